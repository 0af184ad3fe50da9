package com.libragraph.relay.api;

import com.libragraph.relay.core.job.Job;
import com.libragraph.relay.core.job.JobStore;
import com.libragraph.relay.core.worker.DispatchedJob;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.Collections;

/**
 * Dispatch endpoint polled by the worker. Does not reserve the job; the worker
 * follows up with {@code POST /jobs/{id}/start}.
 */
@Path("/queue")
@Produces(MediaType.APPLICATION_JSON)
public class QueueResource {

    @Inject
    JobStore jobStore;

    @GET
    @Path("/next")
    public Response next() {
        Object body = jobStore.nextQueued()
                .<Object>map(QueueResource::dispatch)
                .orElse(Collections.singletonMap("job_id", null));
        return Response.ok(body).build();
    }

    static DispatchedJob dispatch(Job job) {
        return new DispatchedJob(job.id(), job.inputPath(), job.prompt(), job.negativePrompt(), job.seed());
    }
}
