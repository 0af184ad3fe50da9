package com.libragraph.relay.api;

import com.libragraph.relay.core.job.JobStore;
import com.libragraph.relay.types.JobStatus;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Path("/health")
@Produces(MediaType.APPLICATION_JSON)
public class HealthResource {

    @Inject
    JobStore jobStore;

    @GET
    public Map<String, Object> health() {
        Map<JobStatus, Long> counts = jobStore.countByStatus();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", Instant.now());
        body.put("jobs_count", counts.values().stream().mapToLong(Long::longValue).sum());
        for (JobStatus status : JobStatus.values()) {
            body.put(status.label(), counts.get(status));
        }
        return body;
    }
}
