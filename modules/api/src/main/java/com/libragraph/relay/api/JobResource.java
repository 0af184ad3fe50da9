package com.libragraph.relay.api;

import com.libragraph.relay.core.job.InvalidTransitionException;
import com.libragraph.relay.core.job.Job;
import com.libragraph.relay.core.job.JobStore;
import com.libragraph.relay.core.storage.ArtifactStorage;
import com.libragraph.relay.core.storage.StorageException;
import com.libragraph.relay.types.JobStatus;
import com.libragraph.relay.util.MediaTypes;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestForm;
import org.jboss.resteasy.reactive.multipart.FileUpload;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Broker control plane: job submission and inspection for host clients, plus
 * the state-advance calls only the worker makes.
 *
 * <p>Job failures are data ({@code status: error}), never HTTP errors. Illegal
 * state advances answer {@code {"status": "ignored"}} so duplicate worker
 * reports are harmless.
 */
@Path("/jobs")
@Produces(MediaType.APPLICATION_JSON)
public class JobResource {

    private static final Logger log = Logger.getLogger(JobResource.class);

    static final int DEFAULT_LIST_LIMIT = 50;

    @Inject
    JobStore jobStore;

    @Inject
    ArtifactStorage artifactStorage;

    @POST
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    public Map<String, Object> create(
            @RestForm("image") FileUpload image,
            @RestForm("prompt") String prompt,
            @RestForm("negative_prompt") String negativePrompt,
            @RestForm("seed") String seed) {
        if (image == null) {
            throw ApiErrors.badRequest("image file is required");
        }
        Long parsedSeed = parseSeed(seed);

        String id = jobStore.reserveId();
        Job job;
        try {
            java.nio.file.Path input = artifactStorage.saveUpload(id, image.fileName(), image.uploadedFile());
            job = jobStore.create(id, input.toString(), prompt, negativePrompt, parsedSeed);
        } catch (RuntimeException e) {
            jobStore.releaseId(id);
            throw e;
        }
        log.infof("Created job %s with prompt: '%s'", job.id(), job.prompt());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job_id", job.id());
        body.put("status", job.status().label());
        body.put("message", "Job queued for processing");
        return body;
    }

    @GET
    @Path("/{id}")
    public JobView get(@PathParam("id") String id) {
        return JobView.of(jobStore.get(id));
    }

    @GET
    @Path("/{id}/result")
    @Produces(MediaType.WILDCARD)
    public Response result(@PathParam("id") String id) {
        Job job = jobStore.get(id);
        if (job.status() != JobStatus.DONE) {
            throw ApiErrors.badRequest("Job is not complete. Status: " + job.status().label());
        }
        java.nio.file.Path file = artifactStorage.resultFile(job)
                .orElseThrow(() -> ApiErrors.notFound("Result file not found"));

        String fileName = file.getFileName().toString();
        return Response.ok(file.toFile(), MediaTypes.forFileName(fileName))
                .header("Content-Disposition",
                        "attachment; filename=\"result_" + id + MediaTypes.extension(fileName) + "\"")
                .build();
    }

    @DELETE
    @Path("/{id}")
    public Map<String, String> delete(@PathParam("id") String id) {
        Job removed = jobStore.delete(id);
        try {
            artifactStorage.deleteOwnedFiles(removed);
        } catch (StorageException e) {
            log.warnf("Error cleaning up files of job %s: %s", id, e.getMessage());
        }
        log.infof("Job %s deleted (was %s)", id, removed.status().label());
        return Map.of("message", "Job " + id + " deleted");
    }

    @GET
    public Map<String, Object> list(
            @QueryParam("status") String status,
            @QueryParam("limit") @DefaultValue("" + DEFAULT_LIST_LIMIT) int limit) {
        JobStatus filter = null;
        if (status != null && !status.isBlank()) {
            try {
                filter = JobStatus.fromLabel(status.trim());
            } catch (IllegalArgumentException e) {
                throw ApiErrors.badRequest("Unknown status '" + status + "'");
            }
        }
        if (limit < 1) {
            throw ApiErrors.badRequest("limit must be >= 1");
        }

        List<JobView> jobs = jobStore.list(filter, limit).stream().map(JobView::of).toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("total", jobStore.size());
        body.put("returned", jobs.size());
        body.put("jobs", jobs);
        return body;
    }

    // -- Worker-only state advances --

    @POST
    @Path("/{id}/start")
    public Map<String, String> start(@PathParam("id") String id) {
        return advance(id, () -> {
            Job job = jobStore.markRunning(id);
            log.infof("Job %s started processing", id);
            return job;
        });
    }

    @POST
    @Path("/{id}/complete")
    @Consumes({MediaType.APPLICATION_FORM_URLENCODED, MediaType.MULTIPART_FORM_DATA})
    public Map<String, String> complete(@PathParam("id") String id, @RestForm("result_path") String resultPath) {
        if (resultPath == null || resultPath.isBlank()) {
            throw ApiErrors.badRequest("result_path is required");
        }
        return advance(id, () -> {
            Job job = jobStore.markDone(id, resultPath);
            log.infof("Job %s completed in %.2fs", id,
                    job.processingTime().map(d -> d.toMillis() / 1000.0).orElse(0.0));
            return job;
        });
    }

    @POST
    @Path("/{id}/error")
    @Consumes({MediaType.APPLICATION_FORM_URLENCODED, MediaType.MULTIPART_FORM_DATA})
    public Map<String, String> error(@PathParam("id") String id, @RestForm("error_message") String errorMessage) {
        if (errorMessage == null || errorMessage.isBlank()) {
            throw ApiErrors.badRequest("error_message is required");
        }
        return advance(id, () -> {
            Job job = jobStore.markError(id, errorMessage);
            log.errorf("Job %s failed: %s", id, errorMessage);
            return job;
        });
    }

    private Map<String, String> advance(String id, Supplier<Job> transition) {
        try {
            transition.get();
            return Map.of("status", "ok");
        } catch (InvalidTransitionException e) {
            log.warnf("Ignoring state advance for job %s: %s", id, e.getMessage());
            return Map.of("status", "ignored", "detail", e.getMessage());
        }
    }

    private static Long parseSeed(String seed) {
        if (seed == null || seed.isBlank()) {
            return null;
        }
        long value;
        try {
            value = Long.parseLong(seed.trim());
        } catch (NumberFormatException e) {
            throw ApiErrors.badRequest("seed must be an integer, got '" + seed + "'");
        }
        if (value < 0) {
            throw ApiErrors.badRequest("seed must be >= 0");
        }
        return value;
    }
}
