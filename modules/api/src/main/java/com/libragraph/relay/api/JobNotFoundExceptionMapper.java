package com.libragraph.relay.api;

import com.libragraph.relay.core.job.JobNotFoundException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class JobNotFoundExceptionMapper implements ExceptionMapper<JobNotFoundException> {

    @Override
    public Response toResponse(JobNotFoundException e) {
        return ApiErrors.response(Response.Status.NOT_FOUND, e.getMessage());
    }
}
