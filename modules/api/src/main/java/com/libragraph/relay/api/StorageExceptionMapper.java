package com.libragraph.relay.api;

import com.libragraph.relay.core.storage.StorageException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/** Upload write failures are the only 5xx the control plane produces. */
@Provider
public class StorageExceptionMapper implements ExceptionMapper<StorageException> {

    private static final Logger log = Logger.getLogger(StorageExceptionMapper.class);

    @Override
    public Response toResponse(StorageException e) {
        log.errorf(e, "Storage failure: %s", e.getMessage());
        return ApiErrors.response(Response.Status.INTERNAL_SERVER_ERROR, e.getMessage());
    }
}
