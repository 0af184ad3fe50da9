package com.libragraph.relay.api;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.Map;

/** Builds the {@code {"detail": ...}} error bodies the control plane answers with. */
final class ApiErrors {

    private ApiErrors() {
    }

    static Response response(Response.Status status, String detail) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("detail", detail))
                .build();
    }

    static WebApplicationException badRequest(String detail) {
        return new WebApplicationException(response(Response.Status.BAD_REQUEST, detail));
    }

    static WebApplicationException notFound(String detail) {
        return new WebApplicationException(response(Response.Status.NOT_FOUND, detail));
    }
}
