package com.libragraph.relay.core.backend;

import com.libragraph.relay.types.OutputKind;

import java.util.Objects;

/**
 * One file listed in an execution's output manifest.
 *
 * @param subfolder path below the backend's output root, empty for the root itself
 */
public record OutputEntry(String nodeId, String filename, String subfolder, OutputKind kind) {

    public OutputEntry {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(kind, "kind");
        subfolder = subfolder == null ? "" : subfolder;
    }
}
