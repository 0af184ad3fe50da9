package com.libragraph.relay.core.output;

import com.libragraph.relay.types.OutputKind;

import java.nio.file.Path;

/** A manifest entry whose file exists. */
public record ResolvedOutput(String nodeId, OutputKind kind, Path path) {
}
