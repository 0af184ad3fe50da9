package com.libragraph.relay.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.relay.types.OutputKind;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * The backend's history entry for one execution.
 *
 * <p>Terminal success means an {@code outputs} section is present and the status
 * is not {@code error}. Manifest entries keep the backend's order: nodes as they
 * appear in the document, and within a node images, then videos, then gifs.
 */
public record ExecutionRecord(
        String executionId,
        String statusStr,
        boolean completed,
        boolean hasOutputs,
        List<OutputEntry> outputs,
        String errorDetail
) {
    static final String STATUS_ERROR = "error";

    public ExecutionRecord {
        outputs = List.copyOf(outputs);
    }

    public boolean isError() {
        return STATUS_ERROR.equals(statusStr);
    }

    public boolean isSuccess() {
        return !isError() && hasOutputs;
    }

    public boolean isTerminal() {
        return isError() || hasOutputs;
    }

    /**
     * Parses one entry of a {@code GET /history/{id}} response.
     */
    public static ExecutionRecord parse(String executionId, JsonNode entry) {
        JsonNode status = entry.path("status");
        String statusStr = status.path("status_str").isTextual() ? status.get("status_str").asText() : null;
        boolean completed = status.path("completed").asBoolean(false);

        JsonNode outputsNode = entry.get("outputs");
        boolean hasOutputs = outputsNode != null && outputsNode.isObject();
        List<OutputEntry> outputs = new ArrayList<>();
        if (hasOutputs) {
            Iterator<Map.Entry<String, JsonNode>> nodes = outputsNode.fields();
            while (nodes.hasNext()) {
                Map.Entry<String, JsonNode> node = nodes.next();
                for (OutputKind kind : OutputKind.values()) {
                    JsonNode files = node.getValue().path(kind.manifestKey());
                    for (JsonNode file : files) {
                        String filename = file.path("filename").asText("");
                        if (filename.isEmpty()) {
                            continue;
                        }
                        outputs.add(new OutputEntry(node.getKey(), filename,
                                file.path("subfolder").asText(""), kind));
                    }
                }
            }
        }

        String errorDetail = STATUS_ERROR.equals(statusStr) ? errorDetail(status.path("messages")) : null;
        return new ExecutionRecord(executionId, statusStr, completed, hasOutputs, outputs, errorDetail);
    }

    /**
     * Messages are {@code [type, data]} pairs. Prefers the {@code execution_error}
     * exception text, then any message types, then a generic fallback.
     */
    private static String errorDetail(JsonNode messages) {
        List<String> types = new ArrayList<>();
        for (JsonNode message : messages) {
            String type = message.path(0).asText("");
            JsonNode data = message.path(1);
            if ("execution_error".equals(type)) {
                String text = data.path("exception_message").asText("").trim();
                String nodeType = data.path("node_type").asText("");
                if (!text.isEmpty()) {
                    return nodeType.isEmpty() ? text : nodeType + ": " + text;
                }
            }
            if (!type.isEmpty()) {
                types.add(type);
            }
        }
        return types.isEmpty() ? "Unknown error" : String.join(", ", types);
    }
}
