package com.libragraph.relay.core.output;

import com.libragraph.relay.core.backend.ExecutionRecord;
import com.libragraph.relay.core.backend.OutputEntry;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Locates result files for a finished execution on the filesystem shared with
 * the backend. Each manifest entry is {@code <output-dir>/<subfolder>/<filename>};
 * entries that do not exist, or that would escape the output directory, are
 * logged and skipped.
 */
@ApplicationScoped
public class OutputResolver {

    private static final Logger log = Logger.getLogger(OutputResolver.class);

    @ConfigProperty(name = "relay.backend.output-dir")
    String outputDir;

    public OutputResolver() {
    }

    OutputResolver(Path outputRoot) {
        this.outputDir = outputRoot.toString();
    }

    /**
     * First existing output in manifest order.
     *
     * @throws NoOutputProducedException if no entry resolves
     */
    public Path resolve(ExecutionRecord record) {
        List<ResolvedOutput> found = resolveAll(record);
        if (found.isEmpty()) {
            throw new NoOutputProducedException(record.executionId(), record.outputs().size());
        }
        return found.get(0).path();
    }

    /** Every existing output, in manifest order. */
    public List<ResolvedOutput> resolveAll(ExecutionRecord record) {
        Path root = outputRoot();
        List<ResolvedOutput> found = new ArrayList<>();
        for (OutputEntry entry : record.outputs()) {
            Path candidate;
            try {
                candidate = root.resolve(entry.subfolder()).resolve(entry.filename()).normalize();
            } catch (InvalidPathException e) {
                log.warnf("Output of node %s has an unusable path (%s), ignoring", entry.nodeId(), e.getMessage());
                continue;
            }
            if (!candidate.startsWith(root)) {
                log.warnf("Output %s of node %s escapes %s, ignoring", candidate, entry.nodeId(), root);
                continue;
            }
            if (Files.isRegularFile(candidate)) {
                log.debugf("Found %s output of node %s: %s", entry.kind(), entry.nodeId(), candidate);
                found.add(new ResolvedOutput(entry.nodeId(), entry.kind(), candidate));
            } else {
                log.warnf("Output of node %s not found: %s", entry.nodeId(), candidate);
            }
        }
        return found;
    }

    Path outputRoot() {
        return Path.of(outputDir).toAbsolutePath().normalize();
    }
}
