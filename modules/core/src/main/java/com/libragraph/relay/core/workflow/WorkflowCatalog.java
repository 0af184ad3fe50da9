package com.libragraph.relay.core.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.relay.core.service.AbstractManagedService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Holds the workflow template and field mapping the worker renders jobs from.
 *
 * <p>Loads {@code relay.workflow.path} (a file path, or {@code classpath:...})
 * when started and checks the configured bindings against it, so a renamed or
 * missing backend node is reported once at startup instead of on every job.
 * A missing required field fails the start; missing optional fields are warnings.
 * Not started eagerly: only processes that run the worker need a template.
 */
@ApplicationScoped
public class WorkflowCatalog extends AbstractManagedService {

    static final String CLASSPATH_PREFIX = "classpath:";

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Config config;

    @ConfigProperty(name = "relay.workflow.path")
    Optional<String> workflowPath;

    private volatile WorkflowTemplate template;
    private volatile FieldMapping mapping;

    @Override
    public String serviceId() {
        return "workflow-catalog";
    }

    @Override
    protected void doStart() {
        String location = workflowPath
                .filter(p -> !p.isBlank())
                .orElseThrow(() -> new WorkflowConfigurationException("relay.workflow.path is not set"));

        WorkflowTemplate loaded = load(objectMapper, location);
        FieldMapping configured = mappingFromConfig();
        for (String warning : validate(loaded, configured)) {
            log.warn(warning);
        }

        template = loaded;
        mapping = configured;
        log.infof("Loaded workflow %s (%d nodes), bindings %s",
                location, loaded.graph().size(), configured.bindings());
    }

    @Override
    protected void doStop() {
        template = null;
        mapping = null;
    }

    /** Throws if the catalog is not RUNNING. */
    public WorkflowTemplate template() {
        requireRunning();
        return template;
    }

    /** Throws if the catalog is not RUNNING. */
    public FieldMapping mapping() {
        requireRunning();
        return mapping;
    }

    FieldMapping mappingFromConfig() {
        FieldMapping.Builder builder = FieldMapping.builder();
        for (WorkflowField field : WorkflowField.values()) {
            Optional<String> nodeId = config.getOptionalValue(
                    "relay.workflow.nodes." + field.configKey(), String.class);
            if (nodeId.isEmpty() || nodeId.get().isBlank()) {
                continue;
            }
            String inputName = config.getOptionalValue(
                            "relay.workflow.inputs." + field.configKey(), String.class)
                    .filter(s -> !s.isBlank())
                    .orElse(field.defaultInputName());
            builder.bind(field, nodeId.get().trim(), inputName);
        }
        return builder.build();
    }

    /**
     * Reads a template from a file path or a {@code classpath:} resource.
     *
     * @throws WorkflowConfigurationException if it is missing, unreadable or not a JSON object
     */
    static WorkflowTemplate load(ObjectMapper objectMapper, String location) {
        try (InputStream in = open(location)) {
            JsonNode root = objectMapper.readTree(in);
            if (root == null || !root.isObject()) {
                throw new WorkflowConfigurationException(
                        "Workflow " + location + " is not a JSON object of nodes");
            }
            return new WorkflowTemplate(location, (ObjectNode) root);
        } catch (NoSuchFileException e) {
            throw new WorkflowConfigurationException("Workflow not found: " + location, e);
        } catch (IOException e) {
            throw new WorkflowConfigurationException("Failed to read workflow " + location, e);
        }
    }

    /**
     * Checks every binding against the template.
     *
     * @return warnings for optional fields that are unbound or point at missing nodes
     * @throws WorkflowConfigurationException for a required field that cannot be injected
     */
    static List<String> validate(WorkflowTemplate template, FieldMapping mapping) {
        List<String> warnings = new ArrayList<>();
        for (WorkflowField field : WorkflowField.values()) {
            Optional<NodeBinding> binding = mapping.binding(field);
            String problem = null;
            if (binding.isEmpty()) {
                problem = field + " is not bound (relay.workflow.nodes." + field.configKey() + ")";
            } else if (!template.hasNode(binding.get().nodeId())) {
                problem = field + " is bound to node " + binding.get().nodeId()
                        + " which " + template.source() + " does not contain";
            } else if (!template.graph().get(binding.get().nodeId()).path("inputs").isObject()) {
                problem = field + " is bound to node " + binding.get().nodeId() + " which has no inputs";
            }
            if (problem == null) {
                continue;
            }
            if (field.required()) {
                throw new WorkflowConfigurationException(problem);
            }
            warnings.add(problem + "; the field will not be injected");
        }
        return warnings;
    }

    private static InputStream open(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new NoSuchFileException(location);
            }
            return in;
        }
        return Files.newInputStream(Path.of(location));
    }

    private void requireRunning() {
        if (!isRunning()) {
            throw new IllegalStateException(
                    "WorkflowCatalog is not running (state=" + state() + ")");
        }
    }
}
