package com.libragraph.relay.core.worker;

import com.libragraph.relay.core.backend.BackendClient;
import com.libragraph.relay.core.backend.ExecutionRecord;
import com.libragraph.relay.core.job.JobFailure;
import com.libragraph.relay.core.output.OutputResolver;
import com.libragraph.relay.core.workflow.JobParameters;
import com.libragraph.relay.core.workflow.WorkflowCatalog;
import com.libragraph.relay.core.workflow.WorkflowRequest;
import com.libragraph.relay.core.workflow.WorkflowTemplater;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.nio.file.Path;

/**
 * Runs one dispatched job end to end: template, submit, poll, resolve.
 * The backend execution id lives only in this call's frame.
 */
@ApplicationScoped
public class JobProcessor {

    private static final Logger log = Logger.getLogger(JobProcessor.class);

    private static final int PROMPT_LOG_LENGTH = 50;

    @Inject
    WorkflowCatalog workflowCatalog;

    @Inject
    WorkflowTemplater templater;

    @Inject
    BackendClient backendClient;

    @Inject
    OutputResolver outputResolver;

    /**
     * @return path of the produced artifact
     * @throws RuntimeException classified by {@link JobFailure} where the cause is known
     */
    public Path process(DispatchedJob job) throws InterruptedException {
        log.infof("Processing job %s: input=%s, prompt='%s'",
                job.jobId(), job.inputImagePath(), abbreviate(job.prompt()));

        JobParameters params = new JobParameters(job.jobId(), job.inputImagePath(), job.prompt(),
                job.negativePrompt(), templater.resolveSeed(job.seed()));
        WorkflowRequest request = templater.render(
                workflowCatalog.template(), workflowCatalog.mapping(), params);

        ExecutionRecord record = backendClient.execute(request);
        Path output = outputResolver.resolve(record);
        log.infof("Job %s produced output: %s", job.jobId(), output);
        return output;
    }

    /** Human-readable failure text stored as the job's error message. */
    public static String describeFailure(Throwable t) {
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getName();
        if (t instanceof JobFailure failure) {
            return failure.kind() + ": " + message;
        }
        return t.getClass().getSimpleName() + ": " + message;
    }

    private static String abbreviate(String prompt) {
        if (prompt == null) return "";
        return prompt.length() <= PROMPT_LOG_LENGTH ? prompt : prompt.substring(0, PROMPT_LOG_LENGTH) + "...";
    }
}
