package com.reelpilot.session.service;

import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.SessionRunStatus;
import com.reelpilot.session.model.Stats;
import com.reelpilot.session.workflow.Workflow;
import com.reelpilot.session.workflow.WorkflowFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the single workflow that may drive the device at a time.
 */
@Service
public class SessionRunService {
    private static final Logger log = LoggerFactory.getLogger(SessionRunService.class);

    private final WorkflowFactory workflowFactory;
    private final ExecutorService sessionRunExecutor;
    private final AtomicReference<Workflow> active = new AtomicReference<>();
    private volatile Workflow lastFinished;

    public SessionRunService(
        WorkflowFactory workflowFactory,
        @Qualifier("sessionRunExecutor") ExecutorService sessionRunExecutor
    ) {
        this.workflowFactory = workflowFactory;
        this.sessionRunExecutor = sessionRunExecutor;
    }

    public Stats run(RunConfig config) {
        return execute(claim(config));
    }

    public SessionRunStatus startAsync(RunConfig config) {
        Workflow workflow = claim(config);
        sessionRunExecutor.submit(() -> execute(workflow));
        return statusOf(workflow, true);
    }

    public SessionRunStatus stop() {
        Workflow workflow = active.get();
        if (workflow == null) {
            return status();
        }
        log.info("Stop requested for {} workflow", workflow.type());
        workflow.stop();
        return statusOf(workflow, true);
    }

    public SessionRunStatus pause() {
        Workflow workflow = active.get();
        if (workflow != null) {
            workflow.pause();
        }
        return status();
    }

    public SessionRunStatus resume() {
        Workflow workflow = active.get();
        if (workflow != null) {
            workflow.resume();
        }
        return status();
    }

    public SessionRunStatus status() {
        Workflow workflow = active.get();
        if (workflow != null) {
            return statusOf(workflow, true);
        }
        Workflow previous = lastFinished;
        return previous == null ? SessionRunStatus.idle() : statusOf(previous, false);
    }

    private Workflow claim(RunConfig config) {
        Workflow workflow = workflowFactory.create(config);
        if (!active.compareAndSet(null, workflow)) {
            Workflow current = active.get();
            throw new ActiveSessionException("Active session in progress (workflow="
                + (current == null ? "unknown" : current.type())
                + ", sessionId=" + (current == null ? "none" : current.sessionId()) + ")");
        }
        return workflow;
    }

    private Stats execute(Workflow workflow) {
        try {
            return workflow.run();
        } finally {
            lastFinished = workflow;
            active.compareAndSet(workflow, null);
        }
    }

    private static SessionRunStatus statusOf(Workflow workflow, boolean activeRun) {
        Stats stats = workflow.stats();
        return new SessionRunStatus(
            activeRun,
            activeRun && workflow.isPaused(),
            workflow.type().name().toLowerCase(Locale.ROOT),
            workflow.sessionId(),
            stats.completionReason() == null ? null : stats.completionReason().code(),
            stats.toMap()
        );
    }
}
