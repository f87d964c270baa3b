package com.reelpilot.session.workflow;

import com.reelpilot.session.model.Stats;
import com.reelpilot.session.model.WorkflowType;

/**
 * Control surface of one run. {@link #run()} never throws and always returns the stats gathered
 * so far; stop/pause/resume are safe to call from other threads.
 */
public interface Workflow {

    Stats run();

    void stop();

    void pause();

    void resume();

    boolean isRunning();

    boolean isPaused();

    Stats stats();

    WorkflowType type();

    Long sessionId();
}
