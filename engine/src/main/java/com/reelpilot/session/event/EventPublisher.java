package com.reelpilot.session.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans events out to listeners. A listener that throws is logged and skipped; the session goes on.
 */
public class EventPublisher {
    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final List<WorkflowEventListener> listeners = new CopyOnWriteArrayList<>();

    public EventPublisher() {
    }

    public EventPublisher(List<? extends WorkflowEventListener> listeners) {
        if (listeners != null) {
            this.listeners.addAll(listeners);
        }
    }

    public void addListener(WorkflowEventListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void stats(Map<String, Object> stats) {
        publish("stats", listener -> listener.onStats(stats));
    }

    public void action(String action, String target, boolean success) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", action);
        payload.put("target", target);
        payload.put("success", success);
        publish("action", listener -> listener.onAction(payload));
    }

    public void pause(int seconds) {
        publish("pause", listener -> listener.onPause(seconds));
    }

    public void video(Map<String, Object> video) {
        publish("video", listener -> listener.onVideo(video));
    }

    private void publish(String event, Consumer<WorkflowEventListener> call) {
        for (WorkflowEventListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Event listener {} failed on {} event", listener.getClass().getSimpleName(), event, e);
            }
        }
    }
}
