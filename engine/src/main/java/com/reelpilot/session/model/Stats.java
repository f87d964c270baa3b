package com.reelpilot.session.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-run accumulator. Counters only grow; the completion reason is written once.
 */
public class Stats {
    private final Map<StatsCounter, AtomicLong> counters = new EnumMap<>(StatsCounter.class);
    private final AtomicReference<CompletionReason> completionReason = new AtomicReference<>();
    private final Instant startedAt;
    private volatile Instant finishedAt;
    private volatile String errorSummary;

    public Stats() {
        this(Instant.now());
    }

    public Stats(Instant startedAt) {
        this.startedAt = startedAt;
        for (StatsCounter counter : StatsCounter.values()) {
            counters.put(counter, new AtomicLong());
        }
    }

    public long increment(StatsCounter counter) {
        return counters.get(counter).incrementAndGet();
    }

    public long get(StatsCounter counter) {
        return counters.get(counter).get();
    }

    /**
     * @return true when this call set the reason, false when one was already recorded
     */
    public boolean complete(CompletionReason reason) {
        boolean set = completionReason.compareAndSet(null, reason);
        if (set) {
            finishedAt = Instant.now();
        }
        return set;
    }

    public CompletionReason completionReason() {
        return completionReason.get();
    }

    public boolean isCompleted() {
        return completionReason.get() != null;
    }

    public void setErrorSummary(String errorSummary) {
        this.errorSummary = errorSummary;
    }

    public String errorSummary() {
        return errorSummary;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (StatsCounter counter : StatsCounter.values()) {
            out.put(counter.key(), counters.get(counter).get());
        }
        CompletionReason reason = completionReason.get();
        out.put("completion_reason", reason == null ? null : reason.code());
        out.put("started_at", startedAt == null ? null : startedAt.toString());
        out.put("finished_at", finishedAt == null ? null : finishedAt.toString());
        if (errorSummary != null) {
            out.put("error_summary", errorSummary);
        }
        return out;
    }
}
