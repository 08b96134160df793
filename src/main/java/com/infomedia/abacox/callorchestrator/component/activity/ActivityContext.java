package com.infomedia.abacox.callorchestrator.component.activity;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * Per-attempt context visible to an activity body on its pool thread.
 */
@Log4j2
public class ActivityContext {

    private static final ThreadLocal<ActivityContext> CURRENT = new ThreadLocal<>();

    @Getter
    private final String activityName;
    @Getter
    private final int attempt;
    private volatile long lastHeartbeatNanos;
    private volatile Object lastHeartbeatDetails;

    ActivityContext(String activityName, int attempt) {
        this.activityName = activityName;
        this.attempt = attempt;
        this.lastHeartbeatNanos = System.nanoTime();
    }

    /**
     * Records liveness of the running activity. A no-op outside an activity thread.
     */
    public static void heartbeat(Object details) {
        ActivityContext context = CURRENT.get();
        if (context == null) {
            return;
        }
        context.lastHeartbeatNanos = System.nanoTime();
        context.lastHeartbeatDetails = details;
        log.trace("Heartbeat from {} (attempt {}): {}", context.activityName, context.attempt, details);
    }

    public static ActivityContext current() {
        return CURRENT.get();
    }

    public Object getLastHeartbeatDetails() {
        return lastHeartbeatDetails;
    }

    long nanosSinceHeartbeat() {
        return System.nanoTime() - lastHeartbeatNanos;
    }

    static void set(ActivityContext context) {
        CURRENT.set(context);
    }

    static void clear() {
        CURRENT.remove();
    }
}
