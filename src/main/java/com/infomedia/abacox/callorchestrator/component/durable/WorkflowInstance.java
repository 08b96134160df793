package com.infomedia.abacox.callorchestrator.component.durable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infomedia.abacox.callorchestrator.component.activity.ActivityCall;
import com.infomedia.abacox.callorchestrator.component.activity.ActivityFailureException;
import com.infomedia.abacox.callorchestrator.db.entity.WorkflowEvent;
import com.infomedia.abacox.callorchestrator.db.entity.WorkflowExecution;
import com.infomedia.abacox.callorchestrator.multitenancy.TenantContext;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Actor owning one workflow execution: a task on the workflow pool plus an inbox of signals.
 * <p>
 * The workflow body runs on the actor thread only. Signals are journaled by the delivering
 * thread under {@link #lock} and then queued, so the journal order is the inbox order. On
 * activation the journal is replayed: activity outcomes are answered by ordinal, journaled
 * signals are consumed in order and journaled timeouts end their await at the recorded
 * signal count. The first call that the journal cannot answer switches the instance live.
 */
@Log4j2
class WorkflowInstance<I, R> implements Runnable, WorkflowContext {

    static final Duration RESUME_AFTER_JOURNAL_FAILURE = Duration.ofSeconds(5);
    private static final String TIMEOUT_EVENT_NAME = "await";

    interface Listener {
        void onReleased(WorkflowInstance<?, ?> instance, Instant resumeAt);

        void onClosed(WorkflowInstance<?, ?> instance, WorkflowExecution.Status status);
    }

    @Getter
    private final String workflowId;
    private final WorkflowRegistration<I, R> registration;
    private final WorkflowExecution execution;
    private final WorkflowEventStore store;
    private final ObjectMapper mapper;
    private final Listener listener;
    private final boolean closedAtActivation;

    private final Object lock = new Object();
    private final LinkedBlockingQueue<WorkflowMessage> inbox = new LinkedBlockingQueue<>();
    private final Map<String, SignalHandler<?>> signalHandlers = new ConcurrentHashMap<>();
    private final Map<String, Supplier<?>> queryHandlers = new ConcurrentHashMap<>();
    private final CountDownLatch caughtUp = new CountDownLatch(1);

    // Replay cursors, actor thread only
    private final Map<Integer, WorkflowEvent> journaledActivities = new HashMap<>();
    private final Deque<WorkflowEvent> journaledSignals = new ArrayDeque<>();
    private final Map<Integer, Integer> journaledTimeouts = new HashMap<>();
    private volatile boolean replaying;
    private int activityOrdinal;
    private int awaitIndex;
    private int signalsConsumed;

    // Guarded by lock
    private boolean waiting;
    private int pendingSignals;
    private boolean discarded;
    private boolean finished;
    private boolean journalFailed;

    private volatile Instant currentDeadline;

    WorkflowInstance(WorkflowExecution execution, WorkflowRegistration<I, R> registration, List<WorkflowEvent> history,
                     WorkflowEventStore store, ObjectMapper mapper, Listener listener) {
        this.workflowId = execution.getWorkflowId();
        this.execution = execution;
        this.registration = registration;
        this.store = store;
        this.mapper = mapper;
        this.listener = listener;
        this.closedAtActivation = execution.isClosed();

        for (WorkflowEvent event : history) {
            switch (event.getType()) {
                case SIGNAL_RECEIVED -> journaledSignals.add(event);
                case ACTIVITY_COMPLETED, ACTIVITY_FAILED -> journaledActivities.put(event.getOrdinal(), event);
                case AWAIT_TIMED_OUT -> journaledTimeouts.put(event.getOrdinal(), readSignalsConsumed(event));
            }
        }
        this.replaying = !history.isEmpty() || closedAtActivation;
        if (!history.isEmpty()) {
            log.debug("Workflow {} activated with {} journaled events", workflowId, history.size());
        }
    }

    @Override
    public void run() {
        Instant resumeAt = null;
        boolean released = false;
        try {
            I input = mapper.readValue(execution.getInput(), registration.getInputType());
            R result = registration.getFactory().get().run(this, input);
            catchUp();
            if (!closedAtActivation && !close(WorkflowExecution.Status.COMPLETED, mapper.writeValueAsString(result), null)) {
                released = true;
                resumeAt = Instant.now().plus(RESUME_AFTER_JOURNAL_FAILURE);
            }
        } catch (WorkflowEvictedException e) {
            released = true;
            synchronized (lock) {
                resumeAt = journalFailed ? Instant.now().plus(RESUME_AFTER_JOURNAL_FAILURE) : currentDeadline;
            }
            log.debug("Workflow {} released from the worker", workflowId);
        } catch (NonDeterministicWorkflowException e) {
            log.error("Workflow {} cannot be resumed; execution left RUNNING", workflowId, e);
        } catch (Exception e) {
            log.warn("Workflow {} failed: {}", workflowId, e.getMessage());
            if (!closedAtActivation && !close(WorkflowExecution.Status.FAILED, null, e.getMessage())) {
                released = true;
                resumeAt = Instant.now().plus(RESUME_AFTER_JOURNAL_FAILURE);
            }
        } finally {
            synchronized (lock) {
                finished = true;
                waiting = false;
            }
            caughtUp.countDown();
            // Pool threads are reused; do not leak an interrupt into the next task
            Thread.interrupted();
            TenantContext.clear();
        }
        if (released) {
            listener.onReleased(this, resumeAt);
        }
    }

    private boolean close(WorkflowExecution.Status status, String result, String failure) {
        try {
            store.closeExecution(workflowId, status, result, failure);
        } catch (RuntimeException e) {
            log.error("Could not close workflow {} as {}", workflowId, status, e);
            return false;
        }
        log.info("Workflow {} closed as {}", workflowId, status);
        listener.onClosed(this, status);
        return true;
    }

    // ---- delivery and lifecycle, called from other threads ----

    /**
     * @return false if this instance no longer takes signals; the caller decides whether to retry
     *         on a fresh instance or reject
     */
    boolean deliver(String channel, JsonNode payload) {
        synchronized (lock) {
            if (discarded || finished) {
                return false;
            }
            store.append(workflowId, WorkflowEvent.Type.SIGNAL_RECEIVED, channel, 0, payload.toString());
            pendingSignals++;
            inbox.offer(WorkflowMessage.signal(channel, payload));
            return true;
        }
    }

    /**
     * Marks the instance for release if it holds no in-flight work.
     */
    boolean tryDiscard() {
        synchronized (lock) {
            if (discarded) {
                return true;
            }
            if (finished) {
                discarded = true;
                return true;
            }
            if (waiting && pendingSignals == 0 && inbox.isEmpty()) {
                discarded = true;
                inbox.offer(WorkflowMessage.stop());
                return true;
            }
            return false;
        }
    }

    Object query(String channel, Duration catchUpTimeout) {
        try {
            if (!caughtUp.await(catchUpTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new WorkflowNotReadyException(workflowId, channel);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowNotReadyException(workflowId, channel);
        }
        Supplier<?> handler = queryHandlers.get(channel);
        if (handler == null) {
            throw new WorkflowNotReadyException(workflowId, channel);
        }
        return handler.get();
    }

    boolean isFinished() {
        synchronized (lock) {
            return finished;
        }
    }

    boolean isBusy() {
        synchronized (lock) {
            return !finished && !waiting;
        }
    }

    // ---- WorkflowContext, actor thread only ----

    @Override
    public Instant getStartedAt() {
        return execution.getStartedAt();
    }

    @Override
    public boolean isReplaying() {
        return replaying;
    }

    @Override
    public <P> void onSignal(SignalChannel<P> channel, Consumer<P> handler) {
        if (registration.findSignalChannel(channel.getName()).isEmpty()) {
            throw new UnknownChannelException(registration.getType(), channel.getName());
        }
        signalHandlers.put(channel.getName(), new SignalHandler<>(channel.getPayloadType(), handler));
    }

    @Override
    public <T> void onQuery(QueryChannel<T> channel, Supplier<T> handler) {
        if (registration.findQueryChannel(channel.getName()).isEmpty()) {
            throw new UnknownChannelException(registration.getType(), channel.getName());
        }
        queryHandlers.put(channel.getName(), handler);
    }

    @Override
    public <T> T execute(ActivityCall<T> call) {
        int ordinal = ++activityOrdinal;
        WorkflowEvent journaled = journaledActivities.remove(ordinal);
        if (journaled != null) {
            return replayActivity(call, ordinal, journaled);
        }
        if (closedAtActivation) {
            throw new NonDeterministicWorkflowException(workflowId,
                    "closed execution has no outcome for activity " + call.getName() + " #" + ordinal);
        }
        catchUp();
        checkNotDiscarded();

        T result;
        try {
            result = call.invoke();
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted() || isDiscarded()) {
                throw new WorkflowEvictedException(workflowId);
            }
            ActivityFailureException failure = e instanceof ActivityFailureException afe
                    ? afe : new ActivityFailureException(call.getName(), e, 1, false);
            journal(WorkflowEvent.Type.ACTIVITY_FAILED, call.getName(), ordinal, failurePayload(failure));
            throw failure;
        }
        journal(WorkflowEvent.Type.ACTIVITY_COMPLETED, call.getName(), ordinal, toJson(result));
        return result;
    }

    @Override
    public boolean awaitUntil(Instant deadline, BooleanSupplier condition) {
        int index = ++awaitIndex;

        Integer timedOutAfter = journaledTimeouts.remove(index);
        if (timedOutAfter != null) {
            while (signalsConsumed < timedOutAfter) {
                WorkflowEvent signal = journaledSignals.poll();
                if (signal == null) {
                    throw new NonDeterministicWorkflowException(workflowId, String.format(
                            "await #%d timed out after %d signals but only %d are journaled",
                            index, timedOutAfter, signalsConsumed));
                }
                dispatch(signal.getName(), readTree(signal.getPayload()));
            }
            return false;
        }

        while (true) {
            if (condition.getAsBoolean()) {
                return true;
            }
            WorkflowEvent journaledSignal = journaledSignals.poll();
            if (journaledSignal != null) {
                dispatch(journaledSignal.getName(), readTree(journaledSignal.getPayload()));
                continue;
            }
            if (closedAtActivation) {
                throw new NonDeterministicWorkflowException(workflowId,
                        "closed execution ran past its journal at await #" + index);
            }
            catchUp();
            WorkflowMessage message = nextLiveMessage(deadline, index);
            if (message == null) {
                return false;
            }
            if (message.isStop()) {
                throw new WorkflowEvictedException(workflowId);
            }
            try {
                dispatch(message.channel(), message.payload());
            } finally {
                synchronized (lock) {
                    pendingSignals--;
                }
            }
        }
    }

    private WorkflowMessage nextLiveMessage(Instant deadline, int index) {
        currentDeadline = deadline;
        synchronized (lock) {
            if (discarded) {
                throw new WorkflowEvictedException(workflowId);
            }
            waiting = true;
        }

        WorkflowMessage message;
        try {
            if (deadline == null) {
                message = inbox.take();
            } else {
                long remaining = Duration.between(Instant.now(), deadline).toMillis();
                message = remaining > 0 ? inbox.poll(remaining, TimeUnit.MILLISECONDS) : null;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowEvictedException(workflowId);
        }

        synchronized (lock) {
            waiting = false;
            if (discarded) {
                throw new WorkflowEvictedException(workflowId);
            }
            if (message == null) {
                message = inbox.poll();
            }
            if (message == null) {
                ObjectNode marker = mapper.createObjectNode().put("signalsConsumed", signalsConsumed);
                journal(WorkflowEvent.Type.AWAIT_TIMED_OUT, TIMEOUT_EVENT_NAME, index, marker.toString());
                log.debug("Workflow {} await #{} timed out after {} signals", workflowId, index, signalsConsumed);
            }
            return message;
        }
    }

    private void dispatch(String channel, JsonNode payload) {
        signalsConsumed++;
        SignalHandler<?> handler = signalHandlers.get(channel);
        if (handler == null) {
            log.warn("Workflow {} has no handler for signal '{}'; dropping it", workflowId, channel);
            return;
        }
        try {
            handler.accept(mapper, payload);
        } catch (JsonProcessingException e) {
            log.error("Workflow {} could not read the payload of signal '{}'", workflowId, channel, e);
        } catch (RuntimeException e) {
            log.error("Signal handler '{}' of workflow {} failed", channel, workflowId, e);
        }
    }

    private <T> T replayActivity(ActivityCall<T> call, int ordinal, WorkflowEvent journaled) {
        if (!journaled.getName().equals(call.getName())) {
            throw new NonDeterministicWorkflowException(workflowId, String.format(
                    "activity #%d is %s in the journal but the workflow called %s",
                    ordinal, journaled.getName(), call.getName()));
        }
        if (journaled.getType() == WorkflowEvent.Type.ACTIVITY_FAILED) {
            JsonNode failure = readTree(journaled.getPayload());
            throw new ActivityFailureException(call.getName(),
                    failure.path("failureType").asText(),
                    failure.path("message").asText(),
                    failure.path("attempts").asInt(),
                    failure.path("nonRetryable").asBoolean());
        }
        try {
            return mapper.readValue(journaled.getPayload(), call.getResultType());
        } catch (JsonProcessingException e) {
            throw new NonDeterministicWorkflowException(workflowId,
                    "journaled result of " + call.getName() + " #" + ordinal + " is unreadable: " + e.getMessage());
        }
    }

    private void journal(WorkflowEvent.Type type, String name, int ordinal, String payload) {
        try {
            store.append(workflowId, type, name, ordinal, payload);
        } catch (RuntimeException e) {
            log.error("Could not journal {} {} #{} for workflow {}; releasing the instance", type, name, ordinal,
                    workflowId, e);
            synchronized (lock) {
                journalFailed = true;
                discarded = true;
            }
            throw new WorkflowEvictedException(workflowId);
        }
    }

    private void catchUp() {
        if (replaying) {
            replaying = false;
            log.debug("Workflow {} caught up with its journal", workflowId);
        }
        caughtUp.countDown();
    }

    private void checkNotDiscarded() {
        if (isDiscarded()) {
            throw new WorkflowEvictedException(workflowId);
        }
    }

    private boolean isDiscarded() {
        synchronized (lock) {
            return discarded;
        }
    }

    private String failurePayload(ActivityFailureException failure) {
        ObjectNode node = mapper.createObjectNode();
        node.put("activityName", failure.getActivityName());
        node.put("failureType", failure.getFailureType());
        node.put("message", failure.getMessage());
        node.put("attempts", failure.getAttempts());
        node.put("nonRetryable", failure.isNonRetryable());
        return node.toString();
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Activity result of workflow " + workflowId + " is not serializable", e);
        }
    }

    private JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new NonDeterministicWorkflowException(workflowId, "unreadable journal payload: " + e.getMessage());
        }
    }

    private int readSignalsConsumed(WorkflowEvent event) {
        return readTree(event.getPayload()).path("signalsConsumed").asInt();
    }

    private record SignalHandler<P>(Class<P> payloadType, Consumer<P> consumer) {
        void accept(ObjectMapper mapper, JsonNode payload) throws JsonProcessingException {
            consumer.accept(mapper.treeToValue(payload, payloadType));
        }
    }
}
