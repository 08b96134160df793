package com.infomedia.abacox.callorchestrator.component.durable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infomedia.abacox.callorchestrator.db.entity.WorkflowEvent;
import com.infomedia.abacox.callorchestrator.db.entity.WorkflowExecution;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link DurableExecutor} backed by a {@link WorkflowEventStore} journal.
 * <p>
 * Each running workflow is a {@link WorkflowInstance} actor on the workflow pool. Instances are
 * kept in an access-ordered cache; once it holds more than {@code maxCachedWorkflows} entries,
 * idle instances are released from the least recently used end and rebuilt from the journal
 * on their next signal, query or pending deadline.
 */
@Log4j2
public class EventSourcedDurableExecutor implements DurableExecutor, WorkflowInstance.Listener {

    private static final int SIGNAL_DELIVERY_ATTEMPTS = 3;
    private static final Duration QUERY_CATCH_UP_TIMEOUT = Duration.ofSeconds(10);
    private static final long RESULT_POLL_MILLIS = 50;

    private final WorkflowEventStore store;
    private final ObjectMapper mapper;
    private final Executor workflowPool;
    private final String namespace;
    private final String taskQueue;
    private final int maxCachedWorkflows;

    private final Map<String, WorkflowRegistration<?, ?>> registrations = new ConcurrentHashMap<>();
    // Guarded by itself
    private final LinkedHashMap<String, WorkflowInstance<?, ?>> cache = new LinkedHashMap<>(16, 0.75f, true);
    private final ScheduledExecutorService timers =
            Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("workflow-timer-"));

    private volatile boolean accepting;

    private final AtomicLong started = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong signals = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public EventSourcedDurableExecutor(WorkflowEventStore store, ObjectMapper mapper, Executor workflowPool,
                                       String namespace, String taskQueue, int maxCachedWorkflows) {
        this.store = store;
        this.mapper = mapper;
        this.workflowPool = workflowPool;
        this.namespace = namespace;
        this.taskQueue = taskQueue;
        this.maxCachedWorkflows = maxCachedWorkflows;
    }

    // ---- host lifecycle ----

    public void startAccepting() {
        accepting = true;
    }

    public void stopAccepting() {
        accepting = false;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public Set<String> getRegisteredTypes() {
        return new TreeSet<>(registrations.keySet());
    }

    /**
     * Activates every RUNNING execution of this namespace and task queue.
     *
     * @return number of executions resumed
     */
    public int recover() {
        List<String> running = store.findRunningWorkflowIds(namespace, taskQueue);
        int resumed = 0;
        for (String workflowId : running) {
            try {
                activate(workflowId);
                resumed++;
            } catch (RuntimeException e) {
                log.error("Could not resume workflow {}", workflowId, e);
            }
        }
        if (!running.isEmpty()) {
            log.info("Resumed {} of {} running workflow(s) in {}/{}", resumed, running.size(), namespace, taskQueue);
        }
        return resumed;
    }

    /**
     * Blocks until no instance is processing work, or the grace period elapses.
     *
     * @return true if the worker went quiet in time
     */
    public boolean awaitQuiescence(Duration gracePeriod) {
        long deadline = System.nanoTime() + gracePeriod.toNanos();
        while (busyCount() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    public void shutdownTimers() {
        timers.shutdownNow();
    }

    public ExecutorStats stats() {
        int cached;
        int running = 0;
        int busy = 0;
        synchronized (cache) {
            cached = cache.size();
            for (WorkflowInstance<?, ?> instance : cache.values()) {
                if (!instance.isFinished()) {
                    running++;
                }
                if (instance.isBusy()) {
                    busy++;
                }
            }
        }
        return new ExecutorStats(cached, running, busy, started.get(), completed.get(), failed.get(),
                signals.get(), evictions.get());
    }

    private int busyCount() {
        synchronized (cache) {
            return (int) cache.values().stream().filter(WorkflowInstance::isBusy).count();
        }
    }

    // ---- DurableExecutor ----

    @Override
    public void register(WorkflowRegistration<?, ?> registration) {
        WorkflowRegistration<?, ?> previous = registrations.putIfAbsent(registration.getType(), registration);
        if (previous != null && previous != registration) {
            throw new IllegalStateException("Workflow type already registered: " + registration.getType());
        }
        log.info("Registered workflow type '{}' on {}/{}", registration.getType(), namespace, taskQueue);
    }

    @Override
    public WorkflowDescription start(String workflowType, String workflowId, Object input) {
        if (!accepting) {
            throw new WorkerNotAcceptingWorkException();
        }
        if (!registrations.containsKey(workflowType)) {
            throw new UnknownWorkflowTypeException(workflowType);
        }
        String inputJson;
        try {
            inputJson = mapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Workflow input is not serializable: " + e.getMessage(), e);
        }

        WorkflowExecution execution = WorkflowExecution.builder()
                .workflowId(workflowId)
                .workflowType(workflowType)
                .namespace(namespace)
                .taskQueue(taskQueue)
                .input(inputJson)
                .startedAt(Instant.now())
                .build();
        store.createExecution(execution);
        started.incrementAndGet();
        log.info("Started workflow {} of type {}", workflowId, workflowType);

        activate(workflowId);
        return describe(workflowId);
    }

    @Override
    public void signal(String workflowId, String channel, Object payload) {
        WorkflowExecution execution = findExecution(workflowId);
        SignalChannel<?> signalChannel = registrationOf(execution).findSignalChannel(channel)
                .orElseThrow(() -> new UnknownChannelException(execution.getWorkflowType(), channel));
        if (execution.isClosed()) {
            throw new SignalRejectedException(workflowId, channel, "workflow is " + execution.getStatus());
        }
        if (!accepting) {
            throw new WorkerNotAcceptingWorkException();
        }

        JsonNode node = mapper.valueToTree(payload);
        try {
            mapper.treeToValue(node, signalChannel.getPayloadType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid payload for signal '" + channel + "': " + e.getMessage(), e);
        }

        for (int attempt = 0; attempt < SIGNAL_DELIVERY_ATTEMPTS; attempt++) {
            WorkflowInstance<?, ?> instance = activate(workflowId);
            if (instance.deliver(channel, node)) {
                signals.incrementAndGet();
                log.debug("Delivered signal '{}' to workflow {}", channel, workflowId);
                return;
            }
            if (isClosed(workflowId)) {
                throw new SignalRejectedException(workflowId, channel, "workflow has completed");
            }
            release(instance);
        }
        throw new SignalRejectedException(workflowId, channel, "workflow is being released by the worker, retry");
    }

    @Override
    public Object query(String workflowId, String channel) {
        WorkflowExecution execution = findExecution(workflowId);
        registrationOf(execution).findQueryChannel(channel)
                .orElseThrow(() -> new UnknownChannelException(execution.getWorkflowType(), channel));
        return activate(workflowId).query(channel, QUERY_CATCH_UP_TIMEOUT);
    }

    @Override
    public <R> Optional<R> awaitResult(String workflowId, Class<R> resultType, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            WorkflowExecution execution = findExecution(workflowId);
            if (execution.getStatus() == WorkflowExecution.Status.FAILED) {
                throw new WorkflowFailedException(workflowId, execution.getFailure());
            }
            if (execution.getStatus() == WorkflowExecution.Status.COMPLETED) {
                try {
                    return Optional.ofNullable(mapper.readValue(execution.getResult(), resultType));
                } catch (JsonProcessingException e) {
                    throw new IllegalStateException("Result of workflow " + workflowId + " is unreadable", e);
                }
            }
            if (System.nanoTime() >= deadline) {
                return Optional.empty();
            }
            try {
                Thread.sleep(RESULT_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    @Override
    public WorkflowDescription describe(String workflowId) {
        WorkflowExecution execution = findExecution(workflowId);
        boolean cached;
        synchronized (cache) {
            cached = cache.containsKey(workflowId);
        }
        return WorkflowDescription.builder()
                .workflowId(execution.getWorkflowId())
                .workflowType(execution.getWorkflowType())
                .namespace(execution.getNamespace())
                .taskQueue(execution.getTaskQueue())
                .status(execution.getStatus())
                .startedAt(execution.getStartedAt())
                .closedAt(execution.getClosedAt())
                .failure(execution.getFailure())
                .cached(cached)
                .build();
    }

    // ---- WorkflowInstance.Listener ----

    @Override
    public void onReleased(WorkflowInstance<?, ?> instance, Instant resumeAt) {
        synchronized (cache) {
            cache.remove(instance.getWorkflowId(), instance);
        }
        if (resumeAt == null || timers.isShutdown()) {
            return;
        }
        long delay = Math.max(0, Duration.between(Instant.now(), resumeAt).toMillis());
        try {
            timers.schedule(() -> resume(instance.getWorkflowId()), delay, TimeUnit.MILLISECONDS);
            log.debug("Workflow {} will be resumed in {} ms", instance.getWorkflowId(), delay);
        } catch (RejectedExecutionException e) {
            log.debug("Timer service stopped; workflow {} will resume on the next recovery", instance.getWorkflowId());
        }
    }

    @Override
    public void onClosed(WorkflowInstance<?, ?> instance, WorkflowExecution.Status status) {
        if (status == WorkflowExecution.Status.COMPLETED) {
            completed.incrementAndGet();
        } else {
            failed.incrementAndGet();
        }
    }

    // ---- activation and cache ----

    private void resume(String workflowId) {
        if (!accepting) {
            return;
        }
        try {
            if (!isClosed(workflowId)) {
                activate(workflowId);
            }
        } catch (RuntimeException e) {
            log.error("Could not resume workflow {}", workflowId, e);
        }
    }

    private WorkflowInstance<?, ?> activate(String workflowId) {
        List<WorkflowInstance<?, ?>> released;
        WorkflowInstance<?, ?> instance;
        synchronized (cache) {
            instance = cache.get(workflowId);
            if (instance != null) {
                return instance;
            }
            WorkflowExecution execution = findExecution(workflowId);
            List<WorkflowEvent> history = store.loadEvents(workflowId);
            instance = newInstance(execution, history);
            cache.put(workflowId, instance);
            try {
                workflowPool.execute(instance);
            } catch (RejectedExecutionException e) {
                cache.remove(workflowId);
                throw new WorkerNotAcceptingWorkException();
            }
            released = evictIdle(workflowId);
        }
        for (WorkflowInstance<?, ?> evicted : released) {
            log.debug("Evicted idle workflow {} from the cache", evicted.getWorkflowId());
        }
        return instance;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private WorkflowInstance<?, ?> newInstance(WorkflowExecution execution, List<WorkflowEvent> history) {
        WorkflowRegistration registration = registrationOf(execution);
        return new WorkflowInstance(execution, registration, history, store, mapper, this);
    }

    // Caller holds the cache lock
    private List<WorkflowInstance<?, ?>> evictIdle(String keep) {
        List<WorkflowInstance<?, ?>> released = new ArrayList<>();
        Iterator<Map.Entry<String, WorkflowInstance<?, ?>>> it = cache.entrySet().iterator();
        while (cache.size() > maxCachedWorkflows && it.hasNext()) {
            Map.Entry<String, WorkflowInstance<?, ?>> entry = it.next();
            if (entry.getKey().equals(keep)) {
                continue;
            }
            if (entry.getValue().tryDiscard()) {
                it.remove();
                released.add(entry.getValue());
                evictions.incrementAndGet();
            }
        }
        return released;
    }

    private void release(WorkflowInstance<?, ?> instance) {
        synchronized (cache) {
            cache.remove(instance.getWorkflowId(), instance);
        }
    }

    private WorkflowExecution findExecution(String workflowId) {
        return store.findExecution(workflowId).orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    private boolean isClosed(String workflowId) {
        return store.findExecution(workflowId).map(WorkflowExecution::isClosed).orElse(true);
    }

    private WorkflowRegistration<?, ?> registrationOf(WorkflowExecution execution) {
        WorkflowRegistration<?, ?> registration = registrations.get(execution.getWorkflowType());
        if (registration == null) {
            throw new UnknownWorkflowTypeException(execution.getWorkflowType());
        }
        return registration;
    }
}
