package com.infomedia.abacox.callorchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infomedia.abacox.callorchestrator.component.activity.ActivityExecutor;
import com.infomedia.abacox.callorchestrator.component.activity.ActivityOptions;
import com.infomedia.abacox.callorchestrator.component.activity.RetryPolicy;
import com.infomedia.abacox.callorchestrator.component.durable.EventSourcedDurableExecutor;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowEventStore;
import com.infomedia.abacox.callorchestrator.component.postcall.PostCallRetryPolicy;
import com.infomedia.abacox.callorchestrator.component.worker.WorkerPools;
import com.infomedia.abacox.callorchestrator.component.worker.WorkerSettings;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@Log4j2
public class WorkerConfiguration {

    @Value("${worker.namespace:default}")
    private String namespace;

    @Value("${worker.task-queue:voice-processing}")
    private String taskQueue;

    @Value("${worker.max-concurrent-workflows:100}")
    private int maxConcurrentWorkflows;

    @Value("${worker.max-concurrent-activities:50}")
    private int maxConcurrentActivities;

    @Value("${worker.max-cached-workflows:100}")
    private int maxCachedWorkflows;

    @Value("${worker.shutdown-grace-period:30s}")
    private Duration shutdownGracePeriod;

    @Value("${activities.start-to-close-timeout:5m}")
    private Duration startToCloseTimeout;

    @Value("${activities.heartbeat-timeout:30s}")
    private Duration heartbeatTimeout;

    @Value("${activities.retry.initial-interval:1s}")
    private Duration initialInterval;

    @Value("${activities.retry.backoff-coefficient:2.0}")
    private double backoffCoefficient;

    @Value("${activities.retry.maximum-interval:30s}")
    private Duration maximumInterval;

    @Value("${activities.retry.maximum-attempts:5}")
    private int maximumAttempts;

    @Value("${postcall.retry-delay:5m}")
    private Duration postCallRetryDelay;

    @Value("${postcall.max-attempts:0}")
    private int postCallMaxAttempts;

    @Value("${postcall.backoff-multiplier:1.0}")
    private double postCallBackoffMultiplier;

    @Value("${postcall.max-delay:6h}")
    private Duration postCallMaxDelay;

    @Bean
    public WorkerSettings workerSettings() {
        int cached = maxCachedWorkflows;
        // A cached workflow holds a workflow thread while it waits for signals
        if (cached > maxConcurrentWorkflows) {
            log.warn("worker.max-cached-workflows ({}) exceeds worker.max-concurrent-workflows ({}); using {}",
                    cached, maxConcurrentWorkflows, maxConcurrentWorkflows);
            cached = maxConcurrentWorkflows;
        }
        return WorkerSettings.builder()
                .namespace(namespace)
                .taskQueue(taskQueue)
                .maxConcurrentWorkflows(maxConcurrentWorkflows)
                .maxConcurrentActivities(maxConcurrentActivities)
                .maxCachedWorkflows(cached)
                .shutdownGracePeriod(shutdownGracePeriod)
                .build();
    }

    @Bean
    public WorkerPools workerPools(WorkerSettings workerSettings) {
        return new WorkerPools(workerSettings);
    }

    @Bean
    public ActivityOptions activityOptions() {
        return ActivityOptions.builder()
                .startToCloseTimeout(startToCloseTimeout)
                .heartbeatTimeout(heartbeatTimeout)
                .retryPolicy(RetryPolicy.builder()
                        .initialInterval(initialInterval)
                        .backoffCoefficient(backoffCoefficient)
                        .maximumInterval(maximumInterval)
                        .maximumAttempts(maximumAttempts)
                        .build())
                .build();
    }

    @Bean
    public ActivityExecutor activityExecutor(WorkerPools workerPools, ActivityOptions activityOptions) {
        return new ActivityExecutor(workerPools.getActivityPool(), activityOptions);
    }

    @Bean
    public EventSourcedDurableExecutor durableExecutor(WorkflowEventStore workflowEventStore, ObjectMapper objectMapper,
                                                       WorkerPools workerPools, WorkerSettings workerSettings) {
        return new EventSourcedDurableExecutor(workflowEventStore, objectMapper, workerPools.getWorkflowPool(),
                workerSettings.getNamespace(), workerSettings.getTaskQueue(), workerSettings.getMaxCachedWorkflows());
    }

    @Bean
    public PostCallRetryPolicy postCallRetryPolicy() {
        return PostCallRetryPolicy.builder()
                .retryDelay(postCallRetryDelay)
                .maxAttempts(postCallMaxAttempts)
                .backoffMultiplier(postCallBackoffMultiplier)
                .maxDelay(postCallMaxDelay)
                .build();
    }
}
