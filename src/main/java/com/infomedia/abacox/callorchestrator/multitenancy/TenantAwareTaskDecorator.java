package com.infomedia.abacox.callorchestrator.multitenancy;

import org.springframework.core.task.TaskDecorator;
import org.springframework.lang.NonNull;

/**
 * Carries the submitting thread's tenant and call id onto the thread running the task.
 * Whatever context the running thread had before is put back afterwards, so tasks executed
 * inline on a workflow thread leave that thread's context intact.
 */
public class TenantAwareTaskDecorator implements TaskDecorator {

    @Override
    @NonNull
    public Runnable decorate(@NonNull Runnable runnable) {
        String tenantId = TenantContext.getTenant();
        String callId = TenantContext.getCallId();
        return () -> {
            String previousTenant = TenantContext.getTenant();
            String previousCall = TenantContext.getCallId();
            TenantContext.set(tenantId, callId);
            try {
                runnable.run();
            } finally {
                if (previousTenant == null && previousCall == null) {
                    TenantContext.clear();
                } else {
                    TenantContext.set(previousTenant, previousCall);
                }
            }
        };
    }
}
