package com.infomedia.abacox.callorchestrator.multitenancy;

import org.slf4j.MDC;

/**
 * Tenant and call identifiers of the work running on the current thread, mirrored into the
 * logging MDC.
 */
public class TenantContext {
    private static final ThreadLocal<String> CURRENT_TENANT = new ThreadLocal<>();
    private static final ThreadLocal<String> CURRENT_CALL = new ThreadLocal<>();

    // Matches %X{tenant} and %X{callId} in log4j2-spring.xml
    private static final String TENANT_MDC_KEY = "tenant";
    private static final String CALL_MDC_KEY = "callId";

    public static void setTenant(String tenant) {
        CURRENT_TENANT.set(tenant);
        putOrRemove(TENANT_MDC_KEY, tenant);
    }

    public static String getTenant() {
        return CURRENT_TENANT.get();
    }

    public static void setCallId(String callId) {
        CURRENT_CALL.set(callId);
        putOrRemove(CALL_MDC_KEY, callId);
    }

    public static String getCallId() {
        return CURRENT_CALL.get();
    }

    public static void set(String tenant, String callId) {
        setTenant(tenant);
        setCallId(callId);
    }

    public static void clear() {
        CURRENT_TENANT.remove();
        CURRENT_CALL.remove();
        MDC.remove(TENANT_MDC_KEY);
        MDC.remove(CALL_MDC_KEY);
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
