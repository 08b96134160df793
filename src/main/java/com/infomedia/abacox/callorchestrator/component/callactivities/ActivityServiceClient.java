package com.infomedia.abacox.callorchestrator.component.callactivities;

import com.infomedia.abacox.callorchestrator.component.activity.ActivityAuthenticationException;
import com.infomedia.abacox.callorchestrator.component.activity.ActivityContext;
import com.infomedia.abacox.callorchestrator.component.activity.ActivityValidationException;
import com.infomedia.abacox.callorchestrator.component.easyhttp.EasyHttp;
import com.infomedia.abacox.callorchestrator.component.easyhttp.EasyHttpClient;
import com.infomedia.abacox.callorchestrator.component.easyhttp.EasyHttpException;
import com.infomedia.abacox.callorchestrator.multitenancy.TenantContext;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.Set;

/**
 * Calls the activity service: {@code POST {baseUrl}/activities/{name}} with the request as
 * JSON body, and maps its error statuses onto the activity failure taxonomy. While a response
 * is outstanding the calling activity heartbeats, so slow backends are bounded by the
 * start-to-close timeout rather than the heartbeat timeout.
 */
@Log4j2
public class ActivityServiceClient {

    private static final Set<Integer> VALIDATION_STATUSES = Set.of(400, 404, 409, 422);
    private static final Set<Integer> AUTHENTICATION_STATUSES = Set.of(401, 403);

    private final EasyHttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final Duration heartbeatInterval;

    public ActivityServiceClient(EasyHttpClient httpClient, String baseUrl, String apiKey) {
        this(httpClient, baseUrl, apiKey, Duration.ofSeconds(5));
    }

    public ActivityServiceClient(EasyHttpClient httpClient, String baseUrl, String apiKey, Duration heartbeatInterval) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.heartbeatInterval = heartbeatInterval;
    }

    public <T> T invoke(String activityName, Object request, Class<T> resultType) {
        return invoke(activityName, request, resultType, null);
    }

    /**
     * String results are returned as the raw response body; {@link Void} discards the body.
     */
    public <T> T invoke(String activityName, Object request, Class<T> resultType, String idempotencyKey) {
        EasyHttp http = httpClient.url(baseUrl)
                .pathSegment("activities")
                .pathSegment(activityName)
                .header("X-API-Key", apiKey)
                .header("Idempotency-Key", idempotencyKey)
                .header("X-Tenant-Id", TenantContext.getTenant())
                .json(request)
                .whileWaiting(heartbeatInterval, () -> ActivityContext.heartbeat("awaiting " + activityName));

        log.debug("Invoking activity {} on {}", activityName, baseUrl);
        try {
            if (resultType == Void.class) {
                http.post().asString();
                return null;
            }
            if (resultType == String.class) {
                return resultType.cast(http.post().asString());
            }
            return http.post().asObject(resultType);
        } catch (EasyHttpException e) {
            throw translate(activityName, e);
        }
    }

    private RuntimeException translate(String activityName, EasyHttpException e) {
        int status = e.getStatusCode();
        if (VALIDATION_STATUSES.contains(status)) {
            return new ActivityValidationException(
                    String.format("Activity %s rejected the request (%d): %s", activityName, status, e.getResponseBody()), e);
        }
        if (AUTHENTICATION_STATUSES.contains(status)) {
            return new ActivityAuthenticationException(
                    String.format("Activity %s refused the credentials (%d)", activityName, status), e);
        }
        return new ActivityServiceException(activityName, status, e.getMessage(), e);
    }
}
