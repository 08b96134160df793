package com.infomedia.abacox.callorchestrator.component.easyhttp;

import lombok.Getter;

/**
 * Failure of an {@link EasyHttp} call. {@code statusCode} is -1 when no HTTP response was
 * received: connection errors, cancellation, unreadable bodies.
 */
@Getter
public class EasyHttpException extends RuntimeException {
    private final int statusCode;
    private final String responseBody;

    public EasyHttpException(String reason, int statusCode, String responseBody) {
        super(String.format("HTTP %d %s: %s", statusCode, reason, responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public EasyHttpException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.responseBody = null;
    }

    public boolean isHttpError() {
        return statusCode > 0;
    }
}
