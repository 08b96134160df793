package com.infomedia.abacox.callorchestrator.component.easyhttp;

import com.fasterxml.jackson.core.JsonProcessingException;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One JSON call against a base URL, created through {@link EasyHttpClient#url(String)}.
 * The call runs on OkHttp's dispatcher while the calling thread waits; an interrupt of the
 * waiting thread cancels the call, and an optional tick runs at a fixed interval while the
 * response is outstanding.
 */
public class EasyHttp {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final EasyHttpClient client;
    private final Request.Builder requestBuilder = new Request.Builder();
    private final HttpUrl.Builder urlBuilder;
    private RequestBody requestBody;
    private Duration tickInterval;
    private Runnable tick;

    EasyHttp(String url, EasyHttpClient client) {
        this.client = client;
        HttpUrl parsedUrl = HttpUrl.parse(url);
        if (parsedUrl == null) {
            throw new IllegalArgumentException("Invalid URL: " + url);
        }
        this.urlBuilder = parsedUrl.newBuilder();
    }

    public EasyHttp header(String name, String value) {
        if (value != null && !value.isBlank()) {
            requestBuilder.header(name, value);
        }
        return this;
    }

    public EasyHttp pathSegment(String segment) {
        urlBuilder.addPathSegment(segment);
        return this;
    }

    public EasyHttp json(Object object) {
        try {
            requestBody = RequestBody.create(client.getObjectMapper().writeValueAsString(object), JSON);
            return this;
        } catch (JsonProcessingException e) {
            throw new EasyHttpException("Failed to serialize " + object.getClass().getSimpleName() + " to JSON", e);
        }
    }

    /**
     * Runs {@code tick} on the waiting thread every {@code interval} until the response arrives.
     */
    public EasyHttp whileWaiting(Duration interval, Runnable tick) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Tick interval must be positive: " + interval);
        }
        this.tickInterval = interval;
        this.tick = tick;
        return this;
    }

    public Exchange post() {
        RequestBody body = requestBody != null ? requestBody : RequestBody.create(new byte[0], JSON);
        Request request = requestBuilder.url(urlBuilder.build()).post(body).build();
        return new Exchange(client.getOkHttpClient().newCall(request));
    }

    public class Exchange {
        private final Call call;

        private Exchange(Call call) {
            this.call = call;
        }

        /**
         * @return the response body; non-2xx responses raise {@link EasyHttpException} with the status
         */
        public String asString() {
            CompletableFuture<String> body = new CompletableFuture<>();
            call.enqueue(new Callback() {
                @Override
                public void onResponse(Call c, Response response) {
                    try (response) {
                        ResponseBody responseBody = response.body();
                        String text = responseBody != null ? responseBody.string() : "";
                        if (response.isSuccessful()) {
                            body.complete(text);
                        } else {
                            body.completeExceptionally(new EasyHttpException(response.message(), response.code(), text));
                        }
                    } catch (IOException e) {
                        body.completeExceptionally(new EasyHttpException("Failed to read response of " + c.request().url(), e));
                    }
                }

                @Override
                public void onFailure(Call c, IOException e) {
                    body.completeExceptionally(new EasyHttpException("Network request failed: " + c.request().url(), e));
                }
            });
            return await(body);
        }

        /**
         * @return the mapped body, or null for an empty body
         */
        public <T> T asObject(Class<T> type) {
            String text = asString();
            if (text.isBlank()) {
                return null;
            }
            try {
                return client.getObjectMapper().readValue(text, type);
            } catch (JsonProcessingException e) {
                throw new EasyHttpException("Failed to map JSON response to " + type.getSimpleName(), e);
            }
        }

        private String await(CompletableFuture<String> body) {
            try {
                while (true) {
                    if (tick == null) {
                        return body.get();
                    }
                    try {
                        return body.get(tickInterval.toMillis(), TimeUnit.MILLISECONDS);
                    } catch (TimeoutException e) {
                        tick.run();
                    }
                }
            } catch (InterruptedException e) {
                call.cancel();
                Thread.currentThread().interrupt();
                throw new EasyHttpException("Request cancelled: " + call.request().url(), e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof EasyHttpException httpException) {
                    throw httpException;
                }
                throw new EasyHttpException("Request failed: " + call.request().url(), e.getCause());
            }
        }
    }
}
