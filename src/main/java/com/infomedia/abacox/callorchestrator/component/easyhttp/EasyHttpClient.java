package com.infomedia.abacox.callorchestrator.component.easyhttp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.logging.HttpLoggingInterceptor;

import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.X509TrustManager;
import java.time.Duration;

/**
 * Shared OkHttp client and JSON mapper for calls to one backend. Requests start with
 * {@link #url(String)}.
 */
@Log4j2
@Getter
public class EasyHttpClient {

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    private EasyHttpClient(OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
    }

    public EasyHttp url(String url) {
        return new EasyHttp(url, this);
    }

    public static Builder builder() {
        return new Builder();
    }

    public enum LoggingLevel {
        NONE, BASIC, HEADERS, BODY
    }

    public static class Builder {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private Duration callTimeout = Duration.ZERO;
        private int maxConcurrentRequests = 64;
        private LoggingLevel loggingLevel = LoggingLevel.NONE;
        private SSLSocketFactory socketFactory;
        private X509TrustManager trustManager;
        private ObjectMapper mapper;

        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        public Builder readTimeout(Duration timeout) {
            this.readTimeout = timeout;
            return this;
        }

        /**
         * Upper bound for a whole call, including redirects and body transfer. Zero means none.
         */
        public Builder callTimeout(Duration timeout) {
            this.callTimeout = timeout;
            return this;
        }

        /**
         * Requests in flight at once, per host as well as in total. Calls beyond it queue in
         * OkHttp's dispatcher.
         */
        public Builder maxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = maxConcurrentRequests;
            return this;
        }

        public Builder tls(SSLSocketFactory socketFactory, X509TrustManager trustManager) {
            this.socketFactory = socketFactory;
            this.trustManager = trustManager;
            return this;
        }

        public Builder loggingLevel(LoggingLevel level) {
            this.loggingLevel = level;
            return this;
        }

        /**
         * Uses a copy of the given mapper so the caller's configuration stays untouched.
         */
        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = mapper.copy();
            return this;
        }

        public EasyHttpClient build() {
            Dispatcher dispatcher = new Dispatcher();
            dispatcher.setMaxRequests(maxConcurrentRequests);
            dispatcher.setMaxRequestsPerHost(maxConcurrentRequests);

            HttpLoggingInterceptor logging = new HttpLoggingInterceptor(message -> log.debug(message));
            logging.setLevel(switch (loggingLevel) {
                case BASIC -> HttpLoggingInterceptor.Level.BASIC;
                case HEADERS -> HttpLoggingInterceptor.Level.HEADERS;
                case BODY -> HttpLoggingInterceptor.Level.BODY;
                case NONE -> HttpLoggingInterceptor.Level.NONE;
            });
            logging.redactHeader("X-API-Key");

            OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder()
                    .dispatcher(dispatcher)
                    .connectTimeout(connectTimeout)
                    .writeTimeout(readTimeout)
                    .readTimeout(readTimeout)
                    .callTimeout(callTimeout)
                    .addInterceptor(logging);
            if (socketFactory != null) {
                clientBuilder.sslSocketFactory(socketFactory, trustManager);
            }

            ObjectMapper objectMapper = mapper != null ? mapper : new ObjectMapper();
            objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
            objectMapper.findAndRegisterModules();
            objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
            return new EasyHttpClient(clientBuilder.build(), objectMapper);
        }
    }
}
