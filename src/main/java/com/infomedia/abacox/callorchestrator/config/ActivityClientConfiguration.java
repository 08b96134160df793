package com.infomedia.abacox.callorchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infomedia.abacox.callorchestrator.component.callactivities.ActivityServiceClient;
import com.infomedia.abacox.callorchestrator.component.callactivities.CallActivities;
import com.infomedia.abacox.callorchestrator.component.callactivities.HttpCallActivities;
import com.infomedia.abacox.callorchestrator.component.easyhttp.EasyHttpClient;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ResourceUtils;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.time.Duration;

/**
 * HTTP client for the activity service, with optional mutual TLS from PKCS12 stores.
 */
@Configuration
@Log4j2
public class ActivityClientConfiguration {

    @Value("${activities.base-url}")
    private String baseUrl;

    @Value("${activities.api-key:}")
    private String apiKey;

    @Value("${activities.connect-timeout:10s}")
    private Duration connectTimeout;

    @Value("${activities.heartbeat-timeout:30s}")
    private Duration heartbeatTimeout;

    @Value("${activities.start-to-close-timeout:5m}")
    private Duration startToCloseTimeout;

    @Value("${worker.max-concurrent-activities:50}")
    private int maxConcurrentActivities;

    @Value("${activities.http-logging:NONE}")
    private EasyHttpClient.LoggingLevel loggingLevel;

    @Value("${activities.tls.enabled:false}")
    private boolean tlsEnabled;

    @Value("${activities.tls.key-store:}")
    private String keyStore;

    @Value("${activities.tls.key-store-password:}")
    private String keyStorePassword;

    @Value("${activities.tls.trust-store:}")
    private String trustStore;

    @Value("${activities.tls.trust-store-password:}")
    private String trustStorePassword;

    @Bean
    public EasyHttpClient activityHttpClient(ObjectMapper objectMapper) {
        // A request must not outlive the activity attempt that issued it
        EasyHttpClient.Builder builder = EasyHttpClient.builder()
                .connectTimeout(connectTimeout)
                .readTimeout(startToCloseTimeout)
                .callTimeout(startToCloseTimeout)
                .maxConcurrentRequests(maxConcurrentActivities)
                .loggingLevel(loggingLevel)
                .objectMapper(objectMapper);
        if (tlsEnabled) {
            configureTls(builder);
        }
        return builder.build();
    }

    @Bean
    public ActivityServiceClient activityServiceClient(EasyHttpClient activityHttpClient) {
        log.info("Activity service at {}", baseUrl);
        return new ActivityServiceClient(activityHttpClient, baseUrl, apiKey, heartbeatTimeout.dividedBy(3));
    }

    @Bean
    public CallActivities callActivities(ActivityServiceClient activityServiceClient) {
        return new HttpCallActivities(activityServiceClient);
    }

    private void configureTls(EasyHttpClient.Builder builder) {
        try {
            TrustManagerFactory trustManagerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagerFactory.init(trustStore.isBlank() ? null : loadStore(trustStore, trustStorePassword));
            X509TrustManager trustManager = null;
            for (TrustManager manager : trustManagerFactory.getTrustManagers()) {
                if (manager instanceof X509TrustManager x509) {
                    trustManager = x509;
                    break;
                }
            }
            if (trustManager == null) {
                throw new IllegalStateException("No X509 trust manager available");
            }

            KeyManagerFactory keyManagerFactory = null;
            if (!keyStore.isBlank()) {
                keyManagerFactory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
                keyManagerFactory.init(loadStore(keyStore, keyStorePassword), keyStorePassword.toCharArray());
            }

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(keyManagerFactory == null ? null : keyManagerFactory.getKeyManagers(),
                    new TrustManager[]{trustManager}, null);
            builder.tls(sslContext.getSocketFactory(), trustManager);
            log.info("Mutual TLS enabled for the activity service (client certificate: {})", !keyStore.isBlank());
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalStateException("Could not set up TLS for the activity service", e);
        }
    }

    private static KeyStore loadStore(String location, String password) throws GeneralSecurityException, IOException {
        KeyStore store = KeyStore.getInstance("PKCS12");
        try (InputStream in = ResourceUtils.getURL(location).openStream()) {
            store.load(in, password.toCharArray());
        }
        return store;
    }
}
