package com.klinevault.data.transport;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.net.http.HttpClient;
import java.util.concurrent.TimeUnit;

/**
 * Factory for HTTP clients and the shared JSON mapper.
 *
 * Clients are created per transport so each orchestrator owns its connection pool
 * and can release it on shutdown. The mapper is stateless and shared.
 */
public final class HttpClientFactory {

    private static final ObjectMapper SHARED_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private HttpClientFactory() {
        // Prevent instantiation
    }

    /**
     * New OkHttpClient with its own connection pool.
     * OkHttp's transparent retry is disabled; retries belong to the resilience layer.
     */
    public static OkHttpClient newOkHttpClient(TransportSettings settings) {
        return new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(settings.maxIdleConnections(), 5, TimeUnit.MINUTES))
            .connectTimeout(settings.connectTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .readTimeout(settings.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .writeTimeout(settings.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .retryOnConnectionFailure(false)
            .build();
    }

    /**
     * New JDK HttpClient. Always available, used as the fallback transport.
     */
    public static HttpClient newJdkClient(TransportSettings settings) {
        return HttpClient.newBuilder()
            .connectTimeout(settings.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    /**
     * Get the shared ObjectMapper instance.
     * Configured with JavaTimeModule, ISO instants and lenient unknown property handling.
     */
    public static ObjectMapper getMapper() {
        return SHARED_MAPPER;
    }
}
