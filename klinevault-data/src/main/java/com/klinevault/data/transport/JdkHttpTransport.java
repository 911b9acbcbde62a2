package com.klinevault.data.transport;

import com.klinevault.core.error.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.ProtocolException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Transport backed by the JDK HttpClient. Always available.
 */
public class JdkHttpTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    public static final String ID = "jdk";

    public static final TransportProvider PROVIDER = new TransportProvider() {
        @Override
        public String id() {
            return ID;
        }

        @Override
        public boolean isAvailable() {
            return true;
        }

        @Override
        public Transport create(TransportSettings settings) {
            return new JdkHttpTransport(settings);
        }
    };

    private final TransportSettings settings;
    private volatile HttpClient client;

    public JdkHttpTransport(TransportSettings settings) {
        this.settings = settings;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public synchronized void open() {
        if (client == null) {
            client = HttpClientFactory.newJdkClient(settings);
        }
    }

    @Override
    public TransportResponse request(TransportRequest request) throws TransportException {
        HttpClient current = client;
        if (current == null) {
            open();
            current = client;
        }
        String url = request.fullUrl();
        Duration timeout = request.timeoutOr(settings.requestTimeout());
        if (timeout.toMillis() <= 0) {
            throw TransportException.timeout("No time left for " + url);
        }
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .method(request.method(), HttpRequest.BodyPublishers.noBody());
            request.headers().forEach(builder::header);
        } catch (IllegalArgumentException e) {
            throw new TransportException(TransportException.Kind.PROTOCOL_ERROR, "Invalid request: " + url, e);
        }

        try {
            HttpResponse<byte[]> response = current.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
            log.debug("{} {} -> {}", request.method(), url, response.statusCode());
            return new TransportResponse(response.statusCode(), response.headers().map(), response.body(), url);
        } catch (HttpTimeoutException e) {
            throw new TransportException(TransportException.Kind.TIMEOUT, "Timed out: " + url, e);
        } catch (ConnectException e) {
            throw new TransportException(TransportException.Kind.CONNECTION_FAILED, "Connection failed: " + url, e);
        } catch (ProtocolException e) {
            throw new TransportException(TransportException.Kind.PROTOCOL_ERROR, "Protocol error: " + url, e);
        } catch (IOException e) {
            throw new TransportException(TransportException.Kind.CONNECTION_FAILED, "I/O error: " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(TransportException.Kind.CONNECTION_FAILED, "Interrupted: " + url, e);
        }
    }

    @Override
    public synchronized void close() {
        // JDK 17 HttpClient has no close(); dropping the reference lets its executor wind down
        client = null;
    }
}
