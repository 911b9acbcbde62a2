package com.klinevault.data.transport;

import com.klinevault.core.error.TransportException;
import okhttp3.Call;
import okhttp3.Headers;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.ProtocolException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Transport backed by OkHttp.
 */
public class OkHttpTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(OkHttpTransport.class);

    public static final String ID = "okhttp";

    public static final TransportProvider PROVIDER = new TransportProvider() {
        @Override
        public String id() {
            return ID;
        }

        @Override
        public boolean isAvailable() {
            try {
                Class.forName("okhttp3.OkHttpClient", false, OkHttpTransport.class.getClassLoader());
                return true;
            } catch (ClassNotFoundException | LinkageError e) {
                return false;
            }
        }

        @Override
        public Transport create(TransportSettings settings) {
            return new OkHttpTransport(settings);
        }
    };

    private final TransportSettings settings;
    private volatile OkHttpClient client;

    public OkHttpTransport(TransportSettings settings) {
        this.settings = settings;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public synchronized void open() {
        if (client == null) {
            client = HttpClientFactory.newOkHttpClient(settings);
        }
    }

    @Override
    public TransportResponse request(TransportRequest request) throws TransportException {
        OkHttpClient current = client;
        if (current == null) {
            open();
            current = client;
        }

        String url = request.fullUrl();
        long timeoutMillis = request.timeoutOr(settings.requestTimeout()).toMillis();
        if (timeoutMillis <= 0) {
            // OkHttp reads a zero timeout as no timeout at all
            throw TransportException.timeout("No time left for " + url);
        }

        Call call;
        try {
            Request.Builder builder = new Request.Builder().url(url).method(request.method(), null);
            request.headers().forEach(builder::header);
            call = current.newCall(builder.build());
        } catch (IllegalArgumentException e) {
            throw new TransportException(TransportException.Kind.PROTOCOL_ERROR, "Invalid request: " + url, e);
        }
        call.timeout().timeout(timeoutMillis, TimeUnit.MILLISECONDS);

        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            byte[] bytes = body != null ? body.bytes() : new byte[0];
            log.debug("{} {} -> {}", request.method(), url, response.code());
            return new TransportResponse(response.code(), toMap(response.headers()), bytes, url);
        } catch (SocketTimeoutException e) {
            throw new TransportException(TransportException.Kind.TIMEOUT, "Timed out: " + url, e);
        } catch (InterruptedIOException e) {
            // OkHttp reports call timeouts as InterruptedIOException("timeout")
            throw new TransportException(TransportException.Kind.TIMEOUT, "Timed out: " + url, e);
        } catch (ConnectException | UnknownHostException e) {
            throw new TransportException(TransportException.Kind.CONNECTION_FAILED, "Connection failed: " + url, e);
        } catch (ProtocolException e) {
            throw new TransportException(TransportException.Kind.PROTOCOL_ERROR, "Protocol error: " + url, e);
        } catch (IOException e) {
            throw new TransportException(TransportException.Kind.CONNECTION_FAILED, "I/O error: " + url, e);
        }
    }

    private static Map<String, List<String>> toMap(Headers headers) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (String name : headers.names()) {
            map.put(name, headers.values(name));
        }
        return map;
    }

    @Override
    public synchronized void close() {
        if (client != null) {
            client.dispatcher().executorService().shutdown();
            client.connectionPool().evictAll();
            client = null;
            log.debug("Closed {} transport", ID);
        }
    }
}
