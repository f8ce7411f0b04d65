package io.cronhttp.http;

import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide resources of the HTTP job type: one {@link OkHttpClient} whose dispatcher enforces the
 * in-flight request cap. Every {@link HttpJobRunner} gets the same instance.
 */
public final class HttpRunnerShared implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HttpRunnerShared.class);

    private final OkHttpClient client;

    private HttpRunnerShared(OkHttpClient client) {
        this.client = client;
    }

    /**
     * Builds the shared client. Call once at startup.
     */
    public static HttpRunnerShared loadShared(HttpRunnerSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");

        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(settings.maxOpenRequests());
        // fan-out targets a single host, so the per-host limit is the global one
        dispatcher.setMaxRequestsPerHost(settings.maxOpenRequests());

        OkHttpClient client = new OkHttpClient.Builder()
                .dispatcher(dispatcher)
                .connectionPool(new ConnectionPool(settings.maxIdleConnections(), 5, TimeUnit.MINUTES))
                .connectTimeout(settings.connectTimeout())
                .readTimeout(settings.readTimeout())
                .callTimeout(settings.callTimeout())
                .retryOnConnectionFailure(false)
                .build();

        log.info("HTTP runner client ready with maxOpenRequests={}, connectTimeout={}, readTimeout={}",
                settings.maxOpenRequests(), settings.connectTimeout(), settings.readTimeout());
        return new HttpRunnerShared(client);
    }

    public OkHttpClient client() {
        return client;
    }

    public int runningRequests() {
        return client.dispatcher().runningCallsCount();
    }

    public int queuedRequests() {
        return client.dispatcher().queuedCallsCount();
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
