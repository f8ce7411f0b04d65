package io.cronhttp.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.cronhttp.core.AbstractJobRunner;
import io.cronhttp.core.Job;
import io.cronhttp.core.JobConfigurationException;
import io.cronhttp.core.RunnerContext;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Runner for jobs of type {@code http}.
 *
 * <p>One run fires {@code number_of_clones} concurrent requests (at least one) and stores one result
 * row per request. With {@code enable_shadows} the run is closed out, and the job rescheduled, as soon
 * as the requests are sent; the requests then finish and record their results on their own, possibly
 * overlapping the next run. Without it the run closes out after every request has settled.
 */
public class HttpJobRunner extends AbstractJobRunner<HttpJobPayload> {
    private static final Logger log = LoggerFactory.getLogger(HttpJobRunner.class);

    public static final int TYPE_ID = 1;
    public static final String TYPE_NAME = "http";

    private static final Set<String> METHODS_WITH_BODY = Set.of("POST", "PUT", "PATCH", "PROPPATCH", "REPORT");
    private static final byte[] EMPTY = new byte[0];

    private final HttpRunnerShared shared;

    public HttpJobRunner(RunnerContext context, HttpRunnerShared shared) {
        super(context);
        this.shared = Objects.requireNonNull(shared, "shared must not be null");
    }

    @Override
    public int typeId() {
        return TYPE_ID;
    }

    @Override
    public String typeName() {
        return TYPE_NAME;
    }

    @Override
    protected Class<HttpJobPayload> payloadClass() {
        return HttpJobPayload.class;
    }

    @Override
    protected void validate(Job job, HttpJobPayload payload) {
        if (payload.url() == null || HttpUrl.parse(payload.url()) == null) {
            throw new JobConfigurationException("Job " + job.describe() + " has an invalid url: " + payload.url());
        }
        if (payload.verb() == null || payload.verb().isBlank()) {
            throw new JobConfigurationException("Job " + job.describe() + " has no verb");
        }
        try {
            newRequest(payload);
        } catch (IllegalArgumentException e) {
            throw new JobConfigurationException("Job " + job.describe() + " has an unusable request: " + e.getMessage(), e);
        }
    }

    @Override
    protected CompletableFuture<Void> execute(Job job, HttpJobPayload payload) {
        Request request = newRequest(payload);
        int clones = payload.clones();
        log.info("Job {} sending {} {} x{} (shadows={})",
                job.describe(), request.method(), request.url(), clones, payload.enableShadows());

        List<CompletableFuture<Void>> fanOut = new ArrayList<>(clones);
        for (int i = 0; i < clones; i++) {
            fanOut.add(send(job, request));
        }
        CompletableFuture<Void> settled = CompletableFuture.allOf(fanOut.toArray(new CompletableFuture[0]));

        if (payload.enableShadows()) {
            settled.whenComplete((v, err) -> log.debug("Shadow requests of job {} settled", job.describe()));
            return CompletableFuture.completedFuture(null);
        }
        return settled;
    }

    private static Request newRequest(HttpJobPayload payload) {
        String method = payload.verb().trim().toUpperCase(Locale.ROOT);
        RequestBody body = METHODS_WITH_BODY.contains(method) ? RequestBody.create(EMPTY, (MediaType) null) : null;
        return new Request.Builder()
                .url(payload.url())
                .method(method, body)
                .build();
    }

    /**
     * Sends one request; completes once its result row is written (or failed to be written).
     */
    private CompletableFuture<Void> send(Job job, Request request) {
        CompletableFuture<RequestOutcome> outcome = new CompletableFuture<>();
        shared.client().newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.warn("Job {} failed to {} {} (ERROR: \"{}\")", job.describe(), request.method(), request.url(), e.toString());
                outcome.complete(RequestOutcome.failure(e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    ResponseBody body = response.body();
                    outcome.complete(RequestOutcome.response(response.code(), body == null ? "" : body.string()));
                } catch (IOException e) {
                    log.warn("Job {} failed to read response of {} {} (ERROR: \"{}\")",
                            job.describe(), request.method(), request.url(), e.toString());
                    outcome.complete(RequestOutcome.failure(e));
                }
            }
        });
        return outcome.thenCompose(o -> record(job, o));
    }

    private CompletableFuture<Void> record(Job job, RequestOutcome outcome) {
        String result;
        try {
            result = context.objectMapper().writeValueAsString(outcome);
        } catch (JsonProcessingException e) {
            log.error("Failed to encode result of job {} msg={}", job.describe(), e.getMessage(), e);
            return CompletableFuture.completedFuture(null);
        }
        return context.store().recordRun(job.getId(), result, context.clock().instant())
                .exceptionally(err -> {
                    log.error("Failed to persist result of job {} msg={}", job.describe(), err.getMessage(), err);
                    return null;
                });
    }
}
