package io.cronhttp.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhttp.core.Job;
import io.cronhttp.core.JobStore;
import io.cronhttp.core.RunnerContext;
import io.cronhttp.core.WorkQueue;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HttpJobRunnerTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CountDownLatch release = new CountDownLatch(1);

    private MockWebServer server;
    private JobStore store;
    private WorkQueue queue;
    private RunnerContext context;
    private HttpRunnerShared shared;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        store = mock(JobStore.class);
        when(store.updateLastRan(anyLong(), any())).thenReturn(CompletableFuture.completedFuture(null));
        when(store.markDone(anyLong(), any())).thenReturn(CompletableFuture.completedFuture(null));
        when(store.recordRun(anyLong(), anyString(), any())).thenReturn(CompletableFuture.completedFuture(null));

        queue = new WorkQueue();
        context = RunnerContext.create(store, queue, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws IOException {
        release.countDown();
        if (shared != null) {
            shared.close();
        }
        context.close();
        server.shutdown();
    }

    @Test
    void zeroClonesShouldStillSendOneRequest() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));
        HttpJobRunner runner = runner(settings(10, 5));
        Job job = inRotation(job(1L, "GET", 0, false));

        runner.run(job, Duration.ZERO).get(5, TimeUnit.SECONDS);

        assertEquals(1, server.getRequestCount());
        ArgumentCaptor<String> results = ArgumentCaptor.forClass(String.class);
        verify(store, times(1)).recordRun(eq(1L), results.capture(), eq(NOW));
        JsonNode result = objectMapper.readTree(results.getValue());
        assertEquals(200, result.get("code").asInt());
        assertEquals("ok", result.get("body").asText());
        assertFalse(result.has("error"));
    }

    @Test
    void failingClonesShouldNotAffectSiblings() throws Exception {
        AtomicInteger seen = new AtomicInteger();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if (seen.incrementAndGet() <= 3) {
                    return new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AFTER_REQUEST);
                }
                return new MockResponse().setResponseCode(200).setBody("pong");
            }
        });
        HttpJobRunner runner = runner(settings(20, 0));
        Job job = inRotation(job(2L, "GET", 10, false));

        runner.run(job, Duration.ZERO).get(10, TimeUnit.SECONDS);

        ArgumentCaptor<String> results = ArgumentCaptor.forClass(String.class);
        verify(store, times(10)).recordRun(eq(2L), results.capture(), any());
        int failures = 0;
        int successes = 0;
        for (String json : results.getAllValues()) {
            JsonNode result = objectMapper.readTree(json);
            if (result.get("code").asInt() == 0) {
                assertTrue(result.hasNonNull("error"));
                failures++;
            } else {
                assertEquals(200, result.get("code").asInt());
                successes++;
            }
        }
        assertEquals(3, failures);
        assertEquals(7, successes);
        verify(store, times(1)).updateLastRan(2L, NOW);
        assertSame(job, queue.take());
    }

    @Test
    void shadowRunShouldCloseOutBeforeRequestsFinish() throws Exception {
        server.setDispatcher(blockingDispatcher());
        HttpJobRunner runner = runner(settings(10, 5));
        Job job = inRotation(job(3L, "GET", 3, true));

        runner.run(job, Duration.ZERO).get(5, TimeUnit.SECONDS);

        verify(store, times(1)).updateLastRan(3L, NOW);
        assertEquals(1, queue.size());
        verify(store, never()).recordRun(anyLong(), anyString(), any());

        release.countDown();
        verify(store, timeout(5000).times(3)).recordRun(eq(3L), anyString(), any());
    }

    @Test
    void plainRunShouldWaitForEveryClone() throws Exception {
        server.setDispatcher(blockingDispatcher());
        HttpJobRunner runner = runner(settings(10, 5));
        Job job = inRotation(job(4L, "GET", 3, false));

        CompletableFuture<Void> run = runner.run(job, Duration.ZERO);

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> server.getRequestCount() == 3));
        assertFalse(run.isDone());
        verify(store, never()).updateLastRan(anyLong(), any());
        assertEquals(0, queue.size());

        release.countDown();
        run.get(5, TimeUnit.SECONDS);

        verify(store, times(3)).recordRun(eq(4L), anyString(), any());
        verify(store, times(1)).updateLastRan(4L, NOW);
        assertEquals(1, queue.size());
    }

    @Test
    void openRequestsShouldBeCapped() throws Exception {
        server.setDispatcher(blockingDispatcher());
        HttpJobRunner runner = runner(settings(2, 5));
        Job job = inRotation(job(5L, "GET", 5, false));

        CompletableFuture<Void> run = runner.run(job, Duration.ZERO);

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> server.getRequestCount() == 2));
        Thread.sleep(200);
        assertEquals(2, server.getRequestCount());
        assertEquals(2, shared.runningRequests());
        assertEquals(3, shared.queuedRequests());

        release.countDown();
        run.get(10, TimeUnit.SECONDS);

        assertEquals(5, server.getRequestCount());
        verify(store, times(5)).recordRun(eq(5L), anyString(), any());
    }

    @Test
    void postShouldSendEmptyBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201));
        HttpJobRunner runner = runner(settings(10, 5));
        Job job = inRotation(job(6L, "post", 1, false));

        runner.run(job, Duration.ZERO).get(5, TimeUnit.SECONDS);

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertEquals("POST", request.getMethod());
        assertEquals(0, request.getBodySize());
        assertEquals("/hook", request.getPath());
    }

    @Test
    void invalidUrlShouldRetireJob() throws Exception {
        HttpJobRunner runner = runner(settings(10, 5));
        Job job = inRotation(Job.builder()
                .id(7L)
                .userId(1L)
                .name("broken")
                .typeId(HttpJobRunner.TYPE_ID)
                .data("{\"url\":\"not a url\",\"verb\":\"GET\"}")
                .schedule("every minute")
                .dateCreated(NOW)
                .build());

        runner.run(job, Duration.ZERO).get(5, TimeUnit.SECONDS);

        assertEquals(0, server.getRequestCount());
        assertFalse(queue.isInRotation(7L));
        verify(store, never()).updateLastRan(anyLong(), any());
    }

    @Test
    void blankVerbShouldRetireJob() throws Exception {
        HttpJobRunner runner = runner(settings(10, 5));
        Job job = inRotation(job(8L, " ", 1, false));

        runner.run(job, Duration.ZERO).get(5, TimeUnit.SECONDS);

        assertEquals(0, server.getRequestCount());
        assertFalse(queue.isInRotation(8L));
    }

    @Test
    void oneShotJobShouldBeMarkedDone() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        HttpJobRunner runner = runner(settings(10, 5));
        Job job = inRotation(Job.builder()
                .id(9L)
                .userId(1L)
                .name("once")
                .typeId(HttpJobRunner.TYPE_ID)
                .data(payload("GET", 1, false))
                .schedule("once @ 1777636800.0")
                .dateCreated(NOW)
                .build());

        runner.run(job, Duration.ZERO).get(5, TimeUnit.SECONDS);

        assertTrue(job.isDone());
        verify(store, times(1)).recordRun(eq(9L), anyString(), any());
        verify(store, times(1)).markDone(eq(9L), any());
        assertEquals(0, queue.size());
    }

    private HttpJobRunner runner(HttpRunnerSettings settings) {
        shared = HttpRunnerShared.loadShared(settings);
        return new HttpJobRunner(context, shared);
    }

    private Dispatcher blockingDispatcher() {
        return new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) throws InterruptedException {
                release.await(10, TimeUnit.SECONDS);
                return new MockResponse().setResponseCode(200).setBody("late");
            }
        };
    }

    private Job inRotation(Job job) throws InterruptedException {
        queue.submit(job);
        return queue.take();
    }

    private Job job(long id, String verb, int clones, boolean shadows) {
        return Job.builder()
                .id(id)
                .userId(1L)
                .name("job" + id)
                .typeId(HttpJobRunner.TYPE_ID)
                .data(payload(verb, clones, shadows))
                .schedule("every minute")
                .dateCreated(NOW.minusSeconds(3600))
                .build();
    }

    private String payload(String verb, int clones, boolean shadows) {
        return "{\"url\":\"" + server.url("/hook") + "\",\"verb\":\"" + verb + "\","
                + "\"number_of_clones\":" + clones + ",\"enable_shadows\":" + shadows + "}";
    }

    private static HttpRunnerSettings settings(int maxOpenRequests, int maxIdleConnections) {
        return new HttpRunnerSettings(maxOpenRequests, Duration.ofSeconds(5), Duration.ofSeconds(10),
                Duration.ZERO, maxIdleConnections);
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }
}
