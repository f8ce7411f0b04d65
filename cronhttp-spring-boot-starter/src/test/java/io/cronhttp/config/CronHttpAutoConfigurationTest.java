package io.cronhttp.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.cronhttp.JobScheduler;
import io.cronhttp.core.Job;
import io.cronhttp.core.JobDefinition;
import io.cronhttp.core.JobRun;
import io.cronhttp.core.JobRunnerRegistry;
import io.cronhttp.core.JobStore;
import io.cronhttp.core.PersistenceGateway;
import io.cronhttp.core.RunnerContext;
import io.cronhttp.http.HttpJobRunner;
import io.cronhttp.http.HttpRunnerShared;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

class CronHttpAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CronHttpAutoConfiguration.class))
            .withPropertyValues(
                    "cronhttp.database-url=jdbc:sqlite::memory:",
                    "cronhttp.zone=UTC",
                    "cronhttp.http.max-open-requests=16",
                    "cronhttp.http.read-timeout=5s"
            );

    @Test
    void shouldAutoConfigureSchedulerBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(JobScheduler.class);
            assertThat(context).hasSingleBean(CronHttpLifecycle.class);
            assertThat(context).hasSingleBean(CronHttpProperties.class);
            assertThat(context).hasSingleBean(PersistenceGateway.class);
            assertThat(context).hasSingleBean(HttpRunnerShared.class);

            CronHttpProperties props = context.getBean(CronHttpProperties.class);
            assertThat(props.getHttp().getMaxOpenRequests()).isEqualTo(16);
            assertThat(context.getBean(HttpRunnerShared.class).client().dispatcher().getMaxRequests()).isEqualTo(16);

            assertThat(context.getBean(JobRunnerRegistry.class).find(HttpJobRunner.TYPE_ID)).isPresent();
            assertThat(context.getBean(JobScheduler.class).isRunning()).isTrue();
        });
    }

    @Test
    void lifecycleShouldCreateSchemaBeforeStarting() {
        contextRunner.run(context -> {
            List<Map<String, Object>> tables = context.getBean(PersistenceGateway.class)
                    .execute("SELECT name FROM sqlite_master WHERE type = 'table' AND name = 'job'")
                    .join();
            assertThat(tables).hasSize(1);
            assertThat(context.getBean(JobStore.class).findTypeId("http").join()).contains(1);
        });
    }

    @Test
    void applicationJacksonSettingsShouldBeKept() {
        contextRunner
                .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
                .withPropertyValues("spring.jackson.serialization.indent-output=true")
                .run(context -> {
                    assertThat(context).hasSingleBean(ObjectMapper.class);
                    ObjectMapper om = context.getBean(ObjectMapper.class);
                    assertThat(om.isEnabled(SerializationFeature.INDENT_OUTPUT)).isTrue();
                    assertThat(context.getBean(RunnerContext.class).objectMapper()).isSameAs(om);
                });
    }

    @Test
    void fallbackObjectMapperShouldBeCreatedWithoutJackson() {
        contextRunner.run(context -> assertThat(context).hasSingleBean(ObjectMapper.class));
    }

    @Test
    void disabledPropertyShouldSkipConfiguration() {
        contextRunner
                .withPropertyValues("cronhttp.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(JobScheduler.class);
                    assertThat(context).doesNotHaveBean(CronHttpLifecycle.class);
                });
    }

    @Test
    void registeredHttpJobShouldCallEndpointAndRecordResult() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(202).setBody("accepted"));
            server.start();

            contextRunner.run(context -> {
                JobScheduler scheduler = context.getBean(JobScheduler.class);
                JobStore store = context.getBean(JobStore.class);
                String data = "{\"url\":\"" + server.url("/ping") + "\",\"verb\":\"GET\",\"number_of_clones\":1}";

                Job job = scheduler.register(new JobDefinition(1L, "ping-once", "http", data, "once @ 1000.0"))
                        .get(5, TimeUnit.SECONDS);

                RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
                assertThat(request).isNotNull();
                assertThat(request.getPath()).isEqualTo("/ping");

                boolean done = waitUntil(5, TimeUnit.SECONDS,
                        () -> store.findByUserAndName(1L, "ping-once").join().map(Job::isDone).orElse(false));
                assertThat(done).isTrue();

                List<JobRun> runs = store.findRecentRuns(job.getId(), 25).join();
                assertThat(runs).hasSize(1);
                assertThat(runs.get(0).result()).contains("\"code\":202").contains("accepted");
            });
        }
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(100);
        }
        return false;
    }
}
