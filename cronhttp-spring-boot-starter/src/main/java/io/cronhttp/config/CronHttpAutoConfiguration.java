package io.cronhttp.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhttp.JobRunner;
import io.cronhttp.JobScheduler;
import io.cronhttp.core.JobRunnerRegistry;
import io.cronhttp.core.JobStore;
import io.cronhttp.core.PersistenceGateway;
import io.cronhttp.core.RunnerContext;
import io.cronhttp.core.SqlJobStore;
import io.cronhttp.core.WorkQueue;
import io.cronhttp.http.HttpJobRunner;
import io.cronhttp.http.HttpRunnerSettings;
import io.cronhttp.http.HttpRunnerShared;
import io.cronhttp.internal.QueueJobScheduler;
import io.cronhttp.internal.sqlite.SqlitePersistenceGateway;
import io.cronhttp.internal.sqlite.SqliteSchemaInitializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the job scheduler.
 *
 * <p>Runs after Boot's Jackson setup so an application {@link ObjectMapper} is reused; the plain mapper
 * below is only a fallback when none exists.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@ConditionalOnClass({JobScheduler.class, HttpJobRunner.class})
@EnableConfigurationProperties(CronHttpProperties.class)
@ConditionalOnProperty(prefix = "cronhttp", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CronHttpAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public PersistenceGateway persistenceGateway(CronHttpProperties props) {
        return SqlitePersistenceGateway.open(props.getDatabaseUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "cronhttp", name = "initialize-schema", havingValue = "true", matchIfMissing = true)
    public SqliteSchemaInitializer sqliteSchemaInitializer(PersistenceGateway gateway) {
        return new SqliteSchemaInitializer(gateway);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStore jobStore(PersistenceGateway gateway) {
        return new SqlJobStore(gateway);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkQueue workQueue() {
        return new WorkQueue();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public RunnerContext runnerContext(JobStore store, WorkQueue queue, ObjectMapper om) {
        return RunnerContext.create(store, queue, om, Clock.systemUTC());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public HttpRunnerShared httpRunnerShared(CronHttpProperties props) {
        CronHttpProperties.Http http = props.getHttp();
        return HttpRunnerShared.loadShared(new HttpRunnerSettings(
                http.getMaxOpenRequests(),
                http.getConnectTimeout(),
                http.getReadTimeout(),
                http.getCallTimeout(),
                http.getMaxIdleConnections()));
    }

    @Bean
    @ConditionalOnMissingBean
    public HttpJobRunner httpJobRunner(RunnerContext context, HttpRunnerShared shared) {
        return new HttpJobRunner(context, shared);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRunnerRegistry jobRunnerRegistry(ObjectProvider<List<JobRunner>> runnersProvider) {
        List<JobRunner> runners = runnersProvider.getIfAvailable(List::of);
        return new JobRunnerRegistry(runners);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(CronHttpProperties props, JobStore store, WorkQueue queue, JobRunnerRegistry registry) {
        return new QueueJobScheduler(store, queue, registry, ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public CronHttpLifecycle cronHttpLifecycle(JobScheduler scheduler,
                                               ObjectProvider<SqliteSchemaInitializer> schemaInitializer) {
        return new CronHttpLifecycle(scheduler, schemaInitializer.getIfAvailable());
    }
}
