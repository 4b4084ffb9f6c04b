package io.jobs4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobs4j.DeadLetterSink;
import io.jobs4j.JobEnqueuer;
import io.jobs4j.JobQueue;
import io.jobs4j.JobScheduler;
import io.jobs4j.JobWorker;
import io.jobs4j.core.JobRegistration;
import io.jobs4j.internal.mongo.MongoDeadLetterSink;
import io.jobs4j.internal.mongo.MongoJobQueue;
import io.jobs4j.utils.WorkerIds;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Spring Boot auto-configuration entrypoint for the job queue, scheduler and worker.
 *
 * <p>Every {@link JobRegistration} bean in the context is registered with the scheduler.
 */
@AutoConfiguration
@ConditionalOnClass({JobWorker.class, MongoTemplate.class})
@EnableConfigurationProperties(JobsProperties.class)
@ConditionalOnProperty(prefix = "jobs", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobsAutoConfiguration {
    private final String workerId;

    public JobsAutoConfiguration(JobsProperties props) {
        this.workerId = WorkerIds.resolve(props.getWorkerId());
    }

    @Bean
    @ConditionalOnMissingBean
    protected JobsMongoIndexConfig jobsMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new JobsMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(JobsProperties props, ObjectMapper objectMapper, ObjectProvider<JobRegistration<?>> registrations) {
        JobScheduler scheduler = new JobScheduler(objectMapper, props.getHandlerThreads());
        registrations.orderedStream().forEach(scheduler::register);
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean(JobQueue.class)
    public MongoJobQueue jobQueue(MongoTemplate mongoTemplate, JobsProperties props) {
        return new MongoJobQueue(mongoTemplate, props.getLeaseLifetime(), workerId);
    }

    @Bean
    @ConditionalOnMissingBean(DeadLetterSink.class)
    public MongoDeadLetterSink deadLetterSink(MongoTemplate mongoTemplate) {
        return new MongoDeadLetterSink(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobEnqueuer jobEnqueuer(JobScheduler scheduler, JobQueue queue, ObjectMapper objectMapper) {
        return new JobEnqueuer(scheduler, queue, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobWorker jobWorker(JobsProperties props, JobQueue queue, JobScheduler scheduler, DeadLetterSink deadLetterSink) {
        JobWorker.Builder builder = JobWorker.builder();
        if (queue instanceof MongoJobQueue) {
            builder.leaseRenewalInterval(props.leaseRenewalInterval());
        }
        return builder
                .queue(queue)
                .scheduler(scheduler)
                .deadLetterSink(deadLetterSink)
                .defaultRetryPolicy(props.defaultRetryPolicy())
                .pollInterval(props.getPollInterval())
                .jobsPerTick(props.getJobsPerTick())
                .shutdownTimeout(props.getShutdownTimeout())
                .workerId(workerId)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobsLifecycle jobsLifecycle(JobWorker worker, JobsProperties props) {
        return new JobsLifecycle(worker, props.isStartWorker());
    }

    @Bean
    @ConditionalOnProperty(prefix = "jobs", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton jobsIndexesInitializer(JobsMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
