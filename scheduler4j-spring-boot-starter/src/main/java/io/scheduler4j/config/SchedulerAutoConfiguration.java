package io.scheduler4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.scheduler4j.ProcessRunner;
import io.scheduler4j.ScriptScheduler;
import io.scheduler4j.core.JobStore;
import io.scheduler4j.internal.DefaultScriptScheduler;
import io.scheduler4j.internal.LocalProcessRunner;
import io.scheduler4j.internal.mongo.MongoJobStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for scheduler4j components.
 */
@AutoConfiguration
@ConditionalOnClass({ScriptScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "scheduler4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock schedulerClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStore mongoJobStore(MongoTemplate mongoTemplate, Clock clock) {
        return new MongoJobStore(mongoTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    protected SchedulerMongoIndexConfig schedulerMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new SchedulerMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessRunner processRunner() {
        return new LocalProcessRunner();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScriptScheduler scriptScheduler(SchedulerProperties props, JobStore jobStore, ProcessRunner processRunner, Clock clock) {
        return new DefaultScriptScheduler(props, jobStore, processRunner, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobConfigLoader jobConfigLoader(ObjectProvider<ObjectMapper> objectMapper) {
        return new JobConfigLoader(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLifecycle schedulerLifecycle(ScriptScheduler scheduler, SchedulerProperties props, JobConfigLoader loader) {
        return new SchedulerLifecycle(scheduler, props, new JobFileImporter(scheduler, loader));
    }

    @Bean
    @ConditionalOnProperty(prefix = "scheduler4j", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton schedulerIndexesInitializer(SchedulerMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
