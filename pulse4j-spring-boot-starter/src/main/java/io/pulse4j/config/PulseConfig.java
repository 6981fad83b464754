package io.pulse4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.JobRunListener;
import io.pulse4j.Scheduler;
import io.pulse4j.core.JobDescriptor;
import io.pulse4j.core.JobRunStore;
import io.pulse4j.core.SchedulerOptions;
import io.pulse4j.hub.BroadcastHub;
import io.pulse4j.hub.ConnectionRegistry;
import io.pulse4j.hub.JobRunBroadcaster;
import io.pulse4j.internal.DefaultScheduler;
import io.pulse4j.internal.InMemoryJobRunStore;
import io.pulse4j.mongo.JobRunIndexConfig;
import io.pulse4j.mongo.MongoJobRunStore;
import io.pulse4j.pipeline.OkHttpRemoteTrigger;
import io.pulse4j.pipeline.PipelineJob;
import io.pulse4j.pipeline.PipelineRunner;
import io.pulse4j.pipeline.PipelineSpec;
import io.pulse4j.pipeline.PipelineStep;
import io.pulse4j.pipeline.RemoteTrigger;
import io.pulse4j.utils.ObjectMappers;
import io.pulse4j.web.LiveEventController;
import io.pulse4j.web.PulseAdminExceptionHandler;
import io.pulse4j.web.SchedulerAdminController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.net.URI;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Spring Boot auto-configuration entrypoint for the scheduler, pipelines and live-event hub.
 */
@AutoConfiguration
@ConditionalOnClass(Scheduler.class)
@EnableConfigurationProperties(PulseProperties.class)
@ConditionalOnProperty(prefix = "pulse", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PulseConfig {
    private static final Logger log = LoggerFactory.getLogger(PulseConfig.class);

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "pulse.history", name = "store", havingValue = "memory", matchIfMissing = true)
    public JobRunStore inMemoryJobRunStore(PulseProperties props) {
        return new InMemoryJobRunStore(props.getHistory().getLimit());
    }

    @Bean
    @ConditionalOnMissingBean
    public RemoteTrigger remoteTrigger(ObjectProvider<ObjectMapper> objectMapper) {
        return new OkHttpRemoteTrigger(objectMapper.getIfAvailable(ObjectMappers::create));
    }

    @Bean
    @ConditionalOnMissingBean
    public PipelineRunner pipelineRunner(RemoteTrigger remoteTrigger) {
        return new PipelineRunner(remoteTrigger);
    }

    @Bean
    @ConditionalOnMissingBean
    public Scheduler scheduler(PulseProperties props,
                               JobRunStore runStore,
                               PipelineRunner pipelineRunner,
                               ObjectProvider<JobRegistration> registrations,
                               ObjectProvider<JobRunListener> listeners) {
        SchedulerOptions options = new SchedulerOptions(
                ZoneId.of(props.getTimezone()),
                props.getWorkerThreads(),
                props.getShutdownGracePeriod()
        );
        DefaultScheduler scheduler = new DefaultScheduler(options, runStore, Clock.systemUTC());
        try {
            listeners.orderedStream().forEach(scheduler::addListener);
            registrations.orderedStream().forEach(registration -> {
                JobRegistration effective = registration.withOverride(
                        props.getJobs().get(registration.descriptor().name()));
                scheduler.register(effective.descriptor(), effective.handler());
            });
            for (ConfiguredPipeline p : pipelinesFrom(props)) {
                scheduler.register(p.descriptor(), new PipelineJob(pipelineRunner, p.spec()));
            }
        } catch (RuntimeException e) {
            scheduler.shutdown();
            throw e;
        }
        log.info("Scheduler configured jobs={} timezone={}", scheduler.jobNames().size(), options.defaultZone());
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public PulseLifecycle pulseLifecycle(Scheduler scheduler) {
        return new PulseLifecycle(scheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionRegistry connectionRegistry(PulseProperties props) {
        PulseProperties.Hub hub = props.getHub();
        return new ConnectionRegistry(hub.getHeartbeatInterval(), hub.getHeartbeatThreads(), hub.getWriteTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public BroadcastHub broadcastHub(ConnectionRegistry registry, ObjectProvider<ObjectMapper> objectMapper) {
        return new BroadcastHub(registry, objectMapper.getIfAvailable(ObjectMappers::create));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "pulse.hub", name = "publish-job-runs", havingValue = "true")
    public JobRunBroadcaster jobRunBroadcaster(BroadcastHub hub) {
        return new JobRunBroadcaster(hub);
    }

    static List<ConfiguredPipeline> pipelinesFrom(PulseProperties props) {
        List<ConfiguredPipeline> result = new ArrayList<>();
        for (Map.Entry<String, PulseProperties.Pipeline> e : props.getPipelines().entrySet()) {
            String name = e.getKey();
            PulseProperties.Pipeline p = e.getValue();

            List<PipelineStep> steps = new ArrayList<>(p.getSteps().size());
            for (PulseProperties.Step s : p.getSteps()) {
                steps.add(new PipelineStep(s.getName(), URI.create(s.getUrl()), s.getPayload(),
                        s.getTimeout(), s.getDelayAfter()));
            }
            PipelineSpec spec = new PipelineSpec(name, p.getSource(), steps);
            JobDescriptor descriptor = new JobDescriptor(name, p.getCron(), p.getTimezone(), p.isEnabled());
            result.add(new ConfiguredPipeline(spec, descriptor));
        }
        return result;
    }

    record ConfiguredPipeline(PipelineSpec spec, JobDescriptor descriptor) {
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({MongoTemplate.class, MongoJobRunStore.class})
    @ConditionalOnProperty(prefix = "pulse.history", name = "store", havingValue = "mongo")
    static class MongoHistoryConfig {

        @Bean
        @ConditionalOnMissingBean(JobRunStore.class)
        public MongoJobRunStore mongoJobRunStore(MongoTemplate mongoTemplate) {
            return new MongoJobRunStore(mongoTemplate);
        }

        @Bean
        @ConditionalOnMissingBean
        public JobRunIndexConfig jobRunIndexConfig(MongoTemplate mongoTemplate, PulseProperties props) {
            return new JobRunIndexConfig(mongoTemplate, props.getHistory().getRetention());
        }

        @Bean
        @ConditionalOnProperty(prefix = "pulse.history", name = "ensure-indexes", havingValue = "true")
        public SmartInitializingSingleton pulseIndexesInitializer(JobRunIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(ResponseBodyEmitter.class)
    static class WebConfig {

        @Bean
        @ConditionalOnMissingBean
        public LiveEventController liveEventController(ConnectionRegistry registry,
                                                       ObjectProvider<ObjectMapper> objectMapper,
                                                       PulseProperties props) {
            return new LiveEventController(registry, objectMapper.getIfAvailable(ObjectMappers::create),
                    props.getHub().getEmitterTimeout());
        }

        @Bean
        @ConditionalOnMissingBean
        public SchedulerAdminController schedulerAdminController(Scheduler scheduler) {
            return new SchedulerAdminController(scheduler);
        }

        @Bean
        @ConditionalOnMissingBean
        public PulseAdminExceptionHandler pulseAdminExceptionHandler() {
            return new PulseAdminExceptionHandler();
        }
    }
}
