package io.dispatch4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dispatch4j.DaemonLoop;
import io.dispatch4j.JobPreparer;
import io.dispatch4j.ScheduleLedger;
import io.dispatch4j.SchedulingEngine;
import io.dispatch4j.StartupRecovery;
import io.dispatch4j.StatusSink;
import io.dispatch4j.internal.mongo.MongoJobPreparer;
import io.dispatch4j.internal.mongo.MongoJobStore;
import io.dispatch4j.internal.mongo.MongoRunTemplateStore;
import io.dispatch4j.internal.mongo.MongoTenantStore;
import io.dispatch4j.store.JobRepository;
import io.dispatch4j.store.RunTemplateRepository;
import io.dispatch4j.store.TenantRepository;
import io.dispatch4j.utils.IntervalResolver;
import io.dispatch4j.utils.Slf4jStatusSink;
import io.dispatch4j.utils.WindowCalculator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for the dispatch scheduler.
 */
@AutoConfiguration(after = MongoDataAutoConfiguration.class)
@ConditionalOnClass({SchedulingEngine.class, MongoTemplate.class})
@EnableConfigurationProperties(DispatchProperties.class)
@ConditionalOnProperty(prefix = "dispatch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DispatchConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock dispatchClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(TenantRepository.class)
    protected MongoTenantStore mongoTenantStore(MongoTemplate mongoTemplate) {
        return new MongoTenantStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(RunTemplateRepository.class)
    protected MongoRunTemplateStore mongoRunTemplateStore(MongoTemplate mongoTemplate) {
        return new MongoRunTemplateStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(JobRepository.class)
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(JobPreparer.class)
    protected MongoJobPreparer mongoJobPreparer(MongoTemplate mongoTemplate,
                                                ObjectProvider<ObjectMapper> objectMapper,
                                                DispatchProperties props,
                                                Clock clock) {
        return new MongoJobPreparer(mongoTemplate, objectMapper.getIfAvailable(ObjectMapper::new),
                props.resolveInstanceId(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    protected DispatchMongoIndexConfig dispatchMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new DispatchMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public StatusSink statusSink() {
        return new Slf4jStatusSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public IntervalResolver intervalResolver() {
        return new IntervalResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public WindowCalculator windowCalculator(DispatchProperties props) {
        return new WindowCalculator(props.zoneId());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleLedger scheduleLedger(RunTemplateRepository runTemplates,
                                         JobRepository jobs,
                                         IntervalResolver resolver,
                                         WindowCalculator calculator,
                                         StatusSink status) {
        return new ScheduleLedger(runTemplates, jobs, resolver, calculator, status);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulingEngine schedulingEngine(TenantRepository tenants,
                                             RunTemplateRepository runTemplates,
                                             ScheduleLedger ledger,
                                             JobPreparer jobPreparer,
                                             StatusSink status,
                                             WindowCalculator calculator) {
        return new SchedulingEngine(tenants, runTemplates, ledger, jobPreparer, status, calculator.zone());
    }

    @Bean
    @ConditionalOnMissingBean
    public StartupRecovery startupRecovery(RunTemplateRepository runTemplates,
                                           JobRepository jobs,
                                           IntervalResolver resolver,
                                           WindowCalculator calculator) {
        return new StartupRecovery(runTemplates, jobs, resolver, calculator);
    }

    @Bean
    @ConditionalOnMissingBean
    public DaemonLoop daemonLoop(SchedulingEngine engine,
                                 StartupRecovery recovery,
                                 JobRepository jobs,
                                 DispatchProperties props,
                                 Clock clock) {
        return new DaemonLoop(engine, recovery, jobs, props.toDaemonSettings(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "dispatch", name = "one-shot", havingValue = "false", matchIfMissing = true)
    public DispatchLifecycle dispatchLifecycle(DaemonLoop daemonLoop) {
        return new DispatchLifecycle(daemonLoop);
    }

    @Bean
    @ConditionalOnProperty(prefix = "dispatch", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton dispatchIndexesInitializer(DispatchMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
