package io.fleetcron.config;

import io.fleetcron.JobFunction;
import io.fleetcron.Schedule;
import io.fleetcron.core.FunctionRegistry;
import io.fleetcron.internal.DefaultSchedule;
import io.fleetcron.internal.NodeIds;
import io.fleetcron.internal.ObjectMappers;
import io.fleetcron.internal.coordination.ConcurrencyCoordinator;
import io.fleetcron.internal.coordination.InMemoryCoordinationService;
import io.fleetcron.internal.event.LoggingEventSink;
import io.fleetcron.internal.mongo.MongoScheduleStore;
import io.fleetcron.internal.registry.ScheduleRegistry;
import io.fleetcron.internal.source.YamlScheduleSource;
import io.fleetcron.internal.store.FileScheduleStore;
import io.fleetcron.internal.tracking.RunningJobTracker;
import io.fleetcron.spi.CoordinationClient;
import io.fleetcron.spi.EventSink;
import io.fleetcron.spi.PeerQueryClient;
import io.fleetcron.spi.ScheduleSource;
import io.fleetcron.spi.ScheduleStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Random;

/**
 * Spring Boot auto-configuration entrypoint for the scheduler.
 */
@AutoConfiguration
@ConditionalOnClass(Schedule.class)
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "fleetcron", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FleetcronConfig {

    @Bean
    @ConditionalOnMissingBean
    public FunctionRegistry functionRegistry(ObjectProvider<List<JobFunction>> functionsProvider) {
        List<JobFunction> functions = functionsProvider.getIfAvailable(List::of);
        return new FunctionRegistry(functions);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "fleetcron", name = "store", havingValue = "file", matchIfMissing = true)
    public ScheduleStore fileScheduleStore(SchedulerProperties props) {
        return new FileScheduleStore(Path.of(props.getScheduleFile()), ObjectMappers.json());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleRegistry scheduleRegistry(ScheduleStore store) {
        return new ScheduleRegistry(store);
    }

    @Bean
    @ConditionalOnMissingBean
    public InMemoryCoordinationService inMemoryCoordinationService() {
        return new InMemoryCoordinationService();
    }

    @Bean
    @ConditionalOnMissingBean
    public CoordinationClient coordinationClient(InMemoryCoordinationService service) {
        return service.openSession();
    }

    @Bean
    @ConditionalOnMissingBean
    public PeerQueryClient peerQueryClient() {
        return PeerQueryClient.none();
    }

    @Bean
    @ConditionalOnMissingBean
    public RunningJobTracker runningJobTracker(SchedulerProperties props, PeerQueryClient peerQueryClient) {
        return new RunningJobTracker(NodeIds.resolve(props.getNodeId()), peerQueryClient,
                props.getPeerQueryTimeout(), props.getPeerQueryOverallTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConcurrencyCoordinator concurrencyCoordinator(SchedulerProperties props, CoordinationClient client) {
        return new ConcurrencyCoordinator(client, props.getCoordinationRoot(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public EventSink eventSink() {
        return new LoggingEventSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public Schedule schedule(SchedulerProperties props,
                             ScheduleRegistry registry,
                             RunningJobTracker tracker,
                             ConcurrencyCoordinator coordinator,
                             FunctionRegistry functions,
                             EventSink eventSink) {
        ScheduleSource source = props.getScheduleSource() == null || props.getScheduleSource().isBlank()
                ? null
                : new YamlScheduleSource(Path.of(props.getScheduleSource()));
        return new DefaultSchedule(props, registry, tracker, coordinator, functions, eventSink,
                Clock.systemUTC(), new Random(), source);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleLifecycle scheduleLifecycle(Schedule schedule) {
        return new ScheduleLifecycle(schedule);
    }

    /**
     * Mongo-backed storage, selected with {@code fleetcron.store=mongo}.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MongoTemplate.class)
    @ConditionalOnProperty(prefix = "fleetcron", name = "store", havingValue = "mongo")
    static class MongoStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ScheduleStore mongoScheduleStore(MongoTemplate mongoTemplate) {
            return new MongoScheduleStore(mongoTemplate, ObjectMappers.json());
        }

        @Bean
        @ConditionalOnMissingBean
        public FleetcronMongoIndexConfig fleetcronMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new FleetcronMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "fleetcron", name = "ensure-indexes-on-startup", havingValue = "true")
        public SmartInitializingSingleton fleetcronIndexesInitializer(FleetcronMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }
}
