package io.caliban4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.caliban4j.ComputePlatform;
import io.caliban4j.ImageBuilder;
import io.caliban4j.JobHistory;
import io.caliban4j.RunStatusProvider;
import io.caliban4j.Storage;
import io.caliban4j.StorageProvider;
import io.caliban4j.core.Platform;
import io.caliban4j.core.PlatformRegistry;
import io.caliban4j.core.RetryPolicy;
import io.caliban4j.internal.DefaultJobHistory;
import io.caliban4j.internal.EntityCodec;
import io.caliban4j.internal.StatusReconciler;
import io.caliban4j.internal.StorageConnector;
import io.caliban4j.internal.compute.CaipJobApi;
import io.caliban4j.internal.compute.CaipStatusProvider;
import io.caliban4j.internal.compute.GkeJobApi;
import io.caliban4j.internal.compute.GkeStatusProvider;
import io.caliban4j.internal.compute.LocalStatusProvider;
import io.caliban4j.internal.compute.NullCompute;
import io.caliban4j.internal.compute.TestStatusProvider;
import io.caliban4j.internal.memory.FileStorageProvider;
import io.caliban4j.internal.memory.MemoryStorageProvider;
import io.caliban4j.internal.mongo.MongoStorageProvider;
import io.caliban4j.internal.nulls.NullStorageProvider;
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
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Spring Boot auto-configuration entrypoint for the job history.
 */
@AutoConfiguration
@ConditionalOnClass({JobHistory.class, MongoTemplate.class})
@EnableConfigurationProperties(HistoryProperties.class)
@ConditionalOnProperty(prefix = "caliban.history", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HistoryConfig {

    @Bean
    @ConditionalOnMissingBean(name = "historyClock")
    public Clock historyClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public EntityCodec historyEntityCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new EntityCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy historyRetryPolicy(HistoryProperties props) {
        return new RetryPolicy(Math.max(1, props.getMaxRetryCount()), props.getRetryBackoff(), props.getMaxRetryBackoff());
    }

    @Bean
    @ConditionalOnMissingBean
    public StorageConnector storageConnector(HistoryProperties props,
                                             EntityCodec codec,
                                             Clock historyClock,
                                             RetryPolicy retryPolicy,
                                             ObjectProvider<List<StorageProvider>> providersProvider) {
        // application providers take precedence over the built-in schemes
        List<StorageProvider> providers = new ArrayList<>(providersProvider.getIfAvailable(List::of));
        providers.add(new MongoStorageProvider(codec, historyClock, props.getDatabase(),
                props.getServerSelectionTimeout(), retryPolicy));
        providers.add(new FileStorageProvider(codec, historyClock));
        providers.add(new MemoryStorageProvider(codec, historyClock));
        providers.add(new NullStorageProvider(historyClock));
        return new StorageConnector(providers, props.getLocalUrl(), props.isStrict());
    }

    // closed by HistoryLifecycle
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public Storage historyStorage(StorageConnector connector, HistoryProperties props) {
        return connector.connect(props.getUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    public PlatformRegistry platformRegistry(ObjectProvider<List<ComputePlatform>> computesProvider) {
        List<ComputePlatform> computes = new ArrayList<>(computesProvider.getIfAvailable(List::of));
        if (computes.stream().noneMatch(c -> c.platform() == Platform.TEST)) {
            computes.add(new NullCompute());
        }
        return new PlatformRegistry(computes);
    }

    @Bean
    @ConditionalOnMissingBean
    public StatusReconciler statusReconciler(Storage storage,
                                             ObjectProvider<List<RunStatusProvider>> providersProvider,
                                             ObjectProvider<CaipJobApi> caipJobApi,
                                             ObjectProvider<GkeJobApi> gkeJobApi) {
        List<RunStatusProvider> providers = new ArrayList<>(providersProvider.getIfAvailable(List::of));
        Set<Platform> covered = EnumSet.noneOf(Platform.class);
        providers.forEach(p -> covered.add(p.platform()));

        if (!covered.contains(Platform.LOCAL)) {
            providers.add(new LocalStatusProvider());
        }
        if (!covered.contains(Platform.TEST)) {
            providers.add(new TestStatusProvider());
        }
        if (!covered.contains(Platform.CAIP)) {
            caipJobApi.ifAvailable(api -> providers.add(new CaipStatusProvider(api)));
        }
        if (!covered.contains(Platform.GKE)) {
            gkeJobApi.ifAvailable(api -> providers.add(new GkeStatusProvider(api)));
        }
        return new StatusReconciler(storage, providers);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHistory jobHistory(HistoryProperties props,
                                 Storage storage,
                                 PlatformRegistry platformRegistry,
                                 StatusReconciler statusReconciler,
                                 ObjectProvider<ImageBuilder> imageBuilder) {
        return new DefaultJobHistory(storage, platformRegistry, statusReconciler, imageBuilder.getIfAvailable(),
                props.getStatusMaxJobs());
    }

    @Bean
    @ConditionalOnMissingBean
    public HistoryLifecycle historyLifecycle(Storage storage) {
        return new HistoryLifecycle(storage);
    }

    @Bean
    @ConditionalOnMissingBean
    public HistoryMongoIndexConfig historyMongoIndexConfig(Storage storage) {
        return new HistoryMongoIndexConfig(storage);
    }

    @Bean
    @ConditionalOnProperty(prefix = "caliban.history", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton historyIndexesInitializer(HistoryMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
