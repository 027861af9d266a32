package io.switchboard.core.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.switchboard.core.config.ConfigPaths;
import io.switchboard.core.config.model.GatewayConfig;
import io.switchboard.core.config.model.HealthConfig;
import io.switchboard.core.config.model.StorageConfig;
import io.switchboard.core.provider.AdapterPool;
import io.switchboard.core.provider.ProviderAdapterFactory;
import io.switchboard.core.registry.CachedModelRegistry;
import io.switchboard.core.registry.ModelRegistry;
import io.switchboard.core.registry.SecretResolver;
import io.switchboard.core.routing.HealthMonitor;
import io.switchboard.core.routing.RoutingEngine;
import io.switchboard.core.usage.CallLogStore;
import io.switchboard.core.usage.FileCallLogStore;
import io.switchboard.core.usage.SqliteCallLogStore;
import io.switchboard.core.usage.UsageRecorder;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

public final class GatewayFactory {

    private GatewayFactory() {
    }

    public static AiGateway create(
        GatewayConfig config,
        ModelRegistry registry,
        CallLogStore callLog,
        SecretResolver secrets,
        Clock clock
    ) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        CachedModelRegistry cached = new CachedModelRegistry(
            registry,
            clock,
            Duration.ofSeconds(Math.max(0, config.registry().cacheTtlSeconds()))
        );
        AdapterPool adapters = new AdapterPool(new ProviderAdapterFactory(secrets, mapper));
        HealthConfig healthConfig = config.health();
        HealthMonitor health = new HealthMonitor(
            model -> adapters.adapterFor(model).checkHealth(),
            clock,
            Duration.ofSeconds(healthConfig.ttlSeconds()),
            Duration.ofSeconds(Math.max(1, healthConfig.sweepIntervalSeconds())),
            healthConfig.workerThreads()
        );
        RoutingEngine engine = new RoutingEngine(
            adapters::adapterFor,
            health,
            Duration.ofMillis(Math.max(0, config.routing().backoffMillis()))
        );
        UsageRecorder recorder = new UsageRecorder(callLog, cached, mapper, clock);
        AiGateway gateway = new AiGateway(
            cached,
            engine,
            health,
            recorder,
            adapters,
            clock,
            Duration.ofSeconds(Math.max(1, config.routing().requestTimeoutSeconds()))
        );
        health.start();
        return gateway;
    }

    public static CallLogStore callLogStore(StorageConfig storage) throws IOException {
        if (storage.sqlite()) {
            return new SqliteCallLogStore(ConfigPaths.resolve(storage.sqlitePath()));
        }
        return new FileCallLogStore(ConfigPaths.resolve(storage.callLogPath()));
    }
}
