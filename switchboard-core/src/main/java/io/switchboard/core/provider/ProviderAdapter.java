package io.switchboard.core.provider;

import io.switchboard.core.registry.ModelConfig;

/**
 * Uniform facade over one backend model.
 *
 * <p>Implementations report failures as {@link ProviderResult#error()} values or
 * {@code ERROR} stream events; they do not throw for backend problems and do not retry.
 */
public interface ProviderAdapter extends AutoCloseable {

    ModelConfig model();

    ProviderResult executeTask(ProviderCall call);

    ProviderStream executeTaskStream(ProviderCall call);

    HealthCheckResult checkHealth();

    @Override
    void close();
}
