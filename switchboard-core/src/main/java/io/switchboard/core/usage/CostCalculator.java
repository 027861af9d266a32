package io.switchboard.core.usage;

import io.switchboard.core.model.TokenUsage;
import io.switchboard.core.registry.Pricing;

public final class CostCalculator {

    private CostCalculator() {
    }

    public static double cost(Pricing pricing, TokenUsage usage) {
        if (pricing == null || usage == null) {
            return 0.0;
        }
        if (pricing.hasDirectionalPrices()) {
            return usage.promptTokens() / 1000.0 * orZero(pricing.inputCostPer1k())
                + usage.completionTokens() / 1000.0 * orZero(pricing.outputCostPer1k());
        }
        return usage.totalTokens() / 1000.0 * orZero(pricing.blendedCostPer1k());
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
