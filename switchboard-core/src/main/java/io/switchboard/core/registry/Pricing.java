package io.switchboard.core.registry;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Price table in currency units per 1000 tokens. Per-direction prices win over the blended price.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Pricing(
    @JsonAlias({"input_cost_per_1k", "cost_per_1k_input_tokens"}) Double inputCostPer1k,
    @JsonAlias({"output_cost_per_1k", "cost_per_1k_output_tokens"}) Double outputCostPer1k,
    @JsonAlias({"cost_per_1k", "cost_per_1k_tokens"}) Double blendedCostPer1k
) {

    public static Pricing free() {
        return new Pricing(null, null, null);
    }

    public static Pricing perDirection(double inputCostPer1k, double outputCostPer1k) {
        return new Pricing(inputCostPer1k, outputCostPer1k, null);
    }

    public static Pricing blended(double costPer1k) {
        return new Pricing(null, null, costPer1k);
    }

    public boolean hasDirectionalPrices() {
        return inputCostPer1k != null || outputCostPer1k != null;
    }
}
