package io.switchboard.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kinds of work callers can ask the gateway for. Each task declares the
 * capabilities relevant to it; a model serves the task when it has any of them.
 */
public enum TaskType {
    OCR(EnumSet.of(Capability.TEXT, Capability.VISION)),
    STRUCTURED_ANALYSIS(EnumSet.of(Capability.TEXT)),
    INTERACTIVE_ANALYSIS(EnumSet.of(Capability.TEXT)),
    SUMMARIZATION(EnumSet.of(Capability.TEXT)),
    TRANSLATION(EnumSet.of(Capability.TEXT)),
    BATCH_ANALYSIS(EnumSet.of(Capability.TEXT)),
    REVIEW_ANALYSIS(EnumSet.of(Capability.TEXT)),
    CODE_GENERATION(EnumSet.of(Capability.TEXT)),
    CODE_REVIEW(EnumSet.of(Capability.TEXT)),
    MATH_SOLVING(EnumSet.of(Capability.TEXT));

    private final Set<Capability> requiredCapabilities;

    TaskType(Set<Capability> requiredCapabilities) {
        this.requiredCapabilities = Set.copyOf(requiredCapabilities);
    }

    public Set<Capability> requiredCapabilities() {
        return requiredCapabilities;
    }

    public boolean isCodeTask() {
        return this == CODE_GENERATION || this == CODE_REVIEW;
    }
}
