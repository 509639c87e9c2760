package com.taskwave.core.strategy;

import com.taskwave.core.config.ConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The closed set of ordering strategies.
 * <p>
 * TOPOLOGICAL: dependency layers as computed.
 * RISK_FIRST: most urgent priority class first whenever its dependencies allow.
 * FOUNDATIONAL_FIRST: schema/setup style work as early as possible.
 * PARALLEL_MAXIMIZING: merge independent batches, critical chains first.
 */
public enum StrategyType {
    TOPOLOGICAL("topological"),
    RISK_FIRST("risk_first"),
    FOUNDATIONAL_FIRST("foundational_first"),
    PARALLEL_MAXIMIZING("parallel_maximizing");

    private final String wireName;

    StrategyType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a strategy name, case-insensitively and accepting '-' for '_'.
     *
     * @throws ConfigurationException if the name matches no strategy
     */
    public static StrategyType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Strategy name is required. Valid strategies: " + validNames());
        }
        String normalized = name.trim().toLowerCase().replace('-', '_');
        for (var type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new ConfigurationException("Unknown strategy: " + name + ". Valid strategies: " + validNames());
    }

    public static String validNames() {
        return Arrays.stream(values()).map(StrategyType::wireName).collect(Collectors.joining(", "));
    }
}
