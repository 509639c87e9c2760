package com.taskwave.core.config;

import com.taskwave.core.model.PlanningException;

/**
 * Caller-supplied configuration is invalid (e.g. an unknown strategy name).
 * Raised before any graph work starts; retrying with the same input cannot succeed.
 */
public class ConfigurationException extends PlanningException {

    public ConfigurationException(String message) {
        super(message);
    }
}
