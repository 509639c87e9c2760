package com.taskwave.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings for reading tasks from the {@code bd} (beads) issue tracker CLI.
 */
@Component
@ConfigurationProperties(prefix = "taskwave.beads")
public class BeadsProperties {

    private String command = "bd";
    private Duration timeout = Duration.ofSeconds(30);

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
