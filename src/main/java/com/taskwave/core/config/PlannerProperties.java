package com.taskwave.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "taskwave.planner")
public class PlannerProperties {

    private String defaultStrategy = "topological";
    private boolean detectConflicts = true;
    private List<String> foundationalKeywords = new ArrayList<>(List.of(
            "schema", "core", "base", "init", "setup", "config",
            "infrastructure", "migration", "scaffold", "bootstrap"));
    private List<String> resourceExtensions = new ArrayList<>(List.of(
            "ts", "tsx", "js", "jsx", "py", "go", "rs", "java", "kt", "md",
            "json", "yaml", "yml", "xml", "sql", "html", "css", "sh", "toml"));

    public String getDefaultStrategy() {
        return defaultStrategy;
    }

    public void setDefaultStrategy(String defaultStrategy) {
        this.defaultStrategy = defaultStrategy;
    }

    public boolean isDetectConflicts() {
        return detectConflicts;
    }

    public void setDetectConflicts(boolean detectConflicts) {
        this.detectConflicts = detectConflicts;
    }

    public List<String> getFoundationalKeywords() {
        return foundationalKeywords;
    }

    public void setFoundationalKeywords(List<String> foundationalKeywords) {
        this.foundationalKeywords = foundationalKeywords;
    }

    public List<String> getResourceExtensions() {
        return resourceExtensions;
    }

    public void setResourceExtensions(List<String> resourceExtensions) {
        this.resourceExtensions = resourceExtensions;
    }
}
