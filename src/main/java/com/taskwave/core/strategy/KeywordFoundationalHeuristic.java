package com.taskwave.core.strategy;

import com.taskwave.core.config.PlannerProperties;
import com.taskwave.core.model.Task;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Flags a task as foundational when its title or description contains a word starting
 * with one of the configured keywords ("schema", "setup", "init", ...). Matching is
 * case-insensitive and anchored at a word start, so "init" matches "initialize" but
 * "base" does not match "database".
 */
@Component
public class KeywordFoundationalHeuristic implements FoundationalHeuristic {

    private final List<Pattern> patterns;

    @Autowired
    public KeywordFoundationalHeuristic(PlannerProperties properties) {
        this(properties.getFoundationalKeywords());
    }

    public KeywordFoundationalHeuristic(List<String> keywords) {
        this.patterns = keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> Pattern.compile("\\b" + Pattern.quote(k.trim().toLowerCase())))
                .toList();
    }

    @Override
    public boolean isFoundational(Task task) {
        String text = (task.title() + " " + task.description()).toLowerCase();
        for (var pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
