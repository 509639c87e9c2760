package com.taskwave.core.conflict;

import com.taskwave.core.config.PlannerProperties;
import com.taskwave.core.model.Task;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Pulls path-like resource references out of a task's title and description.
 * <p>
 * A reference is a token containing a '/' ({@code src/api/}, {@code db/migrations/001.sql})
 * or a file name with a known extension ({@code schema.sql}, {@code `index.ts`}).
 * URLs are ignored. References are normalized by stripping quotes, a leading
 * {@code ./} and trailing punctuation.
 */
@Component
public class ResourceReferenceExtractor {

    private static final Pattern URL = Pattern.compile("\\b[a-zA-Z][a-zA-Z0-9+.-]*://\\S+");
    private static final Pattern CANDIDATE = Pattern.compile("[A-Za-z0-9_./@~-]+");
    private static final String TRAILING = ".,;:)]}!?'\"";

    private final Pattern fileName;

    @Autowired
    public ResourceReferenceExtractor(PlannerProperties properties) {
        this(properties.getResourceExtensions());
    }

    public ResourceReferenceExtractor(Collection<String> extensions) {
        String alternatives = extensions.stream()
                .filter(e -> e != null && !e.isBlank())
                .map(e -> Pattern.quote(e.trim().toLowerCase()))
                .collect(Collectors.joining("|"));
        this.fileName = alternatives.isEmpty()
                ? null
                : Pattern.compile("(?i).*[A-Za-z0-9_-]\\.(?:" + alternatives + ")");
    }

    public Set<String> extract(Task task) {
        return extract(task.title() + " " + task.description());
    }

    public Set<String> extract(String text) {
        var references = new LinkedHashSet<String>();
        if (text == null || text.isBlank()) {
            return references;
        }
        String withoutUrls = URL.matcher(text).replaceAll(" ");
        Matcher matcher = CANDIDATE.matcher(withoutUrls);
        while (matcher.find()) {
            String token = normalize(matcher.group());
            if (isReference(token)) {
                references.add(token);
            }
        }
        return references;
    }

    private boolean isReference(String token) {
        if (token.isEmpty() || token.equals("/") || !token.matches(".*[A-Za-z].*")) {
            return false;
        }
        if (token.contains("/")) {
            return !token.startsWith("//");
        }
        return fileName != null && fileName.matcher(token).matches();
    }

    static String normalize(String token) {
        String t = token;
        while (!t.isEmpty() && TRAILING.indexOf(t.charAt(t.length() - 1)) >= 0) {
            t = t.substring(0, t.length() - 1);
        }
        while (t.startsWith("./")) {
            t = t.substring(2);
        }
        return t;
    }
}
