package com.taskwave.core.conflict;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Resource references per task for one planning call, answering whether two tasks
 * conflict. Any shared reference is a conflict: splitting a safe pair is acceptable,
 * letting a real collision run concurrently is not.
 */
public final class ConflictIndex implements BiPredicate<String, String> {

    private final Map<String, Set<String>> references;

    ConflictIndex(Map<String, Set<String>> references) {
        this.references = Map.copyOf(references);
    }

    /** An index in which nothing conflicts, used when conflict detection is off. */
    public static ConflictIndex none() {
        return new ConflictIndex(Map.of());
    }

    public Set<String> referencesOf(String taskId) {
        return references.getOrDefault(taskId, Set.of());
    }

    @Override
    public boolean test(String a, String b) {
        return !sharedReferences(a, b).isEmpty();
    }

    public List<String> sharedReferences(String a, String b) {
        if (a.equals(b)) {
            return List.of();
        }
        var left = referencesOf(a);
        var right = referencesOf(b);
        if (left.isEmpty() || right.isEmpty()) {
            return List.of();
        }
        return left.stream()
                .filter(l -> right.stream().anyMatch(r -> sameResource(l, r)))
                .toList();
    }

    /**
     * Two references name the same resource if they are equal or one is a path suffix of
     * the other (relative vs. longer path).
     */
    static boolean sameResource(String first, String second) {
        String n1 = strip(first);
        String n2 = strip(second);
        if (n1.equals(n2)) return true;
        return n1.endsWith("/" + n2) || n2.endsWith("/" + n1);
    }

    private static String strip(String path) {
        String p = path.startsWith("./") ? path.substring(2) : path;
        return p.length() > 1 && p.endsWith("/") ? p.substring(0, p.length() - 1) : p;
    }
}
