package com.zzf.localagent.core.intent;

import java.util.regex.Pattern;

/**
 * Heuristics that decide whether a request names a concrete place in the code base.
 * Shared by the classifier and the planner so both agree on what "scoped" means.
 */
public final class ScopeHints {

    public static final int MIN_SCOPED_WORDS = 4;

    private static final Pattern PATH_HINT = Pattern.compile(
            "[/\\\\]|\\.(?:py|js|ts|tsx|json|yml|yaml|md|html|css|java|kt|xml|gradle|properties)\\b");
    private static final Pattern PRONOUN_HINT = Pattern.compile(
            "\\b(?:it|this|that|these|those)\\b", Pattern.CASE_INSENSITIVE);

    private ScopeHints() {}

    public static boolean hasPathHint(String text) {
        return text != null && PATH_HINT.matcher(text).find();
    }

    public static boolean hasPronoun(String text) {
        return text != null && PRONOUN_HINT.matcher(text).find();
    }

    public static int wordCount(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    /**
     * True when the text cannot be tied to a file or area: empty, too short without a path,
     * or leaning on a pronoun without a path.
     */
    public static boolean isScopeUndetermined(String text) {
        if (text == null || text.trim().isEmpty()) {
            return true;
        }
        boolean hasPath = hasPathHint(text);
        if (wordCount(text) < MIN_SCOPED_WORDS && !hasPath) {
            return true;
        }
        return hasPronoun(text) && !hasPath;
    }
}
