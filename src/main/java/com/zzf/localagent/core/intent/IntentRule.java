package com.zzf.localagent.core.intent;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * One entry of the classifier's ordered rule table: a set of patterns and the intent they
 * select. Patterns are searched (not anchored) in lower-cased text.
 */
public final class IntentRule {

    private final Intent intent;
    private final List<Pattern> patterns;

    private IntentRule(Intent intent, List<Pattern> patterns) {
        this.intent = intent;
        this.patterns = patterns;
    }

    public static IntentRule of(Intent intent, String... regexes) {
        List<Pattern> compiled = Arrays.stream(regexes)
                .map(Pattern::compile)
                .collect(Collectors.toList());
        return new IntentRule(intent, Collections.unmodifiableList(compiled));
    }

    public boolean matches(String normalizedText) {
        for (Pattern p : patterns) {
            if (p.matcher(normalizedText).find()) {
                return true;
            }
        }
        return false;
    }

    public Intent getIntent() {
        return intent;
    }

    @Override
    public String toString() {
        return "IntentRule{" + intent + ", patterns=" + patterns.size() + "}";
    }
}
