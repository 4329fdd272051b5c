package com.zzf.localagent.core.intent;

import com.zzf.localagent.util.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Rule-based classification of user text into an {@link Intent}.
 * <p>
 * Rules are evaluated in table order and the first match wins:
 * <ol>
 *   <li>blank text is {@link Intent#AMBIGUOUS}</li>
 *   <li>{@link #RULES}: INFO, MCP, COMMAND, EDIT</li>
 *   <li>a COMMAND match is downgraded to INFO when the text asks "how to" / "how do i"</li>
 *   <li>short or pronoun-only text without a path is AMBIGUOUS</li>
 *   <li>everything else is EDIT</li>
 * </ol>
 * Pure and deterministic; never throws.
 */
@Component
public class IntentClassifier {
    private static final Logger logger = LoggerFactory.getLogger(IntentClassifier.class);

    static final List<IntentRule> RULES = List.of(
            IntentRule.of(Intent.INFO,
                    "\\bsummarize\\b", "\\bsummarise\\b", "\\bsummarising\\b", "\\bsummarizing\\b",
                    "\\bsummary\\b", "\\bwhat is this\\b", "\\bwhat's this\\b", "\\boverview\\b",
                    "\\barchitecture\\b", "\\bexplain\\b", "\\bhow to run\\b", "\\bhow do i run\\b",
                    "\\bhow to start\\b", "\\bhow do i start\\b", "\\bhow it starts\\b", "\\bhow it start\\b",
                    "\\bhow to build\\b", "\\bhow to test\\b", "\\bsetup\\b", "\\binstall\\b", "\\busage\\b"),
            IntentRule.of(Intent.MCP,
                    "\\bbrowse\\b", "\\bsearch\\b", "\\bgoogle\\b", "\\bwebsite\\b", "\\burl\\b", "\\bhttps?://"),
            IntentRule.of(Intent.COMMAND,
                    "\\brun tests\\b", "\\brun build\\b", "\\brun lint\\b", "\\brun\\b", "\\bexecute\\b",
                    "\\bstart server\\b", "\\bnpm\\b", "\\bpytest\\b", "\\bmake\\b"),
            IntentRule.of(Intent.EDIT,
                    "\\bfix\\b", "\\bchange\\b", "\\bupdate\\b", "\\badd\\b", "\\bremove\\b", "\\brefactor\\b",
                    "\\bimplement\\b", "\\bbug\\b", "\\bissue\\b", "\\bfeature\\b")
    );

    private static final List<String> EXPLANATION_PHRASES = List.of("how to", "how do i");

    public Intent classify(String text) {
        String q = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        if (q.isEmpty()) {
            return Intent.AMBIGUOUS;
        }

        for (IntentRule rule : RULES) {
            if (rule.matches(q)) {
                Intent intent = overrideExplanationRequest(rule.getIntent(), q);
                logger.debug("intent.classify.rule match={} q={}", intent, StringUtils.truncate(q, 50));
                return intent;
            }
        }

        if (ScopeHints.wordCount(q) < ScopeHints.MIN_SCOPED_WORDS && !ScopeHints.hasPathHint(q)) {
            return Intent.AMBIGUOUS;
        }
        if (ScopeHints.hasPronoun(q) && !ScopeHints.hasPathHint(q)) {
            return Intent.AMBIGUOUS;
        }
        return Intent.EDIT;
    }

    /**
     * A command verb must not shadow a request for an explanation of that command.
     */
    private static Intent overrideExplanationRequest(Intent matched, String q) {
        if (matched != Intent.COMMAND) {
            return matched;
        }
        for (String phrase : EXPLANATION_PHRASES) {
            if (q.contains(phrase)) {
                return Intent.INFO;
            }
        }
        return matched;
    }
}
