package com.memquest.ingestion;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based PII detection. Categories are applied in a fixed order, each one
 * against the output of the previous, so overlapping matches resolve the same way
 * every time.
 */
public class PiiRedactor {

    private record Rule(String type, Pattern pattern) {}

    private static final List<Rule> RULES = List.of(
        new Rule("EMAIL", Pattern.compile("\\b[A-Za-z0-9._%+\\-]+@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,}\\b")),
        new Rule("PHONE", Pattern.compile(
                "\\b(?:\\+?1[-.\\s]?)?(?:\\(\\d{3}\\)|\\d{3})[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b")),
        new Rule("SSN", Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b")),
        new Rule("CREDIT_CARD", Pattern.compile("\\b(?:\\d[ -]*?){13,19}\\b")),
        new Rule("IP_ADDRESS", Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b"))
    );

    private final boolean enabled;
    private final RedactionMode defaultMode;

    public PiiRedactor(boolean enabled, RedactionMode defaultMode) {
        this.enabled = enabled;
        this.defaultMode = defaultMode;
    }

    public RedactionResult redact(String text) {
        return redact(text, defaultMode);
    }

    public RedactionResult redact(String text, RedactionMode mode) {
        if (!enabled || text == null || text.isEmpty()) {
            return new RedactionResult(text != null ? text : "", false, List.of());
        }
        var types = new ArrayList<String>();
        var result = text;
        for (var rule : RULES) {
            Matcher m = rule.pattern().matcher(result);
            if (!m.find()) continue;
            types.add(rule.type());
            switch (mode) {
                case MASK -> result = m.replaceAll(Matcher.quoteReplacement("[REDACTED:" + rule.type() + "]"));
                case DROP -> result = m.replaceAll("");
                case TAG -> { }
            }
        }
        return new RedactionResult(result, !types.isEmpty(), types);
    }
}
