package com.fleetops.agent.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips credential-shaped and network-identifying substrings from model
 * "thinking" text. Raw thinking is never stored or streamed; only the output of
 * this class is.
 *
 * Patterns run in order, most specific first, all case-insensitive.
 */
@Component
@Slf4j
public class CotRedactor {

    public static final String TRUNCATION_MARKER = "... [TRUNCATED]";
    public static final int DEFAULT_MAX_SUMMARY_LENGTH = 1000;

    private record Rule(Pattern pattern, String replacement) {
    }

    private final List<Rule> rules = new CopyOnWriteArrayList<>();

    public CotRedactor() {
        // Authentication tokens and keys
        rule("bearer\\s+[A-Za-z0-9_\\-.]+", "Bearer [REDACTED]");
        rule("authorization[:\\s]+[^\\s]+", "Authorization: [REDACTED]");
        rule("api[-_]?key[=:\\s]+[^\\s,;]+", "api_key=[REDACTED]");
        rule("api[-_]?secret[=:\\s]+[^\\s,;]+", "api_secret=[REDACTED]");
        rule("access[-_]?token[=:\\s]+[^\\s,;]+", "access_token=[REDACTED]");
        rule("refresh[-_]?token[=:\\s]+[^\\s,;]+", "refresh_token=[REDACTED]");
        rule("client[-_]?secret[=:\\s]+[^\\s,;]+", "client_secret=[REDACTED]");

        rule("password[=:\\s]+[^\\s,;]+", "password=[REDACTED]");
        rule("passwd[=:\\s]+[^\\s,;]+", "passwd=[REDACTED]");
        rule("pwd[=:\\s]+[^\\s,;]+", "pwd=[REDACTED]");

        rule("secret[=:\\s]+[^\\s,;]+", "secret=[REDACTED]");
        rule("private[-_]?key[=:\\s]+[^\\s,;]+", "private_key=[REDACTED]");

        // Connection strings
        rule("postgres(ql)?://[^\\s]+", "[DATABASE_URL_REDACTED]");
        rule("mysql://[^\\s]+", "[DATABASE_URL_REDACTED]");
        rule("mongodb(\\+srv)?://[^\\s]+", "[DATABASE_URL_REDACTED]");
        rule("redis://[^\\s]+", "[REDIS_URL_REDACTED]");

        rule("AKIA[0-9A-Z]{16}", "[AWS_ACCESS_KEY_REDACTED]");
        rule("aws[-_]?secret[-_]?access[-_]?key[=:\\s]+[^\\s,;]+", "aws_secret=[REDACTED]");

        rule("\\b(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\b",
                "[IP_ADDRESS]");
        rule("\\b([0-9A-Fa-f]{2}[:-]){5}([0-9A-Fa-f]{2})\\b", "[MAC_ADDRESS]");
        rule("\\beyJ[A-Za-z0-9_-]*\\.eyJ[A-Za-z0-9_-]*\\.[A-Za-z0-9_-]+\\b", "[JWT_REDACTED]");
        rule("\\b[A-Za-z0-9+/]{40,}={0,2}\\b", "[BASE64_REDACTED]");
        rule("-----BEGIN [A-Z ]+ PRIVATE KEY-----[\\s\\S]*?-----END [A-Z ]+ PRIVATE KEY-----",
                "[PRIVATE_KEY_REDACTED]");
        rule("\\b[0-9a-fA-F]{32,}\\b", "[HEX_STRING_REDACTED]");
    }

    public RedactionResult redact(String text) {
        return redact(text, DEFAULT_MAX_SUMMARY_LENGTH);
    }

    /**
     * Applies every rule, then truncates to {@code maxLength} characters plus
     * {@link #TRUNCATION_MARKER}.
     */
    public RedactionResult redact(String text, int maxLength) {
        if (text == null || text.isEmpty()) {
            return RedactionResult.empty();
        }

        int count = 0;
        String redacted = text;
        for (Rule rule : rules) {
            Matcher matcher = rule.pattern().matcher(redacted);
            int matches = 0;
            while (matcher.find()) {
                matches++;
            }
            if (matches > 0) {
                count += matches;
                redacted = rule.pattern().matcher(redacted).replaceAll(Matcher.quoteReplacement(rule.replacement()));
            }
        }

        if (redacted.length() > maxLength) {
            redacted = redacted.substring(0, maxLength) + TRUNCATION_MARKER;
        }

        if (count > 0) {
            log.debug("Redacted {} sensitive fragment(s) from thinking text", count);
        }
        return new RedactionResult(redacted, count, text.length(), redacted.length());
    }

    /** Redacts a streamed fragment without truncating it. */
    public String redactFragment(String fragment) {
        return redact(fragment, Integer.MAX_VALUE).summary();
    }

    public boolean isSafe(String text) {
        if (text == null) {
            return true;
        }
        return rules.stream().noneMatch(rule -> rule.pattern().matcher(text).find());
    }

    public void addRule(String regex, String replacement) {
        rule(regex, replacement);
    }

    private void rule(String regex, String replacement) {
        rules.add(new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement));
    }
}
