package com.cipilot.orchestrator.healing;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps CI log text to an {@link ErrorClass} using an ordered pattern table.
 *
 * The table is data: rules are tried top to bottom and the first rule whose
 * pattern occurs anywhere in the log wins. Narrow categories come before the
 * generic "error:" style build failure so that, for example, a TLS handshake
 * timeout is reported as a network problem rather than a plain timeout.
 */
@Component
public class ErrorClassifier {

    record Rule(Pattern pattern, ErrorClass errorClass) {
        static Rule of(String regex, ErrorClass errorClass) {
            return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), errorClass);
        }
    }

    static final List<Rule> RULES = List.of(
            Rule.of("yaml.*error|syntax error|parse error|jobs config should contain"
                    + "|mapping values are not allowed|did not find expected key"
                    + "|jobs:.*config contains unknown keys", ErrorClass.SYNTAX),
            Rule.of("artifact.*not found|no artifacts|no files to upload|no matching files",
                    ErrorClass.ARTIFACT_MISSING),
            Rule.of("manifest unknown|manifest for \\S+ not found|pull access denied"
                    + "|image not found|repository does not exist", ErrorClass.MISSING_IMAGE),
            Rule.of("tls handshake|x509|certificate|ssl_|connection refused|econnrefused"
                    + "|could not resolve host|no route to host|temporary failure in name resolution",
                    ErrorClass.NETWORK_TLS),
            Rule.of("permission denied|eacces|access denied|authentication.*failed|403 forbidden",
                    ErrorClass.PERMISSION),
            Rule.of("timed out|timeout|deadline exceeded", ErrorClass.TIMEOUT),
            Rule.of("command not found|executable file not found|not found in \\$path",
                    ErrorClass.MISSING_COMMAND),
            Rule.of("build failed|build failure|compilation failed|compilation error"
                    + "|failed to compile|npm err!|error:", ErrorClass.BUILD_FAILURE)
    );

    public Classification classify(String logText) {
        if (logText == null || logText.isBlank()) {
            return Classification.unclassified();
        }
        for (Rule rule : RULES) {
            Matcher m = rule.pattern().matcher(logText);
            if (m.find()) {
                return new Classification(rule.errorClass(), lineAround(logText, m.start()));
            }
        }
        return Classification.unclassified();
    }

    private static String lineAround(String text, int index) {
        int start = text.lastIndexOf('\n', index) + 1;
        int end   = text.indexOf('\n', index);
        return text.substring(start, end < 0 ? text.length() : end).strip();
    }
}
