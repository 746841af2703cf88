package io.maildigest.judge;

import java.util.Optional;

/**
 * External importance judge. Returns free-form text expected to hold a JSON
 * array of verdicts, or empty when it produced nothing.
 */
@FunctionalInterface
public interface JudgmentEngine {
    Optional<String> judge(String prompt, long timeoutMs) throws JudgmentException;
}
