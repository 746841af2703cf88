package io.maildigest.judge;

public class JudgmentException extends Exception {
    public JudgmentException(String message) {
        super(message);
    }
}
