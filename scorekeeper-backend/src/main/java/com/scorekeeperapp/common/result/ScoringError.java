package com.scorekeeperapp.common.result;

import java.util.Map;

public record ScoringError(ErrorCode code, String message, Map<String, Object> details) {

    public ScoringError {
        if (code == null) throw new IllegalArgumentException("code is required");
        if (message == null || message.isBlank()) throw new IllegalArgumentException("message is required");
        details = (details == null) ? Map.of() : Map.copyOf(details);
    }

    public ScoringError(ErrorCode code, String message) {
        this(code, message, Map.of());
    }

    public ErrorKind kind() {
        return code.kind();
    }
}
