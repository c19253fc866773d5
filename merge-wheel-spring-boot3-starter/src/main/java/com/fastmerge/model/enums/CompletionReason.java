package com.fastmerge.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * attempt 调用的最终原因, 调用方据此区分告警/稍后重新入队等处理
 */
@AllArgsConstructor
@Getter
public enum CompletionReason {
    MERGED(true, AttemptOutcome.SUCCEEDED, "terminal action succeeded"),
    ALREADY_DONE(true, AttemptOutcome.SUCCEEDED, "resource already done"),
    TERMINAL_STATE(false, AttemptOutcome.FAILED_TERMINAL, "resource reached a terminal failure state"),
    RETRIES_EXHAUSTED(false, AttemptOutcome.FAILED_EXHAUSTED, "max retries reached in a transient state"),
    TIMEOUT_EXCEEDED(false, AttemptOutcome.FAILED_TIMEOUT, "next backoff would exceed the deadline"),
    CANCELLED(false, AttemptOutcome.CANCELLED, "cancelled by caller")
    ;

    public final boolean success;
    public final AttemptOutcome outcome;
    public final String desc;
}
