package com.fastmerge.model;

import com.fastmerge.model.enums.AttemptOutcome;
import com.fastmerge.model.enums.State;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 单次轮询记录, 追加后不可变
 */
@Value
public class AttemptRecord {

    /** 从1开始 */
    int attemptNumber;

    Instant timestamp;

    State observedState;

    /** TransientPollException / TransientActException, 可为 null */
    Throwable rawError;

    /** 仅 RETRYING 时存在 */
    Duration delayApplied;

    AttemptOutcome outcome;

    @Builder
    private AttemptRecord(int attemptNumber, Instant timestamp, State observedState,
                          Throwable rawError, Duration delayApplied, AttemptOutcome outcome) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        this.attemptNumber = attemptNumber;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.observedState = Objects.requireNonNull(observedState, "observedState");
        this.rawError = rawError;
        this.delayApplied = delayApplied;
        this.outcome = Objects.requireNonNull(outcome, "outcome");
    }

    public Optional<Throwable> error() {
        return Optional.ofNullable(rawError);
    }

    public Optional<Duration> delay() {
        return Optional.ofNullable(delayApplied);
    }
}
