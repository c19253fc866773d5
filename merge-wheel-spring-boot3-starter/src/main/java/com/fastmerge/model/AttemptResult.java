package com.fastmerge.model;

import com.fastmerge.model.enums.CompletionReason;
import com.fastmerge.model.enums.State;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 一次 attempt 调用的最终结果, 调用方通过 success/reason 判断, 无需捕获异常
 */
@Value
@Builder
public class AttemptResult {

    String resourceId;

    boolean success;

    /** 轮询次数 */
    int attempts;

    State finalState;

    CompletionReason reason;

    String message;

    Duration elapsed;

    /** 本次调用产生的记录 */
    @Singular("record")
    List<AttemptRecord> history;

    /** 最后一次记录的错误 */
    public Optional<Throwable> lastError() {
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).getRawError() != null) {
                return Optional.of(history.get(i).getRawError());
            }
        }
        return Optional.empty();
    }
}
