package com.fastmerge.model;

import com.fastmerge.model.enums.CompletionReason;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 引擎统计快照, 不可变
 */
@Value
public class EngineStatistics {

    public static final EngineStatistics EMPTY =
            new EngineStatistics(0, 0, 0, Collections.emptyMap());

    long totalResources;

    long successfulResources;

    long totalAttempts;

    Map<CompletionReason, Long> reasonCounts;

    /** 累加一次完成的 attempt, 返回新快照 */
    public EngineStatistics plus(AttemptResult result) {
        Map<CompletionReason, Long> counts = new EnumMap<>(CompletionReason.class);
        counts.putAll(reasonCounts);
        counts.merge(result.getReason(), 1L, Long::sum);
        return new EngineStatistics(
                totalResources + 1,
                successfulResources + (result.isSuccess() ? 1 : 0),
                totalAttempts + result.getAttempts(),
                Collections.unmodifiableMap(counts));
    }

    public long countOf(CompletionReason reason) {
        return reasonCounts.getOrDefault(reason, 0L);
    }

    public double getSuccessRate() {
        return totalResources == 0 ? 0.0 : (double) successfulResources / totalResources;
    }

    public double getAverageAttempts() {
        return totalResources == 0 ? 0.0 : (double) totalAttempts / totalResources;
    }
}
