package com.fastmerge.core.stats;

import com.fastmerge.model.AttemptResult;
import com.fastmerge.model.EngineStatistics;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 进程级统计, 每个完成的 attempt 调用恰好记录一次
 * 以不可变快照整体替换, 读取不会看到部分更新
 */
public class StatisticsAggregator {

    private final AtomicReference<EngineStatistics> current = new AtomicReference<>(EngineStatistics.EMPTY);

    public void record(AttemptResult result) {
        current.updateAndGet(s -> s.plus(result));
    }

    public EngineStatistics snapshot() {
        return current.get();
    }

    public void reset() {
        current.set(EngineStatistics.EMPTY);
    }
}
