package com.fastmerge.core.history;

import com.fastmerge.core.spi.HistoryStore;
import com.fastmerge.model.AttemptRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内历史, 生命周期与进程一致
 * compute 保证同一 resourceId 的追加/读取原子, 不同 resourceId 互不影响
 */
public class InMemoryHistoryStore implements HistoryStore {

    private final ConcurrentHashMap<String, List<AttemptRecord>> history = new ConcurrentHashMap<>();

    @Override
    public void append(String resourceId, AttemptRecord record) {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(record, "record");
        history.compute(resourceId, (k, list) -> {
            List<AttemptRecord> l = list == null ? new ArrayList<>() : list;
            l.add(record);
            return l;
        });
    }

    @Override
    public List<AttemptRecord> get(String resourceId) {
        List<AttemptRecord> snapshot = new ArrayList<>();
        history.computeIfPresent(resourceId, (k, list) -> {
            snapshot.addAll(list);
            return list;
        });
        return List.copyOf(snapshot);
    }

    /** 已记录的资源 */
    public Set<String> resourceIds() {
        return Set.copyOf(history.keySet());
    }
}
