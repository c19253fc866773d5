package com.fastmerge.core.spi;

import com.fastmerge.model.AttemptRecord;

import java.util.List;

/**
 * 按资源隔离的只追加尝试日志
 */
public interface HistoryStore {

    void append(String resourceId, AttemptRecord record);

    /** 返回按追加顺序排列的副本, 不存在返回空列表 */
    List<AttemptRecord> get(String resourceId);
}
