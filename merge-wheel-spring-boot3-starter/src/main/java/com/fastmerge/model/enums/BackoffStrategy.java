package com.fastmerge.model.enums;

import java.util.Locale;

/**
 * 退避策略（YAML 中大小写均可）
 */
public enum BackoffStrategy {
    FIXED, LINEAR, EXPONENTIAL_BACKOFF;

    public static BackoffStrategy from(String v) {
        return BackoffStrategy.valueOf(v.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
