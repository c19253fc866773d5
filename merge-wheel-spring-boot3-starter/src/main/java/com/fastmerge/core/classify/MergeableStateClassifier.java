package com.fastmerge.core.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fastmerge.core.spi.StateClassifier;
import com.fastmerge.model.RawState;
import com.fastmerge.model.enums.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;

/**
 * 基于 GitHub PR 字段（merged/state/draft/mergeable/mergeable_state）的优先级分类表
 *
 * 1. merged=true                                   → ALREADY_DONE
 * 2. state=closed                                  → CLOSED
 * 3. draft=true 或 mergeable_state=draft           → DRAFT
 * 4. mergeable_state ∈ {dirty, blocked}            → BLOCKED
 * 5. mergeable=true 且 mergeable_state ∈ {clean, has_hooks} → CLEAN
 * 6. mergeable_state ∈ {unstable, behind, pending} → UNSTABLE
 * 7. 其他（含缺失/类型不符）                        → UNKNOWN
 */
public class MergeableStateClassifier implements StateClassifier {

    private static final Logger log = LoggerFactory.getLogger(MergeableStateClassifier.class);

    public static final String F_MERGED = "merged";
    public static final String F_STATE = "state";
    public static final String F_DRAFT = "draft";
    public static final String F_MERGEABLE = "mergeable";
    public static final String F_MERGEABLE_STATE = "mergeable_state";

    private static final Set<String> BLOCKED = Set.of("dirty", "blocked");
    private static final Set<String> CLEAN = Set.of("clean", "has_hooks");
    private static final Set<String> UNSTABLE = Set.of("unstable", "behind", "pending");

    @Override
    public State classify(RawState raw) {
        if (raw == null || raw.isAbsent()) {
            return State.UNKNOWN;
        }
        try {
            return doClassify(raw);
        } catch (RuntimeException e) {
            // 全函数, 分类过程中的意外按 UNKNOWN 处理
            log.warn("[Classify] unexpected raw state {}, fallback UNKNOWN", raw, e);
            return State.UNKNOWN;
        }
    }

    private State doClassify(RawState raw) {
        if (isTrue(raw.field(F_MERGED))) {
            return State.ALREADY_DONE;
        }
        if ("closed".equals(text(raw.field(F_STATE)))) {
            return State.CLOSED;
        }
        String mergeableState = text(raw.field(F_MERGEABLE_STATE));
        if (isTrue(raw.field(F_DRAFT)) || "draft".equals(mergeableState)) {
            return State.DRAFT;
        }
        if (mergeableState == null) {
            return State.UNKNOWN;
        }
        if (BLOCKED.contains(mergeableState)) {
            return State.BLOCKED;
        }
        if (CLEAN.contains(mergeableState)) {
            // mergeable 可能尚在计算中（null）, 此时不能判定为就绪
            return isTrue(raw.field(F_MERGEABLE)) ? State.CLEAN : State.UNKNOWN;
        }
        if (UNSTABLE.contains(mergeableState)) {
            return State.UNSTABLE;
        }
        return State.UNKNOWN;
    }

    /** 仅接受 JSON boolean true */
    private static boolean isTrue(JsonNode n) {
        return n != null && n.isBoolean() && n.booleanValue();
    }

    /** 仅接受 JSON 字符串, 其余返回 null */
    private static String text(JsonNode n) {
        if (n == null || !n.isTextual()) {
            return null;
        }
        String s = n.textValue().trim().toLowerCase(Locale.ROOT);
        return s.isEmpty() ? null : s;
    }
}
