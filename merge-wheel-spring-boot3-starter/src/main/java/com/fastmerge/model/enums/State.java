package com.fastmerge.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 资源（PR）的规范化状态
 */
@AllArgsConstructor
@Getter
public enum State {
    CLEAN("可执行终态动作（可合并）"),
    UNSTABLE("暂时未就绪（CI 进行中/失败重跑等），可恢复"),
    UNKNOWN("分类失败或信息不全，按瞬时状态处理"),
    DRAFT("草稿，等待作者处理，按瞬时状态处理"),
    BLOCKED("终态失败（冲突/被阻塞），不会再就绪"),
    CLOSED("终态失败（已关闭）"),
    ALREADY_DONE("终态成功（已合并），无需执行动作")
    ;

    public final String desc;

    /** 可重试的瞬时状态 */
    public boolean isTransient() {
        return this == UNSTABLE || this == UNKNOWN || this == DRAFT;
    }

    /** 不可重试的终态失败 */
    public boolean isTerminalFailure() {
        return this == BLOCKED || this == CLOSED;
    }

    public boolean isReady() {
        return this == CLEAN || this == ALREADY_DONE;
    }
}
