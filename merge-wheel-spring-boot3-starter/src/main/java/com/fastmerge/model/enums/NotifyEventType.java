package com.fastmerge.model.enums;

/**
 * 通知事件
 */
public enum NotifyEventType {
    /** 终态动作成功 */
    MERGED,

    /** 资源已完成, 未执行动作 */
    ALREADY_MERGED,

    /** 终态失败状态 */
    TERMINAL_STATE,

    /** 达到最大重试 */
    RETRIES_EXHAUSTED,

    /** 超过截止时间 */
    TIMEOUT,

    /** 调用方取消 */
    CANCELLED,

    /** 终态动作失败（会继续重试） */
    ACT_FAILED
}
