package com.fastmerge.model.enums;

/**
 * 单次尝试的结果
 */
public enum AttemptOutcome {
    /** 瞬时状态, 退避后重试 */
    RETRYING,

    /** 动作成功或资源已完成 */
    SUCCEEDED,

    /** 终态失败(BLOCKED/CLOSED), 不消耗重试预算 */
    FAILED_TERMINAL,

    /** 达到最大重试次数 */
    FAILED_EXHAUSTED,

    /** 下一次退避将越过截止时间 */
    FAILED_TIMEOUT,

    /** 调用方取消 */
    CANCELLED;

    public boolean isFinal() {
        return this != RETRYING;
    }
}
