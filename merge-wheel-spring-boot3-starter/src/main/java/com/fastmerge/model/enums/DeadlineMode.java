package com.fastmerge.model.enums;

/**
 * 截止时间锚点
 */
public enum DeadlineMode {
    /** 单一截止时间, 锚定首次轮询 */
    GLOBAL,

    /** 分类状态变化时重置锚点 */
    RESET_ON_STATE_CHANGE
}
