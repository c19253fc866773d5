package com.fastmerge.model;

import lombok.Value;

/**
 * 终态动作（如合并）结果
 */
@Value
public class ActResult {

    boolean success;

    /** 例如合并提交 sha 或拒绝原因 */
    String message;

    public static ActResult success(String message) {
        return new ActResult(true, message);
    }

    public static ActResult rejected(String message) {
        return new ActResult(false, message);
    }
}
