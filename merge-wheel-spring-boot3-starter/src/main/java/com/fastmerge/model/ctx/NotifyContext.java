package com.fastmerge.model.ctx;

import com.fastmerge.model.enums.NotifyEventType;
import com.fastmerge.model.enums.State;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 通知事件上下文, 由 NotifyContexts 构造
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotifyContext {

    private NotifyEventType type;

    private String nodeId;

    private String resourceId;

    /** 已执行的轮询次数 */
    private Integer attempts;

    /** 所用策略的 maxRetries, ACT_FAILED 时为空 */
    private Integer maxRetries;

    /** 最后观察到的状态 */
    private State state;

    /** CompletionReason 名称或 ACT_FAILED */
    private String reasonCode;

    /** 截断后的错误信息 */
    private String lastError;

    private Instant when;

    /** elapsedMs、success、attemptNumber 等 */
    private Map<String, Object> attributes;
}
