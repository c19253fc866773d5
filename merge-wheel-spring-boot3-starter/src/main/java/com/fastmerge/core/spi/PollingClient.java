package com.fastmerge.core.spi;

import com.fastmerge.model.ActResult;
import com.fastmerge.model.RawState;

/**
 * 外部系统客户端（如 GitHub PR API）
 * 抛出的任何异常都由引擎记录为瞬时错误, 不会传播给 attempt 调用方
 */
public interface PollingClient {

    /**
     * 拉取资源原始状态
     */
    RawState fetch(String resourceId) throws Exception;

    /**
     * 资源就绪后执行一次终态动作（如合并）
     * 返回 success=false 或抛异常都视为可重试的动作失败
     */
    ActResult act(String resourceId) throws Exception;
}
