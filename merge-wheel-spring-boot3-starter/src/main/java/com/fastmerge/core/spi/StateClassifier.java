package com.fastmerge.core.spi;

import com.fastmerge.model.RawState;
import com.fastmerge.model.enums.State;

/**
 * 状态分类器
 * 必须是全函数：任何输入（含 null）都映射到唯一 State, 不抛异常
 */
public interface StateClassifier {

    State classify(RawState raw);
}
