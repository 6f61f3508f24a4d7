package com.stocksignal.core.diagnostics;

/**
 * 模块说明：CauseCode（enum）。
 * 主要职责：单个标的/日期处理单元未产出结果或降级时的原因码。
 */
public enum CauseCode {
    NONE,
    NO_BARS,
    HISTORY_SHORT,
    UNDEFINED_INDICATOR,
    EMPTY_JOIN,
    FETCH_FAILED,
    RUNTIME_ERROR
}
