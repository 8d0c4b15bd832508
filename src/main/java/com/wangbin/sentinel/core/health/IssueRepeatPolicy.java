package com.wangbin.sentinel.core.health;

/**
 * 同一问题连续多个周期出现时的处理策略
 */
public enum IssueRepeatPolicy {

    /**
     * 每个周期都重新上报全部问题
     */
    REPEAT,

    /**
     * 与上一周期相同的问题不再上报
     */
    SUPPRESS
}
