package com.wangbin.sentinel.core.source.wifi;

/**
 * 执行外部命令并返回标准输出。
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @throws com.wangbin.sentinel.common.exception.SourceException 命令失败、超时或被中断
     */
    String run(long timeoutMillis, String... command);
}
