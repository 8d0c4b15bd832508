package com.wangbin.sentinel.core.analysis;

import com.wangbin.sentinel.common.exception.BusinessException;
import com.wangbin.sentinel.common.web.result.ResultCode;

/**
 * 分析周期在写入历史前被中断，本周期放弃，历史保持不变。
 */
public class CycleInterruptedException extends BusinessException {

    public CycleInterruptedException(String message) {
        super(ResultCode.SERVICE_UNAVAILABLE, message, (Object) null);
    }
}
