package com.wangbin.sentinel.api.controller;

import com.wangbin.sentinel.common.exception.BusinessException;
import com.wangbin.sentinel.common.web.result.ApiResult;
import com.wangbin.sentinel.common.web.result.ResultCode;
import com.wangbin.sentinel.core.analysis.AnalysisOrchestrator;
import com.wangbin.sentinel.core.device.Device;
import com.wangbin.sentinel.core.device.DeviceRoster;
import com.wangbin.sentinel.core.device.DeviceStatus;
import com.wangbin.sentinel.core.device.OfflineDeviceReport;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 设备名册接口
 */
@RestController
@RequestMapping("/api/v2/devices")
@RequiredArgsConstructor
public class DeviceController {

    private final AnalysisOrchestrator orchestrator;

    @GetMapping
    public ApiResult<Map<String, Object>> devices(@RequestParam(required = false) String status) {
        DeviceRoster roster = orchestrator.refreshRoster();

        List<Device> devices;
        if (status == null || status.isBlank()) {
            devices = new ArrayList<>(roster.getDevices());
        } else {
            DeviceStatus wanted = DeviceStatus.fromCode(status);
            if (wanted == null) {
                throw new BusinessException(ResultCode.PARAM_ERROR, "未知的设备状态: " + status, (Object) null);
            }
            devices = roster.byStatus(wanted);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("total", roster.getTotal());
        data.put("online", roster.getOnline());
        data.put("offline", roster.getOffline());
        data.put("unknown", roster.getUnknown());
        data.put("devices", devices);
        return ApiResult.success(data);
    }

    @GetMapping("/offline")
    public ApiResult<OfflineDeviceReport> offline() {
        orchestrator.refreshRoster();
        return ApiResult.success(orchestrator.offlineReport());
    }
}
