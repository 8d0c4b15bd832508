package com.wangbin.sentinel.core.source;

import com.wangbin.sentinel.core.wifi.WifiNetworkObservation;

import java.util.List;

/**
 * 周边无线网络观测数据源，用于信道拥堵评分。
 */
@FunctionalInterface
public interface WifiObservationSource {

    List<WifiNetworkObservation> observe();
}
