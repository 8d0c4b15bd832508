package com.wangbin.sentinel.core.device;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 以 IP 为键的设备名册。统计数字在构造时由设备表计算，始终与设备表一致。
 */
@Getter
public final class DeviceRoster {

    private static final DeviceRoster EMPTY = new DeviceRoster(Collections.emptyMap());

    @JsonIgnore
    private final Map<String, Device> devicesByIp;
    private final int total;
    private final int online;
    private final int offline;
    private final int unknown;

    public DeviceRoster(Map<String, Device> devices) {
        this.devicesByIp = Collections.unmodifiableMap(new LinkedHashMap<>(devices));
        Map<DeviceStatus, Integer> counts = new EnumMap<>(DeviceStatus.class);
        for (Device device : this.devicesByIp.values()) {
            counts.merge(device.getStatus(), 1, Integer::sum);
        }
        this.total = this.devicesByIp.size();
        this.online = counts.getOrDefault(DeviceStatus.ONLINE, 0);
        this.offline = counts.getOrDefault(DeviceStatus.OFFLINE, 0);
        this.unknown = counts.getOrDefault(DeviceStatus.UNKNOWN, 0);
    }

    public static DeviceRoster empty() {
        return EMPTY;
    }

    public Collection<Device> getDevices() {
        return devicesByIp.values();
    }

    public Optional<Device> find(String ip) {
        return Optional.ofNullable(ip).map(devicesByIp::get);
    }

    public List<Device> byStatus(DeviceStatus status) {
        return devicesByIp.values().stream()
                .filter(device -> device.getStatus() == status)
                .collect(Collectors.toUnmodifiableList());
    }

    public List<String> offlineIps() {
        return byStatus(DeviceStatus.OFFLINE).stream()
                .map(Device::getIp)
                .collect(Collectors.toUnmodifiableList());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return devicesByIp.isEmpty();
    }
}
