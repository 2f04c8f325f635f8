package com.tailtracker.cache.spi;

/**
 * 设备运行状态快照
 *
 * @param networkType     wifi / cellular / unknown
 * @param batteryLevel    电量（0-1）
 * @param appInBackground 应用是否处于后台
 */
public record DeviceState(
    String networkType,
    boolean connected,
    double batteryLevel,
    boolean charging,
    boolean appInBackground
) {

    public static DeviceState defaults() {
        return new DeviceState("unknown", true, 1.0, false, false);
    }
}
