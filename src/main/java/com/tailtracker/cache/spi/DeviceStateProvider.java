package com.tailtracker.cache.spi;

/**
 * 设备状态来源（网络、电量、前后台）
 */
public interface DeviceStateProvider {

    DeviceState current();
}
