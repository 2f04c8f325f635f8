package com.tailtracker.cache.service;

import com.tailtracker.cache.spi.DeviceState;
import com.tailtracker.cache.spi.DeviceStateProvider;

/**
 * 由宿主应用主动推送的设备状态
 */
public class StaticDeviceStateProvider implements DeviceStateProvider {

    private volatile DeviceState state;

    public StaticDeviceStateProvider() {
        this(DeviceState.defaults());
    }

    public StaticDeviceStateProvider(DeviceState state) {
        this.state = state;
    }

    @Override
    public DeviceState current() {
        return state;
    }

    public void update(DeviceState newState) {
        if (newState != null) {
            this.state = newState;
        }
    }
}
