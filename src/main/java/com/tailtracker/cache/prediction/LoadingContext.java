package com.tailtracker.cache.prediction;

/**
 * 加载上下文快照
 * 字段为 null 表示未提供，相似度计算只比较双方都提供的字段
 *
 * @param timeOfDay 小时（0-23）
 * @param dayOfWeek 星期（0 = 周日）
 */
public record LoadingContext(
    String route,
    String userId,
    Long timestamp,
    String networkType,
    Double batteryLevel,
    Boolean charging,
    Integer timeOfDay,
    Integer dayOfWeek,
    String appVersion
) {

    public static LoadingContext empty() {
        return new LoadingContext(null, null, null, null, null, null, null, null, null);
    }

    public static LoadingContext ofRoute(String route) {
        return empty().withRoute(route);
    }

    public LoadingContext withRoute(String newRoute) {
        return new LoadingContext(newRoute, userId, timestamp, networkType, batteryLevel, charging,
            timeOfDay, dayOfWeek, appVersion);
    }

    public LoadingContext withUserId(String newUserId) {
        return new LoadingContext(route, newUserId, timestamp, networkType, batteryLevel, charging,
            timeOfDay, dayOfWeek, appVersion);
    }

    public LoadingContext withTimestamp(Long newTimestamp) {
        return new LoadingContext(route, userId, newTimestamp, networkType, batteryLevel, charging,
            timeOfDay, dayOfWeek, appVersion);
    }

    public LoadingContext withNetwork(String newNetworkType) {
        return new LoadingContext(route, userId, timestamp, newNetworkType, batteryLevel, charging,
            timeOfDay, dayOfWeek, appVersion);
    }

    public LoadingContext withBattery(Double newBatteryLevel, Boolean newCharging) {
        return new LoadingContext(route, userId, timestamp, networkType, newBatteryLevel, newCharging,
            timeOfDay, dayOfWeek, appVersion);
    }

    public LoadingContext withTime(Integer newTimeOfDay, Integer newDayOfWeek) {
        return new LoadingContext(route, userId, timestamp, networkType, batteryLevel, charging,
            newTimeOfDay, newDayOfWeek, appVersion);
    }

    /**
     * 用 update 中非 null 字段覆盖当前字段
     */
    public LoadingContext merge(LoadingContext update) {
        if (update == null) {
            return this;
        }
        return new LoadingContext(
            update.route != null ? update.route : route,
            update.userId != null ? update.userId : userId,
            update.timestamp != null ? update.timestamp : timestamp,
            update.networkType != null ? update.networkType : networkType,
            update.batteryLevel != null ? update.batteryLevel : batteryLevel,
            update.charging != null ? update.charging : charging,
            update.timeOfDay != null ? update.timeOfDay : timeOfDay,
            update.dayOfWeek != null ? update.dayOfWeek : dayOfWeek,
            update.appVersion != null ? update.appVersion : appVersion);
    }

    public double batteryOrFull() {
        return batteryLevel != null ? batteryLevel : 1.0;
    }

    public boolean chargingOrFalse() {
        return Boolean.TRUE.equals(charging);
    }

    /**
     * 与当前上下文的相似度（0-1）
     * 时段按 12 小时线性衰减，星期 / 网络 / 路由精确匹配
     */
    public double similarityTo(LoadingContext current) {
        double similarity = 0;
        int factors = 0;
        if (timeOfDay != null && current.timeOfDay != null) {
            int diff = Math.abs(timeOfDay - current.timeOfDay);
            similarity += Math.max(0, 1 - diff / 12.0);
            factors++;
        }
        if (dayOfWeek != null) {
            similarity += dayOfWeek.equals(current.dayOfWeek) ? 1 : 0;
            factors++;
        }
        if (networkType != null) {
            similarity += networkType.equals(current.networkType) ? 1 : 0;
            factors++;
        }
        if (route != null) {
            similarity += route.equals(current.route) ? 1 : 0;
            factors++;
        }
        return factors > 0 ? similarity / factors : 0;
    }
}
