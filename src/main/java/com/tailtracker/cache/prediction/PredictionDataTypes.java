package com.tailtracker.cache.prediction;

import java.util.Map;

/**
 * 用户行为到预取数据类型的映射，以及各数据类型的基准大小
 */
public final class PredictionDataTypes {

    private static final Map<String, String> ACTION_TO_DATA_TYPE = Map.of(
        "view_pet_profile", "pet_profile_data",
        "view_health_records", "health_records_data",
        "view_photos", "photo_gallery_data",
        "view_family", "family_coordination_data",
        "view_reminders", "care_reminders_data",
        "view_lost_pets", "lost_pet_alerts_data"
    );

    private static final Map<String, Long> BASE_SIZES = Map.of(
        "pet_profile_data", 2048L,
        "health_records_data", 4096L,
        "photo_gallery_data", 51_200L,
        "family_coordination_data", 1024L,
        "care_reminders_data", 2048L,
        "lost_pet_alerts_data", 3072L
    );

    private static final long DEFAULT_BASE_SIZE = 1024L;

    private PredictionDataTypes() {}

    /**
     * @return 数据类型，未登记的行为返回 null
     */
    public static String dataTypeFor(String action) {
        return action != null ? ACTION_TO_DATA_TYPE.get(action) : null;
    }

    public static long baseSizeOf(String dataType) {
        return BASE_SIZES.getOrDefault(dataType, DEFAULT_BASE_SIZE);
    }
}
