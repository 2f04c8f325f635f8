package com.tailtracker.cache.telemetry;

import com.tailtracker.cache.constant.CacheConstants;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * 最小二乘线性趋势外推
 */
public final class TrendForecaster {

    /** 生成预测所需的最少数据点 */
    static final int MIN_POINTS = 3;

    private TrendForecaster() {}

    /**
     * 对序列做 OLS 拟合并向前外推
     * x 取下标 0..n-1，结果为 intercept + slope * (n - 1 + steps)
     *
     * @param values 指标序列（调用方负责截取最近窗口）
     * @param steps  向前步数
     */
    public static double forecast(double[] values, int steps) {
        int n = values.length;
        if (n < 2) {
            return n == 1 ? values[0] : 0;
        }
        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumXX = 0;
        for (int i = 0; i < n; i++) {
            sumX += i;
            sumY += values[i];
            sumXY += i * values[i];
            sumXX += (double) i * i;
        }
        double slope = (n * sumXY - sumX * sumY) / (n * sumXX - sumX * sumX);
        double intercept = (sumY - slope * sumX) / n;
        return intercept + slope * (n - 1 + steps);
    }

    /**
     * 基于最近 5 个快照预测未来 3 步的命中率、内存使用率与响应时间
     * 少于 3 个快照时返回空列表
     */
    public static List<CacheMetrics> predict(List<CacheMetrics> history) {
        if (history.size() < MIN_POINTS) {
            return new ArrayList<>();
        }
        List<CacheMetrics> recent = history.subList(
            Math.max(0, history.size() - CacheConstants.FORECAST_WINDOW), history.size());
        double[] hitRatios = series(recent, CacheMetrics::getHitRatio);
        double[] utilizations = series(recent, CacheMetrics::getMemoryUtilization);
        double[] responseTimes = series(recent, CacheMetrics::getTotalResponseTime);

        List<CacheMetrics> predictions = new ArrayList<>(CacheConstants.FORECAST_STEPS);
        for (int step = 1; step <= CacheConstants.FORECAST_STEPS; step++) {
            CacheMetrics prediction = new CacheMetrics();
            prediction.setHitRatio(forecast(hitRatios, step));
            prediction.setMemoryUtilization(forecast(utilizations, step));
            prediction.setTotalResponseTime(forecast(responseTimes, step));
            predictions.add(prediction);
        }
        return predictions;
    }

    private static double[] series(List<CacheMetrics> metrics, ToDoubleFunction<CacheMetrics> extractor) {
        return metrics.stream().mapToDouble(extractor).toArray();
    }
}
