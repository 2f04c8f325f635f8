package com.tailtracker.cache.orchestrator;

import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 读取选项
 *
 * @param fallback           所有层未命中时的回源，可为 null
 * @param validate           缓存值校验，不通过视为未命中并删除，可为 null
 * @param cancellationSignal 可为 null
 * @param type               期望的值类型，缓存值类型不符视为未命中，可为 null
 */
public record GetOptions<T>(
    CacheStrategy strategy,
    Supplier<? extends T> fallback,
    Predicate<? super T> validate,
    CancellationSignal cancellationSignal,
    Class<T> type
) {

    public GetOptions {
        if (strategy == null) {
            strategy = CacheStrategy.auto();
        }
    }

    public static <T> GetOptions<T> defaults() {
        return new GetOptions<>(CacheStrategy.auto(), null, null, null, null);
    }

    public static <T> GetOptions<T> withFallback(Supplier<? extends T> fallback) {
        return new GetOptions<>(CacheStrategy.auto(), fallback, null, null, null);
    }

    public GetOptions<T> strategy(CacheStrategy newStrategy) {
        return new GetOptions<>(newStrategy, fallback, validate, cancellationSignal, type);
    }

    public GetOptions<T> ttl(long ttlMs) {
        return new GetOptions<>(strategy.withTtl(ttlMs), fallback, validate, cancellationSignal, type);
    }

    public GetOptions<T> validate(Predicate<? super T> newValidate) {
        return new GetOptions<>(strategy, fallback, newValidate, cancellationSignal, type);
    }

    public GetOptions<T> cancellation(CancellationSignal signal) {
        return new GetOptions<>(strategy, fallback, validate, signal, type);
    }

    public GetOptions<T> expecting(Class<T> expectedType) {
        return new GetOptions<>(strategy, fallback, validate, cancellationSignal, expectedType);
    }

    boolean isCancelled() {
        return cancellationSignal != null && cancellationSignal.isCancelled();
    }
}
