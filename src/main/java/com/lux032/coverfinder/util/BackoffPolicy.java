package com.lux032.coverfinder.util;

import com.lux032.coverfinder.config.TaggerConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 指数退避 + 随机抖动，上限为 maxDelay
 * delay = base * factor^attempt + uniform(0, jitter)
 */
public class BackoffPolicy {

    private final long baseMillis;
    private final double factor;
    private final long jitterMillis;
    private final long maxDelayMillis;

    public BackoffPolicy(long baseMillis, double factor, long jitterMillis, long maxDelayMillis) {
        this.baseMillis = baseMillis;
        this.factor = factor;
        this.jitterMillis = jitterMillis;
        this.maxDelayMillis = maxDelayMillis;
    }

    public static BackoffPolicy from(TaggerConfig config) {
        return new BackoffPolicy(config.getBackoffBaseMillis(), config.getBackoffFactor(),
            config.getBackoffJitterMillis(), config.getBackoffMaxDelayMillis());
    }

    /**
     * @param attempt 从 0 开始的尝试序号
     */
    public Duration delayFor(int attempt) {
        double exponential = baseMillis * Math.pow(factor, attempt);
        double jitter = jitterMillis > 0 ? ThreadLocalRandom.current().nextDouble(jitterMillis) : 0;
        return cap((long) (exponential + jitter));
    }

    /**
     * 服务端给出的 Retry-After（秒），同样受上限约束
     * @return 无法解析时返回 null
     */
    public Duration fromRetryAfter(String headerValue) {
        if (headerValue == null || headerValue.trim().isEmpty()) {
            return null;
        }
        try {
            double seconds = Double.parseDouble(headerValue.trim());
            if (seconds < 0) {
                return null;
            }
            return cap((long) (seconds * 1000));
        } catch (NumberFormatException e) {
            // HTTP-date 形式不支持，退回指数退避
            return null;
        }
    }

    private Duration cap(long millis) {
        return Duration.ofMillis(Math.min(millis, maxDelayMillis));
    }
}
