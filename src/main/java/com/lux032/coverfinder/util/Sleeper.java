package com.lux032.coverfinder.util;

import java.time.Duration;

/**
 * 重试等待
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
