package com.cloudmusic.resolver;

import java.time.Duration;

/**
 * Blocking pause between fade steps; replaced by a no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
