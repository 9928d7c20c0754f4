package com.cloudmusic.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Ramps the sink volume in a fixed number of discrete steps spread over a fixed duration.
 * An interrupted fade jumps straight to its final volume.
 */
public class VolumeFader {
    private static final Logger logger = LoggerFactory.getLogger(VolumeFader.class);

    private final Duration duration;
    private final int steps;
    private final Sleeper sleeper;

    public VolumeFader(Duration duration, int steps, Sleeper sleeper) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be at least 1");
        }
        this.duration = duration;
        this.steps = steps;
        this.sleeper = sleeper;
    }

    public VolumeFader(ResolverConfig config, Sleeper sleeper) {
        this(config.fadeDuration(), config.fadeSteps(), sleeper);
    }

    /**
     * Fades from the current volume to silence. Does nothing when already silent.
     */
    public void fadeOut(AudioSink sink) {
        double start = sink.getVolume();
        if (start <= 0) {
            return;
        }
        ramp(sink, start, 0.0);
    }

    /**
     * Fades from the current volume up to {@code target}.
     */
    public void fadeIn(AudioSink sink, double target) {
        ramp(sink, sink.getVolume(), clamp(target));
    }

    public int steps() {
        return steps;
    }

    private void ramp(AudioSink sink, double from, double to) {
        Duration pause = duration.dividedBy(steps);
        for (int i = 1; i <= steps; i++) {
            sink.setVolume(clamp(from + (to - from) * i / steps));
            if (i == steps) break;
            try {
                sleeper.sleep(pause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("Fade interrupted at step {} of {}", i, steps);
                sink.setVolume(clamp(to));
                return;
            }
        }
    }

    static double clamp(double volume) {
        if (Double.isNaN(volume)) return 0.0;
        return Math.max(0.0, Math.min(1.0, volume));
    }
}
