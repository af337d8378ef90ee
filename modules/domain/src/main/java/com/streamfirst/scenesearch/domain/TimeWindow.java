package com.streamfirst.scenesearch.domain;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Closed acquisition time interval.
 *
 * @param start first instant of the window
 * @param stop last instant of the window, never before {@code start}
 */
public record TimeWindow(LocalDateTime start, LocalDateTime stop) {

    public TimeWindow {
        Objects.requireNonNull(start, "Window start cannot be null");
        Objects.requireNonNull(stop, "Window stop cannot be null");
        if (stop.isBefore(start)) {
            throw new ConfigurationException("window stop " + stop + " precedes start " + start);
        }
    }

    public static TimeWindow of(LocalDateTime start, LocalDateTime stop) {
        return new TimeWindow(start, stop);
    }

    /** Widens the window on both ends, {@code (start - buffer, stop + buffer)}. */
    public TimeWindow buffered(Duration buffer) {
        return padded(buffer, buffer);
    }

    public TimeWindow buffered(int seconds) {
        return buffered(Duration.ofSeconds(seconds));
    }

    /** Moves start back by {@code before} and stop forward by {@code after}. */
    public TimeWindow padded(Duration before, Duration after) {
        return new TimeWindow(start.minus(before), stop.plus(after));
    }

    public boolean contains(LocalDateTime time) {
        return !time.isBefore(start) && !time.isAfter(stop);
    }
}
