package com.investigator.core.provider;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open time range [start, end).
 */
public record TimeWindow(Instant start, Instant end) {
    
    public TimeWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end are required");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("start must be before end: " + start + " >= " + end);
        }
    }
    
    /**
     * The window of the given length ending at {@code end}.
     */
    public static TimeWindow ending(Instant end, Duration length) {
        return new TimeWindow(end.minus(length), end);
    }
    
    public TimeWindow shiftedBack(Duration offset) {
        return new TimeWindow(start.minus(offset), end.minus(offset));
    }
    
    public Duration length() {
        return Duration.between(start, end);
    }
    
    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
