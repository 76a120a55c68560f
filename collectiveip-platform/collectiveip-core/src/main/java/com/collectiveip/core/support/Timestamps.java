package com.collectiveip.core.support;

import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.ValidationException;

/**
 * Deadline arithmetic on unix-second timestamps.
 */
public final class Timestamps {

    private Timestamps() {}

    /**
     * Returns {@code now + seconds}.
     *
     * @throws ValidationException if the duration is negative or the deadline does not fit in a long
     */
    public static long after(long now, long seconds, String what) {
        if (seconds < 0) {
            throw new ValidationException(ErrorReason.INVALID_DURATION, what + " cannot be negative");
        }
        if (seconds > Long.MAX_VALUE - now) {
            throw new ValidationException(ErrorReason.INVALID_DURATION,
                    what + " of " + seconds + "s overflows the timestamp range");
        }
        return now + seconds;
    }
}
