package com.mirrorswarm.mirror.stats;

/**
 * A counter thread title does not carry a readable value.
 */
public class CounterFormatException extends RuntimeException {

    public CounterFormatException(String message) {
        super(message);
    }
}
