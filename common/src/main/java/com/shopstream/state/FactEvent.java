package com.shopstream.state;

/**
 * An immutable, append-only occurrence that carries its own event time.
 */
public interface FactEvent {

    /** Event time in epoch milliseconds. */
    long getEventTime();
}
