package com.shopstream.state;

/**
 * The store already holds its configured maximum of buffered facts.  Usually a sign that a
 * stalled source keeps the watermark, and with it every pending join, frozen.
 */
public class StateStoreCapacityExceededException extends RuntimeException {

    private final int capacity;

    public StateStoreCapacityExceededException(String buffer, int capacity) {
        super("Cannot buffer into '" + buffer + "': state store holds its maximum of "
                + capacity + " facts");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
