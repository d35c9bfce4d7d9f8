package com.shopstream.config;

/**
 * What the join engine does when keyed state reaches its buffered-fact capacity.
 */
public enum CapacityPolicy {

    /**
     * Treat the overflow as fatal: a permanently stalled source keeps pending joins alive
     * forever, which needs an operator.
     */
    FAIL,

    /**
     * Finalize the pending joins with the earliest deadlines to make room.
     */
    FORCE_FINALIZE_OLDEST
}
