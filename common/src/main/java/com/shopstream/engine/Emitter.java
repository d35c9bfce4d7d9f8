package com.shopstream.engine;

/**
 * Receives finalised outputs.  May block while the downstream queue is full.
 *
 * @param <O> output type
 */
@FunctionalInterface
public interface Emitter<O> {

    void emit(O output) throws InterruptedException;
}
