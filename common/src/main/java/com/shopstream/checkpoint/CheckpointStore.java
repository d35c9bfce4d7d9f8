package com.shopstream.checkpoint;

import java.io.IOException;
import java.util.List;
import java.util.OptionalLong;

/**
 * Durable storage for checkpoint payloads: immutable versions plus one pointer to the
 * latest complete version.
 */
public interface CheckpointStore {

    /**
     * Stores {@code payload} as {@code version} and then moves the latest pointer to it.
     * A failure at any step leaves the previous latest version in place.
     */
    void write(long version, byte[] payload) throws IOException;

    /**
     * Version named by the latest pointer, if one has been published.
     */
    OptionalLong latestVersion() throws IOException;

    /**
     * Every stored version, newest first.
     */
    List<Long> listVersions() throws IOException;

    byte[] read(long version) throws IOException;

    void delete(long version) throws IOException;
}
