package com.shopstream.checkpoint;

/**
 * A checkpoint payload failed its header, length or checksum check, or its body could not
 * be read back.
 */
public class CheckpointCorruptException extends RuntimeException {

    public CheckpointCorruptException(String message) {
        super(message);
    }

    public CheckpointCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
