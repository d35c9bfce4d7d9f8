package com.shopstream.checkpoint;

/**
 * A checkpoint could not be persisted within its write attempts.  The previous checkpoint
 * remains the one a restart resumes from.
 */
public class CheckpointWriteFailedException extends RuntimeException {

    public CheckpointWriteFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
