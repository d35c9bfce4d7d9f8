package com.shopstream.sink;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off between the join engine and the sink writer.
 *
 * <p>A record stays <em>unacknowledged</em> from {@link #emit} until the sink writer
 * {@link #ack}s it (written or dead-lettered).  Checkpoints include the unacknowledged
 * records, so an output finalised before a crash is written after the restart even though
 * its inputs lie behind the checkpointed offsets.</p>
 *
 * <p>{@link #emit} blocks while the queue is full, which slows the evaluation loop down to
 * the sink's pace.</p>
 */
@Slf4j
public class OutputChannel<O extends SinkDocument> {

    private final BlockingQueue<O> queue;
    private final Map<String, O> unacked = new ConcurrentHashMap<>();

    public OutputChannel(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public void emit(O record) throws InterruptedException {
        unacked.put(record.getDocumentId(), record);
        queue.put(record);
    }

    /**
     * Takes the next record, waiting up to {@code timeoutMs}.
     *
     * @return the record, or {@code null} on timeout
     */
    public O poll(long timeoutMs) throws InterruptedException {
        return queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Marks {@code record} as durably handled.  A newer version emitted under the same id
     * in the meantime stays unacknowledged.
     */
    public void ack(O record) {
        unacked.remove(record.getDocumentId(), record);
    }

    /**
     * Copy of every record emitted but not yet acknowledged.
     */
    public List<O> unacked() {
        return new ArrayList<>(unacked.values());
    }

    /**
     * Re-emits records recovered from a checkpoint.
     */
    public void requeue(Collection<O> records) throws InterruptedException {
        for (O record : records) {
            emit(record);
        }
        if (!records.isEmpty()) {
            log.info("Re-queued {} unacknowledged outputs from checkpoint", records.size());
        }
    }

    public int queued() {
        return queue.size();
    }

    public int unackedCount() {
        return unacked.size();
    }

    public boolean isDrained() {
        return queue.isEmpty() && unacked.isEmpty();
    }
}
