package io.histingest.core;

import java.util.List;

/**
 * Ordered group of records pulled together from a source. Sequence numbers start at 0
 * and increase by one within a job.
 */
public final class Chunk<T> {
    private final long seq;
    private final List<T> records;

    public Chunk(long seq, List<T> records) {
        if (seq < 0) throw new IllegalArgumentException("seq must be >= 0");
        this.seq = seq;
        this.records = List.copyOf(records);
    }

    public long seq() { return seq; }
    public List<T> records() { return records; }
    public int size() { return records.size(); }
    public boolean isEmpty() { return records.isEmpty(); }

    @Override
    public String toString() {
        return "Chunk{seq=" + seq + ", size=" + records.size() + "}";
    }
}
