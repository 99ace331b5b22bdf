package io.dhtprobe.network;

/**
 * Inclusive subkey range.
 */
public record SubkeyRange(long start, long end) {
    public SubkeyRange {
        if (end < start) {
            throw new IllegalArgumentException("invalid subkey range: " + start + ".." + end);
        }
    }

    public long count() {
        return end - start + 1L;
    }

    public static long totalCount(Iterable<SubkeyRange> ranges) {
        long total = 0L;
        for (SubkeyRange range : ranges) {
            total += range.count();
        }
        return total;
    }
}
