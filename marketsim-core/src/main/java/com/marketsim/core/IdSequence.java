package com.marketsim.core;

/**
 * Per-symbol id generator. Ids carry the symbol index in their high bits,
 * so every symbol can number its orders and fills independently (and
 * deterministically, even when symbols tick on different threads) while ids
 * stay unique across the whole simulation.
 *
 * <pre>
 *   63        40 39                                  0
 *   +-----------+------------------------------------+
 *   | index + 1 |            sequence (from 1)       |
 *   +-----------+------------------------------------+
 * </pre>
 */
public final class IdSequence {

    static final int TAG_SHIFT = 40;
    private static final long SEQUENCE_MASK = (1L << TAG_SHIFT) - 1;
    private static final int MAX_SYMBOLS = (1 << (63 - TAG_SHIFT)) - 1;

    private final long tag;
    private long sequence;

    public IdSequence(int symbolIndex) {
        if (symbolIndex < 0 || symbolIndex >= MAX_SYMBOLS) {
            throw new IllegalArgumentException("symbolIndex out of range: " + symbolIndex);
        }
        this.tag = ((long) symbolIndex + 1) << TAG_SHIFT;
    }

    public long next() {
        return tag | (++sequence & SEQUENCE_MASK);
    }

    public long last() {
        return sequence == 0 ? 0 : tag | sequence;
    }

    /**
     * @return the symbol index encoded in {@code id}, or -1 if it carries none
     */
    public static int symbolIndexOf(long id) {
        if (id <= 0) {
            return -1;
        }
        return (int) (id >>> TAG_SHIFT) - 1;
    }
}
