package io.groupstream.core.model;

/**
 * Sequence token layout: [partition:20 bits][offset:44 bits]
 * - partition supports ~1 million partitions per derived log.
 * - offset supports ~1.7e13 records per partition.
 * <p>
 * Tokens travel as unsigned decimal strings on the wire.
 */
public final class SequenceToken {
    private static final long OFFSET_MASK = (1L << 44) - 1;
    private static final long PARTITION_MASK = (1L << 20) - 1;

    private SequenceToken() {}

    public static long encode(final int partition, final long offset) {
        if ((partition & PARTITION_MASK) != partition) {
            throw new IllegalArgumentException("partition out of range (must fit 20 bits): " + partition);
        }
        if ((offset & OFFSET_MASK) != offset) {
            throw new IllegalArgumentException("offset out of range (must fit 44 bits): " + offset);
        }
        return ((long) partition << 44) | (offset & OFFSET_MASK);
    }

    public static int partition(final long token) {
        return (int) ((token >>> 44) & PARTITION_MASK);
    }

    public static long offset(final long token) {
        return token & OFFSET_MASK;
    }

    public static String format(final long token) {
        return Long.toUnsignedString(token);
    }

    /**
     * @throws IllegalArgumentException if {@code text} is not a decimal token
     */
    public static long parse(final String text) {
        try {
            return Long.parseUnsignedLong(text.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("malformed sequence token: " + text, e);
        }
    }
}
