package com.exprtree.arena;

/**
 * Storage shape of one node variant: the fixed header and its alignment.
 *
 * <p>Sizes follow a 64-bit model: 8 bytes per reference, 4 bytes per source
 * location or scalar, and a common 16-byte base (kind tag plus type slot).</p>
 */
public record NodeLayout(long headerSize, int alignment) {

    public static final int BASE_SIZE = 16;
    public static final int REFERENCE_SIZE = 8;
    public static final int LOCATION_SIZE = 4;
    public static final int SCALAR_SIZE = 4;
    public static final int NODE_ALIGNMENT = 8;

    public NodeLayout {
        if (headerSize < BASE_SIZE) {
            throw new IllegalArgumentException("Header smaller than node base: " + headerSize);
        }
        if (Integer.bitCount(alignment) != 1) {
            throw new IllegalArgumentException("Alignment must be a power of two: " + alignment);
        }
    }

    /**
     * Layout of a node with the given field counts on top of the common base.
     */
    public static NodeLayout of(int references, int locations, int scalars) {
        long raw = BASE_SIZE
            + (long) references * REFERENCE_SIZE
            + (long) locations * LOCATION_SIZE
            + (long) scalars * SCALAR_SIZE;
        return new NodeLayout(alignUp(raw, NODE_ALIGNMENT), NODE_ALIGNMENT);
    }

    /**
     * Size of a node carrying {@code count} trailing elements of {@code elementSize} bytes.
     */
    public long sizeWithTrailing(int count, long elementSize) {
        if (count < 0) {
            throw new IllegalArgumentException("Negative trailing count: " + count);
        }
        return headerSize + count * elementSize;
    }

    public static long alignUp(long value, int alignment) {
        long mask = alignment - 1L;
        return (value + mask) & ~mask;
    }
}
