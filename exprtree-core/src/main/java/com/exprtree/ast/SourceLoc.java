package com.exprtree.ast;

/**
 * An opaque byte offset into the source buffer.
 */
public record SourceLoc(int offset) {

    /** Location of compiler-synthesized syntax. */
    public static final SourceLoc INVALID = new SourceLoc(-1);

    public SourceLoc {
        if (offset < -1) {
            throw new IllegalArgumentException("Bad source offset: " + offset);
        }
    }

    public static SourceLoc at(int offset) {
        return new SourceLoc(offset);
    }

    public boolean isValid() {
        return offset >= 0;
    }

    public boolean isInvalid() {
        return !isValid();
    }

    @Override
    public String toString() {
        return isValid() ? Integer.toString(offset) : "<invalid loc>";
    }
}
