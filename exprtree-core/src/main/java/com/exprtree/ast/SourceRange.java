package com.exprtree.ast;

/**
 * A pair of source locations, both inclusive token starts.
 */
public record SourceRange(SourceLoc start, SourceLoc end) {

    public static final SourceRange INVALID = new SourceRange(SourceLoc.INVALID, SourceLoc.INVALID);

    public SourceRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Range endpoints must not be null; use SourceLoc.INVALID");
        }
    }

    /** A range covering a single token. */
    public SourceRange(SourceLoc loc) {
        this(loc, loc);
    }

    public static SourceRange of(int start, int end) {
        return new SourceRange(SourceLoc.at(start), SourceLoc.at(end));
    }

    public boolean isValid() {
        return start.isValid();
    }

    public boolean isInvalid() {
        return !isValid();
    }

    /**
     * Spans from the first valid start of {@code first} or {@code last}
     * to the last valid end of {@code last} or {@code first}.
     */
    public static SourceRange merge(SourceRange first, SourceRange last) {
        SourceLoc begin = first.start().isValid() ? first.start() : last.start();
        SourceLoc finish = last.end().isValid() ? last.end() : first.end();
        return new SourceRange(begin, finish);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
