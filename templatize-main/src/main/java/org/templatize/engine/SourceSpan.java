package org.templatize.engine;

/**
 * One-based, inclusive line/column span of a node in the host source.
 */
public record SourceSpan(int beginLine, int beginColumn, int endLine, int endColumn) {

    public SourceSpan {
        if (beginLine < 1 || beginColumn < 1 || endLine < beginLine
                || (endLine == beginLine && endColumn < beginColumn)) {
            throw new IllegalArgumentException("Invalid span " + beginLine + ":" + beginColumn + "-" + endLine + ":" + endColumn);
        }
    }

    @Override
    public String toString() {
        return beginLine + ":" + beginColumn + "-" + endLine + ":" + endColumn;
    }
}
