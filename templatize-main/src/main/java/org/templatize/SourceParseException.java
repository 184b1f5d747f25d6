package org.templatize;

public class SourceParseException extends TemplatizeException {

    private final String source;
    private final int line;
    private final int column;

    public SourceParseException(String message, String source, int line, int column) {
        super(message);
        this.source = source;
        this.line = line;
        this.column = column;
    }

    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
