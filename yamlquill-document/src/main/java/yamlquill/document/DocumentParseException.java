package yamlquill.document;

/// Thrown when document text is not well-formed.
/// Line and column are 1-based; the offset is the 0-based character index.
public class DocumentParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;
    private final int offset;

    public DocumentParseException(String message, int line, int column, int offset) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public int offset() {
        return offset;
    }
}
