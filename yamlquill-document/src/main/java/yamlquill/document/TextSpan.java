package yamlquill.document;

/// Character range of a node's text in the original source, end exclusive.
public record TextSpan(int start, int end) {

    public TextSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    /// {@return true if this span can be cut out of `source`}
    public boolean fitsWithin(String source) {
        return source != null && end <= source.length();
    }

    public String slice(String source) {
        return source.substring(start, end);
    }
}
