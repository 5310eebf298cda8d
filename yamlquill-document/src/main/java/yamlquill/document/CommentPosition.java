package yamlquill.document;

/// Where a comment sits relative to the value it annotates.
public enum CommentPosition {
    ABOVE,
    LINE,
    BELOW,
    STANDALONE
}
