package yamlquill.document;

/// How a string scalar is written. Affects output only, never content equality.
public enum StringStyle {
    /// Plain or quoted flow scalar
    PLAIN,
    /// `|` block scalar, line breaks kept
    LITERAL,
    /// `>` block scalar, line breaks folded
    FOLDED
}
