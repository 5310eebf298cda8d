package yamlquill.document;

/// Text dialects the serializer can write.
public enum DocumentFormat {
    /// JSON text; a multi-document root is written as JSON Lines
    JSON,
    /// Block-style YAML
    YAML
}
