package yamlquill.yamlpath;

import java.util.Objects;

/// Exception thrown when a YAMLPath expression cannot be parsed.
/// The typed reason is available from [#error()].
public class YamlPathParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient YamlPathError error;
    private final int position;
    private final String path;

    /// Creates a new parse exception with position information.
    public YamlPathParseException(YamlPathError error, String path, int position) {
        super(formatMessage(Objects.requireNonNull(error, "error must not be null").message(), path, position));
        this.error = error;
        this.position = position;
        this.path = path;
    }

    public YamlPathError error() {
        return error;
    }

    /// Returns the position in the path where the error occurred, or -1 if unknown.
    public int position() {
        return position;
    }

    /// Returns the path that was being parsed, or null if unknown.
    public String path() {
        return path;
    }

    private static String formatMessage(String message, String path, int position) {
        if (path == null || position < 0) {
            return message;
        }
        final var sb = new StringBuilder();
        sb.append(message);
        sb.append(" in path: ").append(path);
        if (position < path.length()) {
            sb.append(" (near '").append(path.charAt(position)).append("')");
        }
        return sb.toString();
    }
}
