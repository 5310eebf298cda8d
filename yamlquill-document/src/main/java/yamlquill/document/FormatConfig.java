package yamlquill.document;

import java.util.Objects;
import java.util.Properties;

/// Settings that control how documents are written back to disk.
///
/// @param indentSize spaces per nesting level in canonical output
/// @param preserveFormatting copy source text for untouched nodes instead of re-rendering
/// @param createBackup copy the existing file to `name.bak` before overwriting
/// @param compactWidth widest single-line rendering allowed for a container of scalars
public record FormatConfig(int indentSize, boolean preserveFormatting, boolean createBackup, int compactWidth) {

    public static final String INDENT_SIZE = "yamlquill.indentSize";
    public static final String PRESERVE_FORMATTING = "yamlquill.preserveFormatting";
    public static final String CREATE_BACKUP = "yamlquill.createBackup";
    public static final String COMPACT_WIDTH = "yamlquill.compactWidth";

    public FormatConfig {
        if (indentSize < 1) {
            throw new IllegalArgumentException("indentSize must be >= 1");
        }
        if (compactWidth < 0) {
            throw new IllegalArgumentException("compactWidth must be >= 0");
        }
    }

    public static FormatConfig defaults() {
        return new FormatConfig(2, true, false, 80);
    }

    /// Reads `yamlquill.*` keys, falling back to [#defaults()] for any key
    /// that is missing.
    /// @throws IllegalArgumentException when a value is present but not a valid number
    public static FormatConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        final var base = defaults();
        return new FormatConfig(
                intProperty(properties, INDENT_SIZE, base.indentSize),
                boolProperty(properties, PRESERVE_FORMATTING, base.preserveFormatting),
                boolProperty(properties, CREATE_BACKUP, base.createBackup),
                intProperty(properties, COMPACT_WIDTH, base.compactWidth));
    }

    public FormatConfig withIndentSize(int indentSize) {
        return new FormatConfig(indentSize, preserveFormatting, createBackup, compactWidth);
    }

    public FormatConfig withPreserveFormatting(boolean preserveFormatting) {
        return new FormatConfig(indentSize, preserveFormatting, createBackup, compactWidth);
    }

    public FormatConfig withCreateBackup(boolean createBackup) {
        return new FormatConfig(indentSize, preserveFormatting, createBackup, compactWidth);
    }

    public FormatConfig withCompactWidth(int compactWidth) {
        return new FormatConfig(indentSize, preserveFormatting, createBackup, compactWidth);
    }

    private static int intProperty(Properties properties, String key, int fallback) {
        final var raw = properties.getProperty(key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer but was '" + raw + "'", e);
        }
    }

    private static boolean boolProperty(Properties properties, String key, boolean fallback) {
        final var raw = properties.getProperty(key);
        return raw == null ? fallback : Boolean.parseBoolean(raw.trim());
    }
}
