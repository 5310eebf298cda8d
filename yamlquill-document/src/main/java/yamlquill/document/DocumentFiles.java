package yamlquill.document;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/// Reads documents from disk and writes them back.
///
/// The dialect follows the file name: `.jsonl` is JSON Lines, `.yaml`/`.yml`
/// is YAML, anything else is JSON. A trailing `.gz` is stripped
/// before that check and the content is gzip-compressed.
public final class DocumentFiles {

    private static final Logger LOG = Logger.getLogger(DocumentFiles.class.getName());

    private DocumentFiles() {
    }

    /// Loads a JSON, JSON Lines or YAML file.
    /// @throws IOException if the file cannot be read
    /// @throws DocumentParseException if the content is malformed
    public static DocTree load(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        final var text = read(path);
        final var name = baseName(path);
        LOG.fine(() -> "Loading " + path + " (" + text.length() + " chars)");
        if (name.endsWith(".jsonl")) {
            return DocumentParser.parseJsonLines(text);
        }
        return formatFor(path) == DocumentFormat.YAML ? DocumentParser.parseYaml(text) : DocumentParser.parseJson(text);
    }

    /// {@return the dialect implied by the file name}
    public static DocumentFormat formatFor(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        final var name = baseName(path);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? DocumentFormat.YAML : DocumentFormat.JSON;
    }

    /// Serializes `tree` and replaces `path` with the result.
    ///
    /// With [FormatConfig#createBackup()] set, an existing file is first copied
    /// to `name.bak`. The new content goes to a temporary sibling that is then
    /// moved over the target, atomically where the file system allows it.
    /// @throws IOException if the backup, the write or the move fails
    public static void save(Path path, DocTree tree, FormatConfig config) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (config.createBackup() && Files.exists(path)) {
            final var backup = path.resolveSibling(path.getFileName() + ".bak");
            Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
            LOG.fine(() -> "Backed up " + path + " to " + backup);
        }

        final var text = DocumentSerializer.serialize(tree, formatFor(path), config);
        final var temp = path.resolveSibling(path.getFileName() + ".tmp");
        final var bytes = text.getBytes(StandardCharsets.UTF_8);
        try {
            if (isCompressed(path)) {
                try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(temp))) {
                    out.write(bytes);
                }
            } else {
                Files.write(temp, bytes);
            }
            move(temp, path);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        LOG.info(() -> "Saved " + path);
    }

    private static void move(Path temp, Path path) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.fine(() -> "Atomic move unsupported for " + path + ", replacing instead");
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String read(Path path) throws IOException {
        if (isCompressed(path)) {
            try (InputStream in = new GZIPInputStream(Files.newInputStream(path))) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    private static boolean isCompressed(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".gz");
    }

    private static String baseName(Path path) {
        final var name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".gz") ? name.substring(0, name.length() - 3) : name;
    }
}
