package yamlquill.editor;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Vim-style registers.
///
/// - the unnamed register, written by every delete and yank that names no register
/// - named registers `a`-`z`; `A` and `a` are the same register
/// - numbered registers `0`-`9`: `0` holds the last yank, `1`-`9` the last nine deletes, newest first
///
/// Register names outside those sets are programming errors and throw
/// [IllegalArgumentException].
public final class RegisterSet {

    private static final Logger LOG = Logger.getLogger(RegisterSet.class.getName());

    /// Name of the unnamed register when addressed by character.
    public static final char UNNAMED = '"';

    private static final int NUMBERED = 10;

    private RegisterContent unnamed = RegisterContent.empty();
    private final Map<Character, RegisterContent> named = new HashMap<>();
    private final RegisterContent[] numbered = new RegisterContent[NUMBERED];

    public RegisterSet() {
        Arrays.fill(numbered, RegisterContent.empty());
    }

    public RegisterContent getUnnamed() {
        return unnamed;
    }

    public void setUnnamed(RegisterContent content) {
        unnamed = Objects.requireNonNull(content, "content must not be null");
    }

    public Optional<RegisterContent> getNamed(char register) {
        return Optional.ofNullable(named.get(namedKey(register)));
    }

    public void setNamed(char register, RegisterContent content) {
        Objects.requireNonNull(content, "content must not be null");
        named.put(namedKey(register), content);
        LOG.finer(() -> "Register '" + register + "' set to " + content.size() + " node(s)");
    }

    /// Adds `content` after whatever the named register holds, creating it when absent.
    public void appendNamed(char register, RegisterContent content) {
        Objects.requireNonNull(content, "content must not be null");
        named.merge(namedKey(register), content, RegisterContent::append);
        LOG.finer(() -> "Appended " + content.size() + " node(s) to register '" + register + "'");
    }

    public RegisterContent getNumbered(int index) {
        return numbered[numberedIndex(index)];
    }

    public void setNumbered(int index, RegisterContent content) {
        numbered[numberedIndex(index)] = Objects.requireNonNull(content, "content must not be null");
    }

    /// Looks a register up by name. Digits select numbered registers, letters
    /// named ones, and `"` the unnamed register. A named register never
    /// written is empty.
    public Optional<RegisterContent> get(char register) {
        if (register == UNNAMED) {
            return Optional.of(unnamed);
        }
        if (register >= '0' && register <= '9') {
            return Optional.of(numbered[register - '0']);
        }
        return getNamed(register);
    }

    /// Records a delete: register 9 is dropped, 1-8 move up one, and `content` becomes register 1.
    public void pushDeleteHistory(RegisterContent content) {
        Objects.requireNonNull(content, "content must not be null");
        System.arraycopy(numbered, 1, numbered, 2, NUMBERED - 2);
        numbered[1] = content;
    }

    /// Records a yank in register 0. Deletes never touch it.
    public void updateYankRegister(RegisterContent content) {
        numbered[0] = Objects.requireNonNull(content, "content must not be null");
    }

    /// Empties every register.
    public void clear() {
        unnamed = RegisterContent.empty();
        named.clear();
        Arrays.fill(numbered, RegisterContent.empty());
    }

    /// {@return true for `"`, `0`-`9` and ASCII letters}
    public static boolean isValidName(char register) {
        return register == UNNAMED
                || (register >= '0' && register <= '9')
                || (register >= 'a' && register <= 'z')
                || (register >= 'A' && register <= 'Z');
    }

    private static char namedKey(char register) {
        final char lower = Character.toLowerCase(register);
        if (lower < 'a' || lower > 'z') {
            throw new IllegalArgumentException("Not a named register: '" + register + "'");
        }
        return lower;
    }

    private static int numberedIndex(int index) {
        if (index < 0 || index >= NUMBERED) {
            throw new IllegalArgumentException("Numbered register index must be 0-9: " + index);
        }
        return index;
    }
}
