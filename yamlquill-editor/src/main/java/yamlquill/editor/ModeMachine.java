package yamlquill.editor;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Finite-state machine over [EditorMode].
///
/// Transitions live in one table; an event with no entry for the current mode
/// is ignored and the mode stays as it is.
public final class ModeMachine {

    private static final Logger LOG = Logger.getLogger(ModeMachine.class.getName());

    private static final Map<EditorMode, Map<ModeEvent, EditorMode>> TRANSITIONS = buildTable();

    private EditorMode mode = EditorMode.NORMAL;

    private static Map<EditorMode, Map<ModeEvent, EditorMode>> buildTable() {
        final var table = new EnumMap<EditorMode, Map<ModeEvent, EditorMode>>(EditorMode.class);
        for (final var mode : EditorMode.values()) {
            table.put(mode, new EnumMap<>(ModeEvent.class));
        }

        table.get(EditorMode.NORMAL).put(ModeEvent.BEGIN_INSERT, EditorMode.INSERT);
        table.get(EditorMode.NORMAL).put(ModeEvent.BEGIN_COMMAND, EditorMode.COMMAND);
        table.get(EditorMode.NORMAL).put(ModeEvent.BEGIN_SEARCH, EditorMode.SEARCH);
        table.get(EditorMode.NORMAL).put(ModeEvent.TOGGLE_VISUAL, EditorMode.VISUAL);

        for (final var prompt : new EditorMode[]{EditorMode.INSERT, EditorMode.COMMAND, EditorMode.SEARCH}) {
            table.get(prompt).put(ModeEvent.SUBMIT, EditorMode.NORMAL);
            table.get(prompt).put(ModeEvent.CANCEL, EditorMode.NORMAL);
        }

        table.get(EditorMode.VISUAL).put(ModeEvent.TOGGLE_VISUAL, EditorMode.NORMAL);
        table.get(EditorMode.VISUAL).put(ModeEvent.CANCEL, EditorMode.NORMAL);
        table.get(EditorMode.VISUAL).put(ModeEvent.BEGIN_COMMAND, EditorMode.COMMAND);
        return table;
    }

    public EditorMode mode() {
        return mode;
    }

    /// {@return the mode `event` leads to from `from`, or `from` itself when the event does not apply}
    public static EditorMode next(EditorMode from, ModeEvent event) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(event, "event must not be null");
        return TRANSITIONS.get(from).getOrDefault(event, from);
    }

    public boolean accepts(ModeEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        return TRANSITIONS.get(mode).containsKey(event);
    }

    /// Applies `event` and returns the resulting mode.
    public EditorMode fire(ModeEvent event) {
        final var from = mode;
        mode = next(from, event);
        if (mode != from) {
            LOG.fine(() -> "Mode " + from + " -> " + mode + " on " + event);
        }
        return mode;
    }

    /// Returns to [EditorMode#NORMAL] unconditionally, as when a new document is loaded.
    public void reset() {
        mode = EditorMode.NORMAL;
    }
}
