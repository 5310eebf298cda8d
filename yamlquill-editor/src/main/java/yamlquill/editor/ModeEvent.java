package yamlquill.editor;

/// Inputs that can change the [EditorMode].
public enum ModeEvent {
    /// Start editing a value.
    BEGIN_INSERT,
    /// Open the `:` command line.
    BEGIN_COMMAND,
    /// Open the `/` search prompt.
    BEGIN_SEARCH,
    /// Toggle node selection.
    TOGGLE_VISUAL,
    /// Confirm the prompt or edit in progress.
    SUBMIT,
    /// Abandon the prompt, edit or selection in progress.
    CANCEL
}
