package yamlquill.editor;

/// The editor's modes. [#NORMAL] is where every session starts.
public enum EditorMode {
    NORMAL("NORMAL"),
    INSERT("INSERT"),
    COMMAND("COMMAND"),
    SEARCH("SEARCH"),
    VISUAL("VISUAL");

    private final String displayName;

    EditorMode(String displayName) {
        this.displayName = displayName;
    }

    /// {@return the label shown in the status line}
    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
