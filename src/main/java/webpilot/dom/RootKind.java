package webpilot.dom;

/** The kind of root node a live node belongs to. */
public enum RootKind {
    DOCUMENT,
    SHADOW_ROOT
}
