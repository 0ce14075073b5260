package webpilot.dom;

/** DOM node types the capture reports; everything else is dropped in the browser. */
public enum NodeKind {
    ELEMENT,
    TEXT
}
