package webpilot.dom;

/**
 * Root against which a hit test runs: the main document or the shadow root
 * hosted by a given node.
 */
public record HitScope(RootKind kind, int shadowHostId) {

    public static final HitScope MAIN_DOCUMENT = new HitScope(RootKind.DOCUMENT, -1);

    public static HitScope shadowRootOf(int hostId) {
        return new HitScope(RootKind.SHADOW_ROOT, hostId);
    }
}
