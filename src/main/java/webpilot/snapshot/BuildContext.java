package webpilot.snapshot;

import webpilot.dom.HitPoint;
import webpilot.dom.HitTarget;
import webpilot.dom.ListenerIntrospection;
import webpilot.dom.LiveDom;
import webpilot.model.Viewport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state of a single build: the index counter, the batched hit-test
 * answers and the overlays to paint.
 * A fresh context per build keeps concurrent sessions independent.
 */
final class BuildContext {

    final LiveDom dom;
    final SnapshotOptions options;
    final Viewport viewport;
    final Optional<ListenerIntrospection> listeners;
    final List<HighlightTarget> highlights = new ArrayList<>();
    Map<HitPoint, Optional<HitTarget>> hits = Map.of();

    private int nextIndex;

    BuildContext(LiveDom dom, SnapshotOptions options, Viewport viewport) {
        this.dom = dom;
        this.options = options;
        this.viewport = viewport;
        this.listeners = dom.listenerIntrospection();
    }

    int assignIndex() {
        return nextIndex++;
    }

    int indexCount() {
        return nextIndex;
    }
}
