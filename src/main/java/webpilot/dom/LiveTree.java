package webpilot.dom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import webpilot.model.Viewport;

/**
 * Result of one capture: the {@code body} subtree plus the top-level viewport.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LiveTree {

    @JsonProperty("viewport")
    private Viewport viewport;

    @JsonProperty("body")
    private LiveNode body;

    @JsonProperty("listenersIntrospected")
    private boolean listenersIntrospected;

    public LiveTree() {}

    public LiveTree(Viewport viewport, LiveNode body, boolean listenersIntrospected) {
        this.viewport = viewport;
        this.body = body;
        this.listenersIntrospected = listenersIntrospected;
    }

    public Viewport getViewport()           { return viewport; }
    public LiveNode getBody()               { return body; }
    public boolean isListenersIntrospected() { return listenersIntrospected; }
}
