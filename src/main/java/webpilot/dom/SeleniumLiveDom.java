package webpilot.dom;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import webpilot.session.WebPilotException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * {@link LiveDom} and {@link OverlaySurface} backed by Selenium script execution.
 *
 * <p>The whole tree is captured by a single script that serialises it to JSON.
 * The script also keeps a page-side registry of the captured nodes so later
 * hit tests and overlay marker writes can refer to them by id. The registry
 * and the overlay container are keyed by a per-instance token.
 */
public class SeleniumLiveDom implements LiveDom, OverlaySurface {

    private static final Logger log = LoggerFactory.getLogger(SeleniumLiveDom.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String CONTAINER_PREFIX = "webpilot-highlight-container-";

    /**
     * Captures body and everything below it. Arguments: registry token,
     * list of tag names that are reported but not descended.
     */
    static final String CAPTURE_JS = """
            var token = arguments[0];
            var nonContent = arguments[1];
            var reg = { token: token, nodes: [], ids: new WeakMap() };
            window.__webpilotRegistry = reg;
            var introspect = typeof window.getEventListeners === 'function';

            function register(node) {
              var id = reg.nodes.length;
              reg.nodes.push(node);
              reg.ids.set(node, id);
              return id;
            }
            function rectOf(r) {
              return { left: r.left, top: r.top, width: r.width, height: r.height };
            }
            function styleOf(el) {
              var view = el.ownerDocument.defaultView || window;
              var cs = view.getComputedStyle(el);
              var rendered = typeof el.checkVisibility === 'function'
                  ? el.checkVisibility({ checkOpacity: true, checkVisibilityCSS: true })
                  : (cs.display !== 'none' && cs.visibility !== 'hidden' && cs.opacity !== '0');
              return { display: cs.display, visibility: cs.visibility, rendered: rendered };
            }
            function siblingIndex(el) {
              var idx = 0;
              for (var sib = el.previousElementSibling; sib; sib = sib.previousElementSibling) {
                if (sib.nodeName === el.nodeName) idx++;
              }
              return idx;
            }
            function rootInfo(node, out) {
              var root = node.getRootNode();
              if (root && root.nodeType === 11 && root.host) {
                var hostId = reg.ids.get(root.host);
                out.rootKind = 'SHADOW_ROOT';
                out.shadowHostId = hostId === undefined ? -1 : hostId;
              } else {
                out.rootKind = 'DOCUMENT';
                out.shadowHostId = -1;
              }
              out.mainDocument = node.ownerDocument === document;
              out.shadowRootChild = !!(node.parentNode && node.parentNode.nodeType === 11);
            }
            function captureText(node) {
              var range = node.ownerDocument.createRange();
              range.selectNodeContents(node);
              var parent = node.parentElement;
              var out = { id: register(node), kind: 'TEXT', text: node.textContent,
                          rect: rectOf(range.getBoundingClientRect()),
                          style: parent ? styleOf(parent) : null };
              rootInfo(node, out);
              return out;
            }
            function appendChildren(out, nodes) {
              for (var i = 0; i < nodes.length; i++) {
                var child = capture(nodes[i]);
                if (child) out.children.push(child);
              }
            }
            function captureElement(el) {
              var tag = el.tagName.toLowerCase();
              var out = { id: register(el), kind: 'ELEMENT', tagName: tag, attributes: {}, children: [] };
              rootInfo(el, out);
              if (nonContent.indexOf(tag) >= 0) return out;
              for (var i = 0; i < el.attributes.length; i++) {
                out.attributes[el.attributes[i].name] = el.attributes[i].value;
              }
              out.rect = rectOf(el.getBoundingClientRect());
              out.offsetWidth = el.offsetWidth || 0;
              out.offsetHeight = el.offsetHeight || 0;
              out.style = styleOf(el);
              out.clickHandler = typeof el.onclick === 'function';
              out.draggable = el.draggable === true;
              if (introspect) {
                try {
                  var listeners = window.getEventListeners(el) || {};
                  out.listenerTypes = Object.keys(listeners).filter(function (t) {
                    return listeners[t] && listeners[t].length > 0;
                  });
                } catch (e) {
                  out.listenerTypes = [];
                }
              }
              out.shadowHost = !!el.shadowRoot;
              out.parentTagName = el.parentElement ? el.parentElement.tagName.toLowerCase() : null;
              out.siblingIndex = siblingIndex(el);
              if (el.shadowRoot) appendChildren(out, el.shadowRoot.childNodes);
              if (tag === 'iframe') {
                var doc = null;
                try {
                  doc = el.contentDocument || (el.contentWindow && el.contentWindow.document);
                } catch (e) {
                  doc = null;
                }
                out.frameAccessible = !!(doc && doc.body);
                if (out.frameAccessible) appendChildren(out, doc.body.childNodes);
              } else {
                appendChildren(out, el.childNodes);
              }
              return out;
            }
            function capture(node) {
              if (node.nodeType === 3) return captureText(node);
              if (node.nodeType === 1) return captureElement(node);
              return null;
            }
            return JSON.stringify({
              viewport: {
                scrollX: Math.round(window.scrollX),
                scrollY: Math.round(window.scrollY),
                width: window.innerWidth,
                height: window.innerHeight
              },
              listenersIntrospected: introspect,
              body: document.body ? capture(document.body) : null
            });
            """;

    /** Arguments: registry token, shadow host id (-1 for the main document), x, y. */
    static final String HIT_TEST_JS = """
            var reg = window.__webpilotRegistry;
            if (!reg || reg.token !== arguments[0]) throw new Error('node registry is stale');
            var hostId = arguments[1];
            var root = hostId >= 0 ? (reg.nodes[hostId] && reg.nodes[hostId].shadowRoot) : document;
            if (!root) throw new Error('shadow root is no longer attached');
            var hit = root.elementFromPoint(arguments[2], arguments[3]);
            if (!hit) return null;
            var stop = hostId >= 0 ? null : document.documentElement;
            var chain = [];
            for (var cur = hit; cur && cur !== stop; cur = cur.parentElement) {
              var id = reg.ids.get(cur);
              chain.push(id === undefined ? -1 : id);
            }
            return chain;
            """;

    /**
     * Arguments: registry token, JSON array of {@code [hostId, x, y]} points.
     * Answers one entry per point: the chain, {@code null} for an empty point,
     * or {@code false} when that point's root is gone.
     */
    static final String HIT_TEST_BATCH_JS = """
            var reg = window.__webpilotRegistry;
            if (!reg || reg.token !== arguments[0]) throw new Error('node registry is stale');
            return JSON.parse(arguments[1]).map(function (p) {
              var hostId = p[0];
              var root = hostId >= 0 ? (reg.nodes[hostId] && reg.nodes[hostId].shadowRoot) : document;
              if (!root) return false;
              var hit = root.elementFromPoint(p[1], p[2]);
              if (!hit) return null;
              var stop = hostId >= 0 ? null : document.documentElement;
              var chain = [];
              for (var cur = hit; cur && cur !== stop; cur = cur.parentElement) {
                var id = reg.ids.get(cur);
                chain.push(id === undefined ? -1 : id);
              }
              return chain;
            });
            """;

    /** Arguments: container id, marker attribute name. */
    static final String CLEAR_JS = """
            var container = document.getElementById(arguments[0]);
            if (container) container.remove();
            var attr = arguments[1];
            var marked = document.querySelectorAll('[' + attr + ']');
            for (var i = 0; i < marked.length; i++) marked[i].removeAttribute(attr);
            var reg = window.__webpilotRegistry;
            if (reg) {
              reg.nodes.forEach(function (n) {
                if (n.nodeType === 1 && n.hasAttribute(attr)) n.removeAttribute(attr);
              });
            }
            """;

    /** Arguments: container id, marker attribute name, JSON array of boxes. */
    static final String PAINT_JS = """
            var containerId = arguments[0];
            var attr = arguments[1];
            var boxes = JSON.parse(arguments[2]);
            var reg = window.__webpilotRegistry;
            var container = document.getElementById(containerId);
            if (!container) {
              container = document.createElement('div');
              container.id = containerId;
              container.style.position = 'absolute';
              container.style.pointerEvents = 'none';
              container.style.top = '0';
              container.style.left = '0';
              container.style.width = '100%';
              container.style.height = '100%';
              container.style.zIndex = '2147483647';
              document.body.appendChild(container);
            }
            boxes.forEach(function (b) {
              var overlay = document.createElement('div');
              overlay.style.position = 'absolute';
              overlay.style.border = '2px solid ' + b.color;
              overlay.style.backgroundColor = b.background;
              overlay.style.pointerEvents = 'none';
              overlay.style.boxSizing = 'border-box';
              overlay.style.top = b.top + 'px';
              overlay.style.left = b.left + 'px';
              overlay.style.width = b.width + 'px';
              overlay.style.height = b.height + 'px';

              var label = document.createElement('div');
              label.style.position = 'absolute';
              label.style.background = b.color;
              label.style.color = 'white';
              label.style.padding = '1px 4px';
              label.style.borderRadius = '4px';
              label.style.fontSize = b.fontSize + 'px';
              label.style.top = b.labelTop + 'px';
              label.style.left = b.labelLeft + 'px';
              label.textContent = b.label;

              container.appendChild(overlay);
              container.appendChild(label);

              var el = reg && reg.nodes[b.nodeId];
              if (el && el.setAttribute) el.setAttribute(attr, b.marker);
            });
            """;

    private final WebDriver driver;
    private final String token;
    private volatile boolean listenersIntrospected;

    public SeleniumLiveDom(WebDriver driver) {
        this(driver, UUID.randomUUID().toString().substring(0, 8));
    }

    SeleniumLiveDom(WebDriver driver, String token) {
        this.driver = driver;
        this.token = token;
    }

    // ── LiveDom ─────────────────────────────────────────────────────────────

    @Override
    public LiveTree queryLiveTree() {
        Object raw = js().executeScript(CAPTURE_JS, token, new ArrayList<>(DomTags.NON_CONTENT));
        if (!(raw instanceof String json)) {
            throw new WebPilotException("DOM capture returned no data");
        }
        LiveTree tree;
        try {
            tree = MAPPER.readValue(json, LiveTree.class);
        } catch (JsonProcessingException e) {
            throw new WebPilotException("Cannot parse DOM capture: " + e.getOriginalMessage(), e);
        }
        if (tree.getBody() == null) {
            throw new WebPilotException("Page has no body element to capture");
        }
        listenersIntrospected = tree.isListenersIntrospected();
        log.debug("Captured live DOM ({} chars of JSON, viewport {})", json.length(), tree.getViewport());
        return tree;
    }

    @Override
    public ComputedStyle computeStyle(LiveNode node) {
        ComputedStyle style = node.getStyle();
        return style != null ? style : ComputedStyle.HIDDEN;
    }

    @Override
    public Optional<HitTarget> hitTest(HitScope scope, double x, double y) {
        Object result = js().executeScript(HIT_TEST_JS, token, scope.shadowHostId(), x, y);
        if (result == null) return Optional.empty();
        if (!(result instanceof List<?> ids)) {
            throw new WebPilotException("Unexpected hit-test result: " + result);
        }
        return Optional.of(toTarget(ids));
    }

    @Override
    public Map<HitPoint, Optional<HitTarget>> hitTestAll(Collection<HitPoint> points) {
        Map<HitPoint, Optional<HitTarget>> results = new LinkedHashMap<>();
        if (points.isEmpty()) return results;

        List<HitPoint> ordered = new ArrayList<>(points);
        List<List<Object>> coords = new ArrayList<>(ordered.size());
        for (HitPoint p : ordered) {
            coords.add(List.<Object>of(p.scope().shadowHostId(), p.x(), p.y()));
        }
        String payload;
        try {
            payload = MAPPER.writeValueAsString(coords);
        } catch (JsonProcessingException e) {
            throw new WebPilotException("Cannot serialise hit-test points", e);
        }

        Object result = js().executeScript(HIT_TEST_BATCH_JS, token, payload);
        if (!(result instanceof List<?> answers) || answers.size() != ordered.size()) {
            throw new WebPilotException("Unexpected batch hit-test result for " + ordered.size() + " point(s)");
        }
        int failed = 0;
        for (int i = 0; i < ordered.size(); i++) {
            Object answer = answers.get(i);
            if (answer == null) {
                results.put(ordered.get(i), Optional.empty());
            } else if (answer instanceof List<?> ids) {
                results.put(ordered.get(i), Optional.of(toTarget(ids)));
            } else {
                failed++;
            }
        }
        log.debug("Hit-tested {} point(s) in one call, {} unanswered", ordered.size(), failed);
        return results;
    }

    private static HitTarget toTarget(List<?> ids) {
        List<Integer> chain = new ArrayList<>(ids.size());
        for (Object id : ids) {
            chain.add(id instanceof Number n ? n.intValue() : -1);
        }
        return new HitTarget(chain);
    }

    @Override
    public Optional<ListenerIntrospection> listenerIntrospection() {
        if (!listenersIntrospected) return Optional.empty();
        return Optional.of(node -> node.getListenerTypes() == null
                ? Set.of()
                : Set.copyOf(node.getListenerTypes()));
    }

    // ── OverlaySurface ──────────────────────────────────────────────────────

    @Override
    public void clearOverlays() {
        js().executeScript(CLEAR_JS, containerId(), MARKER_ATTRIBUTE);
    }

    @Override
    public void paintOverlays(List<OverlayBox> boxes) {
        if (boxes.isEmpty()) return;
        String payload;
        try {
            payload = MAPPER.writeValueAsString(boxes);
        } catch (JsonProcessingException e) {
            throw new WebPilotException("Cannot serialise overlay boxes", e);
        }
        js().executeScript(PAINT_JS, containerId(), MARKER_ATTRIBUTE, payload);
        log.debug("Painted {} highlight overlay(s)", boxes.size());
    }

    String containerId() {
        return CONTAINER_PREFIX + token;
    }

    private JavascriptExecutor js() {
        return (JavascriptExecutor) driver;
    }
}
