package webpilot.dom;

/**
 * A point to hit-test within a root, one per element the top-element check needs.
 */
public record HitPoint(HitScope scope, double x, double y) {
}
