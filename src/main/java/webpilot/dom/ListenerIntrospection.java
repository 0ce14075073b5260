package webpilot.dom;

import java.util.Set;

/**
 * Optional capability: the event types a node has listeners attached for.
 */
@FunctionalInterface
public interface ListenerIntrospection {

    Set<String> listenerTypes(LiveNode node);
}
