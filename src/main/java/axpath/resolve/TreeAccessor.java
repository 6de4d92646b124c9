package axpath.resolve;

import axpath.model.AttributeKey;
import axpath.model.AttributeValue;
import axpath.model.NodeView;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to a live accessibility tree.
 *
 * <p>Every call is a fresh read: the tree may change between two calls and
 * the engine never caches results across them. Implementations signal
 * platform failures (including timeouts) with {@link AccessorException}.
 */
public interface TreeAccessor {

    /**
     * Current children of a node, in document order.
     *
     * @throws AccessorException if the platform call fails
     */
    List<NodeView> getChildren(NodeView node);

    /**
     * Current attributes of a node keyed by canonical name, including
     * {@code AXRole}, {@code AXTitle}, {@code AXValue} and {@code AXDescription}
     * where present.
     *
     * @throws AccessorException if the platform call fails
     */
    Map<AttributeKey, AttributeValue> getAttributes(NodeView node);

    /**
     * Entry node for a scope: the system-wide element, an application element
     * or the element at a screen position.
     *
     * @return the root, or empty if nothing exists for the scope
     * @throws AccessorException if the platform call fails
     */
    Optional<NodeView> getRootForScope(Scope scope);
}
