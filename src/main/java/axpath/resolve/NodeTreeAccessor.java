package axpath.resolve;

import axpath.model.AttributeKey;
import axpath.model.AttributeValue;
import axpath.model.NodeView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TreeAccessor} over an in-memory tree of {@link NodeView}s, such as a
 * JSON dump loaded with {@code ElementTreeIO}. The supplied root plays the
 * system-wide element; applications are found among it and its children.
 */
public class NodeTreeAccessor implements TreeAccessor {

    private static final Logger log = LoggerFactory.getLogger(NodeTreeAccessor.class);

    private static final String APPLICATION_ROLE = "AXApplication";

    private final NodeView systemRoot;

    public NodeTreeAccessor(NodeView systemRoot) {
        this.systemRoot = Objects.requireNonNull(systemRoot, "systemRoot must not be null");
    }

    @Override
    public List<NodeView> getChildren(NodeView node) {
        return node.getChildren();
    }

    @Override
    public Map<AttributeKey, AttributeValue> getAttributes(NodeView node) {
        return node.allAttributes();
    }

    @Override
    public Optional<NodeView> getRootForScope(Scope scope) {
        return switch (scope.kind()) {
            case SYSTEM_WIDE -> Optional.of(systemRoot);
            case APPLICATION -> findApplication(scope.bundleIdentifier());
            case POSITION    -> findAt(scope.x(), scope.y());
        };
    }

    private Optional<NodeView> findApplication(String bundleIdentifier) {
        if (isApplication(systemRoot, bundleIdentifier)) {
            return Optional.of(systemRoot);
        }
        for (NodeView child : systemRoot.getChildren()) {
            if (isApplication(child, bundleIdentifier)) {
                return Optional.of(child);
            }
        }
        log.debug("No application with bundle identifier {}", bundleIdentifier);
        return Optional.empty();
    }

    private static boolean isApplication(NodeView node, String bundleIdentifier) {
        if (!APPLICATION_ROLE.equals(node.getRole())) {
            return false;
        }
        AttributeValue bundle = node.getAttributes().get(AttributeKey.BUNDLE_IDENTIFIER);
        return bundle != null && bundleIdentifier.equals(bundle.asText());
    }

    /** Deepest node whose frame contains the point; later siblings are on top. */
    private Optional<NodeView> findAt(double x, double y) {
        NodeView hit = null;
        Deque<NodeView> stack = new ArrayDeque<>();
        stack.push(systemRoot);
        while (!stack.isEmpty()) {
            NodeView node = stack.pop();
            NodeView next = null;
            List<NodeView> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                if (children.get(i).getFrame().contains(x, y)) {
                    next = children.get(i);
                    break;
                }
            }
            if (next != null) {
                hit = next;
                stack.push(next);
            }
        }
        return Optional.ofNullable(hit);
    }
}
