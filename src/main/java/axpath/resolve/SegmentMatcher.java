package axpath.resolve;

import axpath.model.AttributeKey;
import axpath.model.AttributeValue;
import axpath.model.NodeView;
import axpath.path.Predicate;
import axpath.path.Segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tests nodes against one path segment using fresh attribute reads.
 *
 * <p>A node matches when its role is accepted by the segment and every
 * predicate holds: the node has the attribute and its text form equals the
 * predicate value exactly. An absent attribute never matches.
 */
public class SegmentMatcher {

    private final TreeAccessor accessor;

    public SegmentMatcher(TreeAccessor accessor) {
        this.accessor = accessor;
    }

    /**
     * @throws AccessorException if attributes cannot be read
     */
    public boolean matches(Segment segment, NodeView node) {
        return matches(segment, node, accessor.getAttributes(node));
    }

    /** Matching candidates in document order. */
    public List<NodeView> filter(Segment segment, List<NodeView> candidates) {
        List<NodeView> out = new ArrayList<>();
        for (NodeView candidate : candidates) {
            if (matches(segment, candidate)) {
                out.add(candidate);
            }
        }
        return out;
    }

    public static boolean matches(Segment segment, NodeView node, Map<AttributeKey, AttributeValue> attributes) {
        AttributeValue role = attributes.get(AttributeKey.ROLE);
        String nodeRole = role != null ? role.asText() : node.getRole();
        if (!segment.acceptsRole(nodeRole)) {
            return false;
        }
        for (Predicate p : segment.predicates()) {
            AttributeValue actual = attributes.get(p.key());
            if (actual == null || !p.value().equals(actual.asText())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Short human-readable summary of a node's distinguishing attributes,
     * e.g. {@code AXButton[AXTitle="OK", AXIdentifier="ok"]}.
     */
    public String describe(NodeView node) {
        Map<AttributeKey, AttributeValue> attrs = accessor.getAttributes(node);
        StringBuilder sb = new StringBuilder(node.getRole()).append('[');
        boolean first = true;
        for (AttributeKey key : List.of(AttributeKey.TITLE, AttributeKey.DESCRIPTION,
                AttributeKey.IDENTIFIER, AttributeKey.VALUE)) {
            AttributeValue v = attrs.get(key);
            if (v == null || v.asText().isEmpty()) {
                continue;
            }
            if (!first) sb.append(", ");
            sb.append(key).append("=\"").append(v.asText()).append('"');
            first = false;
        }
        return sb.append(']').toString();
    }
}
