package axpath.resolve;

import axpath.model.AttributeKey;
import axpath.model.AttributeValue;
import axpath.model.NodeView;
import axpath.path.ElementPath;
import axpath.path.Predicate;
import axpath.path.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Builds element paths for nodes from their lineage (root first, node last).
 *
 * <p>Each segment carries the node's role plus the stable identifying
 * attributes it has: title, description, identifier, the bundle identifier
 * on applications, {@code AXEnabled="false"} when disabled and
 * {@code AXFocused}/{@code AXSelected="true"} when set. The value is added
 * only on request. Below the root, a segment that would still match several
 * siblings gets the node's index among those matches, so the generated path
 * resolves back to the same node.
 */
public class PathGenerator {

    private static final Logger log = LoggerFactory.getLogger(PathGenerator.class);

    private static final String APPLICATION_ROLE = "AXApplication";
    private static final Pattern ROLE_TOKEN = Pattern.compile("[A-Za-z0-9_]+");

    private final TreeAccessor accessor;

    public PathGenerator(TreeAccessor accessor) {
        this.accessor = Objects.requireNonNull(accessor, "accessor must not be null");
    }

    /** Path for the last node of {@code lineage}, without value predicates. */
    public ElementPath generate(List<NodeView> lineage) {
        return generate(lineage, false);
    }

    /**
     * Path for the last node of {@code lineage}.
     *
     * @param lineage      nodes from the root down to the target, each a child of the previous
     * @param includeValue whether to add {@code AXValue} predicates
     * @throws AccessorException if the tree cannot be read
     */
    public ElementPath generate(List<NodeView> lineage, boolean includeValue) {
        if (lineage == null || lineage.isEmpty()) {
            throw new IllegalArgumentException("lineage must contain at least one node");
        }
        List<Segment> segments = new ArrayList<>(lineage.size());
        for (int i = 0; i < lineage.size(); i++) {
            NodeView node = lineage.get(i);
            Segment segment = segmentFor(node, accessor.getAttributes(node), includeValue);
            if (i > 0) {
                List<NodeView> siblings = accessor.getChildren(lineage.get(i - 1));
                List<Map<AttributeKey, AttributeValue>> siblingAttributes = new ArrayList<>(siblings.size());
                for (NodeView sibling : siblings) {
                    siblingAttributes.add(accessor.getAttributes(sibling));
                }
                segment = disambiguate(segment, node, siblings, siblingAttributes);
            }
            segments.add(segment);
        }
        ElementPath path = new ElementPath(segments);
        log.debug("Generated {}", path);
        return path;
    }

    // ── Building blocks (shared with snapshot capture) ────────────────────

    /** Segment describing a node by its role and identifying attributes. */
    public static Segment segmentFor(NodeView node, Map<AttributeKey, AttributeValue> attrs, boolean includeValue) {
        String role = node.getRole();
        Segment segment = Segment.of(role != null && ROLE_TOKEN.matcher(role).matches() ? role : Segment.WILDCARD);

        segment = withText(segment, attrs, AttributeKey.TITLE);
        segment = withText(segment, attrs, AttributeKey.DESCRIPTION);
        if (includeValue) {
            segment = withText(segment, attrs, AttributeKey.VALUE);
        }
        segment = withText(segment, attrs, AttributeKey.IDENTIFIER);
        if (APPLICATION_ROLE.equals(role)) {
            segment = withText(segment, attrs, AttributeKey.BUNDLE_IDENTIFIER);
        }

        AttributeValue enabled = attrs.get(AttributeKey.ENABLED);
        if (enabled != null && !enabled.asBoolean()) {
            segment = segment.withPredicate(new Predicate(AttributeKey.ENABLED, enabled.asText()));
        }
        for (AttributeKey flag : List.of(AttributeKey.FOCUSED, AttributeKey.SELECTED)) {
            AttributeValue v = attrs.get(flag);
            if (v != null && v.asBoolean()) {
                segment = segment.withPredicate(new Predicate(flag, v.asText()));
            }
        }
        return segment;
    }

    /**
     * Adds the node's position among the siblings matching {@code segment}
     * when more than one sibling matches; otherwise returns it unchanged.
     */
    public static Segment disambiguate(Segment segment, NodeView node, List<NodeView> siblings,
                                       List<Map<AttributeKey, AttributeValue>> siblingAttributes) {
        int matching = 0;
        int position = -1;
        for (int k = 0; k < siblings.size(); k++) {
            NodeView sibling = siblings.get(k);
            if (!SegmentMatcher.matches(segment, sibling, siblingAttributes.get(k))) {
                continue;
            }
            if (sibling == node && position < 0) {
                position = matching;
            }
            matching++;
        }
        if (matching > 1 && position >= 0) {
            return segment.withIndex(position);
        }
        return segment;
    }

    private static Segment withText(Segment segment, Map<AttributeKey, AttributeValue> attrs, AttributeKey key) {
        AttributeValue v = attrs.get(key);
        if (v == null || v.asText().isEmpty()) {
            return segment;
        }
        return segment.withPredicate(new Predicate(key, v.asText()));
    }
}
