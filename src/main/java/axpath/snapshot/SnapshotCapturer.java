package axpath.snapshot;

import axpath.config.EngineConfig;
import axpath.identity.IdentitySynthesizer;
import axpath.identity.NodeIdentity;
import axpath.identity.SiblingContext;
import axpath.model.AttributeKey;
import axpath.model.AttributeValue;
import axpath.model.NodeView;
import axpath.path.ElementPath;
import axpath.path.Segment;
import axpath.resolve.AccessorException;
import axpath.resolve.PathGenerator;
import axpath.resolve.Scope;
import axpath.resolve.TreeAccessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Walks a tree depth-first (parent before children) and records every node
 * under its {@link NodeIdentity}.
 *
 * <p>Identities must be unique within one snapshot. When a node's identity is
 * already taken (e.g. the same native identifier under two parents) the later
 * node falls back to its structural identity; if that is taken too, it gets
 * an occurrence suffix ({@code #2}, {@code #3}, ...).
 */
public class SnapshotCapturer {

    private static final Logger log = LoggerFactory.getLogger(SnapshotCapturer.class);

    private final TreeAccessor accessor;
    private final IdentitySynthesizer synthesizer;
    private final int maxDepth;
    private final Clock clock;

    public SnapshotCapturer(TreeAccessor accessor, IdentitySynthesizer synthesizer, EngineConfig config, Clock clock) {
        this.accessor    = Objects.requireNonNull(accessor, "accessor must not be null");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer must not be null");
        this.maxDepth    = config.getCaptureMaxDepth();
        this.clock       = clock;
    }

    public SnapshotCapturer(TreeAccessor accessor, EngineConfig config) {
        this(accessor, new IdentitySynthesizer(config), config, Clock.systemUTC());
    }

    /**
     * Captures everything below the root of a scope.
     *
     * @throws CaptureException if the scope has no root or the tree cannot be read
     */
    public TreeSnapshot capture(Scope scope) {
        NodeView root;
        try {
            root = accessor.getRootForScope(scope)
                    .orElseThrow(() -> new CaptureException("No root element for scope " + scope));
        } catch (AccessorException e) {
            throw new CaptureException("Cannot read root for scope " + scope + ": " + e.getMessage(), e);
        }
        return capture(root, scope);
    }

    /**
     * Captures everything below an explicit node.
     *
     * @throws CaptureException if the tree cannot be read
     */
    public TreeSnapshot capture(NodeView root) {
        return capture(root, null);
    }

    private TreeSnapshot capture(NodeView root, Scope scope) {
        long start = System.currentTimeMillis();
        Instant capturedAt = clock.instant();
        Walk walk = new Walk();
        try {
            Map<AttributeKey, AttributeValue> attrs = accessor.getAttributes(root);
            Segment segment = PathGenerator.segmentFor(root, attrs, false);
            walk.visit(root, attrs, SiblingContext.root(), List.of(segment), List.of(), 0);
        } catch (AccessorException e) {
            throw new CaptureException("Capture failed after " + walk.records.size()
                    + " node(s): " + e.getMessage(), e);
        }
        log.debug("Captured {} node(s) from {} in {} ms ({} identity collision(s))",
                walk.records.size(), scope != null ? scope : root.getRole(),
                System.currentTimeMillis() - start, walk.collisions);
        return new TreeSnapshot(scope, capturedAt, walk.records, walk.paths);
    }

    // ── Traversal ─────────────────────────────────────────────────────────

    private final class Walk {

        final Map<NodeIdentity, NodeRecord> records = new LinkedHashMap<>();
        final Map<NodeIdentity, ElementPath> paths = new LinkedHashMap<>();
        int collisions;

        void visit(NodeView node, Map<AttributeKey, AttributeValue> attrs, SiblingContext context,
                   List<Segment> lineage, List<String> ancestorRoles, int depth) {
            List<NodeView> children = accessor.getChildren(node);
            NodeIdentity identity = assign(node, attrs, context);
            records.put(identity, NodeRecord.from(node, attrs, children.size()));
            paths.put(identity, new ElementPath(lineage));

            if (maxDepth > 0 && depth >= maxDepth) {
                return;
            }

            List<Map<AttributeKey, AttributeValue>> childAttrs = new ArrayList<>(children.size());
            for (NodeView child : children) {
                childAttrs.add(accessor.getAttributes(child));
            }
            List<String> roles = new ArrayList<>(ancestorRoles.size() + 1);
            roles.add(records.get(identity).role());
            roles.addAll(ancestorRoles);
            List<SiblingContext> contexts = synthesizer.contextsFor(children, childAttrs, roles);

            for (int i = 0; i < children.size(); i++) {
                NodeView child = children.get(i);
                Segment segment = PathGenerator.disambiguate(
                        PathGenerator.segmentFor(child, childAttrs.get(i), false), child, children, childAttrs);
                List<Segment> childLineage = new ArrayList<>(lineage);
                childLineage.add(segment);
                visit(child, childAttrs.get(i), contexts.get(i), childLineage, roles, depth + 1);
            }
        }

        NodeIdentity assign(NodeView node, Map<AttributeKey, AttributeValue> attrs, SiblingContext context) {
            NodeIdentity identity = synthesizer.identify(node, attrs, context);
            if (!records.containsKey(identity)) {
                return identity;
            }
            collisions++;
            if (identity.getSource() == NodeIdentity.Source.NATIVE) {
                NodeIdentity structural = synthesizer.structuralIdentity(node, attrs, context);
                log.debug("Identity {} already taken, using {}", identity, structural);
                if (!records.containsKey(structural)) {
                    return structural;
                }
                identity = structural;
            }
            int occurrence = 2;
            while (records.containsKey(identity.withOccurrence(occurrence))) {
                occurrence++;
            }
            return identity.withOccurrence(occurrence);
        }
    }
}
