package axpath.resolve;

import axpath.config.EngineConfig;
import axpath.model.NodeView;
import axpath.path.ElementPath;
import axpath.path.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Walks a live tree along an {@link ElementPath}.
 *
 * <p>Segment 0 is the root segment: if the supplied root satisfies it the
 * walk starts there, otherwise it is looked up among the root's children
 * (e.g. the applications below the system-wide element). Each later segment
 * is matched against freshly read children of the previous match:
 * <ul>
 *   <li>with an index, the index-th match in document order is taken;</li>
 *   <li>without one, exactly one match is required. Zero is NOT_FOUND and
 *       several is AMBIGUOUS. The first match is never picked silently.</li>
 * </ul>
 *
 * <p>There are no retries here; see {@link ResolveRetryPolicy}.
 */
public class PathResolver {

    private static final Logger log = LoggerFactory.getLogger(PathResolver.class);

    private final TreeAccessor accessor;
    private final SegmentMatcher matcher;
    private final int previewLimit;

    public PathResolver(TreeAccessor accessor, EngineConfig config) {
        this.accessor     = Objects.requireNonNull(accessor, "accessor must not be null");
        this.matcher      = new SegmentMatcher(accessor);
        this.previewLimit = config.getAmbiguityPreviewLimit();
    }

    public PathResolver(TreeAccessor accessor) {
        this(accessor, EngineConfig.defaults());
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Resolves a path starting from the root of the scope it implies
     * ({@link Scope#forPath(ElementPath)}).
     *
     * @throws ResolveException if any segment fails or the scope has no root
     */
    public NodeView resolve(ElementPath path) {
        return resolve(path, rootFor(path));
    }

    /**
     * Resolves a path starting from an explicit root.
     *
     * @param root starting node; {@code null} fails with NOT_FOUND at segment 0
     * @throws ResolveException if any segment fails
     */
    public NodeView resolve(ElementPath path, NodeView root) {
        NodeView node = walk(path, root, null);
        log.debug("Resolved {} to {}", path, node);
        return node;
    }

    /** Like {@link #resolve(ElementPath)}, but records every step instead of throwing. */
    public ResolutionTrace trace(ElementPath path) {
        List<ResolutionTrace.Step> steps = new ArrayList<>();
        try {
            return ResolutionTrace.resolved(path, steps, walk(path, rootFor(path), steps));
        } catch (ResolveException e) {
            return ResolutionTrace.failed(path, steps, e);
        }
    }

    /** Like {@link #resolve(ElementPath, NodeView)}, but records every step instead of throwing. */
    public ResolutionTrace trace(ElementPath path, NodeView root) {
        List<ResolutionTrace.Step> steps = new ArrayList<>();
        try {
            return ResolutionTrace.resolved(path, steps, walk(path, root, steps));
        } catch (ResolveException e) {
            return ResolutionTrace.failed(path, steps, e);
        }
    }

    // ── Walk ──────────────────────────────────────────────────────────────

    private NodeView rootFor(ElementPath path) {
        Scope scope = Scope.forPath(path);
        try {
            Optional<NodeView> root = accessor.getRootForScope(scope);
            log.debug("Root for {}: {}", scope, root.orElse(null));
            return root.orElse(null);
        } catch (AccessorException e) {
            throw ResolveException.accessorFailure(0, path.rootSegment(), e);
        }
    }

    private NodeView walk(ElementPath path, NodeView root, List<ResolutionTrace.Step> steps) {
        Objects.requireNonNull(path, "path must not be null");
        Segment first = path.rootSegment();
        if (root == null) {
            throw ResolveException.notFound(0, first);
        }

        NodeView current;
        try {
            if (matchesRoot(first, root)) {
                if (steps != null) {
                    steps.add(new ResolutionTrace.Step(0, first.format(), 1, List.of(matcher.describe(root))));
                }
                current = root;
            } else {
                current = select(0, first, accessor.getChildren(root), steps);
            }
        } catch (AccessorException e) {
            throw ResolveException.accessorFailure(0, first, e);
        }

        for (int i = 1; i < path.size(); i++) {
            Segment segment = path.segment(i);
            try {
                current = select(i, segment, accessor.getChildren(current), steps);
            } catch (AccessorException e) {
                throw ResolveException.accessorFailure(i, segment, e);
            }
        }
        return current;
    }

    private boolean matchesRoot(Segment first, NodeView root) {
        return (!first.hasIndex() || first.index() == 0) && matcher.matches(first, root);
    }

    private NodeView select(int i, Segment segment, List<NodeView> candidates, List<ResolutionTrace.Step> steps) {
        List<NodeView> matches = matcher.filter(segment, candidates);
        log.debug("Segment {} '{}': {} of {} candidate(s) match", i, segment, matches.size(), candidates.size());
        if (steps != null) {
            steps.add(new ResolutionTrace.Step(i, segment.format(), candidates.size(),
                    matches.stream().map(matcher::describe).toList()));
        }

        if (segment.hasIndex()) {
            if (segment.index() >= matches.size()) {
                throw ResolveException.indexOutOfRange(i, segment, matches.size());
            }
            return matches.get(segment.index());
        }
        if (matches.isEmpty()) {
            throw ResolveException.notFound(i, segment);
        }
        if (matches.size() > 1) {
            throw ResolveException.ambiguous(i, segment, matches.size(), preview(matches));
        }
        return matches.get(0);
    }

    private List<String> preview(List<NodeView> matches) {
        List<String> out = new ArrayList<>();
        for (int k = 0; k < matches.size() && k < previewLimit; k++) {
            out.add(matcher.describe(matches.get(k)));
        }
        if (matches.size() > previewLimit) {
            out.add("... and " + (matches.size() - previewLimit) + " more");
        }
        return out;
    }
}
