package axpath.engine;

import axpath.config.EngineConfig;
import axpath.identity.IdentitySynthesizer;
import axpath.identity.NodeIdentity;
import axpath.identity.SiblingContext;
import axpath.model.NodeView;
import axpath.path.ElementPath;
import axpath.path.ElementPathParser;
import axpath.path.OpaqueIdCodec;
import axpath.path.PathValidator;
import axpath.path.PathWarning;
import axpath.resolve.PathGenerator;
import axpath.resolve.PathResolver;
import axpath.resolve.ResolutionTrace;
import axpath.resolve.ResolveRetryPolicy;
import axpath.resolve.Scope;
import axpath.resolve.TimeLimitedTreeAccessor;
import axpath.resolve.TreeAccessor;
import axpath.snapshot.ChangeDetector;
import axpath.snapshot.ChangeSet;
import axpath.snapshot.SnapshotCapturer;
import axpath.snapshot.TreeSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Entry point bundling the path language, resolution, identity synthesis and
 * change detection over one {@link TreeAccessor}.
 *
 * <pre>{@code
 * try (ElementPathEngine engine = new ElementPathEngine(accessor, new EngineConfig())) {
 *     NodeView button = engine.resolve(
 *             "macos://ui/AXApplication[@bundleId=\"com.example.app\"]/AXWindow/AXButton[@AXDescription=\"1\"]");
 *     TreeSnapshot before = engine.capture(Scope.application("com.example.app"));
 *     // ... interact ...
 *     ChangeSet changes = engine.diff(before, engine.capture(Scope.application("com.example.app")));
 * }
 * }</pre>
 *
 * <p>When {@code accessor.timeout.ms} is positive the accessor is wrapped in a
 * {@link TimeLimitedTreeAccessor}, released by {@link #close()}.
 */
public class ElementPathEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ElementPathEngine.class);

    private final EngineConfig config;
    private final TreeAccessor accessor;
    private final PathValidator validator;
    private final PathResolver resolver;
    private final PathGenerator generator;
    private final ResolveRetryPolicy retryPolicy;
    private final IdentitySynthesizer synthesizer;
    private final SnapshotCapturer capturer;
    private final ChangeDetector detector;

    public ElementPathEngine(TreeAccessor accessor, EngineConfig config) {
        this(accessor, config, Clock.systemUTC());
    }

    public ElementPathEngine(TreeAccessor accessor, EngineConfig config, Clock clock) {
        this.config = config;
        long timeoutMs = config.getAccessorTimeoutMs();
        this.accessor = timeoutMs > 0 ? new TimeLimitedTreeAccessor(accessor, timeoutMs) : accessor;
        this.validator   = new PathValidator(config);
        this.resolver    = new PathResolver(this.accessor, config);
        this.generator   = new PathGenerator(this.accessor);
        this.retryPolicy = new ResolveRetryPolicy(config);
        this.synthesizer = new IdentitySynthesizer(config);
        this.capturer    = new SnapshotCapturer(this.accessor, synthesizer, config, clock);
        this.detector    = new ChangeDetector();
        log.debug("Engine ready (accessor timeout {} ms, ancestor depth {}, capture depth {})",
                timeoutMs, config.getIdentityAncestorDepth(), config.getCaptureMaxDepth());
    }

    // ── Paths ─────────────────────────────────────────────────────────────

    public ElementPath parse(String text) {
        return ElementPathParser.parse(text);
    }

    public String format(ElementPath path) {
        return ElementPathParser.format(path);
    }

    public List<PathWarning> validate(String text, boolean strict) {
        return validator.validate(text, strict);
    }

    /** Path for the last node of a root-first lineage. */
    public ElementPath generatePath(List<NodeView> lineage) {
        return generator.generate(lineage);
    }

    public String encode(ElementPath path) {
        return OpaqueIdCodec.encode(path.format());
    }

    // ── Resolution ────────────────────────────────────────────────────────

    /** Resolves a path string or opaque id from the root of the scope it implies. */
    public NodeView resolve(String pathOrId) {
        return resolve(parse(OpaqueIdCodec.toPathString(pathOrId)));
    }

    public NodeView resolve(ElementPath path) {
        return resolver.resolve(path);
    }

    public NodeView resolve(ElementPath path, NodeView root) {
        return resolver.resolve(path, root);
    }

    /** {@link #resolve(ElementPath)} under the configured retry policy. */
    public NodeView resolveWithRetry(ElementPath path) {
        return retryPolicy.execute(() -> resolver.resolve(path));
    }

    public ResolutionTrace trace(ElementPath path) {
        return resolver.trace(path);
    }

    // ── Identity & change detection ───────────────────────────────────────

    public NodeIdentity identify(NodeView node, SiblingContext context) {
        return synthesizer.identify(node, context);
    }

    public TreeSnapshot capture(Scope scope) {
        return capturer.capture(scope);
    }

    public TreeSnapshot capture(NodeView root) {
        return capturer.capture(root);
    }

    public ChangeSet diff(TreeSnapshot before, TreeSnapshot after) {
        return detector.diff(before, after);
    }

    public EngineConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (accessor instanceof TimeLimitedTreeAccessor limited) {
            limited.close();
        }
    }
}
