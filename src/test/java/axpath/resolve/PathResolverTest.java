package axpath.resolve;

import axpath.TestTrees;
import axpath.config.EngineConfig;
import axpath.model.ElementNode;
import axpath.model.NodeView;
import axpath.model.Rect;
import axpath.path.ElementPath;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Optional;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link PathResolver}.
 *
 * <p>Most cases run against the in-memory example tree; accessor failures
 * and fresh-read behaviour use a mocked {@link TreeAccessor}.
 */
public class PathResolverTest {

    private static final String APP = "macos://ui/AXApplication[@bundleIdentifier=\"com.example.app\"]";
    private static final String OK_BUTTONS = APP + "/AXWindow/AXGroup/AXButton[@AXTitle=\"OK\"]";

    @Mock
    private TreeAccessor accessor;

    private AutoCloseable mocks;

    private ElementNode system;
    private NodeView app;
    private NodeView window;
    private PathResolver resolver;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        system = TestTrees.systemWide();
        app = system.getChildren().get(0);
        window = app.getChildren().get(0);
        resolver = new PathResolver(new NodeTreeAccessor(system));
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    /** Mocked accessor that serves the example tree. */
    private void stubExampleTree() {
        when(accessor.getRootForScope(any())).thenReturn(Optional.of(app));
        when(accessor.getAttributes(any())).thenAnswer(inv -> inv.<NodeView>getArgument(0).allAttributes());
        when(accessor.getChildren(any())).thenAnswer(inv -> inv.<NodeView>getArgument(0).getChildren());
    }

    private static ResolveException resolveFailure(PathResolver r, String path) {
        ResolveException e = catchThrowableOfType(() -> r.resolve(ElementPath.parse(path)), ResolveException.class);
        assertThat(e).as("resolution of %s should fail", path).isNotNull();
        return e;
    }

    // ── Successful resolution ─────────────────────────────────────────────

    @Test(description = "The documented example path resolves to the '1' button")
    public void testExamplePath() {
        NodeView node = resolver.resolve(ElementPath.parse(TestTrees.EXAMPLE_PATH));

        assertThat(node.getRole()).isEqualTo("AXButton");
        assertThat(node.getDescription()).isEqualTo("1");
        assertThat(node).isSameAs(window.getChildren().get(1));
    }

    @Test(description = "An index picks the n-th match in document order")
    public void testIndexSelects() {
        NodeView node = resolver.resolve(ElementPath.parse(OK_BUTTONS + "[1]"));

        assertThat(node.getFrame()).isEqualTo(new Rect(60, 110, 40, 24));
    }

    @Test(description = "A wildcard role matches any role")
    public void testWildcard() {
        NodeView node = resolver.resolve(ElementPath.parse(APP + "/AXWindow/*[@AXIdentifier=\"display\"]"));

        assertThat(node.getRole()).isEqualTo("AXStaticText");
    }

    @Test(description = "A path without a bundle identifier starts from the system-wide root")
    public void testSystemWideScope() {
        NodeView node = resolver.resolve(ElementPath.parse("macos://ui/AXApplication[@AXTitle=\"Other\"]/AXWindow"));

        assertThat(node.getTitle()).isEqualTo("Other");
    }

    @Test(description = "An index on the root segment is applied among the root's children")
    public void testRootIndex() {
        NodeView node = resolver.resolve(ElementPath.parse("macos://ui/AXApplication[1]/AXWindow"));

        assertThat(node.getTitle()).isEqualTo("Other");
    }

    @Test(description = "An explicit root that satisfies segment 0 is used as the start")
    public void testExplicitRoot() {
        NodeView node = resolver.resolve(ElementPath.parse("macos://ui/AXWindow/AXButton[@AXIdentifier=\"digit-2\"]"), window);

        assertThat(node.getDescription()).isEqualTo("2");
    }

    // ── Failures ──────────────────────────────────────────────────────────

    @Test(description = "Several matches without an index is AMBIGUOUS, never a silent first pick")
    public void testAmbiguous() {
        ResolveException e = resolveFailure(resolver, OK_BUTTONS);

        assertThat(e.getKind()).isEqualTo(ResolveException.Kind.AMBIGUOUS);
        assertThat(e.getSegmentIndex()).isEqualTo(3);
        assertThat(e.getCandidateCount()).isEqualTo(3);
        assertThat(e.getSegmentText()).isEqualTo("AXButton[@AXTitle=\"OK\"]");
        assertThat(e.getPreview()).hasSize(3).allMatch(s -> s.equals("AXButton[AXTitle=\"OK\"]"));
        assertThat(e.isRetryable()).isTrue();
    }

    @Test(description = "The example path against two buttons described \"1\" is AMBIGUOUS with two candidates")
    public void testExamplePathAmbiguous() {
        ElementNode twoOnes = TestTrees.systemWide(TestTrees.exampleApp(TestTrees.duplicateDigitWindow()));
        PathResolver r = new PathResolver(new NodeTreeAccessor(twoOnes));

        ResolveException e = resolveFailure(r, TestTrees.EXAMPLE_PATH);

        assertThat(e.getKind()).isEqualTo(ResolveException.Kind.AMBIGUOUS);
        assertThat(e.getSegmentIndex()).isEqualTo(2);
        assertThat(e.getSegmentText()).isEqualTo("AXButton[@AXDescription=\"1\"]");
        assertThat(e.getCandidateCount()).isEqualTo(2);
        assertThat(e.getPreview()).hasSize(2);
    }

    @Test(description = "The ambiguity preview is bounded by configuration")
    public void testPreviewLimit() {
        Properties props = new Properties();
        props.setProperty("resolve.ambiguity.preview.limit", "2");
        PathResolver limited = new PathResolver(new NodeTreeAccessor(system), new EngineConfig(props));

        ResolveException e = resolveFailure(limited, OK_BUTTONS);

        assertThat(e.getCandidateCount()).isEqualTo(3);
        assertThat(e.getPreview()).hasSize(3);
        assertThat(e.getPreview().get(2)).isEqualTo("... and 1 more");
    }

    @Test(description = "An index beyond the matches is INDEX_OUT_OF_RANGE")
    public void testIndexOutOfRange() {
        ResolveException e = resolveFailure(resolver, OK_BUTTONS + "[3]");

        assertThat(e.getKind()).isEqualTo(ResolveException.Kind.INDEX_OUT_OF_RANGE);
        assertThat(e.getSegmentIndex()).isEqualTo(3);
        assertThat(e.getRequestedIndex()).isEqualTo(3);
        assertThat(e.getCandidateCount()).isEqualTo(3);
    }

    @Test(description = "No match is NOT_FOUND at the failing segment")
    public void testNotFound() {
        ResolveException e = resolveFailure(resolver, APP + "/AXWindow/AXButton[@AXDescription=\"9\"]");

        assertThat(e.getKind()).isEqualTo(ResolveException.Kind.NOT_FOUND);
        assertThat(e.getSegmentIndex()).isEqualTo(2);
        assertThat(e.getMessage()).contains("AXButton[@AXDescription=\"9\"]");
    }

    @Test(description = "A predicate on an attribute the node lacks does not match")
    public void testAbsentAttribute() {
        ResolveException e = resolveFailure(resolver, APP + "/AXWindow/AXButton[@AXHelp=\"\"]");

        assertThat(e.getKind()).isEqualTo(ResolveException.Kind.NOT_FOUND);
    }

    @Test(description = "Predicate values compare exactly")
    public void testExactComparison() {
        assertThat(resolveFailure(resolver, APP + "/AXWindow[@AXTitle=\"example\"]").getKind())
                .isEqualTo(ResolveException.Kind.NOT_FOUND);
        assertThat(resolveFailure(resolver, APP + "/AXWindow[@AXTitle=\"Example \"]").getKind())
                .isEqualTo(ResolveException.Kind.NOT_FOUND);
    }

    @Test(description = "A scope with no root fails with NOT_FOUND at segment 0")
    public void testMissingScopeRoot() {
        ResolveException e = resolveFailure(resolver,
                "macos://ui/AXApplication[@bundleIdentifier=\"com.example.missing\"]/AXWindow");

        assertThat(e.getKind()).isEqualTo(ResolveException.Kind.NOT_FOUND);
        assertThat(e.getSegmentIndex()).isZero();
    }

    @Test(description = "A null root fails with NOT_FOUND at segment 0")
    public void testNullRoot() {
        ResolveException e = catchThrowableOfType(
                () -> resolver.resolve(ElementPath.parse(TestTrees.EXAMPLE_PATH), null), ResolveException.class);

        assertThat(e.getKind()).isEqualTo(ResolveException.Kind.NOT_FOUND);
        assertThat(e.getSegmentIndex()).isZero();
    }

    // ── Accessor behaviour ────────────────────────────────────────────────

    @Test(description = "Accessor errors surface as ACCESSOR_FAILURE at the segment being read")
    public void testAccessorFailure() {
        stubExampleTree();
        AccessorException boom = new AccessorException("AX API error -25204");
        when(accessor.getChildren(app)).thenThrow(boom);

        ResolveException e = resolveFailure(new PathResolver(accessor), TestTrees.EXAMPLE_PATH);

        assertThat(e.getKind()).isEqualTo(ResolveException.Kind.ACCESSOR_FAILURE);
        assertThat(e.getSegmentIndex()).isEqualTo(1);
        assertThat(e.getCause()).isSameAs(boom);
        assertThat(e.isTimeout()).isFalse();
        assertThat(e.isRetryable()).isFalse();
    }

    @Test(description = "An accessor timeout is reported as a timed-out ACCESSOR_FAILURE")
    public void testAccessorTimeout() {
        stubExampleTree();
        when(accessor.getChildren(window)).thenThrow(AccessorException.timeout("getChildren", 50));

        ResolveException e = resolveFailure(new PathResolver(accessor), TestTrees.EXAMPLE_PATH);

        assertThat(e.getKind()).isEqualTo(ResolveException.Kind.ACCESSOR_FAILURE);
        assertThat(e.getSegmentIndex()).isEqualTo(2);
        assertThat(e.isTimeout()).isTrue();
    }

    @Test(description = "A failing scope lookup is an ACCESSOR_FAILURE at segment 0")
    public void testScopeLookupFailure() {
        when(accessor.getRootForScope(any())).thenThrow(new AccessorException("no access"));

        ResolveException e = resolveFailure(new PathResolver(accessor), TestTrees.EXAMPLE_PATH);

        assertThat(e.getKind()).isEqualTo(ResolveException.Kind.ACCESSOR_FAILURE);
        assertThat(e.getSegmentIndex()).isZero();
    }

    @Test(description = "Each resolution reads the tree afresh")
    public void testFreshReads() {
        stubExampleTree();
        List<NodeView> withoutTarget = List.of(TestTrees.display("0"));
        when(accessor.getChildren(window)).thenReturn(withoutTarget, window.getChildren());
        PathResolver r = new PathResolver(accessor);
        ElementPath path = ElementPath.parse(TestTrees.EXAMPLE_PATH);

        assertThat(resolveFailure(r, TestTrees.EXAMPLE_PATH).getKind()).isEqualTo(ResolveException.Kind.NOT_FOUND);
        assertThat(r.resolve(path).getDescription()).isEqualTo("1");

        verify(accessor, times(2)).getRootForScope(Scope.application(TestTrees.APP_BUNDLE));
        verify(accessor, times(2)).getChildren(app);
        verify(accessor, times(2)).getChildren(window);
    }

    // ── Trace ─────────────────────────────────────────────────────────────

    @Test(description = "A trace of a successful resolution records every segment")
    public void testTraceResolved() {
        ResolutionTrace trace = resolver.trace(ElementPath.parse(TestTrees.EXAMPLE_PATH));

        assertThat(trace.isResolved()).isTrue();
        assertThat(trace.getFailure()).isEmpty();
        assertThat(trace.getSteps()).extracting(ResolutionTrace.Step::examined).containsExactly(1, 1, 5);
        assertThat(trace.getSteps().get(2).matches()).containsExactly(
                "AXButton[AXDescription=\"1\", AXIdentifier=\"digit-1\"]");
        assertThat(trace.describe()).contains("RESOLVED");
    }

    @Test(description = "A trace of a failed resolution keeps the steps up to the failure")
    public void testTraceFailed() {
        ResolutionTrace trace = resolver.trace(ElementPath.parse(OK_BUTTONS));

        assertThat(trace.isResolved()).isFalse();
        assertThat(trace.getResolved()).isEmpty();
        assertThat(trace.getFailure()).get()
                .extracting(ResolveException::getKind).isEqualTo(ResolveException.Kind.AMBIGUOUS);
        assertThat(trace.getSteps()).hasSize(4);
        assertThat(trace.getSteps().get(3).matches()).hasSize(3);
        assertThat(trace.describe()).contains("FAILED (AMBIGUOUS)");
    }
}
