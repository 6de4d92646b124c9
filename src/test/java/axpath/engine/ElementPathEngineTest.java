package axpath.engine;

import axpath.TestTrees;
import axpath.config.EngineConfig;
import axpath.identity.NodeIdentity;
import axpath.identity.SiblingContext;
import axpath.model.ElementNode;
import axpath.model.ElementTreeIO;
import axpath.model.NodeView;
import axpath.path.ElementPath;
import axpath.path.OpaqueIdCodec;
import axpath.path.PathParseException;
import axpath.resolve.NodeTreeAccessor;
import axpath.resolve.ResolveException;
import axpath.resolve.Scope;
import axpath.resolve.TreeAccessor;
import axpath.snapshot.ChangeSet;
import axpath.snapshot.NodeChange;
import axpath.snapshot.NodeRecord;
import axpath.snapshot.TreeSnapshot;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests for {@link ElementPathEngine} over JSON tree fixtures.
 */
public class ElementPathEngineTest {

    @Mock
    private TreeAccessor accessor;

    private AutoCloseable mocks;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    private static ElementNode fixture(String name) throws IOException {
        try (InputStream in = ElementPathEngineTest.class.getResourceAsStream("/trees/" + name)) {
            return ElementTreeIO.read(in);
        }
    }

    private static EngineConfig noWaiting() {
        Properties p = new Properties();
        p.setProperty("accessor.timeout.ms", "0");
        p.setProperty("retry.delay.ms", "0");
        return new EngineConfig(p);
    }

    @Test(description = "The example path resolves against the fixture dump through a time-limited accessor")
    public void testResolveFixture() throws IOException {
        try (ElementPathEngine engine = new ElementPathEngine(new NodeTreeAccessor(fixture("example-app.json")),
                new EngineConfig())) {
            NodeView button = engine.resolve(TestTrees.EXAMPLE_PATH);

            assertThat(button.getDescription()).isEqualTo("1");
            assertThat(button.getActions()).contains("AXPress");
        }
    }

    @Test(description = "Opaque ids resolve like the paths they encode")
    public void testResolveOpaqueId() throws IOException {
        try (ElementPathEngine engine = new ElementPathEngine(new NodeTreeAccessor(fixture("example-app.json")),
                noWaiting())) {
            ElementPath path = engine.parse(TestTrees.EXAMPLE_PATH);
            String id = engine.encode(path);

            assertThat(id).isEqualTo(OpaqueIdCodec.encode(engine.format(path)));
            assertThat(engine.resolve(id)).isSameAs(engine.resolve(path));
        }
    }

    @Test(description = "Malformed path strings are rejected before touching the tree")
    public void testParseErrorBeforeTreeAccess() {
        try (ElementPathEngine engine = new ElementPathEngine(accessor, noWaiting())) {
            assertThatThrownBy(() -> engine.resolve("macos://ui/AXWindow[")).isInstanceOf(PathParseException.class);
        }
        verifyNoInteractions(accessor);
    }

    @Test(description = "Generated paths resolve back to their node")
    public void testGeneratePath() throws IOException {
        ElementNode root = fixture("example-app.json");
        NodeView app = root.getChildren().get(0);
        NodeView window = app.getChildren().get(0);
        NodeView plus = window.getChildren().get(3);

        try (ElementPathEngine engine = new ElementPathEngine(new NodeTreeAccessor(root), noWaiting())) {
            ElementPath path = engine.generatePath(List.of(app, window, plus));

            assertThat(path.format()).isEqualTo(
                    "macos://ui/AXApplication[@AXTitle=\"Example\"][@bundleIdentifier=\"com.example.app\"]"
                            + "/AXWindow[@AXTitle=\"Example\"]/AXButton[@AXDescription=\"+\"]");
            assertThat(engine.resolve(path)).isSameAs(plus);
            assertThat(engine.validate(path.format(), true)).isEmpty();
        }
    }

    @Test(description = "Capturing the before and after dumps reports only the display value")
    public void testCaptureAndDiffFixtures() throws IOException {
        TreeSnapshot before;
        TreeSnapshot after;
        try (ElementPathEngine engine = new ElementPathEngine(new NodeTreeAccessor(fixture("example-app.json")),
                noWaiting())) {
            before = engine.capture(Scope.application(TestTrees.APP_BUNDLE));
        }
        try (ElementPathEngine engine = new ElementPathEngine(new NodeTreeAccessor(fixture("example-app-after.json")),
                noWaiting())) {
            after = engine.capture(Scope.application(TestTrees.APP_BUNDLE));

            ChangeSet changes = engine.diff(before, after);

            assertThat(changes.getAdded()).isEmpty();
            assertThat(changes.getRemoved()).isEmpty();
            assertThat(changes.getModified()).hasSize(1);
            NodeChange display = changes.getModified().get(0);
            assertThat(display.identity()).isEqualTo(NodeIdentity.of("id:AXStaticText:display"));
            assertThat(display.changedFields()).containsExactly(NodeRecord.Field.VALUE);
            assertThat(display.after().value()).isEqualTo("12");
        }
    }

    @Test(description = "Resolution with retry succeeds once the element appears")
    public void testResolveWithRetry() {
        ElementNode system = TestTrees.systemWide();
        NodeView app = system.getChildren().get(0);
        NodeView window = app.getChildren().get(0);
        when(accessor.getRootForScope(any())).thenReturn(Optional.of(app));
        when(accessor.getAttributes(any())).thenAnswer(inv -> inv.<NodeView>getArgument(0).allAttributes());
        when(accessor.getChildren(any())).thenAnswer(inv -> inv.<NodeView>getArgument(0).getChildren());
        when(accessor.getChildren(window)).thenReturn(List.of(), List.of(), window.getChildren());

        try (ElementPathEngine engine = new ElementPathEngine(accessor, noWaiting())) {
            NodeView button = engine.resolveWithRetry(engine.parse(TestTrees.EXAMPLE_PATH));

            assertThat(button.getDescription()).isEqualTo("1");
        }
        verify(accessor, times(3)).getChildren(window);
    }

    @Test(description = "Resolution with retry gives up with the last failure")
    public void testResolveWithRetryGivesUp() {
        ElementNode system = TestTrees.systemWide();
        try (ElementPathEngine engine = new ElementPathEngine(new NodeTreeAccessor(system), noWaiting())) {
            ElementPath missing = engine.parse("macos://ui/AXApplication[@bundleIdentifier=\"com.example.app\"]"
                    + "/AXWindow/AXButton[@AXDescription=\"9\"]");

            assertThatThrownBy(() -> engine.resolveWithRetry(missing))
                    .isInstanceOf(ResolveException.class)
                    .hasMessageContaining("AXDescription=\"9\"");
        }
    }

    @Test(description = "Identify and trace delegate to the underlying components")
    public void testIdentifyAndTrace() {
        ElementNode system = TestTrees.systemWide();
        try (ElementPathEngine engine = new ElementPathEngine(new NodeTreeAccessor(system), noWaiting())) {
            assertThat(engine.identify(TestTrees.display("0"), SiblingContext.root()).value())
                    .isEqualTo("id:AXStaticText:display");
            assertThat(engine.trace(engine.parse(TestTrees.EXAMPLE_PATH)).isResolved()).isTrue();
            assertThat(engine.capture(system).size()).isEqualTo(13);
            assertThat(engine.getConfig().getAccessorTimeoutMs()).isZero();
        }
    }
}
