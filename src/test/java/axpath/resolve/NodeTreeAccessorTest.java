package axpath.resolve;

import axpath.TestTrees;
import axpath.model.AttributeKey;
import axpath.model.ElementNode;
import axpath.model.NodeView;
import axpath.path.ElementPath;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link NodeTreeAccessor} and {@link Scope}.
 */
public class NodeTreeAccessorTest {

    private ElementNode system;
    private NodeTreeAccessor accessor;

    @BeforeMethod
    public void setUp() {
        system = TestTrees.systemWide();
        accessor = new NodeTreeAccessor(system);
    }

    @Test(description = "System-wide scope returns the supplied root")
    public void testSystemWide() {
        assertThat(accessor.getRootForScope(Scope.systemWide())).containsSame(system);
    }

    @Test(description = "Application scope finds the application by bundle identifier")
    public void testApplication() {
        assertThat(accessor.getRootForScope(Scope.application(TestTrees.OTHER_BUNDLE)))
                .get().extracting(NodeView::getTitle).isEqualTo("Other");
        assertThat(accessor.getRootForScope(Scope.application("com.example.none"))).isEmpty();
    }

    @Test(description = "Application scope accepts a root that is itself the application")
    public void testApplicationRoot() {
        ElementNode app = TestTrees.exampleApp();
        assertThat(new NodeTreeAccessor(app).getRootForScope(Scope.application(TestTrees.APP_BUNDLE)))
                .containsSame(app);
    }

    @Test(description = "Position scope returns the deepest element under the point")
    public void testPosition() {
        NodeView hit = accessor.getRootForScope(Scope.atPosition(70, 120)).orElseThrow();

        assertThat(hit.getRole()).isEqualTo("AXButton");
        assertThat(hit.getFrame().getX()).isEqualTo(60);

        assertThat(accessor.getRootForScope(Scope.atPosition(2000, 2000))).isEmpty();
    }

    @Test(description = "Attributes include the typed fields")
    public void testAttributes() {
        NodeView app = system.getChildren().get(0);

        assertThat(accessor.getAttributes(app))
                .containsKeys(AttributeKey.ROLE, AttributeKey.TITLE, AttributeKey.BUNDLE_IDENTIFIER, AttributeKey.FRAME);
        assertThat(accessor.getChildren(app)).hasSize(1);
    }

    @Test(description = "Scope derivation from a path root")
    public void testScopeForPath() {
        assertThat(Scope.forPath(ElementPath.parse(TestTrees.EXAMPLE_PATH)))
                .isEqualTo(Scope.application(TestTrees.APP_BUNDLE));
        assertThat(Scope.forPath(ElementPath.parse("macos://ui/AXApplication[@AXTitle=\"x\"]")))
                .isEqualTo(Scope.systemWide());
        assertThat(Scope.application("a").toString()).isEqualTo("application(a)");
        assertThatThrownBy(() -> Scope.application(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
