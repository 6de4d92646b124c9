package axpath.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only, point-in-time projection of one accessibility tree node.
 *
 * <p>Implementations are supplied by the tree-access layer; the engine never
 * mutates them and never holds on to native handles behind them. Optional
 * text fields return {@code null} when the platform reports nothing.
 */
public interface NodeView {

    /** Accessibility role, e.g. {@code AXButton}. Never null. */
    String getRole();

    String getTitle();

    String getValue();

    String getDescription();

    /** Frame in screen coordinates; {@link Rect#ZERO} when unknown. */
    Rect getFrame();

    /** Children in document order, as seen when this view was taken. */
    List<NodeView> getChildren();

    /** Additional attributes keyed by canonical name. */
    Map<AttributeKey, AttributeValue> getAttributes();

    Set<String> getActions();

    /**
     * All attributes including the typed fields ({@code AXRole}, {@code AXTitle},
     * {@code AXValue}, {@code AXDescription}, {@code AXFrame}), which take
     * precedence over same-named raw entries.
     */
    default Map<AttributeKey, AttributeValue> allAttributes() {
        Map<AttributeKey, AttributeValue> merged = new LinkedHashMap<>(getAttributes());
        merged.put(AttributeKey.ROLE, AttributeValue.of(getRole()));
        if (getTitle() != null)       merged.put(AttributeKey.TITLE, AttributeValue.of(getTitle()));
        if (getValue() != null)       merged.put(AttributeKey.VALUE, AttributeValue.of(getValue()));
        if (getDescription() != null) merged.put(AttributeKey.DESCRIPTION, AttributeValue.of(getDescription()));
        if (getFrame() != null)       merged.put(AttributeKey.FRAME, AttributeValue.of(getFrame()));
        return merged;
    }
}
