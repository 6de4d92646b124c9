package axpath.snapshot;

import axpath.model.AttributeKey;
import axpath.model.AttributeValue;
import axpath.model.NodeView;
import axpath.model.Rect;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Properties of one node as observed by a capture. Frames are stored rounded
 * to whole pixels so sub-pixel jitter never shows up as a modification.
 *
 * <p>{@code childCount} is reported but not compared: a child appearing or
 * disappearing is already an added or removed identity of its own.
 */
public record NodeRecord(String role,
                         String title,
                         String value,
                         String description,
                         Rect frame,
                         boolean enabled,
                         boolean visible,
                         boolean focused,
                         boolean selected,
                         int childCount,
                         String identifier) {

    /** Compared properties, as reported in {@link NodeChange#changedFields()}. */
    public enum Field {
        ROLE, TITLE, VALUE, DESCRIPTION, FRAME, ENABLED, VISIBLE, FOCUSED, SELECTED, IDENTIFIER
    }

    public NodeRecord {
        Objects.requireNonNull(role, "role must not be null");
        frame = frame == null ? Rect.ZERO : frame.rounded();
    }

    /**
     * Record from attributes read for a node. Absent flags default to
     * enabled and visible, not focused and not selected.
     */
    public static NodeRecord from(NodeView node, Map<AttributeKey, AttributeValue> attrs, int childCount) {
        AttributeValue role = attrs.get(AttributeKey.ROLE);
        AttributeValue frame = attrs.get(AttributeKey.FRAME);
        return new NodeRecord(
                role != null ? role.asText() : node.getRole(),
                text(attrs, AttributeKey.TITLE),
                text(attrs, AttributeKey.VALUE),
                text(attrs, AttributeKey.DESCRIPTION),
                frame != null && frame.asRect() != null ? frame.asRect() : node.getFrame(),
                flag(attrs, AttributeKey.ENABLED, true),
                flag(attrs, AttributeKey.VISIBLE, true),
                flag(attrs, AttributeKey.FOCUSED, false),
                flag(attrs, AttributeKey.SELECTED, false),
                childCount,
                text(attrs, AttributeKey.IDENTIFIER));
    }

    /** Fields whose values differ between this record and {@code other}. */
    public Set<Field> diff(NodeRecord other) {
        Set<Field> changed = EnumSet.noneOf(Field.class);
        if (!role.equals(other.role))                          changed.add(Field.ROLE);
        if (!Objects.equals(title, other.title))               changed.add(Field.TITLE);
        if (!Objects.equals(value, other.value))               changed.add(Field.VALUE);
        if (!Objects.equals(description, other.description)) changed.add(Field.DESCRIPTION);
        if (!frame.equals(other.frame))                        changed.add(Field.FRAME);
        if (enabled != other.enabled)                          changed.add(Field.ENABLED);
        if (visible != other.visible)                          changed.add(Field.VISIBLE);
        if (focused != other.focused)                          changed.add(Field.FOCUSED);
        if (selected != other.selected)                        changed.add(Field.SELECTED);
        if (!Objects.equals(identifier, other.identifier))     changed.add(Field.IDENTIFIER);
        return changed;
    }

    private static String text(Map<AttributeKey, AttributeValue> attrs, AttributeKey key) {
        AttributeValue v = attrs.get(key);
        return v == null ? null : v.asText();
    }

    private static boolean flag(Map<AttributeKey, AttributeValue> attrs, AttributeKey key, boolean absent) {
        AttributeValue v = attrs.get(key);
        return v == null ? absent : v.asBoolean();
    }
}
