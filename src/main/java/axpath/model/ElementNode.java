package axpath.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable in-memory {@link NodeView}, built with {@link #builder(String)}.
 *
 * <p>Used for trees loaded from JSON dumps and for tests. A changed tree is
 * a new tree: derive a modified node with {@link #toBuilder()}.
 */
public final class ElementNode implements NodeView {

    private final String role;
    private final String title;
    private final String value;
    private final String description;
    private final Rect   frame;
    private final List<NodeView> children;
    private final Map<AttributeKey, AttributeValue> attributes;
    private final Set<String> actions;

    private ElementNode(Builder b) {
        this.role        = Objects.requireNonNull(b.role, "role must not be null");
        this.title       = b.title;
        this.value       = b.value;
        this.description = b.description;
        this.frame       = b.frame != null ? b.frame : Rect.ZERO;
        this.children    = List.copyOf(b.children);
        this.attributes  = Collections.unmodifiableMap(new LinkedHashMap<>(b.attributes));
        this.actions     = Collections.unmodifiableSet(new LinkedHashSet<>(b.actions));
    }

    public static Builder builder(String role) {
        return new Builder(role);
    }

    /** Builder pre-populated with this node's fields and children. */
    public Builder toBuilder() {
        Builder b = new Builder(role)
                .title(title)
                .value(value)
                .description(description)
                .frame(frame);
        b.children.addAll(children);
        b.attributes.putAll(attributes);
        b.actions.addAll(actions);
        return b;
    }

    @Override public String getRole()        { return role; }
    @Override public String getTitle()       { return title; }
    @Override public String getValue()       { return value; }
    @Override public String getDescription() { return description; }
    @Override public Rect   getFrame()       { return frame; }
    @Override public List<NodeView> getChildren() { return children; }
    @Override public Map<AttributeKey, AttributeValue> getAttributes() { return attributes; }
    @Override public Set<String> getActions() { return actions; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ElementNode{").append(role);
        if (title != null)       sb.append(", title='").append(title).append('\'');
        if (description != null) sb.append(", description='").append(description).append('\'');
        if (value != null)       sb.append(", value='").append(value).append('\'');
        sb.append(", children=").append(children.size()).append('}');
        return sb.toString();
    }

    // ── Builder ───────────────────────────────────────────────────────────

    public static final class Builder {

        private final String role;
        private String title;
        private String value;
        private String description;
        private Rect   frame;
        private final List<NodeView> children = new ArrayList<>();
        private final Map<AttributeKey, AttributeValue> attributes = new LinkedHashMap<>();
        private final Set<String> actions = new LinkedHashSet<>();

        private Builder(String role) {
            this.role = role;
        }

        public Builder title(String title)             { this.title = title; return this; }
        public Builder value(String value)             { this.value = value; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder frame(Rect frame)               { this.frame = frame; return this; }

        public Builder frame(double x, double y, double width, double height) {
            return frame(new Rect(x, y, width, height));
        }

        /** Sets {@code AXIdentifier}. */
        public Builder identifier(String identifier) {
            return attribute(AttributeKey.IDENTIFIER, identifier);
        }

        public Builder attribute(String name, Object raw) {
            return attribute(AttributeKey.of(name), raw);
        }

        public Builder attribute(AttributeKey key, Object raw) {
            AttributeValue v = AttributeValue.from(raw);
            if (v == null) {
                attributes.remove(key);
            } else {
                attributes.put(key, v);
            }
            return this;
        }

        public Builder action(String action) {
            actions.add(action);
            return this;
        }

        public Builder child(NodeView child) {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder children(List<? extends NodeView> nodes) {
            children.clear();
            nodes.forEach(this::child);
            return this;
        }

        public Builder child(Builder child) {
            return child(child.build());
        }

        public ElementNode build() {
            return new ElementNode(this);
        }
    }
}
