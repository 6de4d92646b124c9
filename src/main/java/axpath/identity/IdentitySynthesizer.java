package axpath.identity;

import axpath.config.EngineConfig;
import axpath.model.AttributeKey;
import axpath.model.AttributeValue;
import axpath.model.NodeView;
import axpath.model.Rect;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives a {@link NodeIdentity} for a node. A pure function of the node's
 * attributes and its {@link SiblingContext}: no clock, no randomness, no
 * tree access.
 *
 * <ol>
 *   <li>A non-blank {@code AXIdentifier} that is unique among the node's
 *       siblings gives {@code id:<role>:<identifier>}.</li>
 *   <li>Otherwise SHA-256, truncated to 128 bits, over the length-prefixed
 *       role, title, description, frame rounded to whole pixels, same-role
 *       sibling index and ancestor roles (bounded by
 *       {@code identity.ancestor.depth}) gives {@code h:<32 hex digits>}.</li>
 * </ol>
 */
public class IdentitySynthesizer {

    private static final int HASH_BYTES = 16;
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final int ancestorDepth;

    public IdentitySynthesizer(EngineConfig config) {
        this.ancestorDepth = config.getIdentityAncestorDepth();
    }

    public IdentitySynthesizer() {
        this(EngineConfig.defaults());
    }

    /** Identity from the node's own attributes. */
    public NodeIdentity identify(NodeView node, SiblingContext context) {
        return identify(node, node.allAttributes(), context);
    }

    /** Identity from attributes already read for the node (e.g. by a tree accessor). */
    public NodeIdentity identify(NodeView node, Map<AttributeKey, AttributeValue> attrs, SiblingContext context) {
        String role = role(node, attrs);
        String identifier = text(attrs, AttributeKey.IDENTIFIER);
        if (identifier != null && !identifier.isBlank() && context.identifierUnique()) {
            return NodeIdentity.nativeId(role, identifier);
        }
        return structuralIdentity(node, attrs, context);
    }

    /** Hash-based identity, ignoring any native identifier. */
    public NodeIdentity structuralIdentity(NodeView node, Map<AttributeKey, AttributeValue> attrs,
                                           SiblingContext context) {
        MessageDigest md = sha256();
        update(md, role(node, attrs));
        update(md, text(attrs, AttributeKey.TITLE));
        update(md, text(attrs, AttributeKey.DESCRIPTION));
        update(md, frame(node, attrs).toCompactString());
        update(md, Integer.toString(context.sameRoleIndex()));

        List<String> ancestors = context.ancestorRoles();
        int depth = Math.min(ancestorDepth, ancestors.size());
        update(md, Integer.toString(depth));
        for (int i = 0; i < depth; i++) {
            update(md, ancestors.get(i));
        }
        return NodeIdentity.structural(hex(md.digest(), HASH_BYTES));
    }

    /**
     * Sibling contexts for a list of children, in the same order: same-role
     * indexes and native identifier uniqueness among them.
     *
     * @param childAttributes attributes of each child, parallel to {@code children}
     * @param ancestorRoles   roles from the children's parent upwards
     */
    public List<SiblingContext> contextsFor(List<NodeView> children,
                                            List<Map<AttributeKey, AttributeValue>> childAttributes,
                                            List<String> ancestorRoles) {
        Map<String, Integer> identifierCounts = new HashMap<>();
        for (Map<AttributeKey, AttributeValue> attrs : childAttributes) {
            String id = text(attrs, AttributeKey.IDENTIFIER);
            if (id != null && !id.isBlank()) {
                identifierCounts.merge(id, 1, Integer::sum);
            }
        }

        Map<String, Integer> roleCounts = new HashMap<>();
        List<SiblingContext> out = new ArrayList<>(children.size());
        for (int i = 0; i < children.size(); i++) {
            Map<AttributeKey, AttributeValue> attrs = childAttributes.get(i);
            String role = role(children.get(i), attrs);
            int sameRoleIndex = roleCounts.merge(role, 1, Integer::sum) - 1;
            String id = text(attrs, AttributeKey.IDENTIFIER);
            boolean unique = id == null || id.isBlank() || identifierCounts.getOrDefault(id, 0) == 1;
            out.add(new SiblingContext(sameRoleIndex, ancestorRoles, unique));
        }
        return out;
    }

    public int getAncestorDepth() {
        return ancestorDepth;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    static String role(NodeView node, Map<AttributeKey, AttributeValue> attrs) {
        String role = text(attrs, AttributeKey.ROLE);
        return role != null ? role : node.getRole();
    }

    private static String text(Map<AttributeKey, AttributeValue> attrs, AttributeKey key) {
        AttributeValue v = attrs.get(key);
        return v == null ? null : v.asText();
    }

    private static Rect frame(NodeView node, Map<AttributeKey, AttributeValue> attrs) {
        AttributeValue v = attrs.get(AttributeKey.FRAME);
        if (v != null && v.asRect() != null) {
            return v.asRect();
        }
        return node.getFrame() != null ? node.getFrame() : Rect.ZERO;
    }

    /** Absent fields hash as length -1 so they differ from empty strings. */
    private static void update(MessageDigest md, String field) {
        if (field == null) {
            md.update(ByteBuffer.allocate(4).putInt(-1).array());
            return;
        }
        byte[] bytes = field.getBytes(StandardCharsets.UTF_8);
        md.update(ByteBuffer.allocate(4).putInt(bytes.length).array());
        md.update(bytes);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String hex(byte[] digest, int bytes) {
        StringBuilder out = new StringBuilder(bytes * 2);
        for (int i = 0; i < bytes; i++) {
            byte b = digest[i];
            out.append(HEX[(b >>> 4) & 0x0F]).append(HEX[b & 0x0F]);
        }
        return out.toString();
    }
}
