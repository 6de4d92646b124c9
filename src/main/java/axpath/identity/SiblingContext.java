package axpath.identity;

import java.util.List;
import java.util.Objects;

/**
 * Where a node sits among its siblings and ancestors, as seen by the capture
 * that is identifying it.
 *
 * @param sameRoleIndex         0-based position among siblings with the same role
 * @param ancestorRoles         parent role first, then grandparent and so on
 * @param identifierUnique      whether the node's native identifier occurs only
 *                              once among its siblings
 */
public record SiblingContext(int sameRoleIndex, List<String> ancestorRoles, boolean identifierUnique) {

    public SiblingContext {
        if (sameRoleIndex < 0) {
            throw new IllegalArgumentException("sameRoleIndex must be non-negative: " + sameRoleIndex);
        }
        ancestorRoles = List.copyOf(Objects.requireNonNull(ancestorRoles, "ancestorRoles"));
    }

    /** Context of a root node: no siblings, no ancestors. */
    public static SiblingContext root() {
        return new SiblingContext(0, List.of(), true);
    }
}
