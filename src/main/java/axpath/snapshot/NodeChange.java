package axpath.snapshot;

import axpath.identity.NodeIdentity;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/** A node present in both snapshots whose record differs. */
public record NodeChange(NodeIdentity identity, NodeRecord before, NodeRecord after,
                         Set<NodeRecord.Field> changedFields) {

    public NodeChange {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
        changedFields = changedFields.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(changedFields));
    }
}
