package axpath.snapshot;

import axpath.identity.NodeIdentity;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Differences between two snapshots. Every identity appears in at most one
 * of added, removed and modified.
 */
public final class ChangeSet {

    private final Set<NodeIdentity> added;
    private final Set<NodeIdentity> removed;
    private final List<NodeChange> modified;

    public ChangeSet(Set<NodeIdentity> added, Set<NodeIdentity> removed, List<NodeChange> modified) {
        this.added    = Collections.unmodifiableSet(new LinkedHashSet<>(added));
        this.removed  = Collections.unmodifiableSet(new LinkedHashSet<>(removed));
        this.modified = List.copyOf(modified);
    }

    public static ChangeSet empty() {
        return new ChangeSet(Set.of(), Set.of(), List.of());
    }

    /** Identities only in the later snapshot, in its capture order. */
    public Set<NodeIdentity> getAdded() { return added; }

    /** Identities only in the earlier snapshot, in its capture order. */
    public Set<NodeIdentity> getRemoved() { return removed; }

    public List<NodeChange> getModified() { return modified; }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && modified.isEmpty();
    }

    public int size() {
        return added.size() + removed.size() + modified.size();
    }

    @Override
    public String toString() {
        return String.format("ChangeSet{added=%d, removed=%d, modified=%d}",
                added.size(), removed.size(), modified.size());
    }
}
