package axpath.snapshot;

import axpath.identity.NodeIdentity;
import axpath.path.ElementPath;
import axpath.resolve.Scope;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable result of one capture: a record per node keyed by identity, in
 * document order, plus a generated path per node for reporting. Paths are
 * not compared when diffing.
 */
public final class TreeSnapshot {

    private final Scope scope;
    private final Instant capturedAt;
    private final Map<NodeIdentity, NodeRecord> records;
    private final Map<NodeIdentity, ElementPath> paths;

    public TreeSnapshot(Scope scope, Instant capturedAt,
                        Map<NodeIdentity, NodeRecord> records,
                        Map<NodeIdentity, ElementPath> paths) {
        this.scope      = scope;
        this.capturedAt = Objects.requireNonNull(capturedAt, "capturedAt must not be null");
        this.records    = Collections.unmodifiableMap(new LinkedHashMap<>(records));
        this.paths      = Collections.unmodifiableMap(new LinkedHashMap<>(paths));
    }

    /** Scope the capture started from; empty when it started from an explicit node. */
    public Optional<Scope> getScope() { return Optional.ofNullable(scope); }

    public Instant getCapturedAt() { return capturedAt; }

    /** Records in capture order. */
    public Map<NodeIdentity, NodeRecord> getRecords() { return records; }

    public Set<NodeIdentity> identities() { return records.keySet(); }

    public Optional<NodeRecord> get(NodeIdentity identity) {
        return Optional.ofNullable(records.get(identity));
    }

    public boolean contains(NodeIdentity identity) {
        return records.containsKey(identity);
    }

    /** Path generated for a node at capture time. */
    public Optional<ElementPath> pathOf(NodeIdentity identity) {
        return Optional.ofNullable(paths.get(identity));
    }

    public int size() { return records.size(); }

    @Override
    public String toString() {
        return "TreeSnapshot{" + records.size() + " nodes, scope=" + scope + ", capturedAt=" + capturedAt + '}';
    }
}
