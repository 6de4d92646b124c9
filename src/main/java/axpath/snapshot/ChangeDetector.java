package axpath.snapshot;

import axpath.identity.NodeIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares two snapshots by identity: identities only in {@code after} are
 * added, only in {@code before} removed, and those in both with differing
 * records modified. Equal records produce nothing.
 */
public class ChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    public ChangeSet diff(TreeSnapshot before, TreeSnapshot after) {
        Map<NodeIdentity, NodeRecord> old = before.getRecords();
        Map<NodeIdentity, NodeRecord> now = after.getRecords();

        Set<NodeIdentity> added = new LinkedHashSet<>();
        List<NodeChange> modified = new ArrayList<>();
        for (Map.Entry<NodeIdentity, NodeRecord> e : now.entrySet()) {
            NodeRecord previous = old.get(e.getKey());
            if (previous == null) {
                added.add(e.getKey());
                continue;
            }
            Set<NodeRecord.Field> fields = previous.diff(e.getValue());
            if (!fields.isEmpty()) {
                modified.add(new NodeChange(e.getKey(), previous, e.getValue(), fields));
            }
        }

        Set<NodeIdentity> removed = new LinkedHashSet<>();
        for (NodeIdentity id : old.keySet()) {
            if (!now.containsKey(id)) {
                removed.add(id);
            }
        }

        ChangeSet changes = new ChangeSet(added, removed, modified);
        log.debug("Diffed {} -> {} nodes: {}", old.size(), now.size(), changes);
        return changes;
    }
}
