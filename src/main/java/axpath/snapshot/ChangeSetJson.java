package axpath.snapshot;

import axpath.identity.NodeIdentity;
import axpath.model.ElementTreeIO;
import axpath.path.ElementPath;
import axpath.path.OpaqueIdCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders snapshots and change sets as JSON reports.
 *
 * <p>Change report layout:
 * <pre>{@code
 * {
 *   "beforeCapturedAt": "2026-05-01T12:00:00Z", "afterCapturedAt": ...,
 *   "added":    [ {"id": ..., "path": ..., "record": {...}} ],
 *   "removed":  [ {"id": ..., "path": ...} ],
 *   "modified": [ {"id": ..., "path": ..., "changedFields": [...], "before": {...}, "after": {...}} ]
 * }
 * }</pre>
 * With opaque ids enabled, {@code path} holds the {@link OpaqueIdCodec}
 * encoding of the path instead of the path text. Reports are output only;
 * nothing is read back.
 */
public final class ChangeSetJson {

    private static final Logger log = LoggerFactory.getLogger(ChangeSetJson.class);

    private static final ObjectMapper MAPPER = ElementTreeIO.getMapper();

    private ChangeSetJson() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Change report for {@code changes}, with paths taken from the snapshot
     * each identity was seen in.
     */
    public static ObjectNode toTree(ChangeSet changes, TreeSnapshot before, TreeSnapshot after, boolean opaqueIds) {
        ObjectNode out = MAPPER.createObjectNode();
        out.set("beforeCapturedAt", MAPPER.valueToTree(before.getCapturedAt()));
        out.set("afterCapturedAt", MAPPER.valueToTree(after.getCapturedAt()));

        ArrayNode added = out.putArray("added");
        for (NodeIdentity id : changes.getAdded()) {
            ObjectNode entry = entry(id, after, opaqueIds);
            after.get(id).ifPresent(r -> entry.set("record", MAPPER.valueToTree(r)));
            added.add(entry);
        }

        ArrayNode removed = out.putArray("removed");
        for (NodeIdentity id : changes.getRemoved()) {
            removed.add(entry(id, before, opaqueIds));
        }

        ArrayNode modified = out.putArray("modified");
        for (NodeChange change : changes.getModified()) {
            ObjectNode entry = entry(change.identity(), after, opaqueIds);
            ArrayNode fields = entry.putArray("changedFields");
            change.changedFields().forEach(f -> fields.add(f.name()));
            entry.set("before", MAPPER.valueToTree(change.before()));
            entry.set("after", MAPPER.valueToTree(change.after()));
            modified.add(entry);
        }
        return out;
    }

    public static String toJson(ChangeSet changes, TreeSnapshot before, TreeSnapshot after, boolean opaqueIds)
            throws IOException {
        return MAPPER.writeValueAsString(toTree(changes, before, after, opaqueIds));
    }

    /** Snapshot listing: capture metadata plus one entry per node in capture order. */
    public static ObjectNode toTree(TreeSnapshot snapshot, boolean opaqueIds) {
        ObjectNode out = MAPPER.createObjectNode();
        out.set("capturedAt", MAPPER.valueToTree(snapshot.getCapturedAt()));
        snapshot.getScope().ifPresent(s -> out.put("scope", s.toString()));
        out.put("nodeCount", snapshot.size());
        ArrayNode nodes = out.putArray("nodes");
        snapshot.getRecords().forEach((id, record) -> {
            ObjectNode entry = entry(id, snapshot, opaqueIds);
            entry.set("record", MAPPER.valueToTree(record));
            nodes.add(entry);
        });
        return out;
    }

    public static String toJson(TreeSnapshot snapshot, boolean opaqueIds) throws IOException {
        return MAPPER.writeValueAsString(toTree(snapshot, opaqueIds));
    }

    /** Writes a change report to a file (parent directories are created). */
    public static void write(ChangeSet changes, TreeSnapshot before, TreeSnapshot after,
                             boolean opaqueIds, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        MAPPER.writeValue(path.toFile(), toTree(changes, before, after, opaqueIds));
        log.info("Wrote change report ({}) to {}", changes, path);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static ObjectNode entry(NodeIdentity id, TreeSnapshot source, boolean opaqueIds) {
        ObjectNode entry = MAPPER.createObjectNode();
        entry.put("id", id.value());
        source.pathOf(id).map(ElementPath::format).ifPresent(p ->
                entry.put("path", opaqueIds ? OpaqueIdCodec.encode(p) : p));
        return entry;
    }
}
