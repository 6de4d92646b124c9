package axpath.resolve;

import axpath.path.ElementPathException;
import axpath.path.Segment;

import java.util.List;

/**
 * Resolution of a path against a live tree failed at a specific segment.
 *
 * <p>NOT_FOUND, AMBIGUOUS and INDEX_OUT_OF_RANGE describe the tree as it was
 * observed and may succeed on a later attempt. ACCESSOR_FAILURE means the tree
 * could not be observed; {@link #isTimeout()} tells whether it timed out.
 */
public class ResolveException extends ElementPathException {

    private static final long serialVersionUID = 1L;

    public enum Kind { NOT_FOUND, AMBIGUOUS, INDEX_OUT_OF_RANGE, ACCESSOR_FAILURE }

    private final Kind kind;
    private final int segmentIndex;
    private final String segmentText;
    private final int candidateCount;
    private final Integer requestedIndex;
    private final List<String> preview;
    private final boolean timeout;

    private ResolveException(Kind kind, String message, int segmentIndex, String segmentText,
                             int candidateCount, Integer requestedIndex, List<String> preview,
                             Throwable cause, boolean timeout) {
        super(message, cause);
        this.kind           = kind;
        this.segmentIndex   = segmentIndex;
        this.segmentText    = segmentText;
        this.candidateCount = candidateCount;
        this.requestedIndex = requestedIndex;
        this.preview        = preview == null ? List.of() : List.copyOf(preview);
        this.timeout        = timeout;
    }

    // ── Factories ─────────────────────────────────────────────────────────

    public static ResolveException notFound(int segmentIndex, Segment segment) {
        return new ResolveException(Kind.NOT_FOUND,
                String.format("No element matches segment %d '%s'", segmentIndex, segment),
                segmentIndex, segment.format(), 0, null, null, null, false);
    }

    public static ResolveException ambiguous(int segmentIndex, Segment segment, int count, List<String> preview) {
        return new ResolveException(Kind.AMBIGUOUS,
                String.format("Segment %d '%s' matches %d elements; add a predicate or an index. Candidates: %s",
                        segmentIndex, segment, count, preview),
                segmentIndex, segment.format(), count, null, preview, null, false);
    }

    public static ResolveException indexOutOfRange(int segmentIndex, Segment segment, int available) {
        return new ResolveException(Kind.INDEX_OUT_OF_RANGE,
                String.format("Index %d of segment %d '%s' is out of range (%d matching elements)",
                        segment.index(), segmentIndex, segment, available),
                segmentIndex, segment.format(), available, segment.index(), null, null, false);
    }

    public static ResolveException accessorFailure(int segmentIndex, Segment segment, AccessorException cause) {
        return new ResolveException(Kind.ACCESSOR_FAILURE,
                String.format("Tree access failed at segment %d '%s': %s",
                        segmentIndex, segment, cause.getMessage()),
                segmentIndex, segment.format(), 0, null, null, cause, cause.isTimeout());
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public Kind getKind() { return kind; }

    /** 0-based index of the segment that failed. */
    public int getSegmentIndex() { return segmentIndex; }

    /** Wire form of the failing segment. */
    public String getSegmentText() { return segmentText; }

    /** Matching candidates for AMBIGUOUS and INDEX_OUT_OF_RANGE, otherwise 0. */
    public int getCandidateCount() { return candidateCount; }

    /** Requested index for INDEX_OUT_OF_RANGE, otherwise null. */
    public Integer getRequestedIndex() { return requestedIndex; }

    /** Bounded summaries of the ambiguous candidates. */
    public List<String> getPreview() { return preview; }

    public boolean isTimeout() { return timeout; }

    /** False for accessor failures, which a caller should not retry blindly. */
    public boolean isRetryable() {
        return kind != Kind.ACCESSOR_FAILURE;
    }
}
