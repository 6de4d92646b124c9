package axpath.resolve;

import axpath.model.NodeView;
import axpath.path.ElementPath;

import java.util.List;
import java.util.Optional;

/**
 * Segment-by-segment record of one resolution attempt: how many candidates
 * each segment examined and which of them matched, plus the outcome.
 * Meant for diagnosing and repairing paths that no longer resolve.
 */
public final class ResolutionTrace {

    /**
     * @param segmentIndex 0-based segment index
     * @param segmentText  wire form of the segment
     * @param examined     candidates the segment was tested against
     * @param matches      summaries of the candidates that matched
     */
    public record Step(int segmentIndex, String segmentText, int examined, List<String> matches) {
        public Step {
            matches = List.copyOf(matches);
        }
    }

    private final ElementPath path;
    private final List<Step> steps;
    private final NodeView resolved;
    private final ResolveException failure;

    private ResolutionTrace(ElementPath path, List<Step> steps, NodeView resolved, ResolveException failure) {
        this.path     = path;
        this.steps    = List.copyOf(steps);
        this.resolved = resolved;
        this.failure  = failure;
    }

    static ResolutionTrace resolved(ElementPath path, List<Step> steps, NodeView node) {
        return new ResolutionTrace(path, steps, node, null);
    }

    static ResolutionTrace failed(ElementPath path, List<Step> steps, ResolveException failure) {
        return new ResolutionTrace(path, steps, null, failure);
    }

    public ElementPath getPath() { return path; }

    public List<Step> getSteps() { return steps; }

    public boolean isResolved() { return resolved != null; }

    public Optional<NodeView> getResolved() { return Optional.ofNullable(resolved); }

    public Optional<ResolveException> getFailure() { return Optional.ofNullable(failure); }

    /** Multi-line report suitable for a terminal. */
    public String describe() {
        StringBuilder sb = new StringBuilder("Resolution of ").append(path).append('\n');
        for (Step step : steps) {
            sb.append(String.format("  [%d] %s: %d candidate(s), %d match(es)%n",
                    step.segmentIndex(), step.segmentText(), step.examined(), step.matches().size()));
            for (String m : step.matches()) {
                sb.append("        ").append(m).append('\n');
            }
        }
        if (failure != null) {
            sb.append("FAILED (").append(failure.getKind()).append("): ").append(failure.getMessage()).append('\n');
        } else {
            sb.append("RESOLVED: ").append(resolved).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}
