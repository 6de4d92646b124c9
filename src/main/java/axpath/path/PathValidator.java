package axpath.path;

import axpath.config.EngineConfig;
import axpath.model.AttributeKey;
import axpath.model.AttributeNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lints path strings for patterns that parse but tend to resolve badly.
 *
 * <p>Syntax errors are not warnings: {@link #validate(String, boolean)}
 * throws {@link PathParseException} for them. Non-strict validation only
 * reports empty predicate values; strict validation adds the heuristics
 * about roots, roles and missing disambiguation.
 */
public class PathValidator {

    private static final Logger log = LoggerFactory.getLogger(PathValidator.class);

    static final String APPLICATION_ROLE = "AXApplication";
    static final String SYSTEM_WIDE_ROLE = "AXSystemWide";

    private static final Set<String> LABELLED_CONTROLS =
            Set.of("AXButton", "AXMenuItem", "AXRadioButton", "AXCheckBox");
    private static final Set<String> TEXT_INPUTS = Set.of("AXTextField", "AXTextArea");
    private static final Set<String> COLLECTIONS = Set.of("AXTable", "AXGrid", "AXList", "AXOutline");
    private static final Set<String> GENERIC_CONTAINERS = Set.of("AXGroup", "AXBox", "AXGeneric");

    private final int maxSegments;

    public PathValidator(EngineConfig config) {
        this.maxSegments = config.getMaxPathSegments();
    }

    public PathValidator() {
        this(EngineConfig.defaults());
    }

    /**
     * Parses and lints a path string.
     *
     * @return warnings in path order, empty if none
     * @throws PathParseException if the text does not parse
     */
    public List<PathWarning> validate(String text, boolean strict) {
        ElementPath path = ElementPathParser.parse(text);
        List<PathWarning> warnings = validate(path, strict);
        log.debug("Validated {} (strict={}): {} warning(s)", text, strict, warnings.size());
        return warnings;
    }

    /** Lints an already parsed path. */
    public List<PathWarning> validate(ElementPath path, boolean strict) {
        List<PathWarning> warnings = new ArrayList<>();

        if (strict && path.size() > maxSegments) {
            warnings.add(new PathWarning(-1,
                    "Path has " + path.size() + " segments, which might be excessive",
                    "Consider using a shorter path if possible"));
        }
        if (strict) {
            checkRoot(path.rootSegment(), warnings);
        }

        String previousRole = null;
        for (int i = 0; i < path.size(); i++) {
            Segment segment = path.segment(i);
            checkSegment(segment, i, strict, warnings);

            if (strict && segment.role().equals(previousRole) && !segment.hasIndex()) {
                warnings.add(new PathWarning(i,
                        "Consecutive '" + segment.role() + "' segments without an index",
                        "Add an index such as [0] to pick one of the repeated elements"));
            }
            previousRole = segment.role();
        }
        return warnings;
    }

    // ── Checks ────────────────────────────────────────────────────────────

    private void checkRoot(Segment root, List<PathWarning> warnings) {
        String role = root.role();
        if (!APPLICATION_ROLE.equals(role) && !SYSTEM_WIDE_ROLE.equals(role)) {
            warnings.add(new PathWarning(0,
                    "First segment role is '" + role + "' rather than '" + APPLICATION_ROLE
                            + "' or '" + SYSTEM_WIDE_ROLE + "'",
                    "Paths typically start with " + APPLICATION_ROLE + " to target one application"));
        }
        if (APPLICATION_ROLE.equals(role)
                && root.predicateValue(AttributeKey.BUNDLE_IDENTIFIER).isEmpty()
                && root.predicateValue(AttributeKey.TITLE).isEmpty()) {
            warnings.add(new PathWarning(0,
                    "Application segment has neither a bundle identifier nor a title",
                    "Add [@" + AttributeNormalizer.BUNDLE_IDENTIFIER + "=\"...\"] or [@AXTitle=\"...\"]"));
        }
    }

    private void checkSegment(Segment segment, int index, boolean strict, List<PathWarning> warnings) {
        for (Predicate p : segment.predicates()) {
            if (p.value().isEmpty()) {
                warnings.add(new PathWarning(index,
                        "Empty value for attribute '" + p.key() + "'",
                        "Remove the empty predicate or give it a meaningful value"));
            }
        }
        if (!strict) {
            return;
        }

        String role = segment.role();
        if (!segment.isWildcard() && !role.startsWith(AttributeNormalizer.PREFIX)) {
            warnings.add(new PathWarning(index,
                    "Role '" + role + "' doesn't have the standard 'AX' prefix",
                    "Use standard accessibility roles like 'AXButton' or 'AXTextField'"));
        }

        boolean undisambiguated = segment.predicates().isEmpty() && !segment.hasIndex();
        if (index > 0 && undisambiguated) {
            String suggested = null;
            if (LABELLED_CONTROLS.contains(role)) {
                suggested = "AXTitle or AXDescription";
            } else if (TEXT_INPUTS.contains(role)) {
                suggested = "AXPlaceholderValue or AXIdentifier";
            } else if (COLLECTIONS.contains(role)) {
                suggested = "AXIdentifier";
            }
            if (suggested != null) {
                warnings.add(new PathWarning(index,
                        "'" + segment.format() + "' has no attributes to identify it",
                        "Add " + suggested));
            }
        }
        if (undisambiguated && GENERIC_CONTAINERS.contains(role)) {
            warnings.add(new PathWarning(index,
                    "Generic role '" + role + "' without attributes or index may match multiple elements",
                    "Add a predicate or an index"));
        }
    }
}
