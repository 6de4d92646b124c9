package axpath.cli;

import axpath.config.EngineConfig;
import axpath.engine.ElementPathEngine;
import axpath.model.ElementTreeIO;
import axpath.model.NodeView;
import axpath.path.ElementPath;
import axpath.path.ElementPathException;
import axpath.path.OpaqueIdCodec;
import axpath.path.PathParseException;
import axpath.path.PathValidator;
import axpath.path.PathWarning;
import axpath.path.Predicate;
import axpath.path.Segment;
import axpath.resolve.NodeTreeAccessor;
import axpath.resolve.ResolutionTrace;
import axpath.resolve.ResolveException;
import axpath.snapshot.ChangeDetector;
import axpath.snapshot.ChangeSet;
import axpath.snapshot.ChangeSetJson;
import axpath.snapshot.TreeSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line front end for the element path engine. Trees are read from
 * JSON dumps so paths can be checked and snapshots diffed offline.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code axpath parse}    : parse a path and print its segments</li>
 *   <li>{@code axpath validate} : lint a path</li>
 *   <li>{@code axpath resolve}  : resolve a path against a tree dump</li>
 *   <li>{@code axpath capture}  : print the snapshot of a tree dump</li>
 *   <li>{@code axpath diff}     : print the changes between two tree dumps</li>
 *   <li>{@code axpath encode}   : turn a path into an opaque id</li>
 *   <li>{@code axpath decode}   : turn an opaque id back into a path</li>
 * </ul>
 *
 * <p>Exit codes: 0 success, 1 resolution or capture failure, 2 malformed input.
 */
@Command(
        name        = "axpath",
        description = "Address, resolve and diff accessibility tree elements with element paths",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                AxPathCLI.ParseCommand.class,
                AxPathCLI.ValidateCommand.class,
                AxPathCLI.ResolveCommand.class,
                AxPathCLI.CaptureCommand.class,
                AxPathCLI.DiffCommand.class,
                AxPathCLI.EncodeCommand.class,
                AxPathCLI.DecodeCommand.class
        }
)
public class AxPathCLI implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_BAD_INPUT = 2;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new AxPathCLI()).execute(args);
        System.exit(exit);
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    @Command(name = "parse", description = "Parse a path and print its segments", mixinStandardHelpOptions = true)
    static class ParseCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Element path or opaque id")
        String path;

        @Override
        public Integer call() {
            ElementPath parsed;
            try {
                parsed = ElementPath.parse(OpaqueIdCodec.toPathString(path));
            } catch (ElementPathException e) {
                System.err.println("Invalid path: " + e.getMessage());
                return EXIT_BAD_INPUT;
            }
            System.out.println(parsed.format());
            for (int i = 0; i < parsed.size(); i++) {
                Segment s = parsed.segment(i);
                System.out.printf("  [%d] role=%s%s%n", i, s.role(),
                        s.hasIndex() ? " index=" + s.index() : "");
                for (Predicate p : s.predicates()) {
                    System.out.printf("        %s = \"%s\"%n", p.key(), p.value());
                }
            }
            return EXIT_OK;
        }
    }

    @Command(name = "validate", description = "Lint a path for fragile or ambiguous segments",
            mixinStandardHelpOptions = true)
    static class ValidateCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Element path")
        String path;

        @Option(names = {"-s", "--strict"}, description = "Apply all heuristics, not just structural checks")
        boolean strict;

        @Override
        public Integer call() {
            List<PathWarning> warnings;
            try {
                warnings = new PathValidator(new EngineConfig()).validate(path, strict);
            } catch (PathParseException e) {
                System.err.println("Invalid path: " + e.getMessage());
                return EXIT_BAD_INPUT;
            }
            if (warnings.isEmpty()) {
                System.out.println("OK: no warnings");
            }
            warnings.forEach(w -> System.out.println("WARN " + w));
            return EXIT_OK;
        }
    }

    @Command(name = "resolve", description = "Resolve a path against a JSON tree dump",
            mixinStandardHelpOptions = true)
    static class ResolveCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

        @Option(names = {"-t", "--tree"}, required = true, description = "Tree dump (JSON)")
        Path treeFile;

        @Parameters(index = "0", description = "Element path or opaque id")
        String path;

        @Option(names = "--trace", description = "Print every resolution step")
        boolean trace;

        @Override
        public Integer call() throws IOException {
            NodeView root = ElementTreeIO.read(treeFile);
            try (ElementPathEngine engine = new ElementPathEngine(new NodeTreeAccessor(root), new EngineConfig())) {
                ElementPath parsed = engine.parse(OpaqueIdCodec.toPathString(path));
                if (trace) {
                    ResolutionTrace t = engine.trace(parsed);
                    System.out.print(t.describe());
                    return t.isResolved() ? EXIT_OK : EXIT_FAILED;
                }
                NodeView node = engine.resolve(parsed);
                System.out.println(ElementTreeIO.toJson(node));
                return EXIT_OK;
            } catch (PathParseException e) {
                System.err.println("Invalid path: " + e.getMessage());
                return EXIT_BAD_INPUT;
            } catch (ResolveException e) {
                log.debug("Resolution failed", e);
                System.err.println("Not resolved (" + e.getKind() + "): " + e.getMessage());
                return EXIT_FAILED;
            } catch (ElementPathException e) {
                System.err.println("Invalid path or opaque id: " + e.getMessage());
                return EXIT_BAD_INPUT;
            }
        }
    }

    @Command(name = "capture", description = "Print the snapshot of a JSON tree dump",
            mixinStandardHelpOptions = true)
    static class CaptureCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Tree dump (JSON)")
        Path treeFile;

        @Option(names = "--opaque", description = "Print paths as opaque ids")
        boolean opaque;

        @Override
        public Integer call() throws IOException {
            NodeView root = ElementTreeIO.read(treeFile);
            try (ElementPathEngine engine = new ElementPathEngine(new NodeTreeAccessor(root), new EngineConfig())) {
                TreeSnapshot snapshot = engine.capture(root);
                System.out.println(ChangeSetJson.toJson(snapshot, opaque));
            }
            return EXIT_OK;
        }
    }

    @Command(name = "diff", description = "Print the changes between two JSON tree dumps",
            mixinStandardHelpOptions = true)
    static class DiffCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Tree dump before the change")
        Path beforeFile;

        @Parameters(index = "1", description = "Tree dump after the change")
        Path afterFile;

        @Option(names = "--opaque", description = "Print paths as opaque ids")
        boolean opaque;

        @Option(names = {"-o", "--out"}, description = "Write the report to this file instead of stdout")
        Path outFile;

        @Override
        public Integer call() throws IOException {
            EngineConfig config = new EngineConfig();
            TreeSnapshot before = snapshotOf(beforeFile, config);
            TreeSnapshot after  = snapshotOf(afterFile, config);
            ChangeSet changes = new ChangeDetector().diff(before, after);
            if (outFile != null) {
                ChangeSetJson.write(changes, before, after, opaque, outFile);
                System.out.printf("%s written to %s%n", changes, outFile.toAbsolutePath());
            } else {
                System.out.println(ChangeSetJson.toJson(changes, before, after, opaque));
            }
            return EXIT_OK;
        }

        private static TreeSnapshot snapshotOf(Path file, EngineConfig config) throws IOException {
            NodeView root = ElementTreeIO.read(file);
            try (ElementPathEngine engine = new ElementPathEngine(new NodeTreeAccessor(root), config)) {
                return engine.capture(root);
            }
        }
    }

    @Command(name = "encode", description = "Encode a path as an opaque id", mixinStandardHelpOptions = true)
    static class EncodeCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Element path")
        String path;

        @Override
        public Integer call() {
            try {
                System.out.println(OpaqueIdCodec.encode(ElementPath.parse(path).format()));
                return EXIT_OK;
            } catch (PathParseException e) {
                System.err.println("Invalid path: " + e.getMessage());
                return EXIT_BAD_INPUT;
            }
        }
    }

    @Command(name = "decode", description = "Decode an opaque id back into a path", mixinStandardHelpOptions = true)
    static class DecodeCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Opaque id")
        String id;

        @Override
        public Integer call() {
            try {
                System.out.println(OpaqueIdCodec.decode(id));
                return EXIT_OK;
            } catch (ElementPathException e) {
                System.err.println("Invalid opaque id: " + e.getMessage());
                return EXIT_BAD_INPUT;
            }
        }
    }
}
