package com.cee.engine;

import com.cee.config.EngineConfig;
import com.cee.graph.GraphContractException;
import com.cee.graph.GraphJson;
import com.cee.graph.model.GoalConstraint;
import com.cee.graph.model.Graph;
import com.cee.reconciliation.ReconcileOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: reconciles and validates one graph JSON file and prints the report as JSON.
 * <pre>
 * GraphCheckApplication &lt;graph.json&gt; [--constraints &lt;file&gt;] [--fill-controllable-data] [--post-norm]
 * </pre>
 * Limits and the telemetry sink come from the environment (see {@link EngineConfig}).
 * Exit code 0 when the graph is valid, 1 when it is invalid, 2 on usage or input errors.
 */
public final class GraphCheckApplication {

    public static final int EXIT_VALID = 0;
    public static final int EXIT_INVALID = 1;
    public static final int EXIT_USAGE = 2;

    static final String USAGE =
            "Usage: GraphCheckApplication <graph.json> [--constraints <file>] [--fill-controllable-data] [--post-norm]";

    private static final Logger log = LoggerFactory.getLogger(GraphCheckApplication.class);

    private GraphCheckApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        return run(args, out, err, EngineConfig.fromEnvironment());
    }

    static int run(String[] args, PrintStream out, PrintStream err, EngineConfig config) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            Graph graph = GraphJson.fromJson(read(arguments.graphFile));
            List<GoalConstraint> constraints = arguments.constraintsFile != null
                    ? GraphJson.constraintsFromJson(read(arguments.constraintsFile))
                    : null;

            GraphCheckPipeline pipeline = GraphCheckPipeline.fromConfig(config);
            ReconcileOptions options = ReconcileOptions.builder()
                    .goalConstraints(constraints)
                    .fillControllableData(arguments.fillControllableData || config.isFillControllableData())
                    .requestId(arguments.graphFile.getFileName().toString())
                    .build();
            PipelineReport report = pipeline.run(graph, options);
            if (arguments.postNorm) {
                report = report.withPostNormalisation(pipeline.checkAfterClamping(report.getGraph()));
            }

            out.println(GraphJson.toJsonPretty(report));
            log.info("Graph check finished | file={} | valid={}", arguments.graphFile, report.isValid());
            return report.isValid() ? EXIT_VALID : EXIT_INVALID;
        } catch (IOException | UncheckedIOException e) {
            err.println("Cannot read input: " + e.getMessage());
            return EXIT_USAGE;
        } catch (GraphContractException e) {
            err.println("Invalid input document: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    /** Parsed command line. */
    static final class Arguments {
        final Path graphFile;
        final Path constraintsFile;
        final boolean fillControllableData;
        final boolean postNorm;

        private Arguments(Path graphFile, Path constraintsFile, boolean fillControllableData, boolean postNorm) {
            this.graphFile = graphFile;
            this.constraintsFile = constraintsFile;
            this.fillControllableData = fillControllableData;
            this.postNorm = postNorm;
        }

        static Arguments parse(String[] args) {
            if (args == null || args.length == 0) {
                throw new IllegalArgumentException("Missing graph file");
            }
            Path graphFile = null;
            Path constraintsFile = null;
            boolean fill = false;
            boolean postNorm = false;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--constraints" -> {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("--constraints requires a file");
                        }
                        constraintsFile = Path.of(args[++i]);
                    }
                    case "--fill-controllable-data" -> fill = true;
                    case "--post-norm" -> postNorm = true;
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (graphFile != null) {
                            throw new IllegalArgumentException("Only one graph file may be given");
                        }
                        graphFile = Path.of(arg);
                    }
                }
            }
            if (graphFile == null) {
                throw new IllegalArgumentException("Missing graph file");
            }
            return new Arguments(graphFile, constraintsFile, fill, postNorm);
        }
    }
}
