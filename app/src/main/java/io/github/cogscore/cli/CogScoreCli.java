package io.github.cogscore.cli;

import io.github.cogscore.analyzer.TypescriptSyntaxTreeProvider;
import io.github.cogscore.complexity.UnexpectedNodeException;
import io.github.cogscore.output.ComplexityJson;
import io.github.cogscore.scan.ComplexityScanner;
import io.github.cogscore.scan.ScanOptions;
import io.github.cogscore.syntax.SyntaxTreeException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

@CommandLine.Command(
        name = "cogscore",
        mixinStandardHelpOptions = true,
        version = "cogscore 1.0.0",
        description = "Prints the cognitive complexity of a TypeScript/JavaScript file, or of every such file in a"
                + " folder, as JSON.")
public final class CogScoreCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CogScoreCli.class);

    static final int EXIT_SCORING_FAILED = 1;

    @CommandLine.Parameters(index = "0", paramLabel = "PATH", description = "Source file or folder to score.")
    private Path path;

    @CommandLine.Option(
            names = "--threads",
            description = "Files scored concurrently in a folder scan. Default: number of processors.")
    private int threads = ScanOptions.defaults().threads();

    @CommandLine.Option(
            names = "--max-tree-depth",
            description = "Reject files whose syntax tree is nested deeper than this. Default: ${DEFAULT-VALUE}.")
    private int maxTreeDepth = TypescriptSyntaxTreeProvider.DEFAULT_MAX_TREE_DEPTH;

    @CommandLine.Option(names = "--prune-zero", description = "Leave out nodes that score 0.")
    private boolean pruneZero = false;

    @CommandLine.Option(names = "--compact", description = "Print JSON on a single line.")
    private boolean compact = false;

    @CommandLine.Option(names = "--verbose", description = "Log progress to stderr.")
    private boolean verbose = false;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CogScoreCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (verbose) {
            Configurator.setRootLevel(Level.DEBUG);
        }
        if (!Files.exists(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "No such file or folder: " + path);
        }
        if (threads < 1 || maxTreeDepth < 1) {
            throw new CommandLine.ParameterException(
                    spec.commandLine(), "--threads and --max-tree-depth must be at least 1");
        }

        var options = new ScanOptions(threads, maxTreeDepth, pruneZero);
        var scanner = new ComplexityScanner(new TypescriptSyntaxTreeProvider(maxTreeDepth), options);
        var err = spec.commandLine().getErr();
        try {
            var report = scanner.scan(path);
            spec.commandLine().getOut().println(ComplexityJson.toJson(report.name(), report.result(), !compact));
            spec.commandLine().getOut().flush();
            if (report.hasFailures()) {
                err.println(report.failures().size() + " file(s) could not be scored:");
                report.failures().forEach(f -> err.println("  " + f.file() + ": " + f.message()));
                return EXIT_SCORING_FAILED;
            }
            return 0;
        } catch (IOException | SyntaxTreeException | UnexpectedNodeException e) {
            logger.error("Scoring {} failed", path, e);
            err.println("Error: " + e.getMessage());
            return EXIT_SCORING_FAILED;
        }
    }
}
