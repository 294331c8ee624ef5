package com.agentflow.orchestrator.cli;

import com.agentflow.orchestrator.model.WorkflowDefinition;
import com.agentflow.orchestrator.service.BatchRunService;
import com.agentflow.orchestrator.service.ReportWriter;
import com.agentflow.orchestrator.service.RepositoryScanner;
import com.agentflow.orchestrator.service.RunReport;
import com.agentflow.orchestrator.service.WorkflowRunService;
import com.agentflow.orchestrator.workflow.WorkflowDefinitionException;
import com.agentflow.orchestrator.workflow.WorkflowLoader;
import com.agentflow.orchestrator.workflow.WorkflowNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Command-line surface:
 *
 * <pre>
 *   scan      --root=DIR [--include=GLOBS] [--exclude=GLOBS]
 *   apply     --workflow=NAME [--path=DIR] [--out=FILE] [--dry-run]
 *   apply-all --workflow=NAME [--root=DIR] [--out-dir=DIR] [--include=GLOBS]
 *             [--exclude=GLOBS] [--workers=N] [--dry-run]
 * </pre>
 *
 * Options use Spring's {@code --name=value} form; GLOBS is a comma-separated
 * list matched against repository directory names.
 *
 * Without a positional argument the runner does nothing and the HTTP API
 * serves instead. Exit code is 0 whenever the runs completed, whatever their
 * results; task failures and compliance failures live in the reports.
 * Non-zero only for usage errors (2) and workflows that cannot be loaded
 * or uncaught failures (1).
 */
@Component
public class WorkflowCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCommandRunner.class);

    public static final Set<String> COMMANDS = Set.of("scan", "apply", "apply-all");

    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE   = 2;

    private final WorkflowLoader     loader;
    private final WorkflowRunService runService;
    private final BatchRunService    batchService;
    private final RepositoryScanner  scanner;
    private final ReportWriter       writer;
    private final String             reportsDir;

    private PrintStream out = System.out;
    private int exitCode = 0;

    public WorkflowCommandRunner(WorkflowLoader loader,
                                 WorkflowRunService runService,
                                 BatchRunService batchService,
                                 RepositoryScanner scanner,
                                 ReportWriter writer,
                                 @Value("${agentflow.reports.dir:reports}") String reportsDir) {
        this.loader       = loader;
        this.runService   = runService;
        this.batchService = batchService;
        this.scanner      = scanner;
        this.writer       = writer;
        this.reportsDir   = reportsDir;
    }

    /**
     * True when any non-option argument is present. Unknown words count too,
     * so a mistyped command exits with a usage error instead of starting the
     * HTTP server.
     */
    public static boolean isCommand(String[] args) {
        return Arrays.stream(args).anyMatch(a -> !a.startsWith("--"));
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            return;
        }
        String command = positional.get(0);
        try {
            switch (command) {
                case "scan"      -> scan(args);
                case "apply"     -> apply(args);
                case "apply-all" -> applyAll(args);
                default -> {
                    log.error("Unknown command '{}'; expected one of {}", command, COMMANDS);
                    exitCode = EXIT_USAGE;
                }
            }
        } catch (UsageException e) {
            log.error("{}", e.getMessage());
            exitCode = EXIT_USAGE;
        } catch (WorkflowNotFoundException | WorkflowDefinitionException e) {
            log.error("Cannot load workflow: {}", e.getMessage());
            exitCode = EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Command '{}' failed: {}", command, e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    // ------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------

    private void scan(ApplicationArguments args) {
        Path root = Path.of(option(args, "root", "."));
        for (Path repo : scanner.scan(root, list(args, "include"), list(args, "exclude"))) {
            out.println(repo);
        }
    }

    private void apply(ApplicationArguments args) {
        WorkflowDefinition workflow = loader.load(required(args, "workflow"));
        Path repo = Path.of(option(args, "path", "."));

        RunReport report = runService.run(workflow, repo.toString(), repo.toString());
        printOutcome(report);

        if (args.containsOption("dry-run")) {
            log.info("Dry run: report for {} not written", repo);
            return;
        }
        Path file = args.containsOption("out")
                ? Path.of(args.getOptionValues("out").get(0))
                : Path.of(reportsDir, ReportWriter.fileSafe(repo.toString()) + "-" + ReportWriter.fileSafe(workflow.name()) + ".json");
        writer.write(report, file);
    }

    private void applyAll(ApplicationArguments args) {
        WorkflowDefinition workflow = loader.load(required(args, "workflow"));
        Path root = Path.of(option(args, "root", "."));
        List<Path> repos = scanner.scan(root, list(args, "include"), list(args, "exclude"));

        int workers = parseInt(option(args, "workers", String.valueOf(batchService.defaultWorkers())), "workers");
        Path outDir = Path.of(option(args, "out-dir", reportsDir));

        BatchRunService.BatchOutcome outcome = batchService.runAll(
                workflow, repos, workers, outDir, args.containsOption("dry-run"));
        outcome.reports().forEach(this::printOutcome);
        out.printf("global %s: %d result(s), success rate %.3f, compliant=%s%n",
                workflow.name(), outcome.aggregate().results().size(),
                outcome.aggregate().summary().successRate(), outcome.aggregate().compliance().passed());
    }

    private void printOutcome(RunReport report) {
        out.printf("%s [%s] %s: %d task(s), success rate %.3f, compliant=%s%n",
                report.label(), report.runId(), report.workflow(), report.results().size(),
                report.summary().successRate(), report.compliance().passed());
        report.compliance().violations().forEach(v -> out.println("  violation: " + v));
    }

    // ------------------------------------------------------------------
    // Argument helpers
    // ------------------------------------------------------------------

    private static String option(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        return (values == null || values.isEmpty() || values.get(0).isBlank()) ? fallback : values.get(0);
    }

    private static String required(ApplicationArguments args, String name) {
        String value = option(args, name, null);
        if (value == null) {
            throw new UsageException("Missing required option --" + name);
        }
        return value;
    }

    private static List<String> list(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .flatMap(v -> Arrays.stream(v.split(",")))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static int parseInt(String value, String name) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("--" + name + " must be an integer, got '" + value + "'");
        }
    }

    static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
