package com.agentflow.orchestrator.cli;

import com.agentflow.orchestrator.governance.Compliance;
import com.agentflow.orchestrator.governance.ResultSummarizer;
import com.agentflow.orchestrator.model.*;
import com.agentflow.orchestrator.service.AggregateReport;
import com.agentflow.orchestrator.service.BatchRunService;
import com.agentflow.orchestrator.service.ReportWriter;
import com.agentflow.orchestrator.service.RepositoryScanner;
import com.agentflow.orchestrator.service.RunReport;
import com.agentflow.orchestrator.service.WorkflowRunService;
import com.agentflow.orchestrator.workflow.WorkflowDefinitionException;
import com.agentflow.orchestrator.workflow.WorkflowLoader;
import com.agentflow.orchestrator.workflow.WorkflowNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * CLI commands with the services mocked and a real repository scanner
 * over a temp directory.
 */
@ExtendWith(MockitoExtension.class)
class WorkflowCommandRunnerTest {

    @TempDir Path root;

    @Mock WorkflowLoader     loader;
    @Mock WorkflowRunService runService;
    @Mock BatchRunService    batchService;
    @Mock ReportWriter       writer;

    WorkflowCommandRunner runner;
    ByteArrayOutputStream stdout;

    final ResultSummarizer summarizer = new ResultSummarizer();
    final WorkflowDefinition smoke = new WorkflowDefinition("smoke", null, Transport.LOCAL, null,
            List.of(AgentTask.of("noop")));

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(root.resolve("api/.git"));
        Files.createDirectories(root.resolve("web/.git"));
        Files.createDirectories(root.resolve("docs"));

        runner = new WorkflowCommandRunner(loader, runService, batchService, new RepositoryScanner(), writer,
                root.resolve("reports").toString());
        stdout = new ByteArrayOutputStream();
        runner.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    void run(String... args) {
        runner.run(new DefaultApplicationArguments(args));
    }

    String output() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    RunReport report(String label, Compliance compliance) {
        List<AgentResult> results = List.of(AgentResult.success("noop", null, 1, 1));
        return new RunReport(label, label, label + "-run", Instant.EPOCH, "smoke", Transport.LOCAL,
                Policy.empty(), smoke.tasks(), results, summarizer.summarize(results), compliance);
    }

    // ------------------------------------------------------------------
    // Dispatch and usage errors
    // ------------------------------------------------------------------

    @Test
    void isCommand_anyPositionalArgumentSelectsCliMode() {
        assertThat(WorkflowCommandRunner.isCommand(new String[] {"--workers=2", "apply-all"})).isTrue();
        assertThat(WorkflowCommandRunner.isCommand(new String[] {"aply", "--workflow=smoke"})).isTrue();
        assertThat(WorkflowCommandRunner.isCommand(new String[] {"--server.port=9090"})).isFalse();
        assertThat(WorkflowCommandRunner.isCommand(new String[] {})).isFalse();
    }

    @Test
    void mistypedCommand_exitsWithUsageError() {
        run("aply", "--workflow=smoke");

        assertThat(runner.getExitCode()).isEqualTo(WorkflowCommandRunner.EXIT_USAGE);
        verifyNoInteractions(loader, runService, batchService, writer);
    }

    @Test
    void noCommand_doesNothing() {
        run("--server.port=9090");

        assertThat(runner.getExitCode()).isZero();
        verifyNoInteractions(loader, runService, batchService, writer);
    }

    @Test
    void unknownCommand_exitsWithUsageError() {
        run("deploy");

        assertThat(runner.getExitCode()).isEqualTo(WorkflowCommandRunner.EXIT_USAGE);
    }

    @Test
    void apply_missingWorkflow_exitsWithUsageError() {
        run("apply", "--path=" + root);

        assertThat(runner.getExitCode()).isEqualTo(WorkflowCommandRunner.EXIT_USAGE);
        verifyNoInteractions(loader);
    }

    @Test
    void apply_unknownWorkflow_exitsWithFailure() {
        when(loader.load("ghost")).thenThrow(new WorkflowNotFoundException("ghost"));

        run("apply", "--workflow=ghost");

        assertThat(runner.getExitCode()).isEqualTo(WorkflowCommandRunner.EXIT_FAILURE);
        verifyNoInteractions(runService);
    }

    @Test
    void apply_malformedWorkflow_exitsWithFailure() {
        when(loader.load("broken")).thenThrow(new WorkflowDefinitionException("Malformed workflow"));

        run("apply", "--workflow=broken");

        assertThat(runner.getExitCode()).isEqualTo(WorkflowCommandRunner.EXIT_FAILURE);
    }

    // ------------------------------------------------------------------
    // scan
    // ------------------------------------------------------------------

    @Test
    void scan_printsRepositories() {
        run("scan", "--root=" + root, "--exclude=web");

        assertThat(output())
                .contains(root.resolve("api").toString())
                .doesNotContain(root.resolve("web").toString())
                .doesNotContain(root.resolve("docs").toString());
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void scan_missingRoot_exitsWithFailure() {
        run("scan", "--root=" + root.resolve("nowhere"));

        assertThat(runner.getExitCode()).isEqualTo(WorkflowCommandRunner.EXIT_FAILURE);
    }

    // ------------------------------------------------------------------
    // apply
    // ------------------------------------------------------------------

    @Test
    void apply_writesReportToOut_andExitsZeroEvenWhenNotCompliant() {
        Path repo = root.resolve("api");
        Path out = root.resolve("out/api.json");
        RunReport report = report(repo.toString(), Compliance.of(List.of("success rate 0.000 is below the minimum 1.000")));
        when(loader.load("smoke")).thenReturn(smoke);
        when(runService.run(smoke, repo.toString(), repo.toString())).thenReturn(report);
        when(writer.write(report, out)).thenReturn(Optional.of(out));

        run("apply", "--workflow=smoke", "--path=" + repo, "--out=" + out);

        assertThat(runner.getExitCode()).isZero();
        assertThat(output()).contains("compliant=false").contains("violation: success rate");
        verify(writer).write(report, out);
    }

    @Test
    void apply_defaultOutput_isUnderReportsDir() {
        Path repo = root.resolve("api");
        RunReport report = report(repo.toString(), Compliance.of(List.of()));
        when(loader.load("smoke")).thenReturn(smoke);
        when(runService.run(any(), any(), any())).thenReturn(report);

        run("apply", "--workflow=smoke", "--path=" + repo);

        Path expected = Path.of(root.resolve("reports").toString(),
                ReportWriter.fileSafe(repo.toString()) + "-smoke.json");
        verify(writer).write(report, expected);
    }

    @Test
    void apply_dryRun_writesNothing() {
        when(loader.load("smoke")).thenReturn(smoke);
        when(runService.run(any(), any(), any())).thenReturn(report("api", Compliance.of(List.of())));

        run("apply", "--workflow=smoke", "--dry-run");

        assertThat(runner.getExitCode()).isZero();
        verifyNoInteractions(writer);
    }

    // ------------------------------------------------------------------
    // apply-all
    // ------------------------------------------------------------------

    @Test
    void applyAll_runsOverScannedRepositories() {
        RunReport api = report(root.resolve("api").toString(), Compliance.of(List.of()));
        AggregateReport aggregate = new AggregateReport("smoke", List.of(api.runId()), api.results(),
                api.summary(), Compliance.of(List.of()));
        when(loader.load("smoke")).thenReturn(smoke);
        when(batchService.runAll(any(), any(), anyInt(), any(), anyBoolean()))
                .thenReturn(new BatchRunService.BatchOutcome(List.of(api), aggregate, List.of()));

        run("apply-all", "--workflow=smoke", "--root=" + root, "--include=api,web", "--exclude=web",
                "--workers=3", "--out-dir=" + root.resolve("out"));

        verify(batchService).runAll(smoke, List.of(root.resolve("api")), 3, root.resolve("out"), false);
        assertThat(output()).contains("global smoke: 1 result(s)");
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void applyAll_defaultsWorkersFromConfig() {
        AggregateReport empty = new AggregateReport("smoke", List.of(), List.of(),
                summarizer.summarize(List.of()), Compliance.of(List.of()));
        when(loader.load("smoke")).thenReturn(smoke);
        when(batchService.defaultWorkers()).thenReturn(4);
        when(batchService.runAll(any(), any(), anyInt(), any(), anyBoolean()))
                .thenReturn(new BatchRunService.BatchOutcome(List.of(), empty, List.of()));

        run("apply-all", "--workflow=smoke", "--root=" + root.resolve("docs"), "--dry-run");

        verify(batchService).runAll(eq(smoke), eq(List.of()), eq(4), any(), eq(true));
    }

    @Test
    void applyAll_badWorkerCount_exitsWithUsageError() {
        when(loader.load("smoke")).thenReturn(smoke);

        run("apply-all", "--workflow=smoke", "--root=" + root, "--workers=many");

        assertThat(runner.getExitCode()).isEqualTo(WorkflowCommandRunner.EXIT_USAGE);
        verify(batchService, never()).runAll(any(), any(), anyInt(), any(), anyBoolean());
    }
}
