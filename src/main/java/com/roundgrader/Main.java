package com.roundgrader;

import akka.actor.typed.ActorRef;
import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.AskPattern;
import akka.http.javadsl.ServerBinding;
import akka.japi.function.Function;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundgrader.actors.PipelineCoordinatorActor;
import com.roundgrader.actors.PipelineMessages;
import com.roundgrader.checks.CheckEngine;
import com.roundgrader.checks.RepositoryChecks;
import com.roundgrader.dispatch.TaskDispatcher;
import com.roundgrader.ingest.SubmissionIngestor;
import com.roundgrader.ledger.Ledger;
import com.roundgrader.models.CheckResult;
import com.roundgrader.models.Participant;
import com.roundgrader.pipeline.BatchSummary;
import com.roundgrader.pipeline.EvaluationService;
import com.roundgrader.pipeline.RoundDispatchService;
import com.roundgrader.tasks.TaskGenerator;
import com.roundgrader.tasks.TemplateCatalog;
import com.roundgrader.utils.CsvUtils;
import com.roundgrader.utils.PipelineSettings;
import com.roundgrader.utils.Sleeper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command line entry point for the grading pipeline.
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        System.out.println("╔══════════════════════════════════════════════════════════════╗");
        System.out.println("║                       ROUNDGRADER                            ║");
        System.out.println("║                      Version 1.0.0                           ║");
        System.out.println("╚══════════════════════════════════════════════════════════════╝");
        System.out.println();

        if (args.length < 1) {
            printUsage();
            System.exit(1);
        }

        Config config = ConfigFactory.load();
        PipelineSettings settings = new PipelineSettings(config);
        logger.info("Loaded settings: ledger={}, evaluationUrl={}, interactive={}",
                settings.getJdbcUrl(), settings.getEvaluationUrl(), settings.isInteractiveEnabled());
        int exitCode;
        try {
            exitCode = run(args, config, settings);
        } catch (IllegalArgumentException e) {
            System.err.println("❌ " + e.getMessage());
            printUsage();
            exitCode = 2;
        } catch (IOException e) {
            logger.error("I/O failure", e);
            System.err.println("❌ " + e.getMessage());
            exitCode = 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("🛑 Interrupted");
            exitCode = 130;
        }
        System.exit(exitCode);
    }

    static void printUsage() {
        System.out.println("Usage: roundgrader <command> [options]");
        System.out.println("  round1 <participants.csv>        Generate and dispatch round 1 tasks");
        System.out.println("  round2                           Dispatch round 2 tasks to eligible participants");
        System.out.println("  evaluate [--round N] [--force]   Run checks for submissions without results");
        System.out.println("  export <results.csv>             Write all results to a CSV file");
        System.out.println("  serve [port]                     Start the submission ingestion server");
    }

    private static int run(String[] args, Config config, PipelineSettings settings)
            throws IOException, InterruptedException {
        ObjectMapper objectMapper = new ObjectMapper();
        Ledger ledger = Ledger.open(settings.getJdbcUrl(), objectMapper);

        switch (args[0]) {
            case "round1": {
                if (args.length < 2) {
                    throw new IllegalArgumentException("round1 needs a participants CSV path");
                }
                List<Participant> participants = CsvUtils.readParticipants(Path.of(args[1]));
                return runBatch(config, settings, ledger, objectMapper, "round 1",
                        replyTo -> new PipelineMessages.RunRoundOne(participants, replyTo));
            }
            case "round2":
                return runBatch(config, settings, ledger, objectMapper, "round 2", PipelineMessages.RunRoundTwo::new);
            case "evaluate": {
                EvaluateOptions options = EvaluateOptions.parse(args);
                return runBatch(config, settings, ledger, objectMapper, "evaluation",
                        replyTo -> new PipelineMessages.RunEvaluation(options.round, options.force, replyTo));
            }
            case "export": {
                if (args.length < 2) {
                    throw new IllegalArgumentException("export needs an output CSV path");
                }
                List<CheckResult> results = ledger.findResults(null, null);
                CsvUtils.writeResults(Path.of(args[1]), results);
                System.out.println("✅ Exported " + results.size() + " results to " + args[1]);
                return 0;
            }
            case "serve": {
                int port = args.length > 1 ? parsePort(args[1]) : settings.getServerPort();
                return serve(config, settings, ledger, objectMapper, port);
            }
            default:
                throw new IllegalArgumentException("Unknown command: " + args[0]);
        }
    }

    private static int runBatch(Config config, PipelineSettings settings, Ledger ledger, ObjectMapper objectMapper,
                                String batch, Function<ActorRef<PipelineMessages.BatchReply>, PipelineMessages.Message> command)
            throws IOException, InterruptedException {
        Sleeper sleeper = Sleeper.system();
        TemplateCatalog catalog = TemplateCatalog.load(settings.getTemplatesResource(), objectMapper);
        TaskGenerator generator = new TaskGenerator(catalog, objectMapper, Clock.systemUTC());
        RoundDispatchService dispatchService = new RoundDispatchService(ledger, generator,
                TaskDispatcher.fromSettings(settings, objectMapper, sleeper), settings.getEvaluationUrl(),
                settings.getCriticalChecks(), sleeper, settings.getPauseBetweenParticipants());
        EvaluationService evaluationService = new EvaluationService(ledger, CheckEngine.fromSettings(settings),
                RepositoryChecks.fromSettings(settings, objectMapper));

        ActorSystem<PipelineMessages.Message> system = ActorSystem.create(
                PipelineCoordinatorActor.create(dispatchService, evaluationService), "roundgrader", config);
        try {
            System.out.println("🚀 Running " + batch + " batch...");
            CompletionStage<PipelineMessages.BatchReply> reply = AskPattern.ask(system, command,
                    settings.getBatchAwaitTimeout(), system.scheduler());
            PipelineMessages.BatchReply result = reply.toCompletableFuture()
                    .get(settings.getBatchAwaitTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return report(result);
        } catch (ExecutionException | TimeoutException e) {
            logger.error("Batch did not complete", e);
            System.err.println("❌ Batch did not complete: " + e.getMessage());
            return 1;
        } finally {
            system.terminate();
        }
    }

    private static int report(PipelineMessages.BatchReply reply) {
        if (reply instanceof PipelineMessages.BatchCompleted) {
            PipelineMessages.BatchCompleted completed = (PipelineMessages.BatchCompleted) reply;
            BatchSummary summary = completed.getSummary();
            System.out.println("✅ " + completed.getBatch() + " complete");
            System.out.println("   Processed: " + summary.processed());
            System.out.println("   Skipped:   " + summary.skipped());
            System.out.println("   Failed:    " + summary.failed());
            System.out.println("   Total:     " + summary.total());
            return summary.failed() > 0 ? 3 : 0;
        }
        PipelineMessages.BatchFailed failed = (PipelineMessages.BatchFailed) reply;
        System.err.println("❌ " + failed.getBatch() + " failed: " + failed.getError());
        return 1;
    }

    private static int serve(Config config, PipelineSettings settings, Ledger ledger, ObjectMapper objectMapper,
                             int port) throws InterruptedException {
        ActorSystem<Void> system = ActorSystem.create(Behaviors.empty(), "roundgrader", config);
        WebServer server = new WebServer(system, objectMapper, new SubmissionIngestor(ledger), null, Clock.systemUTC());
        try {
            ServerBinding binding = server.start(settings.getServerHost(), port).toCompletableFuture().get();
            System.out.println("✅ Server started on port " + binding.localAddress().getPort());
            System.out.println("⏹️  Press Ctrl+C to stop the server...");
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                System.out.println("🛑 Server shutting down...");
                binding.unbind();
                system.terminate();
            }));
            system.getWhenTerminated().toCompletableFuture().get();
            return 0;
        } catch (ExecutionException e) {
            logger.error("Failed to start server", e);
            System.err.println("❌ Failed to start server: " + e.getCause().getMessage());
            system.terminate();
            return 1;
        }
    }

    private static int parsePort(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + value);
        }
    }

    static final class EvaluateOptions {
        final Integer round;
        final boolean force;

        private EvaluateOptions(Integer round, boolean force) {
            this.round = round;
            this.force = force;
        }

        static EvaluateOptions parse(String[] args) {
            Integer round = null;
            boolean force = false;
            for (int i = 1; i < args.length; i++) {
                switch (args[i]) {
                    case "--force":
                        force = true;
                        break;
                    case "--round":
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("--round needs a number");
                        }
                        try {
                            round = Integer.parseInt(args[++i]);
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("Invalid round: " + args[i]);
                        }
                        if (round < 1) {
                            throw new IllegalArgumentException("Round must be positive");
                        }
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                }
            }
            return new EvaluateOptions(round, force);
        }
    }
}
