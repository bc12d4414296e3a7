package com.roundgrader;

import akka.actor.typed.ActorSystem;
import akka.actor.typed.DispatcherSelector;
import akka.http.javadsl.Http;
import akka.http.javadsl.ServerBinding;
import akka.http.javadsl.marshallers.jackson.Jackson;
import akka.http.javadsl.model.ContentTypes;
import akka.http.javadsl.model.HttpResponse;
import akka.http.javadsl.model.StatusCode;
import akka.http.javadsl.model.StatusCodes;
import akka.http.javadsl.server.AllDirectives;
import akka.http.javadsl.server.Route;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundgrader.actors.PipelineWorkerActor;
import com.roundgrader.build.BuildOutcome;
import com.roundgrader.build.BuildRequest;
import com.roundgrader.build.BuildWorkflow;
import com.roundgrader.build.DeploymentNotFoundException;
import com.roundgrader.build.InvalidRequestException;
import com.roundgrader.ingest.SubmissionIngestor;
import com.roundgrader.ingest.SubmissionRejectedException;
import com.roundgrader.ingest.SubmissionRequest;
import com.roundgrader.models.Submission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * HTTP surface: submission ingestion, health, and optionally the build/revise endpoints.
 */
public class WebServer extends AllDirectives {
    private static final Logger logger = LoggerFactory.getLogger(WebServer.class);
    static final String SERVICE_NAME = "roundgrader";

    private final ActorSystem<?> system;
    private final ObjectMapper objectMapper;
    private final SubmissionIngestor ingestor;
    private final BuildWorkflow buildWorkflow;
    private final Clock clock;
    private final Executor blockingExecutor;

    /**
     * @param buildWorkflow build/revise handler, or {@code null} to leave those endpoints unmounted
     */
    public WebServer(ActorSystem<?> system, ObjectMapper objectMapper, SubmissionIngestor ingestor,
                     BuildWorkflow buildWorkflow, Clock clock) {
        this.system = system;
        this.objectMapper = objectMapper;
        this.ingestor = ingestor;
        this.buildWorkflow = buildWorkflow;
        this.clock = clock;
        this.blockingExecutor = system.dispatchers().lookup(DispatcherSelector.fromConfig(PipelineWorkerActor.DISPATCHER));
    }

    public CompletionStage<ServerBinding> start(String host, int port) {
        return Http.get(system)
                .newServerAt(host, port)
                .bind(createRoute())
                .thenApply(binding -> {
                    logger.info("🌐 Server online at http://{}:{}/", host, binding.localAddress().getPort());
                    return binding;
                });
    }

    Route createRoute() {
        List<Route> routes = new ArrayList<>();
        routes.add(pathSingleSlash(() -> get(() -> json(StatusCodes.OK, index()))));
        routes.add(path("health", () -> get(() -> json(StatusCodes.OK, health()))));
        routes.add(pathPrefix("api", () -> path("evaluation", () -> post(() ->
                entity(Jackson.unmarshaller(objectMapper, SubmissionRequest.class), this::handleSubmission)))));
        if (buildWorkflow != null) {
            routes.add(pathPrefix("api", () -> concat(
                    path("build", () -> post(() ->
                            entity(Jackson.unmarshaller(objectMapper, BuildRequest.class),
                                    request -> handleBuild(request, buildWorkflow::build)))),
                    path("revise", () -> post(() ->
                            entity(Jackson.unmarshaller(objectMapper, BuildRequest.class),
                                    request -> handleBuild(request, buildWorkflow::revise)))))));
        }
        return concat(routes.get(0), routes.subList(1, routes.size()).toArray(new Route[0]));
    }

    private Route handleSubmission(SubmissionRequest request) {
        try {
            Submission submission = ingestor.ingest(request);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("message", "Repository submission recorded successfully");
            body.put("repo_id", submission.getTaskId() + "-r" + submission.getRound());
            body.put("timestamp", now());
            return json(StatusCodes.OK, body);
        } catch (SubmissionRejectedException e) {
            return json(StatusCodes.BAD_REQUEST, error(e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Unexpected error recording submission", e);
            return json(StatusCodes.INTERNAL_SERVER_ERROR, error("Internal server error: " + e.getMessage()));
        }
    }

    private Route handleBuild(BuildRequest request, Function<BuildRequest, BuildOutcome> action) {
        CompletableFuture<BuildOutcome> future = CompletableFuture.supplyAsync(() -> action.apply(request), blockingExecutor);
        return onComplete(future, tryResult -> {
            if (tryResult.isSuccess()) {
                return buildResponse(tryResult.get());
            }
            Throwable cause = tryResult.failed().get();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof InvalidRequestException) {
                return json(StatusCodes.BAD_REQUEST, error(cause.getMessage()));
            }
            if (cause instanceof DeploymentNotFoundException) {
                return json(StatusCodes.NOT_FOUND, error(cause.getMessage()));
            }
            logger.error("Unexpected error in build workflow", cause);
            return json(StatusCodes.INTERNAL_SERVER_ERROR, error("Internal server error: " + cause.getMessage()));
        });
    }

    private Route buildResponse(BuildOutcome outcome) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", outcome.success());
        body.put("message", outcome.message());
        if (outcome.success()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("repo_url", outcome.repoUrl());
            data.put("pages_url", outcome.pagesUrl());
            data.put("commit_sha", outcome.commitSha());
            data.put("notification_sent", outcome.notificationSent());
            data.put("notification_attempts", outcome.notificationAttempts());
            body.put("data", data);
            if (outcome.hasWarning()) {
                body.put("warning", "Notification to evaluation URL failed: " + outcome.error());
            }
        } else {
            body.put("error", outcome.error());
        }
        body.put("timestamp", now());
        return json(outcome.success() ? StatusCodes.OK : StatusCodes.INTERNAL_SERVER_ERROR, body);
    }

    private Map<String, Object> index() {
        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "GET /health");
        endpoints.put("evaluation", "POST /api/evaluation");
        if (buildWorkflow != null) {
            endpoints.put("build", "POST /api/build");
            endpoints.put("revise", "POST /api/revise");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", SERVICE_NAME);
        body.put("endpoints", endpoints);
        return body;
    }

    private Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", SERVICE_NAME);
        body.put("timestamp", now());
        return body;
    }

    private Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        body.put("timestamp", now());
        return body;
    }

    private String now() {
        return clock.instant().toString();
    }

    private Route json(StatusCode status, Object body) {
        try {
            return complete(HttpResponse.create()
                    .withStatus(status)
                    .withEntity(ContentTypes.APPLICATION_JSON, objectMapper.writeValueAsString(body)));
        } catch (JsonProcessingException e) {
            logger.error("Cannot serialize response", e);
            return complete(HttpResponse.create()
                    .withStatus(StatusCodes.INTERNAL_SERVER_ERROR)
                    .withEntity(ContentTypes.APPLICATION_JSON, "{\"success\":false,\"error\":\"Serialization failed\"}"));
        }
    }
}
