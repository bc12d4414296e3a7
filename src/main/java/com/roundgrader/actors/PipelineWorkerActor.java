package com.roundgrader.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.roundgrader.pipeline.BatchSummary;
import com.roundgrader.pipeline.EvaluationService;
import com.roundgrader.pipeline.RoundDispatchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one batch at a time on a blocking dispatcher and reports back to the coordinator.
 * Every network call and retry sleep in a batch blocks this actor's thread.
 */
public class PipelineWorkerActor extends AbstractBehavior<PipelineMessages.Message> {
    private static final Logger logger = LoggerFactory.getLogger(PipelineWorkerActor.class);

    public static final String DISPATCHER = "pipeline-blocking-dispatcher";

    private final RoundDispatchService dispatchService;
    private final EvaluationService evaluationService;
    private final ActorRef<PipelineMessages.Message> coordinator;

    private PipelineWorkerActor(ActorContext<PipelineMessages.Message> context,
                                RoundDispatchService dispatchService,
                                EvaluationService evaluationService,
                                ActorRef<PipelineMessages.Message> coordinator) {
        super(context);
        this.dispatchService = dispatchService;
        this.evaluationService = evaluationService;
        this.coordinator = coordinator;
    }

    public static Behavior<PipelineMessages.Message> create(RoundDispatchService dispatchService,
                                                            EvaluationService evaluationService,
                                                            ActorRef<PipelineMessages.Message> coordinator) {
        return Behaviors.setup(context ->
                new PipelineWorkerActor(context, dispatchService, evaluationService, coordinator));
    }

    @Override
    public Receive<PipelineMessages.Message> createReceive() {
        return newReceiveBuilder()
                .onMessage(PipelineMessages.RunRoundOne.class, this::onRunRoundOne)
                .onMessage(PipelineMessages.RunRoundTwo.class, this::onRunRoundTwo)
                .onMessage(PipelineMessages.RunEvaluation.class, this::onRunEvaluation)
                .build();
    }

    private Behavior<PipelineMessages.Message> onRunRoundOne(PipelineMessages.RunRoundOne msg) {
        return runBatch(PipelineCoordinatorActor.ROUND_ONE, () -> dispatchService.runRoundOne(msg.getParticipants()));
    }

    private Behavior<PipelineMessages.Message> onRunRoundTwo(PipelineMessages.RunRoundTwo msg) {
        return runBatch(PipelineCoordinatorActor.ROUND_TWO, dispatchService::runRoundTwo);
    }

    private Behavior<PipelineMessages.Message> onRunEvaluation(PipelineMessages.RunEvaluation msg) {
        return runBatch(PipelineCoordinatorActor.EVALUATION,
                () -> evaluationService.evaluatePending(msg.getRound(), msg.isForce()));
    }

    private Behavior<PipelineMessages.Message> runBatch(String batch, BatchJob job) {
        logger.info("Worker starting {} batch", batch);
        try {
            BatchSummary summary = job.run();
            coordinator.tell(new PipelineMessages.WorkerFinished(batch, summary));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("{} batch interrupted", batch);
            coordinator.tell(new PipelineMessages.WorkerFailed(batch, "Interrupted"));
        } catch (RuntimeException e) {
            logger.error("{} batch failed", batch, e);
            coordinator.tell(new PipelineMessages.WorkerFailed(batch, String.valueOf(e.getMessage())));
        }
        return this;
    }

    @FunctionalInterface
    private interface BatchJob {
        BatchSummary run() throws InterruptedException;
    }
}
