package com.roundgrader.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.DispatcherSelector;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.roundgrader.pipeline.EvaluationService;
import com.roundgrader.pipeline.RoundDispatchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Accepts batch commands and hands them to a single worker. Only one batch runs at a time;
 * a command arriving while another batch is in flight is answered with {@link PipelineMessages.BatchFailed}.
 */
public class PipelineCoordinatorActor extends AbstractBehavior<PipelineMessages.Message> {
    private static final Logger logger = LoggerFactory.getLogger(PipelineCoordinatorActor.class);

    static final String ROUND_ONE = "round1";
    static final String ROUND_TWO = "round2";
    static final String EVALUATION = "evaluation";

    private final ActorRef<PipelineMessages.Message> worker;

    private String currentBatch;
    private ActorRef<PipelineMessages.BatchReply> currentReplyTo;

    private PipelineCoordinatorActor(ActorContext<PipelineMessages.Message> context,
                                     Function<ActorRef<PipelineMessages.Message>, Behavior<PipelineMessages.Message>> workerFactory,
                                     DispatcherSelector workerDispatcher) {
        super(context);
        this.worker = context.spawn(workerFactory.apply(context.getSelf()), "pipeline-worker", workerDispatcher);
    }

    public static Behavior<PipelineMessages.Message> create(RoundDispatchService dispatchService,
                                                            EvaluationService evaluationService) {
        return create(coordinator -> PipelineWorkerActor.create(dispatchService, evaluationService, coordinator),
                DispatcherSelector.fromConfig(PipelineWorkerActor.DISPATCHER));
    }

    /**
     * @param workerFactory builds the worker behavior given the coordinator it reports to
     */
    public static Behavior<PipelineMessages.Message> create(
            Function<ActorRef<PipelineMessages.Message>, Behavior<PipelineMessages.Message>> workerFactory,
            DispatcherSelector workerDispatcher) {
        return Behaviors.setup(context -> new PipelineCoordinatorActor(context, workerFactory, workerDispatcher));
    }

    @Override
    public Receive<PipelineMessages.Message> createReceive() {
        return newReceiveBuilder()
                .onMessage(PipelineMessages.RunRoundOne.class,
                        msg -> start(ROUND_ONE, msg, msg.getReplyTo()))
                .onMessage(PipelineMessages.RunRoundTwo.class,
                        msg -> start(ROUND_TWO, msg, msg.getReplyTo()))
                .onMessage(PipelineMessages.RunEvaluation.class,
                        msg -> start(EVALUATION, msg, msg.getReplyTo()))
                .onMessage(PipelineMessages.WorkerFinished.class, this::onWorkerFinished)
                .onMessage(PipelineMessages.WorkerFailed.class, this::onWorkerFailed)
                .build();
    }

    private Behavior<PipelineMessages.Message> start(String batch, PipelineMessages.Message command,
                                                     ActorRef<PipelineMessages.BatchReply> replyTo) {
        if (currentBatch != null) {
            logger.warn("Rejecting {} batch: {} batch still running", batch, currentBatch);
            replyTo.tell(new PipelineMessages.BatchFailed(batch, "Batch " + currentBatch + " is already running"));
            return this;
        }
        logger.info("🚀 Starting {} batch", batch);
        currentBatch = batch;
        currentReplyTo = replyTo;
        worker.tell(command);
        return this;
    }

    private Behavior<PipelineMessages.Message> onWorkerFinished(PipelineMessages.WorkerFinished msg) {
        logger.info("✅ {} batch finished: {}", msg.getBatch(), msg.getSummary());
        ActorRef<PipelineMessages.BatchReply> replyTo = currentReplyTo;
        clear();
        if (replyTo != null) {
            replyTo.tell(new PipelineMessages.BatchCompleted(msg.getBatch(), msg.getSummary()));
        }
        return this;
    }

    private Behavior<PipelineMessages.Message> onWorkerFailed(PipelineMessages.WorkerFailed msg) {
        logger.error("❌ {} batch failed: {}", msg.getBatch(), msg.getError());
        ActorRef<PipelineMessages.BatchReply> replyTo = currentReplyTo;
        clear();
        if (replyTo != null) {
            replyTo.tell(new PipelineMessages.BatchFailed(msg.getBatch(), msg.getError()));
        }
        return this;
    }

    private void clear() {
        currentBatch = null;
        currentReplyTo = null;
    }
}
