package com.roundgrader.actors;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.actor.testkit.typed.javadsl.TestProbe;
import akka.actor.typed.ActorRef;
import akka.actor.typed.DispatcherSelector;
import akka.actor.typed.javadsl.Behaviors;
import com.roundgrader.models.Participant;
import com.roundgrader.pipeline.BatchSummary;
import com.roundgrader.pipeline.EvaluationService;
import com.roundgrader.pipeline.RoundDispatchService;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PipelineCoordinatorActorTest {

    private static final ActorTestKit testKit = ActorTestKit.create();

    @AfterAll
    static void shutdown() {
        testKit.shutdownTestKit();
    }

    private ActorRef<PipelineMessages.Message> coordinatorWithRecordingWorker(TestProbe<PipelineMessages.Message> workerInbox) {
        return testKit.spawn(PipelineCoordinatorActor.create(
                coordinator -> Behaviors.receiveMessage(msg -> {
                    workerInbox.ref().tell(msg);
                    return Behaviors.same();
                }),
                DispatcherSelector.defaultDispatcher()));
    }

    @Test
    void forwardsCommandAndRelaysWorkerSummary() {
        TestProbe<PipelineMessages.Message> workerInbox = testKit.createTestProbe();
        TestProbe<PipelineMessages.BatchReply> caller = testKit.createTestProbe();
        ActorRef<PipelineMessages.Message> coordinator = coordinatorWithRecordingWorker(workerInbox);

        coordinator.tell(new PipelineMessages.RunRoundTwo(caller.ref()));
        workerInbox.expectMessageClass(PipelineMessages.RunRoundTwo.class);

        BatchSummary summary = new BatchSummary(2, 1, 0, 3);
        coordinator.tell(new PipelineMessages.WorkerFinished(PipelineCoordinatorActor.ROUND_TWO, summary));

        PipelineMessages.BatchCompleted reply = caller.expectMessageClass(PipelineMessages.BatchCompleted.class);
        assertEquals("round2", reply.getBatch());
        assertEquals(summary, reply.getSummary());
    }

    @Test
    void rejectsSecondBatchWhileOneIsRunning() {
        TestProbe<PipelineMessages.Message> workerInbox = testKit.createTestProbe();
        TestProbe<PipelineMessages.BatchReply> first = testKit.createTestProbe();
        TestProbe<PipelineMessages.BatchReply> second = testKit.createTestProbe();
        ActorRef<PipelineMessages.Message> coordinator = coordinatorWithRecordingWorker(workerInbox);

        coordinator.tell(new PipelineMessages.RunEvaluation(1, false, first.ref()));
        workerInbox.expectMessageClass(PipelineMessages.RunEvaluation.class);
        coordinator.tell(new PipelineMessages.RunRoundOne(List.of(), second.ref()));

        PipelineMessages.BatchFailed rejected = second.expectMessageClass(PipelineMessages.BatchFailed.class);
        assertEquals("round1", rejected.getBatch());
        assertEquals("Batch evaluation is already running", rejected.getError());
        workerInbox.expectNoMessage();

        coordinator.tell(new PipelineMessages.WorkerFailed(PipelineCoordinatorActor.EVALUATION, "disk full"));
        assertEquals("disk full", first.expectMessageClass(PipelineMessages.BatchFailed.class).getError());

        coordinator.tell(new PipelineMessages.RunRoundOne(List.of(), second.ref()));
        workerInbox.expectMessageClass(PipelineMessages.RunRoundOne.class);
    }

    @Test
    void realWorkerRunsTheServiceAndReportsFailures() throws Exception {
        RoundDispatchService dispatchService = mock(RoundDispatchService.class);
        EvaluationService evaluationService = mock(EvaluationService.class);
        Participant participant = new Participant("t", "a@x.com", "http://a/api/build", "s");
        when(dispatchService.runRoundOne(List.of(participant))).thenReturn(new BatchSummary(1, 0, 0, 1));
        when(evaluationService.evaluatePending(null, true)).thenThrow(new IllegalStateException("ledger closed"));

        ActorRef<PipelineMessages.Message> coordinator = testKit.spawn(PipelineCoordinatorActor.create(
                self -> PipelineWorkerActor.create(dispatchService, evaluationService, self),
                DispatcherSelector.defaultDispatcher()));
        TestProbe<PipelineMessages.BatchReply> caller = testKit.createTestProbe();

        coordinator.tell(new PipelineMessages.RunRoundOne(List.of(participant), caller.ref()));
        assertEquals(new BatchSummary(1, 0, 0, 1),
                caller.expectMessageClass(PipelineMessages.BatchCompleted.class).getSummary());

        coordinator.tell(new PipelineMessages.RunEvaluation(null, true, caller.ref()));
        PipelineMessages.BatchFailed failed = caller.expectMessageClass(PipelineMessages.BatchFailed.class);
        assertEquals("evaluation", failed.getBatch());
        assertEquals("ledger closed", failed.getError());
    }
}
