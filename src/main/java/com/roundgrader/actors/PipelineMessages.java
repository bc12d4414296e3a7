package com.roundgrader.actors;

import akka.actor.typed.ActorRef;
import com.roundgrader.models.Participant;
import com.roundgrader.pipeline.BatchSummary;

import java.util.List;

/**
 * Commands and replies exchanged by the batch coordinator, its worker and the caller.
 */
public class PipelineMessages {

    public interface Message {
        // Marker interface for coordinator and worker commands
    }

    public interface BatchReply {
        // Marker interface for replies to the caller
    }

    // Batch commands

    public static class RunRoundOne implements Message {
        private final List<Participant> participants;
        private final ActorRef<BatchReply> replyTo;

        public RunRoundOne(List<Participant> participants, ActorRef<BatchReply> replyTo) {
            this.participants = List.copyOf(participants);
            this.replyTo = replyTo;
        }

        public List<Participant> getParticipants() { return participants; }
        public ActorRef<BatchReply> getReplyTo() { return replyTo; }
    }

    public static class RunRoundTwo implements Message {
        private final ActorRef<BatchReply> replyTo;

        public RunRoundTwo(ActorRef<BatchReply> replyTo) {
            this.replyTo = replyTo;
        }

        public ActorRef<BatchReply> getReplyTo() { return replyTo; }
    }

    public static class RunEvaluation implements Message {
        private final Integer round;
        private final boolean force;
        private final ActorRef<BatchReply> replyTo;

        /**
         * @param round round to evaluate, or {@code null} for every round
         */
        public RunEvaluation(Integer round, boolean force, ActorRef<BatchReply> replyTo) {
            this.round = round;
            this.force = force;
            this.replyTo = replyTo;
        }

        public Integer getRound() { return round; }
        public boolean isForce() { return force; }
        public ActorRef<BatchReply> getReplyTo() { return replyTo; }
    }

    // Worker to coordinator

    public static class WorkerFinished implements Message {
        private final String batch;
        private final BatchSummary summary;

        public WorkerFinished(String batch, BatchSummary summary) {
            this.batch = batch;
            this.summary = summary;
        }

        public String getBatch() { return batch; }
        public BatchSummary getSummary() { return summary; }
    }

    public static class WorkerFailed implements Message {
        private final String batch;
        private final String error;

        public WorkerFailed(String batch, String error) {
            this.batch = batch;
            this.error = error;
        }

        public String getBatch() { return batch; }
        public String getError() { return error; }
    }

    // Replies

    public static class BatchCompleted implements BatchReply {
        private final String batch;
        private final BatchSummary summary;

        public BatchCompleted(String batch, BatchSummary summary) {
            this.batch = batch;
            this.summary = summary;
        }

        public String getBatch() { return batch; }
        public BatchSummary getSummary() { return summary; }
    }

    public static class BatchFailed implements BatchReply {
        private final String batch;
        private final String error;

        public BatchFailed(String batch, String error) {
            this.batch = batch;
            this.error = error;
        }

        public String getBatch() { return batch; }
        public String getError() { return error; }
    }
}
