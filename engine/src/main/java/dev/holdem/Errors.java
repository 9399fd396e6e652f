package dev.holdem;

import io.grpc.Status;

/**
 * Exception types for engine errors.
 *
 * <p>Every error carries a {@link Status.Code} so that a transport in front of the
 * engine can report it without inspecting the concrete type.
 */
public class Errors {

    /**
     * Base exception for all engine errors.
     */
    public static class PokerError extends RuntimeException {
        private final Status.Code statusCode;

        public PokerError(String message, Status.Code statusCode) {
            super(message);
            this.statusCode = statusCode;
        }

        public PokerError(String message, Status.Code statusCode, Throwable cause) {
            super(message, cause);
            this.statusCode = statusCode;
        }

        public Status.Code getStatusCode() {
            return statusCode;
        }

        /**
         * Convert to gRPC Status for transports that speak it.
         */
        public Status toGrpcStatus() {
            return Status.fromCode(statusCode).withDescription(getMessage());
        }

        /**
         * Returns true if the current round cannot continue after this error.
         */
        public boolean isFatal() {
            return true;
        }

        /**
         * Returns true if the caller can retry or otherwise carry on.
         */
        public boolean isRecoverable() {
            return !isFatal();
        }

        public boolean isPreconditionFailed() {
            return statusCode == Status.Code.FAILED_PRECONDITION;
        }

        public boolean isInvalidArgument() {
            return statusCode == Status.Code.INVALID_ARGUMENT;
        }
    }

    /**
     * Thrown when a table operation is refused.
     *
     * <p>Usage:
     * <pre>{@code
     * if (state.isFull()) {
     *     throw Errors.CommandRejectedError.preconditionFailed("Cannot add more players");
     * }
     * if (bigBlind <= 0) {
     *     throw Errors.CommandRejectedError.invalidArgument("big blind must be positive");
     * }
     * }</pre>
     */
    public static class CommandRejectedError extends PokerError {

        public CommandRejectedError(String message) {
            this(message, Status.Code.FAILED_PRECONDITION);
        }

        public CommandRejectedError(String message, Status.Code statusCode) {
            super(message, statusCode);
        }

        /**
         * Create a FAILED_PRECONDITION error for state precondition violations.
         */
        public static CommandRejectedError preconditionFailed(String message) {
            return new CommandRejectedError(message, Status.Code.FAILED_PRECONDITION);
        }

        /**
         * Create an INVALID_ARGUMENT error for invalid inputs.
         */
        public static CommandRejectedError invalidArgument(String message) {
            return new CommandRejectedError(message, Status.Code.INVALID_ARGUMENT);
        }

        @Override
        public boolean isFatal() {
            return false;
        }
    }

    /**
     * Thrown when a decision provider answers with an action the rules do not allow.
     *
     * <p>Carries enough context to diagnose the misbehaving provider.
     */
    public static class ProtocolViolationError extends PokerError {
        private final String player;
        private final String stage;
        private final String attemptedAction;
        private final long call;

        public ProtocolViolationError(String reason, String player, String stage,
                                      String attemptedAction, long call) {
            super(String.format("%s (player=%s, stage=%s, action=%s, call=%d)",
                reason, player, stage, attemptedAction, call), Status.Code.FAILED_PRECONDITION);
            this.player = player;
            this.stage = stage;
            this.attemptedAction = attemptedAction;
            this.call = call;
        }

        public String getPlayer() {
            return player;
        }

        public String getStage() {
            return stage;
        }

        public String getAttemptedAction() {
            return attemptedAction;
        }

        public long getCall() {
            return call;
        }
    }

    /**
     * Thrown when the deck cannot supply the requested cards. The deck is left untouched.
     */
    public static class DeckExhaustedError extends PokerError {
        private final int requested;
        private final int remaining;

        public DeckExhaustedError(int requested, int remaining) {
            super(String.format("Not enough cards left: requested %d, remaining %d",
                requested, remaining), Status.Code.RESOURCE_EXHAUSTED);
            this.requested = requested;
            this.remaining = remaining;
        }

        public int getRequested() {
            return requested;
        }

        public int getRemaining() {
            return remaining;
        }

        @Override
        public boolean isFatal() {
            return false;
        }
    }

    /**
     * Thrown when a decision provider returns no decision (timeout or closed transport).
     */
    public static class NoDecisionError extends PokerError {
        private final String player;

        public NoDecisionError(String player, String stage) {
            super(String.format("No bet received from player %s during %s", player, stage),
                Status.Code.UNAVAILABLE);
            this.player = player;
        }

        public String getPlayer() {
            return player;
        }
    }

    /**
     * Thrown when internal bookkeeping disagrees with itself.
     */
    public static class InvariantViolationError extends PokerError {
        public InvariantViolationError(String message) {
            super(message, Status.Code.INTERNAL);
        }
    }
}
