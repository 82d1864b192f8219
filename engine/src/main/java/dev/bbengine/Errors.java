package dev.bbengine;

/**
 * Exception types raised by the bidding engine.
 *
 * <p>Three families, distinguishable without type checks:
 * <ul>
 *   <li>configuration errors: the bidding system or a registry is wrong
 *       ({@link BiddingError#isConfigurationError()})
 *   <li>invariant violations: the engine reached a state it must never reach
 *       ({@link BiddingError#isInvariantViolation()})
 *   <li>invalid input: a caller handed over a malformed hand or bid
 *       ({@link BiddingError#isInvalidInput()})
 * </ul>
 *
 * <p>None of them are recovered from inside the engine; they propagate to the
 * caller of {@code Bidder.bid}.
 */
public final class Errors {

    private Errors() {}

    /**
     * Base exception for all engine errors.
     */
    public static class BiddingError extends RuntimeException {
        public BiddingError(String message) {
            super(message);
        }

        public BiddingError(String message, Throwable cause) {
            super(message, cause);
        }

        /**
         * Returns true if the bidding system or a registry is misconfigured.
         */
        public boolean isConfigurationError() {
            return false;
        }

        /**
         * Returns true if an engine invariant was broken.
         */
        public boolean isInvariantViolation() {
            return false;
        }

        /**
         * Returns true if the caller supplied malformed input.
         */
        public boolean isInvalidInput() {
            return false;
        }
    }

    // =========================================================================
    // Configuration errors
    // =========================================================================

    /**
     * Base class for problems in the bidding system or the registries.
     */
    public static class ConfigurationError extends BiddingError {
        public ConfigurationError(String message) {
            super(message);
        }

        public ConfigurationError(String message, Throwable cause) {
            super(message, cause);
        }

        @Override
        public boolean isConfigurationError() {
            return true;
        }
    }

    /**
     * Thrown when a criterion or hand-off name is registered twice.
     */
    public static class DuplicateRegistrationError extends ConfigurationError {
        private final String name;

        public DuplicateRegistrationError(String kind, String name) {
            super(kind + " '" + name + "' already registered");
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    /**
     * Thrown when a frozen registry is modified.
     */
    public static class RegistryFrozenError extends ConfigurationError {
        public RegistryFrozenError(String kind, String name) {
            super("Cannot register " + kind + " '" + name + "': registry is frozen");
        }
    }

    /**
     * Thrown when a bid node carries no criteria.
     */
    public static class MissingCriteriaError extends ConfigurationError {
        public MissingCriteriaError(String bid) {
            super("No criteria found for bid " + bid);
        }
    }

    /**
     * Thrown when a rule names a criterion nobody registered.
     */
    public static class UnknownCriterionError extends ConfigurationError {
        private final String name;

        public UnknownCriterionError(String name) {
            super("Unknown criterion: " + name);
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    /**
     * Thrown when a bid node names a hand-off nobody registered.
     */
    public static class UnknownHandOffError extends ConfigurationError {
        private final String name;

        public UnknownHandOffError(String name) {
            super("Unknown hand-off: " + name);
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    /**
     * Thrown when a criterion's parameters cannot be interpreted.
     */
    public static class InvalidCriterionError extends ConfigurationError {
        public InvalidCriterionError(String message) {
            super(message);
        }

        public InvalidCriterionError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Thrown when a shape pattern string is malformed.
     */
    public static class InvalidShapePatternError extends ConfigurationError {
        public InvalidShapePatternError(String pattern, String reason) {
            super("Invalid shape pattern '" + pattern + "': " + reason);
        }
    }

    /**
     * Thrown when a bidding system file cannot be read or is structurally wrong.
     */
    public static class SystemLoadError extends ConfigurationError {
        public SystemLoadError(String message) {
            super(message);
        }

        public SystemLoadError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    // =========================================================================
    // Invariant violations
    // =========================================================================

    /**
     * Thrown when an auction is asked to do something its state forbids.
     */
    public static class InvalidStateError extends BiddingError {
        public InvalidStateError(String message) {
            super(message);
        }

        @Override
        public boolean isInvariantViolation() {
            return true;
        }
    }

    /**
     * Thrown when a bid is appended to a completed auction.
     */
    public static class AuctionAlreadyOverError extends InvalidStateError {
        public AuctionAlreadyOverError(String attemptedBid) {
            super("Auction is already over, cannot add " + attemptedBid);
        }
    }

    /**
     * Thrown when a contract bid does not outrank the bid before it.
     */
    public static class InsufficientBidError extends InvalidStateError {
        public InsufficientBidError(String attemptedBid, String highestBid) {
            super("Insufficient bid " + attemptedBid + " over " + highestBid);
        }
    }

    /**
     * Thrown when a successor is requested past 7NT.
     */
    public static class BidSpaceExhaustedError extends BiddingError {
        public BidSpaceExhaustedError(String message) {
            super(message);
        }

        @Override
        public boolean isInvariantViolation() {
            return true;
        }
    }

    /**
     * Thrown when a convention must sign off in no-trump and no such bid is left.
     */
    public static class NoSignoffAvailableError extends BiddingError {
        public NoSignoffAvailableError(String from) {
            super("No no-trump sign-off available at or above " + from);
        }

        @Override
        public boolean isInvariantViolation() {
            return true;
        }
    }

    // =========================================================================
    // Invalid input
    // =========================================================================

    /**
     * Thrown when a hand's text form cannot be parsed.
     */
    public static class InvalidHandError extends BiddingError {
        public InvalidHandError(String message) {
            super(message);
        }

        @Override
        public boolean isInvalidInput() {
            return true;
        }
    }

    /**
     * Thrown when a bid's text form cannot be parsed.
     */
    public static class InvalidBidError extends BiddingError {
        public InvalidBidError(String message) {
            super(message);
        }

        @Override
        public boolean isInvalidInput() {
            return true;
        }
    }
}
