package dev.bbengine.cli;

/**
 * Process exit codes for the bidder command.
 */
public final class ExitCode {
    /** Auction produced */
    public static final int SUCCESS = 0;

    /** Wrong number of arguments */
    public static final int USAGE_ERROR = 1;

    /** Bidding system or registry misconfigured, or an engine invariant broke */
    public static final int CONFIGURATION_ERROR = 2;

    /** A hand could not be parsed */
    public static final int INPUT_ERROR = 3;

    private ExitCode() {}
}
