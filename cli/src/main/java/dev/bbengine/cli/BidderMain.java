package dev.bbengine.cli;

import dev.bbengine.Errors;
import dev.bbengine.bidding.Auction;
import dev.bbengine.bidding.Deal;
import dev.bbengine.system.Bidder;
import dev.bbengine.system.BiddingSystem;
import dev.bbengine.system.SystemLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Bids one deal from the command line.
 *
 * <pre>
 * bbengine "AQ3 AK3 J2 AQ652" "K9742 J2 QJ65 K3"
 * 2N P 3N P 4D P 4N P P P
 * contract: 4N by N
 * </pre>
 */
public class BidderMain {
    private static final Logger logger = LoggerFactory.getLogger(BidderMain.class);

    private final BidderConfig config;
    private final PrintStream out;
    private final PrintStream err;

    public BidderMain(BidderConfig config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    public int run(String... args) {
        if (args.length != 2) {
            err.println("usage: bbengine \"<north hand>\" \"<south hand>\"");
            err.println("  hands list spades, hearts, diamonds, clubs, e.g. \"AKxxx AKx AKx QJ\"");
            return ExitCode.USAGE_ERROR;
        }

        try {
            BiddingSystem system = new SystemLoader().load(config.getSystemLocation());
            Bidder bidder = Bidder.withStandardRegistries(system);
            Auction auction = bidder.auction(config.getDealer(), Deal.parse(args[0], args[1]));

            out.println(auction);
            if (auction.finalContract() == null) {
                out.println("passed out");
            } else {
                out.println("contract: " + auction.finalContract() + " by " + auction.declarer().symbol());
            }
            return ExitCode.SUCCESS;
        } catch (Errors.BiddingError e) {
            err.println("error: " + e.getMessage());
            if (e.isInvalidInput()) {
                return ExitCode.INPUT_ERROR;
            }
            logger.error("bidding_failed", e);
            return ExitCode.CONFIGURATION_ERROR;
        }
    }

    public static void main(String[] args) {
        BidderConfig config = BidderConfig.fromEnvironment();
        int code = new BidderMain(config, System.out, System.err).run(args);
        System.exit(code);
    }
}
