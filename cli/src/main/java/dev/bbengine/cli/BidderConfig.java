package dev.bbengine.cli;

import dev.bbengine.bidding.Seat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Runtime settings, read from the environment.
 *
 * <ul>
 *   <li>{@code BBENGINE_SYSTEM}: bidding system file path or classpath resource
 *   <li>{@code BBENGINE_DEALER}: dealer seat letter (N, E, S or W)
 * </ul>
 */
public final class BidderConfig {
    private static final Logger logger = LoggerFactory.getLogger(BidderConfig.class);

    public static final String SYSTEM_ENV = "BBENGINE_SYSTEM";
    public static final String DEALER_ENV = "BBENGINE_DEALER";
    public static final String DEFAULT_SYSTEM = "systems/kokish.yaml";
    public static final Seat DEFAULT_DEALER = Seat.NORTH;

    private final String systemLocation;
    private final Seat dealer;

    public BidderConfig(String systemLocation, Seat dealer) {
        this.systemLocation = systemLocation;
        this.dealer = dealer;
    }

    public static BidderConfig fromEnvironment() {
        return from(System.getenv());
    }

    static BidderConfig from(Map<String, String> env) {
        String system = env.get(SYSTEM_ENV);
        if (system == null || system.isBlank()) {
            system = DEFAULT_SYSTEM;
        }

        Seat dealer = DEFAULT_DEALER;
        String dealerEnv = env.get(DEALER_ENV);
        if (dealerEnv != null && !dealerEnv.isBlank()) {
            Seat parsed = dealerEnv.trim().length() == 1 ? Seat.fromSymbol(dealerEnv.trim().charAt(0)) : null;
            if (parsed == null) {
                logger.warn("Invalid {} env var '{}', using default {}", DEALER_ENV, dealerEnv, DEFAULT_DEALER);
            } else {
                dealer = parsed;
            }
        }
        return new BidderConfig(system.trim(), dealer);
    }

    public String getSystemLocation() { return systemLocation; }
    public Seat getDealer() { return dealer; }
}
