package dev.bbengine.handoff;

import dev.bbengine.Errors;
import dev.bbengine.bidding.Auction;
import dev.bbengine.bidding.Deal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Name to hand-off lookup. Names are case-insensitive, so a bidding system
 * may write {@code CONFI} or {@code confi}.
 */
public class HandOffRegistry {

    private static final String KIND = "HandOff";

    private final Map<String, HandOffFactory> factories = new LinkedHashMap<>();
    private volatile boolean frozen;

    /**
     * A frozen registry holding the built-in conventions.
     */
    public static HandOffRegistry standard() {
        return new HandOffRegistry()
            .register("confi", ConfiHandOff::new)
            .freeze();
    }

    /**
     * @throws Errors.DuplicateRegistrationError if the name is taken
     * @throws Errors.RegistryFrozenError after {@link #freeze()}
     */
    public synchronized HandOffRegistry register(String name, HandOffFactory factory) {
        String key = key(name);
        if (frozen) {
            throw new Errors.RegistryFrozenError(KIND, key);
        }
        if (factories.containsKey(key)) {
            throw new Errors.DuplicateRegistrationError(KIND, key);
        }
        factories.put(key, factory);
        return this;
    }

    public synchronized HandOffRegistry freeze() {
        frozen = true;
        return this;
    }

    public boolean contains(String name) {
        return factories.containsKey(key(name));
    }

    /**
     * @throws Errors.UnknownHandOffError if nothing is registered under the name
     */
    public HandOffFactory get(String name) {
        HandOffFactory factory = factories.get(key(name));
        if (factory == null) {
            throw new Errors.UnknownHandOffError(name);
        }
        return factory;
    }

    /**
     * Create and run the named hand-off to completion.
     */
    public void run(String name, Deal deal, Auction auction) {
        get(name).create(deal, auction).run();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
