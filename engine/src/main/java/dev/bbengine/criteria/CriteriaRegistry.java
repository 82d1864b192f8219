package dev.bbengine.criteria;

import dev.bbengine.Errors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Name to criterion lookup.
 *
 * <p>Populated once at startup through explicit {@link #register} calls, then
 * frozen; a frozen registry may be shared by concurrent bidding runs.
 */
public class CriteriaRegistry {

    private static final String KIND = "Criterion";

    private final Map<String, Criterion> criteria = new LinkedHashMap<>();
    private volatile boolean frozen;

    /**
     * A frozen registry holding the built-in criteria.
     */
    public static CriteriaRegistry standard() {
        return new CriteriaRegistry()
            .register("opening", new OpeningCriterion())
            .register("shape", new ShapeCriterion())
            .register("balanced", new BalancedCriterion())
            .register("hcp", RangeCriterion.hcp())
            .register("controls", RangeCriterion.controls())
            .register("or", new OrCriterion())
            .freeze();
    }

    /**
     * @throws Errors.DuplicateRegistrationError if the name is taken
     * @throws Errors.RegistryFrozenError after {@link #freeze()}
     */
    public synchronized CriteriaRegistry register(String name, Criterion criterion) {
        if (frozen) {
            throw new Errors.RegistryFrozenError(KIND, name);
        }
        if (criteria.containsKey(name)) {
            throw new Errors.DuplicateRegistrationError(KIND, name);
        }
        criteria.put(name, criterion);
        return this;
    }

    public synchronized CriteriaRegistry freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public boolean contains(String name) {
        return criteria.containsKey(name);
    }

    /**
     * @throws Errors.UnknownCriterionError if nothing is registered under the name
     */
    public Criterion get(String name) {
        Criterion criterion = criteria.get(name);
        if (criterion == null) {
            throw new Errors.UnknownCriterionError(name);
        }
        return criterion;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(criteria.keySet());
    }
}
