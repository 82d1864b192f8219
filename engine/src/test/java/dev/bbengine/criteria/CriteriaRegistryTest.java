package dev.bbengine.criteria;

import dev.bbengine.Errors;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CriteriaRegistryTest {

    private static final Criterion ALWAYS = (spec, hand, auction, checker) -> true;

    @Test
    void standard_registry_holds_the_built_ins_and_is_frozen() {
        CriteriaRegistry registry = CriteriaRegistry.standard();

        assertThat(registry.names())
            .containsExactly("opening", "shape", "balanced", "hcp", "controls", "or");
        assertThat(registry.isFrozen()).isTrue();
    }

    @Test
    void standard_registries_are_independent() {
        assertThat(CriteriaRegistry.standard()).isNotSameAs(CriteriaRegistry.standard());
    }

    @Test
    void register_then_get() {
        CriteriaRegistry registry = new CriteriaRegistry().register("always", ALWAYS);

        assertThat(registry.contains("always")).isTrue();
        assertThat(registry.get("always")).isSameAs(ALWAYS);
    }

    @Test
    void duplicate_name_is_rejected() {
        CriteriaRegistry registry = new CriteriaRegistry().register("always", ALWAYS);

        assertThatThrownBy(() -> registry.register("always", ALWAYS))
            .isInstanceOfSatisfying(Errors.DuplicateRegistrationError.class,
                e -> assertThat(e.getName()).isEqualTo("always"));
    }

    @Test
    void frozen_registry_rejects_registration() {
        CriteriaRegistry registry = new CriteriaRegistry().freeze();

        assertThatThrownBy(() -> registry.register("always", ALWAYS))
            .isInstanceOf(Errors.RegistryFrozenError.class);
    }

    @Test
    void unknown_name_is_reported_by_name() {
        assertThatThrownBy(() -> CriteriaRegistry.standard().get("vulnerable"))
            .isInstanceOfSatisfying(Errors.UnknownCriterionError.class,
                e -> assertThat(e.getName()).isEqualTo("vulnerable"));
    }
}
