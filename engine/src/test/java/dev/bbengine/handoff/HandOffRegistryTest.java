package dev.bbengine.handoff;

import dev.bbengine.Errors;
import dev.bbengine.bidding.Auction;
import dev.bbengine.bidding.Deal;
import dev.bbengine.bidding.Seat;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandOffRegistryTest {

    private static final HandOffFactory PASS_OUT = (deal, auction) -> auction::allPass;

    @Test
    void standard_registry_knows_confi_in_any_case() {
        HandOffRegistry registry = HandOffRegistry.standard();

        assertThat(registry.names()).containsExactly("confi");
        assertThat(registry.contains("CONFI")).isTrue();
        assertThat(registry.get("Confi")).isNotNull();
    }

    @Test
    void names_differing_only_in_case_collide() {
        HandOffRegistry registry = new HandOffRegistry().register("stayman", PASS_OUT);

        assertThatThrownBy(() -> registry.register("STAYMAN", PASS_OUT))
            .isInstanceOf(Errors.DuplicateRegistrationError.class);
    }

    @Test
    void frozen_registry_rejects_registration() {
        assertThatThrownBy(() -> HandOffRegistry.standard().register("stayman", PASS_OUT))
            .isInstanceOf(Errors.RegistryFrozenError.class);
    }

    @Test
    void unknown_hand_off_is_reported_by_name() {
        assertThatThrownBy(() -> HandOffRegistry.standard().get("blackwood"))
            .isInstanceOfSatisfying(Errors.UnknownHandOffError.class,
                e -> assertThat(e.getName()).isEqualTo("blackwood"));
    }

    @Test
    void run_creates_and_runs_the_hand_off() {
        HandOffRegistry registry = new HandOffRegistry().register("passout", PASS_OUT);
        Auction auction = new Auction(Seat.NORTH);

        registry.run("passout", Deal.parse("AKx AKx AKx AKxx", "xxx xxx xxx xxxx"), auction);

        assertThat(auction.completed()).isTrue();
        assertThat(auction.bids()).hasSize(4);
    }
}
