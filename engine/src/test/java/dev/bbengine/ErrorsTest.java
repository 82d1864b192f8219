package dev.bbengine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorsTest {

    // =========================================================================
    // Families
    // =========================================================================

    @Test
    void configuration_errors_report_only_as_configuration() {
        List<Errors.BiddingError> errors = List.of(
            new Errors.DuplicateRegistrationError("Criterion", "hcp"),
            new Errors.RegistryFrozenError("HandOff", "confi"),
            new Errors.MissingCriteriaError("1C"),
            new Errors.UnknownCriterionError("vulnerable"),
            new Errors.UnknownHandOffError("gerber"),
            new Errors.InvalidCriterionError("bad bound"),
            new Errors.InvalidShapePatternError("5,,3", "empty term"),
            new Errors.SystemLoadError("missing"));

        assertThat(errors).allSatisfy(e -> {
            assertThat(e.isConfigurationError()).isTrue();
            assertThat(e.isInvariantViolation()).isFalse();
            assertThat(e.isInvalidInput()).isFalse();
        });
    }

    @Test
    void invariant_violations_report_only_as_invariant_violations() {
        List<Errors.BiddingError> errors = List.of(
            new Errors.InvalidStateError("no ask"),
            new Errors.AuctionAlreadyOverError("2C"),
            new Errors.InsufficientBidError("1C", "3N"),
            new Errors.BidSpaceExhaustedError("past 7N"),
            new Errors.NoSignoffAvailableError("P"));

        assertThat(errors).allSatisfy(e -> {
            assertThat(e.isInvariantViolation()).isTrue();
            assertThat(e.isConfigurationError()).isFalse();
            assertThat(e.isInvalidInput()).isFalse();
        });
    }

    @Test
    void input_errors_report_only_as_invalid_input() {
        List<Errors.BiddingError> errors = List.of(
            new Errors.InvalidHandError("three holdings"),
            new Errors.InvalidBidError("8C"));

        assertThat(errors).allSatisfy(e -> {
            assertThat(e.isInvalidInput()).isTrue();
            assertThat(e.isConfigurationError()).isFalse();
            assertThat(e.isInvariantViolation()).isFalse();
        });
    }

    // =========================================================================
    // Messages
    // =========================================================================

    @Test
    void messages_name_the_offending_item() {
        assertThat(new Errors.DuplicateRegistrationError("Criterion", "hcp"))
            .hasMessage("Criterion 'hcp' already registered");
        assertThat(new Errors.MissingCriteriaError("1C")).hasMessage("No criteria found for bid 1C");
        assertThat(new Errors.AuctionAlreadyOverError("2C")).hasMessageContaining("2C");
    }

    @Test
    void load_error_keeps_its_cause() {
        IllegalStateException cause = new IllegalStateException("io");

        assertThat(new Errors.SystemLoadError("failed", cause)).hasCause(cause);
    }

    // =========================================================================
    // Validation helpers
    // =========================================================================

    @Test
    void validation_rejects_blank_and_empty() {
        assertThatThrownBy(() -> Validation.requireNotEmpty(" ", "system name"))
            .isInstanceOf(Errors.SystemLoadError.class)
            .hasMessageContaining("system name");
        assertThatThrownBy(() -> Validation.requireNotEmpty(List.of(), "bids"))
            .isInstanceOf(Errors.SystemLoadError.class);
        assertThatThrownBy(() -> Validation.require(false, "must hold"))
            .hasMessage("must hold");
    }

    @Test
    void validation_passes_good_values_through() {
        Validation.requireNotEmpty("kokish", "system name");
        Validation.requireNotEmpty(List.of("1N"), "bids");
        Validation.require(true, "never thrown");
    }
}
