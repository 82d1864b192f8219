package dev.bbengine.steps;

import dev.bbengine.Errors;
import io.cucumber.java.en.Then;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Shared step definitions for failure outcomes.
 *
 * Step classes that call into the engine record the error they catch here.
 */
public class CommonSteps {

    private static Errors.BiddingError lastError;

    public static void setLastError(Errors.BiddingError error) {
        lastError = error;
    }

    public static void clearLastError() {
        lastError = null;
    }

    @Then("it fails with {string}")
    public void itFailsWith(String errorType) {
        assertThat(lastError)
            .withFailMessage("Expected a %s but nothing failed", errorType)
            .isNotNull();
        assertThat(lastError.getClass().getSimpleName()).isEqualTo(errorType);
    }

    @Then("the error is a configuration error")
    public void errorIsConfiguration() {
        assertThat(lastError).isNotNull();
        assertThat(lastError.isConfigurationError()).isTrue();
    }

    @Then("the error is an invariant violation")
    public void errorIsInvariantViolation() {
        assertThat(lastError).isNotNull();
        assertThat(lastError.isInvariantViolation()).isTrue();
    }

    @Then("the error is invalid input")
    public void errorIsInvalidInput() {
        assertThat(lastError).isNotNull();
        assertThat(lastError.isInvalidInput()).isTrue();
    }

    @Then("the error message contains {string}")
    public void errorMessageContains(String substring) {
        assertThat(lastError)
            .withFailMessage("Expected a failure but nothing failed")
            .isNotNull();
        assertThat(lastError.getMessage().toLowerCase())
            .contains(substring.toLowerCase());
    }
}
