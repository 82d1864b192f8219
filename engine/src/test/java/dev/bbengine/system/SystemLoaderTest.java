package dev.bbengine.system;

import dev.bbengine.Errors;
import dev.bbengine.bidding.Bid;
import dev.bbengine.criteria.CriterionSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SystemLoaderTest {

    private final SystemLoader loader = new SystemLoader();

    // =========================================================================
    // Reference system
    // =========================================================================

    @Test
    void kokish_loads_from_the_classpath() {
        BiddingSystem system = loader.load("systems/kokish.yaml");

        assertThat(system.getName()).isEqualTo("kokish");
        assertThat(system.getOpenings()).extracting(BidNode::getBid)
            .containsExactly(Bid.parse("1N"), Bid.parse("2N"));

        BidNode twoNoTrump = system.getOpenings().get(1);
        assertThat(twoNoTrump.getCriteria()).extracting(CriterionSpec::name)
            .containsExactly("opening", "balanced", "hcp");
        assertThat(twoNoTrump.getCriteria().get(2).attribute("min", null)).isEqualTo("20");

        BidNode ask = twoNoTrump.getResponses().get(0);
        assertThat(ask.getBid()).isEqualTo(Bid.parse("3N"));
        assertThat(ask.hasHandOff()).isTrue();
        assertThat(ask.getHandOff()).isEqualTo("confi");
    }

    @Test
    void for_each_node_visits_the_whole_tree() {
        List<Bid> visited = new ArrayList<>();

        loader.load("systems/kokish.yaml").forEachNode(node -> visited.add(node.getBid()));

        assertThat(visited).extracting(Bid::toString).containsExactly("1N", "2N", "3N");
    }

    @Test
    void file_path_takes_precedence(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("tiny.yaml");
        Files.writeString(file, "name: tiny\nbids:\n  - bid: 1C\n    criteria: [opening]\n");

        BiddingSystem system = loader.load(file.toString());

        assertThat(system.getName()).isEqualTo("tiny");
    }

    @Test
    void missing_resource_is_a_load_error() {
        assertThatThrownBy(() -> loader.load("systems/nope.yaml"))
            .isInstanceOf(Errors.SystemLoadError.class)
            .hasMessageContaining("nope.yaml");
    }

    // =========================================================================
    // Criterion forms
    // =========================================================================

    @Test
    void every_criterion_form_is_understood() {
        BiddingSystem system = loader.parse(String.join("\n",
            "name: forms",
            "bids:",
            "  - bid: 1S",
            "    criteria:",
            "      - opening",
            "      - shape: \"S5+\"",
            "      - hcp: {min: 11}",
            "      - or: [balanced, {shape: \"5,4\"}]"));

        List<CriterionSpec> criteria = system.getOpenings().get(0).getCriteria();
        assertThat(criteria.get(0)).isEqualTo(CriterionSpec.of("opening"));
        assertThat(criteria.get(1).text()).isEqualTo("S5+");
        assertThat(criteria.get(2).attribute("min", null)).isEqualTo("11");
        assertThat(criteria.get(3).children()).extracting(CriterionSpec::name)
            .containsExactly("balanced", "shape");
    }

    // =========================================================================
    // Structural errors
    // =========================================================================

    @Test
    void node_without_criteria_is_rejected() {
        assertThatThrownBy(() -> loader.parse("name: bad\nbids:\n  - bid: 1C\n"))
            .isInstanceOf(Errors.MissingCriteriaError.class)
            .hasMessageContaining("1C");
    }

    @Test
    void responses_must_be_a_list() {
        String mapping = String.join("\n",
            "name: bad",
            "bids:",
            "  - bid: 2N",
            "    criteria: [opening]",
            "    responses:",
            "      bid: 3N",
            "      criteria: [opening]");

        assertThatThrownBy(() -> loader.parse(mapping))
            .isInstanceOf(Errors.SystemLoadError.class)
            .hasMessageContaining("bids[0].responses must be a list");
        assertThatThrownBy(() -> loader.parse(
                "name: bad\nbids:\n  - bid: 2N\n    criteria: [opening]\n    responses: 3N\n"))
            .isInstanceOf(Errors.SystemLoadError.class);
    }

    @Test
    void invalid_bid_is_reported_with_its_path() {
        assertThatThrownBy(() -> loader.parse("name: bad\nbids:\n  - bid: 9Z\n    criteria: [opening]\n"))
            .isInstanceOf(Errors.SystemLoadError.class)
            .hasMessageContaining("bids[0]");
    }

    @Test
    void system_needs_a_name_and_bids() {
        assertThatThrownBy(() -> loader.parse("bids: []\n"))
            .isInstanceOf(Errors.SystemLoadError.class);
        assertThatThrownBy(() -> loader.parse("name: empty\n"))
            .isInstanceOf(Errors.SystemLoadError.class);
        assertThatThrownBy(() -> loader.parse("name: empty\nbids: []\n"))
            .isInstanceOf(Errors.SystemLoadError.class)
            .hasMessageContaining("opening bids");
    }

    @Test
    void malformed_yaml_is_a_load_error() {
        assertThatThrownBy(() -> loader.parse("name: [unclosed"))
            .isInstanceOf(Errors.SystemLoadError.class)
            .satisfies(e -> assertThat(((Errors.BiddingError) e).isConfigurationError()).isTrue());
    }
}
