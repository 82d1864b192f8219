package dev.bbengine.system;

import java.util.List;
import java.util.function.Consumer;

/**
 * A named decision tree of bids. Root nodes are the candidate opening bids,
 * in priority order.
 */
public final class BiddingSystem {

    private final String name;
    private final String description;
    private final List<BidNode> openings;

    public BiddingSystem(String name, String description, List<BidNode> openings) {
        this.name = name;
        this.description = description == null ? "" : description;
        this.openings = List.copyOf(openings);
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public List<BidNode> getOpenings() { return openings; }

    /**
     * Visit every node, depth first in declared order.
     */
    public void forEachNode(Consumer<BidNode> visitor) {
        visit(openings, visitor);
    }

    private static void visit(List<BidNode> nodes, Consumer<BidNode> visitor) {
        for (BidNode node : nodes) {
            visitor.accept(node);
            visit(node.getResponses(), visitor);
        }
    }
}
