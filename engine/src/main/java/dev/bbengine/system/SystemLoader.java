package dev.bbengine.system;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import dev.bbengine.Errors;
import dev.bbengine.Validation;
import dev.bbengine.bidding.Bid;
import dev.bbengine.criteria.CriterionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Reads bidding systems from YAML.
 *
 * <pre>{@code
 * name: kokish
 * bids:
 *   - bid: 2N
 *     criteria: [opening, balanced, {hcp: {min: 20, max: 21}}]
 *     responses:
 *       - bid: 3N
 *         handoff: confi
 *         criteria: [{hcp: {min: 9}}]
 * }</pre>
 *
 * <p>A criterion is a bare name, a single-entry map whose value is the rule's
 * text ({@code {shape: "5+,3-"}}), its attributes ({@code {hcp: {min: 20}}})
 * or a list of nested criteria ({@code {or: [balanced, {shape: "5,4,2,2"}]}}).
 */
public class SystemLoader {
    private static final Logger logger = LoggerFactory.getLogger(SystemLoader.class);

    private final ObjectMapper mapper = new YAMLMapper();

    /**
     * Load from a file path if one exists there, otherwise from the classpath.
     */
    public BiddingSystem load(String location) {
        Validation.requireNotEmpty(location, "system location");
        Path path = Paths.get(location);
        if (Files.isRegularFile(path)) {
            return load(path);
        }
        return loadResource(location);
    }

    public BiddingSystem load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (IOException e) {
            throw new Errors.SystemLoadError("Failed to read bidding system " + path, e);
        }
    }

    public BiddingSystem loadResource(String resource) {
        String name = resource.startsWith("/") ? resource.substring(1) : resource;
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = SystemLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(name)) {
            if (in == null) {
                throw new Errors.SystemLoadError("Bidding system not found: " + resource);
            }
            return read(in, "classpath:" + name);
        } catch (IOException e) {
            throw new Errors.SystemLoadError("Failed to read bidding system " + resource, e);
        }
    }

    /**
     * Parse a bidding system from YAML text.
     */
    public BiddingSystem parse(String yaml) {
        try {
            return build(mapper.readTree(yaml), "inline");
        } catch (IOException e) {
            throw new Errors.SystemLoadError("Malformed bidding system YAML", e);
        }
    }

    private BiddingSystem read(InputStream in, String source) throws IOException {
        return build(mapper.readTree(in), source);
    }

    private BiddingSystem build(JsonNode root, String source) {
        Validation.require(root != null && root.isObject(), "Bidding system must be a mapping: " + source);
        String name = root.path("name").asText("");
        Validation.requireNotEmpty(name, "system name");
        JsonNode bids = root.path("bids");
        Validation.require(bids.isArray(), "system '" + name + "' must list its opening bids under 'bids'");

        List<BidNode> openings = parseNodes(bids, "bids");
        Validation.requireNotEmpty(openings, "system '" + name + "' opening bids");

        BiddingSystem system = new BiddingSystem(name, root.path("description").asText(""), openings);
        logger.info("bidding_system_loaded",
            kv("system", name), kv("source", source), kv("openings", system.getOpenings().size()));
        return system;
    }

    private List<BidNode> parseNodes(JsonNode nodes, String path) {
        List<BidNode> result = new ArrayList<>();
        int index = 0;
        for (JsonNode node : nodes) {
            result.add(parseNode(node, path + "[" + index++ + "]"));
        }
        return result;
    }

    private BidNode parseNode(JsonNode node, String path) {
        Validation.require(node.isObject(), path + " must be a mapping");
        String value = node.path("bid").asText("");
        Validation.requireNotEmpty(value, path + ".bid");

        Bid bid;
        try {
            bid = Bid.parse(value);
        } catch (Errors.InvalidBidError e) {
            throw new Errors.SystemLoadError(path + ": " + e.getMessage(), e);
        }

        JsonNode criteriaNode = node.path("criteria");
        List<CriterionSpec> criteria = criteriaNode.isMissingNode() || criteriaNode.isNull()
            ? List.of()
            : parseCriteria(criteriaNode, path + ".criteria");

        JsonNode responses = node.path("responses");
        Validation.require(responses.isMissingNode() || responses.isNull() || responses.isArray(),
            path + ".responses must be a list");
        List<BidNode> children = responses.isArray()
            ? parseNodes(responses, path + ".responses")
            : List.of();

        String handOff = node.hasNonNull("handoff") ? node.get("handoff").asText() : null;
        return new BidNode(bid, criteria, children, handOff);
    }

    private List<CriterionSpec> parseCriteria(JsonNode node, String path) {
        Validation.require(node.isArray(), path + " must be a list");
        List<CriterionSpec> specs = new ArrayList<>();
        int index = 0;
        for (JsonNode item : node) {
            specs.add(parseCriterion(item, path + "[" + index++ + "]"));
        }
        return specs;
    }

    private CriterionSpec parseCriterion(JsonNode node, String path) {
        if (node.isTextual()) {
            return CriterionSpec.of(node.asText());
        }
        Validation.require(node.isObject() && node.size() == 1,
            path + " must be a name or a single-entry mapping");

        Map.Entry<String, JsonNode> entry = node.fields().next();
        String name = entry.getKey();
        JsonNode value = entry.getValue();

        if (value == null || value.isNull()) {
            return CriterionSpec.of(name);
        }
        if (value.isValueNode()) {
            return CriterionSpec.withText(name, value.asText());
        }
        if (value.isArray()) {
            return CriterionSpec.withChildren(name, parseCriteria(value, path + "." + name));
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Validation.require(field.getValue().isValueNode() && !field.getValue().isNull(),
                path + "." + name + "." + field.getKey() + " must be a scalar");
            attributes.put(field.getKey(), field.getValue().asText());
        }
        return CriterionSpec.withAttributes(name, attributes);
    }
}
