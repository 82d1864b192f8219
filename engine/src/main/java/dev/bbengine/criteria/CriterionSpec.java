package dev.bbengine.criteria;

import java.util.List;
import java.util.Map;

/**
 * One rule as written in a bidding system: the criterion name plus its
 * parameters. {@code attributes} carries named parameters ({@code min},
 * {@code max}), {@code text} a single free-form argument (a shape pattern),
 * and {@code children} nested rules for combinators such as {@code or}.
 */
public record CriterionSpec(
    String name,
    Map<String, String> attributes,
    String text,
    List<CriterionSpec> children
) {
    public CriterionSpec {
        attributes = Map.copyOf(attributes);
        children = List.copyOf(children);
    }

    public static CriterionSpec of(String name) {
        return new CriterionSpec(name, Map.of(), null, List.of());
    }

    public static CriterionSpec withText(String name, String text) {
        return new CriterionSpec(name, Map.of(), text, List.of());
    }

    public static CriterionSpec withAttributes(String name, Map<String, String> attributes) {
        return new CriterionSpec(name, attributes, null, List.of());
    }

    public static CriterionSpec withChildren(String name, List<CriterionSpec> children) {
        return new CriterionSpec(name, Map.of(), null, children);
    }

    public String attribute(String key, String defaultValue) {
        return attributes.getOrDefault(key, defaultValue);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        if (!attributes.isEmpty()) sb.append(attributes);
        if (text != null) sb.append('(').append(text).append(')');
        if (!children.isEmpty()) sb.append(children);
        return sb.toString();
    }
}
