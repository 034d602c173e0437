package io.caliban4j.utils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expands experiment sweep configs into concrete keyword-argument sets.
 * <p>
 * Rules:
 * <ul>
 *   <li>Scalar values are fixed: {@code {"a": 1}} expands to one config</li>
 *   <li>List values are swept: {@code {"a": [1, 2], "b": ["x", "y"]}} expands to the 4-config cartesian product</li>
 *   <li>Compound keys zip values: {@code {"[a,b]": [[1, "x"], [2, "y"]]}} expands to {@code a=1,b=x} and {@code a=2,b=y}</li>
 *   <li>A list of configs expands each entry and concatenates the results in order</li>
 * </ul>
 * <p>
 * An empty list value sweeps over nothing, so the whole config expands to no configs.
 */
public final class SweepExpander {
    private SweepExpander() {
    }

    public static List<Map<String, Object>> expand(List<Map<String, Object>> configs) {
        Objects.requireNonNull(configs, "configs must not be null");
        List<Map<String, Object>> out = new ArrayList<>();
        for (Map<String, Object> config : configs) {
            out.addAll(expand(config));
        }
        return out;
    }

    public static List<Map<String, Object>> expand(Map<String, Object> config) {
        Objects.requireNonNull(config, "config must not be null");

        List<Map<String, Object>> product = new ArrayList<>();
        product.add(new LinkedHashMap<>());

        for (Map.Entry<String, Object> entry : config.entrySet()) {
            List<Map<String, Object>> choices = choices(entry.getKey(), entry.getValue());
            List<Map<String, Object>> next = new ArrayList<>(product.size() * Math.max(1, choices.size()));
            for (Map<String, Object> partial : product) {
                for (Map<String, Object> choice : choices) {
                    Map<String, Object> merged = new LinkedHashMap<>(partial);
                    merged.putAll(choice);
                    next.add(merged);
                }
            }
            product = next;
        }
        return product;
    }

    static boolean isCompoundKey(String key) {
        return key.length() > 2 && key.startsWith("[") && key.endsWith("]");
    }

    static List<String> compoundNames(String key) {
        List<String> names = new ArrayList<>();
        for (String part : key.substring(1, key.length() - 1).split(",")) {
            String name = part.trim();
            if (name.isEmpty()) {
                throw new IllegalArgumentException("compound key has an empty name: " + key);
            }
            names.add(name);
        }
        return names;
    }

    private static List<Map<String, Object>> choices(String key, Object value) {
        List<Map<String, Object>> choices = new ArrayList<>();

        if (isCompoundKey(key)) {
            List<String> names = compoundNames(key);
            List<?> tuples = value instanceof List<?> l && !l.isEmpty() && l.get(0) instanceof List<?>
                    ? l
                    : List.of(value);
            for (Object tuple : tuples) {
                if (!(tuple instanceof List<?> values) || values.size() != names.size()) {
                    throw new IllegalArgumentException(
                            "compound key " + key + " needs " + names.size() + " values per entry, got: " + tuple);
                }
                Map<String, Object> choice = new LinkedHashMap<>();
                for (int i = 0; i < names.size(); i++) {
                    choice.put(names.get(i), values.get(i));
                }
                choices.add(choice);
            }
            return choices;
        }

        if (value instanceof List<?> values) {
            for (Object v : values) {
                Map<String, Object> choice = new LinkedHashMap<>();
                choice.put(key, v);
                choices.add(choice);
            }
            return choices;
        }

        Map<String, Object> choice = new LinkedHashMap<>();
        choice.put(key, value);
        choices.add(choice);
        return choices;
    }
}
