package io.caliban4j.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class Copies {
    private Copies() {
    }

    static Map<String, Object> map(Map<String, Object> source) {
        return source == null || source.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    static List<String> list(List<String> source) {
        return source == null || source.isEmpty()
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(source));
    }
}
