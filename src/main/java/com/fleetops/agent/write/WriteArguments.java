package com.fleetops.agent.write;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coercions for loosely-typed tool arguments as they arrive from the LLM.
 */
final class WriteArguments {

    private WriteArguments() {
    }

    static String string(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value == null ? null : value.toString();
    }

    static List<String> stringList(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<String> out = new ArrayList<>(list.size());
        list.forEach(item -> {
            if (item != null) {
                out.add(item.toString());
            }
        });
        return out;
    }

    /** Tag values stay null where the caller asked for removal. */
    static Map<String, String> tags(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, String> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(String.valueOf(k), v == null ? null : v.toString()));
        return out;
    }

    /** Parsed form of the "updates" argument of a batch tag update */
    @SuppressWarnings("unchecked")
    static List<TagUpdate> tagUpdates(Object updates) {
        if (!(updates instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(Map.class::isInstance)
                .map(u -> (Map<String, Object>) u)
                .map(u -> new TagUpdate(stringList(u.get("device_ids")), tags(u.get("tags"))))
                .toList();
    }
}
