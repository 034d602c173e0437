package io.caliban4j.internal;

import io.caliban4j.core.Platform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Points a platform job spec at a different container image.
 *
 * <p>Image locations per platform:
 * <ul>
 *   <li>LOCAL: {@code container}, plus any {@code command} element equal to the old image</li>
 *   <li>CAIP: {@code trainingInput.masterConfig.imageUri}</li>
 *   <li>GKE: {@code template.spec.containers[*].image}</li>
 *   <li>TEST: {@code image}</li>
 * </ul>
 * The input spec is never modified.
 */
public final class ImageRewriter {
    private ImageRewriter() {
    }

    public static Map<String, Object> replaceImage(Platform platform, Map<String, Object> spec, String newImage) {
        Objects.requireNonNull(platform, "platform must not be null");
        Objects.requireNonNull(newImage, "newImage must not be null");
        Map<String, Object> copy = deepCopy(spec == null ? Map.of() : spec);

        switch (platform) {
            case LOCAL -> {
                Object oldImage = copy.get("container");
                copy.put("container", newImage);
                if (oldImage != null && copy.get("command") instanceof List<?> command) {
                    List<Object> rewritten = new ArrayList<>(command.size());
                    for (Object part : command) {
                        rewritten.add(oldImage.equals(part) ? newImage : part);
                    }
                    copy.put("command", rewritten);
                }
            }
            case CAIP -> child(child(copy, "trainingInput"), "masterConfig").put("imageUri", newImage);
            case GKE -> {
                Map<String, Object> podSpec = child(child(copy, "template"), "spec");
                if (podSpec.get("containers") instanceof List<?> containers) {
                    for (Object container : containers) {
                        if (container instanceof Map<?, ?>) {
                            asMap(container).put("image", newImage);
                        }
                    }
                }
            }
            case TEST -> copy.put("image", newImage);
            default -> throw new IllegalArgumentException("unsupported platform: " + platform);
        }
        return copy;
    }

    private static Map<String, Object> child(Map<String, Object> parent, String key) {
        Object existing = parent.get(key);
        if (existing instanceof Map<?, ?>) {
            return asMap(existing);
        }
        Map<String, Object> created = new LinkedHashMap<>();
        parent.put(key, created);
        return created;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private static Map<String, Object> deepCopy(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), deepCopyValue(v)));
        return copy;
    }

    private static Object deepCopyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopy(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopyValue(item));
            }
            return copy;
        }
        return value;
    }
}
