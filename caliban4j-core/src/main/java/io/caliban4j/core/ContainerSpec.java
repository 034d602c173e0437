package io.caliban4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * Parameters that determine a container image. Identity is the hash of (user, spec).
 */
public record ContainerSpec(
        String id,
        String uniqueKey,
        String user,
        Map<String, Object> spec,
        Instant timestamp
) implements HistoryObject {

    public static final String IMAGE_ID = "image_id";

    public ContainerSpec {
        spec = Copies.map(spec);
    }

    /**
     * Image id recorded for this spec, or null when the spec describes a build.
     */
    public String imageId() {
        Object image = spec.get(IMAGE_ID);
        return image == null ? null : image.toString();
    }
}
