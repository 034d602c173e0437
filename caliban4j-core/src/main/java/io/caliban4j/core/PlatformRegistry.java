package io.caliban4j.core;

import io.caliban4j.ComputePlatform;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class PlatformRegistry {

    private final Map<Platform, ComputePlatform> platforms;

    public PlatformRegistry(List<? extends ComputePlatform> computes) {
        Map<Platform, ComputePlatform> byPlatform = new EnumMap<>(Platform.class);
        for (ComputePlatform compute : computes) {
            ComputePlatform existing = byPlatform.putIfAbsent(compute.platform(), compute);
            if (existing != null) {
                throw new IllegalStateException("Duplicate ComputePlatform for platform: " + compute.platform()
                        + " (" + existing.name() + ", " + compute.name() + ")");
            }
        }
        this.platforms = Collections.unmodifiableMap(byPlatform);
    }

    public Optional<ComputePlatform> find(Platform platform) {
        return Optional.ofNullable(platforms.get(platform));
    }

    public ComputePlatform getRequired(Platform platform) {
        ComputePlatform compute = platforms.get(platform);
        if (compute == null) {
            throw new IllegalStateException("No ComputePlatform registered for platform: " + platform);
        }
        return compute;
    }
}
