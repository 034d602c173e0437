package io.caliban4j.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Build parameters for a container image. {@link #toSpec()} gives the map that identifies
 * a {@link ContainerSpec}.
 */
public record ContainerBuild(
        String baseImage,
        List<String> dependencyFiles,
        List<String> extraDirs,
        String credentialsPath,
        Accelerator accelerator
) {
    public ContainerBuild {
        Objects.requireNonNull(baseImage, "baseImage must not be null");
        dependencyFiles = Copies.list(dependencyFiles);
        extraDirs = Copies.list(extraDirs);
        accelerator = accelerator == null ? new Accelerator.None() : accelerator;
    }

    public Map<String, Object> toSpec() {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("base_image", baseImage);
        spec.put("job_mode", accelerator.jobMode().name());
        spec.put("dependency_files", new ArrayList<>(dependencyFiles));
        spec.put("extra_dirs", new ArrayList<>(extraDirs));
        if (credentialsPath != null && !credentialsPath.isBlank()) {
            spec.put("credentials_path", credentialsPath);
        }
        return spec;
    }
}
