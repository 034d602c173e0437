package io.caliban4j;

import io.caliban4j.core.ContainerSpec;

/**
 * Builds and pushes the image described by a container spec, returning the new image id.
 */
@FunctionalInterface
public interface ImageBuilder {

    String build(ContainerSpec spec) throws Exception;
}
