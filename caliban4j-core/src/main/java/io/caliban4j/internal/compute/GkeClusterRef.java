package io.caliban4j.internal.compute;

import java.util.Map;
import java.util.Optional;

/**
 * Identifies a Kubernetes Engine cluster as recorded in GKE run details.
 */
public record GkeClusterRef(String projectId, String zone, String name) {

    public static final String PROJECT_ID = "project_id";
    public static final String CLUSTER_ZONE = "cluster_zone";
    public static final String CLUSTER_NAME = "cluster_name";

    public static Optional<GkeClusterRef> fromDetails(Map<String, Object> details) {
        Object project = details.get(PROJECT_ID);
        Object zone = details.get(CLUSTER_ZONE);
        Object name = details.get(CLUSTER_NAME);
        if (project == null || zone == null || name == null) {
            return Optional.empty();
        }
        return Optional.of(new GkeClusterRef(project.toString(), zone.toString(), name.toString()));
    }
}
