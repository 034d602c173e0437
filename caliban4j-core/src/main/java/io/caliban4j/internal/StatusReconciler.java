package io.caliban4j.internal;

import io.caliban4j.RunStatusProvider;
import io.caliban4j.Storage;
import io.caliban4j.core.JobStatus;
import io.caliban4j.core.Platform;
import io.caliban4j.core.PlatformJobStatus;
import io.caliban4j.core.Result;
import io.caliban4j.core.Run;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Brings a run's cached status up to date with its platform.
 *
 * <p>Terminal runs are never polled again. Failures never propagate: a status that cannot be
 * confirmed is reported as {@link JobStatus#UNKNOWN} and the cached value is left as it was.
 */
public class StatusReconciler {
    private static final Logger log = LoggerFactory.getLogger(StatusReconciler.class);

    private final Storage storage;
    private final Map<Platform, RunStatusProvider> providers;

    public StatusReconciler(Storage storage, List<? extends RunStatusProvider> providers) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        Map<Platform, RunStatusProvider> byPlatform = new EnumMap<>(Platform.class);
        for (RunStatusProvider provider : providers) {
            if (byPlatform.putIfAbsent(provider.platform(), provider) != null) {
                throw new IllegalStateException("Duplicate RunStatusProvider for platform: " + provider.platform());
            }
        }
        this.providers = Collections.unmodifiableMap(byPlatform);
    }

    public JobStatus update(Run run) {
        return refresh(run).map(Run::status).orElse(JobStatus.UNKNOWN);
    }

    /**
     * The run with its current status, or empty when the platform could not be asked.
     */
    public Optional<Run> refresh(Run run) {
        Objects.requireNonNull(run, "run must not be null");
        if (run.hasTerminalStatus()) {
            return Optional.of(run);
        }

        RunStatusProvider provider = providers.get(run.platform());
        if (provider == null) {
            log.warn("no status provider for platform={} run={}", run.platform(), run.id());
            return Optional.empty();
        }

        Result<PlatformJobStatus> polled;
        try {
            polled = provider.poll(run);
        } catch (RuntimeException e) {
            log.error("status poll failed run={} platform={} msg={}", run.id(), run.platform(), e.getMessage(), e);
            return Optional.empty();
        }
        if (!polled.isOk() || polled.value().isEmpty()) {
            log.error("status poll failed run={} platform={} msg={}", run.id(), run.platform(),
                    polled.error().map(err -> err.message()).orElse("no status returned"));
            return Optional.empty();
        }

        PlatformJobStatus status = polled.value().get();
        Run updated = run.withStatus(status);
        if (updated.equals(run)) {
            return Optional.of(run);
        }
        log.debug("run status changed run={} from={} to={}", run.id(), run.typedStatus().name(), status.name());
        return Optional.of(persist(updated));
    }

    /**
     * Stops a run that is not known to be finished and marks it STOPPED.
     *
     * <p>When the platform cannot be polled the cached status decides, so an unconfirmed run
     * is still cancelled.
     *
     * @return true when the run is no longer active, false when the cancel could not be made
     */
    public boolean stop(Run run) {
        Objects.requireNonNull(run, "run must not be null");
        Optional<Run> current = refresh(run);
        Run active = current.orElse(run);
        if (active.hasTerminalStatus()) {
            return true;
        }
        if (current.isEmpty()) {
            log.warn("status of run={} unconfirmed, cancelling with cached status={}", active.id(), active.status());
        }

        RunStatusProvider provider = providers.get(active.platform());
        if (provider == null) {
            log.error("cannot stop run={}, no status provider for platform={}", active.id(), active.platform());
            return false;
        }

        Result<Boolean> stopped;
        try {
            stopped = provider.stop(active);
        } catch (RuntimeException e) {
            log.error("stop failed run={} platform={} msg={}", active.id(), active.platform(), e.getMessage(), e);
            return false;
        }
        if (!stopped.orElse(false)) {
            log.error("stop failed run={} platform={} msg={}", active.id(), active.platform(),
                    stopped.error().map(err -> err.message()).orElse("platform rejected the request"));
            return false;
        }

        persist(active.withStatus(JobStatus.STOPPED));
        log.info("run stopped run={} platform={}", active.id(), active.platform());
        return true;
    }

    private Run persist(Run run) {
        try {
            return storage.updateRun(run);
        } catch (RuntimeException e) {
            log.error("failed to record status run={} status={} msg={}", run.id(), run.status(), e.getMessage(), e);
            return run;
        }
    }
}
