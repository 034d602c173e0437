package io.caliban4j.internal;

import io.caliban4j.Storage;
import io.caliban4j.StorageProvider;
import io.caliban4j.core.ConnectError;
import io.caliban4j.core.Result;
import io.caliban4j.core.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Opens the configured store, degrading to the local file store and then to memory.
 *
 * <p>Each step down is logged as a warning. In strict mode the configured URL must open.
 */
public class StorageConnector {
    private static final Logger log = LoggerFactory.getLogger(StorageConnector.class);

    public static final String MEMORY_URL = "mem:";

    private final List<StorageProvider> providers;
    private final String localUrl;
    private final boolean strict;

    public StorageConnector(List<StorageProvider> providers, String localUrl, boolean strict) {
        this.providers = List.copyOf(Objects.requireNonNull(providers, "providers must not be null"));
        this.localUrl = Objects.requireNonNull(localUrl, "localUrl must not be null");
        this.strict = strict;
    }

    public Storage connect(String url) {
        String target = url == null || url.isBlank() ? localUrl : url;

        Result<Storage> result = open(target);
        if (result.isOk()) {
            log.info("history store opened url={}", redact(target));
            return result.value().orElseThrow();
        }
        ConnectError error = result.error().orElseThrow();
        if (strict) {
            throw new StorageException("cannot open history store " + redact(target) + ": " + error.message(),
                    error.cause());
        }

        if (!target.equals(localUrl)) {
            log.warn("history store unavailable url={} msg={}; falling back to local store url={}",
                    redact(target), error.message(), localUrl);
            result = open(localUrl);
            if (result.isOk()) {
                return result.value().orElseThrow();
            }
            error = result.error().orElseThrow();
        }

        log.warn("local history store unavailable url={} msg={}; falling back to in-memory store, history will not persist",
                localUrl, error.message());
        result = open(MEMORY_URL);
        if (result.isOk()) {
            return result.value().orElseThrow();
        }
        ConnectError last = result.error().orElseThrow();
        throw new StorageException("cannot open in-memory history store: " + last.message(), last.cause());
    }

    Result<Storage> open(String url) {
        for (StorageProvider provider : providers) {
            if (!provider.supports(url)) {
                continue;
            }
            try {
                return provider.connect(url);
            } catch (RuntimeException e) {
                return Result.err(ConnectError.permanent(e.getMessage(), e));
            }
        }
        return Result.err(ConnectError.permanent("no storage provider for url " + redact(url)));
    }

    static String redact(String url) {
        return url == null ? null : url.replaceAll("//[^/@]*@", "//***@");
    }
}
