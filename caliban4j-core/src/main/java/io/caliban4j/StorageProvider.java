package io.caliban4j;

import io.caliban4j.core.Result;

/**
 * Opens a {@link Storage} for a URL scheme.
 */
public interface StorageProvider {

    boolean supports(String url);

    Result<Storage> connect(String url);
}
