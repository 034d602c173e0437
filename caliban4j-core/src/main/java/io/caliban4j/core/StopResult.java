package io.caliban4j.core;

public record StopResult(
        int attempted,
        int stopped,
        int failed
) {
}
