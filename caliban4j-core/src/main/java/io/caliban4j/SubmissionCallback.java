package io.caliban4j;

import io.caliban4j.core.Job;
import io.caliban4j.core.Run;

/**
 * Per-item notifications from a batch submission.
 */
public interface SubmissionCallback {

    SubmissionCallback NONE = new SubmissionCallback() {
    };

    default void submitted(Job job, Run run) {
    }

    default void failed(Job job, Run run, Exception error) {
    }
}
