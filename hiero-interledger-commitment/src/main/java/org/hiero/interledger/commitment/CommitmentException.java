// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a commitment root, prefix, path or proof is rejected. Every rejection carries the
 * {@link CommitmentError} that caused it; callers map that to a protocol-level rejection of the message that
 * carried the offending data.
 */
public class CommitmentException extends Exception {

    private final CommitmentError error;

    public CommitmentException(@NonNull final CommitmentError error, @NonNull final String message) {
        super(String.format("%s: %s", requireNonNull(error), message));
        this.error = error;
    }

    public CommitmentException(
            @NonNull final CommitmentError error, @NonNull final String message, @NonNull final Throwable cause) {
        super(String.format("%s: %s", requireNonNull(error), message), cause);
        this.error = error;
    }

    /**
     * Throws a {@link CommitmentException} with the given error if the condition does not hold.
     *
     * @param condition the condition that must be true
     * @param error the error to report otherwise
     * @param message the detail message
     * @throws CommitmentException if the condition is false
     */
    public static void validateTrue(
            final boolean condition, @NonNull final CommitmentError error, @NonNull final String message)
            throws CommitmentException {
        if (!condition) {
            throw new CommitmentException(error, message);
        }
    }

    @NonNull
    public CommitmentError getError() {
        return error;
    }
}
