// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

import static java.util.Objects.requireNonNull;

import com.google.protobuf.ByteString;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * One step from a child hash to its parent: {@code hash(prefix || child || suffix)}. The prefix carries the
 * siblings to the left of the child and the suffix the siblings to its right.
 */
public record InnerOp(@NonNull HashOp hash, @NonNull ByteString prefix, @NonNull ByteString suffix) {

    public InnerOp {
        requireNonNull(hash, "hash must not be null");
        requireNonNull(prefix, "prefix must not be null");
        requireNonNull(suffix, "suffix must not be null");
    }
}
