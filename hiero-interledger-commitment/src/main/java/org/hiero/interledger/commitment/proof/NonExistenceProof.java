// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

import static java.util.Objects.requireNonNull;

import com.google.protobuf.ByteString;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Proves that {@code key} is absent from a tree by proving its neighbours. {@code left} is the greatest key below
 * {@code key} and {@code right} the smallest key above it; one of them is missing when {@code key} lies beyond
 * either end of the tree.
 */
public record NonExistenceProof(
        @NonNull ByteString key, @Nullable ExistenceProof left, @Nullable ExistenceProof right) implements TreeProof {

    public NonExistenceProof {
        requireNonNull(key, "key must not be null");
    }
}
