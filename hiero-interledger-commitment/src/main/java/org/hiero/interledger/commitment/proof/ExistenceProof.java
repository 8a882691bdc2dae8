// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

import static java.util.Objects.requireNonNull;

import com.google.protobuf.ByteString;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.List;

/**
 * Proves that {@code key} maps to {@code value} in a tree. Applying {@code leaf} to the pair and then every step
 * of {@code path}, ordered from the leaf upward, yields the tree's root.
 *
 * @param key the leaf key
 * @param value the leaf value
 * @param leaf the leaf operation, null when the proof was received without one
 * @param path the inner steps, nearest the leaf first
 */
public record ExistenceProof(
        @NonNull ByteString key, @NonNull ByteString value, @Nullable LeafOp leaf, @NonNull List<InnerOp> path)
        implements TreeProof {

    public ExistenceProof {
        requireNonNull(key, "key must not be null");
        requireNonNull(value, "value must not be null");
        path = List.copyOf(requireNonNull(path, "path must not be null"));
    }
}
