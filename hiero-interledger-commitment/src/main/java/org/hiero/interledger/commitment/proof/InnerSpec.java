// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

import static java.util.Objects.requireNonNull;

import com.google.protobuf.ByteString;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;

/**
 * The shape of the inner nodes of a tree.
 *
 * @param childOrder the position of each child in the preimage, e.g. {@code [0, 1]} for a binary tree
 * @param childSize the length in bytes of every child hash
 * @param minPrefixLength the minimum length of the fixed part of an inner prefix
 * @param maxPrefixLength the maximum length of the fixed part of an inner prefix
 * @param emptyChild the placeholder hash of a missing child, empty if the tree has none
 * @param hash the hash applied to inner nodes
 */
public record InnerSpec(
        @NonNull List<Integer> childOrder,
        int childSize,
        int minPrefixLength,
        int maxPrefixLength,
        @NonNull ByteString emptyChild,
        @NonNull HashOp hash) {

    public InnerSpec {
        childOrder = List.copyOf(requireNonNull(childOrder, "childOrder must not be null"));
        requireNonNull(emptyChild, "emptyChild must not be null");
        requireNonNull(hash, "hash must not be null");
        if (childOrder.size() < 2) {
            throw new IllegalArgumentException("childOrder must name at least two children");
        }
        // Every branch 0..n-1 must appear exactly once
        final var seen = new boolean[childOrder.size()];
        for (final Integer branch : childOrder) {
            if (branch < 0 || branch >= seen.length || seen[branch]) {
                throw new IllegalArgumentException("childOrder " + childOrder + " is not a permutation of 0.."
                        + (seen.length - 1));
            }
            seen[branch] = true;
        }
        if (childSize <= 0) {
            throw new IllegalArgumentException("childSize must be positive, was " + childSize);
        }
        if (minPrefixLength < 0 || maxPrefixLength < minPrefixLength) {
            throw new IllegalArgumentException(
                    "Invalid prefix length bounds [" + minPrefixLength + ", " + maxPrefixLength + "]");
        }
    }
}
