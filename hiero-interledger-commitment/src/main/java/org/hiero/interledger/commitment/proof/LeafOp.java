// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

import static java.util.Objects.requireNonNull;

import com.google.protobuf.ByteString;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Describes how a leaf hash is computed from a key and value:
 * {@code hash(prefix || length(prehashKey(key)) || length(prehashValue(value)))}.
 *
 * <p>The same type doubles as the leaf half of a {@link ProofSpec}, where it states what every leaf of a tree must
 * look like.
 *
 * @param hash the hash applied to the whole preimage
 * @param prehashKey the hash applied to the key before length-prefixing
 * @param prehashValue the hash applied to the value before length-prefixing
 * @param length the length encoding of the pre-hashed key and value
 * @param prefix bytes placed in front of the preimage, distinguishing leaves from inner nodes
 */
public record LeafOp(
        @NonNull HashOp hash,
        @NonNull HashOp prehashKey,
        @NonNull HashOp prehashValue,
        @NonNull LengthOp length,
        @NonNull ByteString prefix) {

    public LeafOp {
        requireNonNull(hash, "hash must not be null");
        requireNonNull(prehashKey, "prehashKey must not be null");
        requireNonNull(prehashValue, "prehashValue must not be null");
        requireNonNull(length, "length must not be null");
        requireNonNull(prefix, "prefix must not be null");
    }
}
