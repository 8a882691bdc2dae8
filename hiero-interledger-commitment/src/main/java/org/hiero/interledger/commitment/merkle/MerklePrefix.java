// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.merkle;

import static java.util.Objects.requireNonNull;

import com.google.protobuf.ByteString;
import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.interledger.commitment.CommitmentPrefix;
import org.hiero.interledger.commitment.CommitmentType;

/**
 * The store key under which a nested tree's root is committed in its parent tree. {@link MerklePaths#applyPrefix}
 * turns it into the outermost level of a {@link MerklePath}.
 */
public record MerklePrefix(@NonNull ByteString bytes) implements CommitmentPrefix {

    public MerklePrefix {
        requireNonNull(bytes, "bytes must not be null");
    }

    @NonNull
    public static MerklePrefix of(@NonNull final byte[] keyPrefix) {
        return new MerklePrefix(ByteString.copyFrom(requireNonNull(keyPrefix, "keyPrefix must not be null")));
    }

    @NonNull
    @Override
    public CommitmentType commitmentType() {
        return CommitmentType.MERKLE;
    }

    @Override
    public String toString() {
        return "MerklePrefix[" + bytes.toStringUtf8() + "]";
    }
}
