// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.merkle;

import static java.util.Objects.requireNonNull;

import com.google.common.io.BaseEncoding;
import com.google.protobuf.ByteString;
import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.interledger.commitment.CommitmentRoot;
import org.hiero.interledger.commitment.CommitmentType;

/**
 * The root hash of the outermost tree, e.g. the application hash of a block header.
 */
public record MerkleRoot(@NonNull ByteString hash) implements CommitmentRoot {

    public MerkleRoot {
        requireNonNull(hash, "hash must not be null");
    }

    @NonNull
    public static MerkleRoot of(@NonNull final byte[] hash) {
        return new MerkleRoot(ByteString.copyFrom(requireNonNull(hash, "hash must not be null")));
    }

    @NonNull
    public static MerkleRoot of(@NonNull final ByteString hash) {
        return new MerkleRoot(hash);
    }

    @NonNull
    @Override
    public CommitmentType commitmentType() {
        return CommitmentType.MERKLE;
    }

    @Override
    public String toString() {
        return "MerkleRoot[" + BaseEncoding.base16().lowerCase().encode(hash.toByteArray()) + "]";
    }
}
