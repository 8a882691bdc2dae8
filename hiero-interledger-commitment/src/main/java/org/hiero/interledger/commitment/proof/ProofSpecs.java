// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

import com.google.protobuf.ByteString;
import java.util.List;

/**
 * Proof specs of widely deployed trees.
 */
public final class ProofSpecs {

    private static final ByteString LEAF_PREFIX = ByteString.copyFrom(new byte[] {0});

    /**
     * Simple binary Merkle trees: leaves are {@code sha256(0x00 || varint(len(key)) || key || varint(32) ||
     * sha256(value))}, inner nodes {@code sha256(0x01 || left || right)}.
     */
    public static final ProofSpec TENDERMINT = new ProofSpec(
            new LeafOp(HashOp.SHA256, HashOp.NO_HASH, HashOp.SHA256, LengthOp.VAR_PROTO, LEAF_PREFIX),
            new InnerSpec(List.of(0, 1), 32, 1, 1, ByteString.EMPTY, HashOp.SHA256),
            0,
            0);

    /**
     * IAVL trees, whose inner prefixes carry a variable-length height/size/version header.
     */
    public static final ProofSpec IAVL = new ProofSpec(
            new LeafOp(HashOp.SHA256, HashOp.NO_HASH, HashOp.SHA256, LengthOp.VAR_PROTO, LEAF_PREFIX),
            new InnerSpec(List.of(0, 1), 33, 4, 12, ByteString.EMPTY, HashOp.SHA256),
            0,
            0);

    private ProofSpecs() {
        throw new UnsupportedOperationException("Utility class");
    }
}
