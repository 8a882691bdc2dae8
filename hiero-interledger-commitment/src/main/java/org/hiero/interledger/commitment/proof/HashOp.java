// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Hash functions a proof spec may name for leaf and inner nodes. These are the ICS-23 hash operations the JDK can
 * compute; proofs naming any other are rejected when decoded.
 */
public enum HashOp {
    NO_HASH(null),
    SHA256("SHA-256"),
    SHA512("SHA-512"),
    SHA512_256("SHA-512/256");

    private final String algorithmName;

    HashOp(@Nullable final String algorithmName) {
        this.algorithmName = algorithmName;
    }

    /**
     * @return the JCA algorithm name, or null for {@link #NO_HASH}
     */
    @Nullable
    public String algorithmName() {
        return algorithmName;
    }
}
