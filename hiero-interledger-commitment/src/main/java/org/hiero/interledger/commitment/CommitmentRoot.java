// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment;

import com.google.protobuf.ByteString;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A trusted anchor hash against which commitment proofs are checked.
 */
public interface CommitmentRoot {

    @NonNull
    CommitmentType commitmentType();

    /**
     * @return a read-only view of the root hash
     */
    @NonNull
    ByteString hash();

    /**
     * @return true if the root has no bytes, which marks it as unset
     */
    default boolean isEmpty() {
        return hash().isEmpty();
    }
}
