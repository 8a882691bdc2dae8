// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment;

import com.google.protobuf.ByteString;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Namespace bytes prepended to every key of a store before it is committed.
 */
public interface CommitmentPrefix {

    @NonNull
    CommitmentType commitmentType();

    @NonNull
    ByteString bytes();

    default boolean isEmpty() {
        return bytes().isEmpty();
    }
}
