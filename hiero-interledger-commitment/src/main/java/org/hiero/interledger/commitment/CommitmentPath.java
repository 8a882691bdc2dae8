// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The full key path identifying a value inside a chain of nested stores. The rendered form is returned by
 * {@link Object#toString()}.
 */
public interface CommitmentPath {

    @NonNull
    CommitmentType commitmentType();

    /**
     * @return the rendered path with all escaping removed
     * @throws CommitmentException with {@link CommitmentError#MALFORMED_PATH_ENCODING} if the rendered form is not
     *     valid percent-encoding
     */
    @NonNull
    String pretty() throws CommitmentException;

    boolean isEmpty();
}
