// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.path;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.interledger.commitment.CommitmentException;

/**
 * Checks that a rendered path is well formed before it is used to build a commitment path.
 */
@FunctionalInterface
public interface PathValidator {

    /**
     * @param path the rendered path
     * @throws CommitmentException with {@code INVALID_PATH} if the path is malformed
     */
    void validate(@NonNull String path) throws CommitmentException;
}
