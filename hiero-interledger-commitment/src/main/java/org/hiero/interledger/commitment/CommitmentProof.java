// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A proof that a value is, or a key is not, committed to by a {@link CommitmentRoot}.
 *
 * <p>Implementations are immutable and hold no state between verifications, so one proof may be verified from
 * several threads at once.
 */
public interface CommitmentProof {

    CommitmentType commitmentType();

    /**
     * Verifies that {@code value} is stored at {@code path} under {@code root}.
     *
     * @throws CommitmentException if the proof does not establish membership
     */
    void verifyMembership(@Nullable CommitmentRoot root, @Nullable CommitmentPath path, @Nullable byte[] value)
            throws CommitmentException;

    /**
     * Verifies that nothing is stored at {@code path} under {@code root}.
     *
     * @throws CommitmentException if the proof does not establish absence
     */
    void verifyNonMembership(@Nullable CommitmentRoot root, @Nullable CommitmentPath path) throws CommitmentException;

    boolean isEmpty();

    /**
     * Checks the proof's structure without doing any cryptographic work.
     *
     * @throws CommitmentException with {@link CommitmentError#INVALID_PROOF} if the proof is malformed
     */
    void validateBasic() throws CommitmentException;
}
