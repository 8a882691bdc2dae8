// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Verification of proofs against a single tree. Chained verification treats this as an opaque capability, one call
 * per tree level.
 */
public interface TreeProofVerifier {

    /**
     * @return true if {@code proof} shows that {@code key} maps to {@code value} in the tree with the given root
     */
    boolean verifyMembership(
            @NonNull ProofSpec spec,
            @NonNull byte[] root,
            @NonNull TreeProof proof,
            @NonNull byte[] key,
            @NonNull byte[] value);

    /**
     * @return true if {@code proof} shows that {@code key} is absent from the tree with the given root
     */
    boolean verifyNonMembership(
            @NonNull ProofSpec spec, @NonNull byte[] root, @NonNull TreeProof proof, @NonNull byte[] key);

    /**
     * Computes the root of the tree an existence proof belongs to.
     *
     * @throws ProofCalculationException if the proof has no leaf operation, empty inputs, or a length violation
     */
    @NonNull
    byte[] calculate(@NonNull ExistenceProof proof) throws ProofCalculationException;
}
