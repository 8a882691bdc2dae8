// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.merkle;

import static org.hiero.interledger.commitment.CommitmentError.INVALID_PROOF;
import static org.hiero.interledger.commitment.CommitmentException.validateTrue;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.hiero.interledger.commitment.CommitmentException;
import org.hiero.interledger.commitment.CommitmentPath;
import org.hiero.interledger.commitment.CommitmentProof;
import org.hiero.interledger.commitment.CommitmentRoot;
import org.hiero.interledger.commitment.CommitmentType;
import org.hiero.interledger.commitment.proof.ProofSpec;
import org.hiero.interledger.commitment.proof.TreeProof;

/**
 * A list of tree proofs chained to prove membership or non-membership of a value up to a final root.
 *
 * <p>The list is ordered from the lowest subtree to the final tree, and {@code specs.get(i)} gives the rules of the
 * tree proven by {@code proofs.get(i)}. Each proof's root is the value proven by the next proof. This is the reverse
 * of {@link MerklePath}, which lists levels from the root down.
 *
 * <p>Proofs arrive from remote peers, so the lists are copied as-is: null entries and unequal lengths are
 * representable and rejected by {@link #validateBasic()}.
 */
public final class ChainedMerkleProof implements CommitmentProof {

    private final List<TreeProof> proofs;
    private final List<ProofSpec> specs;

    public ChainedMerkleProof(@Nullable final List<TreeProof> proofs, @Nullable final List<ProofSpec> specs) {
        this.proofs = proofs == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(proofs));
        this.specs = specs == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(specs));
    }

    @NonNull
    public List<TreeProof> proofs() {
        return proofs;
    }

    @NonNull
    public List<ProofSpec> specs() {
        return specs;
    }

    /**
     * @return the number of tree levels this proof spans
     */
    public int chainLength() {
        return proofs.size();
    }

    @Override
    public CommitmentType commitmentType() {
        return CommitmentType.MERKLE;
    }

    @Override
    public void verifyMembership(
            @Nullable final CommitmentRoot root, @Nullable final CommitmentPath path, @Nullable final byte[] value)
            throws CommitmentException {
        DefaultVerifierHolder.INSTANCE.verifyMembership(this, root, path, value);
    }

    @Override
    public void verifyNonMembership(@Nullable final CommitmentRoot root, @Nullable final CommitmentPath path)
            throws CommitmentException {
        DefaultVerifierHolder.INSTANCE.verifyNonMembership(this, root, path);
    }

    @Override
    public boolean isEmpty() {
        if (proofs.isEmpty() || specs.isEmpty()) {
            return true;
        }
        final int overlap = Math.min(proofs.size(), specs.size());
        for (int i = 0; i < overlap; i++) {
            if (proofs.get(i) == null || specs.get(i) == null) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void validateBasic() throws CommitmentException {
        validateTrue(!isEmpty(), INVALID_PROOF, "proof is empty or has missing entries");
        validateTrue(
                proofs.size() == specs.size(),
                INVALID_PROOF,
                String.format("proof has %d sub-proofs but %d specs", proofs.size(), specs.size()));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChainedMerkleProof that)) {
            return false;
        }
        return proofs.equals(that.proofs) && specs.equals(that.specs);
    }

    @Override
    public int hashCode() {
        return 31 * proofs.hashCode() + specs.hashCode();
    }

    @Override
    public String toString() {
        return "ChainedMerkleProof[chainLength=" + proofs.size() + ", specs=" + specs.size() + "]";
    }

    private static final class DefaultVerifierHolder {
        private static final ChainedProofVerifier INSTANCE = ChainedProofVerifier.withDefaults();
    }
}
