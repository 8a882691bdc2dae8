// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.merkle;

import static java.util.Objects.requireNonNull;
import static org.hiero.interledger.commitment.CommitmentError.INVALID_PROOF;
import static org.hiero.interledger.commitment.CommitmentError.NOT_A_MERKLE_PATH;

import com.google.common.io.BaseEncoding;
import com.google.protobuf.ByteString;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.interledger.commitment.CommitmentException;
import org.hiero.interledger.commitment.CommitmentPath;
import org.hiero.interledger.commitment.CommitmentRoot;
import org.hiero.interledger.commitment.config.CommitmentConfig;
import org.hiero.interledger.commitment.config.CommitmentConfigLoader;
import org.hiero.interledger.commitment.proof.DefaultTreeProofVerifier;
import org.hiero.interledger.commitment.proof.ExistenceProof;
import org.hiero.interledger.commitment.proof.InnerOp;
import org.hiero.interledger.commitment.proof.NonExistenceProof;
import org.hiero.interledger.commitment.proof.ProofCalculationException;
import org.hiero.interledger.commitment.proof.TreeProof;
import org.hiero.interledger.commitment.proof.TreeProofVerifier;

/**
 * Verifies {@link ChainedMerkleProof}s against a trusted {@link CommitmentRoot}.
 *
 * <p>The proofs run from the lowest subtree up to the final tree while the path runs from the root down to the
 * leaf, so the proof at index {@code i} of a chain of length {@code n} is checked against path level
 * {@code n - 1 - i}. The root computed from each proof becomes the value proven by the next one. The last proof is
 * checked against the caller's root rather than a computed one, which is what ties the whole chain to the trusted
 * anchor.
 *
 * <p>All structural checks run before any hashing. Verification stops at the first failing level; there is no
 * partial acceptance. Instances hold no mutable state and may be shared between threads.
 */
public final class ChainedProofVerifier {

    private static final Logger log = LogManager.getLogger(ChainedProofVerifier.class);

    private final TreeProofVerifier treeVerifier;
    private final CommitmentConfig config;

    public ChainedProofVerifier(@NonNull final TreeProofVerifier treeVerifier, @NonNull final CommitmentConfig config) {
        this.treeVerifier = requireNonNull(treeVerifier, "treeVerifier must not be null");
        this.config = requireNonNull(config, "config must not be null");
    }

    /**
     * @return a verifier using the ICS-23 tree verifier and the classpath configuration
     */
    @NonNull
    public static ChainedProofVerifier withDefaults() {
        return new ChainedProofVerifier(DefaultTreeProofVerifier.INSTANCE, CommitmentConfigLoader.loadDefault());
    }

    /**
     * Verifies that {@code value} is committed at {@code path} under {@code root}.
     *
     * @param proof the chained proof, lowest subtree first
     * @param root the trusted root of the final tree
     * @param path the path, root level first, with exactly one level per proof
     * @param value the value expected at the innermost level
     * @throws CommitmentException with {@code INVALID_PROOF} if any input is empty or malformed or any level fails,
     *     or {@code NOT_A_MERKLE_PATH} if the path is not a {@link MerklePath}
     */
    public void verifyMembership(
            @NonNull final ChainedMerkleProof proof,
            @Nullable final CommitmentRoot root,
            @Nullable final CommitmentPath path,
            @Nullable final byte[] value)
            throws CommitmentException {
        requireNonNull(proof, "proof must not be null");
        final var merklePath = checkInputs(proof, root, path, value == null || value.length == 0);

        final int chainLength = proof.chainLength();
        byte[] provenValue = value;
        for (int i = 0; i < chainLength; i++) {
            provenValue = verifyInclusion(proof, i, root, merklePath, provenValue);
        }
    }

    /**
     * Verifies that nothing is committed at {@code path} under {@code root}: absence is proven in the lowest subtree
     * and each subtree's root is then proven present in the next tree up.
     *
     * @throws CommitmentException with {@code INVALID_PROOF} if any input is empty or malformed or any level fails,
     *     or {@code NOT_A_MERKLE_PATH} if the path is not a {@link MerklePath}
     */
    public void verifyNonMembership(
            @NonNull final ChainedMerkleProof proof,
            @Nullable final CommitmentRoot root,
            @Nullable final CommitmentPath path)
            throws CommitmentException {
        requireNonNull(proof, "proof must not be null");
        final var merklePath = checkInputs(proof, root, path, false);

        final int chainLength = proof.chainLength();
        byte[] provenValue = verifyAbsence(proof, root, merklePath);
        for (int i = 1; i < chainLength; i++) {
            provenValue = verifyInclusion(proof, i, root, merklePath, provenValue);
        }
    }

    /**
     * Proves that the lowest subtree lacks the innermost key.
     *
     * @return the lowest subtree's root
     */
    private byte[] verifyAbsence(
            @NonNull final ChainedMerkleProof proof, @NonNull final CommitmentRoot root, @NonNull final MerklePath path)
            throws CommitmentException {
        if (!(proof.proofs().get(0) instanceof NonExistenceProof nonExistence)) {
            throw reject(proof, "proof is not a nonexistence proof");
        }
        // The left neighbour is preferred; a key below the tree's smallest key only has a right one.
        final var neighbour = nonExistence.left() != null ? nonExistence.left() : nonExistence.right();
        if (neighbour == null) {
            throw reject(proof, "nonexistence proof has no neighbours");
        }
        final byte[] subroot = calculate(proof, neighbour);
        final byte[] anchor = proof.chainLength() == 1 ? root.hash().toByteArray() : subroot;
        if (!treeVerifier.verifyNonMembership(proof.specs().get(0), anchor, nonExistence, subpath(path, 0))) {
            throw reject(proof, "invalid proof for path: " + path);
        }
        return subroot;
    }

    /**
     * Proves that {@code provenValue} is stored in the tree of level {@code index}.
     *
     * @return the root of that tree, which is the value proven by the next level
     */
    private byte[] verifyInclusion(
            @NonNull final ChainedMerkleProof proof,
            final int index,
            @NonNull final CommitmentRoot root,
            @NonNull final MerklePath path,
            @NonNull final byte[] provenValue)
            throws CommitmentException {
        if (!(proof.proofs().get(index) instanceof ExistenceProof existence)) {
            throw reject(proof, "proof is not an existence proof");
        }
        final byte[] subroot = calculate(proof, existence);
        final boolean last = index == proof.chainLength() - 1;
        final byte[] anchor = last ? root.hash().toByteArray() : subroot;
        if (!treeVerifier.verifyMembership(
                proof.specs().get(index), anchor, existence, subpath(path, index), provenValue)) {
            throw reject(proof, "invalid proof for path: " + path);
        }
        return subroot;
    }

    private MerklePath checkInputs(
            @NonNull final ChainedMerkleProof proof,
            @Nullable final CommitmentRoot root,
            @Nullable final CommitmentPath path,
            final boolean valueMissing)
            throws CommitmentException {
        try {
            proof.validateBasic();
        } catch (final CommitmentException e) {
            throw new CommitmentException(INVALID_PROOF, "empty params or proof", e);
        }
        if (root == null || root.isEmpty() || path == null || path.isEmpty() || valueMissing) {
            throw new CommitmentException(INVALID_PROOF, "empty params or proof");
        }
        if (!(path instanceof MerklePath merklePath)) {
            throw new CommitmentException(NOT_A_MERKLE_PATH, "path is not a merkle path for a merkle proof");
        }
        // Proof i pairs with path level n - 1 - i, so the two must have the same length.
        if (proof.chainLength() != merklePath.keyPaths().size()) {
            throw new CommitmentException(
                    INVALID_PROOF,
                    String.format(
                            "invalid chained proof. proof chain length %d not the same as path length %d",
                            proof.chainLength(), merklePath.keyPaths().size()));
        }
        if (proof.chainLength() > config.maxChainLength()) {
            throw new CommitmentException(
                    INVALID_PROOF,
                    String.format(
                            "proof chain length %d exceeds the maximum of %d",
                            proof.chainLength(), config.maxChainLength()));
        }
        return merklePath;
    }

    private byte[] calculate(@NonNull final ChainedMerkleProof proof, @NonNull final ExistenceProof existence)
            throws CommitmentException {
        try {
            return treeVerifier.calculate(existence);
        } catch (final ProofCalculationException e) {
            log.debug("Could not calculate subroot of {}: {}", proof, e.getMessage());
            throw new CommitmentException(INVALID_PROOF, e.getMessage(), e);
        }
    }

    private static byte[] subpath(@NonNull final MerklePath path, final int proofIndex) {
        final var levels = path.keyPaths();
        return levels.get(levels.size() - 1 - proofIndex).toString().getBytes(StandardCharsets.UTF_8);
    }

    private CommitmentException reject(@NonNull final ChainedMerkleProof proof, @NonNull final String reason) {
        log.debug("Rejected {}: {}", proof, reason);
        if (config.logProofDetails() && log.isDebugEnabled()) {
            logProof(proof);
        }
        return new CommitmentException(INVALID_PROOF, reason);
    }

    /**
     * Logs a human-readable dump of a chained proof.
     */
    private static void logProof(@NonNull final ChainedMerkleProof proof) {
        final StringBuilder sb = new StringBuilder();
        sb.append("\n========== Chained Proof Details ==========\n");
        sb.append("Levels: ").append(proof.chainLength()).append(" (lowest subtree first)\n");
        for (int i = 0; i < proof.chainLength(); i++) {
            sb.append("  Level [").append(i).append("]:\n");
            appendTreeProof(sb, proof.proofs().get(i));
            sb.append("    Spec: ").append(proof.specs().get(i)).append("\n");
        }
        sb.append("===========================================\n");
        log.debug("{}", sb.toString());
    }

    private static void appendTreeProof(@NonNull final StringBuilder sb, @Nullable final TreeProof treeProof) {
        if (treeProof instanceof ExistenceProof existence) {
            sb.append("    Existence:\n");
            appendExistence(sb, existence, "      ");
        } else if (treeProof instanceof NonExistenceProof nonExistence) {
            sb.append("    NonExistence:\n");
            sb.append("      Key: ").append(formatBytes(nonExistence.key())).append("\n");
            if (nonExistence.left() != null) {
                sb.append("      Left:\n");
                appendExistence(sb, nonExistence.left(), "        ");
            }
            if (nonExistence.right() != null) {
                sb.append("      Right:\n");
                appendExistence(sb, nonExistence.right(), "        ");
            }
        } else {
            sb.append("    <null>\n");
        }
    }

    private static void appendExistence(
            @NonNull final StringBuilder sb, @NonNull final ExistenceProof existence, @NonNull final String indent) {
        sb.append(indent).append("Key: ").append(formatBytes(existence.key())).append("\n");
        sb.append(indent).append("Value: ").append(formatBytes(existence.value())).append("\n");
        sb.append(indent).append("Leaf: ").append(existence.leaf()).append("\n");
        sb.append(indent).append("Path: ").append(existence.path().size()).append(" step(s)\n");
        for (final InnerOp step : existence.path()) {
            sb.append(indent)
                    .append("  prefix=")
                    .append(formatBytes(step.prefix()))
                    .append(" suffix=")
                    .append(formatBytes(step.suffix()))
                    .append("\n");
        }
    }

    private static String formatBytes(@NonNull final ByteString bytes) {
        if (bytes.isEmpty()) {
            return "<empty>";
        }
        return BaseEncoding.base16().lowerCase().encode(bytes.toByteArray());
    }
}
