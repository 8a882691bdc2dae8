// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

import static java.util.Objects.requireNonNull;

import com.google.common.primitives.UnsignedBytes;
import com.google.protobuf.ByteString;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Arrays;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link TreeProofVerifier} following the ICS-23 verification rules.
 *
 * <p>An existence proof is accepted when:
 * <ul>
 *   <li>its leaf operation equals the spec's leaf spec (apart from a prefix that may extend the spec's)</li>
 *   <li>every inner step uses the spec's hash, does not start with the leaf prefix, and has a prefix and suffix
 *       whose lengths fit the spec's inner shape</li>
 *   <li>the number of inner steps lies within the spec's depth bounds</li>
 *   <li>its key and value are the claimed ones and the root computed from it is the expected root</li>
 * </ul>
 *
 * <p>A non-existence proof is accepted when every neighbour it carries is a valid existence proof, the key lies
 * strictly between the neighbours, and the neighbours are adjacent in the tree: the left neighbour alone must be
 * the right-most leaf, the right neighbour alone the left-most leaf, and together they must be left and right
 * neighbours.
 *
 * <p>Placeholder children ({@link InnerSpec#emptyChild()}) are not recognised when deciding adjacency, so sparse
 * trees that rely on them are rejected by non-membership checks.
 */
public final class DefaultTreeProofVerifier implements TreeProofVerifier {

    private static final Logger log = LogManager.getLogger(DefaultTreeProofVerifier.class);

    public static final DefaultTreeProofVerifier INSTANCE = new DefaultTreeProofVerifier();

    private DefaultTreeProofVerifier() {}

    @Override
    public boolean verifyMembership(
            @NonNull final ProofSpec spec,
            @NonNull final byte[] root,
            @NonNull final TreeProof proof,
            @NonNull final byte[] key,
            @NonNull final byte[] value) {
        requireNonNull(spec, "spec must not be null");
        requireNonNull(root, "root must not be null");
        requireNonNull(proof, "proof must not be null");
        requireNonNull(key, "key must not be null");
        requireNonNull(value, "value must not be null");
        if (!(proof instanceof ExistenceProof existenceProof)) {
            log.debug("Membership requires an existence proof, got {}", proof.getClass().getSimpleName());
            return false;
        }
        try {
            verifyExistence(spec, root, existenceProof, ByteString.copyFrom(key), ByteString.copyFrom(value));
            return true;
        } catch (final TreeProofRejection | ProofCalculationException e) {
            log.debug("Existence proof rejected: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean verifyNonMembership(
            @NonNull final ProofSpec spec,
            @NonNull final byte[] root,
            @NonNull final TreeProof proof,
            @NonNull final byte[] key) {
        requireNonNull(spec, "spec must not be null");
        requireNonNull(root, "root must not be null");
        requireNonNull(proof, "proof must not be null");
        requireNonNull(key, "key must not be null");
        if (!(proof instanceof NonExistenceProof nonExistenceProof)) {
            log.debug("Non-membership requires a non-existence proof, got {}", proof.getClass().getSimpleName());
            return false;
        }
        try {
            verifyNonExistence(spec, root, nonExistenceProof, key);
            return true;
        } catch (final TreeProofRejection | ProofCalculationException e) {
            log.debug("Non-existence proof rejected: {}", e.getMessage());
            return false;
        }
    }

    @NonNull
    @Override
    public byte[] calculate(@NonNull final ExistenceProof proof) throws ProofCalculationException {
        requireNonNull(proof, "proof must not be null");
        if (proof.leaf() == null) {
            throw new ProofCalculationException("Existence proof needs a defined leaf op");
        }
        byte[] current = ProofOps.applyLeaf(proof.leaf(), proof.key(), proof.value());
        for (final var step : proof.path()) {
            current = ProofOps.applyInner(step, current);
        }
        return current;
    }

    private void verifyExistence(
            @NonNull final ProofSpec spec,
            @NonNull final byte[] root,
            @NonNull final ExistenceProof proof,
            @NonNull final ByteString key,
            @NonNull final ByteString value)
            throws TreeProofRejection, ProofCalculationException {
        checkAgainstSpec(spec, proof);
        if (!proof.key().equals(key)) {
            throw new TreeProofRejection("Provided key does not match proof key");
        }
        if (!proof.value().equals(value)) {
            throw new TreeProofRejection("Provided value does not match proof value");
        }
        if (!Arrays.equals(root, calculate(proof))) {
            throw new TreeProofRejection("Calculated root does not match provided root");
        }
    }

    private void verifyNonExistence(
            @NonNull final ProofSpec spec,
            @NonNull final byte[] root,
            @NonNull final NonExistenceProof proof,
            @NonNull final byte[] key)
            throws TreeProofRejection, ProofCalculationException {
        final var left = proof.left();
        final var right = proof.right();
        if (left == null && right == null) {
            throw new TreeProofRejection("Both left and right neighbours are missing");
        }
        if (left != null) {
            verifyExistence(spec, root, left, left.key(), left.value());
            if (compare(key, left.key()) <= 0) {
                throw new TreeProofRejection("Key is not right of the left neighbour");
            }
        }
        if (right != null) {
            verifyExistence(spec, root, right, right.key(), right.value());
            if (compare(key, right.key()) >= 0) {
                throw new TreeProofRejection("Key is not left of the right neighbour");
            }
        }
        final var innerSpec = spec.innerSpec();
        if (left == null) {
            if (!isLeftMost(innerSpec, right.path())) {
                throw new TreeProofRejection("Right neighbour is not the left-most leaf");
            }
        } else if (right == null) {
            if (!isRightMost(innerSpec, left.path())) {
                throw new TreeProofRejection("Left neighbour is not the right-most leaf");
            }
        } else if (!isLeftNeighbor(innerSpec, left.path(), right.path())) {
            throw new TreeProofRejection("Left and right neighbours are not adjacent");
        }
    }

    private static void checkAgainstSpec(@NonNull final ProofSpec spec, @NonNull final ExistenceProof proof)
            throws TreeProofRejection {
        final var leaf = proof.leaf();
        if (leaf == null) {
            throw new TreeProofRejection("Existence proof must start with a leaf operation");
        }
        final var leafSpec = spec.leafSpec();
        if (leaf.hash() != leafSpec.hash()
                || leaf.prehashKey() != leafSpec.prehashKey()
                || leaf.prehashValue() != leafSpec.prehashValue()
                || leaf.length() != leafSpec.length()) {
            throw new TreeProofRejection("Leaf operation does not match the proof spec");
        }
        if (!leaf.prefix().startsWith(leafSpec.prefix())) {
            throw new TreeProofRejection("Leaf prefix does not start with the proof spec prefix");
        }
        final int depth = proof.path().size();
        if (spec.minDepth() > 0 && depth < spec.minDepth()) {
            throw new TreeProofRejection("Inner path depth " + depth + " is below " + spec.minDepth());
        }
        if (spec.maxDepth() > 0 && depth > spec.maxDepth()) {
            throw new TreeProofRejection("Inner path depth " + depth + " is above " + spec.maxDepth());
        }
        for (final var step : proof.path()) {
            checkInnerAgainstSpec(spec, step);
        }
    }

    private static void checkInnerAgainstSpec(@NonNull final ProofSpec spec, @NonNull final InnerOp step)
            throws TreeProofRejection {
        final var innerSpec = spec.innerSpec();
        if (step.hash() != innerSpec.hash()) {
            throw new TreeProofRejection("Inner hash " + step.hash() + " does not match " + innerSpec.hash());
        }
        final var leafPrefix = spec.leafSpec().prefix();
        if (!leafPrefix.isEmpty() && step.prefix().startsWith(leafPrefix)) {
            throw new TreeProofRejection("Inner prefix starts with the leaf prefix");
        }
        final int prefixLength = step.prefix().size();
        final int maxLeftChildBytes = (innerSpec.childOrder().size() - 1) * innerSpec.childSize();
        if (prefixLength < innerSpec.minPrefixLength()
                || prefixLength > innerSpec.maxPrefixLength() + maxLeftChildBytes) {
            throw new TreeProofRejection("Inner prefix length " + prefixLength + " is out of bounds");
        }
        if (step.suffix().size() % innerSpec.childSize() != 0) {
            throw new TreeProofRejection("Inner suffix length " + step.suffix().size() + " is not a child multiple");
        }
    }

    static boolean isLeftMost(@NonNull final InnerSpec spec, @NonNull final List<InnerOp> path) {
        final var padding = padding(spec, 0);
        return path.stream().allMatch(padding::matches);
    }

    static boolean isRightMost(@NonNull final InnerSpec spec, @NonNull final List<InnerOp> path) {
        final var padding = padding(spec, spec.childOrder().size() - 1);
        return path.stream().allMatch(padding::matches);
    }

    /**
     * Checks that the leaves reached by {@code left} and {@code right} sit next to each other. Both paths run from
     * the leaf upward; the steps they share near the root are dropped, after which the topmost remaining steps must
     * be adjacent branches and everything beneath them must hug the boundary between the two subtrees.
     */
    static boolean isLeftNeighbor(
            @NonNull final InnerSpec spec, @NonNull final List<InnerOp> left, @NonNull final List<InnerOp> right) {
        int leftTop = left.size() - 1;
        int rightTop = right.size() - 1;
        while (leftTop >= 0 && rightTop >= 0 && sameStep(left.get(leftTop), right.get(rightTop))) {
            leftTop--;
            rightTop--;
        }
        if (leftTop < 0 || rightTop < 0) {
            return false;
        }
        return isLeftStep(spec, left.get(leftTop), right.get(rightTop))
                && isRightMost(spec, left.subList(0, leftTop))
                && isLeftMost(spec, right.subList(0, rightTop));
    }

    private static boolean isLeftStep(
            @NonNull final InnerSpec spec, @NonNull final InnerOp left, @NonNull final InnerOp right) {
        final int leftBranch = branchOf(spec, left);
        final int rightBranch = branchOf(spec, right);
        return leftBranch >= 0 && rightBranch == leftBranch + 1;
    }

    private static boolean sameStep(@NonNull final InnerOp a, @NonNull final InnerOp b) {
        return a.prefix().equals(b.prefix()) && a.suffix().equals(b.suffix());
    }

    /**
     * @return the branch a step descends through, or -1 if its padding fits no branch
     */
    private static int branchOf(@NonNull final InnerSpec spec, @NonNull final InnerOp step) {
        for (int branch = 0; branch < spec.childOrder().size(); branch++) {
            if (padding(spec, branch).matches(step)) {
                return branch;
            }
        }
        return -1;
    }

    private static Padding padding(@NonNull final InnerSpec spec, final int branch) {
        final int position = spec.childOrder().indexOf(branch);
        if (position < 0) {
            throw new IllegalStateException("Branch " + branch + " is not in the child order");
        }
        final int prefix = position * spec.childSize();
        final int suffix = (spec.childOrder().size() - 1 - position) * spec.childSize();
        return new Padding(prefix + spec.minPrefixLength(), prefix + spec.maxPrefixLength(), suffix);
    }

    private static int compare(@NonNull final byte[] key, @NonNull final ByteString other) {
        return UnsignedBytes.lexicographicalComparator().compare(key, other.toByteArray());
    }

    /**
     * The prefix and suffix lengths an inner step has when it descends through a particular branch.
     */
    private record Padding(int minPrefix, int maxPrefix, int suffix) {

        boolean matches(@Nullable final InnerOp step) {
            return step != null
                    && step.prefix().size() >= minPrefix
                    && step.prefix().size() <= maxPrefix
                    && step.suffix().size() == suffix;
        }
    }
}
