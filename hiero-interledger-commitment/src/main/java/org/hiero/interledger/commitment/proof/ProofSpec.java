// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The hashing and encoding rules of one tree. A proof is only accepted if each of its operations matches the
 * spec it is checked against.
 *
 * @param leafSpec the operation every leaf must use
 * @param innerSpec the shape of every inner node
 * @param maxDepth the maximum number of inner steps, 0 for no limit
 * @param minDepth the minimum number of inner steps, 0 for no limit
 */
public record ProofSpec(@NonNull LeafOp leafSpec, @NonNull InnerSpec innerSpec, int maxDepth, int minDepth) {

    public ProofSpec {
        requireNonNull(leafSpec, "leafSpec must not be null");
        requireNonNull(innerSpec, "innerSpec must not be null");
        if (maxDepth < 0 || minDepth < 0) {
            throw new IllegalArgumentException("Depth bounds must not be negative");
        }
    }
}
