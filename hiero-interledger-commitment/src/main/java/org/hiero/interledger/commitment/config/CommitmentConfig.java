// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.config;

/**
 * Configuration for chained commitment proof verification.
 *
 * @param maxChainLength the most tree levels a chained proof may span; verification cost grows linearly with it
 * @param minIdentifierLength the shortest identifier accepted in a path
 * @param maxIdentifierLength the longest identifier accepted in a path
 * @param logProofDetails whether rejected proofs are dumped in full at debug level
 */
public record CommitmentConfig(
        int maxChainLength, int minIdentifierLength, int maxIdentifierLength, boolean logProofDetails) {

    public static final CommitmentConfig DEFAULT = new CommitmentConfig(8, 1, 255, false);

    public CommitmentConfig {
        if (maxChainLength < 1) {
            throw new IllegalArgumentException("maxChainLength must be at least 1, was " + maxChainLength);
        }
        if (minIdentifierLength < 1 || maxIdentifierLength < minIdentifierLength) {
            throw new IllegalArgumentException("Invalid identifier length bounds ["
                    + minIdentifierLength + ", " + maxIdentifierLength + "]");
        }
    }
}
