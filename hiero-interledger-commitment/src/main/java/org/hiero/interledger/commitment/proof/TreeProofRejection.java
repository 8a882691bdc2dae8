// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

/**
 * Internal signal that a tree proof failed one of the checks of {@link DefaultTreeProofVerifier}.
 */
final class TreeProofRejection extends Exception {

    TreeProofRejection(String message) {
        super(message);
    }
}
