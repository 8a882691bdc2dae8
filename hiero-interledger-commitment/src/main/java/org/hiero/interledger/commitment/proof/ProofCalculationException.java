// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

/**
 * Thrown when a root cannot be computed from an existence proof.
 */
public class ProofCalculationException extends Exception {

    public ProofCalculationException(String message) {
        super(message);
    }
}
