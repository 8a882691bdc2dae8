// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment;

/**
 * Commitment schemes known to this library.
 */
public enum CommitmentType {
    MERKLE
}
