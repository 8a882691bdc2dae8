// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment;

/**
 * The closed set of reasons a commitment operation can be rejected.
 */
public enum CommitmentError {
    /**
     * The proof is structurally malformed, has the wrong variant at some level, or failed a cryptographic check.
     */
    INVALID_PROOF,
    /** A prefix was missing or had no bytes. */
    EMPTY_PREFIX,
    /** A path string failed validation. */
    INVALID_PATH,
    /** A path of some other commitment scheme was given where a Merkle path is required. */
    NOT_A_MERKLE_PATH,
    /** A rendered path could not be percent-decoded. */
    MALFORMED_PATH_ENCODING
}
