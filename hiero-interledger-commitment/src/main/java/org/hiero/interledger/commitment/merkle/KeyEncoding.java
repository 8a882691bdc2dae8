// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.merkle;

/**
 * How a key is rendered inside a path string.
 */
public enum KeyEncoding {
    /** Percent-encoded, readable when the key is mostly text. */
    URL,
    /** {@code x:} followed by upper-case hex, for binary keys. */
    HEX
}
