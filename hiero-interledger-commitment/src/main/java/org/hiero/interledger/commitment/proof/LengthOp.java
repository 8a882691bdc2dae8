// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

/**
 * How the length of a (possibly pre-hashed) key or value is encoded in a leaf preimage.
 */
public enum LengthOp {
    /** The data is used as-is. */
    NO_PREFIX,
    /** Protobuf-style unsigned varint length prefix. */
    VAR_PROTO,
    FIXED32_BIG,
    FIXED32_LITTLE,
    FIXED64_BIG,
    FIXED64_LITTLE,
    /** No prefix, but the data must be exactly 32 bytes. */
    REQUIRE_32_BYTES,
    /** No prefix, but the data must be exactly 64 bytes. */
    REQUIRE_64_BYTES
}
