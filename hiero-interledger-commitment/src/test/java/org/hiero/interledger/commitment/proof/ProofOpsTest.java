// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.google.common.io.BaseEncoding;
import com.google.protobuf.ByteString;
import java.security.MessageDigest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link ProofOps}.
 */
class ProofOpsTest {

    private static final ByteString DATA = ByteString.copyFromUtf8("food");

    @Test
    @DisplayName("doLength() prefixes the data length in the requested encoding")
    void lengthPrefixes() throws ProofCalculationException {
        assertThat(hex(ProofOps.doLength(LengthOp.NO_PREFIX, DATA))).isEqualTo("666f6f64");
        assertThat(hex(ProofOps.doLength(LengthOp.VAR_PROTO, DATA))).isEqualTo("04666f6f64");
        assertThat(hex(ProofOps.doLength(LengthOp.FIXED32_BIG, DATA))).isEqualTo("00000004666f6f64");
        assertThat(hex(ProofOps.doLength(LengthOp.FIXED32_LITTLE, DATA))).isEqualTo("04000000666f6f64");
        assertThat(hex(ProofOps.doLength(LengthOp.FIXED64_BIG, DATA))).isEqualTo("0000000000000004666f6f64");
        assertThat(hex(ProofOps.doLength(LengthOp.FIXED64_LITTLE, DATA))).isEqualTo("0400000000000000666f6f64");
    }

    @Test
    @DisplayName("VAR_PROTO uses a multi-byte varint for lengths of 128 and more")
    void multiByteVarint() throws ProofCalculationException {
        final var data = ByteString.copyFrom(new byte[300]);

        final var prefixed = ProofOps.doLength(LengthOp.VAR_PROTO, data);

        assertThat(prefixed.size()).isEqualTo(302);
        assertThat(prefixed.byteAt(0)).isEqualTo((byte) 0xAC);
        assertThat(prefixed.byteAt(1)).isEqualTo((byte) 0x02);
    }

    @Test
    @DisplayName("REQUIRE_32_BYTES and REQUIRE_64_BYTES only pass data of that size")
    void requiredSizes() throws ProofCalculationException {
        final var thirtyTwo = ByteString.copyFrom(new byte[32]);

        assertThat(ProofOps.doLength(LengthOp.REQUIRE_32_BYTES, thirtyTwo)).isEqualTo(thirtyTwo);
        assertThatExceptionOfType(ProofCalculationException.class)
                .isThrownBy(() -> ProofOps.doLength(LengthOp.REQUIRE_64_BYTES, thirtyTwo))
                .withMessageContaining("expected 64");
    }

    @Test
    @DisplayName("doHash() digests with the named algorithm and passes data through for NO_HASH")
    void hashes() throws Exception {
        assertThat(ProofOps.doHash(HashOp.NO_HASH, DATA)).isEqualTo(DATA.toByteArray());
        assertThat(ProofOps.doHash(HashOp.SHA256, DATA))
                .isEqualTo(MessageDigest.getInstance("SHA-256").digest(DATA.toByteArray()));
        assertThat(ProofOps.doHash(HashOp.SHA512_256, DATA)).hasSize(32);
        assertThat(ProofOps.doHash(HashOp.SHA512, DATA)).hasSize(64);
    }

    @Test
    @DisplayName("applyLeaf() hashes prefix, key and value as the leaf op describes")
    void applyLeaf() throws Exception {
        final var op = new LeafOp(HashOp.SHA256, HashOp.NO_HASH, HashOp.NO_HASH, LengthOp.VAR_PROTO,
                ByteString.copyFrom(new byte[] {0}));

        final var leaf = ProofOps.applyLeaf(op, ByteString.copyFromUtf8("k"), ByteString.copyFromUtf8("v"));

        final var expected = MessageDigest.getInstance("SHA-256").digest(new byte[] {0, 1, 'k', 1, 'v'});
        assertThat(leaf).isEqualTo(expected);
    }

    @Test
    @DisplayName("applyLeaf() needs a key and a value")
    void applyLeafNeedsKeyAndValue() {
        final var op = ProofSpecs.TENDERMINT.leafSpec();

        assertThatExceptionOfType(ProofCalculationException.class)
                .isThrownBy(() -> ProofOps.applyLeaf(op, ByteString.EMPTY, DATA))
                .withMessageContaining("key");
        assertThatExceptionOfType(ProofCalculationException.class)
                .isThrownBy(() -> ProofOps.applyLeaf(op, DATA, ByteString.EMPTY))
                .withMessageContaining("value");
    }

    @Test
    @DisplayName("applyInner() hashes prefix, child and suffix")
    void applyInner() throws Exception {
        final var op = new InnerOp(
                HashOp.SHA256, ByteString.copyFrom(new byte[] {1}), ByteString.copyFrom(new byte[] {2, 3}));

        final var parent = ProofOps.applyInner(op, new byte[] {9});

        assertThat(parent).isEqualTo(MessageDigest.getInstance("SHA-256").digest(new byte[] {1, 9, 2, 3}));
        assertThatExceptionOfType(ProofCalculationException.class)
                .isThrownBy(() -> ProofOps.applyInner(op, new byte[0]));
    }

    private static String hex(final ByteString bytes) {
        return BaseEncoding.base16().lowerCase().encode(bytes.toByteArray());
    }
}
