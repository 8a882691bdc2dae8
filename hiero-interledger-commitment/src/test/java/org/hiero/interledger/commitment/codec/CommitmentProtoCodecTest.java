// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.hiero.interledger.commitment.CommitmentError.INVALID_PATH;
import static org.hiero.interledger.commitment.CommitmentError.INVALID_PROOF;

import com.google.protobuf.InvalidProtocolBufferException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.hiero.interledger.commitment.CommitmentException;
import org.hiero.interledger.commitment.fixtures.SimpleMerkleTree;
import org.hiero.interledger.commitment.merkle.ChainedMerkleProof;
import org.hiero.interledger.commitment.merkle.KeyEncoding;
import org.hiero.interledger.commitment.merkle.KeyPath;
import org.hiero.interledger.commitment.merkle.MerklePath;
import org.hiero.interledger.commitment.merkle.MerklePrefix;
import org.hiero.interledger.commitment.merkle.MerkleRoot;
import org.hiero.interledger.commitment.proof.HashOp;
import org.hiero.interledger.commitment.proof.LengthOp;
import org.hiero.interledger.commitment.proof.ProofSpecs;
import org.hiero.interledger.commitment.proto.CommitmentProtos;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link CommitmentProtoCodec}.
 */
class CommitmentProtoCodecTest {

    private final SimpleMerkleTree tree = SimpleMerkleTree.builder()
            .put("a", "v1")
            .put("c", "v3")
            .put("e", "v5")
            .build();

    @Test
    @DisplayName("A chained proof survives encoding and still verifies")
    void chainedProofRoundTrip() throws Exception {
        final var proof = new ChainedMerkleProof(
                List.of(tree.nonExistenceProof("b"), tree.existenceProof("e")),
                List.of(ProofSpecs.TENDERMINT, ProofSpecs.IAVL));

        final var decoded = CommitmentProtoCodec.decode(CommitmentProtoCodec.encode(proof));

        assertThat(decoded).isEqualTo(proof);

        final var single = new ChainedMerkleProof(List.of(tree.existenceProof("c")), List.of(ProofSpecs.TENDERMINT));
        final var decodedSingle = CommitmentProtoCodec.decode(CommitmentProtoCodec.encode(single));
        assertThatCode(() -> decodedSingle.verifyMembership(
                        MerkleRoot.of(tree.root()), MerklePath.of("c"), "v3".getBytes(StandardCharsets.UTF_8)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Roots, prefixes and paths keep their bytes and key encodings")
    void rootPrefixPathRoundTrip() throws CommitmentException {
        final var root = MerkleRoot.of(tree.root());
        final var prefix = MerklePrefix.of("ibc".getBytes(StandardCharsets.UTF_8));
        final var path = new MerklePath(List.of(
                KeyPath.empty().appendKey("ibc".getBytes(StandardCharsets.UTF_8), KeyEncoding.URL),
                KeyPath.empty()
                        .appendKey(new byte[] {0x01, 0x02}, KeyEncoding.HEX)
                        .appendKey("a b".getBytes(StandardCharsets.UTF_8), KeyEncoding.URL)));

        assertThat(CommitmentProtoCodec.fromProto(CommitmentProtoCodec.toProto(root))).isEqualTo(root);
        assertThat(CommitmentProtoCodec.fromProto(CommitmentProtoCodec.toProto(prefix))).isEqualTo(prefix);
        final var decodedPath = CommitmentProtoCodec.fromProto(CommitmentProtoCodec.toProto(path));
        assertThat(decodedPath).isEqualTo(path);
        assertThat(decodedPath.toString()).isEqualTo("ibc/x:0102/a%20b");
    }

    @Test
    @DisplayName("A missing sub-proof or spec decodes to a null entry that fails basic validation")
    void missingEntriesDecodeToNull() throws CommitmentException {
        final var message = CommitmentProtos.MerkleProof.newBuilder()
                .addProofs(CommitmentProtos.TreeProof.getDefaultInstance())
                .addSpecs(CommitmentProtos.ProofSpec.getDefaultInstance())
                .build();

        final var decoded = CommitmentProtoCodec.fromProto(message);

        assertThat(decoded.chainLength()).isEqualTo(1);
        assertThat(decoded.proofs().get(0)).isNull();
        assertThat(decoded.specs().get(0)).isNull();
        assertThat(decoded.isEmpty()).isTrue();
        assertThatExceptionOfType(CommitmentException.class).isThrownBy(decoded::validateBasic);
    }

    @Test
    @DisplayName("Unknown enum values and impossible specs fail decoding")
    void rejectsUnrepresentableValues() {
        final var spec = CommitmentProtoCodec.toProto(ProofSpecs.TENDERMINT);
        final var unknownHash = spec.toBuilder()
                .setInnerSpec(spec.getInnerSpec().toBuilder().setHashValue(99))
                .build();
        final var zeroChildSize = spec.toBuilder()
                .setInnerSpec(spec.getInnerSpec().toBuilder().setChildSize(0))
                .build();
        final var unknownLength = spec.toBuilder()
                .setLeafSpec(spec.getLeafSpec().toBuilder().setLengthValue(42))
                .build();
        final var unknownEncoding = CommitmentProtos.MerklePath.newBuilder()
                .addKeyPaths(CommitmentProtos.KeyPath.newBuilder()
                        .addKeys(CommitmentProtos.PathKey.newBuilder().setEncodingValue(7)))
                .build();

        for (final var invalid : List.of(unknownHash, zeroChildSize, unknownLength)) {
            assertThatExceptionOfType(CommitmentException.class)
                    .isThrownBy(() -> CommitmentProtoCodec.fromProto(invalid))
                    .satisfies(e -> assertThat(e.getError()).isEqualTo(INVALID_PROOF));
        }
        assertThatExceptionOfType(CommitmentException.class)
                .isThrownBy(() -> CommitmentProtoCodec.fromProto(unknownEncoding))
                .satisfies(e -> assertThat(e.getError()).isEqualTo(INVALID_PATH));
    }

    @Test
    @DisplayName("Hash and length ops keep their ICS-23 wire numbers")
    void decodesIcs23EnumNumbers() throws CommitmentException {
        final var spec = CommitmentProtoCodec.toProto(ProofSpecs.TENDERMINT);
        final var leaf = spec.getLeafSpec().toBuilder().setHashValue(2).setLengthValue(3);

        final var decoded = CommitmentProtoCodec.fromProto(spec.toBuilder().setLeafSpec(leaf).build());

        assertThat(decoded).isNotNull();
        assertThat(decoded.leafSpec().hash()).isEqualTo(HashOp.SHA512);
        assertThat(decoded.leafSpec().length()).isEqualTo(LengthOp.FIXED32_BIG);
        assertThat(CommitmentProtoCodec.toProto(ProofSpecs.TENDERMINT).getLeafSpec().getLengthValue())
                .isEqualTo(1);
        assertThat(CommitmentProtoCodec.toProto(decoded).getLeafSpec().getLengthValue())
                .isEqualTo(3);
    }

    @Test
    @DisplayName("Hash and length ops this library cannot compute are rejected, not reinterpreted")
    void rejectsUnsupportedIcs23Ops() {
        final var spec = CommitmentProtoCodec.toProto(ProofSpecs.TENDERMINT);
        // 3 is KECCAK256, 2 is VAR_RLP
        final var keccak = spec.toBuilder()
                .setLeafSpec(spec.getLeafSpec().toBuilder().setHashValue(3))
                .build();
        final var rlp = spec.toBuilder()
                .setLeafSpec(spec.getLeafSpec().toBuilder().setLengthValue(2))
                .build();

        assertThatExceptionOfType(CommitmentException.class)
                .isThrownBy(() -> CommitmentProtoCodec.fromProto(keccak))
                .satisfies(e -> assertThat(e.getError()).isEqualTo(INVALID_PROOF))
                .withMessageContaining("KECCAK256");
        assertThatExceptionOfType(CommitmentException.class)
                .isThrownBy(() -> CommitmentProtoCodec.fromProto(rlp))
                .satisfies(e -> assertThat(e.getError()).isEqualTo(INVALID_PROOF))
                .withMessageContaining("VAR_RLP");
    }

    @Test
    @DisplayName("A peer-supplied spec whose child order is not a permutation fails decoding")
    void rejectsChildOrderOutsideBranches() {
        final var spec = CommitmentProtoCodec.toProto(ProofSpecs.TENDERMINT);
        final var badOrder = spec.toBuilder()
                .setInnerSpec(spec.getInnerSpec().toBuilder().clearChildOrder().addChildOrder(5).addChildOrder(7))
                .build();
        final var message = CommitmentProtos.MerkleProof.newBuilder()
                .addProofs(CommitmentProtoCodec.toProto(tree.nonExistenceProof("z")))
                .addSpecs(badOrder)
                .build();

        assertThatExceptionOfType(CommitmentException.class)
                .isThrownBy(() -> CommitmentProtoCodec.decode(message.toByteArray()))
                .satisfies(e -> assertThat(e.getError()).isEqualTo(INVALID_PROOF))
                .withMessageContaining("not a permutation");
    }

    @Test
    @DisplayName("decode() surfaces unparseable bytes as a protobuf exception")
    void rejectsGarbage() {
        // field 1, length-delimited, claims 5 bytes but carries 1
        final byte[] truncated = {0x0A, 0x05, 0x01};

        assertThatExceptionOfType(InvalidProtocolBufferException.class)
                .isThrownBy(() -> CommitmentProtoCodec.decode(truncated));
    }
}
