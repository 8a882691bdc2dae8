// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.google.protobuf.ByteString;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.hiero.interledger.commitment.fixtures.SimpleMerkleTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link DefaultTreeProofVerifier}.
 */
class DefaultTreeProofVerifierTest {

    private static final ProofSpec SPEC = ProofSpecs.TENDERMINT;

    private final DefaultTreeProofVerifier subject = DefaultTreeProofVerifier.INSTANCE;

    private SimpleMerkleTree tree;
    private byte[] root;

    @BeforeEach
    void setUp() {
        tree = SimpleMerkleTree.builder()
                .put("b", "v1")
                .put("d", "v2")
                .put("f", "v3")
                .put("h", "v4")
                .put("j", "v5")
                .build();
        root = tree.root();
    }

    @Test
    @DisplayName("calculate() reproduces the tree root from every leaf")
    void calculatesRoot() throws ProofCalculationException {
        for (final var key : List.of("b", "d", "f", "h", "j")) {
            assertThat(subject.calculate(tree.existenceProof(key))).isEqualTo(root);
        }
    }

    @Test
    @DisplayName("calculate() fails without a leaf operation")
    void calculateNeedsLeaf() {
        final var proof = tree.existenceProof("b");
        final var leafless = new ExistenceProof(proof.key(), proof.value(), null, proof.path());

        assertThatExceptionOfType(ProofCalculationException.class).isThrownBy(() -> subject.calculate(leafless));
    }

    @Test
    @DisplayName("verifyMembership() accepts the stored value and nothing else")
    void membership() {
        final var proof = tree.existenceProof("f");

        assertThat(subject.verifyMembership(SPEC, root, proof, utf8("f"), utf8("v3"))).isTrue();
        assertThat(subject.verifyMembership(SPEC, root, proof, utf8("f"), utf8("v4"))).isFalse();
        assertThat(subject.verifyMembership(SPEC, root, proof, utf8("h"), utf8("v3"))).isFalse();
        assertThat(subject.verifyMembership(SPEC, new byte[32], proof, utf8("f"), utf8("v3"))).isFalse();
        assertThat(subject.verifyMembership(SPEC, root, tree.nonExistenceProof("e"), utf8("f"), utf8("v3")))
                .isFalse();
    }

    @Test
    @DisplayName("verifyMembership() rejects proofs that do not match the proof spec")
    void membershipChecksSpec() {
        final var proof = tree.existenceProof("f");

        // IAVL inner prefixes are at least 4 bytes long
        assertThat(subject.verifyMembership(ProofSpecs.IAVL, root, proof, utf8("f"), utf8("v3"))).isFalse();

        final var shallow = new ProofSpec(SPEC.leafSpec(), SPEC.innerSpec(), 1, 0);
        assertThat(subject.verifyMembership(shallow, root, proof, utf8("f"), utf8("v3"))).isFalse();
        final var deep = new ProofSpec(SPEC.leafSpec(), SPEC.innerSpec(), 0, 5);
        assertThat(subject.verifyMembership(deep, root, proof, utf8("f"), utf8("v3"))).isFalse();

        final var otherLeaf = new LeafOp(
                HashOp.SHA512, HashOp.NO_HASH, HashOp.SHA256, LengthOp.VAR_PROTO, ByteString.copyFrom(new byte[] {0}));
        final var otherSpec = new ProofSpec(otherLeaf, SPEC.innerSpec(), 0, 0);
        assertThat(subject.verifyMembership(otherSpec, root, proof, utf8("f"), utf8("v3"))).isFalse();
    }

    @Test
    @DisplayName("verifyMembership() rejects an inner step that could be mistaken for a leaf")
    void membershipRejectsLeafPrefixedInnerStep() {
        final var proof = tree.existenceProof("b");
        final var first = proof.path().get(0);
        final var disguised = new InnerOp(HashOp.SHA256, ByteString.copyFrom(new byte[] {0}), first.suffix());
        final var steps = new java.util.ArrayList<>(proof.path());
        steps.set(0, disguised);
        final var forged = new ExistenceProof(proof.key(), proof.value(), proof.leaf(), steps);

        assertThat(subject.verifyMembership(SPEC, root, forged, utf8("b"), utf8("v1"))).isFalse();
    }

    @Test
    @DisplayName("verifyNonMembership() accepts absent keys between and beyond the stored keys")
    void nonMembership() {
        for (final var key : List.of("a", "c", "e", "g", "i", "k")) {
            assertThat(subject.verifyNonMembership(SPEC, root, tree.nonExistenceProof(key), utf8(key)))
                    .as("absence of %s", key)
                    .isTrue();
        }
    }

    @Test
    @DisplayName("verifyNonMembership() rejects neighbours that are not adjacent")
    void nonMembershipNeedsAdjacentNeighbours() {
        final var gap = new NonExistenceProof(
                ByteString.copyFromUtf8("e"), tree.existenceProof("b"), tree.existenceProof("h"));
        final var leftOnly = new NonExistenceProof(ByteString.copyFromUtf8("e"), tree.existenceProof("d"), null);
        final var rightOnly = new NonExistenceProof(ByteString.copyFromUtf8("e"), null, tree.existenceProof("f"));

        assertThat(subject.verifyNonMembership(SPEC, root, gap, utf8("e"))).isFalse();
        assertThat(subject.verifyNonMembership(SPEC, root, leftOnly, utf8("e"))).isFalse();
        assertThat(subject.verifyNonMembership(SPEC, root, rightOnly, utf8("e"))).isFalse();
    }

    @Test
    @DisplayName("verifyNonMembership() rejects keys outside the neighbours and proofs without neighbours")
    void nonMembershipOrdering() {
        final var proof = tree.nonExistenceProof("e");

        assertThat(subject.verifyNonMembership(SPEC, root, proof, utf8("d"))).isFalse();
        assertThat(subject.verifyNonMembership(SPEC, root, proof, utf8("g"))).isFalse();
        final var noNeighbours = new NonExistenceProof(ByteString.copyFromUtf8("e"), null, null);
        assertThat(subject.verifyNonMembership(SPEC, root, noNeighbours, utf8("e"))).isFalse();
        assertThat(subject.verifyNonMembership(SPEC, root, tree.existenceProof("d"), utf8("e"))).isFalse();
    }

    @Test
    @DisplayName("Left-most and right-most checks follow the padding of the inner spec")
    void edgeChecks() {
        final var inner = SPEC.innerSpec();

        assertThat(DefaultTreeProofVerifier.isLeftMost(inner, tree.existenceProof("b").path())).isTrue();
        assertThat(DefaultTreeProofVerifier.isLeftMost(inner, tree.existenceProof("d").path())).isFalse();
        assertThat(DefaultTreeProofVerifier.isRightMost(inner, tree.existenceProof("j").path())).isTrue();
        assertThat(DefaultTreeProofVerifier.isRightMost(inner, tree.existenceProof("h").path())).isFalse();
        assertThat(DefaultTreeProofVerifier.isLeftNeighbor(
                        inner, tree.existenceProof("h").path(), tree.existenceProof("j").path()))
                .isTrue();
        assertThat(DefaultTreeProofVerifier.isLeftNeighbor(
                        inner, tree.existenceProof("j").path(), tree.existenceProof("h").path()))
                .isFalse();
    }

    private static byte[] utf8(final String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
