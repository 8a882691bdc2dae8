// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.codec;

import static java.util.Objects.requireNonNull;
import static org.hiero.interledger.commitment.CommitmentError.INVALID_PATH;
import static org.hiero.interledger.commitment.CommitmentError.INVALID_PROOF;

import com.google.protobuf.InvalidProtocolBufferException;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.ArrayList;
import java.util.List;
import org.hiero.interledger.commitment.CommitmentException;
import org.hiero.interledger.commitment.merkle.ChainedMerkleProof;
import org.hiero.interledger.commitment.merkle.KeyEncoding;
import org.hiero.interledger.commitment.merkle.KeyPath;
import org.hiero.interledger.commitment.merkle.MerklePath;
import org.hiero.interledger.commitment.merkle.MerklePrefix;
import org.hiero.interledger.commitment.merkle.MerkleRoot;
import org.hiero.interledger.commitment.merkle.PathKey;
import org.hiero.interledger.commitment.proof.ExistenceProof;
import org.hiero.interledger.commitment.proof.HashOp;
import org.hiero.interledger.commitment.proof.InnerOp;
import org.hiero.interledger.commitment.proof.InnerSpec;
import org.hiero.interledger.commitment.proof.LeafOp;
import org.hiero.interledger.commitment.proof.LengthOp;
import org.hiero.interledger.commitment.proof.NonExistenceProof;
import org.hiero.interledger.commitment.proof.ProofSpec;
import org.hiero.interledger.commitment.proof.TreeProof;
import org.hiero.interledger.commitment.proto.CommitmentProtos;

/**
 * Converts commitment types to and from their protobuf wire form.
 *
 * <p>Decoding is lenient about what a peer may legitimately omit and strict about what it cannot: a tree proof
 * with neither variant set decodes to a {@code null} entry, which {@link ChainedMerkleProof#validateBasic()} then
 * rejects, while unknown enum values and spec parameters that cannot describe a tree fail decoding outright.
 */
public final class CommitmentProtoCodec {

    private CommitmentProtoCodec() {
        throw new UnsupportedOperationException("Utility class");
    }

    // ---------- roots and prefixes

    @NonNull
    public static CommitmentProtos.MerkleRoot toProto(@NonNull final MerkleRoot root) {
        requireNonNull(root, "root must not be null");
        return CommitmentProtos.MerkleRoot.newBuilder().setHash(root.hash()).build();
    }

    @NonNull
    public static MerkleRoot fromProto(@NonNull final CommitmentProtos.MerkleRoot root) {
        requireNonNull(root, "root must not be null");
        return new MerkleRoot(root.getHash());
    }

    @NonNull
    public static CommitmentProtos.MerklePrefix toProto(@NonNull final MerklePrefix prefix) {
        requireNonNull(prefix, "prefix must not be null");
        return CommitmentProtos.MerklePrefix.newBuilder()
                .setKeyPrefix(prefix.bytes())
                .build();
    }

    @NonNull
    public static MerklePrefix fromProto(@NonNull final CommitmentProtos.MerklePrefix prefix) {
        requireNonNull(prefix, "prefix must not be null");
        return new MerklePrefix(prefix.getKeyPrefix());
    }

    // ---------- paths

    @NonNull
    public static CommitmentProtos.MerklePath toProto(@NonNull final MerklePath path) {
        requireNonNull(path, "path must not be null");
        final var builder = CommitmentProtos.MerklePath.newBuilder();
        for (final var keyPath : path.keyPaths()) {
            final var keyPathBuilder = CommitmentProtos.KeyPath.newBuilder();
            for (final var key : keyPath.keys()) {
                keyPathBuilder.addKeys(CommitmentProtos.PathKey.newBuilder()
                        .setName(key.name())
                        .setEncoding(
                                key.encoding() == KeyEncoding.HEX
                                        ? CommitmentProtos.KeyEncoding.KEY_ENCODING_HEX
                                        : CommitmentProtos.KeyEncoding.KEY_ENCODING_URL));
            }
            builder.addKeyPaths(keyPathBuilder);
        }
        return builder.build();
    }

    /**
     * @throws CommitmentException with {@code INVALID_PATH} if a key has an unknown encoding
     */
    @NonNull
    public static MerklePath fromProto(@NonNull final CommitmentProtos.MerklePath path) throws CommitmentException {
        requireNonNull(path, "path must not be null");
        final var keyPaths = new ArrayList<KeyPath>(path.getKeyPathsCount());
        for (final var keyPath : path.getKeyPathsList()) {
            final var keys = new ArrayList<PathKey>(keyPath.getKeysCount());
            for (final var key : keyPath.getKeysList()) {
                keys.add(new PathKey(key.getName(), keyEncoding(key.getEncoding())));
            }
            keyPaths.add(new KeyPath(keys));
        }
        return new MerklePath(keyPaths);
    }

    // ---------- chained proofs

    @NonNull
    public static CommitmentProtos.MerkleProof toProto(@NonNull final ChainedMerkleProof proof) {
        requireNonNull(proof, "proof must not be null");
        final var builder = CommitmentProtos.MerkleProof.newBuilder();
        for (final var treeProof : proof.proofs()) {
            builder.addProofs(treeProof == null ? CommitmentProtos.TreeProof.getDefaultInstance() : toProto(treeProof));
        }
        for (final var spec : proof.specs()) {
            builder.addSpecs(spec == null ? CommitmentProtos.ProofSpec.getDefaultInstance() : toProto(spec));
        }
        return builder.build();
    }

    /**
     * @throws CommitmentException with {@code INVALID_PROOF} if an operation or spec cannot be represented
     */
    @NonNull
    public static ChainedMerkleProof fromProto(@NonNull final CommitmentProtos.MerkleProof proof)
            throws CommitmentException {
        requireNonNull(proof, "proof must not be null");
        final var proofs = new ArrayList<TreeProof>(proof.getProofsCount());
        for (final var treeProof : proof.getProofsList()) {
            proofs.add(fromProto(treeProof));
        }
        final var specs = new ArrayList<ProofSpec>(proof.getSpecsCount());
        for (final var spec : proof.getSpecsList()) {
            specs.add(fromProto(spec));
        }
        return new ChainedMerkleProof(proofs, specs);
    }

    @NonNull
    public static byte[] encode(@NonNull final ChainedMerkleProof proof) {
        return toProto(proof).toByteArray();
    }

    /**
     * Decodes a chained proof received from a peer.
     *
     * @throws InvalidProtocolBufferException if the bytes are not a protobuf {@code MerkleProof}
     * @throws CommitmentException if the message decodes but describes an invalid proof
     */
    @NonNull
    public static ChainedMerkleProof decode(@NonNull final byte[] bytes)
            throws InvalidProtocolBufferException, CommitmentException {
        requireNonNull(bytes, "bytes must not be null");
        return fromProto(CommitmentProtos.MerkleProof.parseFrom(bytes));
    }

    // ---------- tree proofs

    @NonNull
    public static CommitmentProtos.TreeProof toProto(@NonNull final TreeProof proof) {
        requireNonNull(proof, "proof must not be null");
        final var builder = CommitmentProtos.TreeProof.newBuilder();
        if (proof instanceof ExistenceProof existence) {
            builder.setExist(toProto(existence));
        } else if (proof instanceof NonExistenceProof nonExistence) {
            final var nonExistBuilder = CommitmentProtos.NonExistenceProof.newBuilder()
                    .setKey(nonExistence.key());
            if (nonExistence.left() != null) {
                nonExistBuilder.setLeft(toProto(nonExistence.left()));
            }
            if (nonExistence.right() != null) {
                nonExistBuilder.setRight(toProto(nonExistence.right()));
            }
            builder.setNonexist(nonExistBuilder);
        }
        return builder.build();
    }

    /**
     * @return the decoded proof, or {@code null} if neither variant is set
     */
    @Nullable
    public static TreeProof fromProto(@NonNull final CommitmentProtos.TreeProof proof) throws CommitmentException {
        requireNonNull(proof, "proof must not be null");
        return switch (proof.getProofCase()) {
            case EXIST -> fromProto(proof.getExist());
            case NONEXIST -> {
                final var nonExist = proof.getNonexist();
                yield new NonExistenceProof(
                        nonExist.getKey(),
                        nonExist.hasLeft() ? fromProto(nonExist.getLeft()) : null,
                        nonExist.hasRight() ? fromProto(nonExist.getRight()) : null);
            }
            case PROOF_NOT_SET -> null;
        };
    }

    @NonNull
    private static CommitmentProtos.ExistenceProof toProto(@NonNull final ExistenceProof proof) {
        final var builder = CommitmentProtos.ExistenceProof.newBuilder()
                .setKey(proof.key())
                .setValue(proof.value());
        if (proof.leaf() != null) {
            builder.setLeaf(toProto(proof.leaf()));
        }
        for (final var step : proof.path()) {
            builder.addPath(CommitmentProtos.InnerOp.newBuilder()
                    .setHash(toProto(step.hash()))
                    .setPrefix(step.prefix())
                    .setSuffix(step.suffix()));
        }
        return builder.build();
    }

    @NonNull
    private static ExistenceProof fromProto(@NonNull final CommitmentProtos.ExistenceProof proof)
            throws CommitmentException {
        final var path = new ArrayList<InnerOp>(proof.getPathCount());
        for (final var step : proof.getPathList()) {
            path.add(new InnerOp(hashOp(step.getHash()), step.getPrefix(), step.getSuffix()));
        }
        return new ExistenceProof(
                proof.getKey(), proof.getValue(), proof.hasLeaf() ? fromProto(proof.getLeaf()) : null, path);
    }

    // ---------- specs

    @NonNull
    public static CommitmentProtos.ProofSpec toProto(@NonNull final ProofSpec spec) {
        requireNonNull(spec, "spec must not be null");
        final var innerSpec = spec.innerSpec();
        return CommitmentProtos.ProofSpec.newBuilder()
                .setLeafSpec(toProto(spec.leafSpec()))
                .setInnerSpec(CommitmentProtos.InnerSpec.newBuilder()
                        .addAllChildOrder(innerSpec.childOrder())
                        .setChildSize(innerSpec.childSize())
                        .setMinPrefixLength(innerSpec.minPrefixLength())
                        .setMaxPrefixLength(innerSpec.maxPrefixLength())
                        .setEmptyChild(innerSpec.emptyChild())
                        .setHash(toProto(innerSpec.hash())))
                .setMaxDepth(spec.maxDepth())
                .setMinDepth(spec.minDepth())
                .build();
    }

    /**
     * @return the decoded spec, or {@code null} if it has no leaf or inner spec
     * @throws CommitmentException with {@code INVALID_PROOF} if the proof spec cannot describe a tree
     */
    @Nullable
    public static ProofSpec fromProto(@NonNull final CommitmentProtos.ProofSpec spec) throws CommitmentException {
        requireNonNull(spec, "spec must not be null");
        if (!spec.hasLeafSpec() || !spec.hasInnerSpec()) {
            return null;
        }
        final var innerSpec = spec.getInnerSpec();
        try {
            return new ProofSpec(
                    fromProto(spec.getLeafSpec()),
                    new InnerSpec(
                            List.copyOf(innerSpec.getChildOrderList()),
                            innerSpec.getChildSize(),
                            innerSpec.getMinPrefixLength(),
                            innerSpec.getMaxPrefixLength(),
                            innerSpec.getEmptyChild(),
                            hashOp(innerSpec.getHash())),
                    spec.getMaxDepth(),
                    spec.getMinDepth());
        } catch (final IllegalArgumentException e) {
            throw new CommitmentException(INVALID_PROOF, "invalid proof spec: " + e.getMessage(), e);
        }
    }

    // ---------- operations

    @NonNull
    private static CommitmentProtos.LeafOp toProto(@NonNull final LeafOp op) {
        return CommitmentProtos.LeafOp.newBuilder()
                .setHash(toProto(op.hash()))
                .setPrehashKey(toProto(op.prehashKey()))
                .setPrehashValue(toProto(op.prehashValue()))
                .setLength(toProto(op.length()))
                .setPrefix(op.prefix())
                .build();
    }

    @NonNull
    private static LeafOp fromProto(@NonNull final CommitmentProtos.LeafOp op) throws CommitmentException {
        return new LeafOp(
                hashOp(op.getHash()),
                hashOp(op.getPrehashKey()),
                hashOp(op.getPrehashValue()),
                lengthOp(op.getLength(), op.getLengthValue()),
                op.getPrefix());
    }

    @NonNull
    private static CommitmentProtos.LengthOp toProto(@NonNull final LengthOp op) {
        return switch (op) {
            case NO_PREFIX -> CommitmentProtos.LengthOp.NO_PREFIX;
            case VAR_PROTO -> CommitmentProtos.LengthOp.VAR_PROTO;
            case FIXED32_BIG -> CommitmentProtos.LengthOp.FIXED32_BIG;
            case FIXED32_LITTLE -> CommitmentProtos.LengthOp.FIXED32_LITTLE;
            case FIXED64_BIG -> CommitmentProtos.LengthOp.FIXED64_BIG;
            case FIXED64_LITTLE -> CommitmentProtos.LengthOp.FIXED64_LITTLE;
            case REQUIRE_32_BYTES -> CommitmentProtos.LengthOp.REQUIRE_32_BYTES;
            case REQUIRE_64_BYTES -> CommitmentProtos.LengthOp.REQUIRE_64_BYTES;
        };
    }

    @NonNull
    private static CommitmentProtos.HashOp toProto(@NonNull final HashOp op) {
        return switch (op) {
            case NO_HASH -> CommitmentProtos.HashOp.NO_HASH;
            case SHA256 -> CommitmentProtos.HashOp.SHA256;
            case SHA512 -> CommitmentProtos.HashOp.SHA512;
            case SHA512_256 -> CommitmentProtos.HashOp.SHA512_256;
        };
    }

    @NonNull
    private static HashOp hashOp(@NonNull final CommitmentProtos.HashOp op) throws CommitmentException {
        return switch (op) {
            case NO_HASH -> HashOp.NO_HASH;
            case SHA256 -> HashOp.SHA256;
            case SHA512 -> HashOp.SHA512;
            case SHA512_256 -> HashOp.SHA512_256;
            case KECCAK256, RIPEMD160, BITCOIN, BLAKE2B_512, BLAKE2S_256, BLAKE3 -> throw new CommitmentException(
                    INVALID_PROOF, "unsupported hash op " + op);
            case UNRECOGNIZED -> throw new CommitmentException(INVALID_PROOF, "unknown hash op");
        };
    }

    @NonNull
    private static LengthOp lengthOp(@NonNull final CommitmentProtos.LengthOp op, final int wireValue)
            throws CommitmentException {
        return switch (op) {
            case NO_PREFIX -> LengthOp.NO_PREFIX;
            case VAR_PROTO -> LengthOp.VAR_PROTO;
            case FIXED32_BIG -> LengthOp.FIXED32_BIG;
            case FIXED32_LITTLE -> LengthOp.FIXED32_LITTLE;
            case FIXED64_BIG -> LengthOp.FIXED64_BIG;
            case FIXED64_LITTLE -> LengthOp.FIXED64_LITTLE;
            case REQUIRE_32_BYTES -> LengthOp.REQUIRE_32_BYTES;
            case REQUIRE_64_BYTES -> LengthOp.REQUIRE_64_BYTES;
            case VAR_RLP -> throw new CommitmentException(INVALID_PROOF, "unsupported length op " + op);
            case UNRECOGNIZED -> throw new CommitmentException(INVALID_PROOF, "unknown length op " + wireValue);
        };
    }

    @NonNull
    private static KeyEncoding keyEncoding(@NonNull final CommitmentProtos.KeyEncoding encoding)
            throws CommitmentException {
        return switch (encoding) {
            case KEY_ENCODING_URL -> KeyEncoding.URL;
            case KEY_ENCODING_HEX -> KeyEncoding.HEX;
            case UNRECOGNIZED -> throw new CommitmentException(INVALID_PATH, "unknown key encoding");
        };
    }
}
