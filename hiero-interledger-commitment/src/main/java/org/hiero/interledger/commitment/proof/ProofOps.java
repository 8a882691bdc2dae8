// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

import static java.util.Objects.requireNonNull;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedOutputStream;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Hashing helpers that apply {@link LeafOp}s and {@link InnerOp}s.
 *
 * <p>Leaves and inner nodes are kept apart by their prefixes, which the {@link ProofSpec} fixes: an inner prefix
 * may never start with the leaf prefix.
 */
public final class ProofOps {

    private ProofOps() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Computes the leaf hash for a key/value pair.
     *
     * @throws ProofCalculationException if the key or value is empty or violates the length operation
     */
    @NonNull
    public static byte[] applyLeaf(
            @NonNull final LeafOp op, @NonNull final ByteString key, @NonNull final ByteString value)
            throws ProofCalculationException {
        requireNonNull(op, "op must not be null");
        requireNonNull(key, "key must not be null");
        requireNonNull(value, "value must not be null");
        if (key.isEmpty()) {
            throw new ProofCalculationException("Leaf op needs key");
        }
        if (value.isEmpty()) {
            throw new ProofCalculationException("Leaf op needs value");
        }
        final ByteString preparedKey = prepareLeafData(op.prehashKey(), op.length(), key);
        final ByteString preparedValue = prepareLeafData(op.prehashValue(), op.length(), value);
        return doHash(op.hash(), op.prefix().concat(preparedKey).concat(preparedValue));
    }

    /**
     * Computes the parent hash of {@code child}.
     *
     * @throws ProofCalculationException if the child hash is empty
     */
    @NonNull
    public static byte[] applyInner(@NonNull final InnerOp op, @NonNull final byte[] child)
            throws ProofCalculationException {
        requireNonNull(op, "op must not be null");
        requireNonNull(child, "child must not be null");
        if (child.length == 0) {
            throw new ProofCalculationException("Inner op needs child value");
        }
        return doHash(op.hash(), op.prefix().concat(ByteString.copyFrom(child)).concat(op.suffix()));
    }

    @NonNull
    static byte[] doHash(@NonNull final HashOp hashOp, @NonNull final ByteString preimage) {
        if (hashOp == HashOp.NO_HASH) {
            return preimage.toByteArray();
        }
        final var digest = newMessageDigest(hashOp);
        preimage.asReadOnlyByteBufferList().forEach(digest::update);
        return digest.digest();
    }

    static MessageDigest newMessageDigest(@NonNull final HashOp hashOp) {
        final var algorithm = requireNonNull(hashOp.algorithmName(), "hashOp has no digest algorithm");
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (final NoSuchAlgorithmException fatal) {
            throw new IllegalStateException(algorithm + " algorithm not found", fatal);
        }
    }

    @NonNull
    private static ByteString prepareLeafData(
            @NonNull final HashOp prehash, @NonNull final LengthOp length, @NonNull final ByteString data)
            throws ProofCalculationException {
        return doLength(length, ByteString.copyFrom(doHash(prehash, data)));
    }

    @NonNull
    static ByteString doLength(@NonNull final LengthOp lengthOp, @NonNull final ByteString data)
            throws ProofCalculationException {
        final int size = data.size();
        return switch (lengthOp) {
            case NO_PREFIX -> data;
            case VAR_PROTO -> varint(size).concat(data);
            case FIXED32_BIG -> fixed(Integer.BYTES, ByteOrder.BIG_ENDIAN, size).concat(data);
            case FIXED32_LITTLE -> fixed(Integer.BYTES, ByteOrder.LITTLE_ENDIAN, size).concat(data);
            case FIXED64_BIG -> fixed(Long.BYTES, ByteOrder.BIG_ENDIAN, size).concat(data);
            case FIXED64_LITTLE -> fixed(Long.BYTES, ByteOrder.LITTLE_ENDIAN, size).concat(data);
            case REQUIRE_32_BYTES -> requireSize(32, data);
            case REQUIRE_64_BYTES -> requireSize(64, data);
        };
    }

    private static ByteString requireSize(final int expected, @NonNull final ByteString data)
            throws ProofCalculationException {
        if (data.size() != expected) {
            throw new ProofCalculationException("Data was " + data.size() + " bytes, expected " + expected);
        }
        return data;
    }

    private static ByteString fixed(final int width, @NonNull final ByteOrder order, final int size) {
        final var buffer = ByteBuffer.allocate(width).order(order);
        if (width == Long.BYTES) {
            buffer.putLong(size);
        } else {
            buffer.putInt(size);
        }
        return ByteString.copyFrom(buffer.array());
    }

    private static ByteString varint(final int size) {
        final var out = ByteString.newOutput(CodedOutputStream.computeUInt32SizeNoTag(size));
        final var coded = CodedOutputStream.newInstance(out);
        try {
            coded.writeUInt32NoTag(size);
            coded.flush();
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to encode length " + size, e);
        }
        return out.toByteString();
    }
}
