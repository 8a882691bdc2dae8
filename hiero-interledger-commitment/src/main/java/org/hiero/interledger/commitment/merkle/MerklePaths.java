// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.merkle;

import static java.util.Objects.requireNonNull;
import static org.hiero.interledger.commitment.CommitmentError.EMPTY_PREFIX;
import static org.hiero.interledger.commitment.CommitmentError.NOT_A_MERKLE_PATH;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.ArrayList;
import org.hiero.interledger.commitment.CommitmentException;
import org.hiero.interledger.commitment.CommitmentPath;
import org.hiero.interledger.commitment.CommitmentPrefix;
import org.hiero.interledger.commitment.config.CommitmentConfigLoader;
import org.hiero.interledger.commitment.path.DefaultPathValidator;
import org.hiero.interledger.commitment.path.PathValidator;

/**
 * Composition of commitment paths.
 */
public final class MerklePaths {

    private MerklePaths() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Applies {@code prefix} to {@code path} using a validator built from the default configuration.
     *
     * @see #applyPrefix(CommitmentPrefix, CommitmentPath, PathValidator)
     */
    @NonNull
    public static MerklePath applyPrefix(@Nullable final CommitmentPrefix prefix, @NonNull final CommitmentPath path)
            throws CommitmentException {
        return applyPrefix(prefix, path, DefaultValidatorHolder.INSTANCE);
    }

    /**
     * Interprets {@code path} in the context of {@code prefix}: the prefix bytes become a new single-key level in
     * front of the path's existing levels, so the result can be verified with a chained proof one level longer.
     *
     * @param prefix the store prefix
     * @param path a well-formed path
     * @param validator checks the rendered form of {@code path}
     * @return the prefixed path
     * @throws CommitmentException with {@code INVALID_PATH} if the path is malformed, {@code EMPTY_PREFIX} if the
     *     prefix is missing or empty, or {@code NOT_A_MERKLE_PATH} if the path is of another commitment scheme
     */
    @NonNull
    public static MerklePath applyPrefix(
            @Nullable final CommitmentPrefix prefix,
            @NonNull final CommitmentPath path,
            @NonNull final PathValidator validator)
            throws CommitmentException {
        requireNonNull(path, "path must not be null");
        requireNonNull(validator, "validator must not be null");
        validator.validate(path.toString());

        if (prefix == null || prefix.isEmpty()) {
            throw new CommitmentException(EMPTY_PREFIX, "prefix can't be empty");
        }
        if (!(path instanceof MerklePath merklePath)) {
            throw new CommitmentException(NOT_A_MERKLE_PATH, "path is not a merkle path");
        }
        final var prefixLevel = KeyPath.empty().appendKey(prefix.bytes().toByteArray(), KeyEncoding.URL);
        final var keyPaths = new ArrayList<KeyPath>(merklePath.keyPaths().size() + 1);
        keyPaths.add(prefixLevel);
        keyPaths.addAll(merklePath.keyPaths());
        return new MerklePath(keyPaths);
    }

    private static final class DefaultValidatorHolder {
        private static final PathValidator INSTANCE = new DefaultPathValidator(CommitmentConfigLoader.loadDefault());
    }
}
