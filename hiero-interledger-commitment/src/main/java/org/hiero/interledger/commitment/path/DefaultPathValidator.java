// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.path;

import static java.util.Objects.requireNonNull;
import static org.hiero.interledger.commitment.CommitmentError.INVALID_PATH;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.interledger.commitment.CommitmentException;
import org.hiero.interledger.commitment.config.CommitmentConfig;

/**
 * Validates paths made of identifiers separated by {@code /}.
 *
 * <p>A path must not be empty, must not begin or end with a separator and must not contain two separators in a
 * row. Each identifier must have a length within the configured bounds and may only use ASCII letters, digits and
 * {@code . _ + - # [ ] < > % :}, the last two admitting escaped and hex-encoded keys.
 */
public final class DefaultPathValidator implements PathValidator {

    private static final CharMatcher IDENTIFIER_CHARS = CharMatcher.inRange('a', 'z')
            .or(CharMatcher.inRange('A', 'Z'))
            .or(CharMatcher.inRange('0', '9'))
            .or(CharMatcher.anyOf("._+-#[]<>%:"))
            .precomputed();

    private static final Splitter SEPARATOR = Splitter.on('/');

    private final int minIdentifierLength;
    private final int maxIdentifierLength;

    public DefaultPathValidator(@NonNull final CommitmentConfig config) {
        requireNonNull(config, "config must not be null");
        this.minIdentifierLength = config.minIdentifierLength();
        this.maxIdentifierLength = config.maxIdentifierLength();
    }

    @Override
    public void validate(@NonNull final String path) throws CommitmentException {
        requireNonNull(path, "path must not be null");
        if (path.isBlank()) {
            throw new CommitmentException(INVALID_PATH, "path cannot be blank");
        }
        for (final var identifier : SEPARATOR.split(path)) {
            if (identifier.isEmpty()) {
                throw new CommitmentException(
                        INVALID_PATH, "path " + path + " cannot begin or end with '/' or contain empty identifiers");
            }
            if (identifier.length() < minIdentifierLength || identifier.length() > maxIdentifierLength) {
                throw new CommitmentException(
                        INVALID_PATH,
                        String.format(
                                "identifier %s has invalid length %d, must be between %d and %d characters",
                                identifier, identifier.length(), minIdentifierLength, maxIdentifierLength));
            }
            if (!IDENTIFIER_CHARS.matchesAllOf(identifier)) {
                throw new CommitmentException(
                        INVALID_PATH, "identifier " + identifier + " in path " + path + " has invalid characters");
            }
        }
    }
}
