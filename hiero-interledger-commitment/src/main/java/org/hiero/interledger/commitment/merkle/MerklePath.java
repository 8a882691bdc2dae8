// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.merkle;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Joiner;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.hiero.interledger.commitment.CommitmentException;
import org.hiero.interledger.commitment.CommitmentPath;
import org.hiero.interledger.commitment.CommitmentType;
import org.hiero.interledger.commitment.path.PathEscaper;

/**
 * A path through a chain of nested trees: one {@link KeyPath} per tree, the tree closest to the trusted root
 * first and the tree holding the value last.
 */
public record MerklePath(@NonNull List<KeyPath> keyPaths) implements CommitmentPath {

    private static final Joiner JOINER = Joiner.on('/');

    public MerklePath {
        keyPaths = List.copyOf(requireNonNull(keyPaths, "keyPaths must not be null"));
    }

    /**
     * Creates a single-level path with one URL-encoded key per segment.
     */
    @NonNull
    public static MerklePath of(@NonNull final String... segments) {
        return of(List.of(requireNonNull(segments, "segments must not be null")));
    }

    @NonNull
    public static MerklePath of(@NonNull final List<String> segments) {
        requireNonNull(segments, "segments must not be null");
        var keyPath = KeyPath.empty();
        for (final var segment : segments) {
            keyPath = keyPath.appendKey(segment.getBytes(StandardCharsets.UTF_8), KeyEncoding.URL);
        }
        return new MerklePath(List.of(keyPath));
    }

    @NonNull
    @Override
    public CommitmentType commitmentType() {
        return CommitmentType.MERKLE;
    }

    @NonNull
    @Override
    public String pretty() throws CommitmentException {
        return new String(PathEscaper.unescape(toString()), StandardCharsets.UTF_8);
    }

    @Override
    public boolean isEmpty() {
        return keyPaths.isEmpty();
    }

    @Override
    public String toString() {
        return JOINER.join(keyPaths);
    }
}
