// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.merkle;

import static java.util.Objects.requireNonNull;
import static org.hiero.interledger.commitment.CommitmentError.MALFORMED_PATH_ENCODING;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.io.BaseEncoding;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.hiero.interledger.commitment.CommitmentException;
import org.hiero.interledger.commitment.path.PathEscaper;

/**
 * The keys addressing a value within one tree, outermost first. Renders as the keys' segments joined by {@code /}.
 */
public record KeyPath(@NonNull List<PathKey> keys) {

    private static final Joiner JOINER = Joiner.on('/');
    private static final Splitter SPLITTER = Splitter.on('/');
    private static final BaseEncoding BASE16 = BaseEncoding.base16();

    public KeyPath {
        keys = List.copyOf(requireNonNull(keys, "keys must not be null"));
    }

    @NonNull
    public static KeyPath empty() {
        return new KeyPath(List.of());
    }

    /**
     * @return a new key path with the key appended
     */
    @NonNull
    public KeyPath appendKey(@NonNull final byte[] name, @NonNull final KeyEncoding encoding) {
        requireNonNull(name, "name must not be null");
        requireNonNull(encoding, "encoding must not be null");
        final var appended = new ArrayList<>(keys);
        appended.add(encoding == KeyEncoding.HEX ? PathKey.hex(name) : PathKey.url(name));
        return new KeyPath(appended);
    }

    /**
     * Parses a rendered key path. A segment of {@code x:} followed by an even number of hex digits reads as a hex
     * key; every other segment, including one that merely starts with {@code x:}, reads as a URL key. A URL key
     * whose bytes themselves look like a hex key therefore parses back as that hex key, which renders the same.
     *
     * @throws CommitmentException with {@code MALFORMED_PATH_ENCODING} on an empty segment or a bad percent escape
     */
    @NonNull
    public static KeyPath parse(@NonNull final String rendered) throws CommitmentException {
        requireNonNull(rendered, "rendered must not be null");
        if (rendered.isEmpty()) {
            return empty();
        }
        final var keys = new ArrayList<PathKey>();
        for (final var segment : SPLITTER.split(rendered)) {
            if (segment.isEmpty()) {
                throw new CommitmentException(
                        MALFORMED_PATH_ENCODING, "Empty segment in key path \"" + rendered + "\"");
            }
            final var hex = segment.startsWith(PathKey.HEX_MARKER)
                    ? segment.substring(PathKey.HEX_MARKER.length()).toUpperCase(Locale.ROOT)
                    : null;
            if (hex != null && BASE16.canDecode(hex)) {
                keys.add(PathKey.hex(BASE16.decode(hex)));
            } else {
                keys.add(PathKey.url(PathEscaper.unescape(segment)));
            }
        }
        return new KeyPath(keys);
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    @Override
    public String toString() {
        return JOINER.join(keys);
    }
}
