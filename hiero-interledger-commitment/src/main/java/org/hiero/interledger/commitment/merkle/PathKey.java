// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.merkle;

import static java.util.Objects.requireNonNull;

import com.google.common.io.BaseEncoding;
import com.google.protobuf.ByteString;
import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.interledger.commitment.path.PathEscaper;

/**
 * One key of a {@link KeyPath}: raw bytes plus the encoding used to render them.
 */
public record PathKey(@NonNull ByteString name, @NonNull KeyEncoding encoding) {

    static final String HEX_MARKER = "x:";

    public PathKey {
        requireNonNull(name, "name must not be null");
        requireNonNull(encoding, "encoding must not be null");
    }

    @NonNull
    public static PathKey url(@NonNull final byte[] name) {
        return new PathKey(ByteString.copyFrom(requireNonNull(name, "name must not be null")), KeyEncoding.URL);
    }

    @NonNull
    public static PathKey hex(@NonNull final byte[] name) {
        return new PathKey(ByteString.copyFrom(requireNonNull(name, "name must not be null")), KeyEncoding.HEX);
    }

    /**
     * Renders the key as one path segment. The rendering is the key proven in the tree, so URL keys are escaped
     * exactly as {@link PathEscaper#escape(byte[])} does and nothing else.
     */
    @NonNull
    public String render() {
        if (encoding == KeyEncoding.HEX) {
            return HEX_MARKER + BaseEncoding.base16().encode(name.toByteArray());
        }
        return PathEscaper.escape(name.toByteArray());
    }

    @Override
    public String toString() {
        return render();
    }
}
