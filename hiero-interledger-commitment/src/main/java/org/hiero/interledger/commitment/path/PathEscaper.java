// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.path;

import static java.util.Objects.requireNonNull;
import static org.hiero.interledger.commitment.CommitmentError.MALFORMED_PATH_ENCODING;

import com.google.common.base.CharMatcher;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import org.hiero.interledger.commitment.CommitmentException;

/**
 * Percent-encoding of raw key bytes as path segments.
 *
 * <p>Bytes outside the unreserved set ({@code A-Z a-z 0-9 - . _ ~}) and the sub-delimiters left alone inside a
 * URL path segment ({@code $ & + : = @}) are written as {@code %XX} with upper-case hex digits, the same output as
 * Go's {@code url.PathEscape}. In particular {@code /}, {@code ,} and {@code ;} are always escaped, so a rendered
 * segment never contains a separator.
 */
public final class PathEscaper {

    private static final CharMatcher SAFE = CharMatcher.inRange('a', 'z')
            .or(CharMatcher.inRange('A', 'Z'))
            .or(CharMatcher.inRange('0', '9'))
            .or(CharMatcher.anyOf("-._~$&+:=@"))
            .precomputed();

    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private PathEscaper() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Escapes arbitrary bytes into a path segment.
     */
    @NonNull
    public static String escape(@NonNull final byte[] raw) {
        requireNonNull(raw, "raw must not be null");
        final var sb = new StringBuilder(raw.length);
        for (final byte b : raw) {
            final char c = (char) (b & 0xFF);
            if (c < 0x80 && SAFE.matches(c)) {
                sb.append(c);
            } else {
                sb.append('%').append(HEX_DIGITS[(b >> 4) & 0x0F]).append(HEX_DIGITS[b & 0x0F]);
            }
        }
        return sb.toString();
    }

    /**
     * Reverses {@link #escape(byte[])}. Characters that were never escaped are taken as their UTF-8 bytes.
     *
     * @throws CommitmentException with {@code MALFORMED_PATH_ENCODING} if a {@code %} is not followed by two hex
     *     digits
     */
    @NonNull
    public static byte[] unescape(@NonNull final String escaped) throws CommitmentException {
        requireNonNull(escaped, "escaped must not be null");
        final var out = new ByteArrayOutputStream(escaped.length());
        int i = 0;
        while (i < escaped.length()) {
            final char c = escaped.charAt(i);
            if (c == '%') {
                if (i + 3 > escaped.length()) {
                    throw new CommitmentException(
                            MALFORMED_PATH_ENCODING, "Truncated escape at index " + i + " of \"" + escaped + "\"");
                }
                final int hi = Character.digit(escaped.charAt(i + 1), 16);
                final int lo = Character.digit(escaped.charAt(i + 2), 16);
                if (hi < 0 || lo < 0) {
                    throw new CommitmentException(
                            MALFORMED_PATH_ENCODING,
                            "Invalid escape \"" + escaped.substring(i, i + 3) + "\" in \"" + escaped + "\"");
                }
                out.write((hi << 4) | lo);
                i += 3;
            } else {
                final int end = nextEscape(escaped, i);
                final byte[] plain = escaped.substring(i, end).getBytes(StandardCharsets.UTF_8);
                out.write(plain, 0, plain.length);
                i = end;
            }
        }
        return out.toByteArray();
    }

    private static int nextEscape(@NonNull final String s, final int from) {
        final int index = s.indexOf('%', from);
        return index < 0 ? s.length() : index;
    }
}
