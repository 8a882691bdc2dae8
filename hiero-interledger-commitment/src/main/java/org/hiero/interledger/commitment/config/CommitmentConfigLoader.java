// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.config;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * Loads a {@link CommitmentConfig} from YAML. All keys live under a top-level {@code commitment} section; keys that
 * are absent keep their {@link CommitmentConfig#DEFAULT default} values.
 *
 * <pre>{@code
 * commitment:
 *   maxChainLength: 4
 *   logProofDetails: true
 * }</pre>
 */
public final class CommitmentConfigLoader {

    private static final Logger log = LogManager.getLogger(CommitmentConfigLoader.class);

    /** Classpath resource consulted by {@link #loadDefault()}. */
    public static final String DEFAULT_RESOURCE = "commitment.yml";

    private static final String SECTION = "commitment";

    private CommitmentConfigLoader() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, or returns the defaults when it is not present.
     */
    @NonNull
    public static CommitmentConfig loadDefault() {
        final var loader = CommitmentConfigLoader.class.getClassLoader();
        try (final var in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.info("No {} on the classpath, using default commitment config", DEFAULT_RESOURCE);
                return CommitmentConfig.DEFAULT;
            }
            final var config = load(in);
            log.info("Loaded commitment config from classpath resource {}: {}", DEFAULT_RESOURCE, config);
            return config;
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to read classpath resource " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Loads the config from a YAML file.
     */
    @NonNull
    public static CommitmentConfig load(@NonNull final Path ymlLoc) {
        requireNonNull(ymlLoc, "ymlLoc must not be null");
        try (final var in = Files.newInputStream(ymlLoc)) {
            final var config = load(in);
            log.info("Loaded commitment config from {}: {}", ymlLoc, config);
            return config;
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to read commitment config YAML file: " + ymlLoc, e);
        }
    }

    /**
     * Loads the config from a YAML stream, which is left open.
     *
     * @throws IllegalArgumentException if a key has a value of the wrong type or out of range
     */
    @NonNull
    public static CommitmentConfig load(@NonNull final InputStream in) {
        requireNonNull(in, "in must not be null");
        final var yamlIn = new Yaml(new SafeConstructor(new LoaderOptions()));
        final Object document = yamlIn.load(in);
        final var section = sectionOf(document);
        final var defaults = CommitmentConfig.DEFAULT;
        return new CommitmentConfig(
                intValue(section, "maxChainLength", defaults.maxChainLength()),
                intValue(section, "minIdentifierLength", defaults.minIdentifierLength()),
                intValue(section, "maxIdentifierLength", defaults.maxIdentifierLength()),
                booleanValue(section, "logProofDetails", defaults.logProofDetails()));
    }

    @NonNull
    private static Map<?, ?> sectionOf(@Nullable final Object document) {
        if (document == null) {
            return Map.of();
        }
        if (!(document instanceof Map<?, ?> root)) {
            throw new IllegalArgumentException("Commitment config must be a YAML mapping");
        }
        final Object section = root.get(SECTION);
        if (section == null) {
            return Map.of();
        }
        if (!(section instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("'" + SECTION + "' must be a YAML mapping");
        }
        return map;
    }

    private static int intValue(@NonNull final Map<?, ?> section, @NonNull final String key, final int defaultValue) {
        final Object value = section.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Integer i)) {
            throw new IllegalArgumentException(SECTION + "." + key + " must be an integer, was " + value);
        }
        return i;
    }

    private static boolean booleanValue(
            @NonNull final Map<?, ?> section, @NonNull final String key, final boolean defaultValue) {
        final Object value = section.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean b)) {
            throw new IllegalArgumentException(SECTION + "." + key + " must be a boolean, was " + value);
        }
        return b;
    }
}
