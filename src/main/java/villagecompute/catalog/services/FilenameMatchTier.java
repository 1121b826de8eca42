/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import com.google.common.io.Files;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ordered policy for resolving a CSV image filename against upload filenames. Tiers are tried in declaration order;
 * the first tier with any hit wins, and within a tier the first candidate in list order wins.
 *
 * <p>
 * {@link #BASENAME_CASE_INSENSITIVE} ignores extensions entirely, so {@code "logo"} and {@code "logo.gif"} both match
 * an upload named {@code "LOGO.png"} when nothing closer exists.
 */
public enum FilenameMatchTier {

    /**
     * Byte-for-byte equal names.
     */
    EXACT {
        @Override
        public boolean matches(String candidate, String requested) {
            return candidate.equals(requested);
        }
    },

    /**
     * Equal ignoring case.
     */
    CASE_INSENSITIVE {
        @Override
        public boolean matches(String candidate, String requested) {
            return candidate.equalsIgnoreCase(requested);
        }
    },

    /**
     * Equal ignoring case once the extension is stripped from both names.
     */
    BASENAME_CASE_INSENSITIVE {
        @Override
        public boolean matches(String candidate, String requested) {
            return baseName(candidate).equalsIgnoreCase(baseName(requested));
        }
    };

    /**
     * Whether {@code candidate} (an upload's name) satisfies this tier for {@code requested} (the CSV value).
     */
    public abstract boolean matches(String candidate, String requested);

    /**
     * Finds the best candidate for a requested filename.
     *
     * @param requested
     *            filename from the CSV
     * @param candidates
     *            candidates in priority order
     * @param nameOf
     *            extracts a candidate's filename
     * @return the first candidate of the first tier with a hit
     */
    public static <T> Optional<T> resolve(String requested, List<T> candidates, Function<T, String> nameOf) {
        if (requested == null || requested.isBlank()) {
            return Optional.empty();
        }
        for (FilenameMatchTier tier : values()) {
            for (T candidate : candidates) {
                String name = nameOf.apply(candidate);
                if (name != null && tier.matches(name, requested)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Filename without directory and without its last extension.
     */
    static String baseName(String filename) {
        return Files.getNameWithoutExtension(filename);
    }
}
