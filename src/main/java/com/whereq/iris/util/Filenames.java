package com.whereq.iris.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Filename helpers for client supplied upload names.
 */
public final class Filenames {

    static final String FALLBACK_NAME = "upload";

    private static final Pattern SEPARATORS = Pattern.compile("[\\s/\\\\]+");
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_.-]");

    private Filenames() {
    }

    /**
     * Reduce a client filename to a safe single path segment: ASCII letters, digits,
     * {@code . _ -}; whitespace and path separators become {@code _}; leading dots and
     * underscores are dropped.
     */
    public static String sanitize(String filename) {
        if (filename == null) {
            return FALLBACK_NAME;
        }
        String ascii = Normalizer.normalize(filename, Normalizer.Form.NFKD);
        String joined = SEPARATORS.matcher(ascii.strip()).replaceAll("_");
        String safe = UNSAFE.matcher(joined).replaceAll("");
        safe = safe.replaceAll("^[._]+", "");
        return safe.isEmpty() ? FALLBACK_NAME : safe;
    }

    /**
     * {@code name} if nothing by that name exists in {@code directory}, otherwise
     * {@code stem_1.ext}, {@code stem_2.ext}, ... whichever is free first.
     */
    public static String unique(Path directory, String name) {
        if (!Files.exists(directory.resolve(name))) {
            return name;
        }
        String stem = stem(name);
        String extension = name.substring(stem.length());
        for (int i = 1; ; i++) {
            String candidate = stem + "_" + i + extension;
            if (!Files.exists(directory.resolve(candidate))) {
                return candidate;
            }
        }
    }

    /**
     * Filename without its last extension.
     */
    public static String stem(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Last extension without the dot, or an empty string.
     */
    public static String extension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1) : "";
    }
}
