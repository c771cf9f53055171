package com.campaignkeeper.storage;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Entity ids: a slug of the name plus a short random suffix, e.g. {@code captain-vex-k3f_9Q}.
 */
public class IdGenerator {

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789_-";
    private static final int SUFFIX_LENGTH = 6;
    private static final SecureRandom RANDOM = new SecureRandom();

    /** Generated ids and hand-picked ones alike; a leading {@code _} marks a config record. */
    private static final Pattern VALID_ID = Pattern.compile("_?[A-Za-z0-9][A-Za-z0-9_-]*");

    private final Supplier<String> suffixes;

    public IdGenerator() {
        this(() -> randomSuffix(SUFFIX_LENGTH));
    }

    public IdGenerator(Supplier<String> suffixes) {
        this.suffixes = suffixes;
    }

    public String fileId(String name) {
        return slugify(name) + "-" + suffixes.get();
    }

    public static boolean isValidId(String id) {
        return id != null && VALID_ID.matcher(id).matches();
    }

    public static String slugify(String value) {
        if (value == null || value.isBlank()) {
            return "entity";
        }
        String slug = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        slug = slug.replaceAll("(^-+|-+$)", "");
        return slug.isEmpty() ? "entity" : slug;
    }

    static String randomSuffix(int length) {
        StringBuilder out = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            out.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return out.toString();
    }
}
