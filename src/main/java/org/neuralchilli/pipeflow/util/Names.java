package org.neuralchilli.pipeflow.util;

import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Generated object names and DNS-1123 label checks.
 */
public final class Names {

    public static final int MAX_LENGTH = 63;
    public static final int SUFFIX_LENGTH = 5;

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final Pattern DNS_LABEL = Pattern.compile("^[a-z0-9]([-a-z0-9]*[a-z0-9])?$");

    private Names() {
    }

    /**
     * {@code base-xxxxx}, with {@code base} cut so the result fits in a label.
     */
    public static String withRandomSuffix(String base) {
        int maxBase = MAX_LENGTH - SUFFIX_LENGTH - 1;
        String prefix = base.length() > maxBase ? base.substring(0, maxBase) : base;
        if (prefix.endsWith("-")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        return prefix + "-" + randomSuffix();
    }

    public static String randomSuffix() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return suffix.toString();
    }

    public static boolean isDnsLabel(String name) {
        return name != null && name.length() <= MAX_LENGTH && DNS_LABEL.matcher(name).matches();
    }
}
