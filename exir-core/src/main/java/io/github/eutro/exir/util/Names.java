package io.github.eutro.exir.util;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utilities for variable names.
 */
public final class Names {
    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");
    private static final Pattern WORD = Pattern.compile("[A-Za-z0-9_]+");

    private Names() {
    }

    /**
     * Check whether a name is a simple identifier, the only kind of name that passes may rename.
     * <p>
     * Module names and qualified names never are.
     *
     * @param name The name.
     * @return Whether it matches {@code [a-z_][a-z0-9_]*}.
     */
    public static boolean isSimpleIdentifier(@Nullable String name) {
        return name != null && SIMPLE_IDENTIFIER.matcher(name).matches();
    }

    /**
     * Get the simple identifiers that occur as whole words in a piece of source text.
     * <p>
     * Nothing is parsed, so the words of strings, comments and qualified calls are included.
     *
     * @param code The text.
     * @return The identifiers, in order of first occurrence.
     */
    public static Set<String> wordsOf(@NotNull String code) {
        Set<String> words = new LinkedHashSet<>();
        Matcher matcher = WORD.matcher(code);
        while (matcher.find()) {
            if (isSimpleIdentifier(matcher.group())) words.add(matcher.group());
        }
        return words;
    }

    /**
     * Check whether a name is an ignored name, that is, one starting with an underscore.
     *
     * @param name The name.
     * @return Whether it is ignored.
     */
    public static boolean isIgnored(@NotNull String name) {
        return name.startsWith("_");
    }

    /**
     * Find a name based on {@code base} which is not in {@code taken}.
     * <p>
     * Tries {@code base} itself, then {@code base1}, {@code base2}, and so on.
     *
     * @param base  The preferred name.
     * @param taken The names that may not be used.
     * @return The fresh name.
     */
    public static String fresh(@NotNull String base, @NotNull Set<String> taken) {
        if (!taken.contains(base)) return base;
        for (int i = 1; ; i++) {
            String candidate = base + i;
            if (!taken.contains(candidate)) return candidate;
        }
    }
}
