package de.bsommerfeld.fdf.core.model;

import com.google.common.collect.ImmutableSet;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Edge pieces of a backdrop border, written pipe-delimited in
 * {@code BackdropCornerFlags "UL|UR|BL|BR|T|L|B|R"}.
 */
public enum BackdropCornerFlag {

    UL, UR, BL, BR, T, L, B, R;

    /**
     * Parses a pipe-delimited flag string. Unknown or empty segments are ignored;
     * order of first appearance is kept.
     */
    public static Set<BackdropCornerFlag> parse(String flags) {
        ImmutableSet.Builder<BackdropCornerFlag> result = ImmutableSet.builder();
        if (flags == null)
            return result.build();
        for (String part : flags.split("\\|")) {
            String key = part.trim().toUpperCase(Locale.ROOT);
            for (BackdropCornerFlag flag : values()) {
                if (flag.name().equals(key))
                    result.add(flag);
            }
        }
        return result.build();
    }

    public static String join(Set<BackdropCornerFlag> flags) {
        return flags.stream().map(Enum::name).collect(Collectors.joining("|"));
    }
}
