package org.kteam.mlcheck;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Which patch sets a run reports.
 */
public enum FilterMode {
    ALL("all"),
    /** No naks and fewer acks than required. */
    NEEDS_ACKS("needs-acks"),
    /** No naks and enough acks. */
    READY_TO_APPLY("ready-to-apply"),
    APPLIED("applied"),
    /** Nak'd and never applied. */
    REJECTED("rejected");

    private final String text;

    FilterMode(String text) {
        this.text = text;
    }

    /**
     * Look up a mode by its command line name, e.g. "needs-acks".  Enum constant names are
     * accepted too.
     *
     * @param text Mode name, case insensitive
     * @return Matching mode
     * @throws IllegalArgumentException if no mode matches
     */
    public static FilterMode fromString(String text) {
        for (FilterMode mode : values()) {
            if (mode.text.equalsIgnoreCase(text) || mode.name().equalsIgnoreCase(text)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Invalid mode \"" + text + "\", expected one of " + names());
    }

    static String names() {
        return Arrays.stream(values())
                .map(FilterMode::toString)
                .collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return text;
    }
}
