package org.kteam.mlcheck;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for the header values found in the list archive.  The archive does not stick to one
 * standard, so every parser here degrades to an empty or null result instead of failing.
 */
public final class MailFields {
    private static final Logger logger = LoggerFactory.getLogger(MailFields.class);

    // The weekday is optional and some clients get it wrong, so it is dropped before parsing
    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("d MMM yyyy HH:mm:ss Z", Locale.ENGLISH);

    private static final Pattern LEADING_WEEKDAY = Pattern.compile("^[A-Za-z]+,\\s*");

    private static final Pattern TRAILING_COMMENT = Pattern.compile("\\s*\\([^)]*\\)\\s*$");

    // Angle brackets as seen in From, Acked-by and SOB lines; safe on content that may not
    // contain any address at all, e.g. a message body.
    private static final Pattern EMAIL_STRICT = Pattern.compile("<([^\\s\\\\]+)\\sat\\s([^\\s\\\\]+)>");

    // A bare From header: "user at domain (Display Name)"
    private static final Pattern EMAIL_LOOSE = Pattern.compile(
            "([^\\s\\\\]+)\\sat\\s([^\\s\\\\()]+)(?:\\s+\\((.*)\\))?");

    private static final Pattern MANGLED_NAME = Pattern.compile("\\S+\\sat\\s\\S+");

    private MailFields() {
    }

    /**
     * Parse a Date header, with or without its leading weekday.  The weekday is not checked
     * against the date.  A trailing parenthetical comment such as "(CET)" is ignored.
     *
     * @param raw Raw header value, may be null
     * @return Parsed timestamp, or null if no format applies
     */
    public static OffsetDateTime parseMailDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String date = TRAILING_COMMENT.matcher(raw.trim()).replaceFirst("").replaceAll("\\s+", " ");
        date = LEADING_WEEKDAY.matcher(date).replaceFirst("");
        try {
            return OffsetDateTime.parse(date, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            logger.warn("failed to parse date: '{}' ({})", raw, e.getMessage());
            return null;
        }
    }

    /**
     * Split a References header into message ids.
     *
     * @param raw Whitespace delimited list of message ids, may be null
     * @return Set of message ids, empty if there are none
     */
    public static Set<String> parseMailReferences(String raw) {
        if (raw == null || raw.isBlank()) {
            return Collections.emptySet();
        }
        Set<String> references = new LinkedHashSet<>();
        for (String id : raw.trim().split("\\s+")) {
            if (!id.isEmpty()) {
                references.add(id);
            }
        }
        return references;
    }

    /**
     * Mailman rewrites user@example.com as "user at example.com" in every field.  This reverses
     * the substitution.
     *
     * In strict mode only bracketed addresses are rewritten in place, so arbitrary text such as a
     * message body can be passed.  Loose mode expects a bare From header of the form
     * "user at domain (Display Name)" and returns "Display Name &lt;user@domain&gt;", or just the
     * address when the name is missing or is itself a mangled address.  Loose input that does not
     * look like an address is returned unchanged.
     *
     * @param raw Content to demangle, may be null
     * @param strict True for free text, false for a From header
     * @return Demangled content, or null for null input
     */
    public static String demangleEmail(String raw, boolean strict) {
        if (raw == null) {
            return null;
        }
        if (strict) {
            return EMAIL_STRICT.matcher(raw).replaceAll("<$1@$2>");
        }

        Matcher m = EMAIL_LOOSE.matcher(raw.trim());
        if (!m.matches()) {
            return raw;
        }
        String address = m.group(1) + "@" + m.group(2);
        String name = m.group(3) == null ? "" : m.group(3).trim();
        if (name.isEmpty() || MANGLED_NAME.matcher(name).matches()) {
            return address;
        }
        return name + " <" + address + ">";
    }

    /**
     * Demangle a From header, which comes either bracketed ("Name &lt;user at domain&gt;") or
     * bare ("user at domain (Name)").
     *
     * @param raw From header value, may be null
     * @return Demangled sender, or null for null input
     */
    public static String demangleSender(String raw) {
        if (raw != null && EMAIL_STRICT.matcher(raw).find()) {
            return demangleEmail(raw, true).trim();
        }
        return demangleEmail(raw, false);
    }

    /**
     * Collapse folded subjects onto one line.
     *
     * @param subject Raw subject, may be null
     * @return Normalized subject, or null for null input
     */
    public static String normalizeSubject(String subject) {
        if (subject == null) {
            return null;
        }
        return subject.replace('\n', ' ').replace('\t', ' ').replace("  ", " ");
    }
}
