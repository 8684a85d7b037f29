package org.kteam.mlcheck;

import com.github.difflib.unifieddiff.UnifiedDiff;
import com.github.difflib.unifieddiff.UnifiedDiffFile;
import com.github.difflib.unifieddiff.UnifiedDiffReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A regex and keyword based classifier.  The subject decides review replies; whether a message
 * is a patch at all also depends on the message id and the body.
 */
public class SimpleClassifier implements MessageClassifier {
    private static final Logger logger = LoggerFactory.getLogger(SimpleClassifier.class);

    private static final Pattern PATCH_SUBJECT = Pattern.compile("^\\[?(patch|sru|ubuntu|pull)",
            Pattern.CASE_INSENSITIVE);

    // Old git versions put this in every generated message id
    static final String SEND_EMAIL_ID_MARKER = "git-send-email";

    // Sections of the SRU template used in cover letters
    static final List<String> TEMPLATE_MARKERS = Arrays.asList(
            "[Impact]", "[Fix]", "[Test]", "[Test Plan]", "[Where problems could occur]");

    static final int MIN_TEMPLATE_MARKERS = 2;

    private static final String SIGNATURE_DELIMITER = "-- ";

    @Override
    public Category getCategory(Message message) {
        String subject = message.getSubject();
        if (subject == null || subject.isEmpty()) {
            return Category.NOT_PATCH;
        }

        String lower = subject.toLowerCase(Locale.ROOT);
        if (lower.startsWith("applied")) {
            return Category.PATCH_APPLIED;
        }
        // NAK, NACK, NAC K... it comes in many flavors
        if (lower.startsWith("nak") || lower.startsWith("nac")) {
            return Category.PATCH_NAK;
        }
        if (lower.startsWith("ack")) {
            return Category.PATCH_ACK;
        }

        if (!isPatch(message)) {
            return Category.NOT_PATCH;
        }
        return hasTemplateMarkers(message.getBody()) ? Category.PATCH_COVER_LETTER : Category.PATCH_N;
    }

    private boolean isPatch(Message message) {
        if (!PATCH_SUBJECT.matcher(message.getSubject()).find()) {
            return false;
        }
        if (message.getMessageId().contains(SEND_EMAIL_ID_MARKER)) {
            return true;
        }
        // Cover letters usually carry no diff, only the template
        return hasInlineDiff(message.getBody()) || hasTemplateMarkers(message.getBody());
    }

    /**
     * Returns true if the text contains at least {@value #MIN_TEMPLATE_MARKERS} of the cover
     * letter template section headers.
     *
     * @param body Message body
     * @return True if the body looks like a filled in template
     */
    static boolean hasTemplateMarkers(String body) {
        long found = TEMPLATE_MARKERS.stream()
                .filter(body::contains)
                .count();
        return found >= MIN_TEMPLATE_MARKERS;
    }

    /**
     * Returns true if the text embeds a unified diff with at least one hunk.  Text that does not
     * parse as a diff is simply not a diff.
     *
     * @param body Message body
     * @return True if one or more hunks were found
     */
    static boolean hasInlineDiff(String body) {
        String diffText = extractDiff(body);
        if (diffText == null) {
            return false;
        }
        try (ByteArrayInputStream in = new ByteArrayInputStream(diffText.getBytes(StandardCharsets.UTF_8))) {
            UnifiedDiff diff = UnifiedDiffReader.parseUnifiedDiff(in);
            if (diff == null) {
                return false;
            }
            for (UnifiedDiffFile file : diff.getFiles()) {
                if (file.getPatch() != null && !file.getPatch().getDeltas().isEmpty()) {
                    return true;
                }
            }
            return false;
        } catch (Exception e) {
            logger.debug("body does not parse as a diff: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Cut the diff section out of a mail body: from the first file header up to the signature
     * delimiter, without trailing blank lines.  The reader takes its first line as a header, so
     * the section is returned behind an empty line.
     *
     * @return Diff section, or null if there is no file header
     */
    static String extractDiff(String body) {
        String[] lines = body.split("\r?\n", -1);
        int start = -1;
        for (int i = 0; i < lines.length && start < 0; i++) {
            if (lines[i].startsWith("diff --git ")
                    || (lines[i].startsWith("--- ") && i + 1 < lines.length && lines[i + 1].startsWith("+++ "))) {
                start = i;
            }
        }
        if (start < 0) {
            return null;
        }

        int end = lines.length;
        for (int i = start; i < lines.length; i++) {
            if (lines[i].equals(SIGNATURE_DELIMITER)) {
                end = i;
                break;
            }
        }
        while (end > start && lines[end - 1].trim().isEmpty()) {
            end--;
        }

        StringBuilder diff = new StringBuilder("\n");
        for (int i = start; i < end; i++) {
            diff.append(lines[i]).append('\n');
        }
        return diff.toString();
    }
}
