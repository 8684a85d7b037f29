package org.kteam.mlcheck;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/**
 * Shared helpers for building messages and loading the mbox fixtures.
 */
final class Fixtures {
    static final String INLINE_DIFF = "Signed-off-by: Jane Doe <jdoe at example.com>\n"
            + "---\n"
            + " drivers/foo.c | 2 +-\n"
            + "\n"
            + "diff --git a/drivers/foo.c b/drivers/foo.c\n"
            + "index 1111111..2222222 100644\n"
            + "--- a/drivers/foo.c\n"
            + "+++ b/drivers/foo.c\n"
            + "@@ -1,3 +1,3 @@\n"
            + " int foo(void)\n"
            + "-    return 0;\n"
            + "+    return 1;\n"
            + " }\n"
            + "-- \n"
            + "2.34.1\n"
            + "\n";

    static final String COVER_LETTER_BODY = "[Impact]\nIt breaks.\n\n[Fix]\nBackport.\n\n"
            + "[Test Plan]\nBoot it.\n\n[Where problems could occur]\nNowhere.\n";

    private Fixtures() {
    }

    static OffsetDateTime at(int day, int hour) {
        return OffsetDateTime.of(2024, 6, day, hour, 0, 0, 0, ZoneOffset.UTC);
    }

    static Message.Builder message(String id, String subject, OffsetDateTime timestamp) {
        return new Message.Builder()
                .messageId(id)
                .subject(subject)
                .timestamp(timestamp)
                .sender("Jane Doe <jdoe@example.com>");
    }

    static Message reply(String id, String subject, OffsetDateTime timestamp, String parentId, String sender) {
        return new Message.Builder()
                .messageId(id)
                .subject(subject)
                .timestamp(timestamp)
                .inReplyTo(parentId)
                .references(new LinkedHashSet<>(Arrays.asList(parentId)))
                .sender(sender)
                .build();
    }

    static Path mbox(String name) {
        URL url = Fixtures.class.getResource("/mbox/" + name);
        if (url == null) {
            throw new IllegalArgumentException("missing fixture " + name);
        }
        try {
            return Paths.get(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    static List<Message> load(String name) {
        try {
            return MailArchive.readMessages(mbox(name), new SimpleClassifier());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static PatchSet patchSet(String name) {
        return new PatchSet(load(name), new SimpleClassifier());
    }

    static Message byId(PatchSet patchSet, String id) {
        return patchSet.getAllMessages().stream()
                .filter(m -> m.getMessageId().equals(id))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no message " + id));
    }

    static byte[] gzip(Path file) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream out = new GZIPOutputStream(bytes)) {
            out.write(Files.readAllBytes(file));
        }
        return bytes.toByteArray();
    }
}
