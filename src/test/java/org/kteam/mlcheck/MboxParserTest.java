package org.kteam.mlcheck;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MboxParserTest {
    private final SimpleClassifier classifier = new SimpleClassifier();

    @Test
    void parseMessages_shouldSplitOnEnvelopeLines() throws IOException {
        try (MboxParser parser = new MboxParser(Fixtures.mbox("single_ack.mbox").toFile(), classifier)) {
            List<Message> messages = parser.parseMessages();

            assertEquals(6, messages.size());
            assertEquals("[SRU][Jammy][PATCH 0/4] bar: fix resume", messages.get(0).getSubject());
            assertTrue(parser.getUnparseableMessages().isEmpty());
        }
    }

    @Test
    void parseMessages_shouldApplyLocalCategories() throws IOException {
        try (MboxParser parser = new MboxParser(Fixtures.mbox("applied.mbox").toFile(), classifier)) {
            List<Message> messages = parser.parseMessages();

            assertEquals(Category.PATCH_N, messages.get(0).getCategory());
            assertEquals(Category.PATCH_ACK, messages.get(1).getCategory());
            assertEquals(Category.PATCH_ACK, messages.get(2).getCategory());
            assertEquals(Category.PATCH_APPLIED, messages.get(3).getCategory());
            assertEquals("Jane Doe <jdoe@example.com>", messages.get(0).getSender());
        }
    }

    @Test
    void parseMessages_shouldKeepNonAsciiWithoutDeclaredCharset() throws IOException {
        try (MboxParser parser = new MboxParser(Fixtures.mbox("non_ascii_author.mbox").toFile(), classifier)) {
            List<Message> messages = parser.parseMessages();

            assertEquals(1, messages.size());
            Message message = messages.get(0);
            assertEquals("J\u00fcrgen Doe <jdoe@example.com>", message.getSender());
            assertTrue(message.getBody().contains("Signed-off-by: J\u00fcrgen Doe <jdoe@example.com>"));
            assertEquals(Category.PATCH_N, message.getCategory());
        }
    }

    @Test
    void parseMessages_shouldSkipMalformedRecords() throws IOException {
        try (MboxParser parser = new MboxParser(Fixtures.mbox("malformed.mbox").toFile(), classifier)) {
            List<Message> messages = parser.parseMessages();

            assertEquals(1, messages.size());
            assertEquals("<good@example.com>", messages.get(0).getMessageId());
            assertEquals(3, parser.getUnparseableMessages().size());
        }
    }

    @Test
    void parseMessages_shouldHandleEmptyInput() throws IOException {
        try (MboxParser parser = new MboxParser(new ByteArrayInputStream(new byte[0]), classifier)) {
            assertTrue(parser.parseMessages().isEmpty());
            assertTrue(parser.getUnparseableMessages().isEmpty());
        }
    }

    @Test
    void parseMessages_shouldConsumeInputOnce() throws IOException {
        String mbox = "From a at b  Mon Jun  3 10:00:00 2024\n"
                + "Subject: hi\n"
                + "Date: Mon, 3 Jun 2024 10:00:00 +0000\n"
                + "Message-ID: <hi@example.com>\n"
                + "\n"
                + "hello\n";
        try (MboxParser parser = new MboxParser(
                new ByteArrayInputStream(mbox.getBytes(StandardCharsets.UTF_8)), classifier)) {
            assertEquals(1, parser.parseMessages().size());
            assertTrue(parser.parseMessages().isEmpty());
        }
    }
}
