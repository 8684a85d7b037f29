package org.kteam.mlcheck;

import org.apache.james.mime4j.codec.DecodeMonitor;
import org.apache.james.mime4j.codec.DecoderUtil;
import org.apache.james.mime4j.parser.AbstractContentHandler;
import org.apache.james.mime4j.parser.MimeStreamParser;
import org.apache.james.mime4j.stream.BodyDescriptor;
import org.apache.james.mime4j.stream.Field;
import org.apache.james.mime4j.stream.MimeConfig;
import org.apache.james.mime4j.util.ByteSequence;
import org.apache.james.mime4j.util.MimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable object representing one message from the list archive.
 *
 * Getters will return values that are possibly empty, but will not be null, with the exception
 * of {@link #getSubject()} on messages built by hand without one.  Two messages are equal when
 * their message ids are equal; the natural order is by timestamp.
 */
public class Message implements Comparable<Message> {
    private static final Logger logger = LoggerFactory.getLogger(Message.class);

    private static final MimeConfig MIME_CONFIG = new MimeConfig.Builder()
            .setMaxLineLen(-1)
            .setMaxHeaderLen(-1)
            .setMaxHeaderCount(-1)
            .build();

    private final String subject;
    private final String messageId;
    private final String inReplyTo;
    private final Set<String> references;
    private final OffsetDateTime timestamp;
    private final String body;
    private final String sender;
    private final Category category;

    private Message(String subject, String messageId, String inReplyTo, Set<String> references,
            OffsetDateTime timestamp, String body, String sender, Category category) {
        this.subject = subject;
        this.messageId = messageId;
        this.inReplyTo = inReplyTo;
        this.references = references;
        this.timestamp = timestamp;
        this.body = body;
        this.sender = sender;
        this.category = category;
    }

    /**
     * Builder (fluent interface) used to construct a {@link Message}.
     */
    public static class Builder {
        private String subject;
        private String messageId;
        private String inReplyTo = "";
        private Set<String> references = new LinkedHashSet<>();
        private OffsetDateTime timestamp;
        private String body = "";
        private String sender = "";
        private Category category = Category.NOT_PATCH;

        public Message.Builder subject(String subject) {
            this.subject = MailFields.normalizeSubject(subject);
            return this;
        }

        public Message.Builder messageId(String messageId) {
            this.messageId = messageId == null ? null : messageId.trim();
            return this;
        }

        public Message.Builder inReplyTo(String inReplyTo) {
            this.inReplyTo = inReplyTo == null ? "" : inReplyTo.trim();
            return this;
        }

        public Message.Builder references(Set<String> references) {
            this.references = new LinkedHashSet<>(references);
            return this;
        }

        public Message.Builder timestamp(OffsetDateTime timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Message.Builder body(String body) {
            this.body = body == null ? "" : body;
            return this;
        }

        public Message.Builder sender(String sender) {
            this.sender = sender == null ? "" : sender;
            return this;
        }

        public Message.Builder category(Category category) {
            this.category = Objects.requireNonNull(category);
            return this;
        }

        /**
         * Return a constructed {@link Message} object.
         *
         * @return The message.
         * @throws IllegalStateException if the message id or timestamp is missing
         */
        public Message build() {
            if (messageId == null || messageId.isEmpty() || timestamp == null) {
                throw new IllegalStateException("Invalid message: message id and date are required");
            }
            return new Message(subject, messageId, inReplyTo, Collections.unmodifiableSet(references),
                    timestamp, body, sender, category);
        }
    }

    /**
     * Parse a single raw mail (headers and body, no mbox envelope line) into a {@link Message}.
     * The returned message is categorized {@link Category#NOT_PATCH} until classified.
     *
     * @param input Raw mail text
     * @return Parsed message
     * @throws IllegalStateException if the mail lacks a subject, message id or parseable date
     */
    public static Message parseMimeMessage(String input) {
        MimeStreamParser parser = new MimeStreamParser(MIME_CONFIG);
        parser.setContentDecoding(true);
        MessageContentHandler handler = new MessageContentHandler();
        parser.setContentHandler(handler);

        try {
            parser.parse(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            logger.debug("failed to parse message \"{}\": {}", getFirstLineMax(input, 80, "(empty)"), e.getMessage());
        }

        if (!handler.hasSubject()) {
            logger.debug("message is malformed, no subject: {}", getFirstLineMax(input, 32, "(empty)"));
            throw new IllegalStateException("Invalid message: subject is required");
        }
        try {
            return handler.getResult();
        } catch (IllegalStateException e) {
            logger.debug("message is malformed: message_id={}, date={}, body={}...",
                    handler.messageId, handler.rawDate, getFirstLineMax(input, 32, "(empty)"));
            throw e;
        }
    }

    /**
     * Content handler for mime4j mail parser.
     */
    private static class MessageContentHandler extends AbstractContentHandler {
        private final Builder builder;
        private final StringBuilder body;
        private String messageId;
        private String rawDate;
        private boolean subjectSeen;

        private MessageContentHandler() {
            builder = new Builder();
            body = new StringBuilder();
        }

        private boolean hasSubject() {
            return subjectSeen;
        }

        private Message getResult() {
            return builder.body(MailFields.demangleEmail(body.toString(), true)).build();
        }

        @Override
        public void body(BodyDescriptor bodyDescriptor, InputStream inputStream) throws IOException {
            // Multipart text parts are concatenated; attachments are already stripped by the archive.
            if (bodyDescriptor.getMimeType() != null && !bodyDescriptor.getMimeType().startsWith("text/")) {
                return;
            }
            if (body.length() > 0) {
                body.append('\n');
            }
            body.append(new String(inputStream.readAllBytes(), charsetOf(bodyDescriptor)));
        }

        @Override
        public void field(Field rawField) {
            String name = rawField.getName();
            if      (name.equalsIgnoreCase("From"))        builder.sender(MailFields.demangleSender(decodeWords(rawField)));
            else if (name.equalsIgnoreCase("Subject"))     parseSubject(decodeWords(rawField));
            else if (name.equalsIgnoreCase("Message-ID"))  parseMessageId(rawField.getBody());
            else if (name.equalsIgnoreCase("In-Reply-To")) builder.inReplyTo(rawField.getBody());
            else if (name.equalsIgnoreCase("References"))  builder.references(MailFields.parseMailReferences(rawField.getBody()));
            else if (name.equalsIgnoreCase("Date"))        parseDate(rawField.getBody());
        }

        /**
         * Field body read from the raw header bytes as UTF-8, with RFC 2047 encoded words
         * decoded.  The parser itself reads header bytes as ASCII, which loses 8-bit names.
         */
        private static String decodeWords(Field rawField) {
            ByteSequence raw = rawField.getRaw();
            String value = rawField.getBody();
            if (raw != null) {
                String line = new String(raw.toByteArray(), StandardCharsets.UTF_8);
                int colon = line.indexOf(':');
                value = colon < 0 ? value : MimeUtil.unfold(line.substring(colon + 1)).trim();
            }
            return DecoderUtil.decodeEncodedWords(value, DecodeMonitor.SILENT);
        }

        private void parseSubject(String field) {
            subjectSeen = true;
            builder.subject(field);
        }

        private void parseMessageId(String field) {
            messageId = field;
            builder.messageId(field);
        }

        private void parseDate(String field) {
            rawDate = field;
            builder.timestamp(MailFields.parseMailDate(field));
        }

        private static Charset charsetOf(BodyDescriptor bodyDescriptor) {
            // us-ascii is what the parser reports when no charset was declared
            String charset = bodyDescriptor.getCharset();
            if (charset == null || charset.equalsIgnoreCase("us-ascii")) {
                return StandardCharsets.UTF_8;
            }
            try {
                return Charset.forName(charset);
            } catch (RuntimeException e) {
                return StandardCharsets.UTF_8;
            }
        }
    }

    /**
     * Returns either the first line or a maximum of maxLen characters from the input.  Null-safe.
     *
     * @param input Input
     * @param maxLen Maximum length of original input to return
     * @param defIfEmpty Default to return if the string is empty or null.
     * @return Output string (non-newline-terminated)
     */
    private static String getFirstLineMax(String input, int maxLen, String defIfEmpty) {
        if (input == null) {
            return defIfEmpty;
        }
        int newline = input.indexOf('\n');
        int len = Math.min(newline < 0 ? input.length() : newline, maxLen);
        return len > 0 ? input.substring(0, len) : defIfEmpty;
    }

    /**
     * Return a copy of this message carrying a different category.
     *
     * @param category New category
     * @return Message identical to this one apart from its category
     */
    public Message withCategory(Category category) {
        if (category == this.category) {
            return this;
        }
        return new Message(subject, messageId, inReplyTo, references, timestamp, body, sender,
                Objects.requireNonNull(category));
    }

    /**
     * Link to the archive's thread view for the month this message was sent in.
     *
     * @return Thread URL
     */
    public String getThreadUrl() {
        return MlCheckConfig.getThreadUrl(timestamp.getYear(), timestamp.getMonthValue());
    }

    /**
     * Generate a filename-safe name for this patch, as if made by git format-patch.  The message
     * id is appended to guard against duplicate subjects.
     *
     * @return Name made of [A-Za-z0-9_] only, or null if there is no subject
     */
    public String generatePatchName() {
        if (subject == null || subject.isEmpty()) {
            return null;
        }
        String unsafeName = subject + "__" + messageId;
        return unsafeName.replaceAll("[^A-Za-z0-9]", "_").replaceAll("^_+|_+$", "");
    }

    /**
     * Generate something resembling a .patch file.
     *
     * @return Patch file content
     */
    public String generatePatch() {
        return String.format("Date: %s\nFrom: %s\nSubject: %s\nMessage-Id: %s\n\n%s",
                timestamp, sender, subject, messageId, body);
    }

    /**
     * Machine readable summary in "[YYYY.MM] URL subject" format.
     *
     * @return Short summary (non-newline-terminated)
     */
    public String getShortSummary() {
        return String.format("[%d.%02d] %s %s",
                timestamp.getYear(), timestamp.getMonthValue(), getThreadUrl(), subject);
    }

    public boolean hasInReplyTo() {
        return !inReplyTo.isEmpty();
    }

    @Override
    public int compareTo(Message other) {
        return timestamp.compareTo(other.timestamp);
    }

    @Override
    public String toString() {
        return new StringBuilder("Message{")
                .append("subject='").append(subject).append('\'')
                .append(", timestamp='").append(timestamp).append('\'')
                .append(", sender='").append(sender).append('\'')
                .append(", messageId='").append(messageId).append('\'')
                .append(", inReplyTo='").append(inReplyTo).append('\'')
                .append(", category=").append(category)
                .append('}').toString();
    }

    public String getBody() {
        return body;
    }

    public Category getCategory() {
        return category;
    }

    public String getInReplyTo() {
        return inReplyTo;
    }

    public String getMessageId() {
        return messageId;
    }

    public Set<String> getReferences() {
        return references;
    }

    public String getSender() {
        return sender;
    }

    public String getSubject() {
        return subject;
    }

    public OffsetDateTime getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Message message = (Message) o;
        return Objects.equals(messageId, message.messageId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageId);
    }
}
