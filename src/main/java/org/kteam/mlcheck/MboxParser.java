package org.kteam.mlcheck;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Scanner;

/**
 * A simple parser for mbox-formatted files, such as the monthly text archives of the list.
 * Every parsed message carries the category assigned by the given classifier.
 */
public class MboxParser implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(MboxParser.class);

    private InputStream input;
    private final MessageClassifier classifier;
    private final List<String> unparseableMessages;

    /**
     * Create a new parser to operate on the given file.
     *
     * @param mboxFile An mbox-formatted file to parse
     * @param classifier Classifier used for the initial category of each message
     * @throws FileNotFoundException
     */
    public MboxParser(File mboxFile, MessageClassifier classifier) throws FileNotFoundException {
        this(new FileInputStream(mboxFile), classifier);
    }

    /**
     * Create a new parser reading from the given stream.  The stream is owned by the parser.
     *
     * @param input mbox-formatted content
     * @param classifier Classifier used for the initial category of each message
     */
    public MboxParser(InputStream input, MessageClassifier classifier) {
        this.input = input;
        this.classifier = classifier;
        unparseableMessages = new ArrayList<>();
    }

    /**
     * Parse the messages in this parser's input and return a list of {@link Message} items.
     * Records lacking a subject, message id or parseable date are skipped and kept in
     * {@link #getUnparseableMessages()}.
     *
     * @return List of messages in file order.
     */
    public List<Message> parseMessages() {
        List<Message> messages = new ArrayList<>();
        if (input == null) {
            return messages;
        }

        Scanner s = new Scanner(new BufferedInputStream(input), StandardCharsets.UTF_8);
        StringBuilder cur = new StringBuilder();

        while (s.hasNextLine()) {
            String line = s.nextLine();
            // The mbox delimiter is /^From /; the envelope line itself is not part of the mail.
            if (line.startsWith("From ")) {
                addMessage(cur.toString(), messages);
                cur = new StringBuilder();
                continue;
            }
            cur.append(line).append('\n');
        }
        addMessage(cur.toString(), messages);
        s.close();
        input = null;

        if (!unparseableMessages.isEmpty()) {
            logger.debug("{} unparseable messages skipped", unparseableMessages.size());
        }
        return messages;
    }

    private void addMessage(String raw, List<Message> messages) {
        // If no messages are in the file, don't try to parse an empty string
        if (raw.isBlank()) {
            return;
        }
        try {
            Message message = Message.parseMimeMessage(raw);
            messages.add(message.withCategory(classifier.getCategory(message)));
        } catch (IllegalStateException e) {
            unparseableMessages.add(raw);
        }
    }

    /**
     * Close the input used by this parser.
     *
     * @throws IOException
     */
    @Override
    public void close() throws IOException {
        if (input != null) {
            input.close();
            input = null;
        }
    }

    /**
     * Retrieve a list of messages which could not be parsed into {@link Message} objects.
     *
     * @return List of Strings of unparseable messages.
     */
    public List<String> getUnparseableMessages() {
        return unparseableMessages;
    }
}
