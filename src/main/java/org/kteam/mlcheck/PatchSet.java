package org.kteam.mlcheck;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A complete patch set: one thread with every message categorized in the context of the thread.
 *
 * Single message classification is ambiguous.  A reply that keeps the patch subject without
 * adding a "Re:" prefix looks exactly like a fresh patch, and an ack can be an answer to some
 * other ack.  The patch set therefore classifies in two passes: first every message on its own,
 * then a structural pass.  The structural pass first checks each patch against the thread's
 * epoch (its cover letter, or its earliest patch), then checks each review reply against the
 * message it replies to.
 *
 * The messages of the patch set are copies carrying the reclassified category; the thread given
 * to the constructor is left untouched.  All views are computed from the current messages on
 * every call.
 */
public class PatchSet implements Comparable<PatchSet> {
    private static final Set<Category> REPLY_PARENTS = EnumSet.of(Category.PATCH_COVER_LETTER, Category.PATCH_N);
    private static final Set<Category> REVIEW_REPLIES =
            EnumSet.of(Category.PATCH_ACK, Category.PATCH_NAK, Category.PATCH_APPLIED);

    private final MessageClassifier classifier;
    private List<Message> messages;

    /**
     * Create and classify a patch set.
     *
     * @param thread Messages of one thread, in any order
     * @param classifier Classifier for the local pass
     */
    public PatchSet(List<Message> thread, MessageClassifier classifier) {
        this.classifier = classifier;
        this.messages = new ArrayList<>(thread);
        this.messages.sort(Comparator.naturalOrder());
        reclassify();
    }

    /**
     * Run both classification passes over the thread, replacing the current categories.
     * Running it again yields the same categories.
     */
    public void reclassify() {
        List<Message> local = new ArrayList<>(messages.size());
        for (Message message : messages) {
            local.add(message.withCategory(classifier.getCategory(message)));
        }

        Message epoch = findEpoch(local);
        if (epoch == null) {
            // Nothing to validate against; local categories stand.
            messages = local;
            return;
        }

        // Series membership first, so every reply is judged against settled parents whatever
        // the timestamps say.
        List<Message> placed = new ArrayList<>(local.size());
        for (Message message : local) {
            placed.add(message.equals(epoch) ? message : message.withCategory(checkPlacement(message, epoch)));
        }

        Map<String, Message> byId = new HashMap<>();
        placed.forEach(m -> byId.put(m.getMessageId(), m));

        List<Message> result = new ArrayList<>(placed.size());
        for (Message message : placed) {
            result.add(message.withCategory(checkReply(message, byId)));
        }
        messages = result;
    }

    /**
     * Decide whether a non-epoch message still belongs to the series.
     */
    private Category checkPlacement(Message message, Message epoch) {
        switch (message.getCategory()) {
        case NOT_PATCH:
            return classifier.getCategory(message);
        case PATCH_N:
            // A series member answers the epoch or nothing at all.  Anything deeper is a reply
            // that kept the patch subject.
            if (!message.hasInReplyTo() || message.getInReplyTo().equals(epoch.getMessageId())) {
                return Category.PATCH_N;
            }
            return Category.NOT_PATCH;
        default:
            // The epoch claimed the cover letter role; another one is most likely a cross-post.
            return message.getCategory();
        }
    }

    /**
     * Review replies count only when they answer a patch or a cover letter.  Only the direct
     * parent is consulted; a parent outside the thread is given the benefit of the doubt.
     */
    private static Category checkReply(Message message, Map<String, Message> byId) {
        if (!message.getCategory().isAnyOf(REVIEW_REPLIES)) {
            return message.getCategory();
        }
        Message parent = message.hasInReplyTo() ? byId.get(message.getInReplyTo()) : null;
        if (parent == null || parent.getCategory().isAnyOf(REPLY_PARENTS)) {
            return message.getCategory();
        }
        return Category.NOT_PATCH;
    }

    /**
     * The earliest cover letter, else the earliest patch, else null.
     */
    private static Message findEpoch(List<Message> sorted) {
        Message firstPatch = null;
        for (Message message : sorted) {
            if (message.getCategory() == Category.PATCH_COVER_LETTER) {
                return message;
            }
            if (firstPatch == null && message.getCategory() == Category.PATCH_N) {
                firstPatch = message;
            }
        }
        return firstPatch;
    }

    /**
     * The root patch of this set: its cover letter, or lacking one, its earliest patch.
     *
     * @return Epoch message, or null if the thread holds no patch
     */
    public Message getEpochPatch() {
        return findEpoch(messages);
    }

    /**
     * Patches of the series, cover letter excluded, in chronological order.
     */
    public List<Message> getPatches() {
        return ofCategory(Category.PATCH_N);
    }

    public List<Message> getCoverLetters() {
        return ofCategory(Category.PATCH_COVER_LETTER);
    }

    public List<Message> getAcks() {
        return ofCategory(Category.PATCH_ACK);
    }

    public List<Message> getNaks() {
        return ofCategory(Category.PATCH_NAK);
    }

    public List<Message> getApplieds() {
        return ofCategory(Category.PATCH_APPLIED);
    }

    public List<Message> getNotPatches() {
        return ofCategory(Category.NOT_PATCH);
    }

    /**
     * Number of messages currently in the given category.
     *
     * @param category Category to count
     * @return Message count
     */
    public int countOf(Category category) {
        return (int) messages.stream().filter(m -> m.getCategory() == category).count();
    }

    /**
     * All messages of the thread in chronological order.  The list is a read-only view.
     */
    public List<Message> getAllMessages() {
        return Collections.unmodifiableList(messages);
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    private List<Message> ofCategory(Category category) {
        return messages.stream()
                .filter(m -> m.getCategory() == category)
                .collect(Collectors.toList());
    }

    /**
     * Orders patch sets by the timestamp of their epoch patch.  Sets without an epoch sort first.
     */
    @Override
    public int compareTo(PatchSet other) {
        return Comparator.nullsFirst(Comparator.<Message>naturalOrder())
                .compare(getEpochPatch(), other.getEpochPatch());
    }

    @Override
    public String toString() {
        Message epoch = getEpochPatch();
        return String.format("PatchSet{epoch=%s, messages=%d, patches=%d, acks=%d, naks=%d, applied=%d}",
                epoch == null ? null : epoch.getSubject(), size(),
                countOf(Category.PATCH_N), countOf(Category.PATCH_ACK),
                countOf(Category.PATCH_NAK), countOf(Category.PATCH_APPLIED));
    }
}
