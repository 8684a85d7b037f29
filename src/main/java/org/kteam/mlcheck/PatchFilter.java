package org.kteam.mlcheck;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Selects the patch sets a run is interested in.  Every mode first requires an epoch patch sent
 * at or after the cutoff.
 */
public class PatchFilter implements Predicate<PatchSet> {
    private static final Logger logger = LoggerFactory.getLogger(PatchFilter.class);

    private final FilterMode mode;
    private final int requiredAcks;
    private final List<String> ignoredAckers;
    private final OffsetDateTime since;

    /**
     * Create a filter without a cutoff or ignored ackers.
     *
     * @param mode Which patch sets to accept
     * @param requiredAcks Ack count at which a patch set is ready to apply
     */
    public PatchFilter(FilterMode mode, int requiredAcks) {
        this(mode, requiredAcks, Collections.emptyList(), OffsetDateTime.MIN);
    }

    /**
     * Create a filter.
     *
     * @param mode Which patch sets to accept
     * @param requiredAcks Ack count at which a patch set is ready to apply
     * @param ignoredAckers Addresses whose acks disqualify a patch set in {@link FilterMode#NEEDS_ACKS} mode;
     *                      blank entries are dropped
     * @param since Patch sets whose epoch is older than this are rejected
     * @throws IllegalArgumentException for a missing mode or cutoff, or a negative ack count
     */
    public PatchFilter(FilterMode mode, int requiredAcks, Collection<String> ignoredAckers, OffsetDateTime since) {
        if (mode == null || since == null) {
            throw new IllegalArgumentException("mode and cutoff are required");
        }
        if (requiredAcks < 0) {
            throw new IllegalArgumentException("required acks must not be negative: " + requiredAcks);
        }
        this.mode = mode;
        this.requiredAcks = requiredAcks;
        this.ignoredAckers = new ArrayList<>();
        if (ignoredAckers != null) {
            // A blank entry would match every sender
            ignoredAckers.stream()
                    .filter(acker -> acker != null && !acker.isBlank())
                    .map(String::trim)
                    .forEach(this.ignoredAckers::add);
        }
        this.since = since;
        logger.debug("PatchFilter: mode={}, requiredAcks={}, ignoredAckers={}, since={}",
                mode, requiredAcks, this.ignoredAckers, since);
    }

    /**
     * Returns true if the patch set should be reported.
     *
     * @param patchSet Classified patch set
     * @return True to keep the patch set
     */
    public boolean matches(PatchSet patchSet) {
        Message epoch = patchSet.getEpochPatch();
        if (epoch == null || epoch.getTimestamp().isBefore(since)) {
            return false;
        }

        int acks = patchSet.countOf(Category.PATCH_ACK);
        int naks = patchSet.countOf(Category.PATCH_NAK);
        int applied = patchSet.countOf(Category.PATCH_APPLIED);

        switch (mode) {
        case ALL:
            return true;
        case NEEDS_ACKS:
            return naks == 0 && acks < requiredAcks && !hasIgnoredAcker(patchSet);
        case READY_TO_APPLY:
            return naks == 0 && acks >= requiredAcks;
        case APPLIED:
            return applied > 0;
        case REJECTED:
            return applied == 0 && naks > 0;
        default:
            throw new IllegalStateException("Unknown mode " + mode);
        }
    }

    @Override
    public boolean test(PatchSet patchSet) {
        return matches(patchSet);
    }

    private boolean hasIgnoredAcker(PatchSet patchSet) {
        return patchSet.getAcks().stream()
                .anyMatch(ack -> ignoredAckers.stream().anyMatch(ack.getSender()::contains));
    }

    public FilterMode getMode() {
        return mode;
    }

    public int getRequiredAcks() {
        return requiredAcks;
    }

    public List<String> getIgnoredAckers() {
        return Collections.unmodifiableList(ignoredAckers);
    }

    public OffsetDateTime getSince() {
        return since;
    }

    @Override
    public String toString() {
        return "PatchFilter{mode=" + mode + ", requiredAcks=" + requiredAcks
                + ", ignoredAckers=" + ignoredAckers + ", since=" + since + '}';
    }
}
