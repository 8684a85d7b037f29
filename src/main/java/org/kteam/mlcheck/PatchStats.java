package org.kteam.mlcheck;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Review statistics over a set of patch sets.
 */
@JsonPropertyOrder({
        "total_patches", "total_applied", "median_age_days", "median_patches_in_patch",
        "top_submitter", "top_acker", "top_naker", "top_applier",
        "median_days_to_first_ack", "median_days_to_first_nak", "median_days_to_applied"})
public class PatchStats {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @JsonProperty("total_patches")
    private final int totalPatches;
    @JsonProperty("total_applied")
    private final int totalApplied;
    @JsonProperty("median_age_days")
    private final double medianAgeDays;
    @JsonProperty("median_patches_in_patch")
    private final double medianPatchesInPatch;
    @JsonProperty("top_submitter")
    private final SenderCount topSubmitter;
    @JsonProperty("top_acker")
    private final SenderCount topAcker;
    @JsonProperty("top_naker")
    private final SenderCount topNaker;
    @JsonProperty("top_applier")
    private final SenderCount topApplier;
    @JsonProperty("median_days_to_first_ack")
    private final double medianDaysToFirstAck;
    @JsonProperty("median_days_to_first_nak")
    private final double medianDaysToFirstNak;
    @JsonProperty("median_days_to_applied")
    private final double medianDaysToApplied;

    private PatchStats(int totalPatches, int totalApplied, double medianAgeDays, double medianPatchesInPatch,
            SenderCount topSubmitter, SenderCount topAcker, SenderCount topNaker, SenderCount topApplier,
            double medianDaysToFirstAck, double medianDaysToFirstNak, double medianDaysToApplied) {
        this.totalPatches = totalPatches;
        this.totalApplied = totalApplied;
        this.medianAgeDays = medianAgeDays;
        this.medianPatchesInPatch = medianPatchesInPatch;
        this.topSubmitter = topSubmitter;
        this.topAcker = topAcker;
        this.topNaker = topNaker;
        this.topApplier = topApplier;
        this.medianDaysToFirstAck = medianDaysToFirstAck;
        this.medianDaysToFirstNak = medianDaysToFirstNak;
        this.medianDaysToApplied = medianDaysToApplied;
    }

    /**
     * A sender and how often it appeared; serialized as a two element array.
     */
    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"sender", "count"})
    public static class SenderCount {
        static final SenderCount NONE = new SenderCount("", 0);

        @JsonProperty
        private final String sender;
        @JsonProperty
        private final long count;

        SenderCount(String sender, long count) {
            this.sender = sender;
            this.count = count;
        }

        public String getSender() {
            return sender;
        }

        public long getCount() {
            return count;
        }
    }

    /**
     * Generate statistics for the given patch sets.
     *
     * @param patchSets Patch sets to summarize
     * @param now Reference time for ages
     * @return Statistics, or null if no patch set has an epoch patch
     */
    public static PatchStats generate(List<PatchSet> patchSets, OffsetDateTime now) {
        // Most stats require an epoch patch so filter this once
        List<PatchSet> valid = patchSets.stream()
                .filter(p -> p.getEpochPatch() != null)
                .collect(Collectors.toList());
        if (valid.isEmpty()) {
            return null;
        }

        List<Long> ages = new ArrayList<>();
        List<Long> sizes = new ArrayList<>();
        List<Long> daysToFirstAck = new ArrayList<>();
        List<Long> daysToFirstNak = new ArrayList<>();
        List<Long> daysToApplied = new ArrayList<>();
        int applied = 0;

        for (PatchSet p : valid) {
            OffsetDateTime start = p.getEpochPatch().getTimestamp();
            ages.add(Duration.between(start, now).toDays());
            sizes.add((long) p.getPatches().size());
            addDaysToFirst(p.getAcks(), start, daysToFirstAck);
            addDaysToFirst(p.getNaks(), start, daysToFirstNak);
            if (addDaysToFirst(p.getApplieds(), start, daysToApplied)) {
                applied++;
            }
        }

        return new PatchStats(
                valid.size(),
                applied,
                median(ages),
                median(sizes),
                mostCommon(valid, p -> Collections.singletonList(p.getEpochPatch())),
                mostCommon(valid, PatchSet::getAcks),
                mostCommon(valid, PatchSet::getNaks),
                mostCommon(valid, PatchSet::getApplieds),
                median(daysToFirstAck),
                median(daysToFirstNak),
                median(daysToApplied));
    }

    private static boolean addDaysToFirst(List<Message> replies, OffsetDateTime start, List<Long> days) {
        if (replies.isEmpty()) {
            return false;
        }
        days.add(Duration.between(start, replies.get(0).getTimestamp()).toDays());
        return true;
    }

    /**
     * Median of the values; 0 for an empty list, the mean of the middle pair for even sizes.
     */
    static double median(List<Long> values) {
        if (values.isEmpty()) {
            return 0;
        }
        List<Long> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid);
        }
        return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }

    /**
     * Most frequent sender among the selected messages, first seen wins a tie.
     */
    static SenderCount mostCommon(List<PatchSet> patchSets, Function<PatchSet, List<Message>> selector) {
        Map<String, Long> counts = patchSets.stream()
                .flatMap(p -> selector.apply(p).stream())
                .collect(Collectors.groupingBy(Message::getSender, LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(e -> new SenderCount(e.getKey(), e.getValue()))
                .orElse(SenderCount.NONE);
    }

    /**
     * Render as indented JSON.
     *
     * @return JSON text
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render stats", e);
        }
    }

    public int getTotalPatches() {
        return totalPatches;
    }

    public int getTotalApplied() {
        return totalApplied;
    }

    public double getMedianAgeDays() {
        return medianAgeDays;
    }

    public double getMedianPatchesInPatch() {
        return medianPatchesInPatch;
    }

    public SenderCount getTopSubmitter() {
        return topSubmitter;
    }

    public SenderCount getTopAcker() {
        return topAcker;
    }

    public SenderCount getTopNaker() {
        return topNaker;
    }

    public SenderCount getTopApplier() {
        return topApplier;
    }

    public double getMedianDaysToFirstAck() {
        return medianDaysToFirstAck;
    }

    public double getMedianDaysToFirstNak() {
        return medianDaysToFirstNak;
    }

    public double getMedianDaysToApplied() {
        return medianDaysToApplied;
    }
}
