package org.kteam.mlcheck;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatchStatsTest {
    private final List<PatchSet> patchSets = Arrays.asList(
            Fixtures.patchSet("applied.mbox"),
            Fixtures.patchSet("single_nak.mbox"),
            Fixtures.patchSet("single_ack.mbox"));

    @Test
    void generate_shouldSummarizeReviewActivity() {
        PatchStats stats = PatchStats.generate(patchSets, Fixtures.at(19, 10));

        assertNotNull(stats);
        assertEquals(3, stats.getTotalPatches());
        assertEquals(1, stats.getTotalApplied());
        assertEquals(15.0, stats.getMedianAgeDays());
        assertEquals(1.0, stats.getMedianPatchesInPatch());
        assertEquals("Jane Doe <jdoe@example.com>", stats.getTopSubmitter().getSender());
        assertEquals(3, stats.getTopSubmitter().getCount());
        assertEquals("Richard Roe <rroe@example.com>", stats.getTopAcker().getSender());
        assertEquals(2, stats.getTopAcker().getCount());
        assertEquals("Mary Major <mmaj@example.com>", stats.getTopNaker().getSender());
        assertEquals("Richard Roe <rroe@example.com>", stats.getTopApplier().getSender());
        assertEquals(0.5, stats.getMedianDaysToFirstAck());
        assertEquals(0.0, stats.getMedianDaysToFirstNak());
        assertEquals(2.0, stats.getMedianDaysToApplied());
    }

    @Test
    void generate_shouldReturnNullWithoutEpochs() {
        assertNull(PatchStats.generate(Collections.singletonList(Fixtures.patchSet("not_a_patch.mbox")),
                Fixtures.at(19, 10)));
        assertNull(PatchStats.generate(Collections.emptyList(), Fixtures.at(19, 10)));
    }

    @Test
    void generate_shouldUseEmptySenderWhenNobodyReplied() {
        PatchStats stats = PatchStats.generate(
                Collections.singletonList(Fixtures.patchSet("no_cover_letter.mbox")), Fixtures.at(19, 10));

        assertEquals("", stats.getTopNaker().getSender());
        assertEquals(0, stats.getTopNaker().getCount());
        assertEquals(0.0, stats.getMedianDaysToFirstNak());
        assertEquals(2.0, stats.getMedianPatchesInPatch());
    }

    @Test
    void median_shouldAverageMiddlePair() {
        assertEquals(0.0, PatchStats.median(Collections.emptyList()));
        assertEquals(3.0, PatchStats.median(Arrays.asList(5L, 1L, 3L)));
        assertEquals(2.5, PatchStats.median(Arrays.asList(4L, 1L, 3L, 2L)));
    }

    @Test
    void toJson_shouldUseSnakeCaseAndSenderPairs() throws Exception {
        String json = PatchStats.generate(patchSets, Fixtures.at(19, 10)).toJson();
        JsonNode node = new ObjectMapper().readTree(json);

        assertEquals(3, node.get("total_patches").asInt());
        assertEquals(1, node.get("total_applied").asInt());
        assertEquals(15.0, node.get("median_age_days").asDouble());
        assertTrue(node.get("top_acker").isArray());
        assertEquals("Richard Roe <rroe@example.com>", node.get("top_acker").get(0).asText());
        assertEquals(2, node.get("top_acker").get(1).asInt());
        assertEquals(11, node.size());
        assertEquals("total_patches", node.fieldNames().next());
    }
}
