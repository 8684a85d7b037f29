package org.kteam.mlcheck;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MailArchiveTest {
    private static final String JUNE = "https://lists.ubuntu.com/archives/kernel-team/2024-June.txt.gz";
    private static final String MAY = "https://lists.ubuntu.com/archives/kernel-team/2024-May.txt.gz";

    @TempDir
    Path cacheDir;

    private final Map<String, byte[]> archives = new HashMap<>();
    private final List<String> requests = new ArrayList<>();

    private MailArchive archive() throws IOException {
        return new MailArchive(cacheDir, url -> {
            requests.add(url);
            return archives.get(url);
        }, new SimpleClassifier());
    }

    private static OffsetDateTime date(int year, int month, int day) {
        return OffsetDateTime.of(year, month, day, 12, 0, 0, 0, ZoneOffset.UTC);
    }

    @Test
    void constructor_shouldCreateCacheDirectory() throws IOException {
        Path nested = cacheDir.resolve("a/b");
        MailArchive archive = new MailArchive(nested, url -> null, new SimpleClassifier());

        assertTrue(Files.isDirectory(nested));
        assertEquals(nested, archive.getCacheDirectory());
        assertEquals(nested.resolve("2024-06.mail_cache"), archive.getCacheFile(YearMonth.of(2024, 6)));
    }

    @Test
    void monthlySteps_shouldIncludeBothEnds() {
        assertEquals(Arrays.asList(YearMonth.of(2023, 11), YearMonth.of(2023, 12), YearMonth.of(2024, 1)),
                MailArchive.monthlySteps(date(2023, 11, 30), date(2024, 1, 2)));
        assertEquals(Arrays.asList(YearMonth.of(2024, 6)),
                MailArchive.monthlySteps(date(2024, 6, 1), date(2024, 6, 30)));
        assertTrue(MailArchive.monthlySteps(date(2024, 7, 1), date(2024, 6, 30)).isEmpty());
    }

    @Test
    void fetchMail_shouldDecompressIntoCache() throws IOException {
        archives.put(JUNE, Fixtures.gzip(Fixtures.mbox("single_ack.mbox")));
        MailArchive archive = archive();

        archive.fetchMail(date(2024, 6, 1), date(2024, 6, 20), false);

        Path cached = cacheDir.resolve("2024-06.mail_cache");
        assertTrue(Files.exists(cached));
        assertArrayEquals(Files.readAllBytes(Fixtures.mbox("single_ack.mbox")), Files.readAllBytes(cached));
        assertEquals(Arrays.asList(JUNE), requests);
    }

    @Test
    void fetchMail_shouldSkipCachedPastMonths() throws IOException {
        archives.put(MAY, Fixtures.gzip(Fixtures.mbox("applied.mbox")));
        archives.put(JUNE, Fixtures.gzip(Fixtures.mbox("single_ack.mbox")));
        MailArchive archive = archive();

        archive.fetchMail(date(2024, 5, 20), date(2024, 6, 3), false);
        archive.fetchMail(date(2024, 5, 20), date(2024, 6, 3), false);

        // The active month is always downloaded again
        assertEquals(Arrays.asList(MAY, JUNE, JUNE), requests);
    }

    @Test
    void fetchMail_shouldSkipMissingArchive() throws IOException {
        archives.put(JUNE, Fixtures.gzip(Fixtures.mbox("single_ack.mbox")));
        MailArchive archive = archive();

        archive.fetchMail(date(2024, 5, 20), date(2024, 6, 3), false);

        assertFalse(Files.exists(archive.getCacheFile(YearMonth.of(2024, 5))));
        assertTrue(Files.exists(archive.getCacheFile(YearMonth.of(2024, 6))));
    }

    @Test
    void fetchMail_shouldPropagateFetchErrors() throws IOException {
        MailArchive archive = new MailArchive(cacheDir, url -> {
            throw new IOException("HTTP 500 for " + url);
        }, new SimpleClassifier());

        assertThrows(IOException.class, () -> archive.fetchMail(date(2024, 6, 1), date(2024, 6, 3), false));
    }

    @Test
    void fetchMail_shouldLeaveNoPartialFileOnCorruptArchive() throws IOException {
        Path cached = cacheDir.resolve("2024-06.mail_cache");
        Files.write(cached, "earlier copy\n".getBytes(StandardCharsets.UTF_8));
        byte[] compressed = Fixtures.gzip(Fixtures.mbox("single_ack.mbox"));
        archives.put(JUNE, Arrays.copyOf(compressed, compressed.length / 2));
        MailArchive archive = archive();

        assertThrows(IOException.class, () -> archive.fetchMail(date(2024, 6, 1), date(2024, 6, 3), false));

        assertFalse(Files.exists(cacheDir.resolve("2024-06.mail_cache.tmp")));
        assertEquals("earlier copy\n", new String(Files.readAllBytes(cached), StandardCharsets.UTF_8));
    }

    @Test
    void clearCache_shouldOnlyRemoveCacheFiles() throws IOException {
        Files.writeString(cacheDir.resolve("2024-05.mail_cache"), "old");
        Files.writeString(cacheDir.resolve("notes.txt"), "keep");
        MailArchive archive = archive();

        archive.clearCache();

        assertFalse(Files.exists(cacheDir.resolve("2024-05.mail_cache")));
        assertTrue(Files.exists(cacheDir.resolve("notes.txt")));
    }

    @Test
    void fetchMail_shouldRefetchAfterClearingCache() throws IOException {
        archives.put(MAY, Fixtures.gzip(Fixtures.mbox("applied.mbox")));
        MailArchive archive = archive();

        archive.fetchMail(date(2024, 5, 1), date(2024, 6, 3), false);
        archive.fetchMail(date(2024, 5, 1), date(2024, 6, 3), true);

        assertEquals(2, requests.stream().filter(MAY::equals).count());
    }

    @Test
    void allThreads_shouldReadWindowMonths() throws IOException {
        Files.copy(Fixtures.mbox("applied.mbox"), cacheDir.resolve("2024-06.mail_cache"));
        Files.copy(Fixtures.mbox("not_a_patch.mbox"), cacheDir.resolve("2024-04.mail_cache"));
        MailArchive archive = archive();

        List<List<Message>> threads = archive.allThreads(date(2024, 5, 20), date(2024, 6, 20));

        assertEquals(1, threads.size());
        assertEquals(4, threads.get(0).size());
    }

    @Test
    void filterPatches_shouldReturnMatchingSetsInEpochOrder() throws IOException {
        String june = new String(Files.readAllBytes(Fixtures.mbox("single_ack.mbox")))
                + new String(Files.readAllBytes(Fixtures.mbox("applied.mbox")))
                + new String(Files.readAllBytes(Fixtures.mbox("single_nak.mbox")))
                + new String(Files.readAllBytes(Fixtures.mbox("not_a_patch.mbox")));
        Files.writeString(cacheDir.resolve("2024-06.mail_cache"), june);
        MailArchive archive = archive();

        List<PatchSet> all = archive.filterPatches(new PatchFilter(FilterMode.ALL, 2),
                date(2024, 6, 1), date(2024, 6, 20));
        List<PatchSet> needsAcks = archive.filterPatches(new PatchFilter(FilterMode.NEEDS_ACKS, 2),
                date(2024, 6, 1), date(2024, 6, 20));

        assertEquals(3, all.size());
        assertEquals("<1717408800-1001-1-git-send-email-jdoe@example.com>", all.get(0).getEpochPatch().getMessageId());
        assertEquals("<1717426800-3000-1-git-send-email-jdoe@example.com>", all.get(1).getEpochPatch().getMessageId());
        assertEquals("<1717581600-2000-0-git-send-email-jdoe@example.com>", all.get(2).getEpochPatch().getMessageId());
        assertEquals(1, needsAcks.size());
        assertEquals(1, needsAcks.get(0).getAcks().size());
    }
}
