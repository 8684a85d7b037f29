package org.kteam.mlcheck;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Local cache of the list's monthly archives.
 *
 * Each month is downloaded once as a gzip text archive and stored decompressed.  Past months do
 * not change, so a cached past month is never downloaded again; the current month is still
 * receiving mail and is refreshed on every fetch.  The archive server does not regenerate the
 * monthly file immediately, so a review sent a few minutes ago may not show up yet.
 */
public class MailArchive {
    private static final Logger logger = LoggerFactory.getLogger(MailArchive.class);

    private final Path cacheDirectory;
    private final MailFetcher fetcher;
    private final MessageClassifier classifier;

    /**
     * Create an archive backed by the given cache directory, creating it if necessary.
     *
     * @param cacheDirectory Directory holding the monthly cache files
     * @param fetcher Source of monthly archives
     * @param classifier Classifier for messages read from the cache
     * @throws IOException if the cache directory cannot be created
     */
    public MailArchive(Path cacheDirectory, MailFetcher fetcher, MessageClassifier classifier) throws IOException {
        this.cacheDirectory = cacheDirectory;
        this.fetcher = fetcher;
        this.classifier = classifier;
        Files.createDirectories(cacheDirectory);
    }

    /**
     * Returns every month from the start month to the end month, inclusive.
     *
     * @param start Inclusive starting point
     * @param end Inclusive ending point
     * @return Months in chronological order, empty if end precedes start
     */
    public static List<YearMonth> monthlySteps(OffsetDateTime start, OffsetDateTime end) {
        List<YearMonth> steps = new ArrayList<>();
        YearMonth last = YearMonth.from(end);
        for (YearMonth month = YearMonth.from(start); !month.isAfter(last); month = month.plusMonths(1)) {
            steps.add(month);
        }
        return steps;
    }

    /**
     * Deletes every cached month.
     *
     * @throws IOException if a cache file cannot be removed
     */
    public void clearCache() throws IOException {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(cacheDirectory, "*" + MlCheckConfig.CACHE_SUFFIX)) {
            for (Path file : files) {
                Files.delete(file);
            }
        }
    }

    /**
     * Download the monthly archives covering the given window.
     *
     * @param since Start of the window
     * @param now End of the window; its month is treated as the active month
     * @param clearCache True to remove all cached mail first
     * @throws IOException if a download fails or the cache cannot be written
     */
    public void fetchMail(OffsetDateTime since, OffsetDateTime now, boolean clearCache) throws IOException {
        if (clearCache) {
            clearCache();
        }

        YearMonth active = YearMonth.from(now);
        for (YearMonth month : monthlySteps(since, now)) {
            Path cacheFile = getCacheFile(month);

            // Bygone months should not have any changes
            if (Files.exists(cacheFile) && month.isBefore(active)) {
                logger.debug("skipping {}", month);
                continue;
            }

            logger.info("downloading {}...", month);
            byte[] compressed = fetcher.fetch(MlCheckConfig.getMonthlyUrl(month.getYear(), month.getMonthValue()));
            if (compressed == null) {
                logger.warn("no archive for {}", month);
                continue;
            }

            Path temp = cacheFile.resolveSibling(cacheFile.getFileName() + ".tmp");
            try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
                Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
                Files.move(temp, cacheFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                // A previous copy of the month, if any, stays in place
                Files.deleteIfExists(temp);
                throw new IOException("failed to unpack archive for " + month, e);
            }
        }
    }

    /**
     * Returns all cached messages of the window in thread form.
     *
     * @param since Start of the window
     * @param now End of the window
     * @return Threads, each in chronological order
     * @throws IOException if a cache file cannot be read
     */
    public List<List<Message>> allThreads(OffsetDateTime since, OffsetDateTime now) throws IOException {
        // Archives are not associative, so build our own message id mapping before threading.
        ThreadCollator collator = new ThreadCollator();
        for (YearMonth month : monthlySteps(since, now)) {
            Path cacheFile = getCacheFile(month);
            if (!Files.exists(cacheFile)) {
                continue;
            }
            readMessages(cacheFile, classifier).forEach(collator::add);
        }
        logger.debug("threading {} messages", collator.size());
        return collator.getThreads();
    }

    /**
     * Returns the patch sets of the window accepted by the filter, in epoch order.
     *
     * @param filter Patch set filter
     * @param since Start of the window
     * @param now End of the window
     * @return Accepted patch sets
     * @throws IOException if a cache file cannot be read
     */
    public List<PatchSet> filterPatches(PatchFilter filter, OffsetDateTime since, OffsetDateTime now)
            throws IOException {
        List<PatchSet> patchSets = new ArrayList<>();
        for (List<Message> thread : allThreads(since, now)) {
            PatchSet patchSet = new PatchSet(thread, classifier);
            if (filter.matches(patchSet)) {
                patchSets.add(patchSet);
            }
        }
        Collections.sort(patchSets);
        return patchSets;
    }

    /**
     * Helper for reading the messages of one mbox file.  Malformed messages are skipped.
     *
     * @param mboxPath mbox file
     * @param classifier Classifier for the initial category
     * @return Parsed messages
     * @throws IOException if the file cannot be read
     */
    public static List<Message> readMessages(Path mboxPath, MessageClassifier classifier) throws IOException {
        try (MboxParser parser = new MboxParser(Files.newInputStream(mboxPath), classifier)) {
            return parser.parseMessages();
        }
    }

    public Path getCacheFile(YearMonth month) {
        return cacheDirectory.resolve(MlCheckConfig.getMonthlyCacheName(month.getYear(), month.getMonthValue()));
    }

    public Path getCacheDirectory() {
        return cacheDirectory;
    }
}
