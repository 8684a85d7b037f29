package org.kteam.mlcheck;

import ch.qos.logback.classic.Level;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.BooleanOptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Kernel team mailing list checker.
 *
 * Checks the public kernel-team mailing list for patches that have not been sufficiently
 * reviewed.  Messages are characterized on a best effort basis, so false positives and
 * negatives will happen.
 *
 * Each monthly archive is downloaded and cached; after the first run only the current month is
 * downloaded again.  Messages are threaded through their Message-ID, In-Reply-To and References
 * headers.  By default the last 14 days of patches are examined.  Since a patch always precedes
 * its replies, the window does not produce false positives on its own.
 */
public class MlCheck {
    private static final Logger logger = LoggerFactory.getLogger(MlCheck.class);

    static final String VERSION = "1.0";

    @Option(name = "-c", aliases = {"--ubuntu-checkpatch-path"},
            metaVar = "checkpatch",
            usage = "path to ubuntu-check-patch (default: $" + MlCheckConfig.CHECKPATCH_ENV + ")")
    private String checkpatchPath = System.getenv(MlCheckConfig.CHECKPATCH_ENV);

    @Option(name = "--clear-cache",
            handler = BooleanOptionHandler.class,
            usage = "clear the local mail cache")
    private boolean clearCache;

    @Option(name = "-d", aliases = {"--days-back"},
            metaVar = "days",
            usage = "how many days back to search")
    private int daysBack = MlCheckConfig.DEFAULT_DAYS_BACK;

    @Option(name = "-h", aliases = {"--help"},
            handler = BooleanOptionHandler.class,
            help = true)
    private boolean help;

    private final List<String> ignoredAckers = new ArrayList<>();
    @Option(name = "-i", aliases = {"--ignore-acker"},
            metaVar = "address",
            usage = "ignore patches with acks from this email address (needs-acks mode only, can be used multiple times)")
    private void addIgnoredAcker(String address) {
        ignoredAckers.add(address);
    }

    private FilterMode mode = FilterMode.NEEDS_ACKS;
    @Option(name = "--mode",
            metaVar = "mode",
            usage = "which patches to show: \"all\", \"needs-acks\", \"ready-to-apply\", \"applied\" or \"rejected\"")
    private void setMode(String mode) throws CmdLineException {
        try {
            this.mode = FilterMode.fromString(mode);
        } catch (IllegalArgumentException e) {
            throw new CmdLineException(null, e.getMessage(), e);
        }
    }

    @Option(name = "-p", aliases = {"--patch-output"},
            metaVar = "outputDirectory",
            usage = "dump patches to $COVER_LETTER_SUBJECT/$PATCH_SUBJECT.patch in this directory;"
                    + " anything existing in this location will be deleted")
    private String patchOutput = "out";

    @Option(name = "--required-acks",
            metaVar = "count",
            usage = "override the required ACK count")
    private int requiredAcks = MlCheckConfig.DEFAULT_REQUIRED_ACKS;

    @Option(name = "-s", aliases = {"--show-stats"},
            handler = BooleanOptionHandler.class,
            usage = "print stats to stdout")
    private boolean showStats;

    @Option(name = "-v", aliases = {"--verbose"},
            handler = BooleanOptionHandler.class,
            usage = "print more debug information")
    private boolean verbose;

    /**
     * Instantiate and run the checker:
     *  - parses arguments
     *  - runs {@link MlCheck#execute(MailArchive, OffsetDateTime, PrintStream)}
     *
     * @param args Arguments
     */
    public static void main(String[] args) {
        MlCheck mlCheck = new MlCheck();

        CmdLineParser parser = new CmdLineParser(mlCheck);
        parser.getProperties().withUsageWidth(80);
        try {
            parser.parseArgument(args);
        } catch (CmdLineException e) {
            System.err.println(e.getMessage());
            mlCheck.exitWithUsage(parser);
        }

        if (mlCheck.help) {
            mlCheck.exitWithUsage(parser);
        }

        int ret = 1;
        try {
            mlCheck.initialize();
            MailArchive archive = new MailArchive(MlCheckConfig.getCacheDirectory(), new HttpMailFetcher(),
                    new SimpleClassifier());
            ret = mlCheck.execute(archive, OffsetDateTime.now(ZoneOffset.UTC), System.out);
        } catch (Exception e) {
            logger.error("ml-check failed", e);
        }
        System.exit(ret);
    }

    private void exitWithUsage(CmdLineParser parser) {
        System.out.format("Kernel Team mailing-list checker v%s\n\nUsage: ml-check [options]\n\nOptions:", VERSION);
        parser.printSingleLineUsage(System.err);
        System.out.println("\n");
        parser.printUsage(System.err);
        System.out.println("\nChecks for patches requiring review on the public kernel mailing list");
        System.exit(1);
    }

    /**
     * Initialize the application after arguments have been parsed.
     */
    void initialize() {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
        }
        logger.debug("{}", this);
    }

    /**
     * Fetch mail, select patch sets and report them.
     *
     * @param archive Mail archive to read from
     * @param now Current time; the search window ends here
     * @param out Destination for the report
     * @return Exit status
     * @throws IOException on fetch or output failure
     */
    int execute(MailArchive archive, OffsetDateTime now, PrintStream out) throws IOException {
        OffsetDateTime since = now.minusDays(daysBack);
        PatchFilter patchFilter = new PatchFilter(mode, requiredAcks, ignoredAckers, since);

        archive.fetchMail(since, now, clearCache);
        List<PatchSet> patchSets = archive.filterPatches(patchFilter, since, now);

        if (patchOutput != null && !patchOutput.isEmpty()) {
            writePatchSets(patchSets, now);
        }

        for (PatchSet patchSet : patchSets) {
            out.println(patchSet.getEpochPatch().getShortSummary());
        }

        if (showStats) {
            PatchStats stats = PatchStats.generate(patchSets, now);
            if (stats != null) {
                out.println(stats.toJson());
            }
        }
        return 0;
    }

    private void writePatchSets(List<PatchSet> patchSets, OffsetDateTime now) throws IOException {
        File outputDirectory = new File(CheckpatchRunner.expandHome(patchOutput)).getAbsoluteFile();
        if (outputDirectory.isFile()) {
            throw new IOException("output directory " + outputDirectory + " is a file");
        }
        FileUtil fileUtil = new FileUtil(outputDirectory);
        fileUtil.recreateOutputDirectory();

        PatchSetWriter writer = new PatchSetWriter(fileUtil);
        CheckpatchRunner checker = checkpatchPath == null || checkpatchPath.isEmpty()
                ? null
                : new CheckpatchRunner(checkpatchPath);
        for (PatchSet patchSet : patchSets) {
            File patchDir = writer.write(patchSet, now);
            if (checker != null) {
                checker.analyze(patchDir);
            }
        }
        logger.info("wrote {} patch sets to {}", patchSets.size(), outputDirectory);
    }

    @Override
    public String toString() {
        return "MlCheck{daysBack=" + daysBack + ", clearCache=" + clearCache + ", patchOutput='" + patchOutput
                + "', mode=" + mode + ", requiredAcks=" + requiredAcks + ", showStats=" + showStats
                + ", checkpatchPath='" + checkpatchPath + "', ignoredAckers=" + ignoredAckers + '}';
    }
}
