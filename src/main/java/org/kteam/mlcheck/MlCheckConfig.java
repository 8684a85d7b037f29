package org.kteam.mlcheck;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Fixed locations and defaults used by the checker.
 */
public final class MlCheckConfig {
    // ACLs prevent direct access to the mbox file on the archive server, but the monthly text
    // archive parses as an mbox just fine.
    public static final String MONTHLY_URL = "https://lists.ubuntu.com/archives/kernel-team/%d-%s.txt.gz";

    // Individual messages are linked through a counter that is not part of the archive data, so
    // the best we can do is the thread view of the month.
    public static final String THREAD_URL = "https://lists.ubuntu.com/archives/kernel-team/%d-%s/thread.html";

    // Sorts like ISO 8601
    public static final String MONTHLY_CACHE = "%04d-%02d.mail_cache";
    public static final String CACHE_SUFFIX = ".mail_cache";

    public static final String CACHE_DIR_ENV = "ML_CHECK_CACHE_DIR";
    public static final String CHECKPATCH_ENV = "ML_UBUNTU_CHECKPATCH";
    public static final String DEFAULT_CACHE_DIRECTORY = ".cache/ml-check";

    public static final int DEFAULT_DAYS_BACK = 14;
    public static final int DEFAULT_REQUIRED_ACKS = 2;

    private MlCheckConfig() {
    }

    /**
     * Resolve the cache directory, preferring the {@value #CACHE_DIR_ENV} environment variable.
     *
     * @return Cache directory path (not necessarily existing)
     */
    public static Path getCacheDirectory() {
        String override = System.getenv(CACHE_DIR_ENV);
        if (override != null && !override.isBlank()) {
            return Paths.get(override);
        }
        return Paths.get(System.getProperty("user.home"), DEFAULT_CACHE_DIRECTORY);
    }

    public static String getMonthlyUrl(int year, int month) {
        return String.format(MONTHLY_URL, year, monthName(month));
    }

    public static String getThreadUrl(int year, int month) {
        return String.format(THREAD_URL, year, monthName(month));
    }

    public static String getMonthlyCacheName(int year, int month) {
        return String.format(MONTHLY_CACHE, year, month);
    }

    private static String monthName(int month) {
        return Month.of(month).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }
}
