package org.kteam.mlcheck;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Runs the external patch style checker over every patch file of a patch set directory and
 * collects its output in check-patch.txt.
 */
public class CheckpatchRunner {
    private static final Logger logger = LoggerFactory.getLogger(CheckpatchRunner.class);

    private static final Pattern ANSI_COLOR = Pattern.compile("\033\\[\\d+m");

    static final String RESULTS_FILE = "check-patch.txt";

    private final String checkpatch;

    /**
     * @param checkpatch Path to the checker executable; a leading "~" expands to the home directory
     */
    public CheckpatchRunner(String checkpatch) {
        this.checkpatch = expandHome(checkpatch);
    }

    /**
     * Check every *.patch file in the directory, in name order.
     *
     * @param patchDir Patch set directory
     * @return The results file
     * @throws IOException if the checker cannot be started or the results cannot be written
     */
    public File analyze(File patchDir) throws IOException {
        File[] patches = patchDir.listFiles((dir, name) -> name.endsWith(".patch"));
        if (patches == null) {
            throw new IOException("not a directory: " + patchDir);
        }
        Arrays.sort(patches);

        List<String> results = new ArrayList<>();
        for (File patch : patches) {
            logger.debug("checking {}", patch);
            results.add(run(patch));
        }

        File resultsFile = new File(patchDir, RESULTS_FILE);
        FileUtil.dumpUtf8ToFile(results, "", resultsFile);
        return resultsFile;
    }

    private String run(File patch) throws IOException {
        Process process = new ProcessBuilder(checkpatch, patch.getPath()).start();
        try {
            // Drain stderr in the background so a chatty checker cannot block on a full pipe.
            StreamCollector err = new StreamCollector(process);
            err.start();
            String out = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            process.waitFor();
            err.join();
            return cleanString(err.getOutput()) + cleanString(out);
        } catch (InterruptedException e) {
            process.destroy();
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while checking " + patch, e);
        }
    }

    /**
     * Removes ANSI color escape codes.
     */
    static String cleanString(String s) {
        return ANSI_COLOR.matcher(s).replaceAll("");
    }

    static String expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }

    private static class StreamCollector extends Thread {
        private final Process process;
        private String output = "";
        private IOException error;

        private StreamCollector(Process process) {
            this.process = process;
            setDaemon(true);
        }

        @Override
        public void run() {
            try {
                output = new String(process.getErrorStream().readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                error = e;
            }
        }

        private String getOutput() throws IOException {
            if (error != null) {
                throw error;
            }
            return output;
        }
    }
}
