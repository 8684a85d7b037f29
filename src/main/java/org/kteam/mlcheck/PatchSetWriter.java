package org.kteam.mlcheck;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes patch sets to disk as patch files, one directory per patch set:
 *
 * <pre>
 * &lt;epoch patch name&gt;/cover_letter
 * &lt;epoch patch name&gt;/&lt;patch name&gt;.patch   (one per patch)
 * &lt;epoch patch name&gt;/series                 (patch files, one per line)
 * &lt;epoch patch name&gt;/summary.txt            (reply stats)
 * </pre>
 */
public class PatchSetWriter {
    private final FileUtil fileUtil;

    public PatchSetWriter(FileUtil fileUtil) {
        this.fileUtil = fileUtil;
    }

    /**
     * Write a patch set below the output directory.
     *
     * @param patchSet Patch set with an epoch patch
     * @param now Reference time for the age reported in the summary
     * @return Directory holding the patch set
     * @throws IOException if a file cannot be written
     * @throws IllegalArgumentException if the patch set has no epoch patch
     */
    public File write(PatchSet patchSet, OffsetDateTime now) throws IOException {
        Message epoch = patchSet.getEpochPatch();
        if (epoch == null) {
            throw new IllegalArgumentException("patch set has no epoch patch: " + patchSet);
        }

        File patchDir = fileUtil.getOutputFile(epoch.generatePatchName());
        if (!patchDir.mkdirs() && !patchDir.isDirectory()) {
            throw new IOException("could not create patch directory " + patchDir);
        }

        FileUtil.dumpUtf8ToFile(epoch.generatePatch(), new File(patchDir, "cover_letter"));

        List<String> series = new ArrayList<>();
        for (Message patch : patchSet.getPatches()) {
            File patchFile = new File(patchDir, patch.generatePatchName() + ".patch");
            FileUtil.dumpUtf8ToFile(patch.generatePatch(), patchFile);
            series.add(patchFile.getPath() + "\n");
        }
        FileUtil.dumpUtf8ToFile(series, "", new File(patchDir, "series"));

        FileUtil.dumpUtf8ToFile(getSummary(patchSet, now), new File(patchDir, "summary.txt"));
        return patchDir;
    }

    /**
     * Summary of the patch set and its replies.
     *
     * @param patchSet Patch set with an epoch patch
     * @param now Reference time for the age
     * @return Multi-line summary, newline terminated
     */
    static String getSummary(PatchSet patchSet, OffsetDateTime now) {
        Message epoch = patchSet.getEpochPatch();
        long ageDays = Duration.between(epoch.getTimestamp(), now).toDays();
        return new StringBuilder()
                .append(epoch.getSubject()).append('\n')
                .append("rfc822msgid: ").append(epoch.getMessageId()).append('\n')
                .append("owner: ").append(epoch.getSender()).append('\n')
                .append("link: ").append(epoch.getThreadUrl()).append('\n')
                .append("age: ").append(ageDays).append(" days\n")
                .append("size: ").append(patchSet.getPatches().size()).append(" patches\n")
                .append("acks: ").append(patchSet.countOf(Category.PATCH_ACK)).append('\n')
                .append("naks: ").append(patchSet.countOf(Category.PATCH_NAK)).append('\n')
                .append("applied: ").append(patchSet.countOf(Category.PATCH_APPLIED) > 0).append('\n')
                .toString();
    }
}
