package org.kteam.mlcheck;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collections;
import java.util.List;

public class FileUtil {
    private final File outputDirectory;

    /**
     * Create a FileUtil instance writing below the given directory.
     *
     * @param outputDirectory Directory in which to place output files
     */
    public FileUtil(File outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    /**
     * Generate a file object in the program's output directory.
     *
     * @param name Name of the file, may include subdirectories
     * @return a File object for the output file.
     */
    public File getOutputFile(String name) {
        return new File(outputDirectory, name);
    }

    public File getOutputDirectory() {
        return outputDirectory;
    }

    /**
     * Delete the output directory with everything in it, then create it empty.
     *
     * @throws IOException if the directory cannot be removed or created
     */
    public void recreateOutputDirectory() throws IOException {
        Path root = outputDirectory.toPath();
        if (Files.exists(root)) {
            Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException e) throws IOException {
                    if (e != null) {
                        throw e;
                    }
                    Files.delete(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        }
        Files.createDirectories(root);
    }

    /**
     * Dump UTF-8 records to the given file using the specified delimiter (or newline if null).
     *
     * @param records List of String to write to file
     * @param delimiter Delimiter between records
     * @param file Output file
     * @throws IOException
     */
    public static void dumpUtf8ToFile(List<String> records, String delimiter, File file) throws IOException {
        byte[] delimiterBytes = (delimiter != null ? delimiter : "\n").getBytes(StandardCharsets.UTF_8);
        byte[] d = new byte[]{};

        try (FileOutputStream output = new FileOutputStream(file)) {
            for (String line : records) {
                output.write(d);  // Write nothing on the first iteration
                d = delimiterBytes;
                output.write(line.getBytes(StandardCharsets.UTF_8));
            }
        }
    }

    /**
     * Dump a UTF-8 string to the given file.
     *
     * @param str String to write
     * @param file Output file
     * @throws IOException
     */
    public static void dumpUtf8ToFile(String str, File file) throws IOException {
        dumpUtf8ToFile(Collections.singletonList(str), "", file);
    }
}
