package asdl.gen;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import asdl.Logging;

import com.google.common.collect.Sets;

/**
 * Writes generated sources into one output folder. Files whose content
 * did not change are left untouched, so timestamps only move when the
 * schema does.
 */
public class FileGenerator {
    /** First line of every generated file. */
    public static final String GENERATED_MARKER = "// Generated by asdl-gen";

    private static final Logger logger = Logging.getLogger();

    private final File outputFolder;
    private final Set<File> writtenFiles = Sets.newLinkedHashSet();
    private int changed = 0;

    public FileGenerator(File outputFolder) {
        this.outputFolder = outputFolder;
    }

    public void createFile(String fileName, StringBuilder sb) {
        File file = new File(outputFolder, fileName);
        writtenFiles.add(file);
        byte[] content = sb.toString().getBytes(StandardCharsets.UTF_8);
        try {
            Files.createDirectories(outputFolder.toPath());
            if (file.isFile() && Arrays.equals(Files.readAllBytes(file.toPath()), content)) {
                logger.debug("unchanged " + file);
                return;
            }
            Files.write(file.toPath(), content);
            changed++;
            logger.debug("wrote " + file);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + file, e);
        }
    }

    /**
     * Deletes generated files in the output folder that were not written
     * in this run, e.g. the classes of a removed constructor.
     */
    public void removeOldFiles() {
        File[] files = outputFolder.listFiles();
        if (files == null) {
            return;
        }
        for (File f : files) {
            if (!f.isFile() || !f.getName().endsWith(".java") || writtenFiles.contains(f)) {
                continue;
            }
            try {
                List<String> lines = Files.readAllLines(f.toPath(), StandardCharsets.UTF_8);
                if (!lines.isEmpty() && lines.get(0).startsWith(GENERATED_MARKER)) {
                    Files.delete(f.toPath());
                    logger.info("removed stale generated file " + f);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Could not remove " + f, e);
            }
        }
    }

    public File getOutputFolder() {
        return outputFolder;
    }

    public Set<File> getWrittenFiles() {
        return writtenFiles;
    }

    /** Number of files whose content changed in this run. */
    public int getChangedCount() {
        return changed;
    }
}
