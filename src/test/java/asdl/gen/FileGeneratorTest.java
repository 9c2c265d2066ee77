package asdl.gen;

import java.io.File;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class FileGeneratorTest {

    @TempDir
    Path tmp;

    private static StringBuilder content(String text) {
        return new StringBuilder(FileGenerator.GENERATED_MARKER + " from t.asdl. Do not edit.\n" + text);
    }

    @Test
    public void writesIntoTheOutputFolder() throws Exception {
        FileGenerator files = new FileGenerator(tmp.resolve("out/pkg").toFile());
        files.createFile("A.java", content("class A {}\n"));
        Path a = tmp.resolve("out/pkg/A.java");
        assertTrue(Files.isRegularFile(a));
        assertTrue(new String(Files.readAllBytes(a), StandardCharsets.UTF_8).endsWith("class A {}\n"));
        assertEquals(1, files.getChangedCount());
        assertEquals(1, files.getWrittenFiles().size());
    }

    @Test
    public void unchangedFilesAreNotRewritten() throws Exception {
        File out = tmp.toFile();
        new FileGenerator(out).createFile("A.java", content("class A {}\n"));
        File a = new File(out, "A.java");
        assertTrue(a.setLastModified(1000L));

        FileGenerator second = new FileGenerator(out);
        second.createFile("A.java", content("class A {}\n"));
        assertEquals(0, second.getChangedCount());
        assertEquals(1000L, a.lastModified());

        second.createFile("A.java", content("class A { int x; }\n"));
        assertEquals(1, second.getChangedCount());
    }

    @Test
    public void staleGeneratedFilesAreRemoved() throws Exception {
        File out = tmp.toFile();
        FileGenerator first = new FileGenerator(out);
        first.createFile("Keep.java", content("class Keep {}\n"));
        first.createFile("Old.java", content("class Old {}\n"));
        Files.write(tmp.resolve("Manual.java"), List.of("class Manual {}"), StandardCharsets.UTF_8);
        Files.write(tmp.resolve("notes.txt"), List.of(FileGenerator.GENERATED_MARKER), StandardCharsets.UTF_8);

        FileGenerator second = new FileGenerator(out);
        second.createFile("Keep.java", content("class Keep {}\n"));
        second.removeOldFiles();

        assertTrue(Files.exists(tmp.resolve("Keep.java")));
        assertFalse(Files.exists(tmp.resolve("Old.java")));
        assertTrue(Files.exists(tmp.resolve("Manual.java")));
        assertTrue(Files.exists(tmp.resolve("notes.txt")));
    }

    @Test
    public void removingFromAMissingFolderDoesNothing() {
        new FileGenerator(tmp.resolve("nothing").toFile()).removeOldFiles();
    }

    @Test
    public void writeErrorsAreUnchecked() throws Exception {
        Path blocker = tmp.resolve("blocker");
        Files.write(blocker, List.of("not a folder"), StandardCharsets.UTF_8);
        FileGenerator files = new FileGenerator(blocker.toFile());
        assertThrows(UncheckedIOException.class, () -> files.createFile("A.java", content("")));
    }
}
