package com.figsearchharness;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ScratchDirectoryTest {

    @TempDir
    Path tempDir;

    private static long count(Path dir) throws IOException {
        try (Stream<Path> s = Files.list(dir)) {
            return s.count();
        }
    }

    @Test
    public void createsMissingDirectory() throws IOException {
        Path dir = tempDir.resolve("pics");
        ScratchDirectory sd = ScratchDirectory.prepare(dir, new Random(1));
        assertTrue(Files.isDirectory(dir));
        assertEquals(dir, sd.path());
    }

    @Test
    public void removesRegularFiles() throws IOException {
        Files.writeString(tempDir.resolve("bmp_1"), "1 1\n1\n");
        Files.writeString(tempDir.resolve("bmp_2"), "old");
        ScratchDirectory.prepare(tempDir, new Random(1));
        assertEquals(0, count(tempDir));
    }

    @Test
    public void nonRegularEntryIsFatalAndNothingIsDeleted() throws IOException {
        Files.writeString(tempDir.resolve("bmp_1"), "keep");
        Files.createDirectory(tempDir.resolve("nested"));
        assertThrows(PreconditionViolationException.class, () -> ScratchDirectory.prepare(tempDir, new Random(1)));
        assertTrue(Files.exists(tempDir.resolve("bmp_1")));
    }

    @Test
    public void scratchPathThatIsAFileIsFatal() throws IOException {
        Path file = Files.writeString(tempDir.resolve("plain"), "x");
        assertThrows(PreconditionViolationException.class, () -> ScratchDirectory.prepare(file, new Random(1)));
    }

    @Test
    public void newFileNamesAreFreshAndUnique() throws IOException {
        ScratchDirectory sd = ScratchDirectory.prepare(tempDir, new Random(3));
        Set<Path> seen = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            Path p = sd.newFile("hline");
            assertTrue(p.getFileName().toString().startsWith("hline_"));
            assertFalse(Files.exists(p));
            assertTrue(seen.add(p), "duplicate " + p);
            Files.writeString(p, "");
        }
    }

    @Test
    public void namesStayFreshWhenTheRandomSuffixRepeats() throws IOException {
        Random constant = new Random() {
            @Override public int nextInt(int bound) { return 0; }
        };
        ScratchDirectory sd = ScratchDirectory.prepare(tempDir, constant);
        Set<Path> seen = new HashSet<>();
        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
            for (int i = 0; i < 500; i++) {
                Path p = sd.newFile("test");
                assertTrue(seen.add(p), "duplicate " + p);
                Files.writeString(p, "");
            }
        });
        assertEquals(500, count(tempDir));
    }
}
