package io.github.yok.eeg.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.eeg.core.geometry.FieldVector;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FieldVectorReaderTest {

    @TempDir
    Path dir;

    @Test
    void readsRowsSkippingBlankAndCommentLines() throws Exception {
        Path file = write("electrodes.txt", "# x y z\n", "0.0 0.0 0.092\n", "\n",
                "  0.092\t0.0  0.0  \n", "# trailing comment\n");

        List<FieldVector> out = FieldVectorReader.read(file, 3);

        assertEquals(List.of(FieldVector.of(0.0, 0.0, 0.092), FieldVector.of(0.092, 0.0, 0.0)),
                out);
    }

    @Test
    void emptyFileGivesEmptyList() throws Exception {
        assertTrue(FieldVectorReader.read(write("empty.txt", "# nothing\n"), 3).isEmpty());
    }

    @Test
    void wrongColumnCountNamesFileAndLine() throws Exception {
        Path file = write("bad.txt", "0 0 1\n", "0 1\n");

        IllegalArgumentException e =
                assertThrows(IllegalArgumentException.class, () -> FieldVectorReader.read(file, 3));
        assertTrue(e.getMessage().contains("bad.txt:2"), e.getMessage());
    }

    @Test
    void malformedOrNonFiniteNumberIsRejected() throws Exception {
        Path letters = write("letters.txt", "0 abc 1\n");
        Path nan = write("nan.txt", "0 NaN 1\n");

        assertThrows(IllegalArgumentException.class, () -> FieldVectorReader.read(letters, 3));
        assertThrows(IllegalArgumentException.class, () -> FieldVectorReader.read(nan, 3));
    }

    @Test
    void missingFileIsAnIoFailure() {
        assertThrows(UncheckedIOException.class,
                () -> FieldVectorReader.read(dir.resolve("missing.txt"), 3));
    }

    private Path write(String name, String... lines) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, String.join("", lines), StandardCharsets.UTF_8);
        return file;
    }
}
