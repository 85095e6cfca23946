package io.github.yok.eeg.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.eeg.core.geometry.Dipole;
import io.github.yok.eeg.core.geometry.FieldVector;
import io.github.yok.eeg.core.metric.ComparisonMetrics;
import io.github.yok.eeg.core.pipeline.ComparisonArtifacts;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvResultWriterTest {

    @TempDir
    Path dir;

    @Test
    void writesPotentialsAndMetrics() throws Exception {
        double[] analytical = {2.0, -2.0};
        double[] numerical = {1.0, -1.0};
        ComparisonArtifacts artifacts = new ComparisonArtifacts(
                new Dipole(FieldVector.of(0, 0, 0.05), FieldVector.of(0, 0, 1)),
                List.of(FieldVector.of(0, 0, 0.092), FieldVector.of(0, 0, -0.092)), analytical,
                numerical, ComparisonMetrics.compare(numerical, analytical), point -> 0.0,
                () -> (solution, file) -> {
                });

        new CsvResultWriter(dir.resolve("out").toString()).write(artifacts);

        List<CSVRecord> potentials = parse(dir.resolve("out/eeg_electrode_potentials.csv"));
        assertEquals(2, potentials.size());
        assertEquals("1", potentials.get(1).get("i"));
        assertEquals(-0.092, Double.parseDouble(potentials.get(1).get("z")));
        assertEquals(-2.0, Double.parseDouble(potentials.get(1).get("potential_analytical")));
        assertEquals(-1.0, Double.parseDouble(potentials.get(1).get("potential_numerical")));
        assertEquals(1.0, Double.parseDouble(potentials.get(1).get("difference")));

        Map<String, Double> metrics = new HashMap<>();
        for (CSVRecord r : parse(dir.resolve("out/eeg_metrics.csv"))) {
            metrics.put(r.get("key"), Double.parseDouble(r.get("value")));
        }
        assertEquals(0.5, metrics.get("mag"), 1e-12);
        assertEquals(0.5, metrics.get("relative_error"), 1e-12);
        assertEquals(0.0, metrics.get("rdm"), 1e-12);
        assertEquals(2.0, metrics.get("electrodes"));
        assertEquals(0.05, metrics.get("dipole.z"));
    }

    @Test
    void rejectsInconsistentArtifacts() {
        ComparisonArtifacts artifacts = new ComparisonArtifacts(
                new Dipole(FieldVector.of(0, 0, 0.05), FieldVector.of(0, 0, 1)),
                List.of(FieldVector.of(0, 0, 0.092)), new double[] {1.0, 2.0},
                new double[] {1.0, 2.0}, null, null, null);

        assertThrows(IllegalArgumentException.class,
                () -> new CsvResultWriter(dir.toString()).write(artifacts));
        assertThrows(IllegalArgumentException.class, () -> new CsvResultWriter(""));
    }

    private static List<CSVRecord> parse(Path file) throws Exception {
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser p = CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader()
                        .setSkipHeaderRecord(true).build().parse(r)) {
            return p.getRecords();
        }
    }
}
