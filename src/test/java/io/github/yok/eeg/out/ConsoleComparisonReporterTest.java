package io.github.yok.eeg.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.eeg.core.geometry.Dipole;
import io.github.yok.eeg.core.geometry.FieldVector;
import io.github.yok.eeg.core.metric.MetricResult;
import io.github.yok.eeg.core.pipeline.ComparisonReport;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ConsoleComparisonReporterTest {

    private static final ComparisonReport REPORT = new ComparisonReport(
            new Dipole(FieldVector.of(0, 0, 0.05), FieldVector.of(0, 0, 1)), 0, 32,
            new MetricResult(2.0, 1.9, 0.12, 0.95, 0.08));

    private ByteArrayOutputStream buffer;

    @Test
    void printsMetricsWithVerdicts() {
        String text = render(new ConsoleComparisonReporter(stream(), 0.1, 0.1, 0.1));

        assertTrue(text.contains("relative error   = 1.20000e-01 [NG]"), text);
        assertTrue(text.contains("MAG              = 9.50000e-01 [OK]"), text);
        assertTrue(text.contains("RDM              = 8.00000e-02 [OK]"), text);
        assertTrue(text.contains("電極数: 32"), text);
    }

    @Test
    void smallDiscrepanciesKeepSignificantDigits() {
        ComparisonReport close = new ComparisonReport(REPORT.getDipole(), 0, 32,
                new MetricResult(2.0, 2.0, 3.2e-7, 1.0000004, 1.5e-8));

        ConsoleComparisonReporter reporter =
                new ConsoleComparisonReporter(stream(), null, null, null);
        reporter.report(close);
        String text = buffer.toString(StandardCharsets.UTF_8);

        assertTrue(text.contains("relative error   = 3.20000e-07"), text);
        assertTrue(text.contains("MAG              = 1.00000e+00"), text);
        assertTrue(text.contains("RDM              = 1.50000e-08"), text);
    }

    @Test
    void omitsVerdictWithoutThreshold() {
        String text = render(new ConsoleComparisonReporter(stream(), null, null, null));

        assertFalse(text.contains("[OK]"));
        assertFalse(text.contains("[NG]"));
    }

    @Test
    void verdictBoundaryIsInclusive() {
        assertEquals(" [OK]", ConsoleComparisonReporter.verdict(0.1, 0.1));
        assertEquals(" [NG]", ConsoleComparisonReporter.verdict(0.1000001, 0.1));
        assertEquals("", ConsoleComparisonReporter.verdict(5.0, null));
    }

    private PrintStream stream() {
        buffer = new ByteArrayOutputStream();
        return new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private String render(ConsoleComparisonReporter reporter) {
        reporter.report(REPORT);
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
