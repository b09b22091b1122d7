package com.tide.qc.detector;

import com.tide.qc.core.ConfigManager;
import com.tide.qc.core.SampleDataException;
import com.tide.qc.core.SampleSeries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CsvSampleLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadStationExport() throws Exception {
        Path csv = write("""
                8772471 water level 20180801-20190731
                Time,raw,Time.1,accepted
                2018-08-01 00:00,1.234,2018-08-01 00:00,1.230
                2018-08-01 00:06,,2018-08-01 00:06,1.240
                2018-08-01 00:12,1.5,2018-08-01 00:12,NaN

                """);
        CsvSampleLoader loader = new CsvSampleLoader("Time", "raw", "accepted", 1);

        SampleSeries series = loader.load(csv);

        assertEquals(3, series.size());
        assertEquals(Instant.parse("2018-08-01T00:06:00Z"), series.get(1).getTime());
        assertEquals(1.234, series.get(0).getRaw());
        assertEquals(1.230, series.get(0).getAccepted());
        assertTrue(Double.isNaN(series.get(1).getRaw()));
        assertTrue(Double.isNaN(series.get(2).getAccepted()));
    }

    @Test
    void testIsoTimestampsAndConfiguredColumns() throws Exception {
        Path csv = write("""
                ts,sensor,verified
                2019-01-01T00:00:00Z,0.5,0.5
                2019-01-01T01:00:00Z,0.6,0.9
                """);
        Properties props = new Properties();
        props.setProperty("csv.time.column", "ts");
        props.setProperty("csv.raw.column", "sensor");
        props.setProperty("csv.accepted.column", "verified");

        SampleSeries series = CsvSampleLoader.fromConfig(ConfigManager.fromProperties(props)).load(csv);

        assertEquals(2, series.size());
        assertArrayEquals(new boolean[]{false, true}, series.groundTruth(0.15));
    }

    @Test
    void testMissingColumnRejected() throws Exception {
        Path csv = write("""
                Time,raw
                2018-08-01 00:00,1.0
                """);
        SampleDataException e = assertThrows(SampleDataException.class, () -> new CsvSampleLoader().load(csv));
        assertTrue(e.getMessage().contains("accepted"));
    }

    @Test
    void testUnsortedTimeRejected() throws Exception {
        Path csv = write("""
                Time,raw,accepted
                2018-08-01 00:06,1.0,1.0
                2018-08-01 00:00,1.0,1.0
                """);
        assertThrows(SampleDataException.class, () -> new CsvSampleLoader().load(csv));
    }

    @Test
    void testMalformedValueRejected() throws Exception {
        Path csv = write("""
                Time,raw,accepted
                2018-08-01 00:00,abc,1.0
                """);
        assertThrows(SampleDataException.class, () -> new CsvSampleLoader().load(csv));
    }

    @Test
    void testMissingFileRejected() {
        assertThrows(SampleDataException.class, () -> new CsvSampleLoader().load(tempDir.resolve("none.csv")));
    }

    private Path write(String content) throws Exception {
        Path csv = tempDir.resolve("station.csv");
        Files.writeString(csv, content, StandardCharsets.UTF_8);
        return csv;
    }
}
