package com.tide.qc.detector;

import com.tide.qc.core.ConfigManager;
import com.tide.qc.core.Sample;
import com.tide.qc.core.SampleDataException;
import com.tide.qc.core.SampleSeries;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * 站点水位 CSV 加载器
 *
 * 文件格式：可选的标题行 + 表头 + 数据行。
 * 按表头名定位时间、原始水位、质控水位三列，空值或 NaN 读作 NaN。
 */
public final class CsvSampleLoader {

    private static final DateTimeFormatter LOCAL_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    private final String timeColumn;
    private final String rawColumn;
    private final String acceptedColumn;
    private final int skipLines;

    public CsvSampleLoader() {
        this("Time", "raw", "accepted", 0);
    }

    public CsvSampleLoader(String timeColumn, String rawColumn, String acceptedColumn, int skipLines) {
        if (skipLines < 0) {
            throw new IllegalArgumentException("skipLines 不能为负数");
        }
        this.timeColumn = timeColumn;
        this.rawColumn = rawColumn;
        this.acceptedColumn = acceptedColumn;
        this.skipLines = skipLines;
    }

    public static CsvSampleLoader fromConfig(ConfigManager cfg) {
        return new CsvSampleLoader(
                cfg.getProperty("csv.time.column", "Time"),
                cfg.getProperty("csv.raw.column", "raw"),
                cfg.getProperty("csv.accepted.column", "accepted"),
                cfg.getIntProperty("csv.skip.lines", 0)
        );
    }

    public SampleSeries load(Path path) throws SampleDataException {
        List<Sample> samples = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            for (int i = 0; i < skipLines; i++) {
                if (reader.readLine() == null) {
                    throw new SampleDataException("文件行数不足: " + path);
                }
            }
            String line = reader.readLine(); // header
            if (line == null) {
                throw new SampleDataException("缺少表头: " + path);
            }
            String[] header = line.split(",", -1);
            int timeIdx = columnIndex(header, timeColumn);
            int rawIdx = columnIndex(header, rawColumn);
            int acceptedIdx = columnIndex(header, acceptedColumn);
            int required = Math.max(timeIdx, Math.max(rawIdx, acceptedIdx)) + 1;

            int lineNo = skipLines + 1;
            Instant previous = null;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                String[] parts = line.split(",", -1);
                if (parts.length < required) {
                    throw new SampleDataException("第 " + lineNo + " 行列数不足: " + line);
                }
                Instant time = parseTime(parts[timeIdx], lineNo);
                if (previous != null && !time.isAfter(previous)) {
                    throw new SampleDataException("第 " + lineNo + " 行时间未按升序排列: " + time);
                }
                previous = time;
                samples.add(new Sample(
                        time,
                        parseLevel(parts[rawIdx], lineNo),
                        parseLevel(parts[acceptedIdx], lineNo)
                ));
            }
        } catch (IOException e) {
            throw new SampleDataException("读取文件失败: " + path, e);
        }

        return new SampleSeries(samples);
    }

    private int columnIndex(String[] header, String name) throws SampleDataException {
        for (int i = 0; i < header.length; i++) {
            if (header[i].trim().equalsIgnoreCase(name)) {
                return i;
            }
        }
        throw new SampleDataException("缺少列: " + name);
    }

    static Instant parseTime(String text, int lineNo) throws SampleDataException {
        String value = text.trim();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ignored) {
            // 非 ISO 格式，按站点导出的本地时间（UTC）再试一次
        }
        try {
            return LocalDateTime.parse(value, LOCAL_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new SampleDataException("第 " + lineNo + " 行时间格式错误: " + value, e);
        }
    }

    static double parseLevel(String text, int lineNo) throws SampleDataException {
        String value = text.trim();
        if (value.isEmpty() || value.equalsIgnoreCase("nan")) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new SampleDataException("第 " + lineNo + " 行水位格式错误: " + value, e);
        }
    }
}
