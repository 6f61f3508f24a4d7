package com.stocksignal.data;

import com.stocksignal.model.Bar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeMap;

/**
 * 模块说明：CsvBarSource（class）。
 * 主要职责：从本地目录读取 {@code <code>.csv} 日线文件，表头为
 * {@code date,open,high,low,close,volume}，可选追加 {@code amount,turn,pctChg} 列。
 * 使用建议：格式错误的行会被跳过；同一日期出现多次时保留最后一行。
 */
public final class CsvBarSource implements BarSource {
    private static final Logger LOG = LogManager.getLogger(CsvBarSource.class);
    private static final String REQUIRED_HEADER = "date,open,high,low,close,volume";

    private final Path dataDir;

    public CsvBarSource(Path dataDir) {
        if (dataDir == null) {
            throw new IllegalArgumentException("data directory is required");
        }
        this.dataDir = dataDir;
    }

    @Override
    public List<Bar> fetchBars(String code, LocalDate start, LocalDate end) throws IOException {
        String normalized = code == null ? "" : code.trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("instrument code is required");
        }
        Path file = dataDir.resolve(normalized + ".csv");
        if (!Files.isRegularFile(file)) {
            LOG.warn("no bar file for code={} path={}", normalized, file);
            return List.of();
        }
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<Bar> bars = parseCsv(normalized, lines, start, end);
        LOG.debug("loaded bars code={} count={} path={}", normalized, bars.size(), file);
        return bars;
    }

    @Override
    public boolean healthCheck() {
        return Files.isDirectory(dataDir) && Files.isReadable(dataDir);
    }

    static List<Bar> parseCsv(String code, List<String> lines, LocalDate start, LocalDate end) throws IOException {
        if (lines == null || lines.isEmpty()) {
            return List.of();
        }
        String header = stripBom(lines.get(0)).trim().toLowerCase(Locale.ROOT).replace(" ", "");
        if (!header.startsWith(REQUIRED_HEADER)) {
            String sample = header.length() > 120 ? header.substring(0, 120) : header;
            throw new IOException("unexpected_csv_header:" + sample);
        }

        TreeMap<LocalDate, Bar> byDate = new TreeMap<>();
        int malformed = 0;
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] cols = line.split(",", -1);
            if (cols.length < 6) {
                malformed++;
                continue;
            }
            try {
                LocalDate date = LocalDate.parse(cols[0].trim());
                if ((start != null && date.isBefore(start)) || (end != null && date.isAfter(end))) {
                    continue;
                }
                double close = parseDouble(cols[4]);
                if (!(close > 0)) {
                    malformed++;
                    continue;
                }
                byDate.put(date, Bar.builder()
                        .code(code)
                        .tradeDate(date)
                        .open(parseDouble(cols[1]))
                        .high(parseDouble(cols[2]))
                        .low(parseDouble(cols[3]))
                        .close(close)
                        .preclose(Double.NaN)
                        .volume(parseDouble(cols[5]))
                        .amount(optionalColumn(cols, 6))
                        .turnover(optionalColumn(cols, 7))
                        .pctChg(optionalColumn(cols, 8))
                        .build());
            } catch (DateTimeParseException | NumberFormatException e) {
                malformed++;
                LOG.debug("skip malformed line code={} line={} error={}", code, i + 1, e.getMessage());
            }
        }
        if (malformed > 0) {
            LOG.warn("skipped malformed lines code={} count={}", code, malformed);
        }
        return new ArrayList<>(byDate.values());
    }

    private static double optionalColumn(String[] cols, int index) {
        if (index >= cols.length) {
            return Double.NaN;
        }
        String v = cols[index].trim();
        if (v.isEmpty() || v.equalsIgnoreCase("null")) {
            return Double.NaN;
        }
        return Double.parseDouble(v);
    }

    private static double parseDouble(String input) {
        String v = input == null ? "" : input.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("null")) {
            return 0.0;
        }
        return Double.parseDouble(v);
    }

    private static String stripBom(String s) {
        return s.startsWith("\uFEFF") ? s.substring(1) : s;
    }
}
