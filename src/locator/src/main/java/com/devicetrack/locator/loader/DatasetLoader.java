package com.devicetrack.locator.loader;

import com.devicetrack.locator.model.LatestIndex;
import com.devicetrack.locator.model.Snapshot;
import com.devicetrack.locator.model.TelemetryRecord;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

/**
 * Turns a raw telemetry CSV export into a {@link Snapshot} and its {@link LatestIndex}.
 *
 * <p>The load is all-or-nothing: a missing column or a single malformed row fails the whole
 * load with {@link DatasetLoadException.Kind#PARSE_FAILURE}.
 */
@Component
public class DatasetLoader {
  private static final CSVFormat FORMAT = CSVFormat.Builder.create(CSVFormat.DEFAULT)
      .setHeader()
      .setSkipHeaderRecord(true)
      .setIgnoreEmptyLines(true)
      .setTrim(true)
      .build();

  /**
   * Parses, orders and indexes a CSV export.
   *
   * @param source CSV bytes with a header row; consumed and closed
   * @return ordered snapshot plus latest-per-device index
   * @throws DatasetLoadException when the content cannot be parsed
   */
  public LoadResult load(InputStream source) {
    List<TelemetryRecord> records = parse(source);
    // List.sort is stable: equal sts keep their row order.
    records.sort(Comparator.comparing(TelemetryRecord::sts));
    Snapshot snapshot = new Snapshot(records);
    return new LoadResult(snapshot, LatestIndex.from(snapshot));
  }

  private List<TelemetryRecord> parse(InputStream source) {
    Reader reader = new InputStreamReader(source, StandardCharsets.UTF_8);
    try (CSVParser parser = FORMAT.parse(reader)) {
      List<String> missing = TelemetryRowParser.REQUIRED_COLUMNS.stream()
          .filter(column -> !parser.getHeaderNames().contains(column))
          .toList();
      if (!missing.isEmpty()) {
        throw new DatasetLoadException(
            DatasetLoadException.Kind.PARSE_FAILURE, "CSV header is missing columns " + missing, null);
      }

      List<TelemetryRecord> records = new ArrayList<>();
      for (CSVRecord row : parser) {
        records.add(TelemetryRowParser.parse(row.toMap(), row.getRecordNumber()));
      }
      return records;
    } catch (MalformedRecordException ex) {
      throw new DatasetLoadException(DatasetLoadException.Kind.PARSE_FAILURE, ex.getMessage(), ex);
    } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException ex) {
      throw new DatasetLoadException(
          DatasetLoadException.Kind.PARSE_FAILURE, "Unreadable CSV content: " + ex.getMessage(), ex);
    }
  }
}
