/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.sources;

import com.intuitivedesigns.cleankernel.core.PipelinePayload;
import com.intuitivedesigns.cleankernel.core.SourceConnector;
import com.intuitivedesigns.cleankernel.model.RawRow;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Reads a delimited file with a header line, one {@link RawRow} per record, lazily.
 *
 * <p>The first non-empty line supplies column labels. A record whose field count differs from the header
 * becomes a structurally malformed row when {@code strictColumns} is set; otherwise missing
 * trailing cells are blank and surplus cells are dropped. A parse error (an unterminated quote,
 * for instance) yields one malformed row and ends the input, since the reader cannot resync.</p>
 */
public final class CsvSourceConnector implements SourceConnector<RawRow> {

    private static final String BOM = "\uFEFF";

    private static final Logger log = LoggerFactory.getLogger(CsvSourceConnector.class);

    public static final String METADATA_SOURCE = "source";

    private final Supplier<Reader> readerSupplier;
    private final String sourceName;
    private final CSVFormat format;
    private final boolean strictColumns;

    private CSVParser parser;
    private Iterator<CSVRecord> records;
    private List<String> headers;
    private long rowNumber;
    private boolean exhausted;

    public CsvSourceConnector(Supplier<Reader> readerSupplier, String sourceName, char delimiter, boolean strictColumns) {
        this.readerSupplier = Objects.requireNonNull(readerSupplier, "readerSupplier");
        this.sourceName = (sourceName == null) ? "csv" : sourceName;
        this.strictColumns = strictColumns;
        this.format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .build();
    }

    public static CsvSourceConnector forFile(Path path, Charset charset, char delimiter, boolean strictColumns) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(charset, "charset");
        return new CsvSourceConnector(() -> {
            try {
                return Files.newBufferedReader(path, charset);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot open " + path, e);
            }
        }, path.getFileName().toString(), delimiter, strictColumns);
    }

    @Override
    public void connect() {
        if (parser != null) return;
        final Reader reader = readerSupplier.get();
        try {
            this.parser = format.parse(reader);
        } catch (IOException e) {
            closeQuietly(reader);
            throw new UncheckedIOException("Cannot read header of " + sourceName, e);
        }
        this.records = parser.iterator();
        this.rowNumber = 0;
        this.exhausted = false;
        this.headers = readHeader();
        log.info("CSV source connected: {} columns={}", sourceName, headers);
    }

    @Override
    public void disconnect() {
        if (parser == null) return;
        try {
            parser.close();
        } catch (IOException e) {
            log.warn("Error closing CSV source {}", sourceName, e);
        } finally {
            parser = null;
            records = null;
        }
        log.info("CSV source disconnected: {} rows read from {}", rowNumber, sourceName);
    }

    @Override
    public PipelinePayload<RawRow> fetch() {
        if (records == null) throw new IllegalStateException("Source not connected");
        if (exhausted) return null;

        final CSVRecord record;
        try {
            if (!records.hasNext()) {
                exhausted = true;
                return null;
            }
            record = records.next();
        } catch (UncheckedIOException | IllegalStateException e) {
            exhausted = true;
            final long n = ++rowNumber;
            log.warn("CSV parse error in {} after row {}: {}", sourceName, n - 1, e.getMessage());
            return payload(RawRow.malformed(n, "unreadable CSV: " + e.getMessage()));
        }

        final long n = ++rowNumber;
        if (strictColumns && record.size() != headers.size()) {
            return payload(RawRow.malformed(n, "expected " + headers.size() + " columns, found " + record.size()));
        }

        final Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            values.putIfAbsent(headers.get(i), i < record.size() ? record.get(i) : null);
        }
        return payload(RawRow.of(n, values));
    }

    // Labels are kept verbatim, duplicates included; matching is the extractor's concern.
    // A leading byte order mark (Excel "CSV UTF-8") is not part of the first label.
    private List<String> readHeader() {
        try {
            if (!records.hasNext()) {
                exhausted = true;
                return List.of();
            }
            final CSVRecord header = records.next();
            final List<String> labels = new ArrayList<>(header.size());
            header.forEach(labels::add);
            if (!labels.isEmpty() && labels.get(0).startsWith(BOM)) {
                labels.set(0, labels.get(0).substring(BOM.length()));
            }
            return List.copyOf(labels);
        } catch (UncheckedIOException | IllegalStateException e) {
            disconnect();
            throw new IllegalStateException("Cannot read header of " + sourceName, e);
        }
    }

    private PipelinePayload<RawRow> payload(RawRow row) {
        return new PipelinePayload<>(row.rowId(), row, Map.of(METADATA_SOURCE, sourceName));
    }

    private static void closeQuietly(Reader reader) {
        try {
            reader.close();
        } catch (IOException e) {
            log.debug("Error closing reader", e);
        }
    }
}
