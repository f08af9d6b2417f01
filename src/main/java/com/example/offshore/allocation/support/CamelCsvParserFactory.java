package com.example.offshore.allocation.support;

import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;
import java.io.Writer;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.dataformat.univocity.UniVocityCsvDataFormat;
import org.springframework.stereotype.Component;

/**
 * Shared univocity settings for backup snapshots: one header row, free-text columns, empty cells for nulls.
 */
@Slf4j
@Component
public class CamelCsvParserFactory extends UniVocityCsvDataFormat {

    private static final int MAX_CHARS_PER_COLUMN = 16 * 1024;

    public CamelCsvParserFactory() {
        setHeaderExtractionEnabled(false);
        setSkipEmptyLines(true);
        setIgnoreLeadingWhitespaces(true);
        setIgnoreTrailingWhitespaces(true);
        setLineSeparator("\n");
        setLazyLoad(true);
        setAsMap(false);
    }

    public CsvParser newParser() {
        CsvParserSettings settings = createParserSettings();
        configureParserSettings(settings);
        settings.setColumnReorderingEnabled(false);
        settings.setMaxCharsPerColumn(MAX_CHARS_PER_COLUMN);
        settings.getFormat().setLineSeparator("\n");
        log.debug("Created CsvParser with maxCharsPerColumn={} lazyLoad={}",
            settings.getMaxCharsPerColumn(), isLazyLoad());
        return createParser(settings);
    }

    public CsvWriter newWriter(Writer writer) {
        CsvWriterSettings settings = new CsvWriterSettings();
        settings.setNullValue("");
        settings.setQuoteAllFields(false);
        settings.getFormat().setLineSeparator("\n");
        return new CsvWriter(writer, settings);
    }
}
