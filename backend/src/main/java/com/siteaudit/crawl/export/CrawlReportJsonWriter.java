package com.siteaudit.crawl.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.siteaudit.crawl.model.CrawlReport;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Renders crawl and monitoring reports as JSON with lower-case enum values and ISO-8601
 * timestamps.
 */
@Component
public class CrawlReportJsonWriter {
    private final ObjectMapper objectMapper;

    public CrawlReportJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(Object report, boolean pretty) {
        ObjectWriter writer = pretty ? objectMapper.writerWithDefaultPrettyPrinter() : objectMapper.writer();
        try {
            return writer.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + report.getClass().getSimpleName(), e);
        }
    }

    /**
     * Writes {@code <directory>/<runId>.json}, replacing an earlier export of the same run.
     */
    public Path write(CrawlReport report, Path directory, boolean pretty) {
        Path target = directory.resolve(report.run().runId() + ".json");
        Path temp = directory.resolve(report.run().runId() + ".json.tmp");
        try {
            Files.createDirectories(directory);
            Files.writeString(temp, toJson(report, pretty));
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write crawl report to " + target, e);
        }
    }
}
