/* (C)2026 */
package com.ammann.logquery.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Writes each record as one JSON line appended to the configured log file.
 */
@ApplicationScoped
public class JsonLinesFileLogSink implements LogSink
{
    private static final Logger LOG = Logger.getLogger(JsonLinesFileLogSink.class);

    private final ObjectMapper objectMapper;
    private final Path logFile;

    @Inject
    public JsonLinesFileLogSink(
            ObjectMapper objectMapper,
            @ConfigProperty(name = "logquery.log-file", defaultValue = "service.log") String logFile) {
        this.objectMapper = objectMapper;
        this.logFile = Path.of(logFile);
    }

    @Override
    public synchronized void append(ObservabilityRecord record) {
        try {
            String line = objectMapper.writeValueAsString(record.toMap()) + "\n";
            Files.writeString(
                    logFile,
                    line,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
        } catch (JsonProcessingException e) {
            LOG.warnf(e, "Could not serialize %s record", record.event().label());
        } catch (IOException e) {
            LOG.warnf(e, "Could not append %s record to %s", record.event().label(), logFile);
        }
    }

    Path getLogFile() {
        return logFile;
    }
}
