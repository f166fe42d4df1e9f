package io.bastion.core.status;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.bastion.api.status.RuntimeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes runtime status snapshots as indented JSON for external reporting.
 */
public class StatusReportWriter {

    private static final Logger log = LoggerFactory.getLogger(StatusReportWriter.class);

    private final Path reportPath;
    private final ObjectMapper objectMapper;

    public StatusReportWriter(Path reportPath) {
        this.reportPath = reportPath;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return true if the report was written
     */
    public boolean write(RuntimeStatus status) {
        try {
            Path parent = reportPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(reportPath.toFile(), status);
            log.info("Status report written to: {}", reportPath.toAbsolutePath());
            return true;
        } catch (IOException e) {
            log.error("Failed to write status report to {}", reportPath, e);
            return false;
        }
    }

    public String toJson(RuntimeStatus status) {
        try {
            return objectMapper.writeValueAsString(status);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Status snapshot is not serializable", e);
        }
    }

    public Path reportPath() {
        return reportPath;
    }
}
