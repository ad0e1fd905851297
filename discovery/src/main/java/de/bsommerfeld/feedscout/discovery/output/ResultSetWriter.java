package de.bsommerfeld.feedscout.discovery.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes {@link RankedResultSet}s to pretty-printed JSON with ISO-8601
 * instants. Where the file goes is up to the caller.
 */
@Singleton
public class ResultSetWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ResultSetWriter.class);

    /** Jackson's ObjectMapper is thread-safe once configured. */
    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(RankedResultSet resultSet) throws JsonProcessingException {
        return mapper.writeValueAsString(resultSet);
    }

    /**
     * Writes {@code resultSet} to {@code target}, creating parent directories
     * as needed and replacing an existing file.
     */
    public void write(RankedResultSet resultSet, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(target.toFile(), resultSet);
        LOG.info("Saved {} records for {} to {}", resultSet.size(), resultSet.sourceEntity(), target);
    }
}
