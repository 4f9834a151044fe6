package uk.gegc.tunetrivia.features.clipjob.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.tunetrivia.features.progress.domain.model.ProcessingStart;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;

import java.util.Optional;

/**
 * Reads {@code PROGRESS: {json}} lines printed by the clip job.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProgressLineParser {

    public static final String PREFIX = "PROGRESS: ";

    private final ObjectMapper objectMapper;

    /**
     * @return the event, or empty for other output and for malformed JSON
     */
    public Optional<ProgressEvent> parse(String line) {
        if (line == null || !line.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String json = line.substring(PREFIX.length()).trim();
        try {
            ProgressEvent event = objectMapper.readValue(json, ProgressEvent.class);
            if (event instanceof ProcessingStart start) {
                return Optional.of(start.normalized());
            }
            return Optional.ofNullable(event);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse progress line: {} ({})", line, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
