package org.rostilos.branchtree.vcsclient.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Reads the liveness marker of a worktree and decides whether an agent is currently active there.
 * Presence and recency of the marker are the only signals trusted.
 */
public class LivenessMarkerReader {

    private static final Logger log = LoggerFactory.getLogger(LivenessMarkerReader.class);

    public static final String DEFAULT_MARKER_PATH = ".branchtree/heartbeat.json";
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(30);

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String markerPath;
    private final Duration window;

    public LivenessMarkerReader(ObjectMapper objectMapper, Clock clock, String markerPath, Duration window) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.markerPath = markerPath;
        this.window = window;
    }

    public LivenessMarkerReader(Clock clock) {
        this(new ObjectMapper(), clock, DEFAULT_MARKER_PATH, DEFAULT_WINDOW);
    }

    /**
     * @return the marker when it exists and was refreshed within the window
     */
    public Optional<LivenessMarker> readActive(Path worktreePath) {
        Path file = worktreePath.resolve(markerPath);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }

        LivenessMarker marker;
        try {
            marker = objectMapper.readValue(file.toFile(), LivenessMarker.class);
        } catch (IOException e) {
            log.warn("Unreadable liveness marker {}: {}", file, e.getMessage());
            return Optional.empty();
        }

        Optional<Instant> updatedAt = parseInstant(marker.updatedAt());
        if (updatedAt.isEmpty()) {
            log.warn("Liveness marker {} has no valid updatedAt: '{}'", file, marker.updatedAt());
            return Optional.empty();
        }

        Duration age = Duration.between(updatedAt.get(), clock.instant());
        return age.compareTo(window) < 0 ? Optional.of(marker) : Optional.empty();
    }

    static Optional<Instant> parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(value));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(OffsetDateTime.parse(value).toInstant());
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }
}
