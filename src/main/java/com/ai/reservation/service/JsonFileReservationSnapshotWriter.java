package com.ai.reservation.service;

import com.ai.reservation.dto.ReservationSnapshot;
import com.ai.reservation.memory.SessionState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Writes each finished reservation to {@code <guest-slug>_<yyyyMMdd_HHmmss>.json} under the
 * configured directory and returns the file path.
 */
@Service
@ConditionalOnProperty(name = "reservation.storage.type", havingValue = "file", matchIfMissing = true)
public class JsonFileReservationSnapshotWriter implements ReservationSnapshotWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonFileReservationSnapshotWriter.class);

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final ObjectMapper mapper;
    private final Path directory;
    private final Clock clock;

    @Autowired
    public JsonFileReservationSnapshotWriter(ObjectMapper mapper,
                                             @Value("${reservation.storage.directory:reservations}") String directory) {
        this(mapper, Paths.get(directory), Clock.systemUTC());
    }

    JsonFileReservationSnapshotWriter(ObjectMapper mapper, Path directory, Clock clock) {
        this.mapper = mapper;
        this.directory = directory;
        this.clock = clock;
    }

    @Override
    public String save(SessionState state) {
        Instant now = clock.instant();
        ReservationSnapshot snapshot = ReservationSnapshot.from(state, now);
        Path file = directory.resolve(slugify(state.getGoalFacts().getGuestName()) + "_" + FILE_TIMESTAMP.format(now) + ".json");
        try {
            Files.createDirectories(directory);
            mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), snapshot);
        } catch (IOException e) {
            throw new ReservationPersistenceException("Could not write " + file, e);
        }
        log.debug("Wrote reservation snapshot {}", file);
        return file.toString();
    }

    static String slugify(String value) {
        String slug = value == null ? "" : value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        slug = slug.replaceAll("^_+|_+$", "");
        return slug.isEmpty() ? "reservation" : slug;
    }
}
