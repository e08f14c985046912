package com.ai.reservation.service;

import com.ai.reservation.dto.ReservationSnapshot;
import com.ai.reservation.entity.ReservationRecord;
import com.ai.reservation.memory.SessionState;
import com.ai.reservation.repository.ReservationRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Stores the reservation snapshot as a JSON column. The location returned is
 * {@code reservation-record:<id>}.
 */
@Service
@ConditionalOnProperty(name = "reservation.storage.type", havingValue = "database")
public class DatabaseReservationSnapshotWriter implements ReservationSnapshotWriter {

    private static final Logger log = LoggerFactory.getLogger(DatabaseReservationSnapshotWriter.class);

    static final String LOCATION_PREFIX = "reservation-record:";

    private final ReservationRecordRepository repository;
    private final ObjectMapper mapper;

    public DatabaseReservationSnapshotWriter(ReservationRecordRepository repository, ObjectMapper mapper) {
        this.repository = repository;
        this.mapper = mapper;
    }

    @Override
    @Transactional
    public String save(SessionState state) {
        ReservationSnapshot snapshot = ReservationSnapshot.from(state, Instant.now());
        try {
            ReservationRecord record = ReservationRecord.builder()
                    .guestName(snapshot.getGuest().getName())
                    .restaurant(snapshot.getRestaurant())
                    .confirmationStatus(snapshot.getWorkflow().getConfirmationStatus().getValue())
                    .snapshotJson(mapper.writeValueAsString(snapshot))
                    .build();
            ReservationRecord saved = repository.save(record);
            log.debug("Stored reservation record {}", saved.getId());
            return LOCATION_PREFIX + saved.getId();
        } catch (JsonProcessingException | DataAccessException e) {
            throw new ReservationPersistenceException("Could not store reservation record", e);
        }
    }
}
