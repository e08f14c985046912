package com.ai.reservation.repository;

import com.ai.reservation.entity.ReservationRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ReservationRecordRepository extends JpaRepository<ReservationRecord, Long> {
}
