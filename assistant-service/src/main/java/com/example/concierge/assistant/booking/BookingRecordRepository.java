package com.example.concierge.assistant.booking;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface BookingRecordRepository extends JpaRepository<BookingRecord, UUID> {

    List<BookingRecord> findBySessionIdOrderByCreatedAtDesc(String sessionId);

    Optional<BookingRecord> findByPnr(String pnr);
}
