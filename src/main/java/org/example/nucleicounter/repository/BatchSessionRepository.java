package org.example.nucleicounter.repository;

import org.example.nucleicounter.model.BatchSession;
import org.example.nucleicounter.model.BatchStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BatchSessionRepository extends JpaRepository<BatchSession, Long> {
    List<BatchSession> findByStatusIn(List<BatchStatus> statuses);
}
