package org.example.nucleicounter.repository;

import org.example.nucleicounter.model.HistoryEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface HistoryEntryRepository extends JpaRepository<HistoryEntry, Long> {
    List<HistoryEntry> findAllByOrderByIdAsc(Pageable pageable);

    List<HistoryEntry> findAllByOrderByIdDesc(Pageable pageable);
}
