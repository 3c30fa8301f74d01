package org.example.nucleicounter.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "history_entries")
@Getter
@Setter
@NoArgsConstructor
public class HistoryEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_id")
    private Long batchId;

    @Column(nullable = false, length = 2048)
    private String image;

    private Integer count;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OutcomeStatus status;

    @Column(nullable = false)
    private Instant recordedAt;

    public HistoryEntry(Long batchId, ImageOutcome outcome, Instant recordedAt) {
        this.batchId = batchId;
        this.image = outcome.image();
        this.count = outcome.count();
        this.status = outcome.status();
        this.recordedAt = recordedAt;
    }
}
