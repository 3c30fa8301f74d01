package org.example.nucleicounter.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "batch_sessions")
@Getter
@Setter
public class BatchSession {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BatchStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunMode runMode;

    private Integer imageCount;
    private Integer countedTotal;
    private Integer failedTotal;
    private Long nucleiTotal;

    private Boolean engineMissing;
    private Boolean timedOut;
    private Integer exitCode;
    private String channelStatus;
    private String errorMessage;

    private String logPath;
    private String outcomesJsonPath;

    private Instant createdAt;
    private Instant startedAt;
    private Instant finishedAt;
}
