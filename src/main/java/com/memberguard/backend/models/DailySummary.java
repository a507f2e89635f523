package com.memberguard.backend.models;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * One row per calendar day, upserted by the nightly summary job.
 */
@Entity
@Table(name = "daily_summaries", uniqueConstraints = @UniqueConstraint(columnNames = "summary_date"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailySummary {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "summary_date", nullable = false)
    private LocalDate date;

    private long newUsers;
    private long requestsReceived;
    private long approvals;
    private long renewals;
    private long expiredToday;
    private long removedFromGroup;
    private long broadcasts;
}
