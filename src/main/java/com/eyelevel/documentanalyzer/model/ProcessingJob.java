package com.eyelevel.documentanalyzer.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * A unit of background work that runs the extraction for one {@link FinancialDocument}.
 * This table doubles as the job result store queried by the status endpoint.
 */
@Entity
@Table(name = "processing_job")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingJob {

    @Id
    @Column(length = 36)
    private String jobId;

    @Column(nullable = false, updatable = false)
    private Long documentId;

    @Column(nullable = false, updatable = false, length = 1024)
    private String filePath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobState state;

    /**
     * JSON form of the extraction outcome, written once the job finishes.
     */
    @Column(columnDefinition = "TEXT")
    private String resultJson;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Builder.Default
    @Column(nullable = false)
    private int attempts = 0;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
