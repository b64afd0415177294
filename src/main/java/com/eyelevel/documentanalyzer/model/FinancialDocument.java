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
 * One uploaded financial document and the outcome of its single extraction run.
 * <p>
 * Terminal transitions are written through the guarded named queries in
 * {@code META-INF/document-orm.xml}, never through a dirty-checked save.
 */
@Entity
@Table(name = "financial_document")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancialDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(updatable = false)
    private String filename;

    @Builder.Default
    @Column(nullable = false, columnDefinition = "TEXT")
    private String rawText = "";

    @Embedded
    @Builder.Default
    private ParsedFields parsedFields = ParsedFields.empty();

    @Column(unique = true)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DocumentStatus status;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    /**
     * Hibernate leaves an embedded component null when all of its columns are null.
     *
     * @return the parsed fields, never {@code null}.
     */
    public ParsedFields getParsedFields() {
        return parsedFields == null ? ParsedFields.empty() : parsedFields;
    }
}
