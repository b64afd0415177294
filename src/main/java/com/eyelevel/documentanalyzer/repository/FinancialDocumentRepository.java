package com.eyelevel.documentanalyzer.repository;

import com.eyelevel.documentanalyzer.model.DocumentStatus;
import com.eyelevel.documentanalyzer.model.FinancialDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link FinancialDocument} entity.
 * JPQL queries are defined in META-INF/document-orm.xml.
 */
@Repository
public interface FinancialDocumentRepository extends JpaRepository<FinancialDocument, Long>,
                                                     FinancialDocumentSliceRepository {

    @Transactional(readOnly = true)
    Optional<FinancialDocument> findByJobId(String jobId);

    @Transactional(readOnly = true)
    List<FinancialDocument> findByStatusAndCreatedAtBefore(DocumentStatus status, LocalDateTime threshold);

    /**
     * Writes the raw text, all four parsed fields and the SUCCESS status in one statement,
     * only if the document is still in {@code expectedStatus}.
     *
     * @return the number of rows updated, 0 or 1.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "FinancialDocument.markSucceeded")
    int markSucceeded(@Param("id") Long id, @Param("rawText") String rawText, @Param("vendor") String vendor,
                      @Param("invoiceNo") String invoiceNo, @Param("invoiceDate") String invoiceDate,
                      @Param("total") String total, @Param("newStatus") DocumentStatus newStatus,
                      @Param("expectedStatus") DocumentStatus expectedStatus, @Param("now") LocalDateTime now);

    /**
     * Moves the document to FAILED without touching its text or parsed fields,
     * only if the document is still in {@code expectedStatus}.
     *
     * @return the number of rows updated, 0 or 1.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "FinancialDocument.markFailed")
    int markFailed(@Param("id") Long id, @Param("errorMessage") String errorMessage,
                   @Param("newStatus") DocumentStatus newStatus,
                   @Param("expectedStatus") DocumentStatus expectedStatus, @Param("now") LocalDateTime now);
}
