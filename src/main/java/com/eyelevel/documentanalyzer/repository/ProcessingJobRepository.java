package com.eyelevel.documentanalyzer.repository;

import com.eyelevel.documentanalyzer.model.JobState;
import com.eyelevel.documentanalyzer.model.ProcessingJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA repository for the {@link ProcessingJob} entity.
 * JPQL queries are defined in META-INF/document-orm.xml.
 */
@Repository
public interface ProcessingJobRepository extends JpaRepository<ProcessingJob, String> {

    @Transactional(readOnly = true)
    List<ProcessingJob> findByStateInAndUpdatedAtBefore(Collection<JobState> states, LocalDateTime threshold);

    /**
     * Claims a job for a worker by moving it from {@code expectedState} to {@code newState} and counting the attempt.
     *
     * @return 1 if this caller won the claim, 0 otherwise.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "ProcessingJob.claim")
    int claim(@Param("jobId") String jobId, @Param("newState") JobState newState,
                   @Param("expectedState") JobState expectedState, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "ProcessingJob.finish")
    int finish(@Param("jobId") String jobId, @Param("newState") JobState newState,
               @Param("resultJson") String resultJson, @Param("errorMessage") String errorMessage,
               @Param("expectedState") JobState expectedState, @Param("now") LocalDateTime now);
}
