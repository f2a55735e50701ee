package com.editflow.orchestrator.repository;

import com.editflow.orchestrator.model.Job;
import com.editflow.orchestrator.model.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * CRUD + scheduler queries for the jobs table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface JobRepository extends JpaRepository<Job, String> {

    /**
     * Load a job with a row lock held until the surrounding transaction commits.
     * Every state transition goes through this so that two writers never
     * interleave on the same job.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") String id);

    /** Candidates for the next selection pass, in FIFO order. */
    List<Job> findByStatusOrderByCreatedAtAscSequenceAsc(JobStatus status);

    List<Job> findByStatusAndSubjectRefOrderByCreatedAtAsc(JobStatus status, String subjectRef);

    List<Job> findBySubjectRefOrderByCreatedAtAsc(String subjectRef);

    List<Job> findByStatusOrderByCreatedAtAsc(JobStatus status);

    List<Job> findAllByOrderByCreatedAtAsc();

    long countByStatus(JobStatus status);

    long countByStatusAndPriorityTier(JobStatus status, int priorityTier);

    /** Highest submission sequence handed out so far (0 for an empty table). */
    @Query("SELECT COALESCE(MAX(j.sequence), 0) FROM Job j")
    long findMaxSequence();
}
