package com.cadence.backend.repositories.campaign;

import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.ErrorCategory;
import com.cadence.backend.enums.StepStatus;
import com.cadence.backend.models.campaign.ScheduledStep;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface ScheduledStepRepository extends JpaRepository<ScheduledStep, Long> {

    boolean existsByCampaignIdAndContactIdAndStepIndex(Long campaignId, Long contactId, Integer stepIndex);

    List<ScheduledStep> findByCampaignIdOrderByContactIdAscStepIndexAsc(Long campaignId);

    List<ScheduledStep> findByCampaignIdAndChannelAndStatusOrderByIdAsc(Long campaignId, Channel channel, StepStatus status);

    List<ScheduledStep> findByWorkspaceIdAndStatusOrderByScheduledAtDesc(Long workspaceId, StepStatus status);

    List<ScheduledStep> findByStatusAndUpdatedAtBeforeOrderByIdAsc(StepStatus status, Instant updatedBefore);

    /**
     * Due steps, oldest first. The id tie-break keeps passes deterministic.
     */
    @Query("""
        SELECT s FROM ScheduledStep s
        WHERE s.status IN :statuses
        AND s.scheduledAt <= :now
        ORDER BY s.scheduledAt ASC, s.id ASC
        """)
    List<ScheduledStep> findDueSteps(@Param("statuses") Collection<StepStatus> statuses,
                                     @Param("now") Instant now);

    @Query("""
        SELECT s FROM ScheduledStep s
        WHERE s.status = :status
        AND (:campaignId IS NULL OR s.campaignId = :campaignId)
        AND (:category IS NULL OR s.errorCategory = :category)
        ORDER BY s.id ASC
        """)
    List<ScheduledStep> findByStatusAndFilters(@Param("status") StepStatus status,
                                               @Param("campaignId") Long campaignId,
                                               @Param("category") ErrorCategory category);

    // =========================
    // CONDITIONAL UPDATES (compare-and-set on status)
    // =========================

    /**
     * Claim a step for execution. Fails when the stored status moved on or when
     * another step for the same contact and channel is already executing.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ScheduledStep s
        SET s.status = :executing, s.updatedAt = :now
        WHERE s.id = :id
        AND s.status = :expected
        AND NOT EXISTS (
            SELECT o.id FROM ScheduledStep o
            WHERE o.contactId = s.contactId
            AND o.channel = s.channel
            AND o.status = :executing
        )
        """)
    int claim(@Param("id") Long id,
              @Param("expected") StepStatus expected,
              @Param("executing") StepStatus executing,
              @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ScheduledStep s
        SET s.status = :next, s.updatedAt = :now
        WHERE s.id = :id AND s.status = :expected
        """)
    int transition(@Param("id") Long id,
                   @Param("expected") StepStatus expected,
                   @Param("next") StepStatus next,
                   @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ScheduledStep s
        SET s.status = :outcome,
            s.executedAt = :executedAt,
            s.errorCategory = :category,
            s.errorMessage = :errorMessage,
            s.updatedAt = :now
        WHERE s.id = :id AND s.status = :executing
        """)
    int recordOutcome(@Param("id") Long id,
                      @Param("executing") StepStatus executing,
                      @Param("outcome") StepStatus outcome,
                      @Param("executedAt") Instant executedAt,
                      @Param("category") ErrorCategory category,
                      @Param("errorMessage") String errorMessage,
                      @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ScheduledStep s
        SET s.status = :pending,
            s.scheduledAt = :scheduledAt,
            s.executedAt = NULL,
            s.errorCategory = NULL,
            s.errorMessage = NULL,
            s.updatedAt = :now
        WHERE s.id = :id AND s.status = :expected
        """)
    int resetToPending(@Param("id") Long id,
                       @Param("expected") StepStatus expected,
                       @Param("pending") StepStatus pending,
                       @Param("scheduledAt") Instant scheduledAt,
                       @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ScheduledStep s
        SET s.status = :approved, s.approvedBy = :approverId, s.approvedAt = :now, s.updatedAt = :now
        WHERE s.id = :id AND s.status = :awaiting
        """)
    int approve(@Param("id") Long id,
                @Param("awaiting") StepStatus awaiting,
                @Param("approved") StepStatus approved,
                @Param("approverId") String approverId,
                @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ScheduledStep s
        SET s.status = :skipped, s.rejectedBy = :approverId, s.rejectionReason = :reason, s.updatedAt = :now
        WHERE s.id = :id AND s.status = :awaiting
        """)
    int reject(@Param("id") Long id,
               @Param("awaiting") StepStatus awaiting,
               @Param("skipped") StepStatus skipped,
               @Param("approverId") String approverId,
               @Param("reason") String reason,
               @Param("now") Instant now);

    // =========================
    // WARMUP WINDOW QUERIES
    // =========================

    @Query("""
        SELECT MIN(s.executedAt) FROM ScheduledStep s
        WHERE s.workspaceId = :workspaceId
        AND s.status IN :statuses
        """)
    Instant findFirstExecutedAt(@Param("workspaceId") Long workspaceId,
                                @Param("statuses") Collection<StepStatus> statuses);

    @Query("""
        SELECT COUNT(s) FROM ScheduledStep s
        WHERE s.workspaceId = :workspaceId
        AND s.status IN :statuses
        AND s.executedAt >= :from
        AND s.executedAt < :to
        """)
    long countExecutedBetween(@Param("workspaceId") Long workspaceId,
                              @Param("statuses") Collection<StepStatus> statuses,
                              @Param("from") Instant from,
                              @Param("to") Instant to);

    @Query("""
        SELECT COUNT(s) FROM ScheduledStep s
        WHERE s.workspaceId = :workspaceId
        AND s.status = :executing
        AND s.updatedAt >= :from
        AND s.updatedAt < :to
        """)
    long countClaimedBetween(@Param("workspaceId") Long workspaceId,
                             @Param("executing") StepStatus executing,
                             @Param("from") Instant from,
                             @Param("to") Instant to);

    // =========================
    // AGGREGATES
    // =========================

    @Query("""
        SELECT s.status, COUNT(s) FROM ScheduledStep s
        WHERE s.campaignId = :campaignId
        GROUP BY s.status
        """)
    List<Object[]> countByStatus(@Param("campaignId") Long campaignId);

    @Query("""
        SELECT s.errorCategory, COUNT(s), MAX(s.errorMessage) FROM ScheduledStep s
        WHERE s.campaignId = :campaignId
        AND s.status = :failed
        GROUP BY s.errorCategory
        ORDER BY COUNT(s) DESC
        """)
    List<Object[]> countFailuresByCategory(@Param("campaignId") Long campaignId,
                                           @Param("failed") StepStatus failed);
}
