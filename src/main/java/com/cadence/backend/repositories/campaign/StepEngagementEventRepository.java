package com.cadence.backend.repositories.campaign;

import com.cadence.backend.enums.EngagementEventType;
import com.cadence.backend.models.campaign.StepEngagementEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface StepEngagementEventRepository extends JpaRepository<StepEngagementEvent, Long> {

    /**
     * Rows of (stepIndex, eventType, count) for a campaign
     */
    @Query("""
        SELECT e.stepIndex, e.eventType, COUNT(e) FROM StepEngagementEvent e
        WHERE e.campaignId = :campaignId
        GROUP BY e.stepIndex, e.eventType
        """)
    List<Object[]> countByStepAndType(@Param("campaignId") Long campaignId);

    @Query("""
        SELECT COUNT(e) FROM StepEngagementEvent e
        WHERE e.campaignId = :campaignId
        AND e.occurredAt >= :from
        AND e.occurredAt < :to
        """)
    long countBetween(@Param("campaignId") Long campaignId,
                      @Param("from") Instant from,
                      @Param("to") Instant to);

    @Query("""
        SELECT COUNT(DISTINCT e.contactId) FROM StepEngagementEvent e
        WHERE e.campaignId = :campaignId
        AND e.eventType = :eventType
        """)
    long countDistinctContacts(@Param("campaignId") Long campaignId,
                               @Param("eventType") EngagementEventType eventType);
}
