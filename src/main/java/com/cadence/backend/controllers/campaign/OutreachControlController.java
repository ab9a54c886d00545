package com.cadence.backend.controllers.campaign;

import com.cadence.backend.dto.campaign.request.ApproveStepRequest;
import com.cadence.backend.dto.campaign.request.RecordEventRequest;
import com.cadence.backend.dto.campaign.request.RejectStepRequest;
import com.cadence.backend.dto.campaign.request.ResetFailedRequest;
import com.cadence.backend.dto.campaign.request.ScheduleStepsRequest;
import com.cadence.backend.dto.campaign.response.ResetResultDto;
import com.cadence.backend.dto.campaign.response.ScheduleStepsResultDto;
import com.cadence.backend.dto.campaign.response.ScheduledStepDto;
import com.cadence.backend.dto.campaign.response.SchedulerPassDto;
import com.cadence.backend.dto.campaign.response.WarmupRescheduleResultDto;
import com.cadence.backend.dto.monitor.CampaignHealthReport;
import com.cadence.backend.dto.monitor.CampaignProgress;
import com.cadence.backend.dto.monitor.InsightReport;
import com.cadence.backend.enums.ErrorCategory;
import com.cadence.backend.models.campaign.StepEngagementEvent;
import com.cadence.backend.services.campaign.ApprovalGateService;
import com.cadence.backend.services.campaign.EngagementEventService;
import com.cadence.backend.services.campaign.OutreachSchedulerService;
import com.cadence.backend.services.campaign.StepRecoveryService;
import com.cadence.backend.services.campaign.StepSchedulingService;
import com.cadence.backend.services.campaign.WarmupRescheduleService;
import com.cadence.backend.services.monitor.CampaignMonitorService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator surface over the outreach engine. Each endpoint is a thin wrapper around one service call.
 */
@RestController
@RequestMapping("/api/outreach")
@RequiredArgsConstructor
@Slf4j
public class OutreachControlController {

    private final StepSchedulingService stepSchedulingService;
    private final OutreachSchedulerService schedulerService;
    private final WarmupRescheduleService warmupRescheduleService;
    private final StepRecoveryService recoveryService;
    private final ApprovalGateService approvalGateService;
    private final EngagementEventService engagementEventService;
    private final CampaignMonitorService monitorService;
    private final Clock clock;

    // =========================
    // SCHEDULING
    // =========================

    @PostMapping("/campaigns/{campaignId}/steps")
    public ResponseEntity<ScheduleStepsResultDto> scheduleSteps(
            @PathVariable Long campaignId,
            @Valid @RequestBody ScheduleStepsRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(stepSchedulingService.scheduleCampaignSteps(campaignId, request));
    }

    @PostMapping("/scheduler/run")
    public ResponseEntity<SchedulerPassDto> runScheduler() {
        log.info("Manual scheduler pass requested");
        return ResponseEntity.ok(schedulerService.runPass(clock.instant()).toDto());
    }

    @PostMapping("/campaigns/{campaignId}/reschedule-warmup")
    public ResponseEntity<WarmupRescheduleResultDto> rescheduleWarmup(@PathVariable Long campaignId) {
        return ResponseEntity.ok(warmupRescheduleService.rescheduleWarmup(campaignId));
    }

    // =========================
    // RECOVERY
    // =========================

    @PostMapping("/campaigns/{campaignId}/reset-failed")
    public ResponseEntity<ResetResultDto> resetCampaignFailed(
            @PathVariable Long campaignId,
            @RequestBody(required = false) ResetFailedRequest request) {
        ErrorCategory category = null;
        List<Long> contactIds = null;
        if (request != null) {
            if (request.getErrorCategory() != null && !request.getErrorCategory().isBlank()) {
                category = ErrorCategory.fromCode(request.getErrorCategory());
            }
            contactIds = request.getContactIds();
        }
        return ResponseEntity.ok(recoveryService.resetFailed(campaignId, category, contactIds));
    }

    @PostMapping("/steps/reset-failed")
    public ResponseEntity<ResetResultDto> resetAllFailed() {
        return ResponseEntity.ok(recoveryService.resetAllFailedAndStale());
    }

    @PostMapping("/steps/reset-stale")
    public ResponseEntity<ResetResultDto> resetStale() {
        return ResponseEntity.ok(recoveryService.resetStaleExecuting());
    }

    // =========================
    // APPROVALS
    // =========================

    @GetMapping("/approvals")
    public ResponseEntity<List<ScheduledStepDto>> listApprovals(@RequestParam Long workspaceId) {
        return ResponseEntity.ok(approvalGateService.listAwaitingApproval(workspaceId).stream()
                .map(ScheduledStepDto::from)
                .toList());
    }

    @PostMapping("/steps/{stepId}/approve")
    public ResponseEntity<ScheduledStepDto> approve(
            @PathVariable Long stepId,
            @Valid @RequestBody ApproveStepRequest request) {
        return ResponseEntity.ok(ScheduledStepDto.from(
                approvalGateService.approve(stepId, request.getApproverId())));
    }

    @PostMapping("/steps/{stepId}/reject")
    public ResponseEntity<ScheduledStepDto> reject(
            @PathVariable Long stepId,
            @Valid @RequestBody RejectStepRequest request) {
        return ResponseEntity.ok(ScheduledStepDto.from(
                approvalGateService.reject(stepId, request.getApproverId(), request.getReason())));
    }

    // =========================
    // ENGAGEMENT & MONITORING
    // =========================

    @PostMapping("/events")
    public ResponseEntity<Map<String, Object>> recordEvent(@Valid @RequestBody RecordEventRequest request) {
        StepEngagementEvent event = engagementEventService.recordEvent(request);

        Map<String, Object> response = new HashMap<>();
        response.put("id", event.getId());
        response.put("eventType", event.getEventType());
        response.put("occurredAt", event.getOccurredAt());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/campaigns/{campaignId}/progress")
    public ResponseEntity<CampaignProgress> getProgress(@PathVariable Long campaignId) {
        return ResponseEntity.ok(monitorService.getProgress(campaignId));
    }

    @GetMapping("/campaigns/{campaignId}/health")
    public ResponseEntity<CampaignHealthReport> getHealth(@PathVariable Long campaignId) {
        return ResponseEntity.ok(monitorService.getHealthReport(campaignId));
    }

    @GetMapping("/campaigns/{campaignId}/insights")
    public ResponseEntity<InsightReport> getInsights(@PathVariable Long campaignId) {
        return ResponseEntity.ok(monitorService.getInsights(campaignId));
    }
}
