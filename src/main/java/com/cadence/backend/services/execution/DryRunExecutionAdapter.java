package com.cadence.backend.services.execution;

import com.cadence.backend.enums.Channel;
import com.cadence.backend.models.campaign.ScheduledStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Logs the send instead of performing it. Active unless {@code outreach.execution.dry-run=false},
 * in which case real channel adapters must be registered as beans.
 */
@Component
@ConditionalOnProperty(prefix = "outreach.execution", name = "dry-run", havingValue = "true", matchIfMissing = true)
@Slf4j
public class DryRunExecutionAdapter implements ExecutionAdapter {

    @Override
    public Set<Channel> supportedChannels() {
        return EnumSet.allOf(Channel.class);
    }

    @Override
    public ExecutionResult execute(ScheduledStep step) {
        if (step.getContent() != null && step.getContent().contains("{{")) {
            log.warn("DRY RUN: step {} content still has unresolved placeholders", step.getId());
        }
        log.info("DRY RUN: {} to contact {} (campaign {}, step {}): {}",
                step.getChannel().getDisplayName(), step.getContactId(), step.getCampaignId(),
                step.getStepIndex(), step.getSubject() != null ? step.getSubject() : "(no subject)");
        return ExecutionResult.success();
    }
}
