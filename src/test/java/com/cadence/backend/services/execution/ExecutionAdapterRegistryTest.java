package com.cadence.backend.services.execution;

import com.cadence.backend.enums.Channel;
import com.cadence.backend.models.campaign.ScheduledStep;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ExecutionAdapterRegistryTest {

    @Test
    void forChannel_ShouldRouteToRegisteredAdapter() {
        ExecutionAdapter email = new FixedAdapter(EnumSet.of(Channel.EMAIL));
        ExecutionAdapter linkedIn = new FixedAdapter(EnumSet.of(Channel.LINKEDIN_CONNECTION, Channel.LINKEDIN_MESSAGE));

        ExecutionAdapterRegistry registry = new ExecutionAdapterRegistry(List.of(email, linkedIn));

        assertThat(registry.forChannel(Channel.EMAIL)).containsSame(email);
        assertThat(registry.forChannel(Channel.LINKEDIN_MESSAGE)).containsSame(linkedIn);
        assertThat(registry.forChannel(Channel.PHONE)).isEmpty();
    }

    @Test
    void constructor_ShouldRejectTwoAdaptersForOneChannel() {
        List<ExecutionAdapter> adapters = List.of(
                new FixedAdapter(EnumSet.of(Channel.SMS)), new FixedAdapter(EnumSet.of(Channel.SMS, Channel.EMAIL)));

        assertThatThrownBy(() -> new ExecutionAdapterRegistry(adapters))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SMS");
    }

    @Test
    void dryRunAdapter_ShouldCoverEveryChannelAndSucceed() {
        DryRunExecutionAdapter dryRun = new DryRunExecutionAdapter();
        ExecutionAdapterRegistry registry = new ExecutionAdapterRegistry(List.of(dryRun));

        for (Channel channel : Channel.values()) {
            assertThat(registry.forChannel(channel)).containsSame(dryRun);
        }
        ExecutionResult result = dryRun.execute(ScheduledStep.builder()
                .id(1L).campaignId(2L).contactId(3L).stepIndex(0)
                .channel(Channel.EMAIL).subject("Hi {{firstName}}").content("Hello {{firstName}}")
                .build());
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getErrorCategory()).isNull();
    }

    private static class FixedAdapter implements ExecutionAdapter {
        private final Set<Channel> channels;

        FixedAdapter(Set<Channel> channels) {
            this.channels = channels;
        }

        @Override
        public Set<Channel> supportedChannels() {
            return channels;
        }

        @Override
        public ExecutionResult execute(ScheduledStep step) {
            return ExecutionResult.success();
        }
    }
}
