package com.cadence.backend.services.execution;

import com.cadence.backend.enums.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class ExecutionAdapterRegistry {

    private final Map<Channel, ExecutionAdapter> adapters = new EnumMap<>(Channel.class);

    public ExecutionAdapterRegistry(List<ExecutionAdapter> registered) {
        for (ExecutionAdapter adapter : registered) {
            for (Channel channel : adapter.supportedChannels()) {
                ExecutionAdapter existing = adapters.putIfAbsent(channel, adapter);
                if (existing != null) {
                    throw new IllegalStateException(String.format(
                            "Channel %s is claimed by both %s and %s", channel,
                            existing.getClass().getSimpleName(), adapter.getClass().getSimpleName()));
                }
            }
        }
        log.info("Execution adapters registered for channels {}", adapters.keySet());
    }

    public Optional<ExecutionAdapter> forChannel(Channel channel) {
        return Optional.ofNullable(adapters.get(channel));
    }
}
