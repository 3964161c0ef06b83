package com.visionai.gateway.events;

import com.visionai.gateway.core.bus.TransportStatus;

import java.util.List;

public record ManagerStatus(boolean initialized, int channelCount, List<String> channels,
                            TransportStatus eventBusStatus) {

    public ManagerStatus {
        channels = List.copyOf(channels);
    }
}
