package com.example.courier.realtime.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.OffsetDateTime;
import java.util.Map;

@Getter
@Builder
@ToString
public class ConnectionStats {
    private final String instanceId;
    private final int totalConnections;
    private final int totalUsers;
    private final Map<String, Integer> connectionsByRole;
    private final int totalDeliverySubscriptions;
    private final int totalPackageSubscriptions;
    private final OffsetDateTime timestamp;
}
