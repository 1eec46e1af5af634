package com.rizilab.averroes.bridge.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SystemStatus {
    LifecycleState.Status status;
    String reason;
    boolean ready;
    String agent;
    boolean usingRealAi;
    String chainNetwork;
    Instant since;
}
