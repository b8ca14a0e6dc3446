package com.commerce.sync.service.batch;

import com.commerce.sync.domain.Platform;
import com.commerce.sync.domain.ResourceKey;
import lombok.Value;

import java.time.Instant;

@Value
public class ItemFailure {

    ResourceKey resourceKey;
    Platform platform;
    String message;
    Instant occurredAt;
}
