package com.commerce.sync.service.batch;

import com.commerce.sync.domain.Platform;
import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.domain.SyncOperation;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One pending write: set {@code operation}'s field of {@code resourceKey} on {@code platform}
 * to {@code newValue}.
 */
@Value
@Builder(toBuilder = true)
public class BatchItem {

    @NonNull ResourceKey resourceKey;
    @NonNull Platform platform;
    @NonNull SyncOperation operation;
    @NonNull BigDecimal newValue;

    /**
     * Value last observed on the platform, if known. An item whose new value equals it is skipped.
     */
    BigDecimal currentValue;

    String reason;

    public boolean isNoOp() {
        return currentValue != null && currentValue.compareTo(newValue) == 0;
    }
}
