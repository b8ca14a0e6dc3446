package com.commerce.sync.dto;

import com.commerce.sync.domain.SyncOperation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Manual run trigger. An empty key list means every active catalog resource.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRunRequest {

    private SyncOperation operation;
    private List<String> resourceKeys;
}
