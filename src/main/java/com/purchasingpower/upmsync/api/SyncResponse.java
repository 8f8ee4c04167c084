package com.purchasingpower.upmsync.api;

import com.purchasingpower.upmsync.model.sync.SyncResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Sync endpoint response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResponse {

    private boolean success;
    private String summary;
    private List<SyncResult> results;
    private long durationMs;
    private String error;

    public static SyncResponse of(List<SyncResult> results, String summary, long durationMs) {
        return SyncResponse.builder()
            .success(results.stream().allMatch(SyncResult::isSuccess))
            .summary(summary)
            .results(results)
            .durationMs(durationMs)
            .build();
    }

    public static SyncResponse error(String error) {
        return SyncResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
