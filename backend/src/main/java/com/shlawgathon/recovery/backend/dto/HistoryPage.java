package com.shlawgathon.recovery.backend.dto;

import com.shlawgathon.recovery.backend.model.RecoveryHistoryEntry;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of recovery history, newest first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Page of recovery history")
public class HistoryPage {

    private List<RecoveryHistoryEntry> items;

    private long total;

    private int limit;
    private int offset;
}
