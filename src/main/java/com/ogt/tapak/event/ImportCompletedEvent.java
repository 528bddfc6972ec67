package com.ogt.tapak.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportCompletedEvent {
    private UUID jobId;
    private String fileName;
    private String targetTable;
    private int insertedRows;
    private LocalDateTime completedAt;
}
