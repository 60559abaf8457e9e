package com.example.knowledgesync.dto;

import com.example.knowledgesync.entity.SourceType;
import lombok.Builder;
import lombok.Value;

/**
 * One candidate item produced by a source adapter.
 *
 * updatedAt is the raw remote last-modified timestamp. Jira reports it with an offset,
 * older tracker rows may hold naive values; ChangeDetector reconciles both.
 */
@Value
@Builder
public class SyncItem {

    String id;
    SourceType type;
    String updatedAt;
    String content;
}
