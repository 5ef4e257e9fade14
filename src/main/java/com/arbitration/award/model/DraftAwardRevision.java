package com.arbitration.award.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Immutable snapshot of a draft's content at a version. Never updated once written.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Versioned snapshot of a draft award")
public class DraftAwardRevision {
    private String id;
    private String draftAwardId;
    private int version;
    private AwardContent content;
    private ChangeType changeType;
    private String changeSummary;
    private List<String> changedFields;
    private String authorId;
    private long createdAt;
}
