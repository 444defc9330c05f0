package com.detection.governance.store;

import com.detection.governance.model.ContentItem;
import com.detection.governance.model.ContentStatus;
import com.detection.governance.model.ContentType;
import com.detection.governance.model.DdlcPhase;
import com.detection.governance.model.ReviewStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional listing criteria; null fields match everything.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentItemFilter {

    private ContentType contentType;
    private ContentStatus status;
    private String category;
    private String severity;
    private DdlcPhase ddlcPhase;
    private String branch;
    private ReviewStatus reviewStatus;

    public static ContentItemFilter all() {
        return new ContentItemFilter();
    }

    public boolean matches(ContentItem item) {
        return (contentType == null || contentType == item.getContentType())
                && (status == null || status == item.getStatus())
                && (category == null || category.equalsIgnoreCase(item.getCategory()))
                && (severity == null || severity.equalsIgnoreCase(item.getSeverity()))
                && (ddlcPhase == null || ddlcPhase == item.currentPhase())
                && (branch == null || branch.equals(item.getGitInfo().getBranch()))
                && (reviewStatus == null || reviewStatus == item.getGitInfo().getReviewStatus());
    }
}
