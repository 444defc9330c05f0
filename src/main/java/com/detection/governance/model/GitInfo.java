package com.detection.governance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Source-control style state of a content item.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GitInfo {

    public static final String MAIN_BRANCH = "main";
    public static final String FORK_BRANCH = "fork-main";

    private String branch;
    private String commit;          // opaque token, never parsed
    private String author;
    private String message;
    private Integer pullRequest;    // null until a pull request is opened
    private String targetBranch;    // branch the open pull request targets

    @Builder.Default
    private ReviewStatus reviewStatus = ReviewStatus.NONE;

    @Builder.Default
    private MergeStatus mergeStatus = MergeStatus.UNMERGED;

    public GitInfo copy() {
        return toBuilder().build();
    }
}
