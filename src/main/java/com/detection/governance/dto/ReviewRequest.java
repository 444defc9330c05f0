package com.detection.governance.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewRequest {

    // "approved" or "changes_requested"
    @NotBlank(message = "Review status is required")
    private String status;

    private String comment;
}
