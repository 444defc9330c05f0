package com.detection.governance.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;

@Value
@Builder
@Jacksonized
public class ReviewEntry {
    String reviewer;
    ReviewStatus status;
    String comment;
    LocalDateTime timestamp;
}
