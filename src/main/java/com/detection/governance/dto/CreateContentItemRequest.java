package com.detection.governance.dto;

import com.detection.governance.model.ContentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Registration payload handed over by the content generation pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateContentItemRequest {

    // Optional, generated as {contentType}_{token} when absent
    private String id;

    @NotNull(message = "Content type is required")
    private ContentType contentType;

    @NotBlank(message = "Name is required")
    private String name;

    private String description;
    private String category;
    private String severity;
    private String contentData;
    private String requirements;

    @Builder.Default
    private List<String> dependencies = new ArrayList<>();
}
