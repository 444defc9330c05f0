package com.detection.governance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * MongoDB document for one generated detection artifact tracked by the governance engine.
 *
 * Branching and forking never mutate an item into another; they create a new document
 * with its own id. The graph fields ({@code dependencies}, {@code dependents}, {@code forks},
 * {@code originalId}) are kept mutually consistent by the dependency graph manager.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "content_items")
public class ContentItem {

    @Id
    private String id;

    @Indexed
    private ContentType contentType;

    private String name;
    private String description;
    private String category;
    private String severity;

    // Opaque payload from the templating collaborator, never inspected here
    private String contentData;
    private String requirements;

    @Indexed
    private ContentStatus status;

    private int version;

    @Builder.Default
    private DdlcMetadata metadata = new DdlcMetadata();

    @Builder.Default
    private GitInfo gitInfo = new GitInfo();

    @Builder.Default
    private Collaboration collaboration = new Collaboration();

    @Builder.Default
    private Set<String> dependencies = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> dependents = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> forks = new LinkedHashSet<>();

    private String originalId;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public DdlcPhase currentPhase() {
        return metadata.getDdlcPhase();
    }

    /**
     * Deep copy: no collection or nested object is shared with this instance.
     */
    public ContentItem copy() {
        return toBuilder()
                .metadata(metadata.copy())
                .gitInfo(gitInfo.copy())
                .collaboration(collaboration.copy())
                .dependencies(new LinkedHashSet<>(dependencies))
                .dependents(new LinkedHashSet<>(dependents))
                .forks(new LinkedHashSet<>(forks))
                .build();
    }
}
