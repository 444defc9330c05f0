package com.detection.governance.repository;

import com.detection.governance.model.ContentItem;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ContentItemRepository extends MongoRepository<ContentItem, String> {

    List<ContentItem> findAllByOrderByCreatedAtDesc();

    @Query(value = "{ 'gitInfo.pullRequest': { $ne: null } }", sort = "{ 'gitInfo.pullRequest': -1 }")
    List<ContentItem> findWithPullRequestOrderByPullRequestDesc();
}
