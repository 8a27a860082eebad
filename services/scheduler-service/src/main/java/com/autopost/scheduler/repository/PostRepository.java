package com.autopost.scheduler.repository;

import com.autopost.scheduler.entity.Post;
import com.autopost.scheduler.entity.PostStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PostRepository extends JpaRepository<Post, UUID> {

    List<Post> findAllByOrderByCreatedAtDesc();

    List<Post> findByStatusOrderByCreatedAtDesc(PostStatus status);

    List<Post> findByAccountIdOrderByCreatedAtDesc(String accountId);

    List<Post> findByAccountIdAndStatusOrderByCreatedAtDesc(String accountId, PostStatus status);

    long countByStatus(PostStatus status);

    @Query("SELECT COUNT(p) FROM Post p WHERE p.accountId = :accountId AND p.status = :status AND p.publishedTime >= :since")
    long countByAccountIdAndStatusSince(@Param("accountId") String accountId,
                                        @Param("status") PostStatus status,
                                        @Param("since") OffsetDateTime since);

    Optional<Post> findFirstByAccountIdAndStatusOrderByPublishedTimeDesc(String accountId, PostStatus status);

    @Query("SELECT DISTINCT p.accountId FROM Post p WHERE p.status IN :statuses")
    List<String> findAccountIdsWithStatusIn(@Param("statuses") List<PostStatus> statuses);
}
