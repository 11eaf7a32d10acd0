package com.jimin.blog.service;

import com.jimin.blog.dto.PostRequest;
import com.jimin.blog.entity.Post;
import com.jimin.blog.mapper.PostMapper;
import com.jimin.blog.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * PostService - 게시글 비즈니스 로직 처리
 *
 * 거의 Repository 위임이고, 서비스에서 하는 일은 두 가지:
 *  1. PostRequest → Post 변환 (PostMapper)
 *  2. 수정 시 updatedAt 갱신
 *
 * 없는 게시글은 예외가 아니라 Optional.empty() / false로 알림
 * DB 예외는 잡지 않고 그대로 전파 → GlobalExceptionHandler
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PostService {

    private final PostRepository postRepository;
    private final PostMapper postMapper;
    private final Clock clock;

    public CompletableFuture<List<Post>> getPosts() {
        log.info("Retrieving all posts");
        return postRepository.getAll()
                .thenApply(posts -> {
                    log.debug("Retrieved {} posts", posts.size());
                    return posts;
                });
    }

    public CompletableFuture<Optional<Post>> getPostById(UUID id) {
        log.info("Retrieving post with ID: {}", id);
        return postRepository.getById(id)
                .thenApply(post -> {
                    if (post.isEmpty()) {
                        log.warn("Post with ID: {} not found", id);
                    }
                    return post;
                });
    }

    /**
     * 게시글 작성
     *
     * @return 저장된 게시글 (id 포함)
     */
    public CompletableFuture<Post> addPost(PostRequest request) {
        Post post = postMapper.toEntity(request, Instant.now(clock));
        log.info("Adding new post with ID: {}", post.getId());
        return postRepository.add(post);
    }

    /**
     * 게시글 수정 (title, content 전체 교체)
     *
     * @return 없는 ID면 false (아무것도 변경하지 않음)
     */
    public CompletableFuture<Boolean> updatePost(UUID id, PostRequest request) {
        log.info("Updating post with ID: {}", id);
        Instant now = Instant.now(clock);

        // 조회 → 덮어쓰기 → 저장이 한 트랜잭션: 그 사이 삭제된 글을 다시 INSERT하지 않음
        return postRepository.updateById(id, post -> {
                    postMapper.applyUpdate(request, post);
                    post.markUpdated(now);
                })
                .thenApply(updated -> {
                    if (updated) {
                        log.info("Successfully updated post with ID: {}", id);
                    } else {
                        log.warn("Post with ID: {} not found for update", id);
                    }
                    return updated;
                });
    }

    /**
     * 게시글 삭제 (댓글은 함께 삭제하지 않음)
     *
     * @return 없는 ID면 false
     */
    public CompletableFuture<Boolean> deletePost(UUID id) {
        log.info("Deleting post with ID: {}", id);
        return postRepository.deleteById(id)
                .thenApply(deleted -> {
                    if (deleted) {
                        log.info("Successfully deleted post with ID: {}", id);
                    } else {
                        log.warn("Post with ID: {} not found for deletion", id);
                    }
                    return deleted;
                });
    }
}
