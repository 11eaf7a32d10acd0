package com.jimin.blog.service;

import com.jimin.blog.dto.CommentRequest;
import com.jimin.blog.dto.CommentResponse;
import com.jimin.blog.entity.Comment;
import com.jimin.blog.mapper.CommentMapper;
import com.jimin.blog.repository.CommentRepository;
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
 * CommentService - 댓글 비즈니스 로직 처리
 *
 * 외부로는 Entity 대신 CommentResponse만 반환
 * author는 요청 Body가 아니라 Controller가 넘겨준 호출자 정보로만 설정
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommentService {

    private final CommentRepository commentRepository;
    private final CommentMapper commentMapper;
    private final Clock clock;

    public CompletableFuture<List<CommentResponse>> getComments() {
        log.info("Retrieving all comments");
        return commentRepository.getAll()
                .thenApply(comments -> {
                    log.debug("Retrieved {} comments", comments.size());
                    return comments.stream()
                            .map(commentMapper::toResponse)
                            .toList();
                });
    }

    public CompletableFuture<Optional<CommentResponse>> getCommentById(UUID id) {
        log.info("Retrieving comment with ID: {}", id);
        return commentRepository.getById(id)
                .thenApply(comment -> {
                    if (comment.isEmpty()) {
                        log.warn("Comment with ID: {} not found", id);
                    }
                    return comment.map(commentMapper::toResponse);
                });
    }

    /**
     * 댓글 작성
     *
     * @param author 호출자 이름 (인증 정보 또는 익명 기본값)
     * @return 저장된 댓글 (새 id 포함)
     */
    public CompletableFuture<CommentResponse> addComment(CommentRequest request, String author) {
        log.info("Adding new comment by author: {} to post: {}", author, request.postId());

        Comment comment = commentMapper.toEntity(request, Instant.now(clock));
        comment.setAuthor(author);

        return commentRepository.add(comment)
                .thenApply(saved -> {
                    log.info("Successfully added comment with ID: {}", saved.getId());
                    return commentMapper.toResponse(saved);
                });
    }

    /**
     * 댓글 수정 (content만 변경, postId는 유지)
     *
     * @return 없는 ID면 false (아무것도 변경하지 않음)
     */
    public CompletableFuture<Boolean> updateComment(UUID id, CommentRequest request) {
        log.info("Updating comment with ID: {}", id);
        Instant now = Instant.now(clock);

        return commentRepository.updateById(id, comment -> {
                    commentMapper.applyUpdate(request, comment);
                    comment.markUpdated(now);
                })
                .thenApply(updated -> {
                    if (updated) {
                        log.info("Successfully updated comment with ID: {}", id);
                    } else {
                        log.warn("Comment with ID: {} not found for update", id);
                    }
                    return updated;
                });
    }

    /**
     * 댓글 삭제
     *
     * @return 없는 ID면 false
     */
    public CompletableFuture<Boolean> deleteComment(UUID id) {
        log.info("Deleting comment with ID: {}", id);
        return commentRepository.deleteById(id)
                .thenApply(deleted -> {
                    if (deleted) {
                        log.info("Successfully deleted comment with ID: {}", id);
                    } else {
                        log.warn("Comment with ID: {} not found for deletion", id);
                    }
                    return deleted;
                });
    }
}
