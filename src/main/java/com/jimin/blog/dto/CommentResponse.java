package com.jimin.blog.dto;

import java.time.Instant;
import java.util.UUID;

/**
 * 댓글 응답 DTO
 *
 * updatedAt은 응답에 포함하지 않음
 * Comment → CommentResponse 변환은 CommentMapper가 담당
 */
public record CommentResponse(
        UUID id,
        UUID postId,
        String author,
        String content,
        Instant createdAt
) {
}
