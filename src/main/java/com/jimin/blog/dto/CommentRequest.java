package com.jimin.blog.dto;

import com.jimin.blog.validation.NonNilUuid;
import com.jimin.blog.validation.TrimmedLength;
import jakarta.validation.constraints.NotBlank;

import java.util.UUID;

/**
 * 댓글 작성/수정 요청 DTO
 *
 * author, id, createdAt 필드가 없음 → 클라이언트가 보내도 Jackson이 무시
 * 수정(PUT) 시 postId는 검증만 하고 반영하지 않음 (content만 변경)
 */
public record CommentRequest(

        @NotBlank(message = "Comment content is required.")
        @TrimmedLength(min = 5, max = 500,
                minMessage = "Comment content too short.",
                maxMessage = "Comment limit exceeded.")
        String content,

        @NonNilUuid(message = "PostId is required and cannot be an empty UUID.")
        UUID postId
) {
}
