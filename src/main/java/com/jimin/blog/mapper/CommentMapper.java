package com.jimin.blog.mapper;

import com.jimin.blog.dto.CommentRequest;
import com.jimin.blog.dto.CommentResponse;
import com.jimin.blog.entity.Comment;

import java.time.Instant;

/**
 * CommentRequest → Comment, Comment → CommentResponse 변환
 */
public interface CommentMapper {

    /**
     * 요청의 content, postId만 복사한 새 댓글
     * author는 비어 있음 → Service가 호출자 정보로 채움
     * createdAt = updatedAt = now
     */
    Comment toEntity(CommentRequest request, Instant now);

    /**
     * 수정 시 content만 덮어씀 (postId는 생성 후 변경 불가)
     */
    void applyUpdate(CommentRequest request, Comment comment);

    CommentResponse toResponse(Comment comment);
}
