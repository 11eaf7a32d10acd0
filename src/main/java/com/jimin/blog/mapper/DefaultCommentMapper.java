package com.jimin.blog.mapper;

import com.jimin.blog.dto.CommentRequest;
import com.jimin.blog.dto.CommentResponse;
import com.jimin.blog.entity.Comment;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * DefaultCommentMapper - 필드 단위로 직접 복사하는 CommentMapper 구현
 *
 * 요청 → 엔티티: content, postId만 (id, 시각, author는 요청에서 받지 않음)
 * 엔티티 → 응답: updatedAt을 제외한 조회용 필드
 */
@Component
public class DefaultCommentMapper implements CommentMapper {

    @Override
    public Comment toEntity(CommentRequest request, Instant now) {
        Comment comment = new Comment(now);
        comment.setPostId(request.postId());
        comment.setContent(request.content());
        return comment;
    }

    @Override
    public void applyUpdate(CommentRequest request, Comment comment) {
        comment.setContent(request.content());
    }

    @Override
    public CommentResponse toResponse(Comment comment) {
        return new CommentResponse(
                comment.getId(),
                comment.getPostId(),
                comment.getAuthor(),
                comment.getContent(),
                comment.getCreatedAt()
        );
    }
}
