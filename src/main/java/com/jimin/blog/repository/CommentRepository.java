package com.jimin.blog.repository;

import com.jimin.blog.entity.Comment;

/**
 * CommentRepository - 댓글 저장소 (비동기 CRUD)
 *
 * 구현체: JpaCommentRepository
 */
public interface CommentRepository extends AsyncCrudRepository<Comment> {
}
