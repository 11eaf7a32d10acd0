package com.jimin.blog.repository;

import com.jimin.blog.entity.Comment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * 댓글 DB 접근 인터페이스 (Spring Data JPA)
 */
public interface CommentJpaRepository extends JpaRepository<Comment, UUID> {
}
