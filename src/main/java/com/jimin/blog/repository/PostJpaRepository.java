package com.jimin.blog.repository;

import com.jimin.blog.entity.Post;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * 게시글 DB 접근 인터페이스 (Spring Data JPA)
 *
 * JpaRepository<Post, UUID>를 상속받으면:
 *  - findAll(), findById(id), save(post), delete(post) 자동 제공
 *
 * 직접 사용하지 않고 JpaPostRepository를 통해 비동기로 호출
 */
public interface PostJpaRepository extends JpaRepository<Post, UUID> {
}
