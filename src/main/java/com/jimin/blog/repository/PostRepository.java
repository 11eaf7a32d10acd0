package com.jimin.blog.repository;

import com.jimin.blog.entity.Post;

/**
 * PostRepository - 게시글 저장소 (비동기 CRUD)
 *
 * 구현체: JpaPostRepository
 */
public interface PostRepository extends AsyncCrudRepository<Post> {
}
