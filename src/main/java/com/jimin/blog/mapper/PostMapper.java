package com.jimin.blog.mapper;

import com.jimin.blog.dto.PostRequest;
import com.jimin.blog.entity.Post;

import java.time.Instant;

/**
 * PostRequest ↔ Post 변환
 */
public interface PostMapper {

    /**
     * 새 게시글 생성 (id는 엔티티 생성 시 자동 할당, createdAt = updatedAt = now)
     */
    Post toEntity(PostRequest request, Instant now);

    /**
     * 수정 가능한 필드(title, content)만 기존 게시글에 덮어씀
     */
    void applyUpdate(PostRequest request, Post post);
}
