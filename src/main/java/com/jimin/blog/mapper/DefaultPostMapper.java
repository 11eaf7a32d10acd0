package com.jimin.blog.mapper;

import com.jimin.blog.dto.PostRequest;
import com.jimin.blog.entity.Post;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;

/**
 * DefaultPostMapper - 필드 단위로 직접 복사하는 PostMapper 구현
 *
 * 리플렉션 기반 매핑 라이브러리 없이 title, content 두 필드만 다룸
 */
@Component
public class DefaultPostMapper implements PostMapper {

    @Override
    public Post toEntity(PostRequest request, Instant now) {
        Post post = new Post(now);
        applyUpdate(request, post);
        return post;
    }

    @Override
    public void applyUpdate(PostRequest request, Post post) {
        // title, content 모두 NOT NULL 컬럼 → null은 ""로 저장
        post.setTitle(Objects.requireNonNullElse(request.title(), ""));
        post.setContent(Objects.requireNonNullElse(request.content(), ""));
    }
}
