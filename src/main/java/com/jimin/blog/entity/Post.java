package com.jimin.blog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Post Entity - 게시글 테이블과 매핑
 *
 * DB 테이블: posts
 * 컬럼:
 *  - id, created_at, updated_at: BaseEntity
 *  - title: 제목 (필수, 기본값 "")
 *  - content: 내용 (TEXT 타입, 기본값 "")
 *
 * 댓글과의 연관관계는 매핑하지 않음 (Comment가 postId 값만 보관, cascade 없음)
 */
@Entity
@Table(name = "posts")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)  // Lombok: JPA용 기본 생성자
public class Post extends BaseEntity {

    @Column(nullable = false)
    private String title = "";

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content = "";

    public Post(Instant createdAt) {
        super(createdAt);
    }
}
