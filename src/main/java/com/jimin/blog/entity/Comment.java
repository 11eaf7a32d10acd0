package com.jimin.blog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Comment Entity - 댓글 테이블과 매핑
 *
 * DB 테이블: comments
 * 관계: postId 값으로만 게시글을 참조 (FK 제약, 존재 여부 검증 없음)
 */
@Entity
@Table(name = "comments")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)  // Lombok: JPA용 기본 생성자
public class Comment extends BaseEntity {

    @Column(name = "post_id", nullable = false)
    private UUID postId;

    // 요청 Body가 아니라 Service가 호출자 정보로 채움
    @Column(nullable = false)
    private String author = "";

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content = "";

    public Comment(Instant createdAt) {
        super(createdAt);
    }
}
