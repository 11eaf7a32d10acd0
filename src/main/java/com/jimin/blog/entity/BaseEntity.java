package com.jimin.blog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * 모든 엔티티가 공유하는 식별자 + 감사(audit) 컬럼
 *
 *  - id: 생성 시점에 애플리케이션에서 UUID 발급, 이후 변경 불가
 *  - createdAt: 생성 시각 (UTC), 이후 변경 불가
 *  - updatedAt: 생성 시각으로 시작, 수정할 때마다 갱신
 */
@Getter
@MappedSuperclass
public abstract class BaseEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id = UUID.randomUUID();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // JPA 전용 (조회 시 컬럼 값으로 채워짐)
    protected BaseEntity() {
    }

    /**
     * 새 엔티티 생성: createdAt = updatedAt = now
     * now는 서비스가 주입받은 Clock 기준 (수정 시각과 같은 시계)
     */
    protected BaseEntity(Instant now) {
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * 수정 시각 갱신 (서비스 계층에서 변경 작업마다 호출)
     */
    public void markUpdated(Instant now) {
        this.updatedAt = now;
    }
}
