package com.jimin.blog.repository;

import com.jimin.blog.entity.BaseEntity;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * 엔티티 단위 비동기 CRUD 계약
 *
 * 모든 메서드는 DB 왕복이 끝나면 완료되는 CompletableFuture를 반환
 *  - 변경 작업(add, update, delete)은 호출마다 즉시 커밋
 *  - 이미 삭제된 엔티티의 update/delete도 예외를 던지지 않음 (삭제된 행을 되살리지도 않음)
 *  - DB 오류는 future를 예외로 완료시킴
 *
 * updateById/deleteById: 조회 → 변경 → 저장을 하나의 트랜잭션(작업 단위)으로 실행
 */
public interface AsyncCrudRepository<T extends BaseEntity> {

    CompletableFuture<List<T>> getAll();

    /**
     * @return 일치하는 행이 없으면 Optional.empty()로 완료
     */
    CompletableFuture<Optional<T>> getById(UUID id);

    CompletableFuture<T> add(T entity);

    /**
     * 행이 이미 삭제됐으면 아무것도 하지 않고 entity를 그대로 돌려줌
     */
    CompletableFuture<T> update(T entity);

    CompletableFuture<Void> delete(T entity);

    /**
     * 같은 트랜잭션 안에서 조회한 엔티티에 changes를 적용하고 저장
     *
     * @return 없는 ID면 false (changes는 호출되지 않음)
     */
    CompletableFuture<Boolean> updateById(UUID id, Consumer<T> changes);

    /**
     * 같은 트랜잭션 안에서 조회 후 삭제
     *
     * @return 없는 ID면 false
     */
    CompletableFuture<Boolean> deleteById(UUID id);
}
