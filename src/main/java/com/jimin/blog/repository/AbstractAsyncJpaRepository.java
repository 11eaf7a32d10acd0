package com.jimin.blog.repository;

import com.jimin.blog.entity.BaseEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Spring Data JpaRepository 호출을 저장소 Executor에서 실행하는 공통 구현
 *
 * 저장소 스레드에서는 @Transactional 프록시가 닿지 않으므로 TransactionTemplate으로 경계를 직접 잡음
 *  - 읽기(getAll, getById): readOnly 트랜잭션
 *  - update / delete: 존재 확인과 쓰기를 한 트랜잭션에서 실행
 *  - updateById / deleteById: 조회 → 변경 → flush까지 한 트랜잭션 (서비스의 수정/삭제 경로)
 *
 * id가 생성 시점에 할당되므로 save()는 merge로 동작 → 없는 행에 save하면 INSERT가 됨.
 * 그래서 update는 existsById로 먼저 확인함.
 */
public abstract class AbstractAsyncJpaRepository<T extends BaseEntity> implements AsyncCrudRepository<T> {

    private final JpaRepository<T, UUID> jpaRepository;
    private final Executor executor;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTransactionTemplate;

    protected AbstractAsyncJpaRepository(JpaRepository<T, UUID> jpaRepository,
                                         Executor executor,
                                         PlatformTransactionManager transactionManager) {
        this.jpaRepository = jpaRepository;
        this.executor = executor;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTransactionTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTransactionTemplate.setReadOnly(true);
    }

    @Override
    public CompletableFuture<List<T>> getAll() {
        return CompletableFuture.supplyAsync(
                () -> readOnlyTransactionTemplate.execute(status -> jpaRepository.findAll()), executor);
    }

    @Override
    public CompletableFuture<Optional<T>> getById(UUID id) {
        return CompletableFuture.supplyAsync(
                () -> readOnlyTransactionTemplate.execute(status -> jpaRepository.findById(id)), executor);
    }

    @Override
    public CompletableFuture<T> add(T entity) {
        return CompletableFuture.supplyAsync(() -> jpaRepository.save(entity), executor);
    }

    @Override
    public CompletableFuture<T> update(T entity) {
        return CompletableFuture.supplyAsync(() -> transactionTemplate.execute(status -> {
            if (!jpaRepository.existsById(entity.getId())) {
                return entity;
            }
            return jpaRepository.save(entity);
        }), executor);
    }

    @Override
    public CompletableFuture<Void> delete(T entity) {
        return CompletableFuture.runAsync(() -> jpaRepository.delete(entity), executor);
    }

    @Override
    public CompletableFuture<Boolean> updateById(UUID id, Consumer<T> changes) {
        return CompletableFuture.supplyAsync(() -> transactionTemplate.execute(status -> {
            Optional<T> found = jpaRepository.findById(id);
            if (found.isEmpty()) {
                return false;
            }

            // 영속 상태 엔티티 → 커밋 시 dirty checking으로 UPDATE
            changes.accept(found.get());
            jpaRepository.flush();
            return true;
        }), executor);
    }

    @Override
    public CompletableFuture<Boolean> deleteById(UUID id) {
        return CompletableFuture.supplyAsync(() -> transactionTemplate.execute(status -> {
            Optional<T> found = jpaRepository.findById(id);
            if (found.isEmpty()) {
                return false;
            }

            jpaRepository.delete(found.get());
            jpaRepository.flush();
            return true;
        }), executor);
    }
}
