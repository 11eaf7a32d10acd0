package com.jimin.blog.repository;

import com.jimin.blog.config.StorageExecutorConfig;
import com.jimin.blog.entity.Post;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.concurrent.Executor;

/**
 * JpaPostRepository - PostRepository의 JPA 구현체
 *
 * 실제 SQL은 PostJpaRepository(Spring Data)가 만들고,
 * 여기서는 그 호출을 storageExecutor 스레드 + 트랜잭션으로 감싸기만 함
 */
@Repository
public class JpaPostRepository extends AbstractAsyncJpaRepository<Post> implements PostRepository {

    public JpaPostRepository(PostJpaRepository postJpaRepository,
                             @Qualifier(StorageExecutorConfig.STORAGE_EXECUTOR) Executor executor,
                             PlatformTransactionManager transactionManager) {
        super(postJpaRepository, executor, transactionManager);
    }
}
