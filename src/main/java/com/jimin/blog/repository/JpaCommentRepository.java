package com.jimin.blog.repository;

import com.jimin.blog.config.StorageExecutorConfig;
import com.jimin.blog.entity.Comment;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.concurrent.Executor;

/**
 * JpaCommentRepository - CommentRepository의 JPA 구현체
 *
 * CommentJpaRepository(Spring Data) 호출을 storageExecutor에서 실행
 * getById는 없는 행이면 Optional.empty()로 완료 (예외 아님)
 */
@Repository
public class JpaCommentRepository extends AbstractAsyncJpaRepository<Comment> implements CommentRepository {

    public JpaCommentRepository(CommentJpaRepository commentJpaRepository,
                                @Qualifier(StorageExecutorConfig.STORAGE_EXECUTOR) Executor executor,
                                PlatformTransactionManager transactionManager) {
        super(commentJpaRepository, executor, transactionManager);
    }
}
