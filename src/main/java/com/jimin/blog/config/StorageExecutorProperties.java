package com.jimin.blog.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 저장소(DB) 호출 전용 스레드 풀 설정
 *
 * application.properties:
 *   blog.storage.core-pool-size=4
 *   blog.storage.max-pool-size=16
 *   blog.storage.queue-capacity=200
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "blog.storage")
public class StorageExecutorProperties {

    private int corePoolSize = 4;

    private int maxPoolSize = 16;

    private int queueCapacity = 200;

    private int keepAliveSeconds = 60;

    private String threadNamePrefix = "storage-";
}
