package com.jimin.blog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * BlogApplication - 블로그 게시글/댓글 REST API
 *
 * Features:
 * - Post CRUD (/api/post)
 * - Comment CRUD (/api/comment)
 * - Swagger UI (dev 프로필에서만 활성화)
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BlogApplication {

	public static void main(String[] args) {
		SpringApplication.run(BlogApplication.class, args);
	}

}
