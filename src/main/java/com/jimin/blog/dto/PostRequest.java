package com.jimin.blog.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 게시글 작성/수정 요청 DTO
 *
 * Entity(Post)를 직접 받지 않음 → id, createdAt, updatedAt은 요청으로 조작 불가
 * 수정(PUT)은 전체 교체: title, content 모두 덮어씀
 */
public record PostRequest(

        @NotBlank(message = "Title is required.")
        @Size(max = 200, message = "Title must be at most 200 characters.")
        String title,

        // content는 검증 없음 → null이면 ""로 저장
        String content
) {
}
