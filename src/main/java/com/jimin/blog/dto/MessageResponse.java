package com.jimin.blog.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

/**
 * 쓰기 API의 결과 메시지
 *
 * 예시 응답:
 * {
 *   "message": "Comment added successfully",
 *   "id": "3f1c9a52-8c1e-4d8e-9c43-2a7f0f3c1b11"
 * }
 *
 * id는 새로 생성된 리소스가 있을 때만 포함
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageResponse(String message, UUID id) {

    public static MessageResponse of(String message) {
        return new MessageResponse(message, null);
    }

    public static MessageResponse created(String message, UUID id) {
        return new MessageResponse(message, id);
    }
}
