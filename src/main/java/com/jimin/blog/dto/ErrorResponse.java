package com.jimin.blog.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * ErrorResponse - 표준화된 에러 응답 DTO
 *
 * RFC 7807 (Problem Details for HTTP APIs) 스타일
 * Content-Type: application/problem+json
 *
 * 예시 응답:
 * {
 *   "status": 404,
 *   "title": "Resource Not Found",
 *   "detail": "Post with id: 5b0c... not found",
 *   "instance": "/api/post/5b0c..."
 * }
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * HTTP 상태 코드 (404, 400, 500 등)
     */
    private int status;

    /**
     * 에러 종류별 고정 제목
     */
    private String title;

    /**
     * 상세 설명 (500은 dev 프로필에서만 예외 전체 내용)
     */
    private String detail;

    /**
     * 에러가 발생한 요청 경로
     */
    private String instance;

    /**
     * 필드별 검증 에러 (검증 실패 시에만 포함)
     */
    private Map<String, List<String>> errors;

    public ErrorResponse(int status, String title, String detail, String instance) {
        this(status, title, detail, instance, null);
    }
}
