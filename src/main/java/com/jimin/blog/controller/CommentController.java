package com.jimin.blog.controller;

import com.jimin.blog.dto.CommentRequest;
import com.jimin.blog.dto.CommentResponse;
import com.jimin.blog.dto.MessageResponse;
import com.jimin.blog.exception.ResourceNotFoundException;
import com.jimin.blog.service.CommentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.security.Principal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * CommentController - 댓글 REST API 엔드포인트
 *
 * 없는 댓글은 ResourceNotFoundException → GlobalExceptionHandler가 404로 변환
 */
@RestController
@RequestMapping("/api/comment")
@Tag(name = "Comment", description = "댓글 CRUD API")
public class CommentController {

    static final String RESOURCE = "Comment";

    private final CommentService commentService;
    private final String anonymousAuthor;

    public CommentController(CommentService commentService,
                             @Value("${blog.comment.anonymous-author:Anonymous/System User}") String anonymousAuthor) {
        this.commentService = commentService;
        this.anonymousAuthor = anonymousAuthor;
    }

    @GetMapping
    @Operation(summary = "댓글 목록 조회")
    public CompletableFuture<ResponseEntity<List<CommentResponse>>> getComments() {
        return commentService.getComments()
                .thenApply(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    @Operation(summary = "댓글 상세 조회")
    public CompletableFuture<ResponseEntity<CommentResponse>> getCommentById(@PathVariable UUID id) {
        return commentService.getCommentById(id)
                .thenApply(comment -> comment
                        .map(ResponseEntity::ok)
                        .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, id)));
    }

    /**
     * POST /api/comment
     *
     * 예시 요청 Body:
     * {
     *   "content": "Nice post!",
     *   "postId": "5b0c7a1e-3f0e-4c35-a0a4-6f8f3b1d2c9e"
     * }
     *
     * 작성자는 Body가 아니라 인증 정보에서 가져옴 (인증 미구현 → 익명 기본값)
     *
     * @return 201 Created + Location 헤더 + 메시지, 생성된 id
     */
    @PostMapping
    @Operation(summary = "댓글 작성")
    public CompletableFuture<ResponseEntity<MessageResponse>> addComment(
            @Valid @RequestBody CommentRequest request,
            @Parameter(hidden = true) Principal principal,
            @Parameter(hidden = true) UriComponentsBuilder uriBuilder) {
        String author = resolveAuthor(principal);

        return commentService.addComment(request, author)
                .thenApply(created -> {
                    URI location = uriBuilder.path("/api/comment/{id}")
                            .buildAndExpand(created.id())
                            .toUri();
                    return ResponseEntity.created(location)
                            .body(MessageResponse.created("Comment added successfully", created.id()));
                });
    }

    /**
     * PUT /api/comment/{id}
     *
     * content만 수정됨 (postId는 변경되지 않음)
     */
    @PutMapping("/{id}")
    @Operation(summary = "댓글 수정")
    public CompletableFuture<ResponseEntity<MessageResponse>> updateComment(
            @PathVariable UUID id,
            @Valid @RequestBody CommentRequest request) {
        return commentService.updateComment(id, request)
                .thenApply(updated -> {
                    if (!updated) {
                        throw new ResourceNotFoundException(RESOURCE, id);
                    }
                    return ResponseEntity.ok(MessageResponse.of("Comment updated successfully"));
                });
    }

    /**
     * DELETE /api/comment/{id}
     *
     * @return 204 No Content 또는 404 Not Found
     */
    @DeleteMapping("/{id}")
    @Operation(summary = "댓글 삭제")
    public CompletableFuture<ResponseEntity<Void>> deleteComment(@PathVariable UUID id) {
        return commentService.deleteComment(id)
                .thenApply(deleted -> {
                    if (!deleted) {
                        throw new ResourceNotFoundException(RESOURCE, id);
                    }
                    return ResponseEntity.noContent().<Void>build();
                });
    }

    private String resolveAuthor(Principal principal) {
        if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
            return anonymousAuthor;
        }
        return principal.getName();
    }
}
