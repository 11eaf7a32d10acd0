package com.jimin.blog.controller;

import com.jimin.blog.dto.MessageResponse;
import com.jimin.blog.dto.PostRequest;
import com.jimin.blog.entity.Post;
import com.jimin.blog.exception.ResourceNotFoundException;
import com.jimin.blog.service.PostService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * PostController - 게시글 REST API 엔드포인트
 *
 * 모든 메서드가 CompletableFuture를 반환 → Spring MVC 비동기 처리
 * (DB 조회 동안 요청 스레드를 점유하지 않음)
 *
 * 게시글 조회 응답은 Post Entity를 그대로 반환
 */
@RestController
@RequestMapping("/api/post")
@RequiredArgsConstructor
@Tag(name = "Post", description = "게시글 CRUD API")
public class PostController {

    static final String RESOURCE = "Post";

    private final PostService postService;

    /**
     * GET /api/post
     *
     * @return 전체 게시글 (200 OK)
     */
    @GetMapping
    @Operation(summary = "게시글 목록 조회")
    public CompletableFuture<ResponseEntity<List<Post>>> getPosts() {
        return postService.getPosts()
                .thenApply(ResponseEntity::ok);
    }

    /**
     * GET /api/post/{id}
     *
     * @return 게시글 (200 OK) 또는 404 Not Found
     */
    @GetMapping("/{id}")
    @Operation(summary = "게시글 상세 조회")
    public CompletableFuture<ResponseEntity<Post>> getPostById(@PathVariable UUID id) {
        return postService.getPostById(id)
                .thenApply(post -> post
                        .map(ResponseEntity::ok)
                        .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, id)));
    }

    /**
     * POST /api/post
     *
     * 예시 요청 Body:
     * {
     *   "title": "새 글",
     *   "content": "내용입니다"
     * }
     *
     * @return 200 OK + 메시지, 생성된 id
     */
    @PostMapping
    @Operation(summary = "게시글 작성")
    public CompletableFuture<ResponseEntity<MessageResponse>> addPost(@Valid @RequestBody PostRequest request) {
        return postService.addPost(request)
                .thenApply(post -> ResponseEntity.ok(
                        MessageResponse.created("Post added successfully", post.getId())));
    }

    /**
     * PUT /api/post/{id}
     *
     * @return 200 OK 또는 400 Bad Request (없는 게시글)
     */
    @PutMapping("/{id}")
    @Operation(summary = "게시글 수정")
    public CompletableFuture<ResponseEntity<MessageResponse>> updatePost(
            @PathVariable UUID id,
            @Valid @RequestBody PostRequest request) {
        return postService.updatePost(id, request)
                .thenApply(updated -> updated
                        ? ResponseEntity.ok(MessageResponse.of("Post updated successfully"))
                        : notFound(id));
    }

    /**
     * DELETE /api/post/{id}
     *
     * @return 200 OK 또는 400 Bad Request (없는 게시글)
     */
    @DeleteMapping("/{id}")
    @Operation(summary = "게시글 삭제", description = "댓글은 함께 삭제되지 않습니다")
    public CompletableFuture<ResponseEntity<MessageResponse>> deletePost(@PathVariable UUID id) {
        return postService.deletePost(id)
                .thenApply(deleted -> deleted
                        ? ResponseEntity.ok(MessageResponse.of("Post deleted successfully"))
                        : notFound(id));
    }

    private static ResponseEntity<MessageResponse> notFound(UUID id) {
        return ResponseEntity.badRequest()
                .body(MessageResponse.of(ResourceNotFoundException.notFoundMessage(RESOURCE, id)));
    }
}
