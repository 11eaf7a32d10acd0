package com.jimin.blog.exception;

import com.jimin.blog.dto.ErrorResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.HttpRequestMethodNotSupportedException;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private MockEnvironment environment;
    private GlobalExceptionHandler handler;
    private MockHttpServletRequest request;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment();
        handler = new GlobalExceptionHandler(environment);
        request = new MockHttpServletRequest("GET", "/api/post/123");
    }

    @Test
    void notFoundReturns404WithIdInDetail() {
        UUID id = UUID.randomUUID();

        ResponseEntity<ErrorResponse> response = handler.handleNotFound(new ResourceNotFoundException("Post", id), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_PROBLEM_JSON);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getTitle()).isEqualTo(GlobalExceptionHandler.NOT_FOUND_TITLE);
        assertThat(response.getBody().getDetail()).isEqualTo("Post with id: " + id + " not found");
        assertThat(response.getBody().getInstance()).isEqualTo("/api/post/123");
    }

    @Test
    void unexpectedReturns500WithGenericDetailOutsideDev() {
        ResponseEntity<ErrorResponse> response =
                handler.handleUnexpected(new IllegalStateException("database password: secret123"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_PROBLEM_JSON);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getStatus()).isEqualTo(500);
        assertThat(response.getBody().getTitle()).isEqualTo(GlobalExceptionHandler.UNEXPECTED_TITLE);
        assertThat(response.getBody().getDetail()).isEqualTo(GlobalExceptionHandler.UNEXPECTED_DETAIL);
        assertThat(response.getBody().getDetail()).doesNotContain("secret123");
    }

    @Test
    void unexpectedIncludesFullDescriptionInDev() {
        environment.setActiveProfiles("dev");

        ResponseEntity<ErrorResponse> response =
                handler.handleUnexpected(new IllegalStateException("Bad state"), request);

        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getDetail())
                .contains("java.lang.IllegalStateException: Bad state")
                .contains("at ");
    }

    @Test
    void nullArgumentIsNotTreatedAsNotFound() {
        ResponseEntity<ErrorResponse> response =
                handler.handleUnexpected(new NullPointerException("id"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void frameworkStatusIsKeptForUnsupportedMethod() {
        ResponseEntity<ErrorResponse> response = handler.handleUnexpected(
                new HttpRequestMethodNotSupportedException("PATCH", List.of("GET", "POST")), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
        assertThat(response.getHeaders().getAllow()).containsExactlyInAnyOrder(HttpMethod.GET, HttpMethod.POST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getTitle()).isEqualTo("Method Not Allowed");
    }

    @Test
    void problemBodyHasNoFieldErrorsUnlessValidationFailed() {
        ResponseEntity<ErrorResponse> response =
                handler.handleUnexpected(new RuntimeException("boom"), request);

        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getErrors()).isNull();
    }
}
