package com.jimin.blog.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * 요청 단위 로그
 *
 * 1. X-Request-ID 헤더(없으면 새 UUID)를 MDC "requestId"에 넣고 응답 헤더로 돌려줌
 * 2. 응답이 끝나면 한 줄 요약 로그:
 *      HTTP GET /api/post responded 200 in 12 ms
 *    - 5xx: ERROR
 *    - 1초 초과: WARN
 *    - 그 외: INFO
 *
 * 컨트롤러가 CompletableFuture를 반환하면 첫 dispatch는 상태 코드 없이 끝나므로
 * async dispatch가 끝난 시점에 로그를 남김
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String MDC_REQUEST_ID = "requestId";
    static final long SLOW_REQUEST_MILLIS = 1000;

    private static final String START_ATTRIBUTE = RequestLoggingFilter.class.getName() + ".start";
    private static final String REQUEST_ID_ATTRIBUTE = RequestLoggingFilter.class.getName() + ".requestId";

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (!isAsyncDispatch(request)) {
            String requestId = request.getHeader(REQUEST_ID_HEADER);
            if (requestId == null || requestId.isBlank()) {
                requestId = UUID.randomUUID().toString();
            }
            request.setAttribute(START_ATTRIBUTE, System.nanoTime());
            request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
            response.setHeader(REQUEST_ID_HEADER, requestId);
        }

        MDC.put(MDC_REQUEST_ID, (String) request.getAttribute(REQUEST_ID_ATTRIBUTE));
        try {
            filterChain.doFilter(request, response);
        } finally {
            if (!isAsyncStarted(request)) {
                logCompletion(request, response);
            }
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private void logCompletion(HttpServletRequest request, HttpServletResponse response) {
        Object start = request.getAttribute(START_ATTRIBUTE);
        long elapsedMillis = start instanceof Long startNanos
                ? TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos)
                : -1;
        int status = response.getStatus();

        String template = "HTTP {} {} responded {} in {} ms";
        if (status >= 500) {
            log.error(template, request.getMethod(), request.getRequestURI(), status, elapsedMillis);
        } else if (elapsedMillis > SLOW_REQUEST_MILLIS) {
            log.warn(template, request.getMethod(), request.getRequestURI(), status, elapsedMillis);
        } else {
            log.info(template, request.getMethod(), request.getRequestURI(), status, elapsedMillis);
        }
    }
}
