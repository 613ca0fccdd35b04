package com.ama.nipreset.security;

import java.io.IOException;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import com.ama.nipreset.config.NipResetProperties;
import com.ama.nipreset.model.dto.ApiMessages;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * OncePerRequestFilter on /api/**. Rejects requests whose declared
 * Content-Length is above the configured limit with 413, and bodies sent
 * without a declared length (chunked) with 411. The container never reads
 * past a declared Content-Length, so every accepted body is within the limit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RequestSizeLimitFilter extends OncePerRequestFilter {

    private static final String API_PATH = "/api/";

    private final NipResetProperties properties;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(API_PATH);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        long maxBytes = properties.getHttp().getMaxBodyBytes();
        long contentLength = request.getContentLengthLong();

        if (contentLength > maxBytes) {
            log.warn("SIZE_FILTER: rejected {} byte body on {}", contentLength, request.getRequestURI());
            reject(response, HttpServletResponse.SC_REQUEST_ENTITY_TOO_LARGE, ApiMessages.PAYLOAD_TOO_LARGE);
            return;
        }

        if (contentLength < 0 && hasBody(request)) {
            log.warn("SIZE_FILTER: rejected body without Content-Length on {}", request.getRequestURI());
            reject(response, HttpServletResponse.SC_LENGTH_REQUIRED, ApiMessages.LENGTH_REQUIRED);
            return;
        }

        filterChain.doFilter(request, response);
    }

    private static boolean hasBody(HttpServletRequest request) {
        return request.getHeader(HttpHeaders.TRANSFER_ENCODING) != null;
    }

    private static void reject(HttpServletResponse response, int status, String message) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write("{\"message\":\"" + message + "\"}");
    }
}
