package com.wabridge.apiwhatsapp.api;

import com.wabridge.apiwhatsapp.config.BridgeProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Protects the bridge endpoints with the shared {@code X-API-Key} header.
 *
 * <p>{@code /health} and the {@code /dev/} endpoints are open. Without a configured key every
 * request passes.
 */
@Component
@Slf4j
public class ApiKeyAuthFilter extends OncePerRequestFilter {

  static final String HEADER = "X-API-Key";

  private final String expectedKey;

  public ApiKeyAuthFilter(BridgeProperties properties) {
    String key = properties.api().key();
    this.expectedKey = key == null ? "" : key.trim();
    if (expectedKey.isBlank()) {
      log.warn("bridge.api.key is not set, API endpoints are unprotected");
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getServletPath();
    return path == null || path.equals("/health") || path.startsWith("/dev/");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    if (expectedKey.isBlank()) {
      log.debug(
          "No API key configured, allowing {} {}", request.getMethod(), request.getRequestURI());
      filterChain.doFilter(request, response);
      return;
    }

    String provided = request.getHeader(HEADER);
    if (provided == null || provided.isBlank()) {
      log.warn("Missing {} header for {} {}", HEADER, request.getMethod(), request.getRequestURI());
      reject(response, HttpServletResponse.SC_UNAUTHORIZED, "Missing API key");
      return;
    }
    if (!expectedKey.equals(provided)) {
      log.warn("Invalid API key for {} {}", request.getMethod(), request.getRequestURI());
      reject(response, HttpServletResponse.SC_FORBIDDEN, "Invalid API key");
      return;
    }

    filterChain.doFilter(request, response);
  }

  private static void reject(HttpServletResponse response, int status, String error)
      throws IOException {
    response.setStatus(status);
    response.setContentType("application/json");
    response.getWriter().write("{\"error\":\"" + error + "\"}");
  }
}
