package com.linlay.chatrunner.security;

import com.linlay.chatrunner.config.AppAuthProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Rejects calls to protected paths without a valid bearer token with 401, before any upstream
 * work starts. The verified caller is stored under {@link #USER_ATTR}.
 */
@Component
public class ApiJwtAuthWebFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiJwtAuthWebFilter.class);

    public static final String USER_ATTR = "CHAT_AUTHENTICATED_USER";

    private static final String AUTH_PREFIX = "Bearer ";

    private final AppAuthProperties authProperties;
    private final JwtVerifier jwtVerifier;

    public ApiJwtAuthWebFilter(AppAuthProperties authProperties, JwtVerifier jwtVerifier) {
        this.authProperties = authProperties;
        this.jwtVerifier = jwtVerifier;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!authProperties.isEnabled()
                || HttpMethod.OPTIONS.equals(exchange.getRequest().getMethod())
                || !isProtected(exchange.getRequest().getPath().value())) {
            return chain.filter(exchange);
        }

        AuthenticatedUser user = jwtVerifier.verify(resolveBearerToken(exchange)).orElse(null);
        if (user == null) {
            log.info("Rejected unauthenticated {} {}", exchange.getRequest().getMethod(),
                    exchange.getRequest().getPath().value());
            return writeUnauthorized(exchange);
        }
        exchange.getAttributes().put(USER_ATTR, user);
        return chain.filter(exchange);
    }

    private boolean isProtected(String path) {
        if (!StringUtils.hasText(path)) {
            return false;
        }
        for (String prefix : authProperties.getProtectedPaths()) {
            if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    private String resolveBearerToken(ServerWebExchange exchange) {
        String authorization = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(AUTH_PREFIX)) {
            return null;
        }
        String token = authorization.substring(AUTH_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private Mono<Void> writeUnauthorized(ServerWebExchange exchange) {
        byte[] body = "{\"code\":401,\"msg\":\"unauthorized\",\"data\":{}}".getBytes(StandardCharsets.UTF_8);
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return exchange.getResponse().writeWith(Mono.just(exchange.getResponse().bufferFactory().wrap(body)));
    }
}
