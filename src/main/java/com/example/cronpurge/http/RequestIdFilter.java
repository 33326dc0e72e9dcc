package com.example.cronpurge.http;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every request with an id that ends up in log lines and on the stored statement. A caller
 * supplied {@code X-Request-Id} is kept only when it is a short token; anything else is replaced
 * with a fresh UUID so arbitrary header text never reaches the statement store.
 */
@Component
@Slf4j
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String MDC_KEY = "requestId";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    static String resolve(String supplied) {
        if (supplied != null && ACCEPTED_ID.matcher(supplied).matches()) {
            return supplied;
        }
        String generated = UUID.randomUUID().toString();
        if (supplied != null && !supplied.isBlank()) {
            log.debug("Replacing unusable {} header with {}", HEADER, generated);
        }
        return generated;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        String requestId = resolve(request.getHeader(HEADER));
        MDC.put(MDC_KEY, requestId);
        response.setHeader(HEADER, requestId);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }
}
