package com.rdslens.web;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts a per-request trace id into the MDC and echoes it in the response.
 *
 * For tool calls the tool name (last path segment under {@code /v1/tools/}) is also put into the MDC
 * so every log line of one invocation can be correlated.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter implements Filter {

    static final String TRACE_ID_HEADER = "X-Request-Id";
    static final String MDC_TRACE_ID = "trace_id";
    static final String MDC_TOOL = "tool";
    private static final String TOOLS_PREFIX = "/v1/tools/";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (request instanceof HttpServletRequest httpServletRequest) {
            String traceId = httpServletRequest.getHeader(TRACE_ID_HEADER);
            if (traceId == null || traceId.isBlank()) {
                traceId = UUID.randomUUID().toString();
            }
            MDC.put(MDC_TRACE_ID, traceId);

            String uri = httpServletRequest.getRequestURI();
            if (uri != null && uri.startsWith(TOOLS_PREFIX) && uri.length() > TOOLS_PREFIX.length()) {
                MDC.put(MDC_TOOL, uri.substring(TOOLS_PREFIX.length()));
            }

            if (response instanceof HttpServletResponse httpServletResponse) {
                httpServletResponse.setHeader(TRACE_ID_HEADER, traceId);
            }
        }

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(MDC_TOOL);
        }
    }
}
