package com.phillippitts.realtimesync.config.logging;

import com.phillippitts.realtimesync.config.properties.RealtimeProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Tags requests to the realtime endpoints with the operation and channel they act on.
 *
 * <p>ThreadContext keys, present only for {@code /api/v1/realtime/**}:</p>
 * <ul>
 *   <li>{@code requestId}: the {@code X-Request-ID} header, or a generated UUID, echoed back
 *       on the response</li>
 *   <li>{@code realtimeOp}: last path segment, e.g. {@code reconnect}, {@code sync},
 *       {@code health}, {@code state}</li>
 *   <li>{@code channel}: name of the shared realtime channel</li>
 * </ul>
 *
 * <p>A forced reconnect or sync carries these keys into callback threads through the callback
 * executor, so consumer logs can be traced back to the request that cued them. Only the keys
 * set here are removed afterwards.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RealtimeRequestContextFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String REALTIME_PATH = "/api/v1/realtime";

    static final String KEY_REQUEST_ID = "requestId";
    static final String KEY_OPERATION = "realtimeOp";
    static final String KEY_CHANNEL = "channel";

    private final String channelName;

    public RealtimeRequestContextFilter(RealtimeProperties properties) {
        this.channelName = properties.getChannel().getName();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !(path.equals(REALTIME_PATH) || path.startsWith(REALTIME_PATH + "/"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);
        ThreadContext.put(KEY_REQUEST_ID, requestId);
        ThreadContext.put(KEY_OPERATION, operationOf(request.getRequestURI()));
        ThreadContext.put(KEY_CHANNEL, channelName);
        try {
            chain.doFilter(request, response);
        } finally {
            ThreadContext.removeAll(List.of(KEY_REQUEST_ID, KEY_OPERATION, KEY_CHANNEL));
        }
    }

    static String operationOf(String path) {
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        if (trimmed.length() <= REALTIME_PATH.length()) {
            return "root";
        }
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }
}
