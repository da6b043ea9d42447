package ge.salesinsight.common.infrastructure;

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

/**
 * Access log for the upload and forecast API.
 *
 * Each request carries an X-Request-Id (taken from the caller or generated) that is
 * echoed on the response and put in the MDC, so a training job's log lines can be
 * matched to the POST that started it. Clients poll job status every few seconds;
 * those GETs are logged at debug to keep the access log readable.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String MDC_KEY = "requestId";

    private static final String JOB_STATUS_PREFIX = "/api/forecast/jobs/";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String requestId = resolveRequestId(request);
        MDC.put(MDC_KEY, requestId);
        response.setHeader(HEADER, requestId);

        long started = System.currentTimeMillis();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long elapsed = System.currentTimeMillis() - started;
            if (isStatusPoll(request)) {
                log.debug("{} {} -> {} ({}ms)", request.getMethod(), request.getRequestURI(),
                        response.getStatus(), elapsed);
            } else {
                log.info("{} {} -> {} ({}ms)", request.getMethod(), request.getRequestURI(),
                        response.getStatus(), elapsed);
            }
            MDC.remove(MDC_KEY);
        }
    }

    static String resolveRequestId(HttpServletRequest request) {
        String incoming = request.getHeader(HEADER);
        return incoming == null || incoming.isBlank() ? UUID.randomUUID().toString() : incoming.trim();
    }

    static boolean isStatusPoll(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return "GET".equals(request.getMethod()) && uri.startsWith(JOB_STATUS_PREFIX) && !uri.endsWith("/result");
    }
}
