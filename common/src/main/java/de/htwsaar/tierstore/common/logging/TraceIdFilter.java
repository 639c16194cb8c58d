package de.htwsaar.tierstore.common.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Legt pro Request eine Trace-ID und, falls erkennbar, das betroffene Backend im MDC ab.
 *
 * <p>Die Trace-ID wird aus dem Header übernommen oder neu erzeugt und in der Antwort
 * zurückgegeben. Das Backend stammt aus dem Query-Parameter {@code backend} oder aus
 * Pfaden der Form {@code .../usage/{backend}} bzw. {@code .../policies/{backend}}. So lassen
 * sich Quota-Entscheidungen und Replikationsläufe im Log einem Request und Backend zuordnen.</p>
 */
public class TraceIdFilter extends OncePerRequestFilter {

    /** Schlüsselname der Trace-ID im Logging-Kontext */
    public static final String TRACE_ID_KEY = "traceId";

    /** Schlüsselname des Backends im Logging-Kontext */
    public static final String BACKEND_KEY = "backendId";

    /** HTTP-Header, aus dem eine vorhandene Trace-ID gelesen werden kann */
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private static final Pattern BACKEND_PATH = Pattern.compile("/(?:usage|policies)/([^/?]+)");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String traceId = request.getHeader(TRACE_ID_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
        }

        MDC.put(TRACE_ID_KEY, traceId);
        String backend = backendOf(request);
        if (backend != null) {
            MDC.put(BACKEND_KEY, backend);
        } else {
            MDC.remove(BACKEND_KEY);
        }
        response.setHeader(TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Kontext nach der Anfrage wieder entfernen (Thread-Pool)
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(BACKEND_KEY);
        }
    }

    static String backendOf(HttpServletRequest request) {
        String param = request.getParameter("backend");
        if (param != null && !param.isBlank()) {
            return param.trim();
        }
        String uri = request.getRequestURI();
        if (uri == null) {
            return null;
        }
        Matcher m = BACKEND_PATH.matcher(uri);
        if (!m.find() || "templates".equals(m.group(1))) {
            return null;
        }
        return m.group(1);
    }
}
