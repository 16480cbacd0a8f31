package com.example.devslegacy.filter;

import com.example.devslegacy.config.InternalConnectorConfig;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;

/**
 * Both connectors share one servlet context. {@code /internal/**} answers only on the loopback
 * connector and that connector answers nothing else; every other combination is a 404.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class ConnectorIsolationFilter extends OncePerRequestFilter {

    static final String INTERNAL_PREFIX = "/internal";

    private static final UrlPathHelper PATH_HELPER = new UrlPathHelper();

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {
        boolean internalConnector = req.getLocalPort() == InternalConnectorConfig.INTERNAL_PORT;
        if (internalConnector != isInternalPath(req)) {
            res.sendError(HttpServletResponse.SC_NOT_FOUND);
            return;
        }
        chain.doFilter(req, res);
    }

    private static boolean isInternalPath(HttpServletRequest req) {
        // decoded, ';' parameters removed, slashes merged: the path handler mapping sees
        String path = PATH_HELPER.getPathWithinApplication(req);
        return path.equals(INTERNAL_PREFIX) || path.startsWith(INTERNAL_PREFIX + "/");
    }
}
