package com.example.devslegacy.filter;

import com.example.devslegacy.config.InternalConnectorConfig;
import com.example.devslegacy.controller.InternalController;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;

/**
 * Second check behind {@link ConnectorIsolationFilter}, made on the handler that was actually
 * resolved: {@link InternalController} never runs for a request that came in off the loopback connector.
 */
@Component
public class InternalHandlerGuard implements HandlerInterceptor {

    @Override
    public boolean preHandle(HttpServletRequest req, HttpServletResponse res, Object handler) throws IOException {
        if (handler instanceof HandlerMethod method
                && InternalController.class.isAssignableFrom(method.getBeanType())
                && req.getLocalPort() != InternalConnectorConfig.INTERNAL_PORT) {
            res.sendError(HttpServletResponse.SC_NOT_FOUND);
            return false;
        }
        return true;
    }
}
