package com.example.devslegacy.config;

import com.example.devslegacy.filter.InternalHandlerGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.servlet.context.ServletWebServerInitializedEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebConfig.class);

    private final InternalHandlerGuard internalHandlerGuard;

    public WebConfig(InternalHandlerGuard internalHandlerGuard) {
        this.internalHandlerGuard = internalHandlerGuard;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(internalHandlerGuard);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins("*")
                .allowedMethods("GET", "HEAD", "POST", "PUT", "PATCH", "DELETE");
    }

    @EventListener
    public void onStarted(ServletWebServerInitializedEvent event) {
        log.info("Internal debug service listening on {}:{}",
                InternalConnectorConfig.INTERNAL_ADDRESS, InternalConnectorConfig.INTERNAL_PORT);
        log.info("Public app listening on port {}", event.getWebServer().getPort());
        log.info("Endpoints: /api/fetch?url=<url>    (naive protection)");
    }
}
