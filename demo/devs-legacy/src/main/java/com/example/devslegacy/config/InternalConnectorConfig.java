package com.example.devslegacy.config;

import com.example.devslegacy.internal.PrivilegedResource;
import org.apache.catalina.connector.Connector;
import org.apache.coyote.AbstractProtocol;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Adds the internal debug listener next to the public one. Its only protection is the bind
 * address, so the connector never listens on anything but the IPv4 loopback interface.
 */
@Configuration
public class InternalConnectorConfig {

    public static final int INTERNAL_PORT = 8000;
    public static final String INTERNAL_ADDRESS = "127.0.0.1";

    @Bean
    public PrivilegedResource privilegedResource(DevsProperties props) {
        return new PrivilegedResource(props.flag());
    }

    @Bean
    public WebServerFactoryCustomizer<TomcatServletWebServerFactory> internalConnectorCustomizer() {
        return factory -> factory.addAdditionalTomcatConnectors(internalConnector());
    }

    static Connector internalConnector() {
        Connector connector = new Connector(TomcatServletWebServerFactory.DEFAULT_PROTOCOL);
        connector.setPort(INTERNAL_PORT);
        if (!(connector.getProtocolHandler() instanceof AbstractProtocol<?> protocol)) {
            throw new IllegalStateException("cannot pin bind address for " + connector.getProtocolHandler());
        }
        protocol.setAddress(loopback());
        return connector;
    }

    private static InetAddress loopback() {
        try {
            return InetAddress.getByName(INTERNAL_ADDRESS);
        } catch (UnknownHostException e) {
            throw new IllegalStateException("invalid internal bind address " + INTERNAL_ADDRESS, e);
        }
    }
}
