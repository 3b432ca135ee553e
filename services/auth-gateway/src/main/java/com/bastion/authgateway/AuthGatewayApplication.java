package com.bastion.authgateway;

import com.bastion.authgateway.config.BastionSecurityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Bastion auth gateway: wires the authentication core into the servlet request lifecycle.
 *
 * <p>Every request passes through {@code CorrelationIdFilter} and then {@code
 * SessionCookieFilter}, which binds the tenant and authenticates the session cookie before any
 * controller runs. The session endpoints live under {@code /api/v1/session}.
 */
@SpringBootApplication
@EnableConfigurationProperties(BastionSecurityProperties.class)
public class AuthGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthGatewayApplication.class, args);
        log.info("Bastion auth gateway started");
    }
}
