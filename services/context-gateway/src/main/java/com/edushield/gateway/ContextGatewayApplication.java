package com.edushield.gateway;

import com.edushield.gateway.config.IccpProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * EduShield context gateway.
 *
 * <p>Composition root for the Integrated Context Control engine: loads the policy tables
 * once, starts the audit dispatcher and exposes {@link com.edushield.gateway.domain.ContextControlEngine}
 * to whichever transport embeds it. On shutdown the audit queue is drained before the
 * sinks are closed.
 */
@SpringBootApplication
@EnableConfigurationProperties(IccpProperties.class)
public class ContextGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(ContextGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ContextGatewayApplication.class, args);
        log.info("EduShield context gateway started successfully");
    }
}
