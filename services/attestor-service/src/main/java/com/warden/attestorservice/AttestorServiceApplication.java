package com.warden.attestorservice;

import com.warden.attestorservice.config.AttestorServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Warden attestor service.
 *
 * <p>Serves the {@code WorkloadAttestor} gRPC API (Attest, Configure) on
 * {@code attestor.service.grpc-port} and a small HTTP surface (info endpoint, actuator) on the
 * Spring Boot web port.
 */
@SpringBootApplication
@EnableConfigurationProperties(AttestorServiceProperties.class)
public class AttestorServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AttestorServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AttestorServiceApplication.class, args);
        log.info("Warden attestor service started");
    }
}
