package com.vibecoding.meshdoctor;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;


@SpringBootApplication
@ConfigurationPropertiesScan
public class MeshDoctorApplication {

    private static final Logger log = LoggerFactory.getLogger(MeshDoctorApplication.class);

    public static void main(String[] args) {
        log.info("==============================================");
        log.info("  Mesh Doctor - Service Mesh Health Checks");
        log.info("==============================================");

        // .env 파일을 시스템 프로퍼티로 로드 (KUBECONFIG, API 주소 등)
        try {
            Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

            dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE).forEach(entry -> {
                System.setProperty(entry.getKey(), entry.getValue());
                log.debug("Loaded environment variable: {}", entry.getKey());
            });

            log.info("Environment variables loaded from .env file");
        } catch (Exception e) {
            log.warn("Failed to load .env file: {}", e.getMessage());
            log.info("Continuing with system environment variables...");
        }

        SpringApplication.run(MeshDoctorApplication.class, args);

        log.info("Application started successfully!");
    }
}
