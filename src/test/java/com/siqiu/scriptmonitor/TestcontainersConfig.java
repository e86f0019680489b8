package com.siqiu.scriptmonitor;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Postgres for integration tests. Durability is switched off; every test context gets a throwaway database.
 */
@TestConfiguration(proxyBeanMethods = false)
public class TestcontainersConfig {

    static final DockerImageName POSTGRES = DockerImageName.parse("postgres:16-alpine");

    @Bean
    @ServiceConnection
    PostgreSQLContainer<?> postgresContainer() {
        return new PostgreSQLContainer<>(POSTGRES)
                .withDatabaseName("script_monitor_it")
                .withUsername("monitor")
                .withPassword("monitor")
                .withCommand("postgres", "-c", "fsync=off", "-c", "synchronous_commit=off", "-c", "full_page_writes=off");
    }
}
