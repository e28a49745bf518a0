package com.mike.contactenricher.support;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * One PostgreSQL container per test JVM with the application schema applied; tables are emptied
 * before every test.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class PostgresTestSupport {

    protected static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("enricher")
            .withUsername("enricher")
            .withPassword("enricher");

    protected DriverManagerDataSource dataSource;
    protected JdbcTemplate jdbcTemplate;
    protected DataSourceTransactionManager transactionManager;

    @BeforeEach
    void prepareDatabase() {
        if (!POSTGRES.isRunning()) {
            POSTGRES.start();
        }
        dataSource = new DriverManagerDataSource(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        jdbcTemplate = new JdbcTemplate(dataSource);
        transactionManager = new DataSourceTransactionManager(dataSource);

        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
        jdbcTemplate.execute("TRUNCATE results, scraped_contacts, scraper_servers RESTART IDENTITY");
    }

    protected long insertBacklogRow(String json) {
        Long id = jdbcTemplate.queryForObject(
                "INSERT INTO results (data) VALUES (CAST(? AS jsonb)) RETURNING id", Long.class, json);
        return id == null ? -1 : id;
    }
}
