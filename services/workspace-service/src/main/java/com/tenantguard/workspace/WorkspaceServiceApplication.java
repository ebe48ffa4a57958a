package com.tenantguard.workspace;

import com.tenantguard.database.migration.QuotaDatabaseConfig;
import com.tenantguard.workspace.config.AccountSeedProperties;
import com.tenantguard.workspace.config.QuotaProperties;
import com.tenantguard.workspace.config.WorkspaceServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Workspace service: tenant-owned contracts and vendors behind the operation guard.
 *
 * <p>Quota state lives in memory unless {@code tenantguard.database.enabled=true}, in which case
 * {@link QuotaDatabaseConfig} migrates its own schema and provides JDBC stores. Spring Boot's
 * data source and Flyway auto-configuration are off so the service starts without a database.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@EnableScheduling
@EnableConfigurationProperties({
    WorkspaceServiceProperties.class,
    QuotaProperties.class,
    AccountSeedProperties.class
})
@Import(QuotaDatabaseConfig.class)
public class WorkspaceServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(WorkspaceServiceApplication.class, args);
        log.info("Workspace service started");
    }
}
