package com.tenantguard.database.migration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.tenantguard.database.jdbc.JdbcAuditSink;
import com.tenantguard.database.jdbc.JdbcBucketStore;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * JDBC-backed quota storage, active when {@code tenantguard.database.enabled=true}.
 * <p>
 * The schema is migrated by a dedicated Flyway instance when the context starts; the stores are
 * created only after migration has run. Services using this configuration should disable Spring
 * Boot's own Flyway auto-configuration:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 */
@Configuration
@EnableConfigurationProperties(QuotaDatabaseProperties.class)
@ConditionalOnProperty(prefix = "tenantguard.database", name = "enabled", havingValue = "true")
public class QuotaDatabaseConfig {

    public static final String QUOTA_DATA_SOURCE_BEAN = "quotaDataSource";
    public static final String QUOTA_FLYWAY_BEAN = "quotaFlyway";

    @Bean(name = QUOTA_DATA_SOURCE_BEAN)
    public DataSource quotaDataSource(QuotaDatabaseProperties properties) {
        return DataSourceBuilder.create()
                .url(properties.url())
                .username(properties.username())
                .password(properties.password())
                .build();
    }

    @Bean(name = QUOTA_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway quotaFlyway(@Qualifier(QUOTA_DATA_SOURCE_BEAN) DataSource dataSource,
                              QuotaDatabaseProperties properties) {
        return createFlyway(dataSource, properties.locations());
    }

    @Bean
    @DependsOn(QUOTA_FLYWAY_BEAN)
    public JdbcBucketStore jdbcBucketStore(@Qualifier(QUOTA_DATA_SOURCE_BEAN) DataSource dataSource) {
        return new JdbcBucketStore(new JdbcTemplate(dataSource),
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
    }

    @Bean
    @DependsOn(QUOTA_FLYWAY_BEAN)
    public JdbcAuditSink jdbcAuditSink(@Qualifier(QUOTA_DATA_SOURCE_BEAN) DataSource dataSource,
                                       ObjectProvider<ObjectMapper> objectMapper) {
        return new JdbcAuditSink(new JdbcTemplate(dataSource),
                objectMapper.getIfAvailable(() -> JsonMapper.builder().findAndAddModules().build()));
    }

    /**
     * A Flyway instance for the quota schema. Clean is always disabled.
     */
    public static Flyway createFlyway(DataSource dataSource, String locations) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(locations)
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
