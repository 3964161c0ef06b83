package com.visionai.gateway.database.config;

import com.visionai.gateway.database.registry.ConnectionRegistry;
import com.visionai.gateway.database.registry.DatabaseConnector;
import com.visionai.gateway.database.single.PrimaryDatabaseConnection;
import com.visionai.gateway.mongo.MongoDatabaseConnector;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Database wiring: the shared connector, the multi-tenant registry and, when
 * {@code agentgw.primary-database.uri} is set, the single primary connection.
 */
@Configuration
@EnableConfigurationProperties({DatabaseProperties.class, PrimaryDatabaseProperties.class})
public class DatabaseConfig {

    @Bean
    @ConditionalOnMissingBean
    public DatabaseConnector databaseConnector(DatabaseProperties props,
                                               @Value("${spring.application.name:agent-gateway}") String appName) {
        return new MongoDatabaseConnector(appName, props.getConnectTimeout(), props.getSocketTimeout(),
                props.getMaxPoolSize());
    }

    @Bean
    public ConnectionRegistry connectionRegistry(DatabaseConnector connector) {
        return new ConnectionRegistry(connector);
    }

    @Bean
    @ConditionalOnProperty(prefix = "agentgw.primary-database", name = "uri")
    public PrimaryDatabaseConnection primaryDatabaseConnection(DatabaseConnector connector,
                                                               PrimaryDatabaseProperties props) {
        return new PrimaryDatabaseConnection(connector, props);
    }
}
