package com.vidnyan.cleanup.adapter.out.store;

import com.vidnyan.cleanup.application.port.out.FindingStore;
import com.vidnyan.cleanup.application.port.out.FindingStoreFactory;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.jdbc.DataSourceBuilder;

import java.time.Duration;

/**
 * Builds one pooled {@link JdbcFindingStore} per configured URL.
 * Pools start lazily, so an unreachable store fails on first use rather than at startup.
 */
@Slf4j
public class JdbcFindingStoreFactory implements FindingStoreFactory {

    private final String username;
    private final String password;
    private final Duration connectionTimeout;
    private final int maxPoolSize;

    public JdbcFindingStoreFactory(String username, String password, Duration connectionTimeout, int maxPoolSize) {
        this.username = username;
        this.password = password;
        this.connectionTimeout = connectionTimeout;
        this.maxPoolSize = maxPoolSize;
    }

    @Override
    public FindingStore create(String name, String url) {
        JdbcUrls.JdbcConnection connection = JdbcUrls.parse(url, username, password);
        HikariDataSource dataSource = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(connection.jdbcUrl())
                .build();
        if (connection.username() != null) {
            dataSource.setUsername(connection.username());
        }
        if (connection.password() != null) {
            dataSource.setPassword(connection.password());
        }
        dataSource.setPoolName("cleanup-" + name);
        dataSource.setMaximumPoolSize(maxPoolSize);
        dataSource.setConnectionTimeout(connectionTimeout.toMillis());
        dataSource.setInitializationFailTimeout(-1);

        log.info("Store '{}' -> {}", name, connection.jdbcUrl().replaceAll("password=[^&;]*", "password=***"));
        return new JdbcFindingStore(name, dataSource);
    }
}
