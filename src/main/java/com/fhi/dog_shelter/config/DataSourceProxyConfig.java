package com.fhi.dog_shelter.config;

import java.sql.Connection;
import java.sql.SQLException;

import javax.sql.DataSource;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.autoconfigure.liquibase.LiquibaseDataSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.jdbc.datasource.SimpleDriverDataSource;

import com.fhi.dog_shelter.tools.ProfilingQueryExecutionListener;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import lombok.extern.slf4j.Slf4j;
import net.ttddyy.dsproxy.support.ProxyDataSourceBuilder;

/**
 * Replaces the application's {@link DataSource} with a proxy around a Hikari pool, so that
 * every SQL statement can be logged by {@link ProfilingQueryExecutionListener} with:
 * - the SQL itself
 * - its execution time in milliseconds
 * - the dog_shelter class and method that triggered it
 *
 * <p>Not for production.
 *
 * <p>Liquibase gets its own plain, unpooled {@link DataSource} pointing at the same database.
 * Running the migration through the proxy would make the proxy depend on Liquibase and Liquibase
 * on the proxy. It must not be a {@link HikariDataSource} either: that class extends
 * {@link HikariConfig}, and {@link #hikariConfig()} has to stay the only bean of that type.
 */
@Configuration
@Profile({ "local"   // we want the profiler when running locally
          ,"dev"
          ,"test"    // integration tests run through the proxy as well, so they exercise the real wiring
        })
@Slf4j
public class DataSourceProxyConfig
{
    @Bean
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariConfig hikariConfig()
    {   return new HikariConfig();
    }


    /**
     * The pooled data source used by JPA, wrapped in a logging proxy.
     *
     * The Hikari pool is built here from {@link DataSourceProperties} rather than injected,
     * so that the {@code spring.datasource.hikari.*} settings are already bound when it starts.
     */
    @Bean
    @Primary
    public DataSource proxiedDataSource(DataSourceProperties dsProps,
                                        HikariConfig hikariConfig,
                                        ProfilingQueryExecutionListener queryExecutionListener)
    {
        hikariConfig.setJdbcUrl (dsProps.getUrl());
        hikariConfig.setUsername(dsProps.getUsername());
        hikariConfig.setPassword(dsProps.getPassword());
        if (dsProps.getDriverClassName() != null)
        {   hikariConfig.setDriverClassName(dsProps.getDriverClassName());
        }

        HikariDataSource hikariDs = new HikariDataSource(hikariConfig);

        log.debug("Hikari auto-commit: {}"      , hikariDs.isAutoCommit());
        log.debug("Hikari maximum-pool-size: {}", hikariDs.getMaximumPoolSize());
        log.debug("Hikari pool-name: {}"        , hikariDs.getPoolName());

        DataSource proxiedDataSource = ProxyDataSourceBuilder
                .create(hikariDs)
                .name("DOG-SHELTER-DS")            // Used in logs
                .listener(queryExecutionListener)
                .multiline()                       // Pretty-print multiline SQL logs
                .countQuery()                      // Appends query count metrics
                .build();

        try (Connection testConn = proxiedDataSource.getConnection())
        {   log.debug("proxiedDataSource connected, auto-commit: {}", testConn.getAutoCommit());
        }
        catch (SQLException e)
        {   log.warn("Could not open a test connection through proxiedDataSource: {}", e.getMessage());
        }

        return proxiedDataSource;
    }


    /**
     * The data source Liquibase runs the changelog with.
     */
    @Bean
    @LiquibaseDataSource
    public DataSource liquibaseDataSource(DataSourceProperties properties)
    {   return properties.initializeDataSourceBuilder()
                         .type(SimpleDriverDataSource.class)
                         .build();
    }


    @Bean
    public ProfilingQueryExecutionListener queryExecutionListener
          (@Value("${profiling.sql.enabled:false}")              boolean enabled,
           @Value("${profiling.sql.logLinePrefix:PROFILING---}") String logLinePrefix
          )
    {   return new ProfilingQueryExecutionListener(enabled, logLinePrefix);
    }
}
