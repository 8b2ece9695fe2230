package com.fhi.dog_shelter.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import com.fhi.dog_shelter.service.BreedService;

import java.util.Arrays;


/**
 * Logs the profiles, Liquibase contexts, datasource and breed settings the application
 * actually started with.
 *
 * <p>Enabled with:
 * <pre>
 *   app.startup-diagnostics-logger.enabled=true
 * </pre>
 * Off by default.</p>
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "app.startup-diagnostics-logger.enabled", havingValue = "true", matchIfMissing = false)
public class StartupDiagnosticsLogger
{
   private static final String PREFIX = "[Startup Diagnostics]";

   private final Environment environment;
   private final BreedService breedService;

   @Value("${spring.liquibase.contexts:__UNSET__}")
   private String liquibaseContexts;


   public StartupDiagnosticsLogger(Environment environment, BreedService breedService)
   {  this.environment  = environment;
      this.breedService = breedService;
   }


   @PostConstruct
   public void logDebugInfo()
   {
      log.info("{} Diagnostics mode is ON", PREFIX);

      log.info("{} Active Spring profiles         : {}", PREFIX, Arrays.toString(environment.getActiveProfiles()));
      log.info("{} Liquibase contexts             : {}", PREFIX, liquibaseContexts);
      log.info("{} Property: spring.datasource.url = {}", PREFIX, environment.getProperty("spring.datasource.url", "NOT SET"));
      log.info("{} Sentinel breed names           : {}", PREFIX, breedService.getSentinelNames());
      log.info("{} SQL profiling                  : {}", PREFIX, environment.getProperty("profiling.sql.enabled", "false"));
      log.info("{} Service profiling              : {}", PREFIX, environment.getProperty("profiling.performance.enabled", "false"));
   }
}
