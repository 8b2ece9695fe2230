package com.fhi.dog_shelter.tools;

import java.util.Arrays;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.hibernate.SessionFactory;
import org.hibernate.stat.Statistics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.persistence.EntityManagerFactory;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs, for each service call, how long it took and what Hibernate did meanwhile:
 * - execution time
 * - number of queries
 * - number of entities and collections loaded
 *
 * The listing endpoints are meant to cost a single query each; a count above one for
 * {@code DogService.listDogs} means the breed join is no longer done in SQL.
 *
 * Complements {@link ProfilingQueryExecutionListener}, which logs the individual statements.
 *
 * Hibernate statistics are global, so the figures are only exact when requests don't overlap.
 * Good enough for local runs and tests.
 */
@Aspect
@Component
@Slf4j
public class PerformanceProfiler
{
    @Value("${profiling.performance.enabled:false}")
    private boolean profilerEnabled;

    @Value("${profiling.performance.slowCallThreshold:500}")
    private long slowCallThreshold;

    @Value("${profiling.performance.queryCountThreshold:10}")
    private long queryCountThreshold;

    @Value("${profiling.performance.printQueryThreshold:5}")
    private long printQueryThreshold;

    @Value("${profiling.performance.logLinePrefix:PROFILING---}")
    private String logLinePrefix;

    private final SessionFactory sessionFactory;


    public PerformanceProfiler(EntityManagerFactory entityManagerFactory)
    {   this.sessionFactory = entityManagerFactory.unwrap(SessionFactory.class);
    }

    @PostConstruct
    public void init()
    {
        if (!profilerEnabled)
        {   return;
        }
        if (!sessionFactory.getStatistics().isStatisticsEnabled())
        {   log.warn("Hibernate statistics are NOT enabled, query counts will read 0. Enable them via 'hibernate.generate_statistics: true'.");
        } else
        {   log.info("Hibernate statistics are enabled for profiling.");
        }
    }


    @Around("execution(public * com.fhi.dog_shelter.service..*(..))")
    public Object profile(ProceedingJoinPoint joinPoint) throws Throwable
    {
        if (!profilerEnabled)
        {   return joinPoint.proceed();
        }

        Statistics stats = sessionFactory.getStatistics();
        stats.clear();
        long start = System.currentTimeMillis();
        try
        {   return joinPoint.proceed();
        }
        finally
        {   long duration            = System.currentTimeMillis() - start;
            long queryCount          = stats.getQueryExecutionCount();
            long entityLoadCount     = stats.getEntityLoadCount();
            long collectionLoadCount = stats.getCollectionLoadCount();
            String method            = joinPoint.getSignature().toShortString();

            log.info("{} [{} ms; {} queries; {} entities, {} collections] for [{}]",
                     logLinePrefix,
                     duration,
                     queryCount,
                     entityLoadCount,
                     collectionLoadCount,
                     method);

            if (queryCount > printQueryThreshold)
            {   log.debug("Top queries: {}", Arrays.stream(stats.getQueries()).limit(2).toList());
            }
            if (duration > slowCallThreshold)
            {   log.warn("{} SLOW CALL DETECTED: [{}] took {} ms", logLinePrefix, method, duration);
            }
            if (queryCount > queryCountThreshold)
            {   log.warn("{} HIGH QUERY COUNT DETECTED: [{}] generated {} queries", logLinePrefix, method, queryCount);
            }
        }
    }
}
