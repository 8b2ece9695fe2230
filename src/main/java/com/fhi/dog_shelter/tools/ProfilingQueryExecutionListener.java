package com.fhi.dog_shelter.tools;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;
import net.ttddyy.dsproxy.ExecutionInfo;
import net.ttddyy.dsproxy.QueryInfo;
import net.ttddyy.dsproxy.listener.QueryExecutionListener;

/**
 * datasource-proxy listener logging every SQL statement the application runs.
 *
 * <p>Each log line carries the statement, its execution time and the first dog_shelter
 * stack frame that led to it (typically a service or repository method), skipping
 * JDK, Spring, Hibernate and pool frames. Handy for spotting N+1 selects on the
 * dog/breed join.
 *
 * <p>Registered on the proxied data source built by
 * {@link com.fhi.dog_shelter.config.DataSourceProxyConfig}.
 */
@Slf4j
public class ProfilingQueryExecutionListener implements QueryExecutionListener
{
   private final boolean enabled;

   /**
    * Prefixed to every log line, to make them easy to grep.
    */
   private final String logLinePrefix;

    private static final List<String> IGNORED_PACKAGES = List.of(
        "java.",
        "jdk.",
        "jakarta.",
        "org.springframework.",
        "org.hibernate.",
        "com.zaxxer.",
        "net.ttddyy.",
        "ch.qos.logback."
    );

    /**
     * Our own classes that never count as the caller.
     */
    private static final List<String> IGNORED_CLASSES = List.of(
        ProfilingQueryExecutionListener.class.getName(),
        PerformanceProfiler.class.getName()
    );

   private static final String APP_PACKAGE_START = "com.fhi.dog_shelter";


    public ProfilingQueryExecutionListener(boolean enabled, String logLinePrefix)
    {   this.enabled = enabled;
        this.logLinePrefix = logLinePrefix;
    }


    @Override
    public void afterQuery(ExecutionInfo execInfo, List<QueryInfo> queryInfoList)
    {
      if (!enabled) return;

      String combinedSql = queryInfoList.stream()
                                        .map(QueryInfo::getQuery)
                                        .collect(Collectors.joining("\n"));

      String caller = findApplicationCaller()
                        .map(this::describe)
                        .orElse("unknown");

      log.info("{} in [{}], {} SQL request in {} ms: \n{}",
               logLinePrefix,
               caller,
               execInfo.isSuccess() ? "executed" : "FAILED",
               execInfo.getElapsedTime(),
               combinedSql);
    }


   /**
    * First stack frame belonging to the application, outside this tooling package.
    *
    * Classes reached through Spring proxies show up under their generated name,
    * which still starts with the application package, so they are kept.
    */
   Optional<StackTraceElement> findApplicationCaller()
   {
      return Arrays.stream(Thread.currentThread().getStackTrace())
                   .filter(element -> {
                                        String className = element.getClassName();
                                        return     className.startsWith(APP_PACKAGE_START)
                                                && !shouldIgnoreClass(className);
                   })
                   .findFirst();
   }


    boolean shouldIgnoreClass(String className)
    {
        return     IGNORED_PACKAGES.stream().anyMatch(className::startsWith)
                || IGNORED_CLASSES.contains(className);
    }


    private String describe(StackTraceElement element)
    {
        String className = element.getClassName();
        String simpleName = className.substring(className.lastIndexOf('.') + 1);
        return simpleName + ":" + element.getMethodName() + ":" + element.getLineNumber();
    }


    @Override
    public void beforeQuery(ExecutionInfo execInfo, List<QueryInfo> queryInfoList)
    {
        // nothing to do before execution
    }
}
