package com.kyc.vision.app.config;

import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Log4j2
@Configuration
public class ExecutorConfig {

  @Value("${kyc.executor.await-termination-seconds:30}")
  private int awaitTerminationSeconds;

  @Value("${kyc.executor.max-concurrent-requests:4}")
  private int maxConcurrentRequests;

  /**
   * Pool for per-page model calls on the multi-document path. There is no queue: every page gets
   * a thread as soon as it is submitted, up to {@code multiMaxPages} pages for each of {@code
   * max-concurrent-requests} requests. Past that the submitting request thread runs the page.
   */
  @Bean(name = "pageExtractionExecutor")
  public ThreadPoolTaskExecutor pageExtractionExecutor(ExtractionProperties props) {
    int corePoolSize = props.getMultiMaxPages();
    int maxPoolSize = corePoolSize * Math.max(1, maxConcurrentRequests);
    return buildExecutor("page-extract-", corePoolSize, maxPoolSize);
  }

  /** Pool for whole-file model calls on the single-document path. */
  @Bean(name = "documentExtractionExecutor")
  public ThreadPoolTaskExecutor documentExtractionExecutor() {
    int poolSize = Math.max(1, maxConcurrentRequests) * 2;
    return buildExecutor("doc-extract-", poolSize, poolSize * 2);
  }

  /** Fires per-page model-call deadlines. */
  @Bean(name = "pageTimeoutScheduler")
  public ThreadPoolTaskScheduler pageTimeoutScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("page-deadline-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setErrorHandler(t -> log.error("Uncaught exception in page deadline task", t));
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    scheduler.initialize();
    return scheduler;
  }

  private ThreadPoolTaskExecutor buildExecutor(String prefix, int corePoolSize, int maxPoolSize) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(corePoolSize);
    executor.setMaxPoolSize(maxPoolSize);
    // zero capacity: hand-off, never queue behind other requests' work
    executor.setQueueCapacity(0);
    executor.setAllowCoreThreadTimeOut(true);
    executor.setThreadNamePrefix(prefix);

    // Be nice on shutdown
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(awaitTerminationSeconds);

    // Saturated pool: run on the request thread rather than drop work
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

    executor.initialize();
    log.info(
        "ThreadPoolTaskExecutor initialized prefix={} corePoolSize={} maxPoolSize={}",
        prefix,
        corePoolSize,
        maxPoolSize);
    return executor;
  }
}
