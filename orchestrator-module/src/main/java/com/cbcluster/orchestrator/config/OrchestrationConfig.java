package com.cbcluster.orchestrator.config;

import com.cbcluster.orchestrator.orchestration.ExternallyManagedNodeCommandDispatcher;
import com.cbcluster.orchestrator.orchestration.NodeCommandDispatcher;
import com.cbcluster.orchestrator.state.ResourceStateRegistry;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestrationConfig {

    /**
     * Runs the cluster bootstrap and the bucket provisioning tasks.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler orchestrationScheduler(OrchestratorProperties properties) {
        OrchestratorProperties.Executor pool = properties.getExecutor();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                pool.getCorePoolSize(),
                pool.getMaxPoolSize(),
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(pool.getQueueCapacity()),
                new ThreadFactoryBuilder().setNameFormat("orchestrator-%d").setDaemon(true).build(),
                new ThreadPoolExecutor.CallerRunsPolicy());
        executor.allowCoreThreadTimeOut(true);
        return Schedulers.fromExecutorService(executor, "orchestrator");
    }

    @Bean
    @ConditionalOnMissingBean
    public NodeCommandDispatcher nodeCommandDispatcher(ResourceStateRegistry resourceStateRegistry) {
        return new ExternallyManagedNodeCommandDispatcher(resourceStateRegistry);
    }
}
