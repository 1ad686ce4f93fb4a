package eu.virtualparadox.ewexport.application.config;

import eu.virtualparadox.ewexport.application.executor.ExportExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public ExportExecutor exportExecutor() {
        ExportExecutor executor = new ExportExecutor();
        executor.setCorePoolSize(1);        // batches run one after another
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("export-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
