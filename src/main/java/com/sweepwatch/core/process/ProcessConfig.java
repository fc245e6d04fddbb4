package com.sweepwatch.core.process;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ProcessConfig {

    @Bean
    @ConditionalOnMissingBean(ProcessLauncher.class)
    public ProcessLauncher processLauncher(ProcessProperties properties) {
        return new OsProcessLauncher(properties.isUseSetsid());
    }
}
