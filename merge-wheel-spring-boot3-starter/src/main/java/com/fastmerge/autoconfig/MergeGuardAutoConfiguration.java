package com.fastmerge.autoconfig;

import com.fastmerge.config.MergeGuardProperties;
import com.fastmerge.core.handler.GuardedClientExecutor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(MergeGuardProperties.class)
public class MergeGuardAutoConfiguration {

    /**
     * fetch/act 统一入口
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardedClientExecutor guardedClientExecutor(MergeGuardProperties props) {
        return new GuardedClientExecutor(props);
    }
}
