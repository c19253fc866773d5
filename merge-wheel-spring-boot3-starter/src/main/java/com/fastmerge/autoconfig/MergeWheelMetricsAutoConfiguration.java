package com.fastmerge.autoconfig;

import com.fastmerge.config.MergeWheelProperties;
import com.fastmerge.core.metric.MergeMeterRegistryProvider;
import com.fastmerge.core.metric.RetryMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

@AutoConfiguration
@EnableConfigurationProperties(MergeWheelProperties.class)
public class MergeWheelMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MergeMeterRegistryProvider mergeMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered,
                                                                 MergeWheelProperties props,
                                                                 Environment env) {
        String nodeId = props.resolveNodeId(env.getProperty("spring.application.name", "merge-wheel"));
        return new MergeMeterRegistryProvider(discovered.orderedStream().toList(), nodeId);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryMetrics retryMetrics(MergeMeterRegistryProvider provider) {
        return RetryMetrics.create(provider.getRegistry());
    }
}
