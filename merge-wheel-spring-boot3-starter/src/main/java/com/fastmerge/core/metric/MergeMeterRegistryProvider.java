package com.fastmerge.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

/**
 * 汇总业务方注册表, 统一打上 node 标签
 * 没有任何外部注册表时退化为内存 Simple 注册表
 */
public class MergeMeterRegistryProvider {

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    public MergeMeterRegistryProvider(List<MeterRegistry> discovered, String nodeId) {
        if (discovered != null) {
            for (MeterRegistry mr : discovered) {
                // 嵌套的组合注册表拆开合入, 避免重复计数
                if (mr instanceof CompositeMeterRegistry c) {
                    c.getRegistries().forEach(composite::add);
                } else {
                    composite.add(mr);
                }
            }
        }
        if (composite.getRegistries().isEmpty()) {
            composite.add(new SimpleMeterRegistry());
        }
        composite.config().commonTags("node", nodeId);
    }

    public MeterRegistry getRegistry() { return composite; }

    public int registryCount() { return composite.getRegistries().size(); }
}
