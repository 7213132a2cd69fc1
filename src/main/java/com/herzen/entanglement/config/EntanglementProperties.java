package com.herzen.entanglement.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "entanglement")
public record EntanglementProperties(@DefaultValue Analysis analysis,
                                     @DefaultValue Query query,
                                     @DefaultValue Persistence persistence) {

    public record Analysis(@DefaultValue("5") int defaultMaxDepth) {}

    public record Query(@DefaultValue("3") int keystoneMinDependents) {}

    public record Persistence(@DefaultValue("1000") long flushDelayMs) {}
}
