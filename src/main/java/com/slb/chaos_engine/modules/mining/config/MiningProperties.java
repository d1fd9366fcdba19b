package com.slb.chaos_engine.modules.mining.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "app.mining")
@Validated
@Data
public class MiningProperties {

    /** Share of every gross emission burned on earn. */
    @Min(0)
    @Max(10_000)
    private int burnOnEarnBps = 2_000;
}
