package com.slb.chaos_engine.modules.agent.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "app.agent")
@Validated
@Data
public class AgentProperties {

    /** Blocks without a heartbeat or claim after which anyone may deactivate the agent. */
    @Min(1)
    private long silenceWindowBlocks = 100_000L;

    /** Blocks after registration before the first claim is accepted. */
    @Min(0)
    private long firstMineDelayBlocks = 10_000L;

    /** Upper bound for the cosmic resilience an agent can register with, in bps. */
    @Min(0)
    private int maxResilienceBps = 5_000;
}
