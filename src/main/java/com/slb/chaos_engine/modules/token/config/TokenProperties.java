package com.slb.chaos_engine.modules.token.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "app.token")
@Validated
@Data
public class TokenProperties {

    /** Hard ceiling on circulating supply (minted - burned), in whole tokens. */
    @Positive
    private long supplyCapTokens = 1_000_000_000L;

    /** Account holding emitted rewards until they are claimed and released from vesting. */
    @NotBlank
    private String reserveAccount = "engine:reserve";
}
