package com.globalai.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "allocation")
@Data
@Validated
public class AllocationProperties {

    @NotBlank
    private String defaultStrategy = "global-ai-long-short";

    private String strategyLocations = "classpath*:strategies/*.json";

    @Min(0)
    @Max(9)
    private int fractionalScale = 6;

    // share of positions that may be dropped before the whole allocation is abandoned
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double maxDroppedRatio = 0.5;

    @NotNull
    private Duration fetchDeadline = Duration.ofSeconds(10);

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double shortMarginRequirement = 0.5;
}
