package com.di.suitesplit.config;

import com.di.suitesplit.timeout.TimeoutPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Timeout estimation tunables, bound from {@code suitesplit.timeout.*}.
 */
@Data
@ConfigurationProperties(prefix = "suitesplit.timeout")
public class TimeoutProperties {

    private double safetyFactor = 3.0;
    private Duration fixedOverhead = Duration.ofMinutes(5);
    private double idleSafetyFactor = 3.0;
    private Duration idleOverhead = Duration.ofMinutes(1);
    private Duration minimum = Duration.ofMinutes(5);
    private Duration maximum = Duration.ofHours(48);

    public TimeoutPolicy toPolicy() {
        return TimeoutPolicy.builder()
                .safetyFactor(safetyFactor)
                .fixedOverhead(fixedOverhead)
                .idleSafetyFactor(idleSafetyFactor)
                .idleOverhead(idleOverhead)
                .minimum(minimum)
                .maximum(maximum)
                .build();
    }
}
