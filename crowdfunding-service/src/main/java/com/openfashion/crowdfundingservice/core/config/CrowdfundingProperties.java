package com.openfashion.crowdfundingservice.core.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

@Data
@Validated
@ConfigurationProperties(prefix = "crowdfunding")
public class CrowdfundingProperties {

    @NotNull
    private Duration minFundingPeriod = Duration.ofDays(1);

    @NotNull
    private Duration maxFundingPeriod = Duration.ofDays(365);

    @NotNull
    private BigInteger minFundingGoal = BigInteger.ONE;

    @Min(0)
    @Max(10_000)
    private int defaultFeeRateBps = 100;

    @Min(0)
    @Max(10_000)
    private int maxFeeRateBps = 10_000;

    @NotNull
    private Duration refundGracePeriod = Duration.ofDays(30);

    @Valid
    private Access access = new Access();

    @Valid
    private Tokens tokens = new Tokens();

    @Valid
    private Lock lock = new Lock();

    @Valid
    private Outbox outbox = new Outbox();

    @AssertTrue(message = "min-funding-period must be positive and not exceed max-funding-period")
    public boolean isFundingPeriodRangeValid() {
        return minFundingPeriod == null || maxFundingPeriod == null
                || (!minFundingPeriod.isNegative() && !minFundingPeriod.isZero()
                && minFundingPeriod.compareTo(maxFundingPeriod) <= 0);
    }

    @AssertTrue(message = "default-fee-rate-bps must not exceed max-fee-rate-bps")
    public boolean isDefaultFeeRateWithinMax() {
        return defaultFeeRateBps <= maxFeeRateBps;
    }

    @Data
    public static class Access {
        // Owner may change the platform fee rate
        private String owner;
        private Set<String> admins = new LinkedHashSet<>();
    }

    @Data
    public static class Tokens {
        // Addresses with deployed token contract code
        private Set<String> contracts = new LinkedHashSet<>();
    }

    @Data
    public static class Lock {
        @Min(1)
        private long ttlSeconds = 30;
    }

    @Data
    public static class Outbox {
        @Min(1)
        private int batchSize = 100;

        // Publish attempts before an event is parked as FAILED
        @Min(1)
        private int maxAttempts = 5;
    }
}
