package org.nowstart.lending.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "lending")
public record LendingProperties(
        @Valid @NotNull @DefaultValue Vault vault,
        @Valid @NotNull @DefaultValue Oracle oracle,
        @Valid @NotNull @DefaultValue Interest interest,
        @Valid @NotNull @DefaultValue Leverage leverage,
        @Valid @NotNull @DefaultValue Chain chain,
        // accounts holding the ADMIN role from start-up
        @NotNull @DefaultValue("owner") List<String> admins
) {

    public record Vault(
            // account that custodies collateral and acts as the registered interest caller
            @NotBlank @DefaultValue("vault") String address,
            @NotBlank @DefaultValue("WETH") String collateralAsset,
            @Min(0) @Max(36) @DefaultValue("18") int collateralDecimals,
            @NotBlank @DefaultValue("USDL") String debtAsset,
            @Min(0) @Max(36) @DefaultValue("18") int debtDecimals,
            // max borrow percentage of collateral value
            @Min(1) @Max(100) @DefaultValue("50") int ltvRatio,
            // health percentage below which liquidation is allowed
            @Positive @DefaultValue("150") int liquidationThreshold,
            // share of seized collateral paid to the liquidator
            @Min(0) @Max(10000) @DefaultValue("500") int liquidatorRewardBips,
            @NotBlank @DefaultValue("treasury") String treasury
    ) {
    }

    public record Oracle(
            @NotBlank @DefaultValue("http://localhost:8090") String baseUrl,
            @DefaultValue("") String apiKey,
            @DefaultValue("") String apiSecret,
            // max age of a price reading still accepted
            @NotNull @DefaultValue("1h") Duration staleness,
            @NotBlank @DefaultValue("eth-usd") String collateralFeed,
            @NotBlank @DefaultValue("usdl-usd") String debtFeed
    ) {
    }

    public record Interest(
            @DefaultValue("true") boolean enabled,
            @Min(0) @DefaultValue("500") int annualRateBips,
            // interest accrues only in whole multiples of this block count
            @Positive @DefaultValue("7200") long periodBlocks,
            @Positive @DefaultValue("2628000") long blocksPerYear,
            @NotNull @DefaultValue("60s") Duration collectionInterval
    ) {
    }

    public record Leverage(
            // account the loop builder borrows and swaps through
            @NotBlank @DefaultValue("leverage-builder") String address,
            @Min(1) @DefaultValue("10") int maxLeverage,
            // token path used to turn borrowed debt asset back into collateral
            @NotEmpty @DefaultValue({"USDL", "WETH"}) List<String> swapRoute,
            @NotBlank @DefaultValue("paper-router") String routerAddress,
            @Min(0) @Max(10000) @DefaultValue("30") int swapFeeBips
    ) {
    }

    public record Chain(
            @NotNull @DefaultValue("2024-01-01T00:00:00Z") Instant genesis,
            @NotNull @DefaultValue("12s") Duration blockTime
    ) {
    }
}
