package com.isolend.config;

import com.isolend.core.address.AddressUtil;
import com.isolend.core.math.WadMath;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link ProtocolParameters} bean from application.yml.
 *
 * <p>Fractions are written as decimals ({@code 0.95}) and converted to WAD here. Defaults are
 * conservative: 24h timelock with a 72h acceptance window, LTV between 10% and 98%, 50% close
 * factor, 10% liquidation discount.
 *
 * <p>Properties prefix: {@code isolend.*}
 */
@Configuration
public class ProtocolConfig {

    @Bean
    public ProtocolParameters protocolParameters(
            @Value("${isolend.protocol-owner}") String protocolOwner,
            @Value("${isolend.fee-recipient}") String feeRecipient,
            @Value("${isolend.pool-address}") String poolAddress,
            @Value("${isolend.position-manager-address}") String positionManagerAddress,
            @Value("${isolend.superpool-factory-address}") String superPoolFactoryAddress,
            @Value("${isolend.pool.default-interest-fee:0}") String defaultInterestFee,
            @Value("${isolend.pool.default-origination-fee:0}") String defaultOriginationFee,
            @Value("${isolend.pool.min-borrow:0}") BigInteger minBorrow,
            @Value("${isolend.pool.min-debt:0}") BigInteger minDebt,
            @Value("${isolend.pool.min-initial-deposit:0}") BigInteger minInitialDeposit,
            @Value("${isolend.risk.min-ltv:0.1}") String minLtv,
            @Value("${isolend.risk.max-ltv:0.98}") String maxLtv,
            @Value("${isolend.risk.close-factor:0.5}") String closeFactor,
            @Value("${isolend.risk.liquidation-discount:0.1}") String liquidationDiscount,
            @Value("${isolend.risk.liquidation-fee:0}") String liquidationFee,
            @Value("${isolend.governance.timelock-duration:24h}") Duration timelockDuration,
            @Value("${isolend.governance.timelock-deadline:72h}") Duration timelockDeadline,
            @Value("${isolend.position.max-assets:5}") int maxPositionAssets,
            @Value("${isolend.position.max-debt-pools:5}") int maxPositionDebtPools,
            @Value("${isolend.superpool.max-queue-length:10}") int maxSuperPoolQueueLength,
            @Value("${isolend.superpool.min-burned-shares:1000}") BigInteger minSuperPoolBurnedShares,
            @Value("${isolend.superpool.max-fee:0.5}") String maxSuperPoolFee) {
        return ProtocolParameters.builder()
                .protocolOwner(AddressUtil.normalize(protocolOwner))
                .feeRecipient(AddressUtil.normalize(feeRecipient))
                .poolAddress(AddressUtil.normalize(poolAddress))
                .positionManagerAddress(AddressUtil.normalize(positionManagerAddress))
                .superPoolFactoryAddress(AddressUtil.normalize(superPoolFactoryAddress))
                .defaultInterestFee(WadMath.wad(defaultInterestFee))
                .defaultOriginationFee(WadMath.wad(defaultOriginationFee))
                .minBorrow(minBorrow)
                .minDebt(minDebt)
                .minInitialDeposit(minInitialDeposit)
                .minLtv(WadMath.wad(minLtv))
                .maxLtv(WadMath.wad(maxLtv))
                .closeFactor(WadMath.wad(closeFactor))
                .liquidationDiscount(WadMath.wad(liquidationDiscount))
                .liquidationFee(WadMath.wad(liquidationFee))
                .timelockDuration(timelockDuration)
                .timelockDeadline(timelockDeadline)
                .maxPositionAssets(maxPositionAssets)
                .maxPositionDebtPools(maxPositionDebtPools)
                .maxSuperPoolQueueLength(maxSuperPoolQueueLength)
                .minSuperPoolBurnedShares(minSuperPoolBurnedShares)
                .maxSuperPoolFee(WadMath.wad(maxSuperPoolFee))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
