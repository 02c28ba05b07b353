package com.isolend.risk;

import com.isolend.config.ProtocolParameters;
import com.isolend.core.address.AddressUtil;
import com.isolend.core.journal.CallExecutor;
import com.isolend.core.math.WadMath;
import com.isolend.domain.enums.Rounding;
import com.isolend.exception.BoundsViolationException;
import com.isolend.exception.HealthViolationException;
import com.isolend.exception.InsufficientFundsException;
import com.isolend.exception.ValuationException;
import com.isolend.pool.PoolService;
import com.isolend.position.Position;
import com.isolend.position.PositionRegistry;
import com.isolend.token.TokenBank;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Collateralization and liquidation math for positions.
 *
 * <p>Each debt pool may price the same collateral asset through its own oracle, so collateral
 * is valued at a debt-weighted average: pool {@code i} contributes its oracle's value scaled by
 * {@code weight_i = debtValue_i / totalDebtValue}, rounded up. The required collateral is
 * {@code sum_i sum_a debtValue_i * assetWeight_a / ltv(pool_i, a)}, also rounded up, where
 * {@code assetWeight_a} is the share of collateral value held in asset {@code a}.
 *
 * <p>A position with no debt is trivially healthy and is never valued, so it needs no oracle.
 * Debt backed by zero collateral is unhealthy and cannot be given risk data.
 *
 * <p>All methods are views; they read simulated pool accrual and never mutate state.
 */
@Service
public class RiskModule {

    private static final Logger log = LoggerFactory.getLogger(RiskModule.class);

    /** Per-pool debt values of one position. */
    private record DebtPortfolio(List<String> pools, List<BigInteger> values, List<BigInteger> weights, BigInteger total) {

        boolean isEmpty() {
            return total.signum() == 0;
        }
    }

    /** Per-asset collateral values of one position. */
    private record AssetPortfolio(List<String> assets, List<BigInteger> values, BigInteger total) {}

    private final RiskEngine riskEngine;
    private final PoolService poolService;
    private final PositionRegistry positionRegistry;
    private final TokenBank tokenBank;
    private final CallExecutor callExecutor;
    private final ProtocolParameters protocolParameters;

    public RiskModule(
            RiskEngine riskEngine,
            PoolService poolService,
            PositionRegistry positionRegistry,
            TokenBank tokenBank,
            CallExecutor callExecutor,
            ProtocolParameters protocolParameters) {
        this.riskEngine = riskEngine;
        this.poolService = poolService;
        this.positionRegistry = positionRegistry;
        this.tokenBank = tokenBank;
        this.callExecutor = callExecutor;
        this.protocolParameters = protocolParameters;
    }

    // ========================
    // HEALTH
    // ========================

    public boolean isPositionHealthy(String position) {
        return callExecutor.read(() -> {
            Position account = positionRegistry.require(AddressUtil.normalize(position));
            DebtPortfolio debt = debtPortfolio(account);
            if (debt.isEmpty()) {
                return true;
            }
            AssetPortfolio assets = assetPortfolio(account, debt);
            if (assets.total().signum() == 0) {
                return false;
            }
            return assets.total().compareTo(minReqAssetValue(debt, assets)) >= 0;
        });
    }

    /**
     * @throws ValuationException ZERO_COLLATERAL_WITH_DEBT when debt is backed by nothing
     */
    public RiskData getRiskData(String position) {
        return callExecutor.read(() -> {
            Position account = positionRegistry.require(AddressUtil.normalize(position));
            DebtPortfolio debt = debtPortfolio(account);
            if (debt.isEmpty()) {
                return RiskData.ZERO;
            }
            AssetPortfolio assets = assetPortfolio(account, debt);
            if (assets.total().signum() == 0) {
                throw new ValuationException(
                        ValuationException.Reason.ZERO_COLLATERAL_WITH_DEBT,
                        "Position " + account.getAddress() + " owes " + debt.total() + " with no collateral",
                        Map.of("position", account.getAddress(), "totalDebtValue", debt.total()));
            }
            return new RiskData(assets.total(), debt.total(), minReqAssetValue(debt, assets));
        });
    }

    /**
     * Collateral value over required collateral value, WAD-scaled. Max uint256 without debt,
     * zero when debt has no collateral.
     */
    public BigInteger healthFactor(String position) {
        return callExecutor.read(() -> {
            Position account = positionRegistry.require(AddressUtil.normalize(position));
            DebtPortfolio debt = debtPortfolio(account);
            if (debt.isEmpty()) {
                return WadMath.MAX_UINT256;
            }
            return healthFactor(account, debt);
        });
    }

    public BigInteger getTotalDebtValue(String position) {
        return callExecutor.read(
                () -> debtPortfolio(positionRegistry.require(AddressUtil.normalize(position))).total());
    }

    public BigInteger getTotalAssetValue(String position) {
        return callExecutor.read(() -> {
            Position account = positionRegistry.require(AddressUtil.normalize(position));
            DebtPortfolio debt = debtPortfolio(account);
            return debt.isEmpty() ? BigInteger.ZERO : assetPortfolio(account, debt).total();
        });
    }

    // ========================
    // LIQUIDATION
    // ========================

    /**
     * Checks a liquidation that repays {@code debts} and seizes {@code seized}.
     *
     * <p>An unhealthy position may be repaid up to the close factor of each pool's debt. A
     * position in bad debt (collateral worth less than debt) skips both the health check and the
     * close factor. In every case the seized value may not exceed the repaid value plus the
     * liquidation discount.
     */
    public LiquidationAssessment validateLiquidation(String position, List<DebtData> debts, List<AssetData> seized) {
        return callExecutor.read(() -> {
            Position account = positionRegistry.require(AddressUtil.normalize(position));
            DebtPortfolio debt = debtPortfolio(account);
            if (debt.isEmpty()) {
                throw new HealthViolationException(
                        HealthViolationException.Reason.LIQUIDATE_HEALTHY_POSITION,
                        "Position " + account.getAddress() + " has no debt");
            }

            AssetPortfolio assets = assetPortfolio(account, debt);
            boolean badDebt = assets.total().compareTo(debt.total()) < 0;
            BigInteger healthFactor = healthFactor(account, debt);
            if (!badDebt && healthFactor.compareTo(WadMath.WAD) >= 0) {
                throw new HealthViolationException(
                        HealthViolationException.Reason.LIQUIDATE_HEALTHY_POSITION,
                        "Position " + account.getAddress() + " is healthy",
                        Map.of("position", account.getAddress(), "healthFactor", healthFactor));
            }

            List<DebtData> resolved = new ArrayList<>(debts.size());
            Set<String> repaidPools = new HashSet<>();
            BigInteger repaidValue = BigInteger.ZERO;
            for (DebtData repayment : debts) {
                if (!repaidPools.add(repayment.poolId())) {
                    throw new BoundsViolationException(
                            BoundsViolationException.Reason.INVALID_PARAMETER,
                            "Pool " + repayment.poolId() + " is listed more than once in the repayment",
                            Map.of("position", account.getAddress(), "poolId", repayment.poolId()));
                }
                DebtData actual = resolveRepayment(account, repayment, badDebt);
                resolved.add(actual);
                if (actual.amount().signum() > 0) {
                    String poolAsset = poolService.getPoolAssetFor(actual.poolId());
                    repaidValue = repaidValue.add(riskEngine.valueOf(actual.poolId(), poolAsset, actual.amount()));
                }
            }

            BigInteger seizedValue = BigInteger.ZERO;
            for (AssetData seizure : seized) {
                String asset = AddressUtil.normalize(seizure.asset());
                BigInteger balance = tokenBank.balanceOf(asset, account.getAddress());
                if (seizure.amount().compareTo(balance) > 0) {
                    throw new InsufficientFundsException(
                            InsufficientFundsException.Reason.INSUFFICIENT_BALANCE,
                            "Cannot seize " + seizure.amount() + " of " + asset + "; position holds " + balance,
                            Map.of("position", account.getAddress(), "asset", asset));
                }
                seizedValue = seizedValue.add(weightedValue(debt, asset, seizure.amount()));
            }

            BigInteger maxSeizedValue =
                    WadMath.mulWad(repaidValue, WadMath.WAD.add(protocolParameters.getLiquidationDiscount()));
            if (seizedValue.compareTo(maxSeizedValue) > 0) {
                throw new HealthViolationException(
                        HealthViolationException.Reason.SEIZED_TOO_MUCH_COLLATERAL,
                        "Seized value " + seizedValue + " exceeds allowed " + maxSeizedValue,
                        Map.of("seizedValue", seizedValue, "maxSeizedValue", maxSeizedValue));
            }

            log.debug("Liquidation check passed: position={} repaid={} seized={} badDebt={}",
                    account.getAddress(), repaidValue, seizedValue, badDebt);
            return new LiquidationAssessment(List.copyOf(resolved), repaidValue, seizedValue, badDebt, healthFactor);
        });
    }

    /** Passes only if the position's collateral is worth strictly less than its debt. */
    public void validateBadDebtLiquidation(String position) {
        Position account = positionRegistry.require(AddressUtil.normalize(position));
        DebtPortfolio debt = debtPortfolio(account);
        BigInteger assetValue = debt.isEmpty() ? BigInteger.ZERO : assetPortfolio(account, debt).total();
        if (debt.isEmpty() || assetValue.compareTo(debt.total()) >= 0) {
            throw new HealthViolationException(
                    HealthViolationException.Reason.NO_BAD_DEBT,
                    "Position " + account.getAddress() + " is not in bad debt",
                    Map.of("position", account.getAddress(), "totalAssetValue", assetValue,
                            "totalDebtValue", debt.total()));
        }
    }

    // ========================
    // VALUATION
    // ========================

    private DebtPortfolio debtPortfolio(Position account) {
        List<String> pools = account.getDebtPools();
        List<BigInteger> values = new ArrayList<>(pools.size());
        BigInteger total = BigInteger.ZERO;
        for (String poolId : pools) {
            BigInteger borrows = poolService.getBorrowsOf(poolId, account.getAddress());
            BigInteger value = borrows.signum() == 0
                    ? BigInteger.ZERO
                    : riskEngine.valueOf(poolId, poolService.getPoolAssetFor(poolId), borrows);
            values.add(value);
            total = total.add(value);
        }

        List<BigInteger> weights = new ArrayList<>(pools.size());
        for (BigInteger value : values) {
            weights.add(total.signum() == 0 ? BigInteger.ZERO : WadMath.divWadUp(value, total));
        }
        return new DebtPortfolio(pools, values, weights, total);
    }

    private AssetPortfolio assetPortfolio(Position account, DebtPortfolio debt) {
        List<String> assets = account.getAssets();
        List<BigInteger> values = new ArrayList<>(assets.size());
        BigInteger total = BigInteger.ZERO;
        for (String asset : assets) {
            BigInteger value = weightedValue(debt, asset, tokenBank.balanceOf(asset, account.getAddress()));
            values.add(value);
            total = total.add(value);
        }
        return new AssetPortfolio(assets, values, total);
    }

    /** Debt-weighted value of {@code amount} of {@code asset} across the position's debt pools. */
    private BigInteger weightedValue(DebtPortfolio debt, String asset, BigInteger amount) {
        if (amount.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger value = BigInteger.ZERO;
        for (int i = 0; i < debt.pools().size(); i++) {
            BigInteger weight = debt.weights().get(i);
            if (weight.signum() == 0) {
                continue;
            }
            value = value.add(WadMath.mulWad(riskEngine.valueOf(debt.pools().get(i), asset, amount), weight));
        }
        return value;
    }

    private BigInteger minReqAssetValue(DebtPortfolio debt, AssetPortfolio assets) {
        BigInteger minReq = BigInteger.ZERO;
        for (int i = 0; i < debt.pools().size(); i++) {
            BigInteger debtValue = debt.values().get(i);
            if (debtValue.signum() == 0) {
                continue;
            }
            String poolId = debt.pools().get(i);
            for (int j = 0; j < assets.assets().size(); j++) {
                BigInteger assetValue = assets.values().get(j);
                if (assetValue.signum() == 0) {
                    continue;
                }
                String asset = assets.assets().get(j);
                BigInteger ltv = riskEngine.ltvFor(poolId, asset);
                if (ltv.signum() == 0) {
                    throw new ValuationException(
                            ValuationException.Reason.UNSUPPORTED_ASSET,
                            "Pool " + poolId + " does not accept " + asset + " as collateral",
                            Map.of("poolId", poolId, "asset", asset));
                }
                BigInteger assetWeight = WadMath.divWadUp(assetValue, assets.total());
                minReq = minReq.add(WadMath.mulDiv(debtValue, assetWeight, ltv, Rounding.UP));
            }
        }
        return minReq;
    }

    private BigInteger healthFactor(Position account, DebtPortfolio debt) {
        AssetPortfolio assets = assetPortfolio(account, debt);
        if (assets.total().signum() == 0) {
            return BigInteger.ZERO;
        }
        return WadMath.divWad(assets.total(), minReqAssetValue(debt, assets));
    }

    private DebtData resolveRepayment(Position account, DebtData repayment, boolean badDebt) {
        String poolId = repayment.poolId();
        if (!account.hasDebtIn(poolId)) {
            throw new BoundsViolationException(
                    BoundsViolationException.Reason.INVALID_PARAMETER,
                    "Position " + account.getAddress() + " owes nothing to pool " + poolId,
                    Map.of("position", account.getAddress(), "poolId", poolId));
        }
        BigInteger borrows = poolService.getBorrowsOf(poolId, account.getAddress());
        BigInteger amount = repayment.isMax() ? borrows : repayment.amount();
        if (amount.compareTo(borrows) > 0) {
            throw new BoundsViolationException(
                    BoundsViolationException.Reason.INVALID_PARAMETER,
                    "Repayment of " + amount + " exceeds the " + borrows + " owed to pool " + poolId,
                    Map.of("position", account.getAddress(), "poolId", poolId));
        }
        BigInteger maxRepay = WadMath.mulWadUp(borrows, protocolParameters.getCloseFactor());
        if (!badDebt && amount.compareTo(maxRepay) > 0) {
            throw new HealthViolationException(
                    HealthViolationException.Reason.CLOSE_FACTOR_EXCEEDED,
                    "Repayment of " + amount + " to pool " + poolId + " exceeds close factor limit " + maxRepay,
                    Map.of("poolId", poolId, "amount", amount, "maxRepay", maxRepay));
        }
        return new DebtData(poolId, amount);
    }
}
