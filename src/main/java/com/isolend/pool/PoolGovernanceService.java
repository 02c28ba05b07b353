package com.isolend.pool;

import com.isolend.config.ProtocolParameters;
import com.isolend.core.address.AddressDeriver;
import com.isolend.core.address.AddressUtil;
import com.isolend.core.journal.CallExecutor;
import com.isolend.core.math.WadMath;
import com.isolend.domain.model.PendingUpdate;
import com.isolend.event.EventPublisherHelper;
import com.isolend.event.PoolEventType;
import com.isolend.exception.BoundsViolationException;
import com.isolend.exception.ProtocolStateException;
import com.isolend.exception.UnauthorizedException;
import com.isolend.irm.RateModel;
import com.isolend.irm.RateModelRegistry;
import java.math.BigInteger;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Market creation and configuration.
 *
 * <p>Pool owners control caps, pausing and the rate model of their own markets; rate-model
 * swaps go through a request/accept timelock so borrowers can react before the curve changes.
 * The protocol owner controls fees, borrow minimums and the rate-model registry.
 */
@Service
public class PoolGovernanceService {

    private static final Logger log = LoggerFactory.getLogger(PoolGovernanceService.class);

    private final PoolStore poolStore;
    private final PoolService poolService;
    private final RateModelRegistry rateModelRegistry;
    private final CallExecutor callExecutor;
    private final EventPublisherHelper eventPublisherHelper;
    private final ProtocolParameters protocolParameters;
    private final Clock clock;

    public PoolGovernanceService(
            PoolStore poolStore,
            PoolService poolService,
            RateModelRegistry rateModelRegistry,
            CallExecutor callExecutor,
            EventPublisherHelper eventPublisherHelper,
            ProtocolParameters protocolParameters,
            Clock clock) {
        this.poolStore = poolStore;
        this.poolService = poolService;
        this.rateModelRegistry = rateModelRegistry;
        this.callExecutor = callExecutor;
        this.eventPublisherHelper = eventPublisherHelper;
        this.protocolParameters = protocolParameters;
        this.clock = clock;
    }

    // ========================
    // MARKET CREATION
    // ========================

    /**
     * Opens a market owned by the caller. The id is derived from {@code (owner, asset,
     * rateModelKey)}; opening the same triple twice fails. The initial deposit is pulled from
     * the caller and its shares are locked at the dead address.
     *
     * @return the new market id
     */
    public String initializePool(
            String caller,
            String asset,
            String rateModelKey,
            BigInteger depositCap,
            BigInteger borrowCap,
            BigInteger initialDeposit) {
        String owner = AddressUtil.normalize(caller);
        String poolAsset = AddressUtil.normalize(asset);
        return callExecutor.execute("Pool.initializePool", () -> {
            if (!rateModelRegistry.contains(rateModelKey)) {
                throw new ProtocolStateException(
                        ProtocolStateException.Reason.UNKNOWN_RATE_MODEL,
                        "No rate model registered under " + rateModelKey,
                        Map.of("rateModelKey", rateModelKey));
            }
            if (initialDeposit.compareTo(protocolParameters.getMinInitialDeposit()) < 0) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.INVALID_PARAMETER,
                        "Initial deposit " + initialDeposit + " below minimum "
                                + protocolParameters.getMinInitialDeposit());
            }

            String poolId = AddressDeriver.poolId(owner, poolAsset, rateModelKey);
            if (poolStore.exists(poolId)) {
                throw new ProtocolStateException(
                        ProtocolStateException.Reason.POOL_ALREADY_INITIALIZED,
                        "Pool " + poolId + " already exists for owner " + owner + ", asset " + poolAsset
                                + " and rate model " + rateModelKey,
                        Map.of("poolId", poolId));
            }

            PoolData pool = PoolData.builder()
                    .poolId(poolId)
                    .owner(owner)
                    .asset(poolAsset)
                    .rateModelKey(rateModelKey)
                    .paused(false)
                    .depositCap(WadMath.requireUnsigned(depositCap))
                    .borrowCap(WadMath.requireUnsigned(borrowCap))
                    .interestFee(poolStore.defaultInterestFee.get())
                    .originationFee(poolStore.defaultOriginationFee.get())
                    .lastUpdated(now())
                    .totalDepositAssets(BigInteger.ZERO)
                    .totalDepositShares(BigInteger.ZERO)
                    .totalBorrowAssets(BigInteger.ZERO)
                    .totalBorrowShares(BigInteger.ZERO)
                    .build();
            poolStore.pools.put(poolId, pool);

            if (initialDeposit.signum() > 0) {
                poolService.deposit(owner, poolId, initialDeposit, AddressUtil.DEAD_ADDRESS);
            }

            log.info("Pool initialized: id={} owner={} asset={} rateModel={} depositCap={} borrowCap={}",
                    poolId, owner, poolAsset, rateModelKey, depositCap, borrowCap);
            eventPublisherHelper.publishPool(
                    this, PoolEventType.POOL_INITIALIZED, poolId, owner, initialDeposit, BigInteger.ZERO);
            return poolId;
        });
    }

    // ========================
    // POOL OWNER SETTINGS
    // ========================

    public void setPoolCap(String caller, String poolId, BigInteger depositCap) {
        callExecutor.run("Pool.setPoolCap", () -> {
            requirePoolOwner(caller, poolId);
            poolStore.pools.update(poolId, p -> p.toBuilder()
                    .depositCap(WadMath.requireUnsigned(depositCap))
                    .build());
            log.info("Pool {} deposit cap set to {}", poolId, depositCap);
            eventPublisherHelper.publishPoolConfig(this, PoolEventType.POOL_CAP_SET, poolId);
        });
    }

    public void setBorrowCap(String caller, String poolId, BigInteger borrowCap) {
        callExecutor.run("Pool.setBorrowCap", () -> {
            requirePoolOwner(caller, poolId);
            poolStore.pools.update(poolId, p -> p.toBuilder()
                    .borrowCap(WadMath.requireUnsigned(borrowCap))
                    .build());
            log.info("Pool {} borrow cap set to {}", poolId, borrowCap);
            eventPublisherHelper.publishPoolConfig(this, PoolEventType.BORROW_CAP_SET, poolId);
        });
    }

    /** Paused pools reject deposits and borrows; withdrawals and repayments still work. */
    public boolean togglePause(String caller, String poolId) {
        return callExecutor.execute("Pool.togglePause", () -> {
            requirePoolOwner(caller, poolId);
            PoolData updated = poolStore.pools.update(poolId, p -> p.toBuilder()
                    .paused(!p.isPaused())
                    .build());
            log.info("Pool {} paused={}", poolId, updated.isPaused());
            eventPublisherHelper.publishPoolConfig(this, PoolEventType.PAUSE_TOGGLED, poolId);
            return updated.isPaused();
        });
    }

    public void requestRateModelUpdate(String caller, String poolId, String rateModelKey) {
        callExecutor.run("Pool.requestRateModelUpdate", () -> {
            requirePoolOwner(caller, poolId);
            rateModelRegistry.get(rateModelKey);
            PendingUpdate<String> pending =
                    PendingUpdate.requested(rateModelKey, now(), protocolParameters.getTimelockDuration());
            poolStore.pendingRateModels.put(poolId, pending);
            log.info("Rate model update requested for pool {}: {} valid after {}",
                    poolId, rateModelKey, pending.validAfter());
            eventPublisherHelper.publishPoolConfig(this, PoolEventType.RATE_MODEL_UPDATE_REQUESTED, poolId);
        });
    }

    /** Accrues under the old model up to now, then switches to the pending one. */
    public void acceptRateModelUpdate(String caller, String poolId) {
        callExecutor.run("Pool.acceptRateModelUpdate", () -> {
            requirePoolOwner(caller, poolId);
            PendingUpdate<String> pending =
                    PendingUpdate.require(poolStore.pendingRateModels.get(poolId), "rate model update for " + poolId);
            pending.requireAcceptable(now(), protocolParameters.getTimelockDeadline(), "Rate model update");

            poolService.accrue(poolId);
            poolStore.pools.update(poolId, p -> p.toBuilder()
                    .rateModelKey(pending.value())
                    .build());
            poolStore.pendingRateModels.remove(poolId);
            log.info("Rate model of pool {} is now {}", poolId, pending.value());
            eventPublisherHelper.publishPoolConfig(this, PoolEventType.RATE_MODEL_UPDATED, poolId);
        });
    }

    public void rejectRateModelUpdate(String caller, String poolId) {
        callExecutor.run("Pool.rejectRateModelUpdate", () -> {
            requirePoolOwner(caller, poolId);
            PendingUpdate.require(poolStore.pendingRateModels.get(poolId), "rate model update for " + poolId);
            poolStore.pendingRateModels.remove(poolId);
            log.info("Rate model update for pool {} rejected", poolId);
            eventPublisherHelper.publishPoolConfig(this, PoolEventType.RATE_MODEL_UPDATE_REJECTED, poolId);
        });
    }

    public PendingUpdate<String> getPendingRateModelUpdate(String poolId) {
        return poolStore.pendingRateModels.get(poolId);
    }

    // ========================
    // PROTOCOL OWNER SETTINGS
    // ========================

    public void registerRateModel(String caller, String key, RateModel model) {
        callExecutor.run("Pool.registerRateModel", () -> {
            requireProtocolOwner(caller);
            rateModelRegistry.register(key, model);
        });
    }

    /** Accrues first so the new fee only applies to interest earned from now on. */
    public void setInterestFee(String caller, String poolId, BigInteger interestFee) {
        callExecutor.run("Pool.setInterestFee", () -> {
            requireProtocolOwner(caller);
            requireFraction(interestFee);
            poolService.accrue(poolId);
            poolStore.pools.update(poolId, p -> p.toBuilder().interestFee(interestFee).build());
            log.info("Pool {} interest fee set to {}", poolId, interestFee);
            eventPublisherHelper.publishPoolConfig(this, PoolEventType.FEES_SET, poolId);
        });
    }

    public void setOriginationFee(String caller, String poolId, BigInteger originationFee) {
        callExecutor.run("Pool.setOriginationFee", () -> {
            requireProtocolOwner(caller);
            requireFraction(originationFee);
            poolStore.pools.update(poolId, p -> p.toBuilder().originationFee(originationFee).build());
            log.info("Pool {} origination fee set to {}", poolId, originationFee);
            eventPublisherHelper.publishPoolConfig(this, PoolEventType.FEES_SET, poolId);
        });
    }

    /** Fee applied to markets opened from now on. */
    public void setDefaultInterestFee(String caller, BigInteger interestFee) {
        callExecutor.run("Pool.setDefaultInterestFee", () -> {
            requireProtocolOwner(caller);
            requireFraction(interestFee);
            poolStore.defaultInterestFee.set(interestFee);
        });
    }

    public void setDefaultOriginationFee(String caller, BigInteger originationFee) {
        callExecutor.run("Pool.setDefaultOriginationFee", () -> {
            requireProtocolOwner(caller);
            requireFraction(originationFee);
            poolStore.defaultOriginationFee.set(originationFee);
        });
    }

    public void setMinBorrow(String caller, BigInteger minBorrow) {
        callExecutor.run("Pool.setMinBorrow", () -> {
            requireProtocolOwner(caller);
            poolStore.minBorrow.set(WadMath.requireUnsigned(minBorrow));
            log.info("Minimum borrow set to {}", minBorrow);
        });
    }

    public void setMinDebt(String caller, BigInteger minDebt) {
        callExecutor.run("Pool.setMinDebt", () -> {
            requireProtocolOwner(caller);
            poolStore.minDebt.set(WadMath.requireUnsigned(minDebt));
            log.info("Minimum debt set to {}", minDebt);
        });
    }

    // ========================
    // GUARDS
    // ========================

    private void requirePoolOwner(String caller, String poolId) {
        PoolData pool = poolStore.require(poolId);
        if (!pool.getOwner().equals(AddressUtil.normalize(caller))) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.ONLY_POOL_OWNER,
                    "Only the owner of pool " + poolId + " may change it; caller " + caller);
        }
    }

    private void requireProtocolOwner(String caller) {
        if (!protocolParameters.getProtocolOwner().equals(AddressUtil.normalize(caller))) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.ONLY_PROTOCOL_OWNER, "Only the protocol owner; caller " + caller);
        }
    }

    private void requireFraction(BigInteger fee) {
        if (WadMath.requireUnsigned(fee).compareTo(WadMath.WAD) > 0) {
            throw new BoundsViolationException(
                    BoundsViolationException.Reason.FEE_TOO_HIGH, "Fee " + fee + " exceeds 100%");
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
