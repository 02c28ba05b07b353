package com.isolend.risk;

import com.isolend.config.ProtocolParameters;
import com.isolend.core.address.AddressUtil;
import com.isolend.core.journal.CallExecutor;
import com.isolend.core.journal.JournaledMap;
import com.isolend.core.journal.JournaledValue;
import com.isolend.core.journal.StateJournal;
import com.isolend.core.math.WadMath;
import com.isolend.domain.model.PendingUpdate;
import com.isolend.event.EventPublisherHelper;
import com.isolend.event.RiskEventType;
import com.isolend.event.RiskLevel;
import com.isolend.exception.BoundsViolationException;
import com.isolend.exception.UnauthorizedException;
import com.isolend.exception.ValuationException;
import com.isolend.oracle.PriceOracle;
import com.isolend.pool.PoolService;
import java.math.BigInteger;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the oracle and loan-to-value bindings of every {@code (pool, asset)} pair.
 *
 * <p>Oracles are bound per pair, so two pools may value the same collateral asset through
 * different feeds. Governance of both bindings is two-step:
 * <ol>
 *   <li>The pool owner requests a value; LTVs must lie in the global {@code [minLtv, maxLtv]}.</li>
 *   <li>After the timelock (and before its deadline) the owner accepts, or rejects it at any time.</li>
 * </ol>
 * The first value of a pair has no borrowers to protect and takes effect on request. The
 * protocol owner can bind an oracle directly and sets the global LTV bounds.
 *
 * <p>Pending updates are keyed per pair, so requests on different pairs never interfere.
 */
@Service
public class RiskEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskEngine.class);

    /** One governed {@code (pool, asset)} pair. */
    record PairKey(String poolId, String asset) {}

    private final PoolService poolService;
    private final CallExecutor callExecutor;
    private final EventPublisherHelper eventPublisherHelper;
    private final ProtocolParameters protocolParameters;
    private final Clock clock;

    private final JournaledMap<PairKey, PriceOracle> oracles;
    private final JournaledMap<PairKey, BigInteger> ltvs;
    private final JournaledMap<PairKey, PendingUpdate<BigInteger>> pendingLtvs;
    private final JournaledMap<PairKey, PendingUpdate<PriceOracle>> pendingOracles;
    private final JournaledValue<BigInteger> minLtv;
    private final JournaledValue<BigInteger> maxLtv;

    public RiskEngine(
            PoolService poolService,
            CallExecutor callExecutor,
            StateJournal stateJournal,
            EventPublisherHelper eventPublisherHelper,
            ProtocolParameters protocolParameters,
            Clock clock) {
        this.poolService = poolService;
        this.callExecutor = callExecutor;
        this.eventPublisherHelper = eventPublisherHelper;
        this.protocolParameters = protocolParameters;
        this.clock = clock;
        this.oracles = stateJournal.newMap();
        this.ltvs = stateJournal.newMap();
        this.pendingLtvs = stateJournal.newMap();
        this.pendingOracles = stateJournal.newMap();
        this.minLtv = stateJournal.newValue(protocolParameters.getMinLtv());
        this.maxLtv = stateJournal.newValue(protocolParameters.getMaxLtv());
    }

    // ========================
    // VALUATION
    // ========================

    /**
     * Values {@code amount} of {@code asset} through the oracle bound for the pair. Oracle
     * failures propagate unchanged.
     */
    public BigInteger valueOf(String poolId, String asset, BigInteger amount) {
        return oracleFor(poolId, asset).valueInReferenceUnit(asset, amount);
    }

    public PriceOracle oracleFor(String poolId, String asset) {
        return callExecutor.read(() -> {
            PriceOracle oracle = oracles.get(new PairKey(poolId, asset));
            if (oracle == null) {
                throw new ValuationException(
                        ValuationException.Reason.NO_ORACLE_FOUND,
                        "No oracle bound for asset " + asset + " in pool " + poolId,
                        Map.of("poolId", poolId, "asset", asset));
            }
            return oracle;
        });
    }

    public boolean hasOracle(String poolId, String asset) {
        return callExecutor.read(() -> oracles.containsKey(new PairKey(poolId, asset)));
    }

    /** LTV of the pair, or zero when the pool does not accept the asset as collateral. */
    public BigInteger ltvFor(String poolId, String asset) {
        return callExecutor.read(() -> ltvs.getOrDefault(new PairKey(poolId, asset), BigInteger.ZERO));
    }

    public BigInteger getMinLtv() {
        return callExecutor.read(() -> minLtv.get());
    }

    public BigInteger getMaxLtv() {
        return callExecutor.read(() -> maxLtv.get());
    }

    public PendingUpdate<BigInteger> getPendingLtvUpdate(String poolId, String asset) {
        return callExecutor.read(() -> pendingLtvs.get(new PairKey(poolId, asset)));
    }

    public PendingUpdate<PriceOracle> getPendingOracleUpdate(String poolId, String asset) {
        return callExecutor.read(() -> pendingOracles.get(new PairKey(poolId, asset)));
    }

    // ========================
    // LTV GOVERNANCE
    // ========================

    public void requestLtvUpdate(String caller, String poolId, String asset, BigInteger ltv) {
        String collateral = AddressUtil.normalize(asset);
        callExecutor.run("RiskEngine.requestLtvUpdate", () -> {
            requirePoolOwner(caller, poolId);
            if (ltv.compareTo(minLtv.get()) < 0 || ltv.compareTo(maxLtv.get()) > 0) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.LTV_OUT_OF_BOUNDS,
                        "LTV " + ltv + " outside [" + minLtv.get() + ", " + maxLtv.get() + "]",
                        Map.of("ltv", ltv, "minLtv", minLtv.get(), "maxLtv", maxLtv.get()));
            }
            oracleFor(poolId, collateral);

            PairKey key = new PairKey(poolId, collateral);
            if (!ltvs.containsKey(key)) {
                ltvs.put(key, ltv);
                pendingLtvs.remove(key);
                log.info("LTV for pool {} asset {} set to {}", poolId, collateral, ltv);
                publishLtv(RiskEventType.LTV_UPDATED, poolId, collateral, ltv, now());
                return;
            }

            PendingUpdate<BigInteger> pending =
                    PendingUpdate.requested(ltv, now(), protocolParameters.getTimelockDuration());
            pendingLtvs.put(key, pending);
            log.info("LTV update requested for pool {} asset {}: {} valid after {}",
                    poolId, collateral, ltv, pending.validAfter());
            publishLtv(RiskEventType.LTV_UPDATE_REQUESTED, poolId, collateral, ltv, pending.validAfter());
        });
    }

    public void acceptLtvUpdate(String caller, String poolId, String asset) {
        String collateral = AddressUtil.normalize(asset);
        callExecutor.run("RiskEngine.acceptLtvUpdate", () -> {
            requirePoolOwner(caller, poolId);
            PairKey key = new PairKey(poolId, collateral);
            PendingUpdate<BigInteger> pending =
                    PendingUpdate.require(pendingLtvs.get(key), "LTV update for " + poolId + "/" + collateral);
            pending.requireAcceptable(now(), protocolParameters.getTimelockDeadline(), "LTV update");

            ltvs.put(key, pending.value());
            pendingLtvs.remove(key);
            log.info("LTV for pool {} asset {} updated to {}", poolId, collateral, pending.value());
            publishLtv(RiskEventType.LTV_UPDATED, poolId, collateral, pending.value(), now());
        });
    }

    public void rejectLtvUpdate(String caller, String poolId, String asset) {
        String collateral = AddressUtil.normalize(asset);
        callExecutor.run("RiskEngine.rejectLtvUpdate", () -> {
            requirePoolOwner(caller, poolId);
            PairKey key = new PairKey(poolId, collateral);
            PendingUpdate<BigInteger> pending =
                    PendingUpdate.require(pendingLtvs.get(key), "LTV update for " + poolId + "/" + collateral);
            pendingLtvs.remove(key);
            log.info("LTV update for pool {} asset {} rejected", poolId, collateral);
            publishLtv(RiskEventType.LTV_UPDATE_REJECTED, poolId, collateral, pending.value(), now());
        });
    }

    public void setLtvBounds(String caller, BigInteger newMinLtv, BigInteger newMaxLtv) {
        callExecutor.run("RiskEngine.setLtvBounds", () -> {
            requireProtocolOwner(caller);
            if (newMinLtv.signum() <= 0
                    || newMinLtv.compareTo(newMaxLtv) > 0
                    || newMaxLtv.compareTo(WadMath.WAD) >= 0) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.INVALID_PARAMETER,
                        "LTV bounds must satisfy 0 < min <= max < 1, got [" + newMinLtv + ", " + newMaxLtv + "]");
            }
            minLtv.set(newMinLtv);
            maxLtv.set(newMaxLtv);
            log.info("LTV bounds set to [{}, {}]", newMinLtv, newMaxLtv);
            eventPublisherHelper.publishRisk(
                    this,
                    RiskEventType.LTV_BOUNDS_SET,
                    RiskLevel.INFO,
                    "LTV bounds updated",
                    Map.of("minLtv", newMinLtv, "maxLtv", newMaxLtv));
        });
    }

    // ========================
    // ORACLE GOVERNANCE
    // ========================

    /** Protocol-owner binding; takes effect immediately and clears any pending request. */
    public void setOracle(String caller, String poolId, String asset, PriceOracle oracle) {
        String collateral = AddressUtil.normalize(asset);
        callExecutor.run("RiskEngine.setOracle", () -> {
            requireProtocolOwner(caller);
            poolService.getPoolData(poolId);
            PairKey key = new PairKey(poolId, collateral);
            oracles.put(key, oracle);
            pendingOracles.remove(key);
            log.info("Oracle for pool {} asset {} set by protocol owner", poolId, collateral);
            publishOracle(RiskEventType.ORACLE_UPDATED, poolId, collateral, now());
        });
    }

    public void requestOracleUpdate(String caller, String poolId, String asset, PriceOracle oracle) {
        String collateral = AddressUtil.normalize(asset);
        callExecutor.run("RiskEngine.requestOracleUpdate", () -> {
            requirePoolOwner(caller, poolId);
            PairKey key = new PairKey(poolId, collateral);
            if (!oracles.containsKey(key)) {
                oracles.put(key, oracle);
                log.info("Oracle for pool {} asset {} bound", poolId, collateral);
                publishOracle(RiskEventType.ORACLE_UPDATED, poolId, collateral, now());
                return;
            }
            PendingUpdate<PriceOracle> pending =
                    PendingUpdate.requested(oracle, now(), protocolParameters.getTimelockDuration());
            pendingOracles.put(key, pending);
            log.info("Oracle update requested for pool {} asset {}, valid after {}",
                    poolId, collateral, pending.validAfter());
            publishOracle(RiskEventType.ORACLE_UPDATE_REQUESTED, poolId, collateral, pending.validAfter());
        });
    }

    public void acceptOracleUpdate(String caller, String poolId, String asset) {
        String collateral = AddressUtil.normalize(asset);
        callExecutor.run("RiskEngine.acceptOracleUpdate", () -> {
            requirePoolOwner(caller, poolId);
            PairKey key = new PairKey(poolId, collateral);
            PendingUpdate<PriceOracle> pending =
                    PendingUpdate.require(pendingOracles.get(key), "oracle update for " + poolId + "/" + collateral);
            pending.requireAcceptable(now(), protocolParameters.getTimelockDeadline(), "Oracle update");
            oracles.put(key, pending.value());
            pendingOracles.remove(key);
            log.info("Oracle for pool {} asset {} updated", poolId, collateral);
            publishOracle(RiskEventType.ORACLE_UPDATED, poolId, collateral, now());
        });
    }

    public void rejectOracleUpdate(String caller, String poolId, String asset) {
        String collateral = AddressUtil.normalize(asset);
        callExecutor.run("RiskEngine.rejectOracleUpdate", () -> {
            requirePoolOwner(caller, poolId);
            PairKey key = new PairKey(poolId, collateral);
            PendingUpdate.require(pendingOracles.get(key), "oracle update for " + poolId + "/" + collateral);
            pendingOracles.remove(key);
            log.info("Oracle update for pool {} asset {} rejected", poolId, collateral);
            publishOracle(RiskEventType.ORACLE_UPDATE_REJECTED, poolId, collateral, now());
        });
    }

    // ========================
    // HELPERS
    // ========================

    private void requirePoolOwner(String caller, String poolId) {
        if (!poolService.getPoolOwnerFor(poolId).equals(AddressUtil.normalize(caller))) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.ONLY_POOL_OWNER,
                    "Only the owner of pool " + poolId + " may govern its risk parameters; caller " + caller);
        }
    }

    private void requireProtocolOwner(String caller) {
        if (!protocolParameters.getProtocolOwner().equals(AddressUtil.normalize(caller))) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.ONLY_PROTOCOL_OWNER, "Only the protocol owner; caller " + caller);
        }
    }

    private void publishLtv(RiskEventType type, String poolId, String asset, BigInteger ltv, long at) {
        eventPublisherHelper.publishRisk(
                this,
                type,
                RiskLevel.INFO,
                type + " for " + poolId + "/" + asset,
                Map.of("poolId", poolId, "asset", asset, "ltv", ltv, "at", at));
    }

    private void publishOracle(RiskEventType type, String poolId, String asset, long at) {
        eventPublisherHelper.publishRisk(
                this,
                type,
                RiskLevel.INFO,
                type + " for " + poolId + "/" + asset,
                Map.of("poolId", poolId, "asset", asset, "at", at));
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
