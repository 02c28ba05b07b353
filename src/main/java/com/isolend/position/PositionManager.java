package com.isolend.position;

import com.isolend.config.ProtocolParameters;
import com.isolend.core.address.AddressDeriver;
import com.isolend.core.address.AddressUtil;
import com.isolend.core.journal.CallExecutor;
import com.isolend.core.journal.JournaledMap;
import com.isolend.core.journal.JournaledValue;
import com.isolend.core.journal.StateJournal;
import com.isolend.core.math.WadMath;
import com.isolend.event.EventPublisherHelper;
import com.isolend.event.PositionEventType;
import com.isolend.event.RiskEventType;
import com.isolend.event.RiskLevel;
import com.isolend.exception.BoundsViolationException;
import com.isolend.exception.HealthViolationException;
import com.isolend.exception.ResourceNotFoundException;
import com.isolend.exception.UnauthorizedException;
import com.isolend.pool.PoolService;
import com.isolend.risk.AssetData;
import com.isolend.risk.DebtData;
import com.isolend.risk.LiquidationAssessment;
import com.isolend.risk.RiskModule;
import com.isolend.token.TokenBank;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.utils.Numeric;

/**
 * Sole mutation entry point for positions.
 *
 * <p>{@link #processBatch} applies every action in order and runs one health check at the end,
 * so intermediate states may be unhealthy (borrow, then deposit the proceeds as collateral).
 * Every action except NEW_POSITION requires the caller to be the owner or an operator of the
 * position. APPROVE and EXEC are sandboxed by protocol-owner allow-lists.
 *
 * <p>Liquidations use the risk module's liquidation checks instead of the plain health check.
 */
@Service
public class PositionManager {

    private static final Logger log = LoggerFactory.getLogger(PositionManager.class);

    record FuncKey(String target, String selector) {}

    private final PositionRegistry positionRegistry;
    private final PoolService poolService;
    private final RiskModule riskModule;
    private final TokenBank tokenBank;
    private final ExecTargetRegistry execTargetRegistry;
    private final CallExecutor callExecutor;
    private final EventPublisherHelper eventPublisherHelper;
    private final ProtocolParameters protocolParameters;

    private final JournaledMap<String, Boolean> knownAssets;
    private final JournaledMap<String, Boolean> knownSpenders;
    private final JournaledMap<FuncKey, Boolean> knownFuncs;
    private final JournaledValue<BigInteger> liquidationFee;

    public PositionManager(
            PositionRegistry positionRegistry,
            PoolService poolService,
            RiskModule riskModule,
            TokenBank tokenBank,
            ExecTargetRegistry execTargetRegistry,
            CallExecutor callExecutor,
            StateJournal stateJournal,
            EventPublisherHelper eventPublisherHelper,
            ProtocolParameters protocolParameters) {
        this.positionRegistry = positionRegistry;
        this.poolService = poolService;
        this.riskModule = riskModule;
        this.tokenBank = tokenBank;
        this.execTargetRegistry = execTargetRegistry;
        this.callExecutor = callExecutor;
        this.eventPublisherHelper = eventPublisherHelper;
        this.protocolParameters = protocolParameters;
        this.knownAssets = stateJournal.newMap();
        this.knownSpenders = stateJournal.newMap();
        this.knownFuncs = stateJournal.newMap();
        this.liquidationFee = stateJournal.newValue(protocolParameters.getLiquidationFee());
    }

    // ========================
    // ACTION PROCESSING
    // ========================

    public void process(String caller, String position, Action action) {
        processBatch(caller, position, List.of(action));
    }

    /**
     * Applies {@code actions} to {@code position} and fails with HEALTH_CHECK_FAILED if the
     * position ends unhealthy. Either every action applies or none does.
     */
    public void processBatch(String caller, String position, List<Action> actions) {
        String sender = AddressUtil.normalize(caller);
        String account = AddressUtil.normalize(position);
        callExecutor.run("PositionManager.processBatch", () -> {
            for (Action action : actions) {
                apply(sender, account, action);
            }
            if (!riskModule.isPositionHealthy(account)) {
                eventPublisherHelper.publishRejection(
                        this,
                        RiskEventType.HEALTH_CHECK_FAILED,
                        "Batch left position " + account + " unhealthy",
                        Map.of("position", account, "caller", sender, "actions", actions.size()));
                throw new HealthViolationException(
                        HealthViolationException.Reason.HEALTH_CHECK_FAILED,
                        "Position " + account + " is unhealthy after the batch",
                        Map.of("position", account));
            }
        });
    }

    private void apply(String caller, String position, Action action) {
        if (action.getOp() == Operation.NEW_POSITION) {
            newPosition(caller, position, action);
            return;
        }
        if (!positionRegistry.isAuth(position, caller)) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.NOT_OWNER_OR_OPERATOR,
                    caller + " is not the owner or an operator of position " + position,
                    Map.of("position", position, "caller", caller));
        }

        switch (action.getOp()) {
            case DEPOSIT -> deposit(caller, position, action);
            case WITHDRAW -> withdraw(caller, position, action);
            case ADD_COLLATERAL_TYPE -> addToken(caller, position, action);
            case REMOVE_COLLATERAL_TYPE -> removeToken(caller, position, action);
            case BORROW -> borrow(caller, position, action);
            case REPAY -> repay(caller, position, action);
            case APPROVE -> approve(caller, position, action);
            case EXEC -> exec(caller, position, action);
            default -> throw new IllegalStateException("Unhandled operation " + action.getOp());
        }
    }

    private void newPosition(String caller, String position, Action action) {
        String owner = AddressUtil.normalize(action.getOwner());
        String expected = AddressDeriver.positionAddress(managerAddress(), owner, action.getSalt());
        if (!expected.equals(position)) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.INVALID_POSITION_ADDRESS,
                    "Salt " + action.getSalt() + " for owner " + owner + " derives " + expected + ", not " + position,
                    Map.of("expected", expected, "claimed", position));
        }
        positionRegistry.create(position, owner);
        log.info("Position {} deployed for owner {}", position, owner);
        eventPublisherHelper.publishPosition(
                this, PositionEventType.POSITION_DEPLOYED, position, caller, Map.of("owner", owner));
    }

    /** Pulls tokens from the caller, who must have approved the position manager. */
    private void deposit(String caller, String position, Action action) {
        String asset = AddressUtil.normalize(action.getAsset());
        tokenBank.transferFrom(asset, managerAddress(), caller, position, action.getAmount());
        publish(PositionEventType.DEPOSIT, position, caller, Map.of("asset", asset, "amount", action.getAmount()));
    }

    private void withdraw(String caller, String position, Action action) {
        String asset = AddressUtil.normalize(action.getAsset());
        String recipient = AddressUtil.normalize(action.getCounterparty());
        tokenBank.transfer(asset, position, recipient, action.getAmount());
        dropIfDrained(position, asset);
        publish(PositionEventType.WITHDRAW, position, caller,
                Map.of("asset", asset, "recipient", recipient, "amount", action.getAmount()));
    }

    private void addToken(String caller, String position, Action action) {
        String asset = AddressUtil.normalize(action.getAsset());
        requireKnownAsset(asset);
        positionRegistry.addAsset(position, asset);
        publish(PositionEventType.ADD_COLLATERAL_TYPE, position, caller, Map.of("asset", asset));
    }

    private void removeToken(String caller, String position, Action action) {
        String asset = AddressUtil.normalize(action.getAsset());
        positionRegistry.removeAsset(position, asset);
        publish(PositionEventType.REMOVE_COLLATERAL_TYPE, position, caller, Map.of("asset", asset));
    }

    private void borrow(String caller, String position, Action action) {
        String poolId = action.getPoolId();
        if (!poolService.exists(poolId)) {
            throw new ResourceNotFoundException("Pool", poolId);
        }
        poolService.borrow(managerAddress(), poolId, position, action.getAmount());
        positionRegistry.addDebtPool(position, poolId);
        publish(PositionEventType.BORROW, position, caller, Map.of("poolId", poolId, "amount", action.getAmount()));
    }

    private void repay(String caller, String position, Action action) {
        String poolId = action.getPoolId();
        BigInteger amount = DebtData.MAX.equals(action.getAmount())
                ? poolService.getBorrowsOf(poolId, position)
                : action.getAmount();
        repayFrom(position, position, poolId, amount);
        publish(PositionEventType.REPAY, position, caller, Map.of("poolId", poolId, "amount", amount));
    }

    private void approve(String caller, String position, Action action) {
        String asset = AddressUtil.normalize(action.getAsset());
        String spender = AddressUtil.normalize(action.getCounterparty());
        requireKnownAsset(asset);
        if (!knownSpenders.getOrDefault(spender, false)) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.UNKNOWN_SPENDER,
                    "Spender " + spender + " is not allow-listed",
                    Map.of("spender", spender));
        }
        tokenBank.approve(asset, position, spender, action.getAmount());
        publish(PositionEventType.APPROVE, position, caller,
                Map.of("asset", asset, "spender", spender, "amount", action.getAmount()));
    }

    private void exec(String caller, String position, Action action) {
        String target = AddressUtil.normalize(action.getCounterparty());
        byte[] calldata = Numeric.hexStringToByteArray(action.getData());
        String selector = Calldata.selectorOf(calldata);
        if (!knownFuncs.getOrDefault(new FuncKey(target, selector), false)) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.UNKNOWN_FUNCTION,
                    "Function " + selector + " on " + target + " is not allow-listed",
                    Map.of("target", target, "selector", selector));
        }
        execTargetRegistry.require(target).execute(position, calldata);
        publish(PositionEventType.EXEC, position, caller, Map.of("target", target, "selector", selector));
    }

    // ========================
    // LIQUIDATION
    // ========================

    /**
     * Repays {@code debts} from the caller's tokens and hands {@code seized} collateral to the
     * caller, minus the liquidation fee. Unless the position is in bad debt, its health factor may
     * not be lower afterwards.
     */
    public void liquidate(String caller, String position, List<DebtData> debts, List<AssetData> seized) {
        String liquidator = AddressUtil.normalize(caller);
        String account = AddressUtil.normalize(position);
        callExecutor.run("PositionManager.liquidate", () -> {
            LiquidationAssessment assessment = riskModule.validateLiquidation(account, debts, seized);

            for (DebtData debt : assessment.debts()) {
                if (debt.amount().signum() > 0) {
                    repayFrom(liquidator, account, debt.poolId(), debt.amount());
                }
            }
            BigInteger fee = liquidationFee.get();
            for (AssetData seizure : seized) {
                String asset = AddressUtil.normalize(seizure.asset());
                BigInteger feeAmount = WadMath.mulWad(seizure.amount(), fee);
                if (feeAmount.signum() > 0) {
                    tokenBank.transfer(asset, account, protocolParameters.getFeeRecipient(), feeAmount);
                }
                tokenBank.transfer(asset, account, liquidator, seizure.amount().subtract(feeAmount));
                dropIfDrained(account, asset);
            }

            if (!assessment.badDebt()) {
                BigInteger healthAfter = riskModule.healthFactor(account);
                if (healthAfter.compareTo(assessment.healthFactor()) < 0) {
                    throw new HealthViolationException(
                            HealthViolationException.Reason.LIQUIDATION_WORSENED_HEALTH,
                            "Liquidation lowers health factor of " + account + " from "
                                    + assessment.healthFactor() + " to " + healthAfter,
                            Map.of("position", account, "before", assessment.healthFactor(), "after", healthAfter));
                }
            }

            log.info("Position {} liquidated by {}: repaid value {}, seized value {}, badDebt={}",
                    account, liquidator, assessment.repaidValue(), assessment.seizedValue(), assessment.badDebt());
            eventPublisherHelper.publishRisk(
                    this,
                    RiskEventType.LIQUIDATION,
                    RiskLevel.WARNING,
                    "Position " + account + " liquidated",
                    Map.of("position", account,
                            "liquidator", liquidator,
                            "repaidValue", assessment.repaidValue(),
                            "seizedValue", assessment.seizedValue(),
                            "badDebt", assessment.badDebt()));
        });
    }

    /**
     * Moves all of a bad-debt position's collateral to the protocol owner and writes its debt off
     * in every pool it owes.
     */
    public void liquidateBadDebt(String caller, String position) {
        String account = AddressUtil.normalize(position);
        callExecutor.run("PositionManager.liquidateBadDebt", () -> {
            requireProtocolOwner(caller);
            riskModule.validateBadDebtLiquidation(account);

            Position snapshot = positionRegistry.require(account);
            String recipient = AddressUtil.normalize(caller);
            for (String asset : snapshot.getAssets()) {
                BigInteger balance = tokenBank.balanceOf(asset, account);
                if (balance.signum() > 0) {
                    tokenBank.transfer(asset, account, recipient, balance);
                }
                positionRegistry.removeAsset(account, asset);
            }
            BigInteger writtenOff = BigInteger.ZERO;
            for (String poolId : snapshot.getDebtPools()) {
                writtenOff = writtenOff.add(poolService.rebalanceBadDebt(managerAddress(), poolId, account));
                positionRegistry.removeDebtPool(account, poolId);
            }

            log.warn("Bad debt liquidation of {}: {} debt written off", account, writtenOff);
            eventPublisherHelper.publishRisk(
                    this,
                    RiskEventType.BAD_DEBT_LIQUIDATION,
                    RiskLevel.CRITICAL,
                    "Bad debt of position " + account + " written off",
                    Map.of("position", account, "writtenOff", writtenOff));
        });
    }

    // ========================
    // AUTHORIZATION
    // ========================

    /** Toggles {@code user} as an operator of {@code position}; owner only. */
    public boolean toggleAuth(String caller, String user, String position) {
        String owner = AddressUtil.normalize(caller);
        String account = AddressUtil.normalize(position);
        String operator = AddressUtil.normalize(user);
        return callExecutor.execute("PositionManager.toggleAuth", () -> {
            requirePositionOwner(owner, account);
            boolean enabled = positionRegistry.toggleOperator(account, operator);
            publish(PositionEventType.AUTH_TOGGLED, account, owner, Map.of("user", operator, "enabled", enabled));
            return enabled;
        });
    }

    public void transferPositionOwnership(String caller, String position, String newOwner) {
        String owner = AddressUtil.normalize(caller);
        String account = AddressUtil.normalize(position);
        String next = AddressUtil.normalize(newOwner);
        callExecutor.run("PositionManager.transferPositionOwnership", () -> {
            requirePositionOwner(owner, account);
            positionRegistry.setOwner(account, next);
            log.info("Position {} ownership transferred from {} to {}", account, owner, next);
            publish(PositionEventType.OWNERSHIP_TRANSFERRED, account, owner, Map.of("newOwner", next));
        });
    }

    public String ownerOf(String position) {
        return callExecutor.read(() -> positionRegistry.ownerOf(AddressUtil.normalize(position)));
    }

    public boolean isAuth(String position, String user) {
        return callExecutor.read(
                () -> positionRegistry.isAuth(AddressUtil.normalize(position), AddressUtil.normalize(user)));
    }

    // ========================
    // PROTOCOL OWNER SETTINGS
    // ========================

    public boolean toggleKnownAsset(String caller, String asset) {
        String token = AddressUtil.normalize(asset);
        return callExecutor.execute("PositionManager.toggleKnownAsset", () -> {
            requireProtocolOwner(caller);
            boolean known = toggle(knownAssets, token);
            publish(PositionEventType.KNOWN_ASSET_TOGGLED, managerAddress(), caller,
                    Map.of("asset", token, "known", known));
            return known;
        });
    }

    public boolean toggleKnownSpender(String caller, String spender) {
        String address = AddressUtil.normalize(spender);
        return callExecutor.execute("PositionManager.toggleKnownSpender", () -> {
            requireProtocolOwner(caller);
            boolean known = toggle(knownSpenders, address);
            publish(PositionEventType.KNOWN_SPENDER_TOGGLED, managerAddress(), caller,
                    Map.of("spender", address, "known", known));
            return known;
        });
    }

    /** Toggles the {@code (target, selector)} pair EXEC actions may call. */
    public boolean toggleKnownFunc(String caller, String target, String selector) {
        FuncKey key = new FuncKey(AddressUtil.normalize(target), selector.toLowerCase());
        return callExecutor.execute("PositionManager.toggleKnownFunc", () -> {
            requireProtocolOwner(caller);
            boolean known = toggle(knownFuncs, key);
            publish(PositionEventType.KNOWN_FUNC_TOGGLED, managerAddress(), caller,
                    Map.of("target", key.target(), "selector", key.selector(), "known", known));
            return known;
        });
    }

    public void setLiquidationFee(String caller, BigInteger fee) {
        callExecutor.run("PositionManager.setLiquidationFee", () -> {
            requireProtocolOwner(caller);
            if (fee.signum() < 0 || fee.compareTo(WadMath.WAD) > 0) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.FEE_TOO_HIGH, "Liquidation fee " + fee + " exceeds 100%");
            }
            liquidationFee.set(fee);
            publish(PositionEventType.LIQUIDATION_FEE_SET, managerAddress(), caller, Map.of("fee", fee));
        });
    }

    public boolean isKnownAsset(String asset) {
        return callExecutor.read(() -> knownAssets.getOrDefault(AddressUtil.normalize(asset), false));
    }

    public boolean isKnownSpender(String spender) {
        return callExecutor.read(() -> knownSpenders.getOrDefault(AddressUtil.normalize(spender), false));
    }

    public boolean isKnownFunc(String target, String selector) {
        return callExecutor.read(() -> knownFuncs.getOrDefault(
                new FuncKey(AddressUtil.normalize(target), selector.toLowerCase()), false));
    }

    public BigInteger getLiquidationFee() {
        return callExecutor.read(() -> liquidationFee.get());
    }

    // ========================
    // HELPERS
    // ========================

    /** Moves {@code amount} from {@code payer} to the pool and clears that much of the position's debt. */
    private void repayFrom(String payer, String position, String poolId, BigInteger amount) {
        String asset = poolService.getPoolAssetFor(poolId);
        if (payer.equals(position)) {
            tokenBank.transfer(asset, position, poolAddress(), amount);
        } else {
            tokenBank.transferFrom(asset, managerAddress(), payer, poolAddress(), amount);
        }
        BigInteger remainingShares = poolService.repay(managerAddress(), poolId, position, amount);
        if (remainingShares.signum() == 0) {
            positionRegistry.removeDebtPool(position, poolId);
        }
    }

    private void dropIfDrained(String position, String asset) {
        if (tokenBank.balanceOf(asset, position).signum() == 0) {
            positionRegistry.removeAsset(position, asset);
        }
    }

    private void requireKnownAsset(String asset) {
        if (!knownAssets.getOrDefault(asset, false)) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.UNKNOWN_ASSET,
                    "Asset " + asset + " is not allow-listed",
                    Map.of("asset", asset));
        }
    }

    private void requirePositionOwner(String caller, String position) {
        String owner = positionRegistry.ownerOf(position);
        if (owner == null) {
            throw new ResourceNotFoundException("Position", position);
        }
        if (!owner.equals(caller)) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.NOT_OWNER_OR_OPERATOR,
                    "Only the owner of position " + position + " may do this; caller " + caller);
        }
    }

    private void requireProtocolOwner(String caller) {
        if (!protocolParameters.getProtocolOwner().equals(AddressUtil.normalize(caller))) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.ONLY_PROTOCOL_OWNER, "Only the protocol owner; caller " + caller);
        }
    }

    private static <K> boolean toggle(JournaledMap<K, Boolean> flags, K key) {
        boolean enabled = !flags.getOrDefault(key, false);
        if (enabled) {
            flags.put(key, true);
        } else {
            flags.remove(key);
        }
        return enabled;
    }

    private void publish(PositionEventType type, String position, String caller, Map<String, Object> details) {
        eventPublisherHelper.publishPosition(this, type, position, caller, details);
    }

    private String managerAddress() {
        return protocolParameters.getPositionManagerAddress();
    }

    private String poolAddress() {
        return protocolParameters.getPoolAddress();
    }
}
