package com.isolend.superpool;

import com.isolend.config.ProtocolParameters;
import com.isolend.core.address.AddressUtil;
import com.isolend.core.journal.CallExecutor;
import com.isolend.core.journal.JournaledMap;
import com.isolend.core.journal.JournaledValue;
import com.isolend.core.journal.StateJournal;
import com.isolend.core.math.SharesMath;
import com.isolend.core.math.WadMath;
import com.isolend.domain.enums.Rounding;
import com.isolend.domain.model.PendingUpdate;
import com.isolend.event.EventPublisherHelper;
import com.isolend.event.SuperPoolEventType;
import com.isolend.exception.BoundsViolationException;
import com.isolend.exception.DegenerateArithmeticException;
import com.isolend.exception.InsufficientFundsException;
import com.isolend.exception.ProtocolStateException;
import com.isolend.exception.UnauthorizedException;
import com.isolend.pool.PoolData;
import com.isolend.pool.PoolService;
import com.isolend.token.TokenBank;
import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vault over one asset that lends its deposits across several pools.
 *
 * <p>{@link #totalAssets()} is the idle balance plus the value of its shares in every member
 * pool, including interest the pools have not accrued yet. Deposits fill member pools in
 * deposit-queue order up to each pool's cap; withdrawals spend idle assets first, then drain
 * pools in withdraw-queue order as far as their liquidity allows.
 *
 * <p>Every mutating call first accrues the performance fee: growth of total assets since the last
 * checkpoint is charged {@code fee}, minted as shares to the fee recipient at the pre-fee share
 * price. Share conversions use a virtual offset of one share and one asset.
 *
 * <p>Instances are created by {@link SuperPoolFactory} and hold their state in the journal.
 */
public class SuperPool {

    private static final Logger log = LoggerFactory.getLogger(SuperPool.class);

    record AllowanceKey(String owner, String spender) {}

    /** Fee shares and total assets as of now, without mutating anything. */
    private record Accrual(BigInteger feeShares, BigInteger newTotalAssets) {}

    private final String address;
    private final String asset;
    private final String name;
    private final String symbol;

    private final PoolService poolService;
    private final TokenBank tokenBank;
    private final CallExecutor callExecutor;
    private final EventPublisherHelper eventPublisherHelper;
    private final ProtocolParameters protocolParameters;
    private final Clock clock;

    private final JournaledValue<String> owner;
    private final JournaledValue<String> feeRecipient;
    private final JournaledValue<BigInteger> fee;
    private final JournaledValue<BigInteger> superPoolCap;
    private final JournaledValue<BigInteger> lastTotalAssets;
    private final JournaledValue<BigInteger> totalSupply;
    private final JournaledValue<Boolean> paused;
    private final JournaledValue<List<String>> depositQueue;
    private final JournaledValue<List<String>> withdrawQueue;
    private final JournaledValue<PendingUpdate<BigInteger>> pendingFee;
    private final JournaledMap<String, BigInteger> poolCaps;
    private final JournaledMap<String, BigInteger> balances;
    private final JournaledMap<AllowanceKey, BigInteger> allowances;
    private final JournaledMap<String, Boolean> allocators;

    SuperPool(
            SuperPoolConfig config,
            PoolService poolService,
            TokenBank tokenBank,
            CallExecutor callExecutor,
            StateJournal stateJournal,
            EventPublisherHelper eventPublisherHelper,
            ProtocolParameters protocolParameters,
            Clock clock) {
        this.address = config.address();
        this.asset = config.asset();
        this.name = config.name();
        this.symbol = config.symbol();
        this.poolService = poolService;
        this.tokenBank = tokenBank;
        this.callExecutor = callExecutor;
        this.eventPublisherHelper = eventPublisherHelper;
        this.protocolParameters = protocolParameters;
        this.clock = clock;
        this.owner = stateJournal.newValue(config.owner());
        this.feeRecipient = stateJournal.newValue(config.feeRecipient());
        this.fee = stateJournal.newValue(config.fee());
        this.superPoolCap = stateJournal.newValue(config.superPoolCap());
        this.lastTotalAssets = stateJournal.newValue(BigInteger.ZERO);
        this.totalSupply = stateJournal.newValue(BigInteger.ZERO);
        this.paused = stateJournal.newValue(false);
        this.depositQueue = stateJournal.newValue(List.of());
        this.withdrawQueue = stateJournal.newValue(List.of());
        this.pendingFee = stateJournal.newValue(null);
        this.poolCaps = stateJournal.newMap();
        this.balances = stateJournal.newMap();
        this.allowances = stateJournal.newMap();
        this.allocators = stateJournal.newMap();

        tokenBank.approve(asset, address, protocolParameters.getPoolAddress(), TokenBank.MAX_ALLOWANCE);
    }

    // ========================
    // DEPOSIT / WITHDRAW
    // ========================

    /** @return shares minted to {@code receiver}, rounded down */
    public BigInteger deposit(String caller, BigInteger assets, String receiver) {
        String from = AddressUtil.normalize(caller);
        String to = AddressUtil.normalize(receiver);
        return callExecutor.execute("SuperPool.deposit", () -> {
            accrueInternal();
            BigInteger shares = toShares(assets, Rounding.DOWN);
            if (shares.signum() == 0) {
                throw new DegenerateArithmeticException(
                        DegenerateArithmeticException.Reason.ZERO_SHARES,
                        "Deposit of " + assets + " into superpool " + address + " mints zero shares");
            }
            depositInternal(from, to, assets, shares);
            return shares;
        });
    }

    /** @return assets pulled from the caller, rounded up */
    public BigInteger mint(String caller, BigInteger shares, String receiver) {
        String from = AddressUtil.normalize(caller);
        String to = AddressUtil.normalize(receiver);
        return callExecutor.execute("SuperPool.mint", () -> {
            accrueInternal();
            BigInteger assets = toAssets(shares, Rounding.UP);
            if (assets.signum() == 0) {
                throw new DegenerateArithmeticException(
                        DegenerateArithmeticException.Reason.ZERO_ASSETS,
                        "Mint of " + shares + " shares of superpool " + address + " costs zero assets");
            }
            depositInternal(from, to, assets, shares);
            return assets;
        });
    }

    /** @return shares burned from {@code owner}, rounded up */
    public BigInteger withdraw(String caller, BigInteger assets, String receiver, String owner) {
        String spender = AddressUtil.normalize(caller);
        String holder = AddressUtil.normalize(owner);
        String to = AddressUtil.normalize(receiver);
        return callExecutor.execute("SuperPool.withdraw", () -> {
            accrueInternal();
            BigInteger shares = toShares(assets, Rounding.UP);
            if (shares.signum() == 0) {
                throw new DegenerateArithmeticException(
                        DegenerateArithmeticException.Reason.ZERO_SHARES,
                        "Withdrawal of " + assets + " from superpool " + address + " burns zero shares");
            }
            withdrawInternal(spender, holder, to, assets, shares);
            return shares;
        });
    }

    /** @return assets sent to {@code receiver}, rounded down */
    public BigInteger redeem(String caller, BigInteger shares, String receiver, String owner) {
        String spender = AddressUtil.normalize(caller);
        String holder = AddressUtil.normalize(owner);
        String to = AddressUtil.normalize(receiver);
        return callExecutor.execute("SuperPool.redeem", () -> {
            accrueInternal();
            BigInteger assets = toAssets(shares, Rounding.DOWN);
            if (assets.signum() == 0) {
                throw new DegenerateArithmeticException(
                        DegenerateArithmeticException.Reason.ZERO_ASSETS,
                        "Redemption of " + shares + " shares of superpool " + address + " pays zero assets");
            }
            withdrawInternal(spender, holder, to, assets, shares);
            return assets;
        });
    }

    /** Mints pending performance-fee shares and checkpoints total assets. */
    public void accrue() {
        callExecutor.run("SuperPool.accrue", this::accrueInternal);
    }

    private void depositInternal(String from, String receiver, BigInteger assets, BigInteger shares) {
        requireNotPaused();
        BigInteger newTotalAssets = lastTotalAssets.get().add(assets);
        if (newTotalAssets.compareTo(superPoolCap.get()) > 0) {
            throw new BoundsViolationException(
                    BoundsViolationException.Reason.SUPERPOOL_CAP_EXCEEDED,
                    "Deposit would raise superpool " + address + " to " + newTotalAssets + " above cap "
                            + superPoolCap.get(),
                    Map.of("superPool", address, "cap", superPoolCap.get()));
        }
        tokenBank.transferFrom(asset, address, from, address, assets);
        mintShares(receiver, shares);
        supplyToPools(assets);
        lastTotalAssets.set(newTotalAssets);

        log.debug("SuperPool deposit: superPool={} receiver={} assets={} shares={}", address, receiver, assets, shares);
        eventPublisherHelper.publishSuperPool(this, SuperPoolEventType.DEPOSIT, address, receiver, assets, shares);
    }

    private void withdrawInternal(
            String spender, String holder, String receiver, BigInteger assets, BigInteger shares) {
        withdrawFromPools(assets);
        if (!spender.equals(holder)) {
            spendAllowance(holder, spender, shares);
        }
        burnShares(holder, shares);
        lastTotalAssets.set(lastTotalAssets.get().subtract(assets));
        tokenBank.transfer(asset, address, receiver, assets);

        log.debug("SuperPool withdraw: superPool={} owner={} receiver={} assets={} shares={}",
                address, holder, receiver, assets, shares);
        eventPublisherHelper.publishSuperPool(this, SuperPoolEventType.WITHDRAW, address, holder, assets, shares);
    }

    private void accrueInternal() {
        Accrual accrual = simulateAccrue();
        if (accrual.feeShares().signum() > 0) {
            mintShares(feeRecipient.get(), accrual.feeShares());
            eventPublisherHelper.publishSuperPool(
                    this, SuperPoolEventType.FEES_ACCRUED, address, feeRecipient.get(), null, accrual.feeShares());
        }
        lastTotalAssets.set(accrual.newTotalAssets());
    }

    private Accrual simulateAccrue() {
        BigInteger newTotalAssets = totalAssets();
        BigInteger interest = WadMath.saturatingSub(newTotalAssets, lastTotalAssets.get());
        if (interest.signum() == 0 || fee.get().signum() == 0) {
            return new Accrual(BigInteger.ZERO, newTotalAssets);
        }
        BigInteger feeAssets = WadMath.mulWad(interest, fee.get());
        BigInteger feeShares = SharesMath.toSharesWithOffset(
                feeAssets, newTotalAssets.subtract(feeAssets), totalSupply.get(), Rounding.DOWN);
        return new Accrual(feeShares, newTotalAssets);
    }

    // ========================
    // ROUTING
    // ========================

    /** Fills pools in deposit-queue order; whatever does not fit stays idle. */
    private void supplyToPools(BigInteger assets) {
        BigInteger remaining = assets;
        for (String poolId : depositQueue.get()) {
            if (remaining.signum() == 0) {
                return;
            }
            BigInteger supplyAmount = WadMath.min(remaining, poolHeadroom(poolId));
            if (supplyAmount.signum() == 0 || poolService.previewDeposit(poolId, supplyAmount).signum() == 0) {
                continue;
            }
            poolService.deposit(address, poolId, supplyAmount, address);
            remaining = remaining.subtract(supplyAmount);
        }
    }

    /**
     * Spends idle assets first, then pulls from pools in withdraw-queue order.
     *
     * @throws InsufficientFundsException INSUFFICIENT_WITHDRAW_PATH when the pools cannot supply enough
     */
    private void withdrawFromPools(BigInteger assets) {
        BigInteger idle = tokenBank.balanceOf(asset, address);
        if (idle.compareTo(assets) >= 0) {
            return;
        }
        BigInteger remaining = assets.subtract(idle);
        for (String poolId : withdrawQueue.get()) {
            BigInteger withdrawAmount = WadMath.min(
                    remaining,
                    WadMath.min(poolService.getAssetsOf(poolId, address), poolService.getLiquidityOf(poolId)));
            if (withdrawAmount.signum() == 0) {
                continue;
            }
            poolService.withdraw(address, poolId, withdrawAmount, address, address);
            remaining = remaining.subtract(withdrawAmount);
            if (remaining.signum() == 0) {
                return;
            }
        }
        throw new InsufficientFundsException(
                InsufficientFundsException.Reason.INSUFFICIENT_WITHDRAW_PATH,
                "Superpool " + address + " cannot source " + remaining + " more of " + assets,
                Map.of("superPool", address, "requested", assets, "shortfall", remaining));
    }

    /** Room left in {@code poolId} under both this vault's cap and the pool's own deposit cap. */
    private BigInteger poolHeadroom(String poolId) {
        PoolData pool = poolService.getPoolData(poolId);
        if (pool.isPaused()) {
            return BigInteger.ZERO;
        }
        BigInteger capRoom = WadMath.saturatingSub(poolCaps.get(poolId), poolService.getAssetsOf(poolId, address));
        BigInteger depositCapRoom = WadMath.saturatingSub(pool.getDepositCap(), poolService.getTotalAssets(poolId));
        return WadMath.min(capRoom, depositCapRoom);
    }

    /**
     * Moves assets between member pools: all {@code withdraws} first, then {@code deposits}.
     * Owner or allocator only. A deposit that would exceed a pool's cap fails the whole call.
     */
    public void reallocate(String caller, List<ReallocateParams> withdraws, List<ReallocateParams> deposits) {
        callExecutor.run("SuperPool.reallocate", () -> {
            String sender = AddressUtil.normalize(caller);
            if (!sender.equals(owner.get()) && !allocators.getOrDefault(sender, false)) {
                throw new UnauthorizedException(
                        UnauthorizedException.Reason.ONLY_ALLOCATOR,
                        "Only the owner or an allocator may reallocate superpool " + address + "; caller " + sender);
            }
            for (ReallocateParams withdrawal : withdraws) {
                requireMember(withdrawal.poolId());
                poolService.withdraw(address, withdrawal.poolId(), withdrawal.assets(), address, address);
            }
            for (ReallocateParams deposit : deposits) {
                requireMember(deposit.poolId());
                BigInteger after = poolService.getAssetsOf(deposit.poolId(), address).add(deposit.assets());
                if (after.compareTo(poolCaps.get(deposit.poolId())) > 0) {
                    throw new BoundsViolationException(
                            BoundsViolationException.Reason.POOL_CAP_EXCEEDED,
                            "Reallocation would put " + after + " into pool " + deposit.poolId() + " above cap "
                                    + poolCaps.get(deposit.poolId()),
                            Map.of("poolId", deposit.poolId(), "cap", poolCaps.get(deposit.poolId())));
                }
                poolService.deposit(address, deposit.poolId(), deposit.assets(), address);
            }
            log.info("SuperPool {} reallocated by {}: {} withdrawals, {} deposits",
                    address, sender, withdraws.size(), deposits.size());
            eventPublisherHelper.publishSuperPool(this, SuperPoolEventType.REALLOCATED, address, sender, null, null);
        });
    }

    // ========================
    // OWNER GOVERNANCE
    // ========================

    /** Adds {@code poolId} at the end of both queues with the given cap. */
    public void addPool(String caller, String poolId, BigInteger cap) {
        callExecutor.run("SuperPool.addPool", () -> {
            requireOwner(caller);
            if (poolCaps.containsKey(poolId)) {
                throw new ProtocolStateException(
                        ProtocolStateException.Reason.POOL_ALREADY_IN_SUPERPOOL,
                        "Pool " + poolId + " is already in superpool " + address);
            }
            if (!poolService.getPoolAssetFor(poolId).equals(asset)) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.INVALID_PARAMETER,
                        "Pool " + poolId + " lends " + poolService.getPoolAssetFor(poolId) + ", superpool holds " + asset);
            }
            requirePositive(cap, "pool cap");
            if (depositQueue.get().size() >= protocolParameters.getMaxSuperPoolQueueLength()) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.MAX_QUEUE_LENGTH_EXCEEDED,
                        "Superpool " + address + " already holds " + depositQueue.get().size() + " pools");
            }
            poolCaps.put(poolId, cap);
            depositQueue.set(appended(depositQueue.get(), poolId));
            withdrawQueue.set(appended(withdrawQueue.get(), poolId));
            log.info("Pool {} added to superpool {} with cap {}", poolId, address, cap);
            eventPublisherHelper.publishSuperPool(this, SuperPoolEventType.POOL_ADDED, address, poolId, cap, null);
        });
    }

    /**
     * Removes {@code poolId} from the vault. A pool still holding vault assets is only removed with
     * {@code forceRemove}, which first redeems every share the vault holds in it.
     */
    public void removePool(String caller, String poolId, boolean forceRemove) {
        callExecutor.run("SuperPool.removePool", () -> {
            requireOwner(caller);
            requireMember(poolId);
            BigInteger shares = poolService.balanceOf(address, poolId);
            if (shares.signum() > 0) {
                if (!forceRemove) {
                    throw new ProtocolStateException(
                            ProtocolStateException.Reason.NONZERO_POOL_BALANCE,
                            "Superpool " + address + " still holds " + shares + " shares of pool " + poolId);
                }
                poolService.redeem(address, poolId, shares, address, address);
            }
            poolCaps.remove(poolId);
            depositQueue.set(without(depositQueue.get(), poolId));
            withdrawQueue.set(without(withdrawQueue.get(), poolId));
            log.info("Pool {} removed from superpool {} (forced={})", poolId, address, forceRemove);
            eventPublisherHelper.publishSuperPool(this, SuperPoolEventType.POOL_REMOVED, address, poolId, null, null);
        });
    }

    public void modifyPoolCap(String caller, String poolId, BigInteger cap) {
        callExecutor.run("SuperPool.modifyPoolCap", () -> {
            requireOwner(caller);
            requireMember(poolId);
            requirePositive(cap, "pool cap");
            poolCaps.put(poolId, cap);
            eventPublisherHelper.publishSuperPool(
                    this, SuperPoolEventType.POOL_CAP_MODIFIED, address, poolId, cap, null);
        });
    }

    /** Reorders the deposit queue so that position {@code i} holds the pool at {@code indexes[i]}. */
    public void reorderDepositQueue(String caller, List<Integer> indexes) {
        callExecutor.run("SuperPool.reorderDepositQueue", () -> {
            requireOwner(caller);
            depositQueue.set(reordered(depositQueue.get(), indexes));
            eventPublisherHelper.publishSuperPool(this, SuperPoolEventType.QUEUE_REORDERED, address, null, null, null);
        });
    }

    public void reorderWithdrawQueue(String caller, List<Integer> indexes) {
        callExecutor.run("SuperPool.reorderWithdrawQueue", () -> {
            requireOwner(caller);
            withdrawQueue.set(reordered(withdrawQueue.get(), indexes));
            eventPublisherHelper.publishSuperPool(this, SuperPoolEventType.QUEUE_REORDERED, address, null, null, null);
        });
    }

    public boolean toggleAllocator(String caller, String allocator) {
        String account = AddressUtil.normalize(allocator);
        return callExecutor.execute("SuperPool.toggleAllocator", () -> {
            requireOwner(caller);
            boolean enabled = !allocators.getOrDefault(account, false);
            if (enabled) {
                allocators.put(account, true);
            } else {
                allocators.remove(account);
            }
            eventPublisherHelper.publishSuperPool(
                    this, SuperPoolEventType.ALLOCATOR_TOGGLED, address, account, null, null);
            return enabled;
        });
    }

    public void setSuperpoolCap(String caller, BigInteger cap) {
        callExecutor.run("SuperPool.setSuperpoolCap", () -> {
            requireOwner(caller);
            superPoolCap.set(WadMath.requireUnsigned(cap));
            eventPublisherHelper.publishSuperPool(this, SuperPoolEventType.SUPERPOOL_CAP_SET, address, null, cap, null);
        });
    }

    public void setFeeRecipient(String caller, String recipient) {
        String account = AddressUtil.normalize(recipient);
        callExecutor.run("SuperPool.setFeeRecipient", () -> {
            requireOwner(caller);
            accrueInternal();
            feeRecipient.set(account);
            eventPublisherHelper.publishSuperPool(
                    this, SuperPoolEventType.FEE_RECIPIENT_SET, address, account, null, null);
        });
    }

    public boolean togglePause(String caller) {
        return callExecutor.execute("SuperPool.togglePause", () -> {
            requireOwner(caller);
            paused.set(!paused.get());
            log.info("Superpool {} paused={}", address, paused.get());
            eventPublisherHelper.publishSuperPool(this, SuperPoolEventType.PAUSE_TOGGLED, address, null, null, null);
            return paused.get();
        });
    }

    public void requestFeeUpdate(String caller, BigInteger newFee) {
        callExecutor.run("SuperPool.requestFeeUpdate", () -> {
            requireOwner(caller);
            if (newFee.compareTo(protocolParameters.getMaxSuperPoolFee()) > 0) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.FEE_TOO_HIGH,
                        "Fee " + newFee + " exceeds the maximum " + protocolParameters.getMaxSuperPoolFee());
            }
            PendingUpdate<BigInteger> pending =
                    PendingUpdate.requested(newFee, now(), protocolParameters.getTimelockDuration());
            pendingFee.set(pending);
            eventPublisherHelper.publishSuperPool(
                    this, SuperPoolEventType.FEE_UPDATE_REQUESTED, address, null, newFee, null);
        });
    }

    /** Accrues at the old fee, then applies the pending one. */
    public void acceptFeeUpdate(String caller) {
        callExecutor.run("SuperPool.acceptFeeUpdate", () -> {
            requireOwner(caller);
            PendingUpdate<BigInteger> pending = PendingUpdate.require(pendingFee.get(), "fee update for " + address);
            pending.requireAcceptable(now(), protocolParameters.getTimelockDeadline(), "Fee update");
            if (pending.value().signum() > 0 && feeRecipient.get() == null) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.INVALID_PARAMETER,
                        "Superpool " + address + " has no fee recipient");
            }
            accrueInternal();
            fee.set(pending.value());
            pendingFee.set(null);
            log.info("Superpool {} fee updated to {}", address, pending.value());
            eventPublisherHelper.publishSuperPool(
                    this, SuperPoolEventType.FEE_UPDATED, address, null, pending.value(), null);
        });
    }

    public void rejectFeeUpdate(String caller) {
        callExecutor.run("SuperPool.rejectFeeUpdate", () -> {
            requireOwner(caller);
            PendingUpdate.require(pendingFee.get(), "fee update for " + address);
            pendingFee.set(null);
            eventPublisherHelper.publishSuperPool(
                    this, SuperPoolEventType.FEE_UPDATE_REJECTED, address, null, null, null);
        });
    }

    // ========================
    // SHARE TOKEN
    // ========================

    public BigInteger balanceOf(String account) {
        return callExecutor.read(() -> balances.getOrDefault(AddressUtil.normalize(account), BigInteger.ZERO));
    }

    public BigInteger totalSupply() {
        return callExecutor.read(() -> totalSupply.get());
    }

    public BigInteger allowance(String holder, String spender) {
        return callExecutor.read(() -> allowances.getOrDefault(
                new AllowanceKey(AddressUtil.normalize(holder), AddressUtil.normalize(spender)), BigInteger.ZERO));
    }

    public void transfer(String caller, String to, BigInteger shares) {
        String from = AddressUtil.normalize(caller);
        String receiver = AddressUtil.normalize(to);
        callExecutor.run("SuperPool.transfer", () -> moveShares(from, receiver, shares));
    }

    public void transferFrom(String caller, String from, String to, BigInteger shares) {
        String spender = AddressUtil.normalize(caller);
        String holder = AddressUtil.normalize(from);
        String receiver = AddressUtil.normalize(to);
        callExecutor.run("SuperPool.transferFrom", () -> {
            if (!spender.equals(holder)) {
                spendAllowance(holder, spender, shares);
            }
            moveShares(holder, receiver, shares);
        });
    }

    public void approve(String caller, String spender, BigInteger shares) {
        AllowanceKey key = new AllowanceKey(AddressUtil.normalize(caller), AddressUtil.normalize(spender));
        callExecutor.run("SuperPool.approve", () -> allowances.put(key, WadMath.requireUnsigned(shares)));
    }

    private void moveShares(String from, String to, BigInteger shares) {
        burnShares(from, shares);
        mintShares(to, shares);
    }

    private void mintShares(String account, BigInteger shares) {
        balances.put(account, balances.getOrDefault(account, BigInteger.ZERO).add(shares));
        totalSupply.set(totalSupply.get().add(shares));
    }

    private void burnShares(String account, BigInteger shares) {
        BigInteger balance = balances.getOrDefault(account, BigInteger.ZERO);
        if (balance.compareTo(shares) < 0) {
            throw new InsufficientFundsException(
                    InsufficientFundsException.Reason.INSUFFICIENT_BALANCE,
                    account + " holds " + balance + " shares of superpool " + address + ", needs " + shares,
                    Map.of("superPool", address, "owner", account));
        }
        balances.put(account, balance.subtract(shares));
        totalSupply.set(totalSupply.get().subtract(shares));
    }

    private void spendAllowance(String holder, String spender, BigInteger shares) {
        AllowanceKey key = new AllowanceKey(holder, spender);
        BigInteger allowed = allowances.getOrDefault(key, BigInteger.ZERO);
        if (allowed.equals(TokenBank.MAX_ALLOWANCE)) {
            return;
        }
        if (allowed.compareTo(shares) < 0) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.INSUFFICIENT_ALLOWANCE,
                    spender + " may spend " + allowed + " shares of " + holder + ", needs " + shares,
                    Map.of("superPool", address, "owner", holder, "spender", spender));
        }
        allowances.put(key, allowed.subtract(shares));
    }

    // ========================
    // VIEWS
    // ========================

    /** Idle assets plus the value of every member pool position, including unaccrued interest. */
    public BigInteger totalAssets() {
        return callExecutor.read(() -> {
            BigInteger total = tokenBank.balanceOf(asset, address);
            for (String poolId : depositQueue.get()) {
                total = total.add(poolService.getAssetsOf(poolId, address));
            }
            return total;
        });
    }

    public BigInteger convertToShares(BigInteger assets) {
        return previewDeposit(assets);
    }

    public BigInteger convertToAssets(BigInteger shares) {
        return previewRedeem(shares);
    }

    public BigInteger previewDeposit(BigInteger assets) {
        return callExecutor.read(() -> previewShares(assets, Rounding.DOWN));
    }

    public BigInteger previewMint(BigInteger shares) {
        return callExecutor.read(() -> previewAssets(shares, Rounding.UP));
    }

    public BigInteger previewWithdraw(BigInteger assets) {
        return callExecutor.read(() -> previewShares(assets, Rounding.UP));
    }

    public BigInteger previewRedeem(BigInteger shares) {
        return callExecutor.read(() -> previewAssets(shares, Rounding.DOWN));
    }

    public BigInteger maxDeposit(String receiver) {
        return callExecutor.read(() -> {
            if (paused.get()) {
                return BigInteger.ZERO;
            }
            return WadMath.saturatingSub(superPoolCap.get(), totalAssets());
        });
    }

    public BigInteger maxMint(String receiver) {
        return callExecutor.read(() -> previewDeposit(maxDeposit(receiver)));
    }

    /** Owner's assets capped by what idle funds and pool liquidity can pay out now. */
    public BigInteger maxWithdraw(String holder) {
        return callExecutor.read(() -> WadMath.min(previewRedeem(balanceOf(holder)), withdrawableLiquidity()));
    }

    public BigInteger maxRedeem(String holder) {
        return callExecutor.read(() -> {
            BigInteger withdrawable = previewShares(withdrawableLiquidity(), Rounding.DOWN);
            return WadMath.min(balanceOf(holder), withdrawable);
        });
    }

    public String getAddress() {
        return address;
    }

    public String getAsset() {
        return asset;
    }

    public String getName() {
        return name;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getOwner() {
        return callExecutor.read(() -> owner.get());
    }

    public String getFeeRecipient() {
        return callExecutor.read(() -> feeRecipient.get());
    }

    public BigInteger getFee() {
        return callExecutor.read(() -> fee.get());
    }

    public BigInteger getSuperPoolCap() {
        return callExecutor.read(() -> superPoolCap.get());
    }

    public BigInteger getLastTotalAssets() {
        return callExecutor.read(() -> lastTotalAssets.get());
    }

    public boolean isPaused() {
        return callExecutor.read(() -> paused.get());
    }

    public boolean isAllocator(String account) {
        return callExecutor.read(() -> allocators.getOrDefault(AddressUtil.normalize(account), false));
    }

    public BigInteger getPoolCap(String poolId) {
        return callExecutor.read(() -> poolCaps.getOrDefault(poolId, BigInteger.ZERO));
    }

    public List<String> getDepositQueue() {
        return callExecutor.read(() -> depositQueue.get());
    }

    public List<String> getWithdrawQueue() {
        return callExecutor.read(() -> withdrawQueue.get());
    }

    public PendingUpdate<BigInteger> getPendingFeeUpdate() {
        return callExecutor.read(() -> pendingFee.get());
    }

    // ========================
    // HELPERS
    // ========================

    private BigInteger toShares(BigInteger assets, Rounding rounding) {
        return SharesMath.toSharesWithOffset(assets, lastTotalAssets.get(), totalSupply.get(), rounding);
    }

    private BigInteger toAssets(BigInteger shares, Rounding rounding) {
        return SharesMath.toAssetsWithOffset(shares, lastTotalAssets.get(), totalSupply.get(), rounding);
    }

    private BigInteger previewShares(BigInteger assets, Rounding rounding) {
        Accrual accrual = simulateAccrue();
        return SharesMath.toSharesWithOffset(
                assets, accrual.newTotalAssets(), totalSupply.get().add(accrual.feeShares()), rounding);
    }

    private BigInteger previewAssets(BigInteger shares, Rounding rounding) {
        Accrual accrual = simulateAccrue();
        return SharesMath.toAssetsWithOffset(
                shares, accrual.newTotalAssets(), totalSupply.get().add(accrual.feeShares()), rounding);
    }

    private BigInteger withdrawableLiquidity() {
        BigInteger liquidity = tokenBank.balanceOf(asset, address);
        for (String poolId : withdrawQueue.get()) {
            liquidity = liquidity.add(
                    WadMath.min(poolService.getAssetsOf(poolId, address), poolService.getLiquidityOf(poolId)));
        }
        return liquidity;
    }

    private List<String> reordered(List<String> queue, List<Integer> indexes) {
        if (indexes.size() != queue.size()) {
            throw invalidReorder(queue, indexes);
        }
        Set<Integer> seen = new HashSet<>();
        List<String> next = new ArrayList<>(queue.size());
        for (Integer index : indexes) {
            if (index == null || index < 0 || index >= queue.size() || !seen.add(index)) {
                throw invalidReorder(queue, indexes);
            }
            next.add(queue.get(index));
        }
        return List.copyOf(next);
    }

    private ProtocolStateException invalidReorder(List<String> queue, List<Integer> indexes) {
        return new ProtocolStateException(
                ProtocolStateException.Reason.INVALID_QUEUE_REORDER,
                "Indexes " + indexes + " are not a permutation of a queue of " + queue.size());
    }

    private static List<String> appended(List<String> queue, String poolId) {
        List<String> next = new ArrayList<>(queue);
        next.add(poolId);
        return List.copyOf(next);
    }

    private static List<String> without(List<String> queue, String poolId) {
        List<String> next = new ArrayList<>(queue);
        next.remove(poolId);
        return List.copyOf(next);
    }

    private void requireMember(String poolId) {
        if (!poolCaps.containsKey(poolId)) {
            throw new ProtocolStateException(
                    ProtocolStateException.Reason.POOL_NOT_IN_SUPERPOOL,
                    "Pool " + poolId + " is not part of superpool " + address);
        }
    }

    private void requireOwner(String caller) {
        if (!owner.get().equals(AddressUtil.normalize(caller))) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.NOT_OWNER_OR_OPERATOR,
                    "Only the owner of superpool " + address + " may do this; caller " + caller);
        }
    }

    private void requireNotPaused() {
        if (paused.get()) {
            throw new ProtocolStateException(
                    ProtocolStateException.Reason.SUPERPOOL_PAUSED, "Superpool " + address + " is paused");
        }
    }

    private static void requirePositive(BigInteger value, String what) {
        if (value == null || value.signum() <= 0) {
            throw new BoundsViolationException(
                    BoundsViolationException.Reason.INVALID_PARAMETER, what + " must be positive, got " + value);
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
