package com.isolend.pool;

import com.isolend.config.ProtocolParameters;
import com.isolend.core.address.AddressUtil;
import com.isolend.core.journal.CallExecutor;
import com.isolend.core.math.SharesMath;
import com.isolend.core.math.WadMath;
import com.isolend.domain.enums.Rounding;
import com.isolend.event.EventPublisherHelper;
import com.isolend.event.PoolEventType;
import com.isolend.exception.BoundsViolationException;
import com.isolend.exception.DegenerateArithmeticException;
import com.isolend.exception.InsufficientFundsException;
import com.isolend.exception.ProtocolStateException;
import com.isolend.exception.UnauthorizedException;
import com.isolend.irm.RateModelRegistry;
import com.isolend.token.TokenBank;
import java.math.BigInteger;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Share ledger for every isolated market: deposits, withdrawals, borrows, repayments and
 * continuous interest accrual.
 *
 * <p>Every mutating call first accrues interest on the market it touches, then converts between
 * assets and shares with the rounding that favors existing holders:
 * <ul>
 *   <li>deposit: shares rounded down</li>
 *   <li>withdraw: shares burned rounded up</li>
 *   <li>redeem: assets paid rounded down</li>
 *   <li>borrow: debt shares rounded up</li>
 *   <li>repay: debt shares cleared rounded down</li>
 * </ul>
 *
 * <p>{@link #borrow}, {@link #repay} and {@link #rebalanceBadDebt} are reserved for the position
 * manager. Repayments expect the tokens to have been transferred to the pool already.
 *
 * <p>All entry points run through the {@link CallExecutor}: a failure anywhere leaves every
 * ledger, balance and token transfer of the call unchanged.
 */
@Service
public class PoolService {

    private static final Logger log = LoggerFactory.getLogger(PoolService.class);

    private final PoolStore poolStore;
    private final RateModelRegistry rateModelRegistry;
    private final TokenBank tokenBank;
    private final CallExecutor callExecutor;
    private final EventPublisherHelper eventPublisherHelper;
    private final ProtocolParameters protocolParameters;
    private final Clock clock;

    public PoolService(
            PoolStore poolStore,
            RateModelRegistry rateModelRegistry,
            TokenBank tokenBank,
            CallExecutor callExecutor,
            EventPublisherHelper eventPublisherHelper,
            ProtocolParameters protocolParameters,
            Clock clock) {
        this.poolStore = poolStore;
        this.rateModelRegistry = rateModelRegistry;
        this.tokenBank = tokenBank;
        this.callExecutor = callExecutor;
        this.eventPublisherHelper = eventPublisherHelper;
        this.protocolParameters = protocolParameters;
        this.clock = clock;
    }

    // ========================
    // DEPOSITS
    // ========================

    /**
     * Pulls {@code assets} from the caller (who must have approved the pool address) and mints
     * deposit shares to {@code receiver}.
     *
     * @return shares minted, rounded down
     */
    public BigInteger deposit(String caller, String poolId, BigInteger assets, String receiver) {
        String from = AddressUtil.normalize(caller);
        String to = AddressUtil.normalize(receiver);
        return callExecutor.execute("Pool.deposit", () -> {
            PoolData pool = accrueInternal(poolId).pool();
            requireNotPaused(pool);

            BigInteger shares = SharesMath.toShares(
                    assets, pool.getTotalDepositAssets(), pool.getTotalDepositShares(), Rounding.DOWN);
            if (shares.signum() == 0) {
                throw new DegenerateArithmeticException(
                        DegenerateArithmeticException.Reason.ZERO_SHARES,
                        "Deposit of " + assets + " into " + poolId + " mints zero shares");
            }

            BigInteger newTotalAssets = pool.getTotalDepositAssets().add(assets);
            if (newTotalAssets.compareTo(pool.getDepositCap()) > 0) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.DEPOSIT_CAP_EXCEEDED,
                        "Deposit would raise pool " + poolId + " to " + newTotalAssets + " above cap "
                                + pool.getDepositCap(),
                        Map.of("poolId", poolId, "cap", pool.getDepositCap()));
            }

            tokenBank.transferFrom(pool.getAsset(), protocolParameters.getPoolAddress(), from, poolAddress(), assets);

            poolStore.pools.put(
                    poolId,
                    pool.toBuilder()
                            .totalDepositAssets(newTotalAssets)
                            .totalDepositShares(pool.getTotalDepositShares().add(shares))
                            .build());
            poolStore.setDepositShares(poolId, to, poolStore.depositSharesOf(poolId, to).add(shares));

            log.debug("Deposit: pool={} caller={} receiver={} assets={} shares={}", poolId, from, to, assets, shares);
            eventPublisherHelper.publishPool(this, PoolEventType.DEPOSIT, poolId, to, assets, shares);
            return shares;
        });
    }

    /**
     * Burns the shares worth {@code assets} (rounded up) from {@code owner} and sends the assets
     * to {@code receiver}.
     *
     * @return shares burned
     */
    public BigInteger withdraw(String caller, String poolId, BigInteger assets, String receiver, String owner) {
        String spender = AddressUtil.normalize(caller);
        String holder = AddressUtil.normalize(owner);
        String to = AddressUtil.normalize(receiver);
        return callExecutor.execute("Pool.withdraw", () -> {
            PoolData pool = accrueInternal(poolId).pool();
            BigInteger shares = SharesMath.toShares(
                    assets, pool.getTotalDepositAssets(), pool.getTotalDepositShares(), Rounding.UP);
            if (shares.signum() == 0) {
                throw new DegenerateArithmeticException(
                        DegenerateArithmeticException.Reason.ZERO_SHARES,
                        "Withdrawal of " + assets + " from " + poolId + " burns zero shares");
            }
            exitPosition(pool, spender, holder, to, assets, shares);
            return shares;
        });
    }

    /**
     * Burns {@code shares} from {@code owner} and sends their value (rounded down) to
     * {@code receiver}.
     *
     * @return assets paid out
     */
    public BigInteger redeem(String caller, String poolId, BigInteger shares, String receiver, String owner) {
        String spender = AddressUtil.normalize(caller);
        String holder = AddressUtil.normalize(owner);
        String to = AddressUtil.normalize(receiver);
        return callExecutor.execute("Pool.redeem", () -> {
            PoolData pool = accrueInternal(poolId).pool();
            BigInteger assets = SharesMath.toAssets(
                    shares, pool.getTotalDepositAssets(), pool.getTotalDepositShares(), Rounding.DOWN);
            if (assets.signum() == 0) {
                throw new DegenerateArithmeticException(
                        DegenerateArithmeticException.Reason.ZERO_ASSETS,
                        "Redemption of " + shares + " shares of " + poolId + " pays zero assets");
            }
            exitPosition(pool, spender, holder, to, assets, shares);
            return assets;
        });
    }

    private void exitPosition(
            PoolData pool, String spender, String holder, String receiver, BigInteger assets, BigInteger shares) {
        String poolId = pool.getPoolId();
        if (!spender.equals(holder) && !isOperator(holder, spender)) {
            spendAllowance(holder, spender, poolId, shares);
        }

        BigInteger balance = poolStore.depositSharesOf(poolId, holder);
        if (balance.compareTo(shares) < 0) {
            throw new InsufficientFundsException(
                    InsufficientFundsException.Reason.INSUFFICIENT_BALANCE,
                    holder + " holds " + balance + " shares of " + poolId + ", needs " + shares,
                    Map.of("poolId", poolId, "owner", holder));
        }
        if (pool.getIdleLiquidity().compareTo(assets) < 0) {
            throw new InsufficientFundsException(
                    InsufficientFundsException.Reason.INSUFFICIENT_LIQUIDITY,
                    "Pool " + poolId + " has " + pool.getIdleLiquidity() + " idle, needs " + assets,
                    Map.of("poolId", poolId, "liquidity", pool.getIdleLiquidity()));
        }

        poolStore.pools.put(
                poolId,
                pool.toBuilder()
                        .totalDepositAssets(pool.getTotalDepositAssets().subtract(assets))
                        .totalDepositShares(pool.getTotalDepositShares().subtract(shares))
                        .build());
        poolStore.setDepositShares(poolId, holder, balance.subtract(shares));
        tokenBank.transfer(pool.getAsset(), poolAddress(), receiver, assets);

        log.debug("Withdraw: pool={} owner={} receiver={} assets={} shares={}", poolId, holder, receiver, assets, shares);
        eventPublisherHelper.publishPool(this, PoolEventType.WITHDRAW, poolId, holder, assets, shares);
    }

    // ========================
    // BORROWS
    // ========================

    /**
     * Lends {@code amount} to {@code position}. The origination fee is carved out of the amount
     * and sent to the fee recipient; the position owes the full amount.
     *
     * @return debt shares minted, rounded up
     */
    public BigInteger borrow(String caller, String poolId, String position, BigInteger amount) {
        requirePositionManager(caller);
        String borrower = AddressUtil.normalize(position);
        return callExecutor.execute("Pool.borrow", () -> {
            PoolData pool = accrueInternal(poolId).pool();
            requireNotPaused(pool);

            if (amount.compareTo(poolStore.minBorrow.get()) < 0) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.BORROW_BELOW_MINIMUM,
                        "Borrow of " + amount + " is below the minimum " + poolStore.minBorrow.get());
            }
            if (pool.getIdleLiquidity().compareTo(amount) < 0) {
                throw new InsufficientFundsException(
                        InsufficientFundsException.Reason.INSUFFICIENT_LIQUIDITY,
                        "Pool " + poolId + " has " + pool.getIdleLiquidity() + " idle, cannot lend " + amount,
                        Map.of("poolId", poolId, "liquidity", pool.getIdleLiquidity()));
            }

            BigInteger shares = SharesMath.toShares(
                    amount, pool.getTotalBorrowAssets(), pool.getTotalBorrowShares(), Rounding.UP);
            if (shares.signum() == 0) {
                throw new DegenerateArithmeticException(
                        DegenerateArithmeticException.Reason.ZERO_SHARES,
                        "Borrow of " + amount + " from " + poolId + " mints zero debt shares");
            }

            BigInteger newTotalBorrows = pool.getTotalBorrowAssets().add(amount);
            if (newTotalBorrows.compareTo(pool.getBorrowCap()) > 0) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.BORROW_CAP_EXCEEDED,
                        "Borrow would raise pool " + poolId + " debt to " + newTotalBorrows + " above cap "
                                + pool.getBorrowCap(),
                        Map.of("poolId", poolId, "cap", pool.getBorrowCap()));
            }

            PoolData updated = pool.toBuilder()
                    .totalBorrowAssets(newTotalBorrows)
                    .totalBorrowShares(pool.getTotalBorrowShares().add(shares))
                    .build();
            BigInteger positionShares = poolStore.borrowSharesOf(poolId, borrower).add(shares);
            requireMinDebt(updated, positionShares);

            poolStore.pools.put(poolId, updated);
            poolStore.setBorrowShares(poolId, borrower, positionShares);

            BigInteger fee = WadMath.mulWad(amount, pool.getOriginationFee());
            if (fee.signum() > 0) {
                tokenBank.transfer(pool.getAsset(), poolAddress(), protocolParameters.getFeeRecipient(), fee);
            }
            tokenBank.transfer(pool.getAsset(), poolAddress(), borrower, amount.subtract(fee));

            log.debug("Borrow: pool={} position={} amount={} fee={} shares={}", poolId, borrower, amount, fee, shares);
            eventPublisherHelper.publishPool(this, PoolEventType.BORROW, poolId, borrower, amount, shares);
            return shares;
        });
    }

    /**
     * Clears debt worth {@code amount} for {@code position}. The position manager transfers the
     * tokens to the pool address before calling.
     *
     * @return the position's remaining debt shares
     */
    public BigInteger repay(String caller, String poolId, String position, BigInteger amount) {
        requirePositionManager(caller);
        String borrower = AddressUtil.normalize(position);
        return callExecutor.execute("Pool.repay", () -> {
            PoolData pool = accrueInternal(poolId).pool();

            BigInteger positionShares = poolStore.borrowSharesOf(poolId, borrower);
            BigInteger shares = SharesMath.toRepaidShares(
                    amount, positionShares, pool.getTotalBorrowAssets(), pool.getTotalBorrowShares());
            if (shares.signum() == 0) {
                throw new DegenerateArithmeticException(
                        DegenerateArithmeticException.Reason.ZERO_SHARES,
                        "Repayment of " + amount + " to " + poolId + " clears zero debt shares");
            }
            if (shares.compareTo(positionShares) > 0) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.INVALID_PARAMETER,
                        "Repayment of " + shares + " shares exceeds the " + positionShares + " owed by " + borrower,
                        Map.of("poolId", poolId, "position", borrower));
            }

            BigInteger remainingTotalShares = pool.getTotalBorrowShares().subtract(shares);
            PoolData updated = pool.toBuilder()
                    .totalBorrowShares(remainingTotalShares)
                    .totalBorrowAssets(
                            remainingTotalShares.signum() == 0
                                    ? BigInteger.ZERO
                                    : WadMath.saturatingSub(pool.getTotalBorrowAssets(), amount))
                    .build();
            BigInteger remainingShares = positionShares.subtract(shares);
            requireMinDebt(updated, remainingShares);

            poolStore.pools.put(poolId, updated);
            poolStore.setBorrowShares(poolId, borrower, remainingShares);

            log.debug("Repay: pool={} position={} amount={} shares={} remaining={}",
                    poolId, borrower, amount, shares, remainingShares);
            eventPublisherHelper.publishPool(this, PoolEventType.REPAY, poolId, borrower, amount, shares);
            return remainingShares;
        });
    }

    /**
     * Writes off all of {@code position}'s debt in the pool. Depositors absorb the loss through
     * a lower deposit share price.
     *
     * @return debt assets written off
     */
    public BigInteger rebalanceBadDebt(String caller, String poolId, String position) {
        requirePositionManager(caller);
        String borrower = AddressUtil.normalize(position);
        return callExecutor.execute("Pool.rebalanceBadDebt", () -> {
            PoolData pool = accrueInternal(poolId).pool();
            BigInteger shares = poolStore.borrowSharesOf(poolId, borrower);
            if (shares.signum() == 0) {
                return BigInteger.ZERO;
            }
            BigInteger debt = WadMath.min(
                    SharesMath.toAssets(shares, pool.getTotalBorrowAssets(), pool.getTotalBorrowShares(), Rounding.UP),
                    pool.getTotalBorrowAssets());

            BigInteger remainingTotalShares = pool.getTotalBorrowShares().subtract(shares);
            poolStore.pools.put(
                    poolId,
                    pool.toBuilder()
                            .totalBorrowShares(remainingTotalShares)
                            .totalBorrowAssets(
                                    remainingTotalShares.signum() == 0
                                            ? BigInteger.ZERO
                                            : pool.getTotalBorrowAssets().subtract(debt))
                            .totalDepositAssets(WadMath.saturatingSub(pool.getTotalDepositAssets(), debt))
                            .build());
            poolStore.setBorrowShares(poolId, borrower, BigInteger.ZERO);

            log.warn("Bad debt written off: pool={} position={} debt={} shares={}", poolId, borrower, debt, shares);
            eventPublisherHelper.publishPool(this, PoolEventType.BAD_DEBT_REBALANCED, poolId, borrower, debt, shares);
            return debt;
        });
    }

    // ========================
    // INTEREST
    // ========================

    /**
     * Accrues interest on {@code poolId} up to now. A second call in the same second is a no-op.
     */
    public AccrualResult accrue(String poolId) {
        return callExecutor.execute("Pool.accrue", () -> accrueInternal(poolId));
    }

    /** Accrual as it would happen now, without writing anything. */
    public AccrualResult simulateAccrue(String poolId) {
        return callExecutor.read(() -> {
            PoolData pool = poolStore.require(poolId);
            return InterestAccrual.simulate(pool, rateModelRegistry.get(pool.getRateModelKey()), now());
        });
    }

    private AccrualResult accrueInternal(String poolId) {
        PoolData pool = poolStore.require(poolId);
        AccrualResult result = InterestAccrual.simulate(pool, rateModelRegistry.get(pool.getRateModelKey()), now());
        if (result.pool() == pool) {
            return result;
        }
        poolStore.pools.put(poolId, result.pool());
        if (result.feeShares().signum() > 0) {
            String feeRecipient = protocolParameters.getFeeRecipient();
            poolStore.setDepositShares(
                    poolId, feeRecipient, poolStore.depositSharesOf(poolId, feeRecipient).add(result.feeShares()));
        }
        if (result.interest().signum() > 0) {
            log.debug("Accrued: pool={} interest={} feeShares={}", poolId, result.interest(), result.feeShares());
            eventPublisherHelper.publishPool(
                    this,
                    PoolEventType.INTEREST_ACCRUED,
                    poolId,
                    protocolParameters.getFeeRecipient(),
                    result.interest(),
                    result.feeShares());
        }
        return result;
    }

    // ========================
    // SHARE TOKEN
    // ========================

    public void transfer(String caller, String receiver, String poolId, BigInteger shares) {
        transferFrom(caller, caller, receiver, poolId, shares);
    }

    public void transferFrom(String caller, String sender, String receiver, String poolId, BigInteger shares) {
        String spender = AddressUtil.normalize(caller);
        String from = AddressUtil.normalize(sender);
        String to = AddressUtil.normalize(receiver);
        callExecutor.run("Pool.transferFrom", () -> {
            poolStore.require(poolId);
            if (!spender.equals(from) && !isOperator(from, spender)) {
                spendAllowance(from, spender, poolId, shares);
            }
            BigInteger balance = poolStore.depositSharesOf(poolId, from);
            if (balance.compareTo(shares) < 0) {
                throw new InsufficientFundsException(
                        InsufficientFundsException.Reason.INSUFFICIENT_BALANCE,
                        from + " holds " + balance + " shares of " + poolId + ", needs " + shares,
                        Map.of("poolId", poolId, "owner", from));
            }
            poolStore.setDepositShares(poolId, from, balance.subtract(shares));
            poolStore.setDepositShares(poolId, to, poolStore.depositSharesOf(poolId, to).add(shares));
            eventPublisherHelper.publishPool(this, PoolEventType.SHARES_TRANSFERRED, poolId, to, null, shares);
        });
    }

    public void approve(String caller, String spender, String poolId, BigInteger shares) {
        String owner = AddressUtil.normalize(caller);
        String approved = AddressUtil.normalize(spender);
        callExecutor.run("Pool.approve", () -> poolStore.allowances.put(
                new PoolStore.AllowanceKey(owner, approved, poolId), WadMath.requireUnsigned(shares)));
    }

    /** Grants or revokes {@code operator} full control over all of the caller's pool shares. */
    public void setOperator(String caller, String operator, boolean approved) {
        String owner = AddressUtil.normalize(caller);
        String op = AddressUtil.normalize(operator);
        callExecutor.run("Pool.setOperator", () -> {
            PoolStore.OperatorKey key = new PoolStore.OperatorKey(owner, op);
            if (approved) {
                poolStore.operators.put(key, Boolean.TRUE);
            } else {
                poolStore.operators.remove(key);
            }
        });
    }

    public boolean isOperator(String owner, String operator) {
        return callExecutor.read(() -> poolStore.operators.containsKey(new PoolStore.OperatorKey(owner, operator)));
    }

    public BigInteger allowance(String owner, String spender, String poolId) {
        return callExecutor.read(() -> poolStore.allowances.getOrDefault(
                new PoolStore.AllowanceKey(owner, spender, poolId), BigInteger.ZERO));
    }

    public BigInteger balanceOf(String owner, String poolId) {
        return callExecutor.read(() -> poolStore.depositSharesOf(poolId, owner));
    }

    private void spendAllowance(String owner, String spender, String poolId, BigInteger shares) {
        PoolStore.AllowanceKey key = new PoolStore.AllowanceKey(owner, spender, poolId);
        BigInteger allowed = poolStore.allowances.getOrDefault(key, BigInteger.ZERO);
        if (allowed.equals(TokenBank.MAX_ALLOWANCE)) {
            return;
        }
        if (allowed.compareTo(shares) < 0) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.INSUFFICIENT_ALLOWANCE,
                    spender + " may move " + allowed + " shares of " + poolId + " for " + owner + ", needs " + shares,
                    Map.of("poolId", poolId, "owner", owner, "spender", spender));
        }
        poolStore.allowances.put(key, allowed.subtract(shares));
    }

    // ========================
    // VIEWS
    // ========================

    public PoolData getPoolData(String poolId) {
        return callExecutor.read(() -> poolStore.require(poolId));
    }

    public boolean exists(String poolId) {
        return callExecutor.read(() -> poolStore.exists(poolId));
    }

    public String getPoolAssetFor(String poolId) {
        return callExecutor.read(() -> poolStore.require(poolId).getAsset());
    }

    public String getPoolOwnerFor(String poolId) {
        return callExecutor.read(() -> poolStore.require(poolId).getOwner());
    }

    public String getRateModelFor(String poolId) {
        return callExecutor.read(() -> poolStore.require(poolId).getRateModelKey());
    }

    /** Deposit assets including interest not yet accrued. */
    public BigInteger getTotalAssets(String poolId) {
        return simulateAccrue(poolId).pool().getTotalDepositAssets();
    }

    /** Borrowed assets including interest not yet accrued. */
    public BigInteger getTotalBorrows(String poolId) {
        return simulateAccrue(poolId).pool().getTotalBorrowAssets();
    }

    /** Idle assets available to withdraw or borrow; accrual does not change it. */
    public BigInteger getLiquidityOf(String poolId) {
        return callExecutor.read(() -> poolStore.require(poolId).getIdleLiquidity());
    }

    /** Value of {@code owner}'s deposit shares, rounded down, including pending interest. */
    public BigInteger getAssetsOf(String poolId, String owner) {
        return callExecutor.read(() -> {
            PoolData pool = simulateAccrue(poolId).pool();
            return SharesMath.toAssets(
                    poolStore.depositSharesOf(poolId, owner),
                    pool.getTotalDepositAssets(),
                    pool.getTotalDepositShares(),
                    Rounding.DOWN);
        });
    }

    /** Debt owed by {@code position}, rounded up, including pending interest. */
    public BigInteger getBorrowsOf(String poolId, String position) {
        return callExecutor.read(() -> {
            PoolData pool = simulateAccrue(poolId).pool();
            return SharesMath.toAssets(
                    poolStore.borrowSharesOf(poolId, position),
                    pool.getTotalBorrowAssets(),
                    pool.getTotalBorrowShares(),
                    Rounding.UP);
        });
    }

    public BigInteger getBorrowSharesOf(String poolId, String position) {
        return callExecutor.read(() -> poolStore.borrowSharesOf(poolId, position));
    }

    /** Largest amount {@code owner} can withdraw right now: own balance capped by idle liquidity. */
    public BigInteger maxWithdraw(String poolId, String owner) {
        return callExecutor.read(() -> WadMath.min(getAssetsOf(poolId, owner), getLiquidityOf(poolId)));
    }

    public BigInteger convertToShares(String poolId, BigInteger assets) {
        return previewDeposit(poolId, assets);
    }

    public BigInteger convertToAssets(String poolId, BigInteger shares) {
        return previewRedeem(poolId, shares);
    }

    public BigInteger previewDeposit(String poolId, BigInteger assets) {
        return callExecutor.read(() -> {
            PoolData pool = simulateAccrue(poolId).pool();
            return SharesMath.toShares(assets, pool.getTotalDepositAssets(), pool.getTotalDepositShares(),
                    Rounding.DOWN);
        });
    }

    public BigInteger previewWithdraw(String poolId, BigInteger assets) {
        return callExecutor.read(() -> {
            PoolData pool = simulateAccrue(poolId).pool();
            return SharesMath.toShares(assets, pool.getTotalDepositAssets(), pool.getTotalDepositShares(),
                    Rounding.UP);
        });
    }

    public BigInteger previewRedeem(String poolId, BigInteger shares) {
        return callExecutor.read(() -> {
            PoolData pool = simulateAccrue(poolId).pool();
            return SharesMath.toAssets(shares, pool.getTotalDepositAssets(), pool.getTotalDepositShares(),
                    Rounding.DOWN);
        });
    }

    public BigInteger getMinBorrow() {
        return callExecutor.read(() -> poolStore.minBorrow.get());
    }

    public BigInteger getMinDebt() {
        return callExecutor.read(() -> poolStore.minDebt.get());
    }

    // ========================
    // GUARDS
    // ========================

    private void requirePositionManager(String caller) {
        if (!protocolParameters.getPositionManagerAddress().equals(AddressUtil.normalize(caller))) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.ONLY_POSITION_MANAGER,
                    "Only the position manager may borrow, repay or rebalance bad debt; caller " + caller);
        }
    }

    private void requireNotPaused(PoolData pool) {
        if (pool.isPaused()) {
            throw new ProtocolStateException(
                    ProtocolStateException.Reason.POOL_PAUSED, "Pool " + pool.getPoolId() + " is paused");
        }
    }

    private void requireMinDebt(PoolData pool, BigInteger positionShares) {
        if (positionShares.signum() == 0) {
            return;
        }
        BigInteger debt = SharesMath.toAssets(
                positionShares, pool.getTotalBorrowAssets(), pool.getTotalBorrowShares(), Rounding.UP);
        if (debt.compareTo(poolStore.minDebt.get()) < 0) {
            throw new BoundsViolationException(
                    BoundsViolationException.Reason.DEBT_BELOW_MINIMUM,
                    "Remaining debt " + debt + " in " + pool.getPoolId() + " is below the minimum "
                            + poolStore.minDebt.get());
        }
    }

    private String poolAddress() {
        return protocolParameters.getPoolAddress();
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
