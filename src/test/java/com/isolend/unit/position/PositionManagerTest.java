package com.isolend.unit.position;

import static com.isolend.support.ProtocolTestFixture.ALICE;
import static com.isolend.support.ProtocolTestFixture.BOB;
import static com.isolend.support.ProtocolTestFixture.FIXED_10;
import static com.isolend.support.ProtocolTestFixture.POOL_OWNER;
import static com.isolend.support.ProtocolTestFixture.POSITION_MANAGER;
import static com.isolend.support.ProtocolTestFixture.PROTOCOL_OWNER;
import static com.isolend.support.ProtocolTestFixture.USDC;
import static com.isolend.support.ProtocolTestFixture.WBTC;
import static com.isolend.support.ProtocolTestFixture.WETH;
import static com.isolend.support.ProtocolTestFixture.ZERO_RATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.isolend.core.math.WadMath;
import com.isolend.event.PositionEvent;
import com.isolend.event.PositionEventType;
import com.isolend.event.RiskEvent;
import com.isolend.event.RiskEventType;
import com.isolend.exception.BoundsViolationException;
import com.isolend.exception.HealthViolationException;
import com.isolend.exception.ProtocolStateException;
import com.isolend.exception.ResourceNotFoundException;
import com.isolend.exception.UnauthorizedException;
import com.isolend.position.Action;
import com.isolend.position.Calldata;
import com.isolend.risk.DebtData;
import com.isolend.support.ProtocolTestFixture;
import com.isolend.support.SwapTarget;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for PositionManager action processing: position deployment, authorization, atomic
 * batches with a single trailing health check and the APPROVE/EXEC allow-lists.
 *
 * <p>WETH collateral is priced at 10 USDC with an LTV of 50%.
 */
class PositionManagerTest {

    private ProtocolTestFixture fx;
    private String poolId;

    @BeforeEach
    void setUp() {
        fx = new ProtocolTestFixture();
        setUpMarket(fx);
    }

    private void setUpMarket(ProtocolTestFixture fixture) {
        poolId = fixture.openPool(POOL_OWNER, USDC, ZERO_RATE);
        fixture.bindOracle(poolId, USDC, WadMath.WAD);
        fixture.acceptCollateral(poolId, WETH, WadMath.wad("10"), WadMath.wad("0.5"));
        fixture.supply(ALICE, poolId, BigInteger.valueOf(10_000));
    }

    private static BigInteger amount(long value) {
        return BigInteger.valueOf(value);
    }

    // ==============================
    // POSITIONS AND AUTHORIZATION
    // ==============================

    @Nested
    @DisplayName("Positions and authorization")
    class Positions {

        @Test
        @DisplayName("Anyone may deploy a position for an owner at its derived address")
        void deployForOwner() {
            String salt = fx.nextSalt();
            String position = fx.positionAddress(BOB, salt);
            fx.events.clear();

            fx.positionManager.process(ALICE, position, Action.newPosition(BOB, salt));

            assertThat(fx.positionManager.ownerOf(position)).isEqualTo(BOB);
            assertThat(fx.positionManager.isAuth(position, ALICE)).isFalse();
            assertThat(fx.events.eventsOf(PositionEvent.class))
                    .extracting(PositionEvent::getEventType)
                    .containsExactly(PositionEventType.POSITION_DEPLOYED);
        }

        @Test
        @DisplayName("Claimed address must match the owner and salt")
        void spoofedAddress() {
            String salt = fx.nextSalt();
            String someoneElses = fx.positionAddress(ALICE, salt);

            assertThatThrownBy(() -> fx.positionManager.process(BOB, someoneElses, Action.newPosition(BOB, salt)))
                    .isInstanceOf(UnauthorizedException.class)
                    .extracting("reason")
                    .isEqualTo(UnauthorizedException.Reason.INVALID_POSITION_ADDRESS);
        }

        @Test
        @DisplayName("Salt cannot be reused")
        void duplicatePosition() {
            String salt = fx.nextSalt();
            String position = fx.positionAddress(BOB, salt);
            fx.positionManager.process(BOB, position, Action.newPosition(BOB, salt));

            assertThatThrownBy(() -> fx.positionManager.process(BOB, position, Action.newPosition(BOB, salt)))
                    .isInstanceOf(ProtocolStateException.class)
                    .extracting("reason")
                    .isEqualTo(ProtocolStateException.Reason.POSITION_ALREADY_EXISTS);
        }

        @Test
        @DisplayName("Strangers cannot act until the owner makes them operators")
        void operatorAuthorization() {
            String position = fx.openPosition(BOB);
            fx.fund(WETH, ALICE, amount(5));
            fx.tokenBank.approve(WETH, ALICE, POSITION_MANAGER, amount(5));

            assertThatThrownBy(() -> fx.positionManager.process(ALICE, position, Action.deposit(WETH, amount(5))))
                    .isInstanceOf(UnauthorizedException.class)
                    .extracting("reason")
                    .isEqualTo(UnauthorizedException.Reason.NOT_OWNER_OR_OPERATOR);

            assertThat(fx.positionManager.toggleAuth(BOB, ALICE, position)).isTrue();
            fx.positionManager.process(ALICE, position, Action.deposit(WETH, amount(5)));

            assertThat(fx.balanceOf(WETH, position)).isEqualTo(amount(5));
        }

        @Test
        @DisplayName("Only the owner toggles operators")
        void onlyOwnerTogglesAuth() {
            String position = fx.openPosition(BOB);

            assertThatThrownBy(() -> fx.positionManager.toggleAuth(ALICE, ALICE, position))
                    .isInstanceOf(UnauthorizedException.class)
                    .extracting("reason")
                    .isEqualTo(UnauthorizedException.Reason.NOT_OWNER_OR_OPERATOR);
        }

        @Test
        @DisplayName("Transferred position answers to its new owner only")
        void transferOwnership() {
            String position = fx.openPosition(BOB);

            fx.positionManager.transferPositionOwnership(BOB, position, ALICE);

            assertThat(fx.positionManager.ownerOf(position)).isEqualTo(ALICE);
            assertThat(fx.positionManager.isAuth(position, BOB)).isFalse();
            assertThatThrownBy(() -> fx.positionManager.process(BOB, position, Action.borrow(poolId, amount(1))))
                    .extracting("reason")
                    .isEqualTo(UnauthorizedException.Reason.NOT_OWNER_OR_OPERATOR);
        }
    }

    // ==============================
    // BATCHES
    // ==============================

    @Nested
    @DisplayName("Batches")
    class Batches {

        @Test
        @DisplayName("One batch deploys, collateralizes and borrows")
        void deployAndBorrowInOneBatch() {
            String salt = fx.nextSalt();
            String position = fx.positionAddress(BOB, salt);
            fx.fund(WETH, BOB, amount(100));
            fx.tokenBank.approve(WETH, BOB, POSITION_MANAGER, amount(100));

            fx.positionManager.processBatch(BOB, position, List.of(
                    Action.newPosition(BOB, salt),
                    Action.deposit(WETH, amount(100)),
                    Action.addToken(WETH),
                    Action.borrow(poolId, amount(400))));

            assertThat(fx.balanceOf(USDC, position)).isEqualTo(amount(400));
            assertThat(fx.poolService.getBorrowsOf(poolId, position)).isEqualTo(amount(400));
            assertThat(fx.positionRegistry.require(position).getAssets()).containsExactly(WETH);
            assertThat(fx.positionRegistry.require(position).getDebtPools()).containsExactly(poolId);
        }

        @Test
        @DisplayName("Intermediate states may be unhealthy as long as the batch ends healthy")
        void borrowBeforeCollateral() {
            String position = fx.openPosition(BOB);
            fx.fund(WETH, BOB, amount(100));
            fx.tokenBank.approve(WETH, BOB, POSITION_MANAGER, amount(100));

            fx.positionManager.processBatch(BOB, position, List.of(
                    Action.borrow(poolId, amount(400)),
                    Action.deposit(WETH, amount(100)),
                    Action.addToken(WETH)));

            assertThat(fx.riskModule.isPositionHealthy(position)).isTrue();
        }

        @Test
        @DisplayName("Unhealthy outcome reverts every action and reports the rejection")
        void unhealthyBatchReverts() {
            String position = fx.openPosition(BOB);
            fx.depositCollateral(BOB, position, WETH, amount(100));
            BigInteger liquidityBefore = fx.poolService.getLiquidityOf(poolId);
            fx.events.clear();

            assertThatThrownBy(() -> fx.positionManager.process(BOB, position, Action.borrow(poolId, amount(600))))
                    .isInstanceOf(HealthViolationException.class)
                    .extracting("reason")
                    .isEqualTo(HealthViolationException.Reason.HEALTH_CHECK_FAILED);

            assertThat(fx.balanceOf(USDC, position)).isZero();
            assertThat(fx.poolService.getTotalBorrows(poolId)).isZero();
            assertThat(fx.poolService.getLiquidityOf(poolId)).isEqualTo(liquidityBefore);
            assertThat(fx.positionRegistry.require(position).getDebtPools()).isEmpty();
            assertThat(fx.events.eventsOf(PositionEvent.class)).isEmpty();
            assertThat(fx.events.eventsOf(RiskEvent.class))
                    .extracting(RiskEvent::getEventType)
                    .containsExactly(RiskEventType.HEALTH_CHECK_FAILED);
        }

        @Test
        @DisplayName("Withdrawal is limited by the health check")
        void withdrawBoundedByHealth() {
            String position = fx.openPosition(BOB);
            fx.depositCollateral(BOB, position, WETH, amount(100));
            fx.positionManager.process(BOB, position, Action.borrow(poolId, amount(400)));

            assertThatThrownBy(() -> fx.positionManager.process(BOB, position, Action.withdraw(BOB, WETH, amount(30))))
                    .extracting("reason")
                    .isEqualTo(HealthViolationException.Reason.HEALTH_CHECK_FAILED);

            fx.positionManager.process(BOB, position, Action.withdraw(BOB, WETH, amount(20)));
            assertThat(fx.balanceOf(WETH, BOB)).isEqualTo(amount(20));
        }

        @Test
        @DisplayName("Removing the only collateral type of an indebted position fails")
        void removeCollateralType() {
            String position = fx.openPosition(BOB);
            fx.depositCollateral(BOB, position, WETH, amount(100));
            fx.positionManager.process(BOB, position, Action.borrow(poolId, amount(100)));

            assertThatThrownBy(() -> fx.positionManager.process(BOB, position, Action.removeToken(WETH)))
                    .extracting("reason")
                    .isEqualTo(HealthViolationException.Reason.HEALTH_CHECK_FAILED);
        }

        @Test
        @DisplayName("Drained collateral leaves the asset set")
        void drainedAssetRemoved() {
            String position = fx.openPosition(BOB);
            fx.depositCollateral(BOB, position, WETH, amount(100));

            fx.positionManager.process(BOB, position, Action.withdraw(BOB, WETH, amount(100)));

            assertThat(fx.positionRegistry.require(position).getAssets()).isEmpty();
            assertThat(fx.balanceOf(WETH, BOB)).isEqualTo(amount(100));
        }

        @Test
        @DisplayName("Full repayment clears the debt pool")
        void repayAll() {
            String position = fx.openPosition(BOB);
            fx.depositCollateral(BOB, position, WETH, amount(100));
            fx.positionManager.process(BOB, position, Action.borrow(poolId, amount(400)));

            fx.positionManager.process(BOB, position, Action.repay(poolId, amount(100)));
            assertThat(fx.poolService.getBorrowsOf(poolId, position)).isEqualTo(amount(300));
            assertThat(fx.positionRegistry.require(position).getDebtPools()).containsExactly(poolId);

            fx.positionManager.process(BOB, position, Action.repay(poolId, DebtData.MAX));
            assertThat(fx.poolService.getBorrowsOf(poolId, position)).isZero();
            assertThat(fx.balanceOf(USDC, position)).isZero();
            assertThat(fx.positionRegistry.require(position).getDebtPools()).isEmpty();
        }

        @Test
        @DisplayName("Borrowing from an unknown pool fails")
        void unknownPool() {
            String position = fx.openPosition(BOB);

            assertThatThrownBy(() -> fx.positionManager.process(BOB, position, Action.borrow("0xdead", amount(1))))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    // ==============================
    // SET LIMITS
    // ==============================

    @Nested
    @DisplayName("Set limits")
    class SetLimits {

        @Test
        @DisplayName("Collateral types are capped per position")
        void maxAssets() {
            ProtocolTestFixture narrow = new ProtocolTestFixture(
                    ProtocolTestFixture.defaultParameters().toBuilder().maxPositionAssets(1).build());
            setUpMarket(narrow);
            narrow.allowAsset(WBTC);
            String position = narrow.openPosition(BOB);
            narrow.depositCollateral(BOB, position, WETH, amount(10));

            assertThatThrownBy(() -> narrow.positionManager.process(BOB, position, Action.addToken(WBTC)))
                    .isInstanceOf(BoundsViolationException.class)
                    .extracting("reason")
                    .isEqualTo(BoundsViolationException.Reason.MAX_ASSETS_EXCEEDED);
        }

        @Test
        @DisplayName("Debt pools are capped per position")
        void maxDebtPools() {
            ProtocolTestFixture narrow = new ProtocolTestFixture(
                    ProtocolTestFixture.defaultParameters().toBuilder().maxPositionDebtPools(1).build());
            setUpMarket(narrow);
            String first = poolId;
            String second = narrow.openPool(POOL_OWNER, USDC, FIXED_10);
            String position = narrow.openPosition(BOB);
            narrow.depositCollateral(BOB, position, WETH, amount(100));
            narrow.positionManager.process(BOB, position, Action.borrow(first, amount(10)));

            assertThatThrownBy(() -> narrow.positionManager.process(BOB, position, Action.borrow(second, amount(10))))
                    .isInstanceOf(BoundsViolationException.class)
                    .extracting("reason")
                    .isEqualTo(BoundsViolationException.Reason.MAX_DEBT_POOLS_EXCEEDED);
        }
    }

    // ==============================
    // ALLOW-LISTS
    // ==============================

    @Nested
    @DisplayName("Allow-lists")
    class AllowLists {

        private String position;

        @BeforeEach
        void openPosition() {
            position = fx.openPosition(BOB);
            fx.depositCollateral(BOB, position, WETH, amount(100));
        }

        @Test
        @DisplayName("Unknown assets cannot become collateral")
        void unknownAsset() {
            assertThatThrownBy(() -> fx.positionManager.process(BOB, position, Action.addToken(WBTC)))
                    .isInstanceOf(UnauthorizedException.class)
                    .extracting("reason")
                    .isEqualTo(UnauthorizedException.Reason.UNKNOWN_ASSET);
        }

        @Test
        @DisplayName("Approvals go to known spenders only")
        void approveKnownSpender() {
            Action approve = Action.approve(SwapTarget.ADDRESS, WETH, amount(10));
            assertThatThrownBy(() -> fx.positionManager.process(BOB, position, approve))
                    .extracting("reason")
                    .isEqualTo(UnauthorizedException.Reason.UNKNOWN_SPENDER);

            fx.positionManager.toggleKnownSpender(PROTOCOL_OWNER, SwapTarget.ADDRESS);
            fx.positionManager.process(BOB, position, approve);

            assertThat(fx.tokenBank.allowance(WETH, position, SwapTarget.ADDRESS)).isEqualTo(amount(10));
        }

        @Test
        @DisplayName("Calls to functions off the allow-list are refused")
        void unknownFunction() {
            String calldata = SwapTarget.swapCalldata(WETH, WBTC, amount(10), amount(1));

            assertThatThrownBy(() -> fx.positionManager.process(BOB, position, Action.exec(SwapTarget.ADDRESS, calldata)))
                    .isInstanceOf(UnauthorizedException.class)
                    .extracting("reason")
                    .isEqualTo(UnauthorizedException.Reason.UNKNOWN_FUNCTION);
        }

        @Test
        @DisplayName("Allow-listed swap runs against the position's approval")
        void execSwap() {
            fx.allowAsset(WBTC);
            fx.positionManager.toggleKnownSpender(PROTOCOL_OWNER, SwapTarget.ADDRESS);
            fx.positionManager.toggleKnownFunc(
                    PROTOCOL_OWNER, SwapTarget.ADDRESS, Calldata.selectorOf(SwapTarget.SWAP_SIGNATURE));

            fx.positionManager.processBatch(BOB, position, List.of(
                    Action.approve(SwapTarget.ADDRESS, WETH, amount(10)),
                    Action.exec(SwapTarget.ADDRESS, SwapTarget.swapCalldata(WETH, WBTC, amount(10), amount(1))),
                    Action.addToken(WBTC)));

            assertThat(fx.balanceOf(WETH, position)).isEqualTo(amount(90));
            assertThat(fx.balanceOf(WBTC, position)).isEqualTo(amount(1));
            assertThat(fx.positionRegistry.require(position).getAssets()).containsExactly(WETH, WBTC);
        }

        @Test
        @DisplayName("Allow-list toggles flip and belong to the protocol owner")
        void togglesOwnerOnly() {
            assertThat(fx.positionManager.toggleKnownSpender(PROTOCOL_OWNER, SwapTarget.ADDRESS)).isTrue();
            assertThat(fx.positionManager.toggleKnownSpender(PROTOCOL_OWNER, SwapTarget.ADDRESS)).isFalse();
            assertThat(fx.positionManager.isKnownSpender(SwapTarget.ADDRESS)).isFalse();

            assertThatThrownBy(() -> fx.positionManager.toggleKnownAsset(BOB, WBTC))
                    .isInstanceOf(UnauthorizedException.class)
                    .extracting("reason")
                    .isEqualTo(UnauthorizedException.Reason.ONLY_PROTOCOL_OWNER);
        }

        @Test
        @DisplayName("Liquidation fee is capped at 100%")
        void liquidationFeeBound() {
            assertThatThrownBy(() -> fx.positionManager.setLiquidationFee(PROTOCOL_OWNER, WadMath.wad("1.01")))
                    .isInstanceOf(BoundsViolationException.class)
                    .extracting("reason")
                    .isEqualTo(BoundsViolationException.Reason.FEE_TOO_HIGH);

            fx.positionManager.setLiquidationFee(PROTOCOL_OWNER, WadMath.wad("0.1"));
            assertThat(fx.positionManager.getLiquidationFee()).isEqualTo(WadMath.wad("0.1"));
        }
    }
}
