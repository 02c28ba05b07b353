package com.isolend.unit.risk;

import static com.isolend.support.ProtocolTestFixture.ALICE;
import static com.isolend.support.ProtocolTestFixture.POOL_OWNER;
import static com.isolend.support.ProtocolTestFixture.PROTOCOL_OWNER;
import static com.isolend.support.ProtocolTestFixture.USDC;
import static com.isolend.support.ProtocolTestFixture.WBTC;
import static com.isolend.support.ProtocolTestFixture.WETH;
import static com.isolend.support.ProtocolTestFixture.ZERO_RATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.isolend.core.math.WadMath;
import com.isolend.event.RiskEvent;
import com.isolend.event.RiskEventType;
import com.isolend.exception.BoundsViolationException;
import com.isolend.exception.GovernanceException;
import com.isolend.exception.UnauthorizedException;
import com.isolend.exception.ValuationException;
import com.isolend.oracle.FixedPriceOracle;
import com.isolend.oracle.PriceOracle;
import com.isolend.support.ProtocolTestFixture;
import java.math.BigInteger;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for RiskEngine: per-pair oracle and LTV bindings, their two-step governance and the
 * global LTV bounds.
 */
class RiskEngineTest {

    private static final BigInteger LTV_80 = WadMath.wad("0.8");
    private static final BigInteger LTV_70 = WadMath.wad("0.7");

    private ProtocolTestFixture fx;
    private String poolId;

    @BeforeEach
    void setUp() {
        fx = new ProtocolTestFixture();
        poolId = fx.openPool(POOL_OWNER, USDC, ZERO_RATE);
    }

    // ==============================
    // LTV GOVERNANCE
    // ==============================

    @Nested
    @DisplayName("LTV governance")
    class LtvGovernance {

        @BeforeEach
        void bindOracle() {
            fx.bindOracle(poolId, WETH, WadMath.wad("2000"));
        }

        @Test
        @DisplayName("LTV above the global maximum is rejected")
        void ltvAboveMaximum() {
            assertThatThrownBy(() -> fx.riskEngine.requestLtvUpdate(POOL_OWNER, poolId, WETH, WadMath.wad("0.99")))
                    .isInstanceOf(BoundsViolationException.class)
                    .extracting("reason")
                    .isEqualTo(BoundsViolationException.Reason.LTV_OUT_OF_BOUNDS);
        }

        @Test
        @DisplayName("LTV below the global minimum is rejected")
        void ltvBelowMinimum() {
            assertThatThrownBy(() -> fx.riskEngine.requestLtvUpdate(POOL_OWNER, poolId, WETH, WadMath.wad("0.05")))
                    .isInstanceOf(BoundsViolationException.class)
                    .extracting("reason")
                    .isEqualTo(BoundsViolationException.Reason.LTV_OUT_OF_BOUNDS);
        }

        @Test
        @DisplayName("LTV needs an oracle for the pair")
        void ltvNeedsOracle() {
            assertThatThrownBy(() -> fx.riskEngine.requestLtvUpdate(POOL_OWNER, poolId, WBTC, LTV_80))
                    .isInstanceOf(ValuationException.class)
                    .extracting("reason")
                    .isEqualTo(ValuationException.Reason.NO_ORACLE_FOUND);
        }

        @Test
        @DisplayName("Only the pool owner governs the pool's LTVs")
        void onlyPoolOwner() {
            assertThatThrownBy(() -> fx.riskEngine.requestLtvUpdate(ALICE, poolId, WETH, LTV_80))
                    .isInstanceOf(UnauthorizedException.class)
                    .extracting("reason")
                    .isEqualTo(UnauthorizedException.Reason.ONLY_POOL_OWNER);
        }

        @Test
        @DisplayName("First LTV of a pair applies immediately")
        void firstLtvImmediate() {
            fx.riskEngine.requestLtvUpdate(POOL_OWNER, poolId, WETH, LTV_80);

            assertThat(fx.riskEngine.ltvFor(poolId, WETH)).isEqualTo(LTV_80);
            assertThat(fx.riskEngine.getPendingLtvUpdate(poolId, WETH)).isNull();
        }

        @Test
        @DisplayName("Later LTV changes wait out the timelock")
        void laterLtvTimelocked() {
            fx.riskEngine.requestLtvUpdate(POOL_OWNER, poolId, WETH, LTV_80);
            fx.riskEngine.requestLtvUpdate(POOL_OWNER, poolId, WETH, LTV_70);

            assertThat(fx.riskEngine.ltvFor(poolId, WETH)).isEqualTo(LTV_80);
            assertThatThrownBy(() -> fx.riskEngine.acceptLtvUpdate(POOL_OWNER, poolId, WETH))
                    .isInstanceOf(GovernanceException.class)
                    .extracting("reason")
                    .isEqualTo(GovernanceException.Reason.TIMELOCK_NOT_ELAPSED);

            fx.clock.advance(Duration.ofHours(24));
            fx.riskEngine.acceptLtvUpdate(POOL_OWNER, poolId, WETH);

            assertThat(fx.riskEngine.ltvFor(poolId, WETH)).isEqualTo(LTV_70);
        }

        @Test
        @DisplayName("Pending LTV change lapses after the deadline")
        void pendingLtvLapses() {
            fx.riskEngine.requestLtvUpdate(POOL_OWNER, poolId, WETH, LTV_80);
            fx.riskEngine.requestLtvUpdate(POOL_OWNER, poolId, WETH, LTV_70);
            fx.clock.advance(Duration.ofHours(24 + 72).plusSeconds(1));

            assertThatThrownBy(() -> fx.riskEngine.acceptLtvUpdate(POOL_OWNER, poolId, WETH))
                    .isInstanceOf(GovernanceException.class)
                    .extracting("reason")
                    .isEqualTo(GovernanceException.Reason.TIMELOCK_EXPIRED);
        }

        @Test
        @DisplayName("Rejecting drops the pending change")
        void rejectDropsPending() {
            fx.riskEngine.requestLtvUpdate(POOL_OWNER, poolId, WETH, LTV_80);
            fx.riskEngine.requestLtvUpdate(POOL_OWNER, poolId, WETH, LTV_70);

            fx.riskEngine.rejectLtvUpdate(POOL_OWNER, poolId, WETH);

            assertThat(fx.riskEngine.getPendingLtvUpdate(poolId, WETH)).isNull();
            assertThat(fx.riskEngine.ltvFor(poolId, WETH)).isEqualTo(LTV_80);
        }

        @Test
        @DisplayName("Pending changes of different pairs do not interfere")
        void pairsIndependent() {
            fx.bindOracle(poolId, WBTC, WadMath.wad("30000"));
            fx.riskEngine.requestLtvUpdate(POOL_OWNER, poolId, WETH, LTV_80);
            fx.riskEngine.requestLtvUpdate(POOL_OWNER, poolId, WBTC, LTV_80);
            fx.riskEngine.requestLtvUpdate(POOL_OWNER, poolId, WETH, LTV_70);
            fx.riskEngine.requestLtvUpdate(POOL_OWNER, poolId, WBTC, WadMath.wad("0.6"));
            fx.clock.advance(Duration.ofHours(24));

            fx.riskEngine.acceptLtvUpdate(POOL_OWNER, poolId, WETH);

            assertThat(fx.riskEngine.ltvFor(poolId, WETH)).isEqualTo(LTV_70);
            assertThat(fx.riskEngine.ltvFor(poolId, WBTC)).isEqualTo(LTV_80);
            assertThat(fx.riskEngine.getPendingLtvUpdate(poolId, WBTC).value()).isEqualTo(WadMath.wad("0.6"));
        }
    }

    // ==============================
    // LTV BOUNDS
    // ==============================

    @Nested
    @DisplayName("LTV bounds")
    class LtvBounds {

        @Test
        @DisplayName("Protocol owner narrows the bounds")
        void ownerSetsBounds() {
            fx.riskEngine.setLtvBounds(PROTOCOL_OWNER, WadMath.wad("0.2"), WadMath.wad("0.9"));

            assertThat(fx.riskEngine.getMinLtv()).isEqualTo(WadMath.wad("0.2"));
            assertThat(fx.riskEngine.getMaxLtv()).isEqualTo(WadMath.wad("0.9"));
            assertThat(fx.events.eventsOf(RiskEvent.class))
                    .extracting(RiskEvent::getEventType)
                    .contains(RiskEventType.LTV_BOUNDS_SET);
        }

        @Test
        @DisplayName("Bounds must satisfy 0 < min <= max < 1")
        void invalidBounds() {
            assertThatThrownBy(() -> fx.riskEngine.setLtvBounds(PROTOCOL_OWNER, BigInteger.ZERO, WadMath.wad("0.9")))
                    .extracting("reason")
                    .isEqualTo(BoundsViolationException.Reason.INVALID_PARAMETER);
            assertThatThrownBy(() -> fx.riskEngine.setLtvBounds(PROTOCOL_OWNER, WadMath.wad("0.5"), WadMath.WAD))
                    .extracting("reason")
                    .isEqualTo(BoundsViolationException.Reason.INVALID_PARAMETER);
            assertThatThrownBy(() -> fx.riskEngine.setLtvBounds(
                            PROTOCOL_OWNER, WadMath.wad("0.6"), WadMath.wad("0.5")))
                    .extracting("reason")
                    .isEqualTo(BoundsViolationException.Reason.INVALID_PARAMETER);
        }

        @Test
        @DisplayName("Only the protocol owner sets bounds")
        void onlyProtocolOwner() {
            assertThatThrownBy(() -> fx.riskEngine.setLtvBounds(POOL_OWNER, WadMath.wad("0.2"), WadMath.wad("0.9")))
                    .isInstanceOf(UnauthorizedException.class)
                    .extracting("reason")
                    .isEqualTo(UnauthorizedException.Reason.ONLY_PROTOCOL_OWNER);
        }
    }

    // ==============================
    // ORACLES
    // ==============================

    @Nested
    @DisplayName("Oracles")
    class Oracles {

        @Test
        @DisplayName("Values amounts through the pair's oracle")
        void valuesThroughOracle() {
            fx.bindOracle(poolId, WETH, WadMath.wad("2000"));

            assertThat(fx.riskEngine.valueOf(poolId, WETH, BigInteger.valueOf(3))).isEqualTo(BigInteger.valueOf(6_000));
        }

        @Test
        @DisplayName("Missing oracle fails valuation")
        void missingOracle() {
            assertThatThrownBy(() -> fx.riskEngine.valueOf(poolId, WETH, BigInteger.ONE))
                    .isInstanceOf(ValuationException.class)
                    .extracting("reason")
                    .isEqualTo(ValuationException.Reason.NO_ORACLE_FOUND);
        }

        @Test
        @DisplayName("Stale price propagates as a valuation failure")
        void stalePrice() {
            FixedPriceOracle oracle = new FixedPriceOracle(fx.clock, WadMath.wad("2000"), Duration.ofMinutes(5));
            fx.riskEngine.setOracle(PROTOCOL_OWNER, poolId, WETH, oracle);
            fx.clock.advance(Duration.ofMinutes(6));

            assertThatThrownBy(() -> fx.riskEngine.valueOf(poolId, WETH, BigInteger.ONE))
                    .isInstanceOf(ValuationException.class)
                    .extracting("reason")
                    .isEqualTo(ValuationException.Reason.STALE_PRICE);
        }

        @Test
        @DisplayName("Pool owner binds the first oracle at once and later ones after the timelock")
        void ownerOracleUpdate() {
            PriceOracle first = FixedPriceOracle.of(fx.clock, WadMath.wad("2000"));
            PriceOracle second = FixedPriceOracle.of(fx.clock, WadMath.wad("2100"));

            fx.riskEngine.requestOracleUpdate(POOL_OWNER, poolId, WETH, first);
            fx.riskEngine.requestOracleUpdate(POOL_OWNER, poolId, WETH, second);

            assertThat(fx.riskEngine.oracleFor(poolId, WETH)).isSameAs(first);
            fx.clock.advance(Duration.ofHours(24));
            fx.riskEngine.acceptOracleUpdate(POOL_OWNER, poolId, WETH);
            assertThat(fx.riskEngine.oracleFor(poolId, WETH)).isSameAs(second);
        }

        @Test
        @DisplayName("Protocol owner binding overrides a pending request")
        void protocolOwnerOverrides() {
            PriceOracle first = FixedPriceOracle.of(fx.clock, WadMath.wad("2000"));
            PriceOracle pending = FixedPriceOracle.of(fx.clock, WadMath.wad("2100"));
            PriceOracle forced = FixedPriceOracle.of(fx.clock, WadMath.wad("1900"));
            fx.riskEngine.requestOracleUpdate(POOL_OWNER, poolId, WETH, first);
            fx.riskEngine.requestOracleUpdate(POOL_OWNER, poolId, WETH, pending);

            fx.riskEngine.setOracle(PROTOCOL_OWNER, poolId, WETH, forced);

            assertThat(fx.riskEngine.oracleFor(poolId, WETH)).isSameAs(forced);
            assertThat(fx.riskEngine.getPendingOracleUpdate(poolId, WETH)).isNull();
        }
    }
}
