package com.isolend.observability;

import com.isolend.event.PoolEvent;
import com.isolend.event.PoolEventType;
import com.isolend.event.RiskEvent;
import com.isolend.event.RiskEventType;
import com.isolend.event.SuperPoolEvent;
import com.isolend.event.SuperPoolEventType;
import com.isolend.superpool.SuperPoolFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the lending protocol:
 * <ul>
 *   <li><b>pool.deposits.count</b> (counter): committed pool deposits</li>
 *   <li><b>pool.borrows.count</b> (counter): committed borrows</li>
 *   <li><b>pool.bad_debt.count</b> (counter): bad-debt write-offs per pool</li>
 *   <li><b>risk.health_check.failed</b> (counter): batches rejected by the health check</li>
 *   <li><b>risk.liquidations.count</b> (counter): liquidations, tagged by kind</li>
 *   <li><b>superpool.deposits.count</b> (counter): committed superpool deposits</li>
 *   <li><b>superpool.deployed</b> (gauge): number of deployed superpools</li>
 * </ul>
 *
 * <p>Only committed calls publish pool and superpool events, so reverted calls never count.
 * Failed health checks are the exception: they are published when the batch is rejected.
 */
@Service
public class ProtocolMetricsService {

    private static final Logger log = LoggerFactory.getLogger(ProtocolMetricsService.class);

    private final Counter depositCounter;
    private final Counter borrowCounter;
    private final Counter badDebtCounter;
    private final Counter healthCheckFailedCounter;
    private final Counter liquidationCounter;
    private final Counter badDebtLiquidationCounter;
    private final Counter superPoolDepositCounter;

    public ProtocolMetricsService(MeterRegistry meterRegistry, SuperPoolFactory superPoolFactory) {
        this.depositCounter = Counter.builder("pool.deposits.count")
                .description("Committed deposits into lending pools")
                .register(meterRegistry);

        this.borrowCounter = Counter.builder("pool.borrows.count")
                .description("Committed borrows from lending pools")
                .register(meterRegistry);

        this.badDebtCounter = Counter.builder("pool.bad_debt.count")
                .description("Position debts written off as bad debt")
                .register(meterRegistry);

        this.healthCheckFailedCounter = Counter.builder("risk.health_check.failed")
                .description("Action batches rejected because the position ended unhealthy")
                .register(meterRegistry);

        this.liquidationCounter = Counter.builder("risk.liquidations.count")
                .description("Executed liquidations")
                .tag("kind", "standard")
                .register(meterRegistry);

        this.badDebtLiquidationCounter = Counter.builder("risk.liquidations.count")
                .description("Executed liquidations")
                .tag("kind", "bad_debt")
                .register(meterRegistry);

        this.superPoolDepositCounter = Counter.builder("superpool.deposits.count")
                .description("Committed superpool deposits")
                .register(meterRegistry);

        meterRegistry.gauge("superpool.deployed", superPoolFactory, factory -> factory.getSuperPools().size());
    }

    @EventListener
    @Order(20)
    public void onPoolEvent(PoolEvent event) {
        if (event.getEventType() == PoolEventType.DEPOSIT) {
            depositCounter.increment();
        } else if (event.getEventType() == PoolEventType.BORROW) {
            borrowCounter.increment();
        } else if (event.getEventType() == PoolEventType.BAD_DEBT_REBALANCED) {
            badDebtCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.HEALTH_CHECK_FAILED) {
            healthCheckFailedCounter.increment();
            log.warn("Health check failed: {}", event.getMessage());
        } else if (event.getEventType() == RiskEventType.LIQUIDATION) {
            liquidationCounter.increment();
        } else if (event.getEventType() == RiskEventType.BAD_DEBT_LIQUIDATION) {
            badDebtLiquidationCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onSuperPoolEvent(SuperPoolEvent event) {
        if (event.getEventType() == SuperPoolEventType.DEPOSIT) {
            superPoolDepositCounter.increment();
        }
    }
}
