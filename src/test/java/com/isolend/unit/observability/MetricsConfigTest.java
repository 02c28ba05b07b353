package com.isolend.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.isolend.config.MetricsConfig;
import com.isolend.support.ProtocolTestFixture;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MetricsConfigTest {

    @Test
    @DisplayName("Meters carry the application name and the pool address of the deployment")
    void tagsEveryMeter() {
        MeterRegistry meterRegistry = new SimpleMeterRegistry();
        new MetricsConfig()
                .protocolCommonTags("isolend", ProtocolTestFixture.defaultParameters())
                .customize(meterRegistry);

        Counter counter = meterRegistry.counter("pool.deposits.count");

        assertThat(counter.getId().getTag("application")).isEqualTo("isolend");
        assertThat(counter.getId().getTag("deployment")).isEqualTo(ProtocolTestFixture.POOL_ADDRESS);
    }
}
