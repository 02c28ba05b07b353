package com.isolend.irm;

import com.isolend.config.ProtocolParameters;
import com.isolend.config.RateModelConfig;
import com.isolend.core.math.WadMath;
import com.isolend.pool.PoolGovernanceService;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Registers the rate models from {@code isolend.irm.models} once the application has started,
 * acting as the protocol owner. Pools can only be initialized against a registered key.
 */
@Component
public class RateModelBootstrap implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(RateModelBootstrap.class);

    private final RateModelConfig rateModelConfig;
    private final PoolGovernanceService poolGovernanceService;
    private final ProtocolParameters protocolParameters;

    public RateModelBootstrap(
            RateModelConfig rateModelConfig,
            PoolGovernanceService poolGovernanceService,
            ProtocolParameters protocolParameters) {
        this.rateModelConfig = rateModelConfig;
        this.poolGovernanceService = poolGovernanceService;
        this.protocolParameters = protocolParameters;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        int registered = registerConfiguredModels();
        log.info("Startup: {} rate model(s) registered", registered);
    }

    public int registerConfiguredModels() {
        for (Map.Entry<String, RateModelConfig.Definition> entry :
                rateModelConfig.getModels().entrySet()) {
            poolGovernanceService.registerRateModel(
                    protocolParameters.getProtocolOwner(), entry.getKey(), build(entry.getValue()));
        }
        return rateModelConfig.getModels().size();
    }

    static RateModel build(RateModelConfig.Definition definition) {
        return switch (definition.getType()) {
            case FIXED -> new FixedRateModel(WadMath.wad(definition.getRate()));
            case LINEAR -> new LinearRateModel(
                    WadMath.wad(definition.getMinRate()), WadMath.wad(definition.getMaxRate()));
        };
    }
}
