package com.isolend.position;

import com.isolend.core.address.AddressUtil;
import com.isolend.exception.UnauthorizedException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves EXEC targets by address. Collects every {@link ExecTarget} bean at startup; more can
 * be registered at runtime.
 */
@Component
public class ExecTargetRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecTargetRegistry.class);

    private final Map<String, ExecTarget> targets = new ConcurrentHashMap<>();

    public ExecTargetRegistry(List<ExecTarget> execTargets) {
        execTargets.forEach(this::register);
    }

    public void register(ExecTarget target) {
        String address = AddressUtil.normalize(target.getAddress());
        targets.put(address, target);
        log.info("Registered exec target {} ({})", address, target.getClass().getSimpleName());
    }

    public ExecTarget require(String address) {
        ExecTarget target = targets.get(address);
        if (target == null) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.UNKNOWN_FUNCTION, "No exec target deployed at " + address);
        }
        return target;
    }
}
