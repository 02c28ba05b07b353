package com.isolend.superpool;

import com.isolend.config.ProtocolParameters;
import com.isolend.core.address.AddressDeriver;
import com.isolend.core.address.AddressUtil;
import com.isolend.core.journal.CallExecutor;
import com.isolend.core.journal.JournaledMap;
import com.isolend.core.journal.StateJournal;
import com.isolend.event.EventPublisherHelper;
import com.isolend.event.SuperPoolEventType;
import com.isolend.exception.BoundsViolationException;
import com.isolend.exception.ProtocolStateException;
import com.isolend.exception.ResourceNotFoundException;
import com.isolend.pool.PoolService;
import com.isolend.token.TokenBank;
import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Deploys superpools at deterministic addresses and keeps track of them.
 *
 * <p>Every deployment seeds the vault with an initial deposit from the deployer whose shares are
 * sent to the dead address. At least {@code min-superpool-burned-shares} must be burned, which
 * keeps the share price of a fresh vault from being inflated by a donation.
 */
@Service
public class SuperPoolFactory {

    private static final Logger log = LoggerFactory.getLogger(SuperPoolFactory.class);

    private final PoolService poolService;
    private final TokenBank tokenBank;
    private final CallExecutor callExecutor;
    private final StateJournal stateJournal;
    private final EventPublisherHelper eventPublisherHelper;
    private final ProtocolParameters protocolParameters;
    private final Clock clock;

    private final JournaledMap<String, SuperPool> superPools;

    public SuperPoolFactory(
            PoolService poolService,
            TokenBank tokenBank,
            CallExecutor callExecutor,
            StateJournal stateJournal,
            EventPublisherHelper eventPublisherHelper,
            ProtocolParameters protocolParameters,
            Clock clock) {
        this.poolService = poolService;
        this.tokenBank = tokenBank;
        this.callExecutor = callExecutor;
        this.stateJournal = stateJournal;
        this.eventPublisherHelper = eventPublisherHelper;
        this.protocolParameters = protocolParameters;
        this.clock = clock;
        this.superPools = stateJournal.newMap();
    }

    /**
     * Deploys a superpool owned by {@code owner}. The caller must have approved the factory for
     * {@code initialDeposit} of {@code asset}.
     *
     * @return the new superpool
     */
    public SuperPool deploySuperPool(
            String caller,
            String owner,
            String asset,
            String feeRecipient,
            BigInteger fee,
            BigInteger superPoolCap,
            BigInteger initialDeposit,
            String name,
            String symbol) {
        String deployer = AddressUtil.normalize(caller);
        String vaultOwner = AddressUtil.normalize(owner);
        String token = AddressUtil.normalize(asset);
        String recipient = feeRecipient != null ? AddressUtil.normalize(feeRecipient) : null;
        return callExecutor.execute("SuperPoolFactory.deploySuperPool", () -> {
            if (fee.signum() > 0 && recipient == null) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.INVALID_PARAMETER, "A nonzero fee needs a fee recipient");
            }
            if (fee.compareTo(protocolParameters.getMaxSuperPoolFee()) > 0) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.FEE_TOO_HIGH,
                        "Fee " + fee + " exceeds the maximum " + protocolParameters.getMaxSuperPoolFee());
            }

            String address = AddressDeriver.superPoolAddress(factoryAddress(), vaultOwner, token, name);
            if (superPools.containsKey(address)) {
                throw new ProtocolStateException(
                        ProtocolStateException.Reason.SUPERPOOL_ALREADY_EXISTS,
                        "Superpool " + name + " for " + vaultOwner + " already deployed at " + address);
            }
            SuperPool superPool = new SuperPool(
                    new SuperPoolConfig(address, vaultOwner, token, recipient, fee, superPoolCap, name, symbol),
                    poolService,
                    tokenBank,
                    callExecutor,
                    stateJournal,
                    eventPublisherHelper,
                    protocolParameters,
                    clock);
            superPools.put(address, superPool);

            tokenBank.transferFrom(token, factoryAddress(), deployer, factoryAddress(), initialDeposit);
            tokenBank.approve(token, factoryAddress(), address, initialDeposit);
            BigInteger shares = superPool.deposit(factoryAddress(), initialDeposit, AddressUtil.DEAD_ADDRESS);
            if (shares.compareTo(protocolParameters.getMinSuperPoolBurnedShares()) < 0) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.INVALID_PARAMETER,
                        "Initial deposit burns " + shares + " shares, need at least "
                                + protocolParameters.getMinSuperPoolBurnedShares(),
                        Map.of("shares", shares, "minShares", protocolParameters.getMinSuperPoolBurnedShares()));
            }

            log.info("Superpool {} ({}) deployed at {} for owner {}, {} shares burned",
                    name, symbol, address, vaultOwner, shares);
            eventPublisherHelper.publishSuperPool(
                    this, SuperPoolEventType.DEPLOYED, address, vaultOwner, initialDeposit, shares);
            return superPool;
        });
    }

    public SuperPool require(String address) {
        return callExecutor.read(() -> {
            SuperPool superPool = superPools.get(AddressUtil.normalize(address));
            if (superPool == null) {
                throw new ResourceNotFoundException("SuperPool", address);
            }
            return superPool;
        });
    }

    public boolean isDeployed(String address) {
        return callExecutor.read(
                () -> AddressUtil.isAddress(address) && superPools.containsKey(AddressUtil.normalize(address)));
    }

    public List<String> getSuperPools() {
        return callExecutor.read(() -> List.copyOf(superPools.keySet()));
    }

    private String factoryAddress() {
        return protocolParameters.getSuperPoolFactoryAddress();
    }
}
