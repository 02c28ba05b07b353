package com.isolend.position;

import com.isolend.config.ProtocolParameters;
import com.isolend.core.journal.JournaledMap;
import com.isolend.core.journal.StateJournal;
import com.isolend.exception.BoundsViolationException;
import com.isolend.exception.ProtocolStateException;
import com.isolend.exception.ResourceNotFoundException;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Journaled arena of positions keyed by their deterministic address, together with ownership
 * and the per-position operator set.
 */
@Component
public class PositionRegistry {

    record AuthKey(String position, String user) {}

    private final JournaledMap<String, Position> positions;
    private final JournaledMap<String, String> owners;
    private final JournaledMap<AuthKey, Boolean> operators;
    private final ProtocolParameters protocolParameters;

    public PositionRegistry(StateJournal stateJournal, ProtocolParameters protocolParameters) {
        this.positions = stateJournal.newMap();
        this.owners = stateJournal.newMap();
        this.operators = stateJournal.newMap();
        this.protocolParameters = protocolParameters;
    }

    void create(String address, String owner) {
        if (positions.containsKey(address)) {
            throw new ProtocolStateException(
                    ProtocolStateException.Reason.POSITION_ALREADY_EXISTS, "Position " + address + " already exists");
        }
        positions.put(
                address,
                new Position(
                        address, protocolParameters.getMaxPositionAssets(), protocolParameters.getMaxPositionDebtPools()));
        owners.put(address, owner);
    }

    public boolean exists(String address) {
        return positions.containsKey(address);
    }

    public Position require(String address) {
        Position position = positions.get(address);
        if (position == null) {
            throw new ResourceNotFoundException("Position", address);
        }
        return position;
    }

    /** Owner of the position, or null when no position lives at {@code address}. */
    public String ownerOf(String address) {
        return owners.get(address);
    }

    void setOwner(String address, String owner) {
        owners.put(address, owner);
    }

    /** True for the owner and for every operator the owner enabled. */
    public boolean isAuth(String address, String user) {
        String owner = owners.get(address);
        if (owner == null) {
            return false;
        }
        return owner.equals(user) || operators.getOrDefault(new AuthKey(address, user), false);
    }

    boolean toggleOperator(String address, String user) {
        AuthKey key = new AuthKey(address, user);
        boolean enabled = !operators.getOrDefault(key, false);
        if (enabled) {
            operators.put(key, true);
        } else {
            operators.remove(key);
        }
        return enabled;
    }

    // ---- collateral and debt sets ----

    void addAsset(String address, String asset) {
        positions.update(address, position -> position.withAssets(set -> {
            if (!set.insert(asset)) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.MAX_ASSETS_EXCEEDED,
                        "Position " + address + " already tracks " + set.capacity() + " assets",
                        Map.of("position", address, "asset", asset));
            }
        }));
    }

    void removeAsset(String address, String asset) {
        positions.update(address, position -> position.withAssets(set -> set.remove(asset)));
    }

    void addDebtPool(String address, String poolId) {
        positions.update(address, position -> position.withDebtPools(set -> {
            if (!set.insert(poolId)) {
                throw new BoundsViolationException(
                        BoundsViolationException.Reason.MAX_DEBT_POOLS_EXCEEDED,
                        "Position " + address + " already owes " + set.capacity() + " pools",
                        Map.of("position", address, "poolId", poolId));
            }
        }));
    }

    void removeDebtPool(String address, String poolId) {
        positions.update(address, position -> position.withDebtPools(set -> set.remove(poolId)));
    }
}
