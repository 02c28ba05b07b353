package com.isolend.position;

import java.util.List;
import java.util.function.Consumer;

/**
 * Collateral account: the assets it tracks as collateral and the pools it owes.
 *
 * <p>Token balances live in the token bank under {@link #getAddress()}; debt lives in the pool
 * ledgers. A position is never destroyed, drained entries are removed from its sets instead.
 */
public final class Position {

    private final String address;
    private final BoundedSet assets;
    private final BoundedSet debtPools;

    Position(String address, int maxAssets, int maxDebtPools) {
        this(address, new BoundedSet(maxAssets), new BoundedSet(maxDebtPools));
    }

    private Position(String address, BoundedSet assets, BoundedSet debtPools) {
        this.address = address;
        this.assets = assets;
        this.debtPools = debtPools;
    }

    public String getAddress() {
        return address;
    }

    public List<String> getAssets() {
        return assets.elements();
    }

    public List<String> getDebtPools() {
        return debtPools.elements();
    }

    public boolean hasAsset(String asset) {
        return assets.contains(asset);
    }

    public boolean hasDebtIn(String poolId) {
        return debtPools.contains(poolId);
    }

    /** Returns a copy with {@code change} applied to its collateral set. */
    Position withAssets(Consumer<BoundedSet> change) {
        BoundedSet next = assets.copy();
        change.accept(next);
        return new Position(address, next, debtPools);
    }

    /** Returns a copy with {@code change} applied to its debt-pool set. */
    Position withDebtPools(Consumer<BoundedSet> change) {
        BoundedSet next = debtPools.copy();
        change.accept(next);
        return new Position(address, assets, next);
    }

    @Override
    public String toString() {
        return "Position{" + address + ", assets=" + assets + ", debtPools=" + debtPools + "}";
    }
}
