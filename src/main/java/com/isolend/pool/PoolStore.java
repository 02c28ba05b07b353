package com.isolend.pool;

import com.isolend.config.ProtocolParameters;
import com.isolend.core.journal.JournaledMap;
import com.isolend.core.journal.JournaledValue;
import com.isolend.core.journal.StateJournal;
import com.isolend.domain.model.PendingUpdate;
import com.isolend.exception.ResourceNotFoundException;
import java.math.BigInteger;
import org.springframework.stereotype.Component;

/**
 * Journaled state of every market: pool snapshots, per-account share balances, share
 * allowances and operators, pending rate-model updates, and the protocol-wide pool settings.
 * Shared by {@link PoolService} and {@link PoolGovernanceService}.
 */
@Component
public class PoolStore {

    record AccountKey(String poolId, String account) {}

    record AllowanceKey(String owner, String spender, String poolId) {}

    record OperatorKey(String owner, String operator) {}

    final JournaledMap<String, PoolData> pools;
    final JournaledMap<AccountKey, BigInteger> depositShares;
    final JournaledMap<AccountKey, BigInteger> borrowShares;
    final JournaledMap<AllowanceKey, BigInteger> allowances;
    final JournaledMap<OperatorKey, Boolean> operators;
    final JournaledMap<String, PendingUpdate<String>> pendingRateModels;

    final JournaledValue<BigInteger> defaultInterestFee;
    final JournaledValue<BigInteger> defaultOriginationFee;
    final JournaledValue<BigInteger> minBorrow;
    final JournaledValue<BigInteger> minDebt;

    public PoolStore(StateJournal stateJournal, ProtocolParameters protocolParameters) {
        this.pools = stateJournal.newMap();
        this.depositShares = stateJournal.newMap();
        this.borrowShares = stateJournal.newMap();
        this.allowances = stateJournal.newMap();
        this.operators = stateJournal.newMap();
        this.pendingRateModels = stateJournal.newMap();
        this.defaultInterestFee = stateJournal.newValue(protocolParameters.getDefaultInterestFee());
        this.defaultOriginationFee = stateJournal.newValue(protocolParameters.getDefaultOriginationFee());
        this.minBorrow = stateJournal.newValue(protocolParameters.getMinBorrow());
        this.minDebt = stateJournal.newValue(protocolParameters.getMinDebt());
    }

    PoolData require(String poolId) {
        PoolData pool = pools.get(poolId);
        if (pool == null) {
            throw new ResourceNotFoundException("Pool", poolId);
        }
        return pool;
    }

    boolean exists(String poolId) {
        return pools.containsKey(poolId);
    }

    BigInteger depositSharesOf(String poolId, String account) {
        return depositShares.getOrDefault(new AccountKey(poolId, account), BigInteger.ZERO);
    }

    void setDepositShares(String poolId, String account, BigInteger shares) {
        AccountKey key = new AccountKey(poolId, account);
        if (shares.signum() == 0) {
            depositShares.remove(key);
        } else {
            depositShares.put(key, shares);
        }
    }

    BigInteger borrowSharesOf(String poolId, String position) {
        return borrowShares.getOrDefault(new AccountKey(poolId, position), BigInteger.ZERO);
    }

    void setBorrowShares(String poolId, String position, BigInteger shares) {
        AccountKey key = new AccountKey(poolId, position);
        if (shares.signum() == 0) {
            borrowShares.remove(key);
        } else {
            borrowShares.put(key, shares);
        }
    }
}
