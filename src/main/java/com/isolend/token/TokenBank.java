package com.isolend.token;

import com.isolend.core.address.AddressUtil;
import com.isolend.core.journal.JournaledMap;
import com.isolend.core.journal.StateJournal;
import com.isolend.core.math.WadMath;
import com.isolend.exception.InsufficientFundsException;
import com.isolend.exception.UnauthorizedException;
import java.math.BigInteger;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * ERC-20 style custody for every asset the protocol touches.
 *
 * <p>Balances and allowances are keyed by {@code (asset, holder)} and
 * {@code (asset, owner, spender)}. Pools, positions and superpools hold tokens here under their
 * own addresses. An allowance equal to {@link #MAX_ALLOWANCE} is never decremented.
 *
 * <p>State is journaled; callers run inside a protocol call so failed transfers roll back with
 * the rest of the call.
 */
@Component
public class TokenBank {

    private static final Logger log = LoggerFactory.getLogger(TokenBank.class);

    public static final BigInteger MAX_ALLOWANCE = WadMath.MAX_UINT256;

    private final JournaledMap<BalanceKey, BigInteger> balances;
    private final JournaledMap<AllowanceKey, BigInteger> allowances;

    record BalanceKey(String asset, String holder) {}

    record AllowanceKey(String asset, String owner, String spender) {}

    public TokenBank(StateJournal stateJournal) {
        this.balances = stateJournal.newMap();
        this.allowances = stateJournal.newMap();
    }

    public BigInteger balanceOf(String asset, String holder) {
        return balances.getOrDefault(new BalanceKey(asset, holder), BigInteger.ZERO);
    }

    public BigInteger allowance(String asset, String owner, String spender) {
        return allowances.getOrDefault(new AllowanceKey(asset, owner, spender), BigInteger.ZERO);
    }

    /** Credits new tokens; stands in for an external faucet or bridge. */
    public void mint(String asset, String to, BigInteger amount) {
        WadMath.requireUnsigned(amount);
        String holder = AddressUtil.normalize(to);
        credit(asset, holder, amount);
        log.debug("Minted {} of {} to {}", amount, asset, holder);
    }

    public void transfer(String asset, String from, String to, BigInteger amount) {
        WadMath.requireUnsigned(amount);
        debit(asset, from, amount);
        credit(asset, to, amount);
    }

    /** Moves {@code amount} from {@code from} to {@code to} on the allowance granted to {@code spender}. */
    public void transferFrom(String asset, String spender, String from, String to, BigInteger amount) {
        WadMath.requireUnsigned(amount);
        if (!spender.equals(from)) {
            spendAllowance(asset, from, spender, amount);
        }
        transfer(asset, from, to, amount);
    }

    public void approve(String asset, String owner, String spender, BigInteger amount) {
        WadMath.requireUnsigned(amount);
        allowances.put(new AllowanceKey(asset, owner, spender), amount);
    }

    private void spendAllowance(String asset, String owner, String spender, BigInteger amount) {
        BigInteger allowed = allowance(asset, owner, spender);
        if (allowed.equals(MAX_ALLOWANCE)) {
            return;
        }
        if (allowed.compareTo(amount) < 0) {
            throw new UnauthorizedException(
                    UnauthorizedException.Reason.INSUFFICIENT_ALLOWANCE,
                    "Allowance of " + spender + " over " + owner + " is " + allowed + ", needs " + amount,
                    Map.of("asset", asset, "owner", owner, "spender", spender));
        }
        allowances.put(new AllowanceKey(asset, owner, spender), allowed.subtract(amount));
    }

    private void debit(String asset, String holder, BigInteger amount) {
        BigInteger balance = balanceOf(asset, holder);
        if (balance.compareTo(amount) < 0) {
            throw new InsufficientFundsException(
                    InsufficientFundsException.Reason.INSUFFICIENT_BALANCE,
                    holder + " holds " + balance + " of " + asset + ", needs " + amount,
                    Map.of("asset", asset, "holder", holder));
        }
        balances.put(new BalanceKey(asset, holder), balance.subtract(amount));
    }

    private void credit(String asset, String holder, BigInteger amount) {
        balances.put(new BalanceKey(asset, holder), balanceOf(asset, holder).add(amount));
    }
}
