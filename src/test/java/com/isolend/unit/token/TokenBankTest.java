package com.isolend.unit.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.isolend.core.journal.StateJournal;
import com.isolend.exception.InsufficientFundsException;
import com.isolend.exception.UnauthorizedException;
import com.isolend.support.ProtocolTestFixture;
import com.isolend.token.TokenBank;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TokenBankTest {

    private static final String TOKEN = ProtocolTestFixture.USDC;
    private static final String ALICE = ProtocolTestFixture.ALICE;
    private static final String BOB = ProtocolTestFixture.BOB;
    private static final String SPENDER = ProtocolTestFixture.POOL_ADDRESS;

    private TokenBank tokenBank;

    @BeforeEach
    void setUp() {
        tokenBank = new TokenBank(new StateJournal());
        tokenBank.mint(TOKEN, ALICE, BigInteger.valueOf(100));
    }

    @Test
    @DisplayName("Transfer moves balance between holders")
    void transferMovesBalance() {
        tokenBank.transfer(TOKEN, ALICE, BOB, BigInteger.valueOf(40));

        assertThat(tokenBank.balanceOf(TOKEN, ALICE)).isEqualTo(BigInteger.valueOf(60));
        assertThat(tokenBank.balanceOf(TOKEN, BOB)).isEqualTo(BigInteger.valueOf(40));
    }

    @Test
    @DisplayName("Transfer above balance fails")
    void transferAboveBalanceFails() {
        assertThatThrownBy(() -> tokenBank.transfer(TOKEN, ALICE, BOB, BigInteger.valueOf(101)))
                .isInstanceOf(InsufficientFundsException.class)
                .extracting("reason")
                .isEqualTo(InsufficientFundsException.Reason.INSUFFICIENT_BALANCE);
    }

    @Test
    @DisplayName("transferFrom spends the allowance")
    void transferFromSpendsAllowance() {
        tokenBank.approve(TOKEN, ALICE, SPENDER, BigInteger.valueOf(50));

        tokenBank.transferFrom(TOKEN, SPENDER, ALICE, BOB, BigInteger.valueOf(30));

        assertThat(tokenBank.allowance(TOKEN, ALICE, SPENDER)).isEqualTo(BigInteger.valueOf(20));
        assertThat(tokenBank.balanceOf(TOKEN, BOB)).isEqualTo(BigInteger.valueOf(30));
    }

    @Test
    @DisplayName("transferFrom beyond the allowance fails")
    void transferFromBeyondAllowanceFails() {
        tokenBank.approve(TOKEN, ALICE, SPENDER, BigInteger.TEN);

        assertThatThrownBy(() -> tokenBank.transferFrom(TOKEN, SPENDER, ALICE, BOB, BigInteger.valueOf(11)))
                .isInstanceOf(UnauthorizedException.class)
                .extracting("reason")
                .isEqualTo(UnauthorizedException.Reason.INSUFFICIENT_ALLOWANCE);
    }

    @Test
    @DisplayName("Infinite allowance is never decremented")
    void infiniteAllowanceStays() {
        tokenBank.approve(TOKEN, ALICE, SPENDER, TokenBank.MAX_ALLOWANCE);

        tokenBank.transferFrom(TOKEN, SPENDER, ALICE, BOB, BigInteger.valueOf(100));

        assertThat(tokenBank.allowance(TOKEN, ALICE, SPENDER)).isEqualTo(TokenBank.MAX_ALLOWANCE);
    }
}
