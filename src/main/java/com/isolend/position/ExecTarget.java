package com.isolend.position;

/**
 * External contract a position may call through an EXEC action. Implementations are Spring
 * beans picked up by {@link ExecTargetRegistry}; the position manager only routes calls whose
 * {@code (address, selector)} pair is allow-listed.
 */
public interface ExecTarget {

    String getAddress();

    /**
     * Runs {@code calldata} on behalf of {@code position}. Token movements must go through the
     * token bank, pulling from the position only on allowances the position granted.
     */
    void execute(String position, byte[] calldata);
}
