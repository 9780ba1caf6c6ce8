package com.polymarket.ctf.infra;

import java.math.BigInteger;

/**
 * Fungible asset that backs positions. Calls carry the acting account explicitly since there is
 * no ambient message sender.
 */
public interface CollateralToken {

    String address();

    /**
     * Moves {@code amount} from {@code from} to {@code to}, spending {@code operator}'s allowance.
     *
     * @return false when the transfer was refused
     */
    boolean transferFrom(String operator, String from, String to, BigInteger amount);

    boolean transfer(String sender, String to, BigInteger amount);

    BigInteger balanceOf(String account);
}
