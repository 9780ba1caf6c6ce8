package com.polymarket.ctf.infra;

import com.polymarket.ctf.core.LedgerHashes;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * ERC20-style token kept in memory, for sandboxes and tests.
 */
@Slf4j
public class InMemoryCollateralToken implements CollateralToken {

    private final String address;
    private final Map<String, BigInteger> balances = new HashMap<>();
    private final Map<String, Map<String, BigInteger>> allowances = new HashMap<>();

    public InMemoryCollateralToken(String address) {
        this.address = LedgerHashes.normalizeAddress(address);
    }

    @Override
    public String address() {
        return address;
    }

    public synchronized void mint(String to, BigInteger amount) {
        String account = LedgerHashes.normalizeAddress(to);
        balances.merge(account, amount, BigInteger::add);
        log.debug("Minted {} of {} to {}", amount, address, account);
    }

    public synchronized void approve(String owner, String spender, BigInteger amount) {
        allowances.computeIfAbsent(LedgerHashes.normalizeAddress(owner), k -> new HashMap<>())
                .put(LedgerHashes.normalizeAddress(spender), amount);
    }

    public synchronized BigInteger allowance(String owner, String spender) {
        return allowances.getOrDefault(LedgerHashes.normalizeAddress(owner), Map.of())
                .getOrDefault(LedgerHashes.normalizeAddress(spender), BigInteger.ZERO);
    }

    @Override
    public synchronized boolean transferFrom(String operator, String from, String to, BigInteger amount) {
        String owner = LedgerHashes.normalizeAddress(from);
        String spender = LedgerHashes.normalizeAddress(operator);
        BigInteger allowed = allowance(owner, spender);
        if (!owner.equals(spender) && allowed.compareTo(amount) < 0) {
            log.debug("transferFrom refused: allowance {} < {} ({} -> {})", allowed, amount, owner, spender);
            return false;
        }
        if (!move(owner, LedgerHashes.normalizeAddress(to), amount)) {
            return false;
        }
        if (!owner.equals(spender)) {
            approve(owner, spender, allowed.subtract(amount));
        }
        return true;
    }

    @Override
    public synchronized boolean transfer(String sender, String to, BigInteger amount) {
        return move(LedgerHashes.normalizeAddress(sender), LedgerHashes.normalizeAddress(to), amount);
    }

    @Override
    public synchronized BigInteger balanceOf(String account) {
        return balances.getOrDefault(LedgerHashes.normalizeAddress(account), BigInteger.ZERO);
    }

    private boolean move(String from, String to, BigInteger amount) {
        BigInteger balance = balances.getOrDefault(from, BigInteger.ZERO);
        if (amount.signum() < 0 || balance.compareTo(amount) < 0) {
            log.debug("transfer refused: balance {} < {} ({})", balance, amount, from);
            return false;
        }
        balances.put(from, balance.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
        return true;
    }
}
