package com.polymarket.ctf;

import com.polymarket.ctf.core.ConditionRegistry;
import com.polymarket.ctf.core.MultiAssetLedger;
import com.polymarket.ctf.core.OracleResultIntake;
import com.polymarket.ctf.core.PositionLedger;
import com.polymarket.ctf.core.SlotIdDeriver;
import com.polymarket.ctf.domain.event.ConditionPreparation;
import com.polymarket.ctf.domain.event.PayoutRedemption;
import com.polymarket.ctf.domain.event.PositionSplit;
import com.polymarket.ctf.infra.CollateralTokenRegistry;
import com.polymarket.ctf.infra.InMemoryCollateralToken;
import com.polymarket.ctf.infra.LedgerAuditLog;
import com.polymarket.ctf.infra.PayoutResultCodec;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "ledger.audit.heartbeat-ms=3600000")
class ConditionalTokensApplicationTest {

    private static final String ORACLE = "0x00000000000000000000000000000000000000aa";
    private static final String TRADER = "0x00000000000000000000000000000000000000a1";
    private static final String USDC = "0x2791bca1f2de4661ed88a30c99a7a9449aa84174";

    @Autowired
    private ConditionRegistry registry;
    @Autowired
    private OracleResultIntake intake;
    @Autowired
    private PositionLedger positions;
    @Autowired
    private MultiAssetLedger assets;
    @Autowired
    private CollateralTokenRegistry tokens;
    @Autowired
    private LedgerAuditLog auditLog;

    @Test
    void sandboxLedgerRunsAFullCycle() {
        InMemoryCollateralToken usdc = (InMemoryCollateralToken) tokens.find(USDC).orElseThrow();
        usdc.mint(TRADER, BigInteger.valueOf(100));
        usdc.approve(TRADER, "0x000000000000000000000000000000000000c7f0", BigInteger.valueOf(100));
        String questionId = Numeric.toHexString(Hash.sha3("Q1".getBytes(StandardCharsets.UTF_8)));

        String conditionId = registry.prepareCondition(ORACLE, questionId, 2);
        positions.splitPosition(TRADER, USDC, SlotIdDeriver.ROOT, conditionId, BigInteger.valueOf(100));
        BigInteger yes = SlotIdDeriver.getPositionId(USDC,
                SlotIdDeriver.getPayoutSlotId(SlotIdDeriver.ROOT, conditionId, 0));
        assertEquals(BigInteger.valueOf(100), assets.balanceOf(TRADER, yes));

        intake.receiveResult(ORACLE, questionId, PayoutResultCodec.encode(1, 3));
        assertEquals(BigInteger.valueOf(100),
                positions.redeemPayout(TRADER, USDC, SlotIdDeriver.ROOT, conditionId));

        assertEquals(BigInteger.valueOf(100), usdc.balanceOf(TRADER));
        assertEquals(1, auditLog.getEvents(ConditionPreparation.class).size());
        assertEquals(1, auditLog.getEvents(PositionSplit.class).size());
        assertEquals(1, auditLog.getEvents(PayoutRedemption.class).size());
    }
}
