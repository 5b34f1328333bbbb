package com.bazaar.marketplace.provider;

import com.bazaar.marketplace.config.X402Properties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.p2p.solanaj.rpc.RpcClient;
import org.p2p.solanaj.rpc.RpcException;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SolanaRpcTransactionConfirmerTest {

    private static final String MINT = "4zMMC9srt5Ri5X14GAgXhaHii3GnPAEERYPJgZJDncDU";
    private static final String TREASURY = "Treasury1111111111111111111111111111111111";
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Mock
    private RpcClient rpcClient;

    private SolanaRpcTransactionConfirmer confirmer;

    @BeforeEach
    void setUp() {
        X402Properties properties = new X402Properties();
        properties.setMaxPollAttempts(2);
        properties.setPollIntervalMs(0L);
        confirmer = new SolanaRpcTransactionConfirmer(rpcClient, properties);
    }

    @Test
    void transferIsReadFromTokenBalanceDeltas() throws Exception {
        JsonNode meta = OBJECT_MAPPER.readTree("""
                {
                  "err": null,
                  "preTokenBalances": [
                    {"accountIndex": 1, "mint": "%1$s", "owner": "buyer-wallet", "uiTokenAmount": {"amount": "9000000"}},
                    {"accountIndex": 2, "mint": "%1$s", "owner": "%2$s", "uiTokenAmount": {"amount": "500000"}}
                  ],
                  "postTokenBalances": [
                    {"accountIndex": 1, "mint": "%1$s", "owner": "buyer-wallet", "uiTokenAmount": {"amount": "7000000"}},
                    {"accountIndex": 2, "mint": "%1$s", "owner": "%2$s", "uiTokenAmount": {"amount": "2500000"}},
                    {"accountIndex": 3, "mint": "OtherMint", "owner": "%2$s", "uiTokenAmount": {"amount": "99000000"}}
                  ]
                }
                """.formatted(MINT, TREASURY));

        ConfirmedTransfer transfer = SolanaRpcTransactionConfirmer.transferOf("sig-1", meta, MINT, TREASURY);

        assertEquals(new BigDecimal("2.000000"), transfer.amountUsdc());
        assertEquals("buyer-wallet", transfer.payerWallet());
    }

    @Test
    void newlyCreatedRecipientAccountCountsFromZero() throws Exception {
        JsonNode meta = OBJECT_MAPPER.readTree("""
                {
                  "preTokenBalances": [
                    {"accountIndex": 1, "mint": "%1$s", "owner": "buyer-wallet", "uiTokenAmount": {"amount": "1000000"}}
                  ],
                  "postTokenBalances": [
                    {"accountIndex": 1, "mint": "%1$s", "owner": "buyer-wallet", "uiTokenAmount": {"amount": "0"}},
                    {"accountIndex": 4, "mint": "%1$s", "owner": "%2$s", "uiTokenAmount": {"amount": "1000000"}}
                  ]
                }
                """.formatted(MINT, TREASURY));

        ConfirmedTransfer transfer = SolanaRpcTransactionConfirmer.transferOf("sig-2", meta, MINT, TREASURY);

        assertEquals(new BigDecimal("1.000000"), transfer.amountUsdc());
        assertEquals("buyer-wallet", transfer.payerWallet());
    }

    @Test
    void transactionWithoutUsdcMovementHasNoPayer() throws Exception {
        JsonNode meta = OBJECT_MAPPER.readTree("{\"preTokenBalances\": [], \"postTokenBalances\": []}");

        ConfirmedTransfer transfer = SolanaRpcTransactionConfirmer.transferOf("sig-3", meta, MINT, TREASURY);

        assertEquals(0, transfer.amountUsdc().signum());
        assertNull(transfer.payerWallet());
    }

    @Test
    void failedTransactionIsNotATransfer() throws Exception {
        when(rpcClient.call(eq("getTransaction"), anyList(), eq(Map.class)))
                .thenReturn(Map.of("meta", Map.of("err", Map.of("InstructionError", "custom"))));

        assertTrue(confirmer.findTransfer("sig-failed", MINT, TREASURY).isEmpty());
    }

    @Test
    void unknownSignatureIsPolledThenGivenUp() throws Exception {
        when(rpcClient.call(eq("getTransaction"), anyList(), eq(Map.class))).thenReturn(null);

        Optional<ConfirmedTransfer> transfer = confirmer.findTransfer("sig-unknown", MINT, TREASURY);

        assertTrue(transfer.isEmpty());
        verify(rpcClient, times(2)).call(eq("getTransaction"), anyList(), eq(Map.class));
    }

    @Test
    void rpcOutageIsTransient() throws Exception {
        when(rpcClient.call(eq("getTransaction"), anyList(), eq(Map.class))).thenThrow(new RpcException("node down"));

        CurrencyAdapterException ex = assertThrows(CurrencyAdapterException.class,
                () -> confirmer.findTransfer("sig-outage", MINT, TREASURY));

        assertTrue(ex.isTransientFailure());
    }
}
