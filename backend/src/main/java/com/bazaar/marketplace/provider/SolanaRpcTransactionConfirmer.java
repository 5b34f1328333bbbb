package com.bazaar.marketplace.provider;

import com.bazaar.marketplace.config.X402Properties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.p2p.solanaj.rpc.RpcClient;
import org.p2p.solanaj.rpc.RpcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Polls the Solana RPC node until the transfer signature is visible, then derives the USDC
 * movement from the transaction's pre and post token balances.
 */
@Component
@ConditionalOnProperty(prefix = "bazaar", name = "payment-mode", havingValue = "x402")
public class SolanaRpcTransactionConfirmer implements X402TransactionConfirmer {

    private static final Logger log = LoggerFactory.getLogger(SolanaRpcTransactionConfirmer.class);
    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder().build();

    private final RpcClient rpcClient;
    private final X402Properties x402Properties;

    public SolanaRpcTransactionConfirmer(RpcClient rpcClient, X402Properties x402Properties) {
        this.rpcClient = rpcClient;
        this.x402Properties = x402Properties;
    }

    @Override
    public Optional<ConfirmedTransfer> findTransfer(String signature, String mint, String recipient) {
        int attempts = Math.max(1, x402Properties.getMaxPollAttempts());
        RpcException lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                JsonNode transaction = fetchTransaction(signature);
                JsonNode meta = transaction.path("meta");
                if (meta.isObject()) {
                    if (!meta.path("err").isMissingNode() && !meta.path("err").isNull()) {
                        log.debug("Signature {} found on attempt {} but failed: {}", signature, attempt, meta.path("err"));
                        return Optional.empty();
                    }
                    log.debug("Signature {} found on attempt {}", signature, attempt);
                    return Optional.of(transferOf(signature, meta, mint, recipient));
                }
                lastError = null;
            } catch (RpcException ex) {
                lastError = ex;
                log.debug("RPC lookup of signature {} failed on attempt {}: {}", signature, attempt, ex.getMessage());
            }
            if (attempt < attempts) {
                pause();
            }
        }

        if (lastError != null) {
            throw new CurrencyAdapterException(
                    "Solana RPC unavailable while confirming " + signature,
                    true,
                    lastError
            );
        }
        return Optional.empty();
    }

    private JsonNode fetchTransaction(String signature) throws RpcException {
        Map<String, Object> config = Map.of(
                "encoding", "json",
                "commitment", "confirmed",
                "maxSupportedTransactionVersion", 0
        );
        List<Object> params = List.of(signature, config);
        Map<?, ?> result = rpcClient.call("getTransaction", params, Map.class);
        return result == null ? OBJECT_MAPPER.missingNode() : OBJECT_MAPPER.valueToTree(result);
    }

    static ConfirmedTransfer transferOf(String signature, JsonNode meta, String mint, String recipient) {
        Map<Integer, TokenBalance> before = tokenBalances(meta.path("preTokenBalances"), mint);
        Map<Integer, TokenBalance> after = tokenBalances(meta.path("postTokenBalances"), mint);

        Set<Integer> accounts = new HashSet<>(before.keySet());
        accounts.addAll(after.keySet());

        BigInteger received = BigInteger.ZERO;
        BigInteger largestDebit = BigInteger.ZERO;
        String payer = null;
        for (Integer account : accounts) {
            TokenBalance pre = before.get(account);
            TokenBalance post = after.get(account);
            BigInteger delta = amountOf(post).subtract(amountOf(pre));
            String owner = post != null ? post.owner() : pre.owner();
            if (recipient.equals(owner)) {
                received = received.add(delta);
            } else if (delta.signum() < 0 && delta.negate().compareTo(largestDebit) > 0) {
                largestDebit = delta.negate();
                payer = owner;
            }
        }
        if (received.signum() < 0) {
            received = BigInteger.ZERO;
        }
        return new ConfirmedTransfer(signature, UsdcAmounts.fromSmallestUnit(received.toString()), payer);
    }

    private static Map<Integer, TokenBalance> tokenBalances(JsonNode balances, String mint) {
        Map<Integer, TokenBalance> byAccount = new HashMap<>();
        for (JsonNode balance : balances) {
            if (!mint.equals(balance.path("mint").asText())) {
                continue;
            }
            byAccount.put(
                    balance.path("accountIndex").asInt(),
                    new TokenBalance(
                            balance.path("owner").asText(null),
                            new BigInteger(balance.path("uiTokenAmount").path("amount").asText("0"))
                    )
            );
        }
        return byAccount;
    }

    private static BigInteger amountOf(TokenBalance balance) {
        return balance == null ? BigInteger.ZERO : balance.amount();
    }

    private void pause() {
        try {
            Thread.sleep(Math.max(0L, x402Properties.getPollIntervalMs()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CurrencyAdapterException("Interrupted while polling for transaction confirmation", true, ex);
        }
    }

    private record TokenBalance(String owner, BigInteger amount) {
    }
}
