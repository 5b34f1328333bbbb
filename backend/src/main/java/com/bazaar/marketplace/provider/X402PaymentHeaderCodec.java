package com.bazaar.marketplace.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encodes and decodes the Base64 JSON carried in the X-PAYMENT header.
 */
public final class X402PaymentHeaderCodec {

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private X402PaymentHeaderCodec() {
    }

    public static String encode(X402PaymentPayload payload) {
        try {
            byte[] json = OBJECT_MAPPER.writeValueAsBytes(payload);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode x402 payment payload", ex);
        }
    }

    public static X402PaymentPayload decode(String header) {
        if (header == null || header.isBlank()) {
            throw new IllegalArgumentException("X-PAYMENT header is required");
        }

        byte[] json;
        try {
            json = Base64.getDecoder().decode(header.trim());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("X-PAYMENT header must be Base64 encoded", ex);
        }

        X402PaymentPayload payload;
        try {
            payload = OBJECT_MAPPER.readValue(new String(json, StandardCharsets.UTF_8), X402PaymentPayload.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("X-PAYMENT header must be valid JSON", ex);
        }

        requireStructure(payload);
        return payload;
    }

    private static void requireStructure(X402PaymentPayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("X-PAYMENT payload must be a JSON object");
        }
        if (isBlank(payload.scheme()) || isBlank(payload.network())) {
            throw new IllegalArgumentException("X-PAYMENT payload requires scheme and network");
        }
        X402PaymentPayload.Transfer transfer = payload.payload();
        if (transfer == null) {
            throw new IllegalArgumentException("X-PAYMENT payload requires a transfer object");
        }
        if (isBlank(transfer.signature())
                || isBlank(transfer.from())
                || isBlank(transfer.to())
                || isBlank(transfer.amount())
                || isBlank(transfer.mint())) {
            throw new IllegalArgumentException(
                    "X-PAYMENT transfer requires signature, from, to, amount and mint"
            );
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
