package com.bazaar.marketplace.provider;

import com.bazaar.marketplace.model.ItemPayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory gem inventory. Serves local runs and tests; a game deployment sets
 * {@code bazaar.item-mode} and supplies its own {@link ItemAdapter} bean.
 */
@Component
@ConditionalOnProperty(
        prefix = "bazaar",
        name = "item-mode",
        havingValue = "gem",
        matchIfMissing = true
)
public class GemItemAdapter implements ItemAdapter {

    public static final String ITEM_TYPE = "gem";

    private static final Logger log = LoggerFactory.getLogger(GemItemAdapter.class);
    private static final List<String> GEM_TYPES = List.of("amethyst", "diamond", "emerald", "ruby", "sapphire");
    private static final Map<String, Double> SIZE_BY_RARITY = Map.of(
            "common", 0.063,
            "uncommon", 0.08,
            "rare", 0.1,
            "epic", 0.125,
            "legendary", 0.16
    );

    private final ConcurrentMap<String, GemRecord> inventory = new ConcurrentHashMap<>();

    @Override
    public boolean validate(String itemType, JsonNode itemData) {
        if (!ITEM_TYPE.equals(itemType) || itemData == null || !itemData.isObject()) {
            return false;
        }
        JsonNode type = itemData.get("type");
        JsonNode rarity = itemData.get("rarity");
        JsonNode level = itemData.get("level");
        JsonNode size = itemData.get("size");
        return type != null && type.isTextual() && GEM_TYPES.contains(type.textValue())
                && rarity != null && rarity.isTextual() && SIZE_BY_RARITY.containsKey(rarity.textValue())
                && (level == null || (level.isIntegralNumber() && level.intValue() >= 1))
                && (size == null || (size.isNumber() && size.doubleValue() > 0.0));
    }

    @Override
    public boolean validateOwnership(String itemId, String wallet) {
        GemRecord gem = inventory.get(itemId);
        return gem != null && gem.ownerWallet.equals(wallet);
    }

    @Override
    public void lockItem(String itemId, String ownerWallet) {
        inventory.compute(itemId, (id, gem) -> {
            if (gem == null || !gem.ownerWallet.equals(ownerWallet)) {
                throw new IllegalStateException("Gem " + itemId + " is not owned by " + ownerWallet);
            }
            if (gem.locked) {
                throw new IllegalStateException("Gem " + itemId + " is already locked");
            }
            return gem.withLock(true);
        });
    }

    @Override
    public void unlockItem(String itemId, String ownerWallet) {
        inventory.computeIfPresent(itemId, (id, gem) ->
                gem.ownerWallet.equals(ownerWallet) ? gem.withLock(false) : gem
        );
    }

    @Override
    public ItemTransferResult transferOwnership(String itemId, String fromWallet, String toWallet) {
        AtomicReference<String> failure = new AtomicReference<>();
        inventory.compute(itemId, (id, gem) -> {
            if (gem == null) {
                failure.set("Gem " + itemId + " does not exist");
                return null;
            }
            if (!gem.ownerWallet.equals(fromWallet)) {
                failure.set("Gem " + itemId + " is not owned by " + fromWallet);
                return gem;
            }
            return new GemRecord(toWallet, gem.data, false);
        });
        if (failure.get() != null) {
            return ItemTransferResult.failed(failure.get());
        }
        log.debug("Gem {} moved from {} to {}", itemId, fromWallet, toWallet);
        return ItemTransferResult.transferred();
    }

    @Override
    public GeneratedItem generate(String rarity) {
        Double size = SIZE_BY_RARITY.get(rarity);
        if (size == null) {
            throw new ItemGenerationException("No gem exists for rarity: " + rarity);
        }
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("type", GEM_TYPES.get(ThreadLocalRandom.current().nextInt(GEM_TYPES.size())));
        data.put("rarity", rarity);
        data.put("level", 1);
        data.put("size", size);
        return new GeneratedItem("gem-" + UUID.randomUUID(), rarity, new ItemPayload(ITEM_TYPE, data));
    }

    @Override
    public void grantItem(GeneratedItem item, String toWallet) {
        Objects.requireNonNull(item, "item is required");
        GemRecord previous = inventory.putIfAbsent(
                item.itemId(),
                new GemRecord(toWallet, item.payload().data().deepCopy(), false)
        );
        if (previous != null) {
            throw new ItemGenerationException("Gem " + item.itemId() + " was already granted");
        }
    }

    /**
     * Places an existing gem in a wallet, e.g. when seeding an inventory.
     */
    public void registerItem(String itemId, String ownerWallet, JsonNode data) {
        inventory.put(itemId, new GemRecord(ownerWallet, data.deepCopy(), false));
    }

    public Optional<String> findOwner(String itemId) {
        return Optional.ofNullable(inventory.get(itemId)).map(gem -> gem.ownerWallet);
    }

    public boolean isLocked(String itemId) {
        GemRecord gem = inventory.get(itemId);
        return gem != null && gem.locked;
    }

    private record GemRecord(String ownerWallet, JsonNode data, boolean locked) {
        GemRecord withLock(boolean lockState) {
            return new GemRecord(ownerWallet, data, lockState);
        }
    }
}
