package com.bazaar.marketplace.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Game integration point. Owns the schema of every item type and the inventory the items
 * live in; the marketplace never inspects item data itself.
 */
public interface ItemAdapter {

    boolean validate(String itemType, JsonNode itemData);

    boolean validateOwnership(String itemId, String wallet);

    /**
     * Withholds a listed item from other game actions.
     *
     * @throws IllegalStateException if the item is already locked or not owned by {@code ownerWallet}
     */
    void lockItem(String itemId, String ownerWallet);

    void unlockItem(String itemId, String ownerWallet);

    ItemTransferResult transferOwnership(String itemId, String fromWallet, String toWallet);

    /**
     * @throws ItemGenerationException if no item can be produced for {@code rarity}
     */
    GeneratedItem generate(String rarity);

    /**
     * @throws ItemGenerationException if the item cannot be placed in the wallet's inventory
     */
    void grantItem(GeneratedItem item, String toWallet);
}
