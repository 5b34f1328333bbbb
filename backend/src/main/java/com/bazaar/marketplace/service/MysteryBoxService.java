package com.bazaar.marketplace.service;

import com.bazaar.marketplace.dto.MysteryBoxRequests;
import com.bazaar.marketplace.error.MarketplaceException;
import com.bazaar.marketplace.model.MarketplaceTransaction;
import com.bazaar.marketplace.model.MarketplaceTransactionType;
import com.bazaar.marketplace.model.MysteryBoxPaymentClaim;
import com.bazaar.marketplace.model.MysteryBoxPurchase;
import com.bazaar.marketplace.model.MysteryBoxTier;
import com.bazaar.marketplace.provider.CurrencyAdapter;
import com.bazaar.marketplace.provider.GeneratedItem;
import com.bazaar.marketplace.provider.ItemAdapter;
import com.bazaar.marketplace.provider.PaymentChallenge;
import com.bazaar.marketplace.provider.PaymentChallengeRequest;
import com.bazaar.marketplace.storage.MarketplaceStorageAdapter;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class MysteryBoxService {

    private static final Logger log = LoggerFactory.getLogger(MysteryBoxService.class);

    private final MysteryBoxTierCatalog tierCatalog;
    private final RaritySampler raritySampler;
    private final PaymentSettlementService paymentSettlementService;
    private final MarketplaceStorageAdapter storageAdapter;
    private final ItemAdapter itemAdapter;
    private final CurrencyAdapter currencyAdapter;
    private final Clock clock;

    public MysteryBoxResult purchase(MysteryBoxRequests.PurchaseMysteryBoxRequest request) {
        if (request == null) {
            throw MarketplaceException.invalidRequest("Mystery box request is required");
        }
        return purchase(request.tierId(), request.buyerWallet(), request.buyerUsername(), request.txRef());
    }

    /**
     * Charges the tier price, draws a rarity and grants a generated item.
     * <p>
     * A payment reference can award at most one box: it is claimed before the item is generated,
     * so concurrent submissions of the same payment cannot both draw. When generation or granting
     * fails after the payment was consumed, the claim is released, nothing is recorded and a
     * failed result is returned.
     */
    public MysteryBoxResult purchase(String tierId, String buyerWallet, String buyerUsername, String txRef) {
        requireText(buyerWallet, "buyerWallet");
        requireText(buyerUsername, "buyerUsername");
        requireText(txRef, "txRef");
        MysteryBoxTier tier = tierCatalog.getTier(tierId)
                .orElseThrow(() -> MarketplaceException.tierNotFound(tierId));

        String canonicalRef = paymentSettlementService.canonicalize(txRef);
        SettlementResult settlement = paymentSettlementService.settle(txRef, tier.priceUsdc(), buyerWallet, canonicalRef);

        if (storageAdapter.findMysteryPurchaseByTxHash(settlement.txRef()).isPresent()) {
            log.warn("Payment {} already awarded a mystery box; rejecting repeat purchase of tier {}", settlement.txRef(), tierId);
            throw MarketplaceException.duplicatePaymentReference(
                    "Payment " + settlement.txRef() + " has already been used for a mystery box"
            );
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        MysteryBoxPaymentClaim claim = new MysteryBoxPaymentClaim();
        claim.setTxHash(settlement.txRef());
        claim.setTierId(tier.id());
        claim.setBuyerWallet(buyerWallet);
        claim.setClaimedAt(now);
        if (storageAdapter.claimMysteryPayment(claim)) {
            log.warn("Payment {} is already claimed by another mystery box draw; rejecting tier {}", settlement.txRef(), tierId);
            throw MarketplaceException.duplicatePaymentReference(
                    "Payment " + settlement.txRef() + " has already been used for a mystery box"
            );
        }

        RarityDraw draw = raritySampler.sample(tier);
        GeneratedItem item;
        try {
            item = itemAdapter.generate(draw.rarity());
            itemAdapter.grantItem(item, buyerWallet);
        } catch (RuntimeException ex) {
            log.error(
                    "Mystery box item generation failed for tier {} rarity {} after payment {} was consumed by {}",
                    tierId,
                    draw.rarity(),
                    settlement.txRef(),
                    buyerWallet,
                    ex
            );
            storageAdapter.releaseMysteryPaymentClaim(settlement.txRef());
            return MysteryBoxResult.failed(settlement.txRef(), "Item generation failed: " + ex.getMessage());
        }

        MysteryBoxPurchase purchase = new MysteryBoxPurchase();
        purchase.setPurchaseId("mbx_" + UUID.randomUUID());
        purchase.setTierId(tier.id());
        purchase.setBuyerWallet(buyerWallet);
        purchase.setBuyerUsername(buyerUsername);
        purchase.setPriceUsdc(tier.priceUsdc());
        purchase.setRarity(draw.rarity());
        purchase.setRoll(draw.roll());
        purchase.setItemId(item.itemId());
        purchase.setItemGenerated(item.payload().data());
        purchase.setTxHash(settlement.txRef());
        purchase.setPurchasedAt(now);

        if (storageAdapter.putMysteryPurchase(purchase)) {
            log.error("Payment {} already has a recorded mystery box; granted item {} was not recorded", settlement.txRef(), item.itemId());
            throw MarketplaceException.duplicatePaymentReference(
                    "Payment " + settlement.txRef() + " has already been used for a mystery box"
            );
        }
        recordAward(purchase);

        log.info(
                "Mystery box {} awarded to {}: tier={} rarity={} roll={}/{} item={}",
                purchase.getPurchaseId(),
                buyerWallet,
                tier.id(),
                draw.rarity(),
                draw.roll(),
                draw.totalWeight(),
                item.itemId()
        );
        return MysteryBoxResult.awarded(item, purchase);
    }

    public MysteryBoxTier getTier(String tierId) {
        return tierCatalog.getTier(tierId).orElseThrow(() -> MarketplaceException.tierNotFound(tierId));
    }

    public List<MysteryBoxTier> getAllTiers() {
        return tierCatalog.getAllTiers();
    }

    public PaymentChallenge createPurchaseChallenge(String tierId) {
        MysteryBoxTier tier = getTier(tierId);
        return currencyAdapter.createChallenge(new PaymentChallengeRequest(
                tier.priceUsdc(),
                "/marketplace/mystery-boxes/" + tier.id() + "/purchase",
                "Mystery box: " + tier.name()
        ));
    }

    public List<MysteryBoxPurchase> getPurchasesByBuyer(String buyerWallet) {
        requireText(buyerWallet, "buyerWallet");
        return storageAdapter.findMysteryPurchasesByBuyer(buyerWallet);
    }

    private void recordAward(MysteryBoxPurchase purchase) {
        MarketplaceTransaction transaction = new MarketplaceTransaction();
        transaction.setTransactionId("txn_" + UUID.randomUUID());
        transaction.setType(MarketplaceTransactionType.MYSTERY_BOX_PURCHASE);
        transaction.setBuyerWallet(purchase.getBuyerWallet());
        transaction.setBuyerUsername(purchase.getBuyerUsername());
        transaction.setTierId(purchase.getTierId());
        transaction.setItemId(purchase.getItemId());
        transaction.setPriceUsdc(purchase.getPriceUsdc());
        transaction.setTxHash(purchase.getTxHash());
        transaction.setCreatedAt(purchase.getPurchasedAt());
        storageAdapter.recordTransaction(transaction);
    }

    private static void requireText(String value, String field) {
        if (!StringUtils.hasText(value)) {
            throw MarketplaceException.invalidRequest(field + " is required");
        }
    }
}
