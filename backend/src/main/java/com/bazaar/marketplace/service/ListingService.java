package com.bazaar.marketplace.service;

import com.bazaar.marketplace.config.MarketplaceRuntimeProperties;
import com.bazaar.marketplace.dto.ListingRequests;
import com.bazaar.marketplace.error.MarketplaceException;
import com.bazaar.marketplace.model.Listing;
import com.bazaar.marketplace.model.ListingStatus;
import com.bazaar.marketplace.model.MarketplaceTransaction;
import com.bazaar.marketplace.model.MarketplaceTransactionType;
import com.bazaar.marketplace.model.PaymentConsumption;
import com.bazaar.marketplace.provider.CurrencyAdapter;
import com.bazaar.marketplace.provider.ItemAdapter;
import com.bazaar.marketplace.provider.ItemTransferResult;
import com.bazaar.marketplace.provider.PaymentChallenge;
import com.bazaar.marketplace.provider.PaymentChallengeRequest;
import com.bazaar.marketplace.provider.UsdcAmounts;
import com.bazaar.marketplace.storage.ListingPage;
import com.bazaar.marketplace.storage.ListingQuery;
import com.bazaar.marketplace.storage.ListingSort;
import com.bazaar.marketplace.storage.ListingTransition;
import com.bazaar.marketplace.storage.MarketplaceStorageAdapter;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Listing state machine: ACTIVE to SOLD, CANCELLED or EXPIRED, nothing after that.
 * Every status change goes through the storage adapter's conditional transition, so a
 * listing is sold to at most one buyer even when buys and the expiry sweep race.
 */
@Service
@RequiredArgsConstructor
public class ListingService {

    private static final Logger log = LoggerFactory.getLogger(ListingService.class);
    private static final BigDecimal MAX_PRICE_USDC = new BigDecimal("999999999999.999999");

    private final MarketplaceStorageAdapter storageAdapter;
    private final PaymentSettlementService paymentSettlementService;
    private final ItemAdapter itemAdapter;
    private final CurrencyAdapter currencyAdapter;
    private final MarketplaceRuntimeProperties marketplaceRuntimeProperties;
    private final Clock clock;

    public Listing createListing(ListingRequests.CreateListingRequest request) {
        if (request == null) {
            throw MarketplaceException.invalidRequest("Listing request is required");
        }
        requireText(request.itemId(), "itemId");
        requireText(request.itemType(), "itemType");
        requireText(request.sellerWallet(), "sellerWallet");
        requireText(request.sellerUsername(), "sellerUsername");

        BigDecimal price = normalizePrice(request.priceUsdc());
        if (request.itemData() == null || !itemAdapter.validate(request.itemType(), request.itemData())) {
            throw MarketplaceException.invalidItemData("Item data is not a valid " + request.itemType());
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = resolveExpiry(request.expiresInSeconds(), now);

        if (!itemAdapter.validateOwnership(request.itemId(), request.sellerWallet())) {
            throw MarketplaceException.itemNotOwned(
                    "Item " + request.itemId() + " is not owned by " + request.sellerWallet()
            );
        }
        try {
            itemAdapter.lockItem(request.itemId(), request.sellerWallet());
        } catch (RuntimeException ex) {
            throw MarketplaceException.itemLockFailed("Item " + request.itemId() + " could not be locked: " + ex.getMessage(), ex);
        }

        Listing listing = new Listing();
        listing.setListingId("lst_" + UUID.randomUUID());
        listing.setItemId(request.itemId());
        listing.setItemType(request.itemType());
        listing.setItemData(request.itemData().deepCopy());
        listing.setSellerWallet(request.sellerWallet());
        listing.setSellerUsername(request.sellerUsername());
        listing.setPriceUsdc(price);
        listing.setStatus(ListingStatus.ACTIVE);
        listing.setCreatedAt(now);
        listing.setExpiresAt(expiresAt);
        listing.setUpdatedAt(now);

        try {
            storageAdapter.putListing(listing);
        } catch (RuntimeException ex) {
            unlockQuietly(listing, "listing creation failed");
            throw ex;
        }

        log.info(
                "Listing {} created: item={} seller={} price={} USDC expiresAt={}",
                listing.getListingId(),
                listing.getItemId(),
                listing.getSellerWallet(),
                price,
                expiresAt
        );
        return listing;
    }

    public Listing buyListing(ListingRequests.BuyListingRequest request) {
        if (request == null) {
            throw MarketplaceException.invalidRequest("Buy request is required");
        }
        return buyListing(request.listingId(), request.buyerWallet(), request.buyerUsername(), request.txRef());
    }

    public Listing buyListing(String listingId, String buyerWallet, String buyerUsername, String txRef) {
        requireText(listingId, "listingId");
        requireText(buyerWallet, "buyerWallet");
        requireText(buyerUsername, "buyerUsername");
        requireText(txRef, "txRef");

        Listing listing = storageAdapter.getListing(listingId)
                .orElseThrow(() -> MarketplaceException.listingNotFound(listingId));

        if (listing.getStatus() != ListingStatus.ACTIVE) {
            Listing replayed = replayedPurchase(listing, buyerWallet, txRef)
                    .orElseThrow(() -> MarketplaceException.listingNotActive(
                            "Listing " + listingId + " is " + listing.getStatus()
                    ));
            return fulfil(replayed);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (listing.isExpiredAt(now)) {
            expire(listing, now);
            throw MarketplaceException.listingExpired(listingId);
        }
        if (listing.getSellerWallet().equals(buyerWallet)) {
            throw MarketplaceException.invalidRequest("Seller cannot buy their own listing");
        }

        SettlementResult settlement = paymentSettlementService.settle(
                txRef,
                listing.getPriceUsdc(),
                buyerWallet,
                listingId
        );

        OffsetDateTime soldAt = OffsetDateTime.now(clock);
        boolean won = storageAdapter.casTransitionListing(
                ListingTransition.sold(listingId, buyerWallet, buyerUsername, settlement.txRef(), soldAt)
        );
        if (!won) {
            Listing current = storageAdapter.getListing(listingId).orElse(listing);
            if (isSoldWith(current, buyerWallet, settlement.txRef())) {
                // the same purchase won on a concurrent retry
                return fulfil(current);
            }
            if (current.getStatus() == ListingStatus.ACTIVE && current.isExpiredAt(soldAt)) {
                log.warn(
                        "Listing {} expired while payment {} from {} was settling",
                        listingId,
                        settlement.txRef(),
                        buyerWallet
                );
                expire(current, soldAt);
                throw MarketplaceException.listingExpiredAfterSettlement(listingId, settlement.txRef());
            }
            log.warn(
                    "Listing {} race lost by buyer {} after payment {} settled; listing is now {}",
                    listingId,
                    buyerWallet,
                    settlement.txRef(),
                    current.getStatus()
            );
            throw MarketplaceException.listingRaceLost(
                    "Listing " + listingId + " was no longer active after payment " + settlement.txRef() + " settled"
            );
        }

        Listing sold = storageAdapter.getListing(listingId)
                .orElseThrow(() -> new IllegalStateException("Sold listing disappeared: " + listingId));
        return fulfil(sold);
    }

    public Listing cancelListing(String listingId, String requesterWallet) {
        requireText(listingId, "listingId");
        requireText(requesterWallet, "requesterWallet");

        Listing listing = storageAdapter.getListing(listingId)
                .orElseThrow(() -> MarketplaceException.listingNotFound(listingId));
        if (!listing.getSellerWallet().equals(requesterWallet)) {
            throw MarketplaceException.unauthorized("Only the seller can cancel listing " + listingId);
        }
        if (listing.getStatus() != ListingStatus.ACTIVE) {
            throw MarketplaceException.listingNotActive("Listing " + listingId + " is " + listing.getStatus());
        }

        boolean cancelled = storageAdapter.casTransitionListing(
                ListingTransition.closed(listingId, ListingStatus.CANCELLED, OffsetDateTime.now(clock))
        );
        if (!cancelled) {
            ListingStatus current = storageAdapter.getListing(listingId)
                    .map(Listing::getStatus)
                    .orElse(listing.getStatus());
            throw MarketplaceException.listingNotActive("Listing " + listingId + " is " + current);
        }

        unlockQuietly(listing, "listing cancelled");
        log.info("Listing {} cancelled by seller {}", listingId, requesterWallet);
        return storageAdapter.getListing(listingId)
                .orElseThrow(() -> new IllegalStateException("Cancelled listing disappeared: " + listingId));
    }

    public SweepSummary sweepExpired() {
        int batchSize = Math.max(1, marketplaceRuntimeProperties.getSweep().getBatchSize());
        int scanned = 0;
        int expired = 0;
        while (true) {
            OffsetDateTime now = OffsetDateTime.now(clock);
            List<Listing> batch = storageAdapter.findExpiredActiveListings(now, batchSize);
            int expiredInBatch = 0;
            for (Listing listing : batch) {
                if (expire(listing, now)) {
                    expiredInBatch++;
                }
            }
            scanned += batch.size();
            expired += expiredInBatch;
            // stop on a short batch, or when nothing in a full batch could be transitioned
            if (batch.size() < batchSize || expiredInBatch == 0) {
                break;
            }
        }
        return new SweepSummary(scanned, expired);
    }

    public Listing getListing(String listingId) {
        requireText(listingId, "listingId");
        return storageAdapter.getListing(listingId)
                .orElseThrow(() -> MarketplaceException.listingNotFound(listingId));
    }

    public ListingPage getActiveListings(String cursor, Integer limit, String sortBy) {
        MarketplaceRuntimeProperties.Listing settings = marketplaceRuntimeProperties.getListing();
        int requested = limit == null ? settings.getDefaultPageSize() : limit;
        int clamped = Math.max(1, Math.min(requested, settings.getMaxPageSize()));
        ListingSort sort;
        try {
            sort = ListingSort.fromValue(sortBy);
        } catch (IllegalArgumentException ex) {
            throw MarketplaceException.invalidRequest(ex.getMessage());
        }
        ListingQuery query = new ListingQuery(cursor, clamped, sort, OffsetDateTime.now(clock));
        try {
            query.offset();
        } catch (IllegalArgumentException ex) {
            throw MarketplaceException.invalidRequest(ex.getMessage());
        }
        return storageAdapter.findActiveListings(query);
    }

    public List<Listing> getListingsBySeller(String sellerWallet) {
        requireText(sellerWallet, "sellerWallet");
        return storageAdapter.findListingsBySeller(sellerWallet);
    }

    public PaymentChallenge createPurchaseChallenge(String listingId) {
        Listing listing = getListing(listingId);
        if (listing.getStatus() != ListingStatus.ACTIVE) {
            throw MarketplaceException.listingNotActive("Listing " + listingId + " is " + listing.getStatus());
        }
        if (listing.isExpiredAt(OffsetDateTime.now(clock))) {
            throw MarketplaceException.listingExpired(listingId);
        }
        return currencyAdapter.createChallenge(new PaymentChallengeRequest(
                listing.getPriceUsdc(),
                "/marketplace/listings/" + listingId + "/buy",
                "Purchase of " + listing.getItemType() + " " + listing.getItemId()
        ));
    }

    private Optional<Listing> replayedPurchase(Listing listing, String buyerWallet, String txRef) {
        if (listing.getStatus() != ListingStatus.SOLD || !buyerWallet.equals(listing.getBuyerWallet())) {
            return Optional.empty();
        }
        Optional<PaymentConsumption> consumption = paymentSettlementService.findConsumption(txRef);
        if (consumption.isPresent()
                && consumption.get().getIdempotencyKey().equals(listing.getListingId())
                && consumption.get().getTxRef().equals(listing.getPaymentTxRef())) {
            log.debug("Replayed purchase of listing {} by {}", listing.getListingId(), buyerWallet);
            return Optional.of(listing);
        }
        return Optional.empty();
    }

    private boolean isSoldWith(Listing listing, String buyerWallet, String canonicalTxRef) {
        return listing.getStatus() == ListingStatus.SOLD
                && buyerWallet.equals(listing.getBuyerWallet())
                && canonicalTxRef.equals(listing.getPaymentTxRef());
    }

    private boolean expire(Listing listing, OffsetDateTime now) {
        boolean expired = storageAdapter.casTransitionListing(
                ListingTransition.closed(listing.getListingId(), ListingStatus.EXPIRED, now)
        );
        if (expired) {
            unlockQuietly(listing, "listing expired");
            log.info("Listing {} expired (expiresAt={})", listing.getListingId(), listing.getExpiresAt());
        }
        return expired;
    }

    /**
     * Delivers the item of a sold listing and records the sale, unless that already happened.
     * Safe to repeat: a sale is recorded once per listing and the transfer is skipped when the
     * buyer already owns the item.
     */
    private Listing fulfil(Listing sold) {
        if (storageAdapter.findListingSale(sold.getListingId()).isPresent()) {
            return sold;
        }
        if (!itemAdapter.validateOwnership(sold.getItemId(), sold.getBuyerWallet())) {
            transferItem(sold, sold.getBuyerWallet(), sold.getPaymentTxRef());
        }
        if (recordSale(sold)) {
            log.debug("Sale of listing {} was recorded by a concurrent request", sold.getListingId());
            return sold;
        }
        log.info(
                "Listing {} sold to {} for {} USDC (payment {})",
                sold.getListingId(),
                sold.getBuyerWallet(),
                sold.getPriceUsdc(),
                sold.getPaymentTxRef()
        );
        return sold;
    }

    private void transferItem(Listing listing, String buyerWallet, String canonicalTxRef) {
        ItemTransferResult transfer;
        try {
            transfer = itemAdapter.transferOwnership(listing.getItemId(), listing.getSellerWallet(), buyerWallet);
        } catch (RuntimeException ex) {
            log.error(
                    "Item transfer for sold listing {} threw after payment {} settled",
                    listing.getListingId(),
                    canonicalTxRef,
                    ex
            );
            throw MarketplaceException.itemTransferFailed(
                    "Item " + listing.getItemId() + " could not be transferred: " + ex.getMessage()
            );
        }
        if (transfer == null || !transfer.success()) {
            if (itemAdapter.validateOwnership(listing.getItemId(), buyerWallet)) {
                // delivered by a concurrent fulfilment of the same sale
                return;
            }
            String reason = transfer == null ? "no result" : transfer.message();
            log.error(
                    "Item transfer for sold listing {} failed after payment {} settled: {}",
                    listing.getListingId(),
                    canonicalTxRef,
                    reason
            );
            throw MarketplaceException.itemTransferFailed(
                    "Item " + listing.getItemId() + " could not be transferred: " + reason
            );
        }
    }

    /**
     * @return true if the sale was already recorded
     */
    private boolean recordSale(Listing sold) {
        MarketplaceTransaction transaction = new MarketplaceTransaction();
        // one sale record per listing
        transaction.setTransactionId("txn_" + sold.getListingId());
        transaction.setType(MarketplaceTransactionType.LISTING_PURCHASE);
        transaction.setBuyerWallet(sold.getBuyerWallet());
        transaction.setBuyerUsername(sold.getBuyerUsername());
        transaction.setSellerWallet(sold.getSellerWallet());
        transaction.setSellerUsername(sold.getSellerUsername());
        transaction.setListingId(sold.getListingId());
        transaction.setItemId(sold.getItemId());
        transaction.setPriceUsdc(sold.getPriceUsdc());
        transaction.setTxHash(sold.getPaymentTxRef());
        transaction.setCreatedAt(sold.getSoldAt());
        return storageAdapter.recordTransaction(transaction);
    }

    private void unlockQuietly(Listing listing, String reason) {
        try {
            itemAdapter.unlockItem(listing.getItemId(), listing.getSellerWallet());
        } catch (RuntimeException ex) {
            log.warn("Failed to unlock item {} ({}): {}", listing.getItemId(), reason, ex.getMessage());
        }
    }

    private BigDecimal normalizePrice(BigDecimal priceUsdc) {
        if (priceUsdc == null || priceUsdc.signum() <= 0) {
            throw MarketplaceException.invalidPrice("priceUsdc must be greater than zero");
        }
        BigDecimal scaled = UsdcAmounts.scale(priceUsdc);
        if (scaled.signum() <= 0) {
            throw MarketplaceException.invalidPrice("priceUsdc rounds to zero at USDC precision");
        }
        if (scaled.compareTo(MAX_PRICE_USDC) > 0) {
            throw MarketplaceException.invalidPrice("priceUsdc exceeds " + MAX_PRICE_USDC);
        }
        return scaled;
    }

    private OffsetDateTime resolveExpiry(Long expiresInSeconds, OffsetDateTime now) {
        if (expiresInSeconds == null) {
            return null;
        }
        long max = marketplaceRuntimeProperties.getListing().getMaxExpiresInSeconds();
        if (expiresInSeconds <= 0 || expiresInSeconds > max) {
            throw MarketplaceException.invalidExpiry("expiresInSeconds must be between 1 and " + max);
        }
        return now.plusSeconds(expiresInSeconds);
    }

    private static void requireText(String value, String field) {
        if (!StringUtils.hasText(value)) {
            throw MarketplaceException.invalidRequest(field + " is required");
        }
    }

    public record SweepSummary(int scanned, int expired) {
        public boolean hasWork() {
            return expired > 0;
        }
    }
}
