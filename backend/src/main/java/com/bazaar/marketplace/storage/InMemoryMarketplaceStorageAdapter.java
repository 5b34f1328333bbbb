package com.bazaar.marketplace.storage;

import com.bazaar.marketplace.model.Listing;
import com.bazaar.marketplace.model.ListingStatus;
import com.bazaar.marketplace.model.MarketplaceTransaction;
import com.bazaar.marketplace.model.MarketplaceTransactionType;
import com.bazaar.marketplace.model.MysteryBoxPaymentClaim;
import com.bazaar.marketplace.model.MysteryBoxPurchase;
import com.bazaar.marketplace.model.PaymentConsumption;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local storage for local runs and tests. Records are copied on the way in and out,
 * so callers only ever hold working copies.
 */
@Service
@ConditionalOnProperty(
        prefix = "bazaar",
        name = "storage-mode",
        havingValue = "in_memory"
)
public class InMemoryMarketplaceStorageAdapter implements MarketplaceStorageAdapter {

    private static final Comparator<Listing> NEWEST_FIRST = Comparator
            .comparing(Listing::getCreatedAt, Comparator.reverseOrder())
            .thenComparing(Listing::getListingId);

    private final ConcurrentMap<String, Listing> listings = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, PaymentConsumption> consumptions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, MysteryBoxPurchase> purchasesByTxHash = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, MysteryBoxPaymentClaim> mysteryClaims = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, MarketplaceTransaction> transactions = new ConcurrentHashMap<>();

    @Override
    public Optional<Listing> getListing(String listingId) {
        return Optional.ofNullable(listings.get(listingId)).map(InMemoryMarketplaceStorageAdapter::persisted);
    }

    @Override
    public void putListing(Listing listing) {
        Listing previous = listings.putIfAbsent(listing.getListingId(), persisted(listing));
        if (previous != null) {
            throw new IllegalStateException("Listing already exists: " + listing.getListingId());
        }
    }

    @Override
    public boolean casTransitionListing(ListingTransition transition) {
        AtomicBoolean applied = new AtomicBoolean(false);
        listings.computeIfPresent(transition.listingId(), (id, current) -> {
            if (current.getStatus() != transition.expected()) {
                return current;
            }
            if (transition.target() == ListingStatus.SOLD && current.isExpiredAt(transition.at())) {
                return current;
            }
            Listing next = current.copy();
            next.setStatus(transition.target());
            next.setUpdatedAt(transition.at());
            if (transition.target() == ListingStatus.SOLD) {
                next.setBuyerWallet(transition.buyerWallet());
                next.setBuyerUsername(transition.buyerUsername());
                next.setPaymentTxRef(transition.paymentTxRef());
                next.setSoldAt(transition.at());
            } else {
                next.setClosedAt(transition.at());
            }
            applied.set(true);
            return next;
        });
        return applied.get();
    }

    @Override
    public List<Listing> findExpiredActiveListings(OffsetDateTime now, int limit) {
        return listings.values().stream()
                .filter(listing -> listing.getStatus() == ListingStatus.ACTIVE && listing.isExpiredAt(now))
                .sorted(Comparator.comparing(Listing::getExpiresAt).thenComparing(Listing::getListingId))
                .limit(limit)
                .map(InMemoryMarketplaceStorageAdapter::persisted)
                .toList();
    }

    @Override
    public ListingPage findActiveListings(ListingQuery query) {
        List<Listing> fetched = listings.values().stream()
                .filter(listing -> listing.getStatus() == ListingStatus.ACTIVE)
                .filter(listing -> query.asOf() == null || !listing.isExpiredAt(query.asOf()))
                .sorted(comparatorFor(query.sortBy()))
                .skip(query.offset())
                .limit(query.limit() + 1L)
                .map(InMemoryMarketplaceStorageAdapter::persisted)
                .toList();
        return ListingPage.of(fetched, query);
    }

    @Override
    public List<Listing> findListingsBySeller(String sellerWallet) {
        return listings.values().stream()
                .filter(listing -> listing.getSellerWallet().equals(sellerWallet))
                .sorted(NEWEST_FIRST)
                .map(InMemoryMarketplaceStorageAdapter::persisted)
                .toList();
    }

    @Override
    public boolean recordPaymentConsumption(PaymentConsumption consumption) {
        PaymentConsumption stored = consumption.copy();
        stored.markPersisted();
        return consumptions.putIfAbsent(consumption.getTxRef(), stored) != null;
    }

    @Override
    public Optional<PaymentConsumption> findPaymentConsumption(String txRef) {
        return Optional.ofNullable(consumptions.get(txRef)).map(PaymentConsumption::copy);
    }

    @Override
    public boolean putMysteryPurchase(MysteryBoxPurchase purchase) {
        MysteryBoxPurchase stored = purchase.copy();
        stored.markPersisted();
        return purchasesByTxHash.putIfAbsent(purchase.getTxHash(), stored) != null;
    }

    @Override
    public Optional<MysteryBoxPurchase> findMysteryPurchaseByTxHash(String txHash) {
        return Optional.ofNullable(purchasesByTxHash.get(txHash)).map(MysteryBoxPurchase::copy);
    }

    @Override
    public boolean claimMysteryPayment(MysteryBoxPaymentClaim claim) {
        MysteryBoxPaymentClaim stored = claim.copy();
        stored.markPersisted();
        return mysteryClaims.putIfAbsent(claim.getTxHash(), stored) != null;
    }

    @Override
    public void releaseMysteryPaymentClaim(String txHash) {
        mysteryClaims.remove(txHash);
    }

    @Override
    public List<MysteryBoxPurchase> findMysteryPurchasesByBuyer(String buyerWallet) {
        return purchasesByTxHash.values().stream()
                .filter(purchase -> purchase.getBuyerWallet().equals(buyerWallet))
                .sorted(Comparator.comparing(MysteryBoxPurchase::getPurchasedAt).reversed())
                .map(MysteryBoxPurchase::copy)
                .toList();
    }

    @Override
    public boolean recordTransaction(MarketplaceTransaction transaction) {
        MarketplaceTransaction stored = transaction.copy();
        stored.markPersisted();
        return transactions.putIfAbsent(transaction.getTransactionId(), stored) != null;
    }

    @Override
    public Optional<MarketplaceTransaction> findListingSale(String listingId) {
        return transactions.values().stream()
                .filter(transaction -> transaction.getType() == MarketplaceTransactionType.LISTING_PURCHASE
                        && listingId.equals(transaction.getListingId()))
                .findFirst()
                .map(MarketplaceTransaction::copy);
    }

    @Override
    public List<MarketplaceTransaction> findTransactionsByWallet(String wallet) {
        return transactions.values().stream()
                .filter(transaction -> wallet.equals(transaction.getBuyerWallet())
                        || wallet.equals(transaction.getSellerWallet()))
                .sorted(Comparator.comparing(MarketplaceTransaction::getCreatedAt).reversed())
                .map(MarketplaceTransaction::copy)
                .toList();
    }

    private static Listing persisted(Listing listing) {
        Listing copy = listing.copy();
        copy.markPersisted();
        return copy;
    }

    private static Comparator<Listing> comparatorFor(ListingSort sort) {
        Objects.requireNonNull(sort, "sort is required");
        return switch (sort) {
            case NEWEST -> NEWEST_FIRST;
            case PRICE_LOW -> Comparator.comparing(Listing::getPriceUsdc).thenComparing(NEWEST_FIRST);
            case PRICE_HIGH -> Comparator.comparing(Listing::getPriceUsdc, Comparator.reverseOrder())
                    .thenComparing(NEWEST_FIRST);
        };
    }
}
