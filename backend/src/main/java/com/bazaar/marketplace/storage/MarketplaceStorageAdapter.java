package com.bazaar.marketplace.storage;

import com.bazaar.marketplace.model.Listing;
import com.bazaar.marketplace.model.MarketplaceTransaction;
import com.bazaar.marketplace.model.MysteryBoxPaymentClaim;
import com.bazaar.marketplace.model.MysteryBoxPurchase;
import com.bazaar.marketplace.model.PaymentConsumption;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Durable state of the marketplace. Every method is atomic on its own; callers never hold
 * a transaction or lock across two calls.
 */
public interface MarketplaceStorageAdapter {

    Optional<Listing> getListing(String listingId);

    /**
     * Inserts a new listing.
     *
     * @throws IllegalStateException if a listing with the same id already exists
     */
    void putListing(Listing listing);

    /**
     * A transition to SOLD additionally requires the listing not to be expired at {@code transition.at()}.
     *
     * @return true when the stored status matched {@code transition.expected()} and was replaced
     */
    boolean casTransitionListing(ListingTransition transition);

    List<Listing> findExpiredActiveListings(OffsetDateTime now, int limit);

    ListingPage findActiveListings(ListingQuery query);

    List<Listing> findListingsBySeller(String sellerWallet);

    /**
     * @return true if a consumption for the same payment reference already existed; nothing is written then
     */
    boolean recordPaymentConsumption(PaymentConsumption consumption);

    Optional<PaymentConsumption> findPaymentConsumption(String txRef);

    /**
     * @return true if a purchase with the same {@code txHash} already existed; nothing is written then
     */
    boolean putMysteryPurchase(MysteryBoxPurchase purchase);

    Optional<MysteryBoxPurchase> findMysteryPurchaseByTxHash(String txHash);

    /**
     * @return true if the payment is already claimed by another draw; nothing is written then
     */
    boolean claimMysteryPayment(MysteryBoxPaymentClaim claim);

    void releaseMysteryPaymentClaim(String txHash);

    List<MysteryBoxPurchase> findMysteryPurchasesByBuyer(String buyerWallet);

    /**
     * @return true if a transaction with the same id already existed; nothing is written then
     */
    boolean recordTransaction(MarketplaceTransaction transaction);

    Optional<MarketplaceTransaction> findListingSale(String listingId);

    List<MarketplaceTransaction> findTransactionsByWallet(String wallet);
}
