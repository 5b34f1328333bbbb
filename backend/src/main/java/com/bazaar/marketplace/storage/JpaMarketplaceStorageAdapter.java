package com.bazaar.marketplace.storage;

import com.bazaar.marketplace.model.Listing;
import com.bazaar.marketplace.model.ListingStatus;
import com.bazaar.marketplace.model.MarketplaceTransaction;
import com.bazaar.marketplace.model.MarketplaceTransactionType;
import com.bazaar.marketplace.model.MysteryBoxPaymentClaim;
import com.bazaar.marketplace.model.MysteryBoxPurchase;
import com.bazaar.marketplace.model.PaymentConsumption;
import com.bazaar.marketplace.repository.ListingRepository;
import com.bazaar.marketplace.repository.MarketplaceTransactionRepository;
import com.bazaar.marketplace.repository.MysteryBoxPaymentClaimRepository;
import com.bazaar.marketplace.repository.MysteryBoxPurchaseRepository;
import com.bazaar.marketplace.repository.PaymentConsumptionRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Relational storage. Each method runs in its own short transaction; inserts are not wrapped
 * in an outer transaction so a key violation can be reported as "already exists".
 */
@Service
@ConditionalOnProperty(
        prefix = "bazaar",
        name = "storage-mode",
        havingValue = "jpa",
        matchIfMissing = true
)
public class JpaMarketplaceStorageAdapter implements MarketplaceStorageAdapter {

    private final ListingRepository listingRepository;
    private final PaymentConsumptionRepository paymentConsumptionRepository;
    private final MysteryBoxPurchaseRepository mysteryBoxPurchaseRepository;
    private final MysteryBoxPaymentClaimRepository mysteryBoxPaymentClaimRepository;
    private final MarketplaceTransactionRepository marketplaceTransactionRepository;
    private final EntityManager entityManager;

    public JpaMarketplaceStorageAdapter(
            ListingRepository listingRepository,
            PaymentConsumptionRepository paymentConsumptionRepository,
            MysteryBoxPurchaseRepository mysteryBoxPurchaseRepository,
            MysteryBoxPaymentClaimRepository mysteryBoxPaymentClaimRepository,
            MarketplaceTransactionRepository marketplaceTransactionRepository,
            EntityManager entityManager
    ) {
        this.listingRepository = listingRepository;
        this.paymentConsumptionRepository = paymentConsumptionRepository;
        this.mysteryBoxPurchaseRepository = mysteryBoxPurchaseRepository;
        this.mysteryBoxPaymentClaimRepository = mysteryBoxPaymentClaimRepository;
        this.marketplaceTransactionRepository = marketplaceTransactionRepository;
        this.entityManager = entityManager;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Listing> getListing(String listingId) {
        return listingRepository.findById(listingId);
    }

    @Override
    public void putListing(Listing listing) {
        try {
            listingRepository.saveAndFlush(listing);
        } catch (DataIntegrityViolationException ex) {
            if (!listingRepository.existsById(listing.getListingId())) {
                throw ex;
            }
            throw new IllegalStateException("Listing already exists: " + listing.getListingId(), ex);
        }
    }

    @Override
    @Transactional
    public boolean casTransitionListing(ListingTransition transition) {
        int updated;
        if (transition.target() == ListingStatus.SOLD) {
            updated = listingRepository.markSoldIfStatus(
                    transition.listingId(),
                    transition.expected(),
                    transition.target(),
                    transition.buyerWallet(),
                    transition.buyerUsername(),
                    transition.paymentTxRef(),
                    transition.at()
            );
        } else {
            updated = listingRepository.closeIfStatus(
                    transition.listingId(),
                    transition.expected(),
                    transition.target(),
                    transition.at()
            );
        }
        return updated == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Listing> findExpiredActiveListings(OffsetDateTime now, int limit) {
        return listingRepository.findByStatusAndExpiresAtLessThanEqualOrderByExpiresAtAsc(
                ListingStatus.ACTIVE,
                now,
                PageRequest.of(0, limit)
        );
    }

    @Override
    @Transactional(readOnly = true)
    public ListingPage findActiveListings(ListingQuery query) {
        StringBuilder jpql = new StringBuilder("SELECT l FROM Listing l WHERE l.status = :status");
        if (query.asOf() != null) {
            jpql.append(" AND (l.expiresAt IS NULL OR l.expiresAt > :asOf)");
        }
        jpql.append(switch (query.sortBy()) {
            case NEWEST -> " ORDER BY l.createdAt DESC, l.listingId ASC";
            case PRICE_LOW -> " ORDER BY l.priceUsdc ASC, l.createdAt DESC, l.listingId ASC";
            case PRICE_HIGH -> " ORDER BY l.priceUsdc DESC, l.createdAt DESC, l.listingId ASC";
        });

        TypedQuery<Listing> typedQuery = entityManager.createQuery(jpql.toString(), Listing.class)
                .setParameter("status", ListingStatus.ACTIVE)
                .setFirstResult(query.offset())
                .setMaxResults(query.limit() + 1);
        if (query.asOf() != null) {
            typedQuery.setParameter("asOf", query.asOf());
        }
        return ListingPage.of(typedQuery.getResultList(), query);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Listing> findListingsBySeller(String sellerWallet) {
        return listingRepository.findBySellerWalletOrderByCreatedAtDesc(sellerWallet);
    }

    @Override
    public boolean recordPaymentConsumption(PaymentConsumption consumption) {
        try {
            paymentConsumptionRepository.saveAndFlush(consumption);
            return false;
        } catch (DataIntegrityViolationException ex) {
            if (paymentConsumptionRepository.existsById(consumption.getTxRef())) {
                return true;
            }
            throw ex;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PaymentConsumption> findPaymentConsumption(String txRef) {
        return paymentConsumptionRepository.findById(txRef);
    }

    @Override
    public boolean putMysteryPurchase(MysteryBoxPurchase purchase) {
        try {
            mysteryBoxPurchaseRepository.saveAndFlush(purchase);
            return false;
        } catch (DataIntegrityViolationException ex) {
            if (mysteryBoxPurchaseRepository.findByTxHash(purchase.getTxHash()).isPresent()) {
                return true;
            }
            throw ex;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MysteryBoxPurchase> findMysteryPurchaseByTxHash(String txHash) {
        return mysteryBoxPurchaseRepository.findByTxHash(txHash);
    }

    @Override
    public boolean claimMysteryPayment(MysteryBoxPaymentClaim claim) {
        try {
            mysteryBoxPaymentClaimRepository.saveAndFlush(claim);
            return false;
        } catch (DataIntegrityViolationException ex) {
            if (mysteryBoxPaymentClaimRepository.existsById(claim.getTxHash())) {
                return true;
            }
            throw ex;
        }
    }

    @Override
    @Transactional
    public void releaseMysteryPaymentClaim(String txHash) {
        mysteryBoxPaymentClaimRepository.deleteById(txHash);
    }

    @Override
    @Transactional(readOnly = true)
    public List<MysteryBoxPurchase> findMysteryPurchasesByBuyer(String buyerWallet) {
        return mysteryBoxPurchaseRepository.findByBuyerWalletOrderByPurchasedAtDesc(buyerWallet);
    }

    @Override
    public boolean recordTransaction(MarketplaceTransaction transaction) {
        try {
            marketplaceTransactionRepository.saveAndFlush(transaction);
            return false;
        } catch (DataIntegrityViolationException ex) {
            if (marketplaceTransactionRepository.existsById(transaction.getTransactionId())) {
                return true;
            }
            throw ex;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MarketplaceTransaction> findListingSale(String listingId) {
        return marketplaceTransactionRepository.findFirstByListingIdAndType(
                listingId,
                MarketplaceTransactionType.LISTING_PURCHASE
        );
    }

    @Override
    @Transactional(readOnly = true)
    public List<MarketplaceTransaction> findTransactionsByWallet(String wallet) {
        return marketplaceTransactionRepository.findByParticipant(wallet);
    }
}
