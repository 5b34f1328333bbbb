package com.bazaar.marketplace.repository;

import com.bazaar.marketplace.model.Listing;
import com.bazaar.marketplace.model.ListingStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface ListingRepository extends JpaRepository<Listing, String> {

    List<Listing> findBySellerWalletOrderByCreatedAtDesc(String sellerWallet);

    List<Listing> findByStatusAndExpiresAtLessThanEqualOrderByExpiresAtAsc(
            ListingStatus status,
            OffsetDateTime now,
            Pageable pageable
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Listing l " +
            "SET l.status = :target, l.buyerWallet = :buyerWallet, l.buyerUsername = :buyerUsername, " +
            "l.paymentTxRef = :paymentTxRef, l.soldAt = :at, l.updatedAt = :at " +
            "WHERE l.listingId = :listingId " +
            "AND l.status = :expected " +
            "AND (l.expiresAt IS NULL OR l.expiresAt > :at)")
    int markSoldIfStatus(@Param("listingId") String listingId,
                         @Param("expected") ListingStatus expected,
                         @Param("target") ListingStatus target,
                         @Param("buyerWallet") String buyerWallet,
                         @Param("buyerUsername") String buyerUsername,
                         @Param("paymentTxRef") String paymentTxRef,
                         @Param("at") OffsetDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Listing l " +
            "SET l.status = :target, l.closedAt = :at, l.updatedAt = :at " +
            "WHERE l.listingId = :listingId " +
            "AND l.status = :expected")
    int closeIfStatus(@Param("listingId") String listingId,
                      @Param("expected") ListingStatus expected,
                      @Param("target") ListingStatus target,
                      @Param("at") OffsetDateTime at);
}
