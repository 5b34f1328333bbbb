package com.bazaar.marketplace.repository;

import com.bazaar.marketplace.model.MarketplaceTransaction;
import com.bazaar.marketplace.model.MarketplaceTransactionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MarketplaceTransactionRepository extends JpaRepository<MarketplaceTransaction, String> {

    @Query("SELECT t FROM MarketplaceTransaction t " +
            "WHERE t.buyerWallet = :wallet OR t.sellerWallet = :wallet " +
            "ORDER BY t.createdAt DESC")
    List<MarketplaceTransaction> findByParticipant(@Param("wallet") String wallet);

    Optional<MarketplaceTransaction> findFirstByListingIdAndType(String listingId, MarketplaceTransactionType type);
}
