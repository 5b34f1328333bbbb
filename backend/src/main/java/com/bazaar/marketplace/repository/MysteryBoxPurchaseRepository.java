package com.bazaar.marketplace.repository;

import com.bazaar.marketplace.model.MysteryBoxPurchase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MysteryBoxPurchaseRepository extends JpaRepository<MysteryBoxPurchase, String> {
    Optional<MysteryBoxPurchase> findByTxHash(String txHash);

    List<MysteryBoxPurchase> findByBuyerWalletOrderByPurchasedAtDesc(String buyerWallet);
}
