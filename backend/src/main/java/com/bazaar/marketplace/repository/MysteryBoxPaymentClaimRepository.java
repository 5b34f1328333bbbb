package com.bazaar.marketplace.repository;

import com.bazaar.marketplace.model.MysteryBoxPaymentClaim;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MysteryBoxPaymentClaimRepository extends JpaRepository<MysteryBoxPaymentClaim, String> {
}
