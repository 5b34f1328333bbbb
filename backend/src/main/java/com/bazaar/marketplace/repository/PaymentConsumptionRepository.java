package com.bazaar.marketplace.repository;

import com.bazaar.marketplace.model.PaymentConsumption;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PaymentConsumptionRepository extends JpaRepository<PaymentConsumption, String> {
}
