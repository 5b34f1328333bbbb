package com.bazaar.marketplace.service;

import com.bazaar.marketplace.error.MarketplaceException;
import com.bazaar.marketplace.model.MarketplaceTransaction;
import com.bazaar.marketplace.storage.MarketplaceStorageAdapter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Read side of the sale and mystery box audit trail.
 */
@Service
@RequiredArgsConstructor
public class MarketplaceHistoryService {

    private final MarketplaceStorageAdapter storageAdapter;

    public List<MarketplaceTransaction> getTransactionsByWallet(String wallet) {
        if (!StringUtils.hasText(wallet)) {
            throw MarketplaceException.invalidRequest("wallet is required");
        }
        return storageAdapter.findTransactionsByWallet(wallet);
    }
}
