package com.bazaar.marketplace.service;

import com.bazaar.marketplace.MutableClock;
import com.bazaar.marketplace.config.MarketplaceRuntimeProperties;
import com.bazaar.marketplace.dto.ListingRequests;
import com.bazaar.marketplace.error.MarketplaceErrorCode;
import com.bazaar.marketplace.error.MarketplaceException;
import com.bazaar.marketplace.model.Listing;
import com.bazaar.marketplace.model.ListingStatus;
import com.bazaar.marketplace.model.MarketplaceTransaction;
import com.bazaar.marketplace.model.MarketplaceTransactionType;
import com.bazaar.marketplace.model.PaymentConsumption;
import com.bazaar.marketplace.provider.GemItemAdapter;
import com.bazaar.marketplace.provider.ItemAdapter;
import com.bazaar.marketplace.provider.ItemTransferResult;
import com.bazaar.marketplace.provider.MockCurrencyAdapter;
import com.bazaar.marketplace.provider.PaymentChallenge;
import com.bazaar.marketplace.provider.PaymentVerification;
import com.bazaar.marketplace.storage.InMemoryMarketplaceStorageAdapter;
import com.bazaar.marketplace.storage.ListingPage;
import com.bazaar.marketplace.storage.ListingTransition;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ListingServiceTest {

    private static final String SELLER = "seller-wallet";
    private static final String BUYER = "buyer-wallet";

    private MutableClock clock;
    private MarketplaceRuntimeProperties properties;
    private InMemoryMarketplaceStorageAdapter storage;
    private MockCurrencyAdapter currency;
    private GemItemAdapter gems;
    private ThreadPoolTaskExecutor executor;
    private PaymentSettlementService settlementService;
    private ListingService listingService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        properties = new MarketplaceRuntimeProperties();
        properties.getSettlement().setVerifyTimeoutMs(2_000);
        storage = new InMemoryMarketplaceStorageAdapter();
        currency = new MockCurrencyAdapter(properties);
        gems = new GemItemAdapter();

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(8);
        executor.initialize();

        settlementService = new PaymentSettlementService(currency, storage, executor, properties, clock);
        listingService = newListingService(storage, gems);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void createListingStartsActiveAndLocksItem() {
        gems.registerItem("gem-1", SELLER, gem("ruby"));

        Listing listing = listingService.createListing(request("gem-1", "5", 3600L));

        assertEquals(ListingStatus.ACTIVE, listing.getStatus());
        assertEquals(new BigDecimal("5.000000"), listing.getPriceUsdc());
        assertEquals(OffsetDateTime.parse("2026-03-01T13:00:00Z"), listing.getExpiresAt());
        assertTrue(gems.isLocked("gem-1"));
        assertEquals(ListingStatus.ACTIVE, listingService.getListing(listing.getListingId()).getStatus());
    }

    @Test
    void createListingValidatesInput() {
        gems.registerItem("gem-1", SELLER, gem("ruby"));

        assertCode(MarketplaceErrorCode.INVALID_PRICE, () -> listingService.createListing(request("gem-1", "0", null)));
        assertCode(MarketplaceErrorCode.INVALID_PRICE, () -> listingService.createListing(request("gem-1", "0.0000001", null)));
        assertCode(MarketplaceErrorCode.INVALID_EXPIRY, () -> listingService.createListing(request("gem-1", "5", 0L)));
        assertCode(MarketplaceErrorCode.INVALID_EXPIRY,
                () -> listingService.createListing(request("gem-1", "5", properties.getListing().getMaxExpiresInSeconds() + 1)));
        assertCode(MarketplaceErrorCode.ITEM_NOT_OWNED, () -> listingService.createListing(request("gem-404", "5", null)));

        ObjectNode badData = gem("ruby");
        badData.put("rarity", "mythic");
        assertCode(MarketplaceErrorCode.INVALID_ITEM_DATA, () -> listingService.createListing(
                new ListingRequests.CreateListingRequest("gem-1", "gem", badData, SELLER, "seller", new BigDecimal("5"), null)
        ));
        assertFalse(gems.isLocked("gem-1"));
    }

    @Test
    void itemCannotBeListedTwice() {
        gems.registerItem("gem-1", SELLER, gem("ruby"));
        listingService.createListing(request("gem-1", "5", null));

        assertCode(MarketplaceErrorCode.ITEM_LOCK_FAILED, () -> listingService.createListing(request("gem-1", "6", null)));
    }

    @Test
    void buyListingSettlesTransfersAndRecordsSale() {
        gems.registerItem("gem-1", SELLER, gem("ruby"));
        Listing listing = listingService.createListing(request("gem-1", "5.0", null));

        Listing sold = listingService.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-buy-1");

        assertEquals(ListingStatus.SOLD, sold.getStatus());
        assertEquals(BUYER, sold.getBuyerWallet());
        assertEquals("mock-tx-buy-1", sold.getPaymentTxRef());
        assertNotNull(sold.getSoldAt());
        assertEquals(BUYER, gems.findOwner("gem-1").orElseThrow());
        assertFalse(gems.isLocked("gem-1"));
        assertEquals(new BigDecimal("95.000000"), currency.getBalance(BUYER));

        PaymentConsumption consumption = storage.findPaymentConsumption("mock-tx-buy-1").orElseThrow();
        assertEquals(listing.getListingId(), consumption.getIdempotencyKey());

        List<MarketplaceTransaction> history = storage.findTransactionsByWallet(SELLER);
        assertEquals(1, history.size());
        assertEquals(MarketplaceTransactionType.LISTING_PURCHASE, history.get(0).getType());
        assertEquals(BUYER, history.get(0).getBuyerWallet());
    }

    @Test
    void secondBuyWithDifferentPaymentFailsNotActive() {
        gems.registerItem("gem-1", SELLER, gem("ruby"));
        Listing listing = listingService.createListing(request("gem-1", "5", null));
        listingService.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-buy-1");

        assertCode(MarketplaceErrorCode.LISTING_NOT_ACTIVE,
                () -> listingService.buyListing(listing.getListingId(), "other-buyer", "other", "mock-tx-buy-2"));
        assertCode(MarketplaceErrorCode.LISTING_NOT_ACTIVE,
                () -> listingService.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-buy-3"));
    }

    @Test
    void replayedBuyReturnsSoldListingWithoutSecondCharge() {
        gems.registerItem("gem-1", SELLER, gem("ruby"));
        Listing listing = listingService.createListing(request("gem-1", "5", null));
        listingService.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-buy-1");

        Listing replayed = listingService.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-buy-1");

        assertEquals(ListingStatus.SOLD, replayed.getStatus());
        assertEquals(new BigDecimal("95.000000"), currency.getBalance(BUYER));
        assertEquals(1, storage.findTransactionsByWallet(BUYER).size());
    }

    @Test
    void insufficientPaymentLeavesListingActive() {
        gems.registerItem("gem-1", SELLER, gem("ruby"));
        Listing listing = listingService.createListing(request("gem-1", "150", null));

        assertCode(MarketplaceErrorCode.INSUFFICIENT_PAYMENT,
                () -> listingService.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-poor"));

        assertEquals(ListingStatus.ACTIVE, listingService.getListing(listing.getListingId()).getStatus());
        assertTrue(storage.findPaymentConsumption("mock-tx-poor").isEmpty());
        assertEquals(SELLER, gems.findOwner("gem-1").orElseThrow());
    }

    @Test
    void paymentCannotBuyTwoListings() {
        gems.registerItem("gem-1", SELLER, gem("ruby"));
        gems.registerItem("gem-2", SELLER, gem("sapphire"));
        Listing first = listingService.createListing(request("gem-1", "5", null));
        Listing second = listingService.createListing(request("gem-2", "5", null));
        listingService.buyListing(first.getListingId(), BUYER, "buyer", "mock-tx-shared");

        assertCode(MarketplaceErrorCode.PAYMENT_ALREADY_USED,
                () -> listingService.buyListing(second.getListingId(), BUYER, "buyer", "mock-tx-shared"));
        assertEquals(ListingStatus.ACTIVE, listingService.getListing(second.getListingId()).getStatus());
    }

    @Test
    void expiredListingIsClosedOnBuy() {
        gems.registerItem("gem-1", SELLER, gem("ruby"));
        Listing listing = listingService.createListing(request("gem-1", "5", 60L));
        clock.advance(Duration.ofSeconds(61));

        assertCode(MarketplaceErrorCode.LISTING_EXPIRED,
                () -> listingService.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-late"));

        Listing stored = listingService.getListing(listing.getListingId());
        assertEquals(ListingStatus.EXPIRED, stored.getStatus());
        assertNotNull(stored.getClosedAt());
        assertFalse(gems.isLocked("gem-1"));
        assertEquals(new BigDecimal("100.000000"), currency.getBalance(BUYER));
    }

    @Test
    void sellerCannotBuyOwnListing() {
        gems.registerItem("gem-1", SELLER, gem("ruby"));
        Listing listing = listingService.createListing(request("gem-1", "5", null));

        assertCode(MarketplaceErrorCode.INVALID_REQUEST,
                () -> listingService.buyListing(listing.getListingId(), SELLER, "seller", "mock-tx-self"));
    }

    @Test
    void unknownListingIsNotFound() {
        assertCode(MarketplaceErrorCode.LISTING_NOT_FOUND,
                () -> listingService.buyListing("lst_missing", BUYER, "buyer", "mock-tx-none"));
    }

    @Test
    void raceLostAfterSettlementIsSignalled() {
        InMemoryMarketplaceStorageAdapter racingStorage = new InMemoryMarketplaceStorageAdapter() {
            @Override
            public boolean casTransitionListing(ListingTransition transition) {
                if (transition.target() == ListingStatus.SOLD && !"rival".equals(transition.buyerWallet())) {
                    super.casTransitionListing(ListingTransition.sold(
                            transition.listingId(), "rival", "rival", "rival-tx", transition.at()
                    ));
                }
                return super.casTransitionListing(transition);
            }
        };
        settlementService = new PaymentSettlementService(currency, racingStorage, executor, properties, clock);
        ListingService racingService = newListingService(racingStorage, gems);
        gems.registerItem("gem-1", SELLER, gem("ruby"));
        Listing listing = racingService.createListing(request("gem-1", "5", null));

        MarketplaceException ex = assertThrows(MarketplaceException.class,
                () -> racingService.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-loser"));

        assertEquals(MarketplaceErrorCode.LISTING_RACE_LOST, ex.getErrorCode());
        assertTrue(ex.isCompensationRequired());
        assertTrue(racingStorage.findPaymentConsumption("mock-tx-loser").isPresent());
        assertEquals(SELLER, gems.findOwner("gem-1").orElseThrow());
    }

    @Test
    void concurrentBuyersProduceExactlyOneSale() throws Exception {
        gems.registerItem("gem-1", SELLER, gem("ruby"));
        Listing listing = listingService.createListing(request("gem-1", "5", null));

        int buyers = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(buyers);
        List<Future<Listing>> results = new ArrayList<>();
        try {
            for (int i = 0; i < buyers; i++) {
                String wallet = "buyer-" + i;
                String txRef = "mock-tx-race-" + i;
                Callable<Listing> attempt = () -> {
                    start.await();
                    return listingService.buyListing(listing.getListingId(), wallet, wallet, txRef);
                };
                results.add(pool.submit(attempt));
            }
            start.countDown();

            int successes = 0;
            for (Future<Listing> result : results) {
                try {
                    result.get(10, TimeUnit.SECONDS);
                    successes++;
                } catch (ExecutionException ex) {
                    MarketplaceException failure = (MarketplaceException) ex.getCause();
                    assertTrue(failure.getErrorCode() == MarketplaceErrorCode.LISTING_RACE_LOST
                            || failure.getErrorCode() == MarketplaceErrorCode.LISTING_NOT_ACTIVE);
                }
            }
            assertEquals(1, successes);
        } finally {
            pool.shutdownNow();
        }

        Listing sold = listingService.getListing(listing.getListingId());
        assertEquals(ListingStatus.SOLD, sold.getStatus());
        assertEquals(sold.getBuyerWallet(), gems.findOwner("gem-1").orElseThrow());
    }

    @Test
    void failedTransferAfterSaleIsReported() {
        ItemAdapter brokenItems = mock(ItemAdapter.class);
        when(brokenItems.validate(any(), any())).thenReturn(true);
        when(brokenItems.validateOwnership("gem-1", SELLER)).thenReturn(true);
        when(brokenItems.transferOwnership("gem-1", SELLER, BUYER))
                .thenReturn(ItemTransferResult.failed("inventory offline"));
        ListingService service = newListingService(storage, brokenItems);
        Listing listing = service.createListing(request("gem-1", "5", null));

        MarketplaceException ex = assertThrows(MarketplaceException.class,
                () -> service.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-broken"));

        assertEquals(MarketplaceErrorCode.ITEM_TRANSFER_FAILED, ex.getErrorCode());
        assertTrue(ex.isCompensationRequired());
        assertEquals(ListingStatus.SOLD, storage.getListing(listing.getListingId()).orElseThrow().getStatus());
    }

    @Test
    void replayAfterFailedTransferDeliversTheItem() {
        ItemAdapter flakyItems = mock(ItemAdapter.class);
        when(flakyItems.validate(any(), any())).thenReturn(true);
        when(flakyItems.validateOwnership("gem-1", SELLER)).thenReturn(true);
        when(flakyItems.transferOwnership("gem-1", SELLER, BUYER))
                .thenReturn(ItemTransferResult.failed("inventory offline"), ItemTransferResult.transferred());
        ListingService service = newListingService(storage, flakyItems);
        Listing listing = service.createListing(request("gem-1", "5", null));
        assertCode(MarketplaceErrorCode.ITEM_TRANSFER_FAILED,
                () -> service.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-flaky"));
        assertTrue(storage.findListingSale(listing.getListingId()).isEmpty());

        Listing replayed = service.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-flaky");
        service.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-flaky");

        assertEquals(ListingStatus.SOLD, replayed.getStatus());
        verify(flakyItems, times(2)).transferOwnership("gem-1", SELLER, BUYER);
        MarketplaceTransaction sale = storage.findListingSale(listing.getListingId()).orElseThrow();
        assertEquals(BUYER, sale.getBuyerWallet());
        assertEquals("mock-tx-flaky", sale.getTxHash());
        assertEquals(1, storage.findTransactionsByWallet(BUYER).size());
        assertEquals(new BigDecimal("95.000000"), currency.getBalance(BUYER));
    }

    @Test
    void replayWhileTransferStillFailingKeepsReportingIt() {
        ItemAdapter brokenItems = mock(ItemAdapter.class);
        when(brokenItems.validate(any(), any())).thenReturn(true);
        when(brokenItems.validateOwnership("gem-1", SELLER)).thenReturn(true);
        when(brokenItems.transferOwnership("gem-1", SELLER, BUYER))
                .thenReturn(ItemTransferResult.failed("inventory offline"));
        ListingService service = newListingService(storage, brokenItems);
        Listing listing = service.createListing(request("gem-1", "5", null));
        assertCode(MarketplaceErrorCode.ITEM_TRANSFER_FAILED,
                () -> service.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-down"));

        assertCode(MarketplaceErrorCode.ITEM_TRANSFER_FAILED,
                () -> service.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-down"));

        assertTrue(storage.findTransactionsByWallet(BUYER).isEmpty());
        assertEquals(new BigDecimal("95.000000"), currency.getBalance(BUYER));
    }

    @Test
    void listingExpiringWhilePaymentSettlesIsNotSold() {
        MockCurrencyAdapter slowCurrency = new MockCurrencyAdapter(properties) {
            @Override
            public PaymentVerification verify(String txRef, BigDecimal requiredAmount, String requiredPayer) {
                clock.advance(Duration.ofSeconds(61));
                return super.verify(txRef, requiredAmount, requiredPayer);
            }
        };
        settlementService = new PaymentSettlementService(slowCurrency, storage, executor, properties, clock);
        ListingService service = newListingService(storage, gems);
        gems.registerItem("gem-1", SELLER, gem("ruby"));
        Listing listing = service.createListing(request("gem-1", "5", 60L));

        assertCode(MarketplaceErrorCode.LISTING_EXPIRED,
                () -> service.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-slow"));

        assertEquals(ListingStatus.EXPIRED, storage.getListing(listing.getListingId()).orElseThrow().getStatus());
        assertTrue(storage.findPaymentConsumption("mock-tx-slow").isPresent());
        assertEquals(SELLER, gems.findOwner("gem-1").orElseThrow());
        assertFalse(gems.isLocked("gem-1"));
    }

    @Test
    void cancelRequiresSellerAndActiveListing() {
        gems.registerItem("gem-1", SELLER, gem("ruby"));
        Listing listing = listingService.createListing(request("gem-1", "5", null));

        assertCode(MarketplaceErrorCode.UNAUTHORIZED, () -> listingService.cancelListing(listing.getListingId(), BUYER));

        Listing cancelled = listingService.cancelListing(listing.getListingId(), SELLER);
        assertEquals(ListingStatus.CANCELLED, cancelled.getStatus());
        assertNotNull(cancelled.getClosedAt());
        assertFalse(gems.isLocked("gem-1"));

        assertCode(MarketplaceErrorCode.LISTING_NOT_ACTIVE, () -> listingService.cancelListing(listing.getListingId(), SELLER));
        assertCode(MarketplaceErrorCode.LISTING_NOT_ACTIVE,
                () -> listingService.buyListing(listing.getListingId(), BUYER, "buyer", "mock-tx-after-cancel"));
        assertCode(MarketplaceErrorCode.LISTING_NOT_FOUND, () -> listingService.cancelListing("lst_missing", SELLER));
    }

    @Test
    void sweepExpiresOnlyListingsPastTheirExpiry() {
        gems.registerItem("gem-1", SELLER, gem("ruby"));
        gems.registerItem("gem-2", SELLER, gem("emerald"));
        gems.registerItem("gem-3", SELLER, gem("diamond"));
        Listing shortLived = listingService.createListing(request("gem-1", "5", 60L));
        Listing longLived = listingService.createListing(request("gem-2", "5", 7200L));
        Listing open = listingService.createListing(request("gem-3", "5", null));
        clock.advance(Duration.ofMinutes(5));

        ListingService.SweepSummary summary = listingService.sweepExpired();

        assertEquals(1, summary.scanned());
        assertEquals(1, summary.expired());
        assertEquals(ListingStatus.EXPIRED, listingService.getListing(shortLived.getListingId()).getStatus());
        assertEquals(ListingStatus.ACTIVE, listingService.getListing(longLived.getListingId()).getStatus());
        assertEquals(ListingStatus.ACTIVE, listingService.getListing(open.getListingId()).getStatus());
        assertFalse(gems.isLocked("gem-1"));

        ListingService.SweepSummary second = listingService.sweepExpired();
        assertEquals(0, second.expired());
        assertFalse(second.hasWork());
    }

    @Test
    void sweepWorksThroughMultipleBatches() {
        properties.getSweep().setBatchSize(2);
        for (int i = 0; i < 5; i++) {
            gems.registerItem("gem-" + i, SELLER, gem("ruby"));
            listingService.createListing(request("gem-" + i, "5", 30L));
        }
        clock.advance(Duration.ofMinutes(1));

        ListingService.SweepSummary summary = listingService.sweepExpired();

        assertEquals(5, summary.expired());
        assertTrue(listingService.getActiveListings(null, null, null).listings().isEmpty());
    }

    @Test
    void activeListingsArePagedAndSorted() {
        String[] prices = {"3", "1", "2"};
        for (int i = 0; i < prices.length; i++) {
            gems.registerItem("gem-" + i, SELLER, gem("ruby"));
            listingService.createListing(request("gem-" + i, prices[i], null));
            clock.advance(Duration.ofSeconds(1));
        }

        ListingPage cheapest = listingService.getActiveListings(null, 2, "price_low");
        assertEquals(2, cheapest.listings().size());
        assertEquals(new BigDecimal("1.000000"), cheapest.listings().get(0).getPriceUsdc());
        assertEquals(new BigDecimal("2.000000"), cheapest.listings().get(1).getPriceUsdc());
        assertTrue(cheapest.hasMore());

        ListingPage rest = listingService.getActiveListings(cheapest.nextCursor(), 2, "price_low");
        assertEquals(1, rest.listings().size());
        assertEquals(new BigDecimal("3.000000"), rest.listings().get(0).getPriceUsdc());
        assertNull(rest.nextCursor());

        ListingPage newest = listingService.getActiveListings(null, 500, "newest");
        assertEquals("gem-2", newest.listings().get(0).getItemId());
        assertEquals(3, newest.listings().size());

        ListingPage highest = listingService.getActiveListings(null, 0, "price_high");
        assertEquals(1, highest.listings().size());
        assertEquals(new BigDecimal("3.000000"), highest.listings().get(0).getPriceUsdc());

        assertCode(MarketplaceErrorCode.INVALID_REQUEST, () -> listingService.getActiveListings(null, 2, "cheapest"));
        assertCode(MarketplaceErrorCode.INVALID_REQUEST, () -> listingService.getActiveListings("abc", 2, null));
    }

    @Test
    void listingsBySellerIncludeClosedListings() {
        gems.registerItem("gem-1", SELLER, gem("ruby"));
        gems.registerItem("gem-2", SELLER, gem("emerald"));
        Listing first = listingService.createListing(request("gem-1", "5", null));
        listingService.createListing(request("gem-2", "5", null));
        listingService.cancelListing(first.getListingId(), SELLER);

        assertEquals(2, listingService.getListingsBySeller(SELLER).size());
        assertTrue(listingService.getListingsBySeller(BUYER).isEmpty());
    }

    @Test
    void purchaseChallengeQuotesListingPrice() {
        gems.registerItem("gem-1", SELLER, gem("ruby"));
        Listing listing = listingService.createListing(request("gem-1", "5", null));

        PaymentChallenge challenge = listingService.createPurchaseChallenge(listing.getListingId());

        assertEquals("5000000", challenge.accepts().get(0).maxAmountRequired());
        assertTrue(challenge.accepts().get(0).resource().contains(listing.getListingId()));
    }

    private ListingService newListingService(InMemoryMarketplaceStorageAdapter storageAdapter, ItemAdapter itemAdapter) {
        return new ListingService(storageAdapter, settlementService, itemAdapter, currency, properties, clock);
    }

    private static ListingRequests.CreateListingRequest request(String itemId, String price, Long expiresInSeconds) {
        return new ListingRequests.CreateListingRequest(
                itemId,
                "gem",
                gem("ruby"),
                SELLER,
                "seller",
                new BigDecimal(price),
                expiresInSeconds
        );
    }

    private static ObjectNode gem(String type) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("type", type);
        data.put("rarity", "rare");
        data.put("level", 3);
        data.put("size", 0.1);
        return data;
    }

    private static void assertCode(MarketplaceErrorCode expected, Runnable action) {
        MarketplaceException ex = assertThrows(MarketplaceException.class, action::run);
        assertEquals(expected, ex.getErrorCode());
    }
}
