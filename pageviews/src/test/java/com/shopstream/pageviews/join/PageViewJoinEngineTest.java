package com.shopstream.pageviews.join;

import com.shopstream.config.CapacityPolicy;
import com.shopstream.metrics.MetricsSnapshot;
import com.shopstream.metrics.PipelineMetrics;
import com.shopstream.pageviews.model.EnrichedRecord;
import com.shopstream.pageviews.model.FinalizedView;
import com.shopstream.pageviews.model.ProductRecord;
import com.shopstream.pageviews.model.SaleEvent;
import com.shopstream.pageviews.model.UserRecord;
import com.shopstream.pageviews.model.ViewEvent;
import com.shopstream.source.SourceRecord;
import com.shopstream.state.FactBufferDescriptor;
import com.shopstream.state.KeyedStateStore;
import com.shopstream.state.StateStoreCapacityExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageViewJoinEngineTest {

    private static final long VIEW_LATENESS = 1_000;
    private static final long DEDUP_HORIZON = 5_000;
    private static final FactBufferDescriptor<FinalizedView> FINALIZED =
            PageViewState.finalizedViews(VIEW_LATENESS, DEDUP_HORIZON);
    private static final long NO_WATERMARK = Long.MIN_VALUE;

    private final List<EnrichedRecord> emitted = new ArrayList<>();
    private PipelineMetrics metrics;
    private KeyedStateStore store;
    private PageViewJoinEngine engine;

    @BeforeEach
    void setUp() {
        engine = engine(null, 1_000, CapacityPolicy.FAIL);
    }

    private PageViewJoinEngine engine(Long matchWindowMs, int maxFacts, CapacityPolicy policy) {
        FactBufferDescriptor<SaleEvent> sales = PageViewState.sales(matchWindowMs, VIEW_LATENESS);
        metrics = new PipelineMetrics();
        store = new KeyedStateStore(List.of(PageViewState.PRODUCTS, PageViewState.USERS),
                List.of(sales, PageViewState.PENDING_VIEWS, FINALIZED), maxFacts);
        emitted.clear();
        return new PageViewJoinEngine(store, emitted::add, metrics, sales, FINALIZED, VIEW_LATENESS, matchWindowMs,
                policy);
    }

    private static ViewEvent view(String productId, String userId, long time) {
        return view(productId, userId, time, time);
    }

    private static ViewEvent view(String productId, String userId, long viewTime, long eventTime) {
        return ViewEvent.builder().productId(productId).userId(userId).viewTime(viewTime).eventTime(eventTime)
                .pageUrl("/products/" + productId).ip("10.0.0.1").build();
    }

    private static SaleEvent sale(long orderId, String productId, long time) {
        return SaleEvent.builder().orderId(orderId).productId(productId).customerId("c-" + orderId)
                .eventTime(time).build();
    }

    private static ProductRecord product(String id, String name) {
        return ProductRecord.builder().id(id).name(name).brand("Acme").build();
    }

    private static UserRecord user(String id, String firstName) {
        return UserRecord.builder().id(id).firstName(firstName).lastName("Doe").build();
    }

    private EnrichedRecord onlyEmitted() {
        assertThat(emitted).hasSize(1);
        return emitted.get(0);
    }

    @Test
    void emitsAsSoonAsAllSidesAreKnown() throws InterruptedException {
        engine.onProduct(product("p1", "Kettle"));
        engine.onUser(user("u1", "Ada"));
        engine.onSale(sale(1000, "p1", 50));

        engine.onView(view("p1", "u1", 100), NO_WATERMARK);

        EnrichedRecord record = onlyEmitted();
        assertThat(record.getDocumentId()).isEqualTo("p1:u1:100");
        assertThat(record.getProductName()).isEqualTo("Kettle");
        assertThat(record.getBrand()).isEqualTo("Acme");
        assertThat(record.getFirstName()).isEqualTo("Ada");
        assertThat(record.getLastName()).isEqualTo("Doe");
        assertThat(record.getOrderId()).isEqualTo(1000L);
        assertThat(record.getOrderDate()).isEqualTo(50L);
        assertThat(engine.pendingCount()).isZero();
    }

    @Test
    void viewWaitsForItsSale() throws InterruptedException {
        engine.onProduct(product("p1", "Kettle"));
        engine.onUser(user("u1", "Ada"));
        engine.onView(view("p1", "u1", 100), NO_WATERMARK);

        assertThat(emitted).isEmpty();
        assertThat(engine.pendingCount()).isEqualTo(1);

        engine.onSale(sale(1000, "p1", 150));

        assertThat(onlyEmitted().getOrderId()).isEqualTo(1000L);
        assertThat(engine.pendingCount()).isZero();
        assertThat(store.factCount(PageViewState.PENDING_VIEWS)).isZero();
    }

    @Test
    void saleArrivingAfterTheDeadlineLeavesOrderEmpty() throws InterruptedException {
        long t = 10_000;
        engine.onProduct(product("P1", "Kettle"));
        engine.onUser(user("U1", "Ada"));
        ViewEvent view = ViewEvent.builder().productId("P1").userId("U1").viewTime(78).eventTime(t).build();
        engine.onView(view, NO_WATERMARK);

        engine.onWatermark(t + VIEW_LATENESS);
        engine.onSale(sale(1000, "P1", t - 5));

        EnrichedRecord record = onlyEmitted();
        assertThat(record.getDocumentId()).isEqualTo("P1:U1:78");
        assertThat(record.getOrderId()).isNull();
    }

    @Test
    void saleArrivingBeforeTheDeadlineIsAttributed() throws InterruptedException {
        long t = 10_000;
        engine.onProduct(product("P1", "Kettle"));
        engine.onUser(user("U1", "Ada"));
        ViewEvent view = ViewEvent.builder().productId("P1").userId("U1").viewTime(78).eventTime(t).build();
        engine.onView(view, NO_WATERMARK);

        engine.onWatermark(t + VIEW_LATENESS - 1);
        engine.onSale(sale(1000, "P1", t - 5));

        assertThat(onlyEmitted().getOrderId()).isEqualTo(1000L);
    }

    @Test
    void saleAfterTheMatchWindowIsNotAttributed() throws InterruptedException {
        engine = engine(0L, 1_000, CapacityPolicy.FAIL);
        engine.onProduct(product("p1", "Kettle"));
        engine.onUser(user("u1", "Ada"));
        engine.onView(view("p1", "u1", 100), NO_WATERMARK);

        engine.onSale(sale(1000, "p1", 150));
        assertThat(emitted).isEmpty();

        engine.onWatermark(1_100);

        EnrichedRecord record = onlyEmitted();
        assertThat(record.getOrderId()).isNull();
        assertThat(record.getOrderDate()).isNull();
        assertThat(record.getProductName()).isEqualTo("Kettle");
    }

    @Test
    void saleInsideTheMatchWindowIsAttributed() throws InterruptedException {
        engine = engine(100L, 1_000, CapacityPolicy.FAIL);
        engine.onProduct(product("p1", "Kettle"));
        engine.onUser(user("u1", "Ada"));
        engine.onView(view("p1", "u1", 100), NO_WATERMARK);

        engine.onSale(sale(1000, "p1", 200));

        assertThat(onlyEmitted().getOrderId()).isEqualTo(1000L);
    }

    @Test
    void mostRecentSaleWinsAndLaterArrivalBreaksTies() throws InterruptedException {
        engine.onProduct(product("p1", "Kettle"));
        engine.onUser(user("u1", "Ada"));
        engine.onSale(sale(1, "p1", 10));
        engine.onSale(sale(2, "p1", 30));
        engine.onSale(sale(3, "p1", 30));
        engine.onSale(sale(4, "p1", 20));

        engine.onView(view("p1", "u1", 100), NO_WATERMARK);

        assertThat(onlyEmitted().getOrderId()).isEqualTo(3L);
    }

    @Test
    void unmatchedSidesAreNullAtTheDeadline() throws InterruptedException {
        engine.onView(view("p1", "u1", 100), NO_WATERMARK);

        engine.onWatermark(1_099);
        assertThat(emitted).isEmpty();

        engine.onWatermark(1_100);

        EnrichedRecord record = onlyEmitted();
        assertThat(record.getProductId()).isEqualTo("p1");
        assertThat(record.getUserId()).isEqualTo("u1");
        assertThat(record.getViewTime()).isEqualTo(100);
        assertThat(record.getProductName()).isNull();
        assertThat(record.getBrand()).isNull();
        assertThat(record.getFirstName()).isNull();
        assertThat(record.getLastName()).isNull();
        assertThat(record.getOrderId()).isNull();
        assertThat(engine.pendingCount()).isZero();
        assertThat(store.factCount(PageViewState.PENDING_VIEWS)).isZero();
    }

    @Test
    void partialMatchIsEmittedWithWhatIsKnown() throws InterruptedException {
        engine.onUser(user("u1", "Ada"));
        engine.onSale(sale(7, "p1", 90));
        engine.onView(view("p1", "u1", 100), NO_WATERMARK);

        engine.onWatermark(5_000);

        EnrichedRecord record = onlyEmitted();
        assertThat(record.getFirstName()).isEqualTo("Ada");
        assertThat(record.getOrderId()).isEqualTo(7L);
        assertThat(record.getProductName()).isNull();
    }

    @Test
    void lateViewIsEmittedImmediately() throws InterruptedException {
        engine.onUser(user("u1", "Ada"));

        engine.onView(view("p1", "u1", 100), 1_100);

        EnrichedRecord record = onlyEmitted();
        assertThat(record.getFirstName()).isEqualTo("Ada");
        assertThat(record.getProductName()).isNull();
        assertThat(engine.pendingCount()).isZero();
        assertThat(metrics.snapshot(null).getLateArrivals()).isEqualTo(1);
    }

    @Test
    void duplicateOfPendingViewIsIgnored() throws InterruptedException {
        engine.onView(view("p1", "u1", 100), NO_WATERMARK);
        engine.onView(view("p1", "u1", 100), NO_WATERMARK);

        assertThat(engine.pendingCount()).isEqualTo(1);
        assertThat(store.factCount(PageViewState.PENDING_VIEWS)).isEqualTo(1);

        engine.onWatermark(2_000);

        assertThat(emitted).hasSize(1);
        assertThat(metrics.snapshot(null).getDuplicateArrivals()).isEqualTo(1);
    }

    @Test
    void redeliveredCompleteViewIsNotEmittedAgain() throws InterruptedException {
        engine.onProduct(product("p1", "Kettle"));
        engine.onUser(user("u1", "Ada"));
        engine.onSale(sale(1000, "p1", 50));

        engine.onView(view("p1", "u1", 100), NO_WATERMARK);
        engine.onView(view("p1", "u1", 100), NO_WATERMARK);

        assertThat(onlyEmitted().getOrderId()).isEqualTo(1000L);
        assertThat(metrics.snapshot(null).getDuplicateArrivals()).isEqualTo(1);
    }

    @Test
    void saleArrivingAfterFinalisationDoesNotRewriteTheRedeliveredView() throws InterruptedException {
        engine.onProduct(product("P1", "Kettle"));
        engine.onUser(user("U1", "Ada"));
        engine.onView(view("P1", "U1", 78, 10_000), NO_WATERMARK);

        engine.onWatermark(11_000);
        assertThat(onlyEmitted().getOrderId()).isNull();

        engine.onSale(sale(1000, "P1", 9_995));
        engine.onView(view("P1", "U1", 78, 10_000), 11_000);

        EnrichedRecord record = onlyEmitted();
        assertThat(record.getDocumentId()).isEqualTo("P1:U1:78");
        assertThat(record.getOrderId()).isNull();
        assertThat(metrics.snapshot(null).getDuplicateArrivals()).isEqualTo(1);
        assertThat(metrics.snapshot(null).getLateArrivals()).isZero();
    }

    @Test
    void lateViewLeavesAMarkerToo() throws InterruptedException {
        engine.onView(view("p1", "u1", 100), 1_100);
        engine.onView(view("p1", "u1", 100), 1_100);

        assertThat(emitted).hasSize(1);
        assertThat(store.getFacts(FINALIZED, "p1:u1:100")).extracting(FinalizedView::getEventTime)
                .containsExactly(100L);
        assertThat(store.getBufferedFactCount()).isZero();
    }

    @Test
    void redeliveryPastTheDedupHorizonIsEmittedAgain() throws InterruptedException {
        engine.onView(view("p1", "u1", 100), NO_WATERMARK);
        engine.onWatermark(1_100);
        assertThat(emitted).hasSize(1);

        store.evictOlderThan(100 + VIEW_LATENESS + DEDUP_HORIZON);
        assertThat(store.getFacts(FINALIZED, "p1:u1:100")).hasSize(1);

        store.evictOlderThan(100 + VIEW_LATENESS + DEDUP_HORIZON + 1);
        assertThat(store.factCount(FINALIZED)).isZero();

        engine.onView(view("p1", "u1", 100), 6_200);
        assertThat(emitted).hasSize(2);
        assertThat(metrics.snapshot(null).getDuplicateArrivals()).isZero();
    }

    @Test
    void userUpdateCompletesPendingViewsOfThatUser() throws InterruptedException {
        engine.onProduct(product("p1", "Kettle"));
        engine.onSale(sale(1000, "p1", 50));
        engine.onView(view("p1", "u1", 100), NO_WATERMARK);
        engine.onView(view("p1", "u2", 110), NO_WATERMARK);

        engine.onUser(user("u1", "Ada"));

        EnrichedRecord record = onlyEmitted();
        assertThat(record.getUserId()).isEqualTo("u1");
        assertThat(record.getFirstName()).isEqualTo("Ada");
        assertThat(engine.pendingCount()).isEqualTo(1);
    }

    @Test
    void productUpdateCompletesPendingViewsOfThatProduct() throws InterruptedException {
        engine.onUser(user("u1", "Ada"));
        engine.onSale(sale(1000, "p1", 50));
        engine.onView(view("p1", "u1", 100), NO_WATERMARK);

        engine.onProduct(product("p2", "Toaster"));
        assertThat(emitted).isEmpty();

        engine.onProduct(product("p1", "Kettle"));

        assertThat(onlyEmitted().getProductName()).isEqualTo("Kettle");
    }

    @Test
    void latestDimensionValueIsUsed() throws InterruptedException {
        engine.onProduct(product("p1", "Kettle"));
        engine.onProduct(product("p1", "Electric Kettle"));
        engine.onUser(user("u1", "Ada"));
        engine.onSale(sale(1000, "p1", 50));

        engine.onView(view("p1", "u1", 100), NO_WATERMARK);

        assertThat(onlyEmitted().getProductName()).isEqualTo("Electric Kettle");
    }

    @Test
    void dispatchesRecordsByType() throws InterruptedException {
        engine.process(new SourceRecord<>("products", 0, 0, 0, product("p1", "Kettle")), NO_WATERMARK);
        engine.process(new SourceRecord<>("users", 0, 0, 0, user("u1", "Ada")), NO_WATERMARK);
        engine.process(new SourceRecord<>("sales", 0, 0, 50, sale(1000, "p1", 50)), NO_WATERMARK);
        engine.process(new SourceRecord<>("views", 0, 0, 100, view("p1", "u1", 100)), NO_WATERMARK);

        assertThat(onlyEmitted().getOrderId()).isEqualTo(1000L);
        assertThatThrownBy(() -> engine.process(new SourceRecord<>("clicks", 0, 0, 0, "click"), NO_WATERMARK))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("clicks");
    }

    @Test
    void salesWithoutProductAreDropped() throws InterruptedException {
        engine.onSale(sale(1000, null, 50));

        assertThat(store.getBufferedFactCount()).isZero();
    }

    @Test
    void fullStateFailsUnderFailPolicy() throws InterruptedException {
        engine = engine(null, 2, CapacityPolicy.FAIL);
        engine.onView(view("p1", "u1", 100), NO_WATERMARK);
        engine.onView(view("p2", "u1", 200), NO_WATERMARK);

        assertThatThrownBy(() -> engine.onView(view("p3", "u1", 300), NO_WATERMARK))
                .isInstanceOf(StateStoreCapacityExceededException.class);
        assertThat(emitted).isEmpty();
    }

    @Test
    void fullStateForceFinalizesOldestPendingView() throws InterruptedException {
        engine = engine(null, 2, CapacityPolicy.FORCE_FINALIZE_OLDEST);
        engine.onView(view("p1", "u1", 100), NO_WATERMARK);
        engine.onView(view("p2", "u1", 200), NO_WATERMARK);

        engine.onView(view("p3", "u1", 300), NO_WATERMARK);

        assertThat(onlyEmitted().getDocumentId()).isEqualTo("p1:u1:100");
        assertThat(engine.pendingCount()).isEqualTo(2);
        assertThat(store.getBufferedFactCount()).isEqualTo(2);
        assertThat(metrics.snapshot(null).getJoinsForceFinalized()).isEqualTo(1);
    }

    @Test
    void forceFinalizeCannotFreeSpaceHeldBySales() throws InterruptedException {
        engine = engine(null, 1, CapacityPolicy.FORCE_FINALIZE_OLDEST);
        engine.onSale(sale(1, "p1", 10));

        assertThatThrownBy(() -> engine.onSale(sale(2, "p2", 20)))
                .isInstanceOf(StateStoreCapacityExceededException.class);
    }

    @Test
    void pendingIndexIsRebuiltAfterRestore() throws InterruptedException {
        engine.onView(view("p1", "u1", 100), NO_WATERMARK);
        engine.onView(view("p2", "u2", 500), NO_WATERMARK);

        engine.onView(view("p3", "u3", 50), 1_050);
        assertThat(emitted).hasSize(1);

        FactBufferDescriptor<SaleEvent> sales = PageViewState.sales(null, VIEW_LATENESS);
        KeyedStateStore restoredStore = new KeyedStateStore(List.of(PageViewState.PRODUCTS, PageViewState.USERS),
                List.of(sales, PageViewState.PENDING_VIEWS, FINALIZED), 1_000);
        restoredStore.restore(store.snapshot());
        assertThat(restoredStore.getBufferedFactCount()).isEqualTo(2);
        List<EnrichedRecord> out = new ArrayList<>();
        PageViewJoinEngine restored = new PageViewJoinEngine(restoredStore, out::add, new PipelineMetrics(),
                sales, FINALIZED, VIEW_LATENESS, null, CapacityPolicy.FAIL);

        restored.onRestore();
        assertThat(restored.pendingCount()).isEqualTo(2);

        restored.onView(view("p3", "u3", 50), 1_050);
        assertThat(out).isEmpty();

        restored.onUser(user("u2", "Grace"));
        assertThat(out).isEmpty();

        restored.onWatermark(1_100);
        assertThat(out).extracting(EnrichedRecord::getDocumentId).containsExactly("p1:u1:100");
        assertThat(restored.pendingCount()).isEqualTo(1);
    }
}
