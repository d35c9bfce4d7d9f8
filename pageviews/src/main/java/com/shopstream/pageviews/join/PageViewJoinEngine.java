package com.shopstream.pageviews.join;

import com.shopstream.config.CapacityPolicy;
import com.shopstream.engine.Emitter;
import com.shopstream.engine.StreamProcessor;
import com.shopstream.metrics.PipelineMetrics;
import com.shopstream.pageviews.model.EnrichedRecord;
import com.shopstream.pageviews.model.FinalizedView;
import com.shopstream.pageviews.model.ProductRecord;
import com.shopstream.pageviews.model.SaleEvent;
import com.shopstream.pageviews.model.UserRecord;
import com.shopstream.pageviews.model.ViewEvent;
import com.shopstream.source.SourceRecord;
import com.shopstream.state.FactBufferDescriptor;
import com.shopstream.state.FactEvent;
import com.shopstream.state.KeyedStateStore;
import com.shopstream.state.StateStoreCapacityExceededException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Left-outer join of page views with the latest product, the latest user and the most
 * recent eligible sale.
 *
 * <p>A view is emitted as soon as all three sides are known.  Otherwise it waits in the
 * pending-views buffer and is re-evaluated whenever a sale for its product, an update of
 * its product or an update of its user arrives.  Once the global watermark reaches the
 * view's deadline ({@code event_time + view lateness}) it is emitted with whatever is
 * known, absent sides as {@code null}.  A view arriving after its deadline is emitted
 * straight away.</p>
 *
 * <p>Every view leaves the engine at most once.  A re-delivered view that is still pending is
 * dropped.  An emitted view leaves a marker in the finalized-views buffer, and a re-delivery
 * is dropped for as long as that marker is retained, so a sale that arrived in between
 * cannot overwrite the document the view was finalised with.</p>
 */
@Slf4j
public class PageViewJoinEngine implements StreamProcessor {

    private final KeyedStateStore store;
    private final Emitter<EnrichedRecord> emitter;
    private final PipelineMetrics metrics;
    private final FactBufferDescriptor<SaleEvent> sales;
    private final FactBufferDescriptor<FinalizedView> finalized;
    private final Long viewLatenessMs;
    private final Long matchWindowMs;
    private final CapacityPolicy capacityPolicy;
    private final PendingViewIndex pending = new PendingViewIndex();

    public PageViewJoinEngine(KeyedStateStore store, Emitter<EnrichedRecord> emitter, PipelineMetrics metrics,
                              FactBufferDescriptor<SaleEvent> sales, FactBufferDescriptor<FinalizedView> finalized,
                              Long viewLatenessMs, Long matchWindowMs, CapacityPolicy capacityPolicy) {
        this.store = store;
        this.emitter = emitter;
        this.metrics = metrics;
        this.sales = sales;
        this.finalized = finalized;
        this.viewLatenessMs = viewLatenessMs;
        this.matchWindowMs = matchWindowMs;
        this.capacityPolicy = capacityPolicy;
    }

    @Override
    public void process(SourceRecord<?> record, long globalWatermark) throws InterruptedException {
        Object value = record.getValue();
        if (value instanceof ViewEvent) {
            onView((ViewEvent) value, globalWatermark);
        } else if (value instanceof SaleEvent) {
            onSale((SaleEvent) value);
        } else if (value instanceof ProductRecord) {
            onProduct((ProductRecord) value);
        } else if (value instanceof UserRecord) {
            onUser((UserRecord) value);
        } else {
            throw new IllegalArgumentException("Unexpected record type from source '" + record.getSource()
                    + "': " + (value == null ? "null" : value.getClass().getName()));
        }
    }

    @Override
    public void onWatermark(long globalWatermark) throws InterruptedException {
        List<ViewEvent> due = pending.dueBy(globalWatermark);
        for (ViewEvent view : due) {
            removePending(view);
            emit(view);
        }
        if (!due.isEmpty()) {
            log.debug("Finalised {} pending views at watermark={}", due.size(), globalWatermark);
        }
    }

    @Override
    public void onRestore() {
        pending.clear();
        store.forEachFact(PageViewState.PENDING_VIEWS, (productId, view) -> pending.add(view, deadline(view)));
        log.info("Rebuilt pending-view index with {} views", pending.size());
    }

    @Override
    public int pendingCount() {
        return pending.size();
    }

    // ── Per-stream handling ──────────────────────────────────────────────

    void onView(ViewEvent view, long globalWatermark) throws InterruptedException {
        metrics.onJoinStarted();
        String viewId = view.getViewId();
        if (pending.contains(viewId)) {
            metrics.onDuplicateArrival();
            log.debug("Ignoring duplicate of pending view {}", viewId);
            return;
        }
        if (!store.getFacts(finalized, viewId).isEmpty()) {
            metrics.onDuplicateArrival();
            log.debug("Ignoring duplicate of finalised view {}", viewId);
            return;
        }
        long deadline = deadline(view);
        if (globalWatermark >= deadline) {
            metrics.onLateArrival();
            log.debug("Late view {} (deadline={} watermark={}), finalising now", viewId, deadline, globalWatermark);
            emit(view);
            return;
        }
        if (isComplete(view)) {
            emit(view);
            return;
        }
        buffer(PageViewState.PENDING_VIEWS, PageViewState.key(view.getProductId()), view);
        pending.add(view, deadline);
    }

    void onSale(SaleEvent sale) throws InterruptedException {
        if (sale.getProductId() == null) {
            log.warn("Dropping sale without product_id: order_id={}", sale.getOrderId());
            return;
        }
        buffer(sales, sale.getProductId(), sale);
        reevaluateProduct(sale.getProductId());
    }

    void onProduct(ProductRecord product) throws InterruptedException {
        if (product.getId() == null) {
            log.warn("Dropping product update without id");
            return;
        }
        store.upsertDimension(PageViewState.PRODUCTS, product.getId(), product);
        reevaluateProduct(product.getId());
    }

    void onUser(UserRecord user) throws InterruptedException {
        if (user.getId() == null) {
            log.warn("Dropping user update without id");
            return;
        }
        store.upsertDimension(PageViewState.USERS, user.getId(), user);
        for (ViewEvent view : pending.viewsOfUser(user.getId())) {
            completeIfPossible(view);
        }
    }

    // ── Join evaluation ──────────────────────────────────────────────────

    private void reevaluateProduct(String productId) throws InterruptedException {
        for (ViewEvent view : store.getFacts(PageViewState.PENDING_VIEWS, productId)) {
            completeIfPossible(view);
        }
    }

    private void completeIfPossible(ViewEvent view) throws InterruptedException {
        if (isComplete(view)) {
            removePending(view);
            emit(view);
        }
    }

    private boolean isComplete(ViewEvent view) {
        return product(view).isPresent() && user(view).isPresent() && sale(view).isPresent();
    }

    private void emit(ViewEvent view) throws InterruptedException {
        Optional<ProductRecord> product = product(view);
        Optional<UserRecord> user = user(view);
        Optional<SaleEvent> sale = sale(view);
        EnrichedRecord record = EnrichedRecord.builder()
                .productId(view.getProductId())
                .userId(view.getUserId())
                .viewTime(view.getViewTime())
                .productName(product.map(ProductRecord::getName).orElse(null))
                .brand(product.map(ProductRecord::getBrand).orElse(null))
                .firstName(user.map(UserRecord::getFirstName).orElse(null))
                .lastName(user.map(UserRecord::getLastName).orElse(null))
                .orderId(sale.map(SaleEvent::getOrderId).orElse(null))
                .orderDate(sale.map(SaleEvent::getEventTime).orElse(null))
                .build();
        metrics.onJoinEmitted(sale.isPresent());
        emitter.emit(record);
        store.bufferFact(finalized, view.getViewId(), new FinalizedView(view.getViewId(), view.getEventTime()));
    }

    private Optional<ProductRecord> product(ViewEvent view) {
        return store.getDimension(PageViewState.PRODUCTS, view.getProductId());
    }

    private Optional<UserRecord> user(ViewEvent view) {
        return store.getDimension(PageViewState.USERS, view.getUserId());
    }

    private Optional<SaleEvent> sale(ViewEvent view) {
        if (view.getProductId() == null) {
            return Optional.empty();
        }
        return SaleMatcher.mostRecentSale(store.getFacts(sales, view.getProductId()), view.getEventTime(),
                matchWindowMs);
    }

    private long deadline(ViewEvent view) {
        if (viewLatenessMs == null) {
            return Long.MAX_VALUE;
        }
        return SaleMatcher.saturatedAdd(view.getEventTime(), viewLatenessMs);
    }

    private void removePending(ViewEvent view) {
        String viewId = view.getViewId();
        store.drainMatchingFacts(PageViewState.PENDING_VIEWS, PageViewState.key(view.getProductId()),
                v -> v.getViewId().equals(viewId));
        pending.remove(viewId);
    }

    // ── Capacity ─────────────────────────────────────────────────────────

    private <F extends FactEvent> void buffer(FactBufferDescriptor<F> buffer, String key, F fact)
            throws InterruptedException {
        while (true) {
            try {
                store.bufferFact(buffer, key, fact);
                return;
            } catch (StateStoreCapacityExceededException e) {
                if (capacityPolicy == CapacityPolicy.FAIL || !forceFinalizeOldest()) {
                    log.error("Keyed state is full ({} facts) with {} pending views; stopping. "
                                    + "Check for a stalled source holding the watermark back.",
                            e.getCapacity(), pending.size());
                    throw e;
                }
            }
        }
    }

    private boolean forceFinalizeOldest() throws InterruptedException {
        ViewEvent oldest = pending.oldest();
        if (oldest == null) {
            return false;
        }
        log.warn("Keyed state full, force-finalising pending view {}", oldest.getViewId());
        removePending(oldest);
        metrics.onJoinForceFinalized();
        emit(oldest);
        return true;
    }
}
