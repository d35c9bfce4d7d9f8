package com.shopstream.pageviews.join;

import com.shopstream.pageviews.model.FinalizedView;
import com.shopstream.pageviews.model.ProductRecord;
import com.shopstream.pageviews.model.SaleEvent;
import com.shopstream.pageviews.model.UserRecord;
import com.shopstream.pageviews.model.ViewEvent;
import com.shopstream.state.DimensionDescriptor;
import com.shopstream.state.FactBufferDescriptor;

/**
 * Source names and keyed-state tables of the page-view join.
 */
public final class PageViewState {

    public static final String PRODUCTS_SOURCE = "products";
    public static final String USERS_SOURCE = "users";
    public static final String SALES_SOURCE = "sales";
    public static final String VIEWS_SOURCE = "views";

    /** Key used for records whose join attribute is missing. */
    static final String NO_KEY = "";

    public static final DimensionDescriptor<ProductRecord> PRODUCTS =
            new DimensionDescriptor<>("products", ProductRecord.class);

    public static final DimensionDescriptor<UserRecord> USERS =
            new DimensionDescriptor<>("users", UserRecord.class);

    /** Views waiting for a sale, product or user, keyed by product id. */
    public static final FactBufferDescriptor<ViewEvent> PENDING_VIEWS =
            FactBufferDescriptor.drainedByOwner("pending-views", ViewEvent.class);

    private PageViewState() {
    }

    /**
     * Sales keyed by product id.
     *
     * <p>A view that can still arrive on time has {@code event_time > watermark - viewLateness}
     * and accepts sales up to {@code event_time + matchWindow}.  Per product, a sale is
     * superseded once a newer sale lies behind {@code watermark + matchWindow - viewLateness},
     * so the store keeps only the newest one behind that horizon.  With an unbounded match
     * window only the newest sale per product can ever match.  With unbounded view lateness
     * no sale is ever safe to drop.</p>
     */
    public static FactBufferDescriptor<SaleEvent> sales(Long matchWindowMs, Long viewLatenessMs) {
        if (viewLatenessMs == null) {
            return FactBufferDescriptor.drainedByOwner("sales", SaleEvent.class);
        }
        Long horizon = matchWindowMs == null ? null : matchWindowMs - viewLatenessMs;
        return FactBufferDescriptor.keepLatestBehind("sales", SaleEvent.class, horizon);
    }

    /**
     * Markers of emitted views, keyed by view id.
     *
     * <p>A marker is dropped once the watermark passes the view's deadline plus
     * {@code dedupHorizon}.  Without view lateness or without a dedup horizon markers are
     * kept for the life of the job.</p>
     */
    public static FactBufferDescriptor<FinalizedView> finalizedViews(Long viewLatenessMs, Long dedupHorizonMs) {
        if (viewLatenessMs == null || dedupHorizonMs == null) {
            return FactBufferDescriptor.expireBehind("finalized-views", FinalizedView.class, null);
        }
        long retention = SaleMatcher.saturatedAdd(viewLatenessMs, dedupHorizonMs);
        return FactBufferDescriptor.expireBehind("finalized-views", FinalizedView.class,
                retention == Long.MAX_VALUE ? null : -retention);
    }

    static String key(String id) {
        return id == null ? NO_KEY : id;
    }
}
