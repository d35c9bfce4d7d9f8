package com.shopstream.pageviews.join;

import com.shopstream.pageviews.model.ViewEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Secondary index over the pending-views buffer: by deadline, for watermark-driven
 * finalisation, and by user id, for re-evaluation on user updates.
 *
 * <p>Derived entirely from the buffer, so it is not checkpointed; it is rebuilt after a
 * restore.</p>
 */
class PendingViewIndex {

    private static final Comparator<Entry> BY_DEADLINE =
            Comparator.comparingLong((Entry e) -> e.deadline).thenComparing(e -> e.viewId);

    private final Map<String, Entry> byId = new HashMap<>();
    private final NavigableSet<Entry> byDeadline = new TreeSet<>(BY_DEADLINE);
    private final Map<String, Set<String>> byUser = new HashMap<>();

    boolean contains(String viewId) {
        return byId.containsKey(viewId);
    }

    void add(ViewEvent view, long deadline) {
        Entry entry = new Entry(view.getViewId(), view, deadline);
        Entry previous = byId.put(entry.viewId, entry);
        if (previous != null) {
            byDeadline.remove(previous);
        }
        byDeadline.add(entry);
        byUser.computeIfAbsent(PageViewState.key(view.getUserId()), k -> new LinkedHashSet<>()).add(entry.viewId);
    }

    void remove(String viewId) {
        Entry entry = byId.remove(viewId);
        if (entry == null) {
            return;
        }
        byDeadline.remove(entry);
        String user = PageViewState.key(entry.view.getUserId());
        Set<String> views = byUser.get(user);
        if (views != null) {
            views.remove(viewId);
            if (views.isEmpty()) {
                byUser.remove(user);
            }
        }
    }

    /**
     * Pending views of {@code userId}, oldest arrival first.
     */
    List<ViewEvent> viewsOfUser(String userId) {
        Set<String> ids = byUser.get(PageViewState.key(userId));
        List<ViewEvent> views = new ArrayList<>();
        if (ids != null) {
            for (String id : ids) {
                views.add(byId.get(id).view);
            }
        }
        return views;
    }

    /**
     * Pending views whose deadline is at or before {@code watermark}, earliest first.
     */
    List<ViewEvent> dueBy(long watermark) {
        List<ViewEvent> due = new ArrayList<>();
        for (Entry entry : byDeadline) {
            if (entry.deadline > watermark) {
                break;
            }
            due.add(entry.view);
        }
        return due;
    }

    /** The pending view with the earliest deadline, or {@code null}. */
    ViewEvent oldest() {
        return byDeadline.isEmpty() ? null : byDeadline.first().view;
    }

    int size() {
        return byId.size();
    }

    void clear() {
        byId.clear();
        byDeadline.clear();
        byUser.clear();
    }

    private static final class Entry {
        final String viewId;
        final ViewEvent view;
        final long deadline;

        Entry(String viewId, ViewEvent view, long deadline) {
            this.viewId = viewId;
            this.view = view;
            this.deadline = deadline;
        }
    }
}
