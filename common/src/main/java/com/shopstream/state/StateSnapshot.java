package com.shopstream.state;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of every table of a {@link KeyedStateStore}.
 *
 * <p>Maps and lists are private copies; the records themselves are shared with the store,
 * which never mutates a record after it has been stored.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StateSnapshot {

    /** dimension name → key → latest record. */
    private Map<String, Map<String, Object>> dimensions = new HashMap<>();

    /** fact buffer name → key → facts in arrival order. */
    private Map<String, Map<String, List<Object>>> facts = new HashMap<>();

    public static StateSnapshot empty() {
        return new StateSnapshot();
    }
}
