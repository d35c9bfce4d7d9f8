package com.shopstream.checkpoint;

import com.shopstream.state.StateSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to resume the pipeline: where every source stopped reading, the
 * watermarks, the keyed state and the outputs still on their way to the sink.
 *
 * <p>Captured as one unit on the evaluation thread, so offsets and state always describe
 * the same instant.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Checkpoint {

    private long version;
    private long createdAt;

    /** source → partition → next offset to read. */
    @Builder.Default
    private Map<String, Map<Integer, Long>> offsets = new HashMap<>();

    @Builder.Default
    private Map<String, Long> sourceWatermarks = new HashMap<>();

    private long globalWatermark;

    @Builder.Default
    private StateSnapshot state = StateSnapshot.empty();

    /** Outputs emitted but not yet acknowledged by the sink writer. */
    @Builder.Default
    private List<Object> pendingOutputs = new ArrayList<>();
}
