package io.topologycache.models;

import io.topologycache.enums.ResyncSkipReason;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one resync cycle.
 */
@Getter
public class ResyncResult {

    private final String logId;
    private final int dirtyNodes;
    private final boolean aborted;
    private final List<String> flushedNodes = new ArrayList<>();
    private final Map<ResyncSkipReason, Integer> skipped = new EnumMap<>(ResyncSkipReason.class);

    public ResyncResult(String logId, int dirtyNodes, boolean aborted) {
        this.logId = logId;
        this.dirtyNodes = dirtyNodes;
        this.aborted = aborted;
    }

    public static ResyncResult nothingToDo(String logId) {
        return new ResyncResult(logId, 0, false);
    }

    public static ResyncResult aborted(String logId, int dirtyNodes) {
        return new ResyncResult(logId, dirtyNodes, true);
    }

    public void addFlushed(String nodeName) {
        flushedNodes.add(nodeName);
    }

    public void addSkipped(ResyncSkipReason reason) {
        skipped.merge(reason, 1, Integer::sum);
    }

    public int getSkippedCount(ResyncSkipReason reason) {
        return skipped.getOrDefault(reason, 0);
    }

    public List<String> getFlushedNodes() {
        return Collections.unmodifiableList(flushedNodes);
    }

    @Override
    public String toString() {
        return "ResyncResult{logId=" + logId + ", dirty=" + dirtyNodes + ", aborted=" + aborted
                + ", flushed=" + flushedNodes + ", skipped=" + skipped + "}";
    }
}
