package org.maptracker.merge.interaction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.maptracker.merge.tile.AlignDirection;

/**
 * Interaction port that answers with prepared responses and records every request it receives.
 * Tiles without a prepared direction keep their suggested direction and
 * groups without a prepared barrier are not split.
 */
public class ScriptedInteractionPort
        implements InteractionPort {

    private final Map<String, AlignDirection> tileFileNameToDirection;
    private final Map<String, BarrierResponse> groupKeyToBarrier;
    private final List<AlignmentRequest> alignmentRequests;
    private final List<BarrierRequest> barrierRequests;

    public ScriptedInteractionPort() {
        this.tileFileNameToDirection = new HashMap<>();
        this.groupKeyToBarrier = new HashMap<>();
        this.alignmentRequests = new ArrayList<>();
        this.barrierRequests = new ArrayList<>();
    }

    public ScriptedInteractionPort withAlignment(final String tileFileName,
                                                 final AlignDirection direction) {
        tileFileNameToDirection.put(tileFileName, direction);
        return this;
    }

    public ScriptedInteractionPort withBarrier(final String groupKey,
                                               final BarrierResponse response) {
        groupKeyToBarrier.put(groupKey, response);
        return this;
    }

    @Override
    public AlignDirection resolveAlignment(final AlignmentRequest request) {
        alignmentRequests.add(request);
        final AlignDirection direction = tileFileNameToDirection.get(request.getTile().getFileName());
        return direction == null ? request.getTile().getAlignment().getDirection() : direction;
    }

    @Override
    public BarrierResponse collectBarrier(final BarrierRequest request) {
        barrierRequests.add(request);
        return groupKeyToBarrier.getOrDefault(request.getGroupKey(), BarrierResponse.skip());
    }

    public List<AlignmentRequest> getAlignmentRequests() {
        return alignmentRequests;
    }

    public List<BarrierRequest> getBarrierRequests() {
        return barrierRequests;
    }

}
