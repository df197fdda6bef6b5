package com.questrail.mesh.observability;

import com.questrail.mesh.model.FragmentId;
import com.questrail.mesh.model.PeerId;

import java.time.Instant;

/**
 * Observability events emitted by the fragmentation engine.
 */
public sealed interface ReassemblyEvent
        permits ReassemblyEvent.FragmentsCreated,
                ReassemblyEvent.GroupCompleted,
                ReassemblyEvent.GroupsExpired,
                ReassemblyEvent.FragmentDropped
{
    Instant timestamp();

    /** Why an inbound fragment was discarded. */
    enum DropReason {
        NOT_A_FRAGMENT,
        MALFORMED,
        ALREADY_COMPLETED,
        INCONSISTENT_TOTAL,
        /** The fragment claims its original packet was itself a fragment. */
        NESTED_FRAGMENT
    }

    /** An outbound packet was split. */
    record FragmentsCreated(Instant timestamp,
                            FragmentId fragmentId,
                            PeerId sender,
                            int fragmentCount,
                            int payloadLength) implements ReassemblyEvent {}

    /** A reassembly group completed and was delivered. */
    record GroupCompleted(Instant timestamp,
                          FragmentId fragmentId,
                          PeerId sender,
                          int totalFragments,
                          int payloadLength) implements ReassemblyEvent {}

    /** An expiry sweep discarded incomplete groups. */
    record GroupsExpired(Instant timestamp, int count) implements ReassemblyEvent {}

    /** An inbound fragment was dropped without touching state. */
    record FragmentDropped(Instant timestamp,
                           PeerId sender,
                           DropReason reason) implements ReassemblyEvent {}
}
