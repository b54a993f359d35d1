package com.cbcluster.orchestrator.cluster;

import com.cbcluster.common.model.ServerNode;

/**
 * Outcome of joining one node.
 *
 * @param added   whether the node was added by this join, as opposed to already being a member
 * @param failure why the join failed, {@code null} on success
 */
public record JoinResult(ServerNode node, boolean added, Throwable failure) {

    public static JoinResult added(ServerNode node) {
        return new JoinResult(node, true, null);
    }

    public static JoinResult alreadyMember(ServerNode node) {
        return new JoinResult(node, false, null);
    }

    public static JoinResult failed(ServerNode node, Throwable failure) {
        return new JoinResult(node, false, failure);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
