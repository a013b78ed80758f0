package com.dishdash.order.controller;

import com.dishdash.order.domain.Actor;
import com.dishdash.order.domain.ActorRole;

/**
 * Identity is established upstream; the gateway forwards the acting party in these headers.
 */
final class ActorHeaders {

    static final String ROLE = "X-Actor-Role";
    static final String ID = "X-Actor-Id";
    static final String NAME = "X-Actor-Name";
    static final String PHONE = "X-Actor-Phone";

    private ActorHeaders() {
    }

    static Actor toActor(String role, String id, String name, String phone) {
        return new Actor(ActorRole.fromWireName(role), id, name, phone);
    }
}
