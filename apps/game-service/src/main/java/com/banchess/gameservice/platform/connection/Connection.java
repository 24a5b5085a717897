package com.banchess.gameservice.platform.connection;

import com.banchess.gameservice.games.banchess.domain.enums.SeatRole;
import com.banchess.gameservice.games.banchess.domain.model.Identity;

/**
 * 一条传输连接的状态。
 * 可变字段只在持有该对象监视器时修改（同一连接的 attach/detach 串行）。
 */
public class Connection {

    private final String id;
    private final long openedAt;
    private volatile Identity identity;
    private volatile String attachedSessionId;
    private volatile SeatRole role;

    public Connection(String id, long openedAt) {
        this.id = id;
        this.openedAt = openedAt;
    }

    public String id() {
        return id;
    }

    public long openedAt() {
        return openedAt;
    }

    public Identity identity() {
        return identity;
    }

    void identity(Identity identity) {
        this.identity = identity;
    }

    public boolean isAuthenticated() {
        return identity != null;
    }

    public String attachedSessionId() {
        return attachedSessionId;
    }

    public SeatRole role() {
        return role;
    }

    void attach(String sessionId, SeatRole role) {
        this.attachedSessionId = sessionId;
        this.role = role;
    }

    void detach() {
        this.attachedSessionId = null;
        this.role = null;
    }
}
