package org.gamehost.entity;

/**
 * 实例状态
 * REQUESTED → PROVISIONING → RUNNING → {STOPPING → STOPPED, FAILED} → DESTROYED
 */
public enum InstanceStatus {
    
    REQUESTED,
    PROVISIONING,
    RUNNING,
    STOPPING,
    STOPPED,
    FAILED,
    DESTROYED;
    
    /**
     * 是否处于占用端口的活动期（PROVISIONING 到 STOPPED）
     */
    public boolean holdsPort() {
        return this == PROVISIONING || this == RUNNING || this == STOPPING || this == STOPPED;
    }
    
    public boolean isTerminal() {
        return this == FAILED || this == DESTROYED;
    }
}
