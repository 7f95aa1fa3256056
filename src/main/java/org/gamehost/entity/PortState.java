package org.gamehost.entity;

/**
 * 端口状态: FREE / RESERVED（已预留，容器未启动） / BOUND（容器已绑定）
 */
public enum PortState {
    FREE,
    RESERVED,
    BOUND
}
