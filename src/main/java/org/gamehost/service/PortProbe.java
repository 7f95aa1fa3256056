package org.gamehost.service;

/**
 * 操作系统层面的端口占用检测
 */
public interface PortProbe {
    
    /**
     * 端口当前可以被绑定时返回 true
     */
    boolean isAvailable(int port);
}
