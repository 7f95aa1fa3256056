package org.gamehost.socket;

/**
 * 会话类型
 */
public enum SessionKind {
    
    /**
     * 双向控制台：容器输出推送给客户端，客户端输入写入容器 stdin
     */
    CONSOLE,
    
    /**
     * 只读资源监控
     */
    METRICS
}
