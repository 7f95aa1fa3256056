package org.gamehost.metrics;

/**
 * 限流器：判断当前时刻是否允许发出一次事件
 */
public interface RateLimiter {
    
    /**
     * 允许时返回 true 并占用当前窗口，否则事件应被丢弃
     */
    boolean tryAcquire();
}
