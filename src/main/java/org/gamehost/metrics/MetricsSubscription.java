package org.gamehost.metrics;

import java.io.Closeable;

/**
 * 监控订阅句柄，关闭即退订
 */
public interface MetricsSubscription extends Closeable {
    
    String getInstanceId();
    
    @Override
    void close();
}
