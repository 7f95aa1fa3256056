package org.gamehost.metrics;

/**
 * 监控样本接收方，实现不得阻塞
 */
public interface MetricsListener {
    
    void onSample(MetricsSample sample);
    
    /**
     * 上游资源流结束或出错，cause 为 null 表示正常结束
     */
    void onDetach(Throwable cause);
}
