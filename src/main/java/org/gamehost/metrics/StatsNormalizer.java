package org.gamehost.metrics;

import org.gamehost.runtime.RawStatsSample;

/**
 * 将运行时累计计数转换为瞬时使用率
 */
public final class StatsNormalizer {

    private StatsNormalizer() {
    }

    /**
     * cpuPercent = (cpuDelta / systemDelta) * onlineCpus * 100，保留一位小数。
     * 没有上一个样本或差值不为正时返回 0。
     */
    public static double cpuPercent(RawStatsSample sample, RawStatsSample previous) {
        if (sample == null || previous == null) {
            return 0.0;
        }
        long cpuDelta = sample.getCpuTotalUsage() - previous.getCpuTotalUsage();
        long systemDelta = sample.getSystemCpuUsage() - previous.getSystemCpuUsage();
        if (systemDelta <= 0 || cpuDelta <= 0) {
            return 0.0;
        }
        int cores = sample.getOnlineCpus() > 0 ? sample.getOnlineCpus() : 1;
        double percent = ((double) cpuDelta / systemDelta) * cores * 100.0;
        return Math.round(percent * 10.0) / 10.0;
    }

    public static MetricsSample normalize(String instanceId, RawStatsSample sample,
                                          RawStatsSample previous, long timestamp) {
        return new MetricsSample(
            instanceId,
            cpuPercent(sample, previous),
            sample.getMemoryUsage(),
            sample.getMemoryLimit(),
            timestamp);
    }
}
