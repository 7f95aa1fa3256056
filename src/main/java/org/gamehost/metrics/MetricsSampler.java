package org.gamehost.metrics;

import lombok.extern.slf4j.Slf4j;
import org.gamehost.exception.StreamDetachException;
import org.gamehost.runtime.ContainerRuntime;
import org.gamehost.runtime.RawStatsSample;
import org.gamehost.runtime.StreamListener;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 资源监控采样服务
 * 每个实例只向运行时订阅一条原始流，归一化、限流后分发给所有订阅者
 */
@Slf4j
@Service
public class MetricsSampler {

    private final ContainerRuntime containerRuntime;
    private final Map<String, InstanceFeed> feeds = new ConcurrentHashMap<>();
    private final Object feedLock = new Object();
    private volatile Duration interval;

    public MetricsSampler(ContainerRuntime containerRuntime,
                          @Value("${gamehost.stream.metrics-interval-ms:1000}") long intervalMillis) {
        this.containerRuntime = containerRuntime;
        this.interval = Duration.ofMillis(intervalMillis);
    }

    /**
     * 设置发送间隔，已有订阅立即生效
     */
    public void throttle(Duration newInterval) {
        if (newInterval == null || newInterval.isNegative() || newInterval.isZero()) {
            throw new IllegalArgumentException("限流间隔必须为正数: " + newInterval);
        }
        this.interval = newInterval;
        feeds.values().forEach(feed -> feed.limiter = new FixedWindowRateLimiter(newInterval));
        log.info("监控发送间隔调整为 {} ms", newInterval.toMillis());
    }

    public Duration getInterval() {
        return interval;
    }

    /**
     * 订阅实例的归一化资源样本，首个订阅者触发运行时原始流的订阅
     */
    public MetricsSubscription subscribe(String instanceId, String containerId, MetricsListener listener) {
        synchronized (feedLock) {
            InstanceFeed feed = feeds.get(instanceId);
            if (feed == null) {
                feed = new InstanceFeed(instanceId, new FixedWindowRateLimiter(interval));
                feeds.put(instanceId, feed);
                try {
                    feed.upstream = containerRuntime.stats(containerId, feed);
                } catch (RuntimeException e) {
                    feeds.remove(instanceId, feed);
                    throw e;
                }
                if (feeds.get(instanceId) != feed) {
                    // 订阅过程中上游已结束
                    closeUpstream(feed);
                    throw new StreamDetachException("实例资源流已结束: " + instanceId);
                }
                log.info("开始采集实例资源: instanceId={}, containerId={}", instanceId, containerId);
            }
            FeedSubscription subscription = new FeedSubscription(feed, listener);
            feed.subscribers.add(subscription);
            return subscription;
        }
    }

    public int activeFeedCount() {
        return feeds.size();
    }

    public int subscriberCount(String instanceId) {
        InstanceFeed feed = feeds.get(instanceId);
        return feed == null ? 0 : feed.subscribers.size();
    }

    private void unsubscribe(FeedSubscription subscription) {
        InstanceFeed feed = subscription.feed;
        synchronized (feedLock) {
            feed.subscribers.remove(subscription);
            if (feed.subscribers.isEmpty() && feeds.remove(feed.instanceId, feed)) {
                log.info("最后一个订阅者断开，停止采集: instanceId={}", feed.instanceId);
                closeUpstream(feed);
            }
        }
    }

    private void detachFeed(InstanceFeed feed, Throwable cause) {
        List<FeedSubscription> subscribers;
        synchronized (feedLock) {
            if (!feeds.remove(feed.instanceId, feed)) {
                return;
            }
            subscribers = new ArrayList<>(feed.subscribers);
            feed.subscribers.clear();
            closeUpstream(feed);
        }
        for (FeedSubscription subscription : subscribers) {
            subscription.closed.set(true);
            subscription.listener.onDetach(cause);
        }
    }

    private void closeUpstream(InstanceFeed feed) {
        if (feed.upstream == null) {
            return;
        }
        try {
            feed.upstream.close();
        } catch (IOException e) {
            log.debug("关闭资源流失败: instanceId={}", feed.instanceId, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        for (InstanceFeed feed : new ArrayList<>(feeds.values())) {
            detachFeed(feed, null);
        }
    }

    private class InstanceFeed implements StreamListener<RawStatsSample> {

        private final String instanceId;
        private final List<FeedSubscription> subscribers = new CopyOnWriteArrayList<>();
        private volatile RateLimiter limiter;
        private volatile Closeable upstream;
        private RawStatsSample previous;

        InstanceFeed(String instanceId, RateLimiter limiter) {
            this.instanceId = instanceId;
            this.limiter = limiter;
        }

        @Override
        public void onNext(RawStatsSample sample) {
            MetricsSample normalized;
            synchronized (this) {
                RawStatsSample last = previous;
                // 基线随每个原始样本推进，被丢弃的样本同样参与差值计算
                previous = sample;
                if (!limiter.tryAcquire()) {
                    return;
                }
                normalized = StatsNormalizer.normalize(instanceId, sample, last, System.currentTimeMillis());
            }
            for (FeedSubscription subscription : subscribers) {
                subscription.listener.onSample(normalized);
            }
        }

        @Override
        public void onError(Throwable throwable) {
            log.warn("资源流异常: instanceId={}, error={}", instanceId, throwable.getMessage());
            detachFeed(this, throwable);
        }

        @Override
        public void onComplete() {
            log.info("资源流结束: instanceId={}", instanceId);
            detachFeed(this, null);
        }
    }

    private class FeedSubscription implements MetricsSubscription {

        private final InstanceFeed feed;
        private final MetricsListener listener;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        FeedSubscription(InstanceFeed feed, MetricsListener listener) {
            this.feed = feed;
            this.listener = listener;
        }

        @Override
        public String getInstanceId() {
            return feed.instanceId;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                unsubscribe(this);
            }
        }
    }
}
