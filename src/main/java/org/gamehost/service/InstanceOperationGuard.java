package org.gamehost.service;

import lombok.extern.slf4j.Slf4j;
import org.gamehost.exception.LifecycleConflictException;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 实例级互斥：同一实例同一时刻只允许一个生命周期操作，冲突立即拒绝而不是排队
 */
@Slf4j
@Component
public class InstanceOperationGuard {

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public <T> T call(String instanceId, String operation, Supplier<T> action) {
        if (!inFlight.add(instanceId)) {
            log.warn("拒绝并发操作: instanceId={}, operation={}", instanceId, operation);
            throw new LifecycleConflictException(instanceId, operation);
        }
        try {
            return action.get();
        } finally {
            inFlight.remove(instanceId);
        }
    }

    /**
     * 空闲时执行，忙碌时直接跳过
     *
     * @return 是否执行了 action
     */
    public boolean tryRun(String instanceId, Runnable action) {
        if (!inFlight.add(instanceId)) {
            return false;
        }
        try {
            action.run();
            return true;
        } finally {
            inFlight.remove(instanceId);
        }
    }

    public boolean isBusy(String instanceId) {
        return inFlight.contains(instanceId);
    }
}
