package org.gamehost.service;

import org.gamehost.entity.PortState;

import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * 端口区间的进程内状态表，按 port - rangeMin 下标寻址
 */
public class PortArena {

    private final int rangeMin;
    private final int rangeMax;
    private final AtomicReferenceArray<PortState> states;

    public PortArena(int rangeMin, int rangeMax) {
        if (rangeMin < 1 || rangeMax > 65535 || rangeMin > rangeMax) {
            throw new IllegalArgumentException(
                String.format("端口范围无效: [%d-%d]", rangeMin, rangeMax));
        }
        this.rangeMin = rangeMin;
        this.rangeMax = rangeMax;
        this.states = new AtomicReferenceArray<>(rangeMax - rangeMin + 1);
        for (int i = 0; i < states.length(); i++) {
            states.set(i, PortState.FREE);
        }
    }

    public boolean contains(int port) {
        return port >= rangeMin && port <= rangeMax;
    }

    public PortState stateOf(int port) {
        return states.get(offsetOf(port));
    }

    /**
     * FREE → RESERVED，失败说明该端口正被本进程其他请求检测或持有
     */
    public boolean tryReserve(int port) {
        return states.compareAndSet(offsetOf(port), PortState.FREE, PortState.RESERVED);
    }

    public boolean markBound(int port) {
        return states.compareAndSet(offsetOf(port), PortState.RESERVED, PortState.BOUND);
    }

    public void release(int port) {
        states.set(offsetOf(port), PortState.FREE);
    }

    /**
     * 启动时按持久化记录恢复状态
     */
    public void restore(int port, PortState state) {
        if (contains(port)) {
            states.set(offsetOf(port), state);
        }
    }

    public int countFree() {
        int free = 0;
        for (int i = 0; i < states.length(); i++) {
            if (states.get(i) == PortState.FREE) {
                free++;
            }
        }
        return free;
    }

    public int getRangeMin() {
        return rangeMin;
    }

    public int getRangeMax() {
        return rangeMax;
    }

    private int offsetOf(int port) {
        if (!contains(port)) {
            throw new IllegalArgumentException(
                String.format("端口 %d 不在范围 [%d-%d] 内", port, rangeMin, rangeMax));
        }
        return port - rangeMin;
    }
}
