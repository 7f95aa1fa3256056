package org.gamehost.runtime;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;

/**
 * 容器运行时能力接口
 * 生命周期管理与会话网关只依赖此接口，不直接依赖具体引擎客户端
 */
public interface ContainerRuntime {
    
    /**
     * 检查运行时是否可达，不可达时抛出 RuntimeUnavailableException
     */
    void ping();
    
    void pullImage(String image);
    
    /**
     * 创建容器，返回容器ID
     */
    String create(ContainerDescriptor descriptor);
    
    void start(String containerId);
    
    /**
     * 优雅停止，超过 graceSeconds 由运行时强制终止
     *
     * @return false 表示容器本来就已停止
     */
    boolean stop(String containerId, int graceSeconds);
    
    void kill(String containerId);
    
    /**
     * 删除容器定义，不存在时视为成功
     */
    void remove(String containerId, boolean removeVolumes);
    
    /**
     * 查询容器状态，容器不存在时返回 empty
     */
    Optional<ContainerState> inspect(String containerId);
    
    /**
     * 订阅原始资源计数流，关闭返回值即取消订阅
     */
    Closeable stats(String containerId, StreamListener<RawStatsSample> listener);
    
    /**
     * 最近 tailLines 行控制台输出
     */
    List<String> logs(String containerId, int tailLines);
    
    /**
     * 附加到容器主进程的 stdin/stdout/stderr
     */
    ConsoleAttachment attach(String containerId, StreamListener<byte[]> output);
}
