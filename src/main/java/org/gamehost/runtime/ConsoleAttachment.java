package org.gamehost.runtime;

import java.io.Closeable;
import java.io.IOException;

/**
 * 容器标准输入输出的一次附加，关闭即释放上游流
 */
public interface ConsoleAttachment extends Closeable {
    
    /**
     * 写入容器 stdin，按调用顺序送达
     */
    void write(byte[] input) throws IOException;
}
