package org.gamehost.exception;

/**
 * 同一实例已有生命周期操作在执行
 */
public class LifecycleConflictException extends GameHostException {
    
    public static final String ERROR_CODE = "LIFECYCLE_CONFLICT";
    
    public LifecycleConflictException(String instanceId, String operation) {
        super(ERROR_CODE, String.format("实例 %s 正在执行其他操作，拒绝 %s", instanceId, operation));
    }
}
