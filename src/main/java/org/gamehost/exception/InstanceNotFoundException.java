package org.gamehost.exception;

/**
 * 实例不存在异常
 */
public class InstanceNotFoundException extends GameHostException {
    
    public static final String ERROR_CODE = "INSTANCE_NOT_FOUND";
    
    public InstanceNotFoundException(String instanceId) {
        super(ERROR_CODE, "实例不存在: " + instanceId);
    }
}
