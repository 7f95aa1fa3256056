package org.gamehost.exception;

/**
 * 容器操作异常
 */
public class ContainerException extends GameHostException {
    
    public static final String ERROR_CODE_CREATE_FAILED = "CONTAINER_CREATE_FAILED";
    public static final String ERROR_CODE_START_FAILED = "CONTAINER_START_FAILED";
    public static final String ERROR_CODE_STOP_FAILED = "CONTAINER_STOP_FAILED";
    public static final String ERROR_CODE_NOT_FOUND = "CONTAINER_NOT_FOUND";
    public static final String ERROR_CODE_NOT_RUNNING = "CONTAINER_NOT_RUNNING";
    public static final String ERROR_CODE_STARTUP_TIMEOUT = "CONTAINER_STARTUP_TIMEOUT";
    public static final String ERROR_CODE_INVALID_STATE = "INSTANCE_INVALID_STATE";
    
    public ContainerException(String errorCode, String message) {
        super(errorCode, message);
    }
    
    public ContainerException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
