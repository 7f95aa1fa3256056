package org.gamehost.exception;

/**
 * 容器运行时（Docker 守护进程）不可达
 */
public class RuntimeUnavailableException extends GameHostException {
    
    public static final String ERROR_CODE = "RUNTIME_UNAVAILABLE";
    
    public RuntimeUnavailableException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
