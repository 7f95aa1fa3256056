package org.gamehost.exception;

/**
 * 端口管理异常
 */
public class PortException extends GameHostException {
    
    public static final String ERROR_CODE_PORTS_EXHAUSTED = "PORTS_EXHAUSTED";
    public static final String ERROR_CODE_PORT_RELEASE_FAILED = "PORT_RELEASE_FAILED";
    public static final String ERROR_CODE_INVALID_RANGE = "PORT_RANGE_INVALID";
    
    public PortException(String errorCode, String message) {
        super(errorCode, message);
    }
    
    public PortException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
