package org.gamehost.exception;

/**
 * 托管核心异常基类
 */
public class GameHostException extends RuntimeException {
    
    private String errorCode;
    
    public GameHostException(String message) {
        super(message);
    }
    
    public GameHostException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public GameHostException(String message, Throwable cause) {
        super(message, cause);
    }
    
    public GameHostException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
