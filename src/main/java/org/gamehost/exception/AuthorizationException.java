package org.gamehost.exception;

/**
 * 认证或归属校验失败
 */
public class AuthorizationException extends GameHostException {
    
    public static final String ERROR_CODE_AUTHENTICATION_FAILED = "AUTHENTICATION_FAILED";
    public static final String ERROR_CODE_ACCESS_DENIED = "ACCESS_DENIED";
    
    public AuthorizationException(String errorCode, String message) {
        super(errorCode, message);
    }
    
    public AuthorizationException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
    
    public boolean isAuthenticationFailure() {
        return ERROR_CODE_AUTHENTICATION_FAILED.equals(getErrorCode());
    }
}
