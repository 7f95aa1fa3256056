package org.gamehost.exception;

/**
 * 上游流意外断开，需要客户端手动重连
 */
public class StreamDetachException extends GameHostException {
    
    public static final String ERROR_CODE = "STREAM_DETACH";
    
    public StreamDetachException(String message) {
        super(ERROR_CODE, message);
    }
    
    public StreamDetachException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
