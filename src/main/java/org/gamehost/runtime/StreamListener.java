package org.gamehost.runtime;

/**
 * 运行时流回调
 */
public interface StreamListener<T> {
    
    void onNext(T item);
    
    void onError(Throwable throwable);
    
    void onComplete();
}
