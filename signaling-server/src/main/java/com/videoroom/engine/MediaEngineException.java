package com.videoroom.engine;

/**
 * 미디어 엔진 호출 실패를 표현하는 런타임 예외.
 */
public class MediaEngineException extends RuntimeException {

    public MediaEngineException(String message) {
        super(message);
    }

    public MediaEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
