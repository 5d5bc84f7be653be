package com.auditflow.core.framework;

/**
 * 프로세스 종료급 신호. run() 의 장벽에서 잡히지 않고 그대로 전파되며 cleanUp 도 건너뛴다.
 */
public class FatalScanError extends Error {
    public FatalScanError(String message) {
        super(message);
    }

    public FatalScanError(String message, Throwable cause) {
        super(message, cause);
    }
}
