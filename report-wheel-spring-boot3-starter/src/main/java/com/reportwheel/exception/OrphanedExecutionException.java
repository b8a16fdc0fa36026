package com.reportwheel.exception;

/**
 * 进程崩溃遗留的 running 执行, 按可重试失败处理
 */
public class OrphanedExecutionException extends CollaboratorFailureException {

    public static final String REASON = "orphaned: no heartbeat since restart";

    public OrphanedExecutionException() {
        super("ORPHANED", REASON, true, null);
    }
}
