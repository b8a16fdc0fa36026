package com.reportwheel.core.spi.failure;

import com.reportwheel.model.ctx.FailureContext;
import lombok.Getter;

/**
 * 失败判定器 按异常类型给出决策
 */
public interface FailureDecider {

    Decision decide(Throwable t, FailureContext ctx);

    @Getter
    final class Decision {
        private final Outcome outcome;
        private final Category category;
        private final String code;
        private final String message;

        private Decision(Outcome o, Category c, String code, String msg) {
            this.outcome = o; this.category = c; this.code = code; this.message = msg;
        }
        public static Decision of(Outcome o, Category c) { return new Decision(o, c, null, null); }
        public Decision withCode(String code){ return new Decision(outcome, category, code, message); }
        public Decision withMsg(String msg){ return new Decision(outcome, category, code, msg); }

        public boolean retryable() { return outcome == Outcome.RETRY; }
    }

    enum Outcome { RETRY, FAILED }

    enum Category { OPEN_CIRCUIT, RATE_LIMITED, BULKHEAD_FULL, TIMEOUT, ORPHANED, CONFIG, COLLABORATOR, UNKNOWN }
}
