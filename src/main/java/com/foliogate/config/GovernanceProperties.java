package com.foliogate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-operation-class governance settings, bound from app.governance.
 *
 * <pre>
 * app:
 *   governance:
 *     general-class: user
 *     classes:
 *       "[ai_generation]": { ceiling: 10, window: 1h, failure-policy: FAIL_CLOSED, ledger-mode: BLOCKING, billed: true }
 * </pre>
 *
 * Class names containing underscores must be bracketed in YAML so the binder keeps them verbatim.
 */
@ConfigurationProperties(prefix = "app.governance")
public class GovernanceProperties {

    /**
     * Class every gated invocation must additionally pass, on top of its own class.
     */
    private String generalClass = "user";

    private Map<String, OperationClassPolicy> classes = new LinkedHashMap<>();

    public String getGeneralClass() {
        return generalClass;
    }

    public void setGeneralClass(String generalClass) {
        this.generalClass = generalClass;
    }

    public Map<String, OperationClassPolicy> getClasses() {
        return classes;
    }

    public void setClasses(Map<String, OperationClassPolicy> classes) {
        this.classes = classes;
    }

    /**
     * Looks up the policy of a configured class.
     * @throws IllegalArgumentException if the class is not configured
     */
    public OperationClassPolicy policyFor(String operationClass) {
        OperationClassPolicy policy = classes.get(operationClass);
        if (policy == null) {
            throw new IllegalArgumentException("Unknown operation class: " + operationClass);
        }
        return policy;
    }

    public enum FailurePolicy {
        /** Deny when limiter state cannot be read or written. */
        FAIL_CLOSED,
        /** Allow when limiter state cannot be read or written. */
        FAIL_OPEN
    }

    public enum LedgerMode {
        /** Ledger write must succeed before a successful result is released. */
        BLOCKING,
        /** Ledger write is handed to the background writer with retries. */
        ASYNC
    }

    public static class OperationClassPolicy {

        private int ceiling = 100;
        private Duration window = Duration.ofHours(1);
        private FailurePolicy failurePolicy = FailurePolicy.FAIL_CLOSED;
        private LedgerMode ledgerMode = LedgerMode.BLOCKING;
        private boolean billed;

        public OperationClassPolicy() {
        }

        public OperationClassPolicy(int ceiling, Duration window, FailurePolicy failurePolicy,
                                    LedgerMode ledgerMode, boolean billed) {
            this.ceiling = ceiling;
            this.window = window;
            this.failurePolicy = failurePolicy;
            this.ledgerMode = ledgerMode;
            this.billed = billed;
        }

        public int getCeiling() {
            return ceiling;
        }

        public void setCeiling(int ceiling) {
            this.ceiling = ceiling;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public FailurePolicy getFailurePolicy() {
            return failurePolicy;
        }

        public void setFailurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
        }

        public LedgerMode getLedgerMode() {
            return ledgerMode;
        }

        public void setLedgerMode(LedgerMode ledgerMode) {
            this.ledgerMode = ledgerMode;
        }

        public boolean isBilled() {
            return billed;
        }

        public void setBilled(boolean billed) {
            this.billed = billed;
        }
    }
}
