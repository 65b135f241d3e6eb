package com.rcmp.marketplace.exception;

/**
 * Exception thrown when the payment processor is unreachable, times out or
 * rejects a request. No local state has been changed when this is thrown,
 * so the caller may retry.
 *
 * @author Marketplace Team
 */
public class PaymentProcessorException extends RuntimeException {

    private final Integer processorStatus;

    public PaymentProcessorException(String message) {
        super(message);
        this.processorStatus = null;
    }

    public PaymentProcessorException(String message, Throwable cause) {
        super(message, cause);
        this.processorStatus = null;
    }

    public PaymentProcessorException(String message, Integer processorStatus, Throwable cause) {
        super(message, cause);
        this.processorStatus = processorStatus;
    }

    /**
     * HTTP status returned by the processor, if it answered at all.
     *
     * @return Status code or null
     */
    public Integer getProcessorStatus() {
        return processorStatus;
    }
}
