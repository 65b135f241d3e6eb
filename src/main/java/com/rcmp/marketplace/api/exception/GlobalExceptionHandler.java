package com.rcmp.marketplace.api.exception;

import com.rcmp.marketplace.api.dto.ErrorResponse;
import com.rcmp.marketplace.exception.*;
import com.rcmp.marketplace.infrastructure.metrics.MarketplaceMetricsService;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the marketplace API.
 * Maps domain exceptions to HTTP statuses and the common {@link ErrorResponse} body.
 *
 * @author Marketplace Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final MarketplaceMetricsService metricsService;

    public GlobalExceptionHandler(MarketplaceMetricsService metricsService) {
        this.metricsService = metricsService;
    }

    /**
     * Handle ResourceNotFoundException.
     * Returns 404 NOT FOUND when a listing or account doesn't exist.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.NOT_FOUND.value(),
                ex.getResourceType() + " Not Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("resourceType", ex.getResourceType());
        error.addDetail("resourceId", ex.getResourceId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Handle ListingAlreadySoldException.
     * Returns 409 CONFLICT when checkout is attempted on a sold listing.
     */
    @ExceptionHandler(ListingAlreadySoldException.class)
    public ResponseEntity<ErrorResponse> handleListingAlreadySoldException(
            ListingAlreadySoldException ex,
            HttpServletRequest request
    ) {
        logger.warn("Listing already sold: {}", ex.getListingId());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.CONFLICT.value(),
                "Already Sold",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("listingId", ex.getListingId());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle SellerNotPayableException.
     * Returns 422 UNPROCESSABLE ENTITY when the seller cannot receive the payout.
     */
    @ExceptionHandler(SellerNotPayableException.class)
    public ResponseEntity<ErrorResponse> handleSellerNotPayableException(
            SellerNotPayableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Seller not payable: listing {}, seller {}", ex.getListingId(), ex.getSellerId());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.UNPROCESSABLE_ENTITY.value(),
                "Seller Not Payable",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("listingId", ex.getListingId());

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }

    /**
     * Handle InvalidSignatureException.
     * Returns 400 BAD REQUEST with a generic message; the reason stays in the logs.
     */
    @ExceptionHandler(InvalidSignatureException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSignatureException(
            InvalidSignatureException ex,
            HttpServletRequest request
    ) {
        logger.warn("Rejected webhook delivery: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST,
                "Invalid signature",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle PaymentProcessorException.
     * Returns 502 BAD GATEWAY when the processor failed or could not be reached.
     */
    @ExceptionHandler(PaymentProcessorException.class)
    public ResponseEntity<ErrorResponse> handlePaymentProcessorException(
            PaymentProcessorException ex,
            HttpServletRequest request
    ) {
        logger.error("Payment processor error: {}", ex.getMessage(), ex);
        metricsService.recordError("PAYMENT_PROCESSOR_ERROR", "createCheckout");

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_GATEWAY.value(),
                "Payment Processor Error",
                "The payment processor could not create a checkout session. Please try again later.",
                request.getRequestURI()
        );
        error.addDetail("processorStatus", ex.getProcessorStatus());

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error);
    }

    /**
     * Handle InvalidResetTokenException.
     * Returns 400 BAD REQUEST; expired, forged and used tokens are indistinguishable.
     */
    @ExceptionHandler(InvalidResetTokenException.class)
    public ResponseEntity<ErrorResponse> handleInvalidResetTokenException(
            InvalidResetTokenException ex,
            HttpServletRequest request
    ) {
        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, ex.getMessage(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle UsernameAlreadyExistsException.
     * Returns 409 CONFLICT.
     */
    @ExceptionHandler(UsernameAlreadyExistsException.class)
    public ResponseEntity<ErrorResponse> handleUsernameAlreadyExistsException(
            UsernameAlreadyExistsException ex,
            HttpServletRequest request
    ) {
        ErrorResponse error = new ErrorResponse(
                HttpStatus.CONFLICT.value(),
                "Username Taken",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle InvalidCredentialsException.
     * Returns 401 UNAUTHORIZED.
     */
    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCredentialsException(
            InvalidCredentialsException ex,
            HttpServletRequest request
    ) {
        ErrorResponse error = ErrorResponse.of(HttpStatus.UNAUTHORIZED, ex.getMessage(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(error);
    }

    /**
     * Handle NotificationDeliveryException.
     * Returns 502 BAD GATEWAY when the reset link could not be handed off.
     */
    @ExceptionHandler(NotificationDeliveryException.class)
    public ResponseEntity<ErrorResponse> handleNotificationDeliveryException(
            NotificationDeliveryException ex,
            HttpServletRequest request
    ) {
        logger.error("Notification delivery failed: {}", ex.getMessage(), ex);
        metricsService.recordError("NOTIFICATION_DELIVERY_ERROR", "forgotPassword");

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_GATEWAY.value(),
                "Notification Delivery Failed",
                "The reset link could not be sent. Please try again later.",
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error);
    }

    /**
     * Handle AccessDeniedException from ownership checks.
     * Returns 403 FORBIDDEN.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Access denied: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.FORBIDDEN, ex.getMessage(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    /**
     * Handle IllegalArgumentException.
     * Returns 400 BAD REQUEST for invalid arguments.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal argument: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Invalid Argument",
                ex.getMessage(),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle unreadable request bodies (malformed JSON, wrong types).
     * Returns 400 BAD REQUEST.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Unreadable request body on {}", request.getRequestURI());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST,
                "Request body is missing or malformed",
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Failed",
                "Request validation failed. Please check the field errors.",
                request.getRequestURI()
        );
        error.addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR without internal detail.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);
        metricsService.recordError(ex.getClass().getSimpleName(), "api");

        ErrorResponse error = new ErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "An unexpected error occurred. Please try again later.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
