package dev.shelfscan.inventory.web;

import dev.shelfscan.inventory.ExternalServiceException;
import dev.shelfscan.inventory.InputValidationException;
import dev.shelfscan.inventory.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InputValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleValidation(InputValidationException exception) {
        LOGGER.info("Rejected request: {}", exception.getMessage());
        return ApiResponse.failure(exception.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleUnreadable(HttpMessageNotReadableException exception) {
        LOGGER.info("Rejected unreadable request body: {}", exception.getMostSpecificCause().getMessage());
        return ApiResponse.failure("Invalid request body");
    }

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ApiResponse<Void> handleNotFound(NotFoundException exception) {
        LOGGER.info("Not found: {}", exception.getMessage());
        return ApiResponse.failure(exception.getMessage());
    }

    @ExceptionHandler(ExternalServiceException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public ApiResponse<Void> handleExternal(ExternalServiceException exception) {
        LOGGER.warn("External service failure: {}", exception.getMessage());
        return ApiResponse.failure(exception.getMessage());
    }
}
