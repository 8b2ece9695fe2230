package com.fhi.dog_shelter.api.exception;

import java.util.Map;

import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.fhi.dog_shelter.service.exception.dog.DogNotFoundException;

import lombok.extern.slf4j.Slf4j;


/**
 * Translates exceptions escaping the controllers into the API's JSON error body:
 * <pre>
 *   {"error": "..."}
 * </pre>
 *
 * Lives in the api layer rather than next to the exceptions it handles: the service layer
 * knows nothing about HTTP status codes or response shapes.
 *
 * Only the cases below are handled here. Everything else (unmatched routes, type
 * mismatches) is left to Spring MVC's own resolvers.
 */
@RestControllerAdvice
@Slf4j
public class DogShelterExceptionHandler
{
    static final String ERROR_KEY = "error";
    static final String INTERNAL_ERROR_MESSAGE = "Internal server error";


    @ExceptionHandler(DogNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleDogNotFound(DogNotFoundException ex)
    {
        log.debug("{}", ex.toString());
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }


   /**
    * Storage or connection failure. The cause is logged, the client only gets a generic message.
    *
    * When the database is unreachable, opening the service's read-only transaction already fails
    * with a {@link TransactionException} (e.g. CannotCreateTransactionException) before any
    * repository call could raise a {@link DataAccessException}.
    */
    @ExceptionHandler({ DataAccessException.class, TransactionException.class })
    public ResponseEntity<Map<String, String>> handleStorageFailure(RuntimeException ex)
    {
        log.error("Storage failure while serving request", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR_MESSAGE);
    }


    private ResponseEntity<Map<String, String>> error(HttpStatus status, String message)
    {
        return ResponseEntity.status(status).body(Map.of(ERROR_KEY, message));
    }
}
