package com.csveditor.app.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Catches editor exceptions from anywhere in the controllers or services,
 * returning error JSON with a 4xx/5xx code.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException ex) {
        ErrorResponse error = new ErrorResponse("SESSION_NOT_FOUND", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(GridIndexOutOfBoundsException.class)
    public ResponseEntity<ErrorResponse> handleIndexOutOfBounds(GridIndexOutOfBoundsException ex) {
        ErrorResponse error = new ErrorResponse("INDEX_OUT_OF_BOUNDS", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidGridException.class)
    public ResponseEntity<ErrorResponse> handleInvalidGrid(InvalidGridException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_GRID", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidPositionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPosition(InvalidPositionException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_POSITION", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(TransformInProgressException.class)
    public ResponseEntity<ErrorResponse> handleTransformInProgress(TransformInProgressException ex) {
        ErrorResponse error = new ErrorResponse("TRANSFORM_IN_PROGRESS", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(StaleSnapshotException.class)
    public ResponseEntity<ErrorResponse> handleStaleSnapshot(StaleSnapshotException ex) {
        ErrorResponse error = new ErrorResponse("STALE_SNAPSHOT", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(GridTransformException.class)
    public ResponseEntity<ErrorResponse> handleTransformFailed(GridTransformException ex) {
        ErrorResponse error = new ErrorResponse("TRANSFORM_FAILED", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        log.error("Unhandled editor error", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
