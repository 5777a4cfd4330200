package ir.ipaam.pdflayout.api.advice;

import ir.ipaam.pdflayout.domain.exception.ConstraintViolationException;
import ir.ipaam.pdflayout.domain.exception.SerializationFailureException;
import ir.ipaam.pdflayout.domain.exception.UnbalancedGraphicsStateException;
import lombok.extern.slf4j.Slf4j;
import org.axonframework.commandhandling.CommandExecutionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps layout and serialization failures to problem details.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleInvalidRequest(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return problem(HttpStatus.BAD_REQUEST, "Invalid request", detail);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail handleConstraintViolation(ConstraintViolationException ex) {
        log.warn("Layout rejected: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Layout failed", ex.getMessage());
        if (ex.getWidgetId() != null) {
            problem.setProperty("widget", ex.getWidgetId());
        }
        return problem;
    }

    @ExceptionHandler(UnbalancedGraphicsStateException.class)
    public ProblemDetail handleUnbalanced(UnbalancedGraphicsStateException ex) {
        log.error("Widget left the graphics state unbalanced", ex);
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Paint failed", ex.getMessage());
    }

    @ExceptionHandler(SerializationFailureException.class)
    public ProblemDetail handleSerialization(SerializationFailureException ex) {
        log.error("PDF serialization failed", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Serialization failed", ex.getMessage());
    }

    @ExceptionHandler(CommandExecutionException.class)
    public ProblemDetail handleCommandExecution(CommandExecutionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof IllegalArgumentException illegal) {
            return handleIllegalArgument(illegal);
        }
        if (cause instanceof ConstraintViolationException violation) {
            return handleConstraintViolation(violation);
        }
        if (cause instanceof UnbalancedGraphicsStateException unbalanced) {
            return handleUnbalanced(unbalanced);
        }
        log.error("Command execution failed", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Rendering failed", ex.getMessage());
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return problem;
    }
}
