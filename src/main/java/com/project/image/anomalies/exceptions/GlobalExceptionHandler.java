package com.project.image.anomalies.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import jakarta.validation.ConstraintViolationException;
import java.io.IOException;

@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({StorageException.class, AnomalyDetectionException.class})
    public String handleDomainExceptions(RuntimeException ex, Model model) {
        log.warn("Domain error: {}", ex.getMessage());
        model.addAttribute("error", ex.getMessage());
        return "detect";
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public String handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex, Model model) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        model.addAttribute("error", "Качените файлове са твърде големи. Максимален размер на заявката: 100MB");
        return "detect";
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
    public String handleValidationErrors(Exception ex, Model model) {
        log.warn("Validation error: {}", ex.getMessage());
        model.addAttribute("error", "Невалидни параметри. Моля проверете въведените данни.");
        return "detect";
    }

    @ExceptionHandler(IOException.class)
    public String handleIOException(IOException ex, Model model) {
        log.error("IO error occurred", ex);
        model.addAttribute("error", "Грешка при четенето на файловете. Моля опитайте отново.");
        return "detect";
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public String handleIllegalArgument(IllegalArgumentException ex, Model model) {
        log.warn("Invalid argument: {}", ex.getMessage());
        model.addAttribute("error", "Невалидни параметри: " + ex.getMessage());
        return "detect";
    }

    @ExceptionHandler(Exception.class)
    public String handleUnknownException(Exception ex, Model model) {
        log.error("Unhandled error occurred", ex);
        model.addAttribute("error", "Възникна неочаквана грешка. Моля опитайте отново или се свържете с администратора.");
        return "index";
    }
}
