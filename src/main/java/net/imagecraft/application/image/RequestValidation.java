package net.imagecraft.application.image;

import net.imagecraft.exception.ImageValidationException;

/**
 * Input checks shared by the pipeline services. All failures are raised before any backend call.
 */
final class RequestValidation {

    static final int MAX_PROMPT_LENGTH = 2000;

    private RequestValidation() {
    }

    static String requirePrompt(String prompt) {
        return requireText("prompt", prompt, MAX_PROMPT_LENGTH);
    }

    static String requireText(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new ImageValidationException(field + " cannot be empty");
        }
        if (value.length() > maxLength) {
            throw new ImageValidationException(field + " must be at most " + maxLength + " characters");
        }
        return value.trim();
    }

    static byte[] requireImage(String field, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new ImageValidationException(field + " is required");
        }
        return bytes;
    }
}
