package com.hookline.hooks;

/**
 * A hook that threw during dispatch.
 *
 * @param hookName the failing hook's name
 * @param error what it threw
 */
public record HandlerFailure(String hookName, Exception error) {

    public HandlerFailure {
        if (hookName == null || hookName.isBlank()) {
            throw new IllegalArgumentException("hookName must not be null or blank");
        }
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
    }

    public String message() {
        return hookName + ": " + error;
    }
}
