package com.xammer.spectre.service;

import com.xammer.spectre.util.ErrorMessages;
import software.amazon.awssdk.core.exception.SdkServiceException;

import java.util.List;

/**
 * Decides whether a failed AWS call is worth another attempt.
 */
public class TransientErrorClassifier {

    private static final List<String> RETRYABLE_SIGNATURES = List.of(
            "RequestLimitExceeded",
            "ServiceUnavailable",
            "SlowDown",
            "RequestTimeout",
            "TooManyRequests",
            "InternalError",
            "Throttling",
            "503",
            "429"
    );

    public boolean isTransient(Throwable error) {
        if (error == null) {
            return false;
        }
        Throwable current = error;
        while (current != null) {
            if (current instanceof SdkServiceException) {
                SdkServiceException serviceException = (SdkServiceException) current;
                int status = serviceException.statusCode();
                if (status == 429 || status >= 500 || serviceException.isThrottlingException()) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return matchesSignature(ErrorMessages.errorCode(error)) || matchesSignature(ErrorMessages.detailMessage(error));
    }

    private static boolean matchesSignature(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (String signature : RETRYABLE_SIGNATURES) {
            if (text.contains(signature)) {
                return true;
            }
        }
        return false;
    }
}
