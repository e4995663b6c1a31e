package com.xammer.spectre.util;

import com.xammer.spectre.exception.ProviderException;
import com.xammer.spectre.exception.TransientProviderException;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;

/**
 * Turns provider failures into the short diagnostics stored on bucket metadata.
 */
public final class ErrorMessages {

    private ErrorMessages() {
    }

    /**
     * Phrases a failed call for humans, e.g. {@code "get versioning failed for logs: Access Denied - check IAM permissions"}.
     */
    public static String describe(String operation, String resource, Throwable error) {
        String text = errorCode(error) + " " + summary(error);
        if (text.contains("AccessDenied") || text.contains("Access Denied")) {
            return String.format("%s failed for %s: Access Denied - check IAM permissions", operation, resource);
        }
        if (text.contains("NoSuchBucket")) {
            return String.format("%s failed for %s: Bucket does not exist or is in a different region", operation, resource);
        }
        if (text.contains("RequestLimitExceeded") || text.contains("SlowDown")) {
            return String.format("%s failed for %s: Rate limit exceeded - consider reducing --concurrency", operation, resource);
        }
        return String.format("%s failed for %s: %s", operation, resource, summary(error));
    }

    /** AWS error code of the innermost service exception, or an empty string. */
    public static String errorCode(Throwable error) {
        AwsServiceException service = serviceException(error);
        if (service == null || service.awsErrorDetails() == null) {
            return "";
        }
        String code = service.awsErrorDetails().errorCode();
        return code == null ? "" : code;
    }

    /**
     * Message of the underlying failure without the SDK's request-id suffix where possible.
     */
    public static String detailMessage(Throwable error) {
        AwsServiceException service = serviceException(error);
        if (service != null) {
            AwsErrorDetails details = service.awsErrorDetails();
            if (details != null && details.errorMessage() != null) {
                return details.errorMessage();
            }
            return String.valueOf(service.getMessage());
        }
        Throwable root = unwrap(error);
        return root == null ? "" : String.valueOf(root.getMessage());
    }

    public static boolean hasErrorCode(Throwable error, String code) {
        return code.equals(errorCode(error)) || detailMessage(error).contains(code);
    }

    private static String summary(Throwable error) {
        if (error instanceof TransientProviderException) {
            return "max retries exceeded: " + detailMessage(error);
        }
        if (error instanceof ProviderException) {
            return detailMessage(error);
        }
        return String.valueOf(error.getMessage());
    }

    private static AwsServiceException serviceException(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof AwsServiceException) {
                return (AwsServiceException) current;
            }
            current = current.getCause();
        }
        return null;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof ProviderException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
