package com.xammer.spectre.command;

import java.util.Locale;

/**
 * Turns a failure into a user-facing message with remediation hints for the common causes.
 */
public final class ErrorAdvisor {

    private ErrorAdvisor() {
    }

    public static String advise(String operation, Throwable error, int concurrency) {
        String detail = fullMessage(error);
        String lower = detail.toLowerCase(Locale.ROOT);

        if (lower.contains("unable to load credentials") || lower.contains("no valid credentials")
                || lower.contains("nocredentialproviders") || lower.contains("profile file contained no credentials")) {
            return operation + " failed: No AWS credentials found.\n"
                    + "Solutions:\n"
                    + "  - Set AWS_PROFILE environment variable\n"
                    + "  - Use --aws-profile option\n"
                    + "  - Configure AWS credentials with 'aws configure'\n"
                    + "Original error: " + detail;
        }
        if (detail.contains("AccessDenied") || detail.contains("Access Denied")) {
            return operation + " failed: Access Denied.\n"
                    + "Solutions:\n"
                    + "  - Check IAM permissions for S3 operations\n"
                    + "  - Ensure you have s3:ListBucket, s3:GetBucketLocation, s3:GetBucketVersioning permissions\n"
                    + "  - Verify the correct AWS profile is being used\n"
                    + "Original error: " + detail;
        }
        if (detail.contains("RequestLimitExceeded") || detail.contains("SlowDown")
                || detail.contains("max retries exceeded")) {
            return operation + " failed: AWS rate limit exceeded.\n"
                    + "Solutions:\n"
                    + "  - Reduce concurrency with --concurrency option (current: " + concurrency + ")\n"
                    + "  - Wait a few seconds and try again\n"
                    + "Original error: " + detail;
        }
        if (lower.contains("no such file or directory") || lower.contains("not a directory")) {
            return operation + " failed: Repository path not found.\n"
                    + "Solutions:\n"
                    + "  - Check the --repo path is correct\n"
                    + "  - Ensure the directory exists and is readable\n"
                    + "Original error: " + detail;
        }
        return operation + " failed: " + detail;
    }

    // Joins the cause chain so hints match codes buried in wrapped SDK exceptions.
    static String fullMessage(Throwable error) {
        StringBuilder builder = new StringBuilder();
        Throwable current = error;
        while (current != null) {
            String message = current.getMessage();
            if (message != null && !message.isEmpty() && builder.indexOf(message) < 0) {
                if (builder.length() > 0) {
                    builder.append(": ");
                }
                builder.append(message);
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return builder.length() == 0 ? error.getClass().getSimpleName() : builder.toString();
    }
}
