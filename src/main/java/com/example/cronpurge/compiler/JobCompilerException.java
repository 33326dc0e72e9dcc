package com.example.cronpurge.compiler;

import lombok.Getter;

public class JobCompilerException extends RuntimeException {

    public enum Code {
        INVALID_CRON_FORMAT,
        MISSING_FILTERS,
        INVALID_IDENTIFIER,
        JOB_NOT_FOUND
    }

    @Getter
    private final Code code;

    private JobCompilerException(Code code, String message) {
        super(message);
        this.code = code;
    }

    private JobCompilerException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static JobCompilerException invalidCronFormat(String expression) {
        return new JobCompilerException(Code.INVALID_CRON_FORMAT,
                "Cron expression '" + expression + "' must have 5 or 6 whitespace-separated fields");
    }

    public static JobCompilerException invalidCronFormat(String expression, Throwable cause) {
        return new JobCompilerException(Code.INVALID_CRON_FORMAT,
                "Cron expression '" + expression + "' is not valid: " + cause.getMessage(), cause);
    }

    public static JobCompilerException missingFilters() {
        return new JobCompilerException(Code.MISSING_FILTERS,
                "At least one retention filter is required");
    }

    public static JobCompilerException invalidIdentifier(String field, String value) {
        return new JobCompilerException(Code.INVALID_IDENTIFIER,
                "Value '" + value + "' is not allowed for " + field);
    }

    public static JobCompilerException jobNotFound(String jobKey) {
        return new JobCompilerException(Code.JOB_NOT_FOUND,
                "No statement has been submitted for job " + jobKey);
    }
}
