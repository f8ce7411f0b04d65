package io.cronhttp.http;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.IOException;

/**
 * Result of one HTTP request, stored as the {@code job_result.result} JSON.
 * Failures carry code 0 and the error text.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RequestOutcome(
        int code,
        String body,
        String error
) {

    public static RequestOutcome response(int code, String body) {
        return new RequestOutcome(code, body, null);
    }

    public static RequestOutcome failure(IOException e) {
        return new RequestOutcome(0, null, String.valueOf(e));
    }

    public boolean failed() {
        return error != null;
    }
}
