/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.relay.port.outbound;

import java.util.OptionalInt;

/**
 * Failure of a backend call: connection error, non-success HTTP status or a
 * response body that could not be parsed. The message always starts with the
 * operation that failed and is safe to show to users as-is.
 */
public class BackendException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Integer statusCode;
    private final String detail;

    private BackendException(String message, Integer statusCode, String detail, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.detail = detail;
    }

    /**
     * Connection refused, timeout or any other IO failure.
     */
    public static BackendException transport(String context, Throwable cause) {
        String detail = describe(cause);
        return new BackendException(context + ": " + detail, null, detail, cause);
    }

    /**
     * Non-success status. The response body is kept verbatim.
     */
    public static BackendException rejected(String context, int statusCode, String body) {
        String detail = body != null ? body : "";
        return new BackendException(context + " (HTTP " + statusCode + "): " + detail, statusCode, detail, null);
    }

    /**
     * Body missing or not the expected JSON.
     */
    public static BackendException decode(String context, Throwable cause) {
        String detail = describe(cause);
        return new BackendException(context + ": " + detail, null, detail, cause);
    }

    public OptionalInt getStatusCode() {
        return statusCode != null ? OptionalInt.of(statusCode) : OptionalInt.empty();
    }

    public boolean isNotFound() {
        return statusCode != null && statusCode == 404;
    }

    public String getDetail() {
        return detail;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }
}
