package me.golemcore.incident.adapter.outbound.llm.converse;

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

import lombok.Getter;

/**
 * Failure reported by the Converse backend or while talking to it. Carries the
 * HTTP status (0 for I/O failures) and the backend error code when known.
 */
@Getter
public class ConverseApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int status;
    private final String errorCode;

    public ConverseApiException(int status, String errorCode, String message) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public ConverseApiException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.errorCode = null;
    }

    /**
     * Builds an exception whose message explains the backend error code.
     */
    public static ConverseApiException fromResponse(int status, String errorCode, String backendMessage) {
        String detail = backendMessage != null && !backendMessage.isBlank() ? backendMessage : "no details";
        String code = errorCode != null ? errorCode : "";
        String message;
        if (code.startsWith("ValidationException")) {
            message = "Converse request rejected as invalid: " + detail;
        } else if (code.startsWith("AccessDeniedException")) {
            message = "Access denied to the Converse backend, check credentials and model access: " + detail;
        } else if (code.startsWith("ThrottlingException")) {
            message = "Converse backend throttled the request: " + detail;
        } else if (code.startsWith("ServiceQuotaExceededException")) {
            message = "Converse service quota exceeded: " + detail;
        } else if (code.startsWith("ModelNotReadyException") || code.startsWith("ResourceNotFoundException")) {
            message = "Converse model unavailable: " + detail;
        } else if (code.startsWith("InternalServerException") || status >= 500) {
            message = "Converse backend internal error (HTTP " + status + "): " + detail;
        } else {
            message = "Converse call failed (HTTP " + status + "): " + detail;
        }
        return new ConverseApiException(status, errorCode, message);
    }

    public boolean isThrottled() {
        return status == 429 || errorCode != null && errorCode.startsWith("ThrottlingException");
    }
}
