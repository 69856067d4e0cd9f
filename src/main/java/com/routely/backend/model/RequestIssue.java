package com.routely.backend.model;

import lombok.Builder;
import lombok.Value;

/**
 * One problem found in a plan request, tied to the request field that caused it.
 */
@Value
@Builder
public class RequestIssue {
    String code;
    String message;
    String field;
}
