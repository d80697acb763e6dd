package com.finsolve.assistant.exception;

import org.springframework.http.HttpStatus;

public class UnknownRoleException extends ChatException {

    public UnknownRoleException(String principal) {
        super(HttpStatus.FORBIDDEN, ErrorCode.UNKNOWN_ROLE,
                "No department role is assigned to " + principal);
    }
}
