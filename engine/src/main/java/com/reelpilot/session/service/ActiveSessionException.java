package com.reelpilot.session.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveSessionException extends RuntimeException {
    public ActiveSessionException(String message) {
        super(message);
    }
}
