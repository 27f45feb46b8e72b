package com.proxyhub.aggregator.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class SubscriptionValidationException extends SubscriptionException {
    public SubscriptionValidationException(String message) {
        super(message);
    }
}
