package dev.jobtracker.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class DuplicateSourceException extends RuntimeException {

    public DuplicateSourceException(String url) {
        super("Source already tracked: " + url);
    }
}
