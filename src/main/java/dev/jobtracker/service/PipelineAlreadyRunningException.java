package dev.jobtracker.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A run was requested while another one holds the run guard.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class PipelineAlreadyRunningException extends RuntimeException {

    public PipelineAlreadyRunningException() {
        super("A pipeline run is already in progress");
    }
}
