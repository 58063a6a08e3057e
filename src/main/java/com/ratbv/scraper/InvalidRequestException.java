package com.ratbv.scraper;

/**
 * Malformed input to one of the service operations, e.g. a blank master URL.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
