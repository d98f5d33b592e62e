package com.wrestling.ratings.exception;

/**
 * Thrown when a stored leaderboard (or other requested document) does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException noLeaderboard() {
        return new ResourceNotFoundException("No leaderboard has been generated yet");
    }
}
