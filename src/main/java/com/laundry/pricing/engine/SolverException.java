package com.laundry.pricing.engine;

/**
 * The integer program could not be solved to a certified optimum.
 */
public class SolverException extends RuntimeException {

    public SolverException(String message) {
        super(message);
    }
}
