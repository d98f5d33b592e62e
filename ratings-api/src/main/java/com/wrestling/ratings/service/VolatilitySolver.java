package com.wrestling.ratings.service;

import com.wrestling.ratings.exception.RatingConvergenceException;

/**
 * Glicko-2 volatility update (step 5 of Glickman's procedure), solved with the
 * Illinois variant of regula falsi.
 *
 * Stateless; all inputs are on the Glicko-2 internal scale.
 */
public final class VolatilitySolver {

    static final double CONVERGENCE_TOLERANCE = 1e-6;
    static final int MAX_BRACKET_STEPS = 10_000;
    static final int MAX_ITERATIONS = 10_000;

    private VolatilitySolver() {}

    /**
     * Solve for the new volatility.
     *
     * @param delta   estimated improvement (v times the weighted score residual)
     * @param phiStar pre-period deviation, sqrt(phi^2 + sigma^2)
     * @param v       estimated variance of the rating based on game outcomes
     * @param tau     system constant limiting volatility change
     * @param sigma   current volatility
     * @return the new volatility sigma'
     * @throws RatingConvergenceException if no bracket or no convergence within the step caps
     */
    public static double solve(double delta, double phiStar, double v, double tau, double sigma) {
        return solve(delta, phiStar, v, tau, sigma, MAX_BRACKET_STEPS, MAX_ITERATIONS);
    }

    static double solve(double delta, double phiStar, double v, double tau, double sigma,
                        int maxBracketSteps, int maxIterations) {
        requireValidTau(tau);
        if (!(sigma > 0)) {
            throw new IllegalArgumentException("sigma must be positive: " + sigma);
        }

        double a = Math.log(sigma * sigma);
        double deltaSq = delta * delta;
        double phiStarSq = phiStar * phiStar;

        VolatilityFunction f = new VolatilityFunction(deltaSq, phiStarSq, v, a, tau);

        double lowerA = a;
        double upperB;
        if (deltaSq > phiStarSq + v) {
            upperB = Math.log(deltaSq - phiStarSq - v);
        } else {
            int k = 1;
            while (f.apply(a - k * tau) < 0) {
                k++;
                if (k > maxBracketSteps) {
                    throw new RatingConvergenceException(String.format(
                            "Could not bracket volatility root (delta=%.6f, phi*=%.6f, v=%.6f, tau=%.3f, sigma=%.6f)",
                            delta, phiStar, v, tau, sigma));
                }
            }
            upperB = a - k * tau;
        }

        double fA = f.apply(lowerA);
        double fB = f.apply(upperB);

        int iterations = 0;
        while (Math.abs(upperB - lowerA) > CONVERGENCE_TOLERANCE) {
            if (++iterations > maxIterations) {
                throw new RatingConvergenceException(String.format(
                        "Volatility iteration did not converge after %d steps (A=%.9f, B=%.9f)",
                        maxIterations, lowerA, upperB));
            }
            double c = lowerA + (lowerA - upperB) * fA / (fB - fA);
            double fC = f.apply(c);
            if (fC * fB < 0) {
                lowerA = upperB;
                fA = fB;
            } else {
                // Illinois step: halve the retained endpoint's value
                fA = fA / 2;
            }
            upperB = c;
            fB = fC;
        }

        double result = Math.exp(lowerA / 2);
        if (!Double.isFinite(result) || result <= 0) {
            throw new RatingConvergenceException("Volatility solver produced an invalid value: " + result);
        }
        return result;
    }

    /**
     * tau must be positive and its square must stay a positive finite number,
     * otherwise the volatility function degenerates to NaN.
     */
    static void requireValidTau(double tau) {
        double tauSq = tau * tau;
        if (!(tau > 0) || !(tauSq > 0) || !Double.isFinite(tauSq)) {
            throw new IllegalArgumentException("tau must be positive with a finite, non-zero square: " + tau);
        }
    }

    private record VolatilityFunction(double deltaSq, double phiStarSq, double v, double a, double tau) {

        double apply(double x) {
            double expX = Math.exp(x);
            double numerator = expX * (deltaSq - phiStarSq - v - expX);
            double denominator = 2 * Math.pow(phiStarSq + v + expX, 2);
            return (numerator / denominator) - ((x - a) / (tau * tau));
        }
    }
}
