package com.astrostack.service;

import ij.measure.Minimizer;
import ij.measure.UserFunction;
import ij.process.FloatProcessor;

import static java.lang.Math.exp;

// A * exp(-(x-x0)^2/(2 sx^2) - (y-y0)^2/(2 sy^2)) + off, in cutout pixel coordinates
public class GaussianSurfaceFit implements UserFunction {

    private static final int N_PARAMS = 6;

    private final FloatProcessor cutout;
    private final int w, h;
    private final double maxSigma;

    public double sigmaX, sigmaY;

    public GaussianSurfaceFit(FloatProcessor cutout) {
        this.cutout = cutout;
        this.w = cutout.getWidth();
        this.h = cutout.getHeight();
        this.maxSigma = Math.max(w, h);
    }

    public boolean fit(double initialX0, double initialY0, double initialSigma, double initialAmplitude, double initialOffset) {
        double[] initialParameters = new double[] {initialX0, initialY0, initialSigma, initialSigma, initialAmplitude, initialOffset};
        double[] initialParametersVariation = new double[] {1, 1, 0.5, 0.5, Math.max(1, initialAmplitude / 10), 10};

        Minimizer min = new Minimizer();
        min.setFunction(this, N_PARAMS);
        min.setRandomSeed(1);
        min.setMaxIterations(20000);
        if (!converged(min.minimize(initialParameters, initialParametersVariation))) return false;

        double[] p = min.getParams();
        for (int i = 0; i < N_PARAMS; i++) {
            if (Double.isNaN(p[i]) || Double.isInfinite(p[i])) return false;
        }
        sigmaX = Math.abs(p[2]);
        sigmaY = Math.abs(p[3]);
        return true;
    }

    static boolean converged(int status) {
        switch (status) {
            case Minimizer.INITIALIZATION_FAILURE:
            case Minimizer.ABORTED:
            case Minimizer.REINITIALIZATION_FAILURE:
            case Minimizer.MAX_ITERATIONS_EXCEEDED:
                return false;
            default:
                return true;
        }
    }

    @Override
    public double userFunction(double[] params, double dummy) {
        double sx = params[2];
        double sy = params[3];
        if (sx <= 0 || sy <= 0) return Double.NaN;
        if (sx > maxSigma || sy > maxSigma) return Double.NaN;
        return sumOfSquares(params[0], params[1], sx, sy, params[4], params[5]);
    }

    private double sumOfSquares(double xc, double yc, double sx, double sy, double a, double off) {
        double sx22 = 2 * sx * sx;
        double sy22 = 2 * sy * sy;
        double[] gx = new double[w];
        for (int i = 0; i < w; i++) gx[i] = (i - xc) * (i - xc) / sx22;

        double error = 0;
        for (int j = 0; j < h; j++) {
            double gy = (j - yc) * (j - yc) / sy22;
            for (int i = 0; i < w; i++) {
                double r = a * exp(-gx[i] - gy) + off - cutout.getf(i, j);
                error += r * r;
            }
        }
        return error;
    }
}
