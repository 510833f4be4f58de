package com.limetext.explain;

/**
 * 指数核：weight(d) = sqrt(exp(-d^2 / width^2))。
 */
public record ExponentialKernel(double kernelWidth) {

    public ExponentialKernel {
        if (!(kernelWidth > 0) || Double.isInfinite(kernelWidth)) {
            throw new IllegalArgumentException("核宽度必须为有限正数: " + kernelWidth);
        }
    }

    public double weight(double distance) {
        return weight(distance, kernelWidth);
    }

    public double[] weights(double[] distances) {
        double[] weights = new double[distances.length];
        for (int index = 0; index < distances.length; index++) {
            weights[index] = weight(distances[index]);
        }
        return weights;
    }

    public static double weight(double distance, double kernelWidth) {
        return Math.sqrt(Math.exp(-(distance * distance) / (kernelWidth * kernelWidth)));
    }
}
