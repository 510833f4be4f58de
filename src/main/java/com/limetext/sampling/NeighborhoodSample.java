package com.limetext.sampling;

/**
 * 邻域中的一行。
 */
public record NeighborhoodSample(
    double[] mask,
    String text,
    double[] probabilities,
    double distance
) {
}
