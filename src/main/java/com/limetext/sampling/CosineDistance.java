package com.limetext.sampling;

public final class CosineDistance {

    private CosineDistance() {
    }

    /**
     * 计算每一行与第 0 行的余弦距离，结果截断到 [0, 2]。
     * 零向量与任意向量的距离记为 1。
     */
    public static double[] toFirstRow(double[][] rows) {
        if (rows == null || rows.length == 0) {
            return new double[0];
        }
        double[] reference = rows[0];
        double referenceNorm = norm(reference);
        double[] distances = new double[rows.length];
        for (int index = 1; index < rows.length; index++) {
            distances[index] = distance(reference, referenceNorm, rows[index]);
        }
        return distances;
    }

    public static double distance(double[] left, double[] right) {
        return distance(left, norm(left), right);
    }

    private static double distance(double[] reference, double referenceNorm, double[] row) {
        if (reference.length != row.length) {
            throw new IllegalArgumentException("向量维度不一致: " + reference.length + " != " + row.length);
        }
        double rowNorm = norm(row);
        if (referenceNorm == 0 || rowNorm == 0) {
            return 1.0;
        }
        double dot = 0;
        for (int index = 0; index < row.length; index++) {
            dot += reference[index] * row[index];
        }
        double distance = 1.0 - dot / (referenceNorm * rowNorm);
        return Math.max(0.0, Math.min(2.0, distance));
    }

    private static double norm(double[] vector) {
        double sum = 0;
        for (double value : vector) {
            sum += value * value;
        }
        return Math.sqrt(sum);
    }
}
