package eu.virtualparadox.flockqa.util;

public final class VectorMath {

    private VectorMath() {
        // prevent instantiation
    }

    /**
     * Scales {@code vec} to unit length in place. Zero vectors are left untouched.
     *
     * @param vec vector to normalize
     * @return the same array, for chaining
     */
    public static float[] normalizeInPlace(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        }
        return vec;
    }

    /**
     * @return a unit-length copy of {@code vec}
     */
    public static float[] normalized(final float[] vec) {
        return normalizeInPlace(vec.clone());
    }

    public static double norm(final float[] vec) {
        double sum = 0.0;
        for (final float v : vec) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }
}
