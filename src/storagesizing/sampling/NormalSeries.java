package storagesizing.sampling;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import storagesizing.config.ConfigurationException;

import java.util.Arrays;

/**
 * Выборка временных рядов из нормального распределения с отсечением.
 */
final class NormalSeries {

    private NormalSeries() {}

    /**
     * n значений N(mean, std). При std == 0 ряд постоянный и генератор не расходуется.
     */
    static double[] sample(RandomGenerator rng, String name, double mean, double std, int n) {
        if (!Double.isFinite(mean) || !Double.isFinite(std) || std < 0.0) {
            throw new ConfigurationException(
                    "Некорректные параметры распределения " + name + ": mean=" + mean + ", std=" + std);
        }
        if (std == 0.0) {
            double[] constant = new double[n];
            Arrays.fill(constant, mean);
            return constant;
        }
        return new NormalDistribution(rng, mean, std).sample(n);
    }

    static void clipBelow(double[] arr, double min) {
        for (int i = 0; i < arr.length; i++) {
            if (arr[i] < min) arr[i] = min;
        }
    }

    static void clipAbove(double[] arr, double max) {
        for (int i = 0; i < arr.length; i++) {
            if (arr[i] > max) arr[i] = max;
        }
    }

    static void scale(double[] arr, double factor) {
        for (int i = 0; i < arr.length; i++) {
            arr[i] *= factor;
        }
    }
}
