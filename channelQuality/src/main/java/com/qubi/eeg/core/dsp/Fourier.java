package com.qubi.eeg.core.dsp;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * DFT de largo arbitrario sobre la FFT radix-2 de commons-math. Para largos que no
 * son potencia de dos se usa la transformada chirp-z (Bluestein).
 */
public final class Fourier {
    private Fourier(){}

    private static final FastFourierTransformer FFT = new FastFourierTransformer(DftNormalization.STANDARD);

    /** DFT de {@code x} rellenado con ceros (o truncado) a {@code n} puntos. */
    public static Complex[] transform(double[] x, int n) {
        if (n < 1) throw new IllegalArgumentException("transform length must be >= 1: " + n);
        if (isPowerOfTwo(n)) {
            double[] padded = new double[n];
            System.arraycopy(x, 0, padded, 0, Math.min(x.length, n));
            return FFT.transform(padded, TransformType.FORWARD);
        }
        return bluestein(x, n);
    }

    /** |X[k]|² para k = 0..n/2 (espectro de un solo lado, sin escalar). */
    public static double[] oneSidedPower(double[] x, int n) {
        Complex[] spectrum = transform(x, n);
        double[] power = new double[n / 2 + 1];
        for (int k = 0; k < power.length; k++) {
            double re = spectrum[k].getReal();
            double im = spectrum[k].getImaginary();
            power[k] = re * re + im * im;
        }
        return power;
    }

    private static Complex[] bluestein(double[] x, int n) {
        int m = Integer.highestOneBit(2 * n - 1);
        if (m < 2 * n - 1) m <<= 1;

        // chirp w[k] = exp(-iπk²/n); k² se reduce mod 2n para conservar precisión
        Complex[] w = new Complex[n];
        long mod = 2L * n;
        for (int k = 0; k < n; k++) {
            long k2 = ((long) k * k) % mod;
            double angle = Math.PI * k2 / n;
            w[k] = new Complex(Math.cos(angle), -Math.sin(angle));
        }

        Complex[] a = new Complex[m];
        Complex[] b = new Complex[m];
        for (int i = 0; i < m; i++) { a[i] = Complex.ZERO; b[i] = Complex.ZERO; }
        int len = Math.min(x.length, n);
        for (int k = 0; k < len; k++) a[k] = w[k].multiply(x[k]);
        b[0] = w[0].conjugate();
        for (int k = 1; k < n; k++) {
            b[k] = w[k].conjugate();
            b[m - k] = b[k];
        }

        Complex[] fa = FFT.transform(a, TransformType.FORWARD);
        Complex[] fb = FFT.transform(b, TransformType.FORWARD);
        for (int i = 0; i < m; i++) fa[i] = fa[i].multiply(fb[i]);
        Complex[] conv = FFT.transform(fa, TransformType.INVERSE);

        Complex[] out = new Complex[n];
        for (int k = 0; k < n; k++) out[k] = w[k].multiply(conv[k]);
        return out;
    }

    static boolean isPowerOfTwo(int n) { return n > 0 && (n & (n - 1)) == 0; }
}
