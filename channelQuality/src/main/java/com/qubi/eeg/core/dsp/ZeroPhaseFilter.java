package com.qubi.eeg.core.dsp;

import com.qubi.eeg.core.error.ComputationException;
import com.qubi.eeg.core.error.InsufficientDataException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.*;

/**
 * Filtrado hacia adelante y hacia atrás (filtfilt): el retardo de grupo se
 * cancela y la salida tiene el mismo largo que la entrada.
 * <p>
 * Los bordes se extienden con reflexión impar de {@code 3 * taps} muestras y cada
 * pasada arranca con las condiciones iniciales de régimen escaladas por la
 * primera muestra, para no introducir un transitorio de arranque.
 */
public final class ZeroPhaseFilter {
    private ZeroPhaseFilter(){}

    public static int padLength(IirCoefficients c) { return 3 * c.taps(); }

    public static double[] filtfilt(IirCoefficients c, double[] x) {
        int n = x.length;
        int pad = padLength(c);
        if (n <= pad)
            throw new InsufficientDataException("zero-phase filter needs more than " + pad + " samples, got " + n);

        int taps = c.taps();
        double[] b = padTo(c.b(), taps);
        double[] a = padTo(c.a(), taps);
        double[] zi = steadyStateState(b, a);

        double[] ext = oddExtension(x, pad);

        double[] fwd = lfilter(b, a, ext, scaled(zi, ext[0]));
        reverse(fwd);
        double[] bwd = lfilter(b, a, fwd, scaled(zi, fwd[0]));
        reverse(bwd);

        double[] out = new double[n];
        System.arraycopy(bwd, pad, out, 0, n);
        for (double v : out) {
            if (!Double.isFinite(v)) throw new ComputationException("filter output is not finite (unstable design?) " + c);
        }
        return out;
    }

    /**
     * Forma directa II transpuesta con estado inicial {@code z} (largo taps-1).
     * {@code z} se consume.
     */
    static double[] lfilter(double[] b, double[] a, double[] x, double[] z) {
        int order = z.length;
        double[] y = new double[x.length];
        for (int m = 0; m < x.length; m++) {
            double xm = x[m];
            double ym = b[0] * xm + (order > 0 ? z[0] : 0.0);
            for (int i = 0; i < order - 1; i++) {
                z[i] = b[i + 1] * xm + z[i + 1] - a[i + 1] * ym;
            }
            if (order > 0) z[order - 1] = b[order] * xm - a[order] * ym;
            y[m] = ym;
        }
        return y;
    }

    /** Estado de régimen ante un escalón unitario: (I - Aᵀ) zi = b[1:] - a[1:]·b[0]. */
    static double[] steadyStateState(double[] b, double[] a) {
        int order = a.length - 1;
        if (order == 0) return new double[0];
        double[][] m = new double[order][order];
        double[] rhs = new double[order];
        for (int i = 0; i < order; i++) {
            m[i][i] += 1.0;
            m[i][0] += a[i + 1];                  // -(-a[i+1]) de la compañera transpuesta
            if (i + 1 < order) m[i][i + 1] -= 1.0;
            rhs[i] = b[i + 1] - a[i + 1] * b[0];
        }
        try {
            DecompositionSolver solver = new LUDecomposition(new Array2DRowRealMatrix(m, false)).getSolver();
            return solver.solve(new ArrayRealVector(rhs, false)).toArray();
        } catch (MathIllegalArgumentException e) {   // incluye SingularMatrixException
            throw new ComputationException("cannot compute filter initial conditions", e);
        }
    }

    static double[] oddExtension(double[] x, int pad) {
        int n = x.length;
        double[] ext = new double[n + 2 * pad];
        for (int i = 0; i < pad; i++) {
            ext[i] = 2.0 * x[0] - x[pad - i];
            ext[n + pad + i] = 2.0 * x[n - 1] - x[n - 2 - i];
        }
        System.arraycopy(x, 0, ext, pad, n);
        return ext;
    }

    private static double[] scaled(double[] v, double k) {
        double[] out = new double[v.length];
        for (int i = 0; i < v.length; i++) out[i] = v[i] * k;
        return out;
    }

    private static double[] padTo(double[] v, int len) {
        if (v.length == len) return v;
        double[] out = new double[len];
        System.arraycopy(v, 0, out, 0, v.length);
        return out;
    }

    private static void reverse(double[] v) {
        for (int i = 0, j = v.length - 1; i < j; i++, j--) {
            double t = v[i]; v[i] = v[j]; v[j] = t;
        }
    }
}
