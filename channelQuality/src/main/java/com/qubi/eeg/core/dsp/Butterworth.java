package com.qubi.eeg.core.dsp;

import com.qubi.eeg.core.error.ConfigurationException;
import org.apache.commons.math3.complex.Complex;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Diseño digital de Butterworth: prototipo analógico, prewarp y transformada
 * bilineal, devuelto en forma (b, a).
 */
public final class Butterworth {
    private Butterworth(){}

    public enum Type { LOW_PASS, HIGH_PASS }

    private static final double FS = 2.0;   // frecuencias normalizadas a Nyquist

    public static IirCoefficients lowPass(int order, double cutoffHz, double samplingRateHz) {
        return design(order, cutoffHz, samplingRateHz, Type.LOW_PASS);
    }

    public static IirCoefficients highPass(int order, double cutoffHz, double samplingRateHz) {
        return design(order, cutoffHz, samplingRateHz, Type.HIGH_PASS);
    }

    public static IirCoefficients design(int order, double cutoffHz, double samplingRateHz, Type type) {
        if (order < 1) throw new ConfigurationException("filter order must be >= 1: " + order);
        double nyquist = samplingRateHz / 2.0;
        if (!(cutoffHz > 0 && cutoffHz < nyquist))
            throw new ConfigurationException(String.format(Locale.ROOT,
                    "cutoff %.4f Hz outside (0, %.4f) Hz for fs=%.2f Hz", cutoffHz, nyquist, samplingRateHz));

        double wn = cutoffHz / nyquist;
        double warped = 2.0 * FS * Math.tan(Math.PI * wn / FS);

        // prototipo analógico: polos en el semicírculo izquierdo, sin ceros, k = 1
        List<Complex> protoPoles = new ArrayList<>(order);
        for (int m = -order + 1; m < order; m += 2) {
            protoPoles.add(new Complex(0, Math.PI * m / (2.0 * order)).exp().negate());
        }

        List<Complex> zeros = new ArrayList<>();
        List<Complex> poles = new ArrayList<>(order);
        double gain;
        if (type == Type.LOW_PASS) {
            for (Complex p : protoPoles) poles.add(p.multiply(warped));
            gain = Math.pow(warped, order);
        } else {
            for (Complex p : protoPoles) poles.add(new Complex(warped).divide(p));
            for (int i = 0; i < order; i++) zeros.add(Complex.ZERO);
            gain = Complex.ONE.divide(product(negateAll(protoPoles))).getReal();
        }
        return bilinear(zeros, poles, gain);
    }

    private static IirCoefficients bilinear(List<Complex> zeros, List<Complex> poles, double gain) {
        Complex fs2 = new Complex(2.0 * FS);
        List<Complex> zz = new ArrayList<>(poles.size());
        List<Complex> pz = new ArrayList<>(poles.size());
        Complex num = Complex.ONE;
        Complex den = Complex.ONE;
        for (Complex z : zeros) {
            zz.add(fs2.add(z).divide(fs2.subtract(z)));
            num = num.multiply(fs2.subtract(z));
        }
        for (Complex p : poles) {
            pz.add(fs2.add(p).divide(fs2.subtract(p)));
            den = den.multiply(fs2.subtract(p));
        }
        // ceros en Nyquist por la diferencia de grado
        while (zz.size() < pz.size()) zz.add(new Complex(-1.0));

        double k = gain * num.divide(den).getReal();
        double[] b = poly(zz);
        for (int i = 0; i < b.length; i++) b[i] *= k;
        return new IirCoefficients(b, poly(pz));
    }

    /** Coeficientes reales del polinomio mónico con esas raíces (pares conjugados). */
    static double[] poly(List<Complex> roots) {
        Complex[] c = new Complex[roots.size() + 1];
        c[0] = Complex.ONE;
        for (int i = 1; i < c.length; i++) c[i] = Complex.ZERO;
        int deg = 0;
        for (Complex r : roots) {
            deg++;
            for (int j = deg; j >= 1; j--) c[j] = c[j].subtract(r.multiply(c[j - 1]));
        }
        double[] out = new double[c.length];
        for (int i = 0; i < c.length; i++) out[i] = c[i].getReal();
        return out;
    }

    private static List<Complex> negateAll(List<Complex> values) {
        List<Complex> out = new ArrayList<>(values.size());
        for (Complex v : values) out.add(v.negate());
        return out;
    }

    private static Complex product(List<Complex> values) {
        Complex acc = Complex.ONE;
        for (Complex v : values) acc = acc.multiply(v);
        return acc;
    }
}
