package guraa.paintquality.analysis;

/**
 * sRGB to CIELAB conversion (D65) and delta-E color differences.
 */
public final class ColorSpaceUtils {

    // D65 reference white
    private static final double XN = 0.95047;
    private static final double YN = 1.00000;
    private static final double ZN = 1.08883;

    private static final double POW25_7 = Math.pow(25.0, 7);

    private ColorSpaceUtils() {
    }

    /**
     * Convert an sRGB color with channels in 0-255 (fractional values allowed, e.g. cell means) to CIELAB.
     *
     * @return {L*, a*, b*}
     */
    public static double[] srgbToLab(double r, double g, double b) {
        double rl = linearize(r / 255.0);
        double gl = linearize(g / 255.0);
        double bl = linearize(b / 255.0);

        double x = 0.4124564 * rl + 0.3575761 * gl + 0.1804375 * bl;
        double y = 0.2126729 * rl + 0.7151522 * gl + 0.0721750 * bl;
        double z = 0.0193339 * rl + 0.1191920 * gl + 0.9503041 * bl;

        double fx = labF(x / XN);
        double fy = labF(y / YN);
        double fz = labF(z / ZN);

        return new double[]{116.0 * fy - 16.0, 500.0 * (fx - fy), 200.0 * (fy - fz)};
    }

    /**
     * CIE76 color difference: Euclidean distance in CIELAB.
     */
    public static double cie76(double[] lab1, double[] lab2) {
        double dL = lab1[0] - lab2[0];
        double da = lab1[1] - lab2[1];
        double db = lab1[2] - lab2[2];
        return Math.sqrt(dL * dL + da * da + db * db);
    }

    /**
     * CIEDE2000 color difference (Sharma, Wu, Dalal 2005) with unit weighting factors.
     */
    public static double ciede2000(double[] lab1, double[] lab2) {
        double l1 = lab1[0], a1 = lab1[1], b1 = lab1[2];
        double l2 = lab2[0], a2 = lab2[1], b2 = lab2[2];

        double meanL = (l1 + l2) / 2.0;
        double meanC = (Math.hypot(a1, b1) + Math.hypot(a2, b2)) / 2.0;
        double meanC7 = Math.pow(meanC, 7);
        double g = 0.5 * (1.0 - Math.sqrt(meanC7 / (meanC7 + POW25_7)));

        double a1p = a1 * (1.0 + g);
        double a2p = a2 * (1.0 + g);
        double c1p = Math.hypot(a1p, b1);
        double c2p = Math.hypot(a2p, b2);
        double meanCp = (c1p + c2p) / 2.0;

        double h1p = hueAngle(b1, a1p);
        double h2p = hueAngle(b2, a2p);
        boolean achromatic = c1p == 0 || c2p == 0;

        double dhp;
        if (achromatic) {
            dhp = 0;
        } else if (Math.abs(h2p - h1p) <= Math.PI) {
            dhp = h2p - h1p;
        } else if (h2p - h1p > Math.PI) {
            dhp = h2p - h1p - 2.0 * Math.PI;
        } else {
            dhp = h2p - h1p + 2.0 * Math.PI;
        }

        double meanHp;
        if (achromatic) {
            meanHp = h1p + h2p;
        } else if (Math.abs(h1p - h2p) <= Math.PI) {
            meanHp = (h1p + h2p) / 2.0;
        } else if (h1p + h2p < 2.0 * Math.PI) {
            meanHp = (h1p + h2p + 2.0 * Math.PI) / 2.0;
        } else {
            meanHp = (h1p + h2p - 2.0 * Math.PI) / 2.0;
        }

        double t = 1.0
                - 0.17 * Math.cos(meanHp - Math.toRadians(30))
                + 0.24 * Math.cos(2.0 * meanHp)
                + 0.32 * Math.cos(3.0 * meanHp + Math.toRadians(6))
                - 0.20 * Math.cos(4.0 * meanHp - Math.toRadians(63));

        double lOffset = (meanL - 50.0) * (meanL - 50.0);
        double sl = 1.0 + 0.015 * lOffset / Math.sqrt(20.0 + lOffset);
        double sc = 1.0 + 0.045 * meanCp;
        double sh = 1.0 + 0.015 * meanCp * t;

        double hueTerm = (meanHp - Math.toRadians(275)) / Math.toRadians(25);
        double dTheta = Math.toRadians(30) * Math.exp(-hueTerm * hueTerm);
        double meanCp7 = Math.pow(meanCp, 7);
        double rt = -Math.sin(2.0 * dTheta) * 2.0 * Math.sqrt(meanCp7 / (meanCp7 + POW25_7));

        double lTerm = (l2 - l1) / sl;
        double cTerm = (c2p - c1p) / sc;
        double hTerm = 2.0 * Math.sqrt(c1p * c2p) * Math.sin(dhp / 2.0) / sh;

        return Math.sqrt(lTerm * lTerm + cTerm * cTerm + hTerm * hTerm + rt * cTerm * hTerm);
    }

    private static double linearize(double c) {
        return c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    private static double labF(double t) {
        return t > 0.008856 ? Math.cbrt(t) : (903.3 * t + 16.0) / 116.0;
    }

    private static double hueAngle(double b, double ap) {
        double h = Math.atan2(b, ap);
        return h < 0 ? h + 2.0 * Math.PI : h;
    }
}
