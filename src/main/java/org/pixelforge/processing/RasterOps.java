package org.pixelforge.processing;

import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.awt.image.BufferedImage;

/**
 * OpenCV kernels behind the transform steps. Every method returns a new raster of the
 * source's type and leaves the source untouched; {@link Mat}s never leave this class.
 * <p>
 * The enhancement steps blend the raster with a degenerate version of itself:
 * {@code out = source * factor + degenerate * (1 - factor)}, so a factor of 1.0 reproduces
 * the source exactly. Alpha is carried through resize and blur, and left as is by the
 * enhancements.
 */
final class RasterOps {

    private static final int ALPHA_CHANNEL = 3;

    // 3x3 smoothing kernel (1 1 1 / 1 5 1 / 1 1 1) / 13, the degenerate image of the sharpness step
    private static final float[] SMOOTH_KERNEL = {
            1 / 13f, 1 / 13f, 1 / 13f,
            1 / 13f, 5 / 13f, 1 / 13f,
            1 / 13f, 1 / 13f, 1 / 13f};

    private static volatile boolean nativeLoaded;

    private RasterOps() {
    }

    // --- Resize ---

    static BufferedImage resize(final BufferedImage src, final int targetWidth, final int targetHeight) {
        if (src.getWidth() == targetWidth && src.getHeight() == targetHeight) return copy(src);
        final Mat in = toMat(src);
        final Mat out = new Mat();
        try {
            Imgproc.resize(in, out, new Size(targetWidth, targetHeight), 0, 0, Imgproc.INTER_LANCZOS4);
            return toImage(out, src.getType());
        } finally {
            in.release();
            out.release();
        }
    }

    // --- Gaussian blur ---

    static BufferedImage gaussianBlur(final BufferedImage src, final double radius) {
        if (radius <= 0) return copy(src);
        final int half = kernelHalfWidth(radius, src.getWidth(), src.getHeight());
        final Mat in = toMat(src);
        final Mat out = new Mat();
        try {
            Imgproc.GaussianBlur(in, out, new Size(2 * half + 1, 2 * half + 1), radius, radius, Core.BORDER_REPLICATE);
            return toImage(out, src.getType());
        } finally {
            in.release();
            out.release();
        }
    }

    /**
     * Three sigma either side, at least one tap, and never wider than the image: beyond that
     * every tap reads a replicated edge pixel.
     */
    static int kernelHalfWidth(final double sigma, final int width, final int height) {
        final double wanted = Math.max(1.0, Math.ceil(3 * sigma));
        return (int) Math.min(wanted, Math.max(1, Math.max(width, height)));
    }

    // --- Enhancements ---

    static BufferedImage sharpness(final BufferedImage src, final double factor) {
        final int w = src.getWidth();
        final int h = src.getHeight();
        final Mat in = toMat(src);
        final Mat degenerate = in.clone();
        final Mat kernel = new Mat(3, 3, CvType.CV_32F);
        final Mat smoothed = new Mat();
        try {
            // border pixels have no full neighbourhood and stay as they are
            if (w > 2 && h > 2) {
                kernel.put(0, 0, SMOOTH_KERNEL);
                Imgproc.filter2D(in, smoothed, -1, kernel);
                smoothed.submat(1, h - 1, 1, w - 1).copyTo(degenerate.submat(1, h - 1, 1, w - 1));
            }
            return blend(in, degenerate, factor, src.getType());
        } finally {
            in.release();
            degenerate.release();
            kernel.release();
            smoothed.release();
        }
    }

    static BufferedImage contrast(final BufferedImage src, final double factor) {
        final Mat in = toMat(src);
        final double mean = meanLuminance(in);
        final Mat degenerate = new Mat(in.size(), in.type(), new Scalar(mean, mean, mean, 0));
        try {
            return blend(in, degenerate, factor, src.getType());
        } finally {
            in.release();
            degenerate.release();
        }
    }

    static BufferedImage brightness(final BufferedImage src, final double factor) {
        final Mat in = toMat(src);
        final Mat degenerate = Mat.zeros(in.size(), in.type());
        try {
            return blend(in, degenerate, factor, src.getType());
        } finally {
            in.release();
            degenerate.release();
        }
    }

    /**
     * Mean ITU-R 601 luma over all pixels, rounded to an integer grey level.
     */
    static double meanLuminance(final Mat bgra) {
        if (bgra.empty()) return 0;
        final Mat grey = new Mat();
        try {
            Imgproc.cvtColor(bgra, grey, Imgproc.COLOR_BGRA2GRAY);
            return Math.floor(Core.mean(grey).val[0] + 0.5);
        } finally {
            grey.release();
        }
    }

    private static BufferedImage blend(final Mat source, final Mat degenerate, final double factor, final int type) {
        final Mat out = new Mat();
        final Mat alpha = new Mat();
        try {
            Core.addWeighted(source, factor, degenerate, 1.0 - factor, 0.0, out);
            Core.extractChannel(source, alpha, ALPHA_CHANNEL);
            Core.insertChannel(alpha, out, ALPHA_CHANNEL);
            return toImage(out, type);
        } finally {
            out.release();
            alpha.release();
        }
    }

    // --- Conversion ---

    static BufferedImage copy(final BufferedImage src) {
        final int w = src.getWidth();
        final int h = src.getHeight();
        return image(src.getType(), w, h, src.getRGB(0, 0, w, h, null, 0, w));
    }

    /**
     * Packed ARGB ints to an 8-bit, four channel BGRA matrix.
     */
    static Mat toMat(final BufferedImage img) {
        loadNative();
        final int w = img.getWidth();
        final int h = img.getHeight();
        final int[] argb = img.getRGB(0, 0, w, h, null, 0, w);
        final byte[] bgra = new byte[argb.length * 4];
        for (int i = 0, o = 0; i < argb.length; i++) {
            final int p = argb[i];
            bgra[o++] = (byte) p;
            bgra[o++] = (byte) (p >> 8);
            bgra[o++] = (byte) (p >> 16);
            bgra[o++] = (byte) (p >>> 24);
        }
        final Mat mat = new Mat(h, w, CvType.CV_8UC4);
        mat.put(0, 0, bgra);
        return mat;
    }

    static BufferedImage toImage(final Mat bgra, final int type) {
        final int w = bgra.cols();
        final int h = bgra.rows();
        final byte[] data = new byte[w * h * 4];
        bgra.get(0, 0, data);
        final int[] argb = new int[w * h];
        for (int i = 0, o = 0; i < argb.length; i++, o += 4) {
            argb[i] = ((data[o + 3] & 0xFF) << 24) | ((data[o + 2] & 0xFF) << 16)
                    | ((data[o + 1] & 0xFF) << 8) | (data[o] & 0xFF);
        }
        return image(type, w, h, argb);
    }

    private static BufferedImage image(final int type, final int w, final int h, final int[] argb) {
        final int safeType = type == BufferedImage.TYPE_INT_ARGB ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        final BufferedImage img = new BufferedImage(w, h, safeType);
        img.setRGB(0, 0, w, h, argb, 0, w);
        return img;
    }

    private static void loadNative() {
        if (nativeLoaded) return;
        synchronized (RasterOps.class) {
            if (nativeLoaded) return;
            try {
                OpenCV.loadLocally();
            } catch (RuntimeException | LinkageError e) {
                throw new IllegalStateException("OpenCV native library unavailable: " + e.getMessage(), e);
            }
            nativeLoaded = true;
        }
    }
}
