package org.pixelforge.processing;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.plugins.jpeg.JPEGImageWriteParam;
import javax.imageio.spi.ImageWriterSpi;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;

/**
 * Reads image files into {@link BufferedImage} rasters and writes them back through ImageIO.
 * <p>
 * Decoded rasters are normalized to {@code TYPE_INT_RGB}, or {@code TYPE_INT_ARGB} when the
 * source carries alpha, so the transform steps only ever see packed 8-bit channels.
 * Stateless and safe to share between workers.
 */
public class ImageCodec {

    /**
     * {@link #OPTIMIZED} only changes how the bytes are packed, never the decoded pixels.
     */
    public enum EncodeMode {
        DEFAULT,
        OPTIMIZED
    }

    static final String TIFF_OPTIMIZED_COMPRESSION = "Deflate";

    /**
     * Encode format for an output file name: JPEG for .jpg/.jpeg and anything unrecognized,
     * otherwise PNG, BMP or TIFF by extension.
     */
    public static ImageFormat selectFormat(final String fileName) {
        return ImageFormat.select(fileName);
    }

    public BufferedImage decode(final Path path) throws DecodeException {
        if (!Files.isRegularFile(path)) throw new DecodeException("File not found: " + path);
        final BufferedImage image;
        try (InputStream in = Files.newInputStream(path)) {
            image = ImageIO.read(in);
        } catch (IOException e) {
            throw new DecodeException("Cannot read " + path.getFileName() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // some readers fail on truncated data with unchecked exceptions
            throw new DecodeException("Corrupt image data in " + path.getFileName() + ": " + e, e);
        }
        if (image == null) throw new DecodeException("Not a recognizable image: " + path.getFileName());
        return normalize(image);
    }

    public void encode(final BufferedImage raster, final Path path, final ImageFormat format) throws EncodeException {
        encode(raster, path, format, EncodeMode.DEFAULT);
    }

    public void encode(final BufferedImage raster, final Path path, final ImageFormat format, final EncodeMode mode)
            throws EncodeException {
        if (raster == null || raster.getWidth() <= 0 || raster.getHeight() <= 0)
            throw new EncodeException("Nothing to encode for " + path.getFileName());
        final ImageFormat target = format == ImageFormat.UNKNOWN ? ImageFormat.JPEG : format;
        final BufferedImage image = target.alphaCapable() ? raster : stripAlpha(raster);

        final ImageWriter writer = writerFor(target);
        try {
            final ImageWriterSpi provider = writer.getOriginatingProvider();
            if (provider != null && !provider.canEncodeImage(image))
                throw new EncodeException("%s writer cannot encode raster type %d".formatted(target, image.getType()));

            final ImageWriteParam param = writer.getDefaultWriteParam();
            if (mode == EncodeMode.OPTIMIZED) optimize(target, param);

            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(path));
                 ImageOutputStream ios = new MemoryCacheImageOutputStream(out)) {
                writer.setOutput(ios);
                writer.write(null, new IIOImage(image, null, null), param);
                ios.flush();
            }
        } catch (IOException | RuntimeException e) {
            deletePartial(path, e);
            throw new EncodeException("Cannot write " + path.getFileName() + ": " + e.getMessage(), e);
        } catch (EncodeException e) {
            deletePartial(path, e);
            throw e;
        } finally {
            writer.dispose();
        }
    }

    /**
     * Lossless packing options: Huffman table optimization for JPEG (same quantization),
     * strongest deflate level for PNG, Deflate compression for TIFF.
     */
    static void optimize(final ImageFormat format, final ImageWriteParam param) {
        switch (format) {
            case JPEG -> {
                if (param instanceof JPEGImageWriteParam jpeg) jpeg.setOptimizeHuffmanTables(true);
            }
            case PNG -> {
                if (param.canWriteCompressed()) {
                    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                    if (param.getCompressionType() == null && param.getCompressionTypes() != null)
                        param.setCompressionType(param.getCompressionTypes()[0]);
                    // quality 0 selects the strongest deflate level
                    param.setCompressionQuality(0.0f);
                }
            }
            case TIFF -> {
                if (param.canWriteCompressed()) {
                    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                    if (Arrays.asList(param.getCompressionTypes()).contains(TIFF_OPTIMIZED_COMPRESSION))
                        param.setCompressionType(TIFF_OPTIMIZED_COMPRESSION);
                }
            }
            default -> {
                // BMP has nothing lossless to tune
            }
        }
    }

    static BufferedImage normalize(final BufferedImage source) {
        final int targetType = source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        if (source.getType() == targetType) return source;
        final int w = source.getWidth();
        final int h = source.getHeight();
        final BufferedImage converted = new BufferedImage(w, h, targetType);
        converted.setRGB(0, 0, w, h, source.getRGB(0, 0, w, h, null, 0, w), 0, w);
        return converted;
    }

    static BufferedImage stripAlpha(final BufferedImage source) {
        if (!source.getColorModel().hasAlpha()) return source;
        final int w = source.getWidth();
        final int h = source.getHeight();
        final int[] pixels = source.getRGB(0, 0, w, h, null, 0, w);
        for (int i = 0; i < pixels.length; i++) pixels[i] &= 0x00FFFFFF;
        final BufferedImage rgb = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        rgb.setRGB(0, 0, w, h, pixels, 0, w);
        return rgb;
    }

    private static ImageWriter writerFor(final ImageFormat format) throws EncodeException {
        final Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.imageIoName());
        if (!writers.hasNext()) throw new EncodeException("No ImageIO writer available for " + format);
        return writers.next();
    }

    private static void deletePartial(final Path path, final Exception failure) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
