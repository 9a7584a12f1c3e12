package com.phillippitts.hazardscan.service.validation;

import com.phillippitts.hazardscan.exception.MalformedInputException;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Structural checks for the image encodings accepted by the pipeline.
 *
 * <p>JPEG: segment walk from SOI to SOS, EOI trailer required.
 * PNG: signature, CRC-checked chunk walk, IHDR must match the declared dimensions, IEND required.
 * Raw: buffer length must equal width x height x channels for 1, 3 or 4 channels.
 *
 * <p>No pixel data is decoded.
 */
public class ImageFormatInspector {

    public enum Format { JPEG, PNG, RAW }

    private static final byte[] PNG_SIGNATURE = {
            (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'
    };
    private static final int[] RAW_CHANNELS = {1, 3, 4};

    // JPEG markers
    private static final int SOI = 0xD8;
    private static final int EOI = 0xD9;
    private static final int SOS = 0xDA;
    private static final int TEM = 0x01;

    /**
     * Inspects the encoding and returns the detected format.
     *
     * @throws MalformedInputException when the structure is invalid or contradicts the dimensions
     */
    public Format inspect(byte[] data, int width, int height) {
        if (isPng(data)) {
            validatePng(data, width, height);
            return Format.PNG;
        }
        if (isJpeg(data)) {
            validateJpeg(data);
            return Format.JPEG;
        }
        validateRaw(data, width, height);
        return Format.RAW;
    }

    private boolean isPng(byte[] a) {
        if (a.length < PNG_SIGNATURE.length) {
            return false;
        }
        for (int i = 0; i < PNG_SIGNATURE.length; i++) {
            if (a[i] != PNG_SIGNATURE[i]) {
                return false;
            }
        }
        return true;
    }

    private boolean isJpeg(byte[] a) {
        return a.length >= 2 && (a[0] & 0xFF) == 0xFF && (a[1] & 0xFF) == SOI;
    }

    /**
     * PNG layout: signature, then chunks of length(4) + type(4) + data(length) + crc(4).
     */
    private void validatePng(byte[] png, int width, int height) {
        int offset = PNG_SIGNATURE.length;
        boolean first = true;
        while (offset + 12 <= png.length) {
            long length = readIntBE(png, offset) & 0xFFFFFFFFL;
            if (length > png.length - offset - 12L) {
                throw malformed(png, "PNG chunk length exceeds payload at offset " + offset);
            }
            String type = new String(png, offset + 4, 4, StandardCharsets.US_ASCII);
            int dataOffset = offset + 8;
            int crcOffset = dataOffset + (int) length;

            CRC32 crc = new CRC32();
            crc.update(png, offset + 4, 4 + (int) length);
            if ((int) crc.getValue() != readIntBE(png, crcOffset)) {
                throw malformed(png, "PNG chunk " + type + " has a bad CRC");
            }

            if (first) {
                if (!"IHDR".equals(type) || length != 13) {
                    throw malformed(png, "PNG must start with a 13-byte IHDR chunk");
                }
                int ihdrWidth = readIntBE(png, dataOffset);
                int ihdrHeight = readIntBE(png, dataOffset + 4);
                if (ihdrWidth != width || ihdrHeight != height) {
                    throw malformed(png, "PNG header dimensions " + ihdrWidth + "x" + ihdrHeight
                            + " do not match declared " + width + "x" + height);
                }
                first = false;
            }
            if ("IEND".equals(type)) {
                return;
            }
            offset = crcOffset + 4;
        }
        throw malformed(png, "PNG is truncated (no IEND chunk)");
    }

    /**
     * Walks marker segments up to start-of-scan, then requires the EOI trailer.
     */
    private void validateJpeg(byte[] jpg) {
        int offset = 2;
        while (offset < jpg.length) {
            if ((jpg[offset] & 0xFF) != 0xFF) {
                throw malformed(jpg, "JPEG marker expected at offset " + offset);
            }
            // Fill bytes
            while (offset < jpg.length && (jpg[offset] & 0xFF) == 0xFF) {
                offset++;
            }
            if (offset >= jpg.length) {
                break;
            }
            int marker = jpg[offset] & 0xFF;
            offset++;
            if (marker == EOI) {
                throw malformed(jpg, "JPEG ends before any scan data");
            }
            if (marker == TEM || (marker >= 0xD0 && marker <= 0xD7)) {
                continue;
            }
            if (offset + 2 > jpg.length) {
                break;
            }
            int segmentLength = ((jpg[offset] & 0xFF) << 8) | (jpg[offset + 1] & 0xFF);
            if (segmentLength < 2 || offset + segmentLength > jpg.length) {
                throw malformed(jpg, "JPEG segment 0x" + Integer.toHexString(marker)
                        + " has invalid length " + segmentLength);
            }
            offset += segmentLength;
            if (marker == SOS) {
                if (offset >= jpg.length - 2
                        || (jpg[jpg.length - 2] & 0xFF) != 0xFF
                        || (jpg[jpg.length - 1] & 0xFF) != EOI) {
                    throw malformed(jpg, "JPEG scan data missing or EOI trailer absent");
                }
                return;
            }
        }
        throw malformed(jpg, "JPEG is truncated (no start-of-scan)");
    }

    private void validateRaw(byte[] raw, int width, int height) {
        long pixels = (long) width * height;
        for (int channels : RAW_CHANNELS) {
            if (pixels * channels == raw.length) {
                return;
            }
        }
        throw malformed(raw, "unrecognized encoding: raw buffer of " + raw.length
                + " bytes does not match " + width + "x" + height + " with 1, 3 or 4 channels");
    }

    /**
     * Infers the channel count of a raw buffer, or 0 if the length does not match.
     */
    public static int rawChannels(int length, int width, int height) {
        long pixels = (long) width * height;
        for (int channels : RAW_CHANNELS) {
            if (pixels * channels == length) {
                return channels;
            }
        }
        return 0;
    }

    private static int readIntBE(byte[] a, int offset) {
        return ((a[offset] & 0xFF) << 24)
                | ((a[offset + 1] & 0xFF) << 16)
                | ((a[offset + 2] & 0xFF) << 8)
                | (a[offset + 3] & 0xFF);
    }

    private static MalformedInputException malformed(byte[] data, String reason) {
        return new MalformedInputException(data.length, reason);
    }
}
