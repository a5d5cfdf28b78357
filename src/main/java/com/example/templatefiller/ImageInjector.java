package com.example.templatefiller;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.poifs.filesystem.FileMagic;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.IntSupplier;
import java.util.regex.Pattern;

/**
 * Turns an image placeholder into an inline picture. The whole container is replaced by a single
 * run holding the drawing, so image placeholders belong in paragraphs of their own.
 */
@Slf4j
public final class ImageInjector {
    private ImageInjector() {}

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<FileMagic, String> MIME_BY_MAGIC = Map.of(
            FileMagic.PNG, "image/png",
            FileMagic.JPEG, "image/jpeg",
            FileMagic.GIF, "image/gif",
            FileMagic.BMP, "image/bmp",
            FileMagic.TIFF, "image/tiff");

    /** Decoded image with what the package needs to know about it. */
    public static final class DecodedImage {
        public final byte[] bytes;
        public final String mimeType;
        public final int widthPx;
        public final int heightPx;

        DecodedImage(byte[] bytes, String mimeType, int widthPx, int heightPx) {
            this.bytes = bytes; this.mimeType = mimeType; this.widthPx = widthPx; this.heightPx = heightPx;
        }
    }

    /**
     * Decodes a base64 payload (plain, line-wrapped or a {@code data:} URL) and checks it is a raster
     * image with readable dimensions.
     */
    public static DecodedImage decode(String token, String payload) {
        if (payload == null || payload.isBlank()) throw new InvalidImagePayloadException(token, "empty payload");
        String b64 = payload.trim();
        if (b64.startsWith("data:")) {
            int comma = b64.indexOf(',');
            if (comma < 0 || !b64.substring(0, comma).endsWith(";base64")) {
                throw new InvalidImagePayloadException(token, "data URL is not base64 encoded");
            }
            b64 = b64.substring(comma + 1);
        }

        byte[] bytes;
        try {
            // line-wrapped payloads only differ by whitespace; anything else outside the alphabet is an error
            bytes = Base64.getDecoder().decode(WHITESPACE.matcher(b64).replaceAll(""));
        } catch (IllegalArgumentException e) {
            throw new InvalidImagePayloadException(token, e.getMessage(), e);
        }
        if (bytes.length == 0) throw new InvalidImagePayloadException(token, "no image data");

        String mime = MIME_BY_MAGIC.get(FileMagic.valueOf(bytes));
        if (mime == null) throw new InvalidImagePayloadException(token, "not a PNG, JPEG, GIF, BMP or TIFF image");

        int width;
        int height;
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = in == null ? Collections.emptyIterator() : ImageIO.getImageReaders(in);
            if (!readers.hasNext()) throw new InvalidImagePayloadException(token, "no reader for " + mime + " data");
            ImageReader reader = readers.next();
            try {
                // header only, the raster is never decoded
                reader.setInput(in, true, true);
                width = reader.getWidth(0);
                height = reader.getHeight(0);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new InvalidImagePayloadException(token, "unreadable " + mime + ": " + e.getMessage(), e);
        }
        if (width <= 0 || height <= 0) {
            throw new InvalidImagePayloadException(token, "cannot read dimensions of " + mime + " data");
        }
        return new DecodedImage(bytes, mime, width, height);
    }

    /**
     * Adds the image to the package, relates it from {@code partPath} and replaces the container's
     * runs with one picture run in the formatting of the run the placeholder starts in.
     */
    public static <F> Run.InlinePicture inject(FormattedContainer<F> container, TokenMatch match, ImageSlot slot,
                                               DecodedImage image, DocumentArchive archive, String partPath,
                                               IntSupplier drawingIds) {
        String mediaPath = archive.addMediaPart(image.bytes, image.mimeType);
        String relId = archive.addRelationship(partPath, mediaPath, DocumentArchive.REL_IMAGE);

        long cx = slot.widthEmu();
        long cy = slot.heightEmu(image.widthPx, image.heightPx);
        String name = mediaPath.substring(mediaPath.lastIndexOf('/') + 1);
        Run.InlinePicture pic = new Run.InlinePicture(relId, name, cx, cy, drawingIds.getAsInt());

        Run<F> start = container.run(match.span.startRun);
        container.replaceAll(List.of(start.withPicture(pic)));
        log.debug("{}: {} ({}x{} px) as {} -> {}x{} EMU", match.name, mediaPath, image.widthPx, image.heightPx, relId, cx, cy);
        return pic;
    }
}
