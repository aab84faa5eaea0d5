package com.coursegen.orchestrator.media;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.GradientPaint;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Local PNG rendering: flat-colour slides with a centred caption.
 *
 * Used by the terminal tiers of the image chains, so it has no external
 * dependencies. Text is best effort: a headless host without fonts still gets
 * the coloured image.
 */
public class ImageRenderer {

    private static final Logger log = LoggerFactory.getLogger(ImageRenderer.class);

    public static final int BACKGROUND_WIDTH  = 1792;
    public static final int BACKGROUND_HEIGHT = 1024;
    public static final int THUMBNAIL_WIDTH   = 1280;
    public static final int THUMBNAIL_HEIGHT  = 720;

    private static final Color[] PALETTE = {
            new Color(0x1F3A5F), new Color(0x2E5E4E), new Color(0x4A3B6B),
            new Color(0x6B3B3B), new Color(0x3B5B6B), new Color(0x5B4A2E),
    };

    /** Flat background whose colour is stable per {@code seed} (e.g. the lesson number). */
    public byte[] background(String caption, int seed) {
        Color base = PALETTE[Math.floorMod(seed, PALETTE.length)];
        return render(BACKGROUND_WIDTH, BACKGROUND_HEIGHT, base, base.darker(), caption, null);
    }

    public byte[] thumbnail(String title, String subtitle) {
        return render(THUMBNAIL_WIDTH, THUMBNAIL_HEIGHT, new Color(0x10243E), new Color(0x3C6E9F), title, subtitle);
    }

    /** Still frame used as the placeholder presenter clip. */
    public byte[] placeholderFrame(String caption) {
        return render(1280, 720, Color.DARK_GRAY, Color.BLACK, caption, "Video unavailable");
    }

    private byte[] render(int width, int height, Color top, Color bottom, String title, String subtitle) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setPaint(new GradientPaint(0, 0, top, 0, height, bottom));
            g.fillRect(0, 0, width, height);
            drawCaption(g, width, height, title, subtitle);
        } finally {
            g.dispose();
        }
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("PNG encoding failed", e);
        }
    }

    private void drawCaption(Graphics2D g, int width, int height, String title, String subtitle) {
        if (title == null || title.isBlank()) return;
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, height / 14));
            FontMetrics fm = g.getFontMetrics();
            List<String> lines = wrap(title, fm, width * 8 / 10);
            int y = height / 2 - (lines.size() * fm.getHeight()) / 2 + fm.getAscent();
            for (String line : lines) {
                g.drawString(line, (width - fm.stringWidth(line)) / 2, y);
                y += fm.getHeight();
            }
            if (subtitle != null && !subtitle.isBlank()) {
                g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, height / 24));
                FontMetrics sub = g.getFontMetrics();
                g.drawString(subtitle, (width - sub.stringWidth(subtitle)) / 2, y + sub.getHeight());
            }
        } catch (RuntimeException | InternalError | LinkageError e) {
            // font subsystem unavailable on some headless hosts
            log.warn("Could not draw caption '{}': {}", title, e.toString());
        }
    }

    private static List<String> wrap(String text, FontMetrics fm, int maxWidth) {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : text.split("\\s+")) {
            String candidate = current.isEmpty() ? word : current + " " + word;
            if (fm.stringWidth(candidate) > maxWidth && !current.isEmpty()) {
                lines.add(current.toString());
                current = new StringBuilder(word);
            } else {
                current = new StringBuilder(candidate);
            }
        }
        if (!current.isEmpty()) lines.add(current.toString());
        return lines;
    }
}
