package guraa.paintquality.visual;

import guraa.paintquality.image.ImagePair;
import guraa.paintquality.model.AnalysisResult;
import guraa.paintquality.model.ProblemRegion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.AlphaComposite;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Draws the before and after images side by side and highlights the problem regions on the after image.
 * Rendering only reads the result.
 */
@Slf4j
@Component
public class OverlayRenderer {

    private static final int GAP = 10;

    static final Color LOW_SEVERITY = Color.YELLOW;
    static final Color MEDIUM_SEVERITY = Color.ORANGE;
    static final Color HIGH_SEVERITY = Color.RED;

    /**
     * Render the comparison image.
     *
     * @param pair The normalized images the result refers to
     * @param result The analysis result
     * @return An RGB image twice as wide as the pair plus a gap
     */
    public BufferedImage render(ImagePair pair, AnalysisResult result) {
        int width = pair.getWidth();
        int height = pair.getHeight();
        BufferedImage canvas = new BufferedImage(width * 2 + GAP, height, BufferedImage.TYPE_INT_RGB);

        Graphics2D g = canvas.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);

            g.setColor(Color.WHITE);
            g.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());

            g.drawImage(pair.getBefore().toBufferedImage(), 0, 0, null);
            g.drawImage(pair.getAfter().toBufferedImage(), width + GAP, 0, null);

            if (result.getProblemRegions() != null) {
                for (ProblemRegion region : result.getProblemRegions()) {
                    drawRegion(g, region, width + GAP);
                }
            }
        } finally {
            g.dispose();
        }

        log.debug("Rendered overlay of {}x{} with {} region(s), score {}", canvas.getWidth(), canvas.getHeight(),
                result.getIssuesDetected(), result.getOverallScore());
        return canvas;
    }

    /**
     * Render the comparison image and encode it as PNG.
     *
     * @param pair The normalized images
     * @param result The analysis result
     * @return PNG bytes
     * @throws IOException If encoding fails
     */
    public byte[] renderPng(ImagePair pair, AnalysisResult result) throws IOException {
        BufferedImage image = render(pair, result);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return out.toByteArray();
    }

    private void drawRegion(Graphics2D g, ProblemRegion region, int offsetX) {
        Color color = colorFor(region.getSeverity());
        int x = offsetX + region.getX();
        int y = region.getY();

        g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, alphaFor(region.getSeverity())));
        g.setColor(color);
        g.fillRect(x, y, region.getWidth(), region.getHeight());

        g.setComposite(AlphaComposite.SrcOver);
        g.setStroke(new BasicStroke(2));
        g.drawRect(x, y, region.getWidth() - 1, region.getHeight() - 1);
    }

    static Color colorFor(double severity) {
        if (severity < 0.3) {
            return LOW_SEVERITY;
        }
        if (severity < 0.6) {
            return MEDIUM_SEVERITY;
        }
        return HIGH_SEVERITY;
    }

    static float alphaFor(double severity) {
        if (severity < 0.3) {
            return 0.3f;
        }
        if (severity < 0.6) {
            return 0.4f;
        }
        return 0.5f;
    }
}
