package uk.gegc.mathassessment.features.export.infra.image;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;
import uk.gegc.mathassessment.features.item.domain.model.GridPoint;
import uk.gegc.mathassessment.shared.exception.AssessmentExportException;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Draws the labelled points of a coordinate geometry item on a grid spanning
 * [-6, 6] on both axes and encodes the picture as PNG.
 */
@Component
@Slf4j
public class CoordinatePlaneRenderer {

    static final int SIZE_PX = 600;
    static final int AXIS_LIMIT = 6;

    private static final int MARGIN_PX = 50;
    private static final int MARKER_PX = 10;

    public Optional<byte[]> render(AssessmentItem item) {
        if (!item.hasImage() || !item.hasPoints()) {
            return Optional.empty();
        }

        BufferedImage image = new BufferedImage(SIZE_PX, SIZE_PX, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, SIZE_PX, SIZE_PX);
            drawGrid(g);
            drawAxes(g);
            drawPoints(g, item.pointsData());
            g.setColor(Color.BLACK);
            g.drawString("Coordinate Plane", SIZE_PX / 2 - 50, MARGIN_PX / 2);
        } finally {
            g.dispose();
        }

        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", baos);
            log.debug("Rendered coordinate plane with {} point(s)", item.pointsData().size());
            return Optional.of(baos.toByteArray());
        } catch (IOException e) {
            throw new AssessmentExportException("Failed to encode coordinate plane image", e);
        }
    }

    private void drawGrid(Graphics2D g) {
        g.setColor(new Color(220, 220, 220));
        for (int v = -AXIS_LIMIT; v <= AXIS_LIMIT; v++) {
            g.drawLine(toPx(v), toPy(-AXIS_LIMIT), toPx(v), toPy(AXIS_LIMIT));
            g.drawLine(toPx(-AXIS_LIMIT), toPy(v), toPx(AXIS_LIMIT), toPy(v));
        }
    }

    private void drawAxes(Graphics2D g) {
        g.setColor(Color.BLACK);
        g.setStroke(new BasicStroke(1.5f));
        g.drawLine(toPx(-AXIS_LIMIT), toPy(0), toPx(AXIS_LIMIT), toPy(0));
        g.drawLine(toPx(0), toPy(-AXIS_LIMIT), toPx(0), toPy(AXIS_LIMIT));
        g.drawString("x", toPx(AXIS_LIMIT) + 8, toPy(0) + 4);
        g.drawString("y", toPx(0) - 4, toPy(AXIS_LIMIT) - 8);
    }

    private void drawPoints(Graphics2D g, Map<String, GridPoint> points) {
        g.setColor(new Color(31, 119, 180));
        for (Map.Entry<String, GridPoint> entry : points.entrySet()) {
            int px = toPx(entry.getValue().x());
            int py = toPy(entry.getValue().y());
            g.fillOval(px - MARKER_PX / 2, py - MARKER_PX / 2, MARKER_PX, MARKER_PX);
            g.drawString(entry.getKey(), px + 6, py - 6);
        }
    }

    private int toPx(int x) {
        return MARGIN_PX + (x + AXIS_LIMIT) * cellSize();
    }

    private int toPy(int y) {
        return MARGIN_PX + (AXIS_LIMIT - y) * cellSize();
    }

    private int cellSize() {
        return (SIZE_PX - 2 * MARGIN_PX) / (2 * AXIS_LIMIT);
    }
}
